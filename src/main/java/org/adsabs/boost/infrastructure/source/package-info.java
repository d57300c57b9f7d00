/**
 * File-based record sources for batch runs.
 */
package org.adsabs.boost.infrastructure.source;
