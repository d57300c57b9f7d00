/**
 * CSV export of stored boost factors.
 */
package org.adsabs.boost.infrastructure.export;
