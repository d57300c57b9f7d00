/**
 * Ports separating the pipeline from storage, transport, metrics and time.
 */
package org.adsabs.boost.application.port;
