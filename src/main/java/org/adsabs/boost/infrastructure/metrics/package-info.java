/**
 * OpenTelemetry implementation of the metrics port.
 */
package org.adsabs.boost.infrastructure.metrics;
