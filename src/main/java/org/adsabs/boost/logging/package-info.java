/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize values before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers.</p>
 *
 * @since 0.1.0
 */
package org.adsabs.boost.logging;
