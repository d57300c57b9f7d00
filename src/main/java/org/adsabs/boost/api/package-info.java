/**
 * <strong>Purpose:</strong> Command-line entry points: the {@code boost} dispatcher and its
 * {@code run}, {@code listen}, {@code query} and {@code export} modes.
 * <p>Arguments are {@code key=value} pairs layered over the YAML configuration; exit codes are
 * listed in {@link org.adsabs.boost.api.ExitCode}.</p>
 *
 * @since 0.1.0
 */
package org.adsabs.boost.api;
