/**
 * Error taxonomy shared by the boost pipeline.
 *
 * <p>Stage failures are checked {@link org.adsabs.boost.domain.error.StageException}s tagged with an
 * {@link org.adsabs.boost.domain.error.ErrorKind}; configuration failures are unchecked.</p>
 */
package org.adsabs.boost.domain.error;
