package org.adsabs.boost.application.port;

import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.error.StageException;

/**
 * Output port that publishes computed boost factors to downstream consumers.
 *
 * <p>Implementations raise a retryable {@link StageException} for transport failures.</p>
 *
 * @since 0.1.0
 */
public interface NotificationPort extends AutoCloseable {
  /**
   * Publishes one record's boost factors.
   *
   * @param factors stored factors
   * @throws StageException if the message could not be delivered
   */
  void publish(BoostFactors factors) throws StageException;

  @Override
  default void close() throws Exception {}
}
