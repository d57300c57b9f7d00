package org.adsabs.boost.infrastructure.notify;

import java.util.Objects;
import org.adsabs.boost.application.codec.BoostFactorsCodec;
import org.adsabs.boost.application.port.NotificationPort;
import org.adsabs.boost.domain.BoostFactors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notification adapter that writes each response message to the log, for runs without a message
 * broker.
 *
 * @since 0.1.0
 */
public final class LoggingNotificationAdapter implements NotificationPort {
  private static final Logger log = LoggerFactory.getLogger("org.adsabs.boost.notifications");

  private final BoostFactorsCodec codec;

  public LoggingNotificationAdapter(BoostFactorsCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public void publish(BoostFactors factors) {
    log.info(codec.encodeResponse(factors));
  }
}
