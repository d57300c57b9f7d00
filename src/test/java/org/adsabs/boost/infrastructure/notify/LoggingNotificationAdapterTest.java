package org.adsabs.boost.infrastructure.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.adsabs.boost.application.codec.BoostFactorsCodec;
import org.adsabs.boost.testutil.Records;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingNotificationAdapterTest {
  private Logger logger;
  private ListAppender<ILoggingEvent> appender;
  private Level previous;

  @BeforeEach
  void attach() {
    logger = (Logger) LoggerFactory.getLogger("org.adsabs.boost.notifications");
    previous = logger.getLevel();
    logger.setLevel(Level.INFO);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detach() {
    logger.detachAppender(appender);
    logger.setLevel(previous);
  }

  @Test
  void logsResponseMessage() {
    new LoggingNotificationAdapter(new BoostFactorsCodec())
        .publish(Records.factors("2024ApJ...001....1A", null, 0.7));

    assertEquals(1, appender.list.size());
    String message = appender.list.get(0).getFormattedMessage();
    assertTrue(message.contains("2024ApJ...001....1A"));
    assertTrue(message.contains("updated"));
  }
}
