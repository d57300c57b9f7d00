package org.adsabs.boost.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class MainTest {
  private final StringWriter buffer = new StringWriter();
  private Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    logger = (Logger) LoggerFactory.getLogger(Main.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    ExitCode exit = Main.run(new String[0]);

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertTrue(buffer.toString().contains("usage: boost <run|listen|query|export>"));
    assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().equals("Missing command")));
  }

  @Test
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().startsWith("Boost factor pipeline"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay", "file=x.json"}));
    assertTrue(appender.list.stream().anyMatch(e -> e.getFormattedMessage().equals("Unknown command: replay")));
  }

  @Test
  void mistypedSwitchIsRejectedBeforeDispatch() {
    assertEquals(ExitCode.INVALID_ARGS,
        Main.run(new String[] {"run", "--dryrun", "file=records.json", "metricsExporter=none"}));
    assertTrue(buffer.toString().contains("usage: boost <run|listen|query|export>"));
    assertTrue(appender.list.stream()
        .anyMatch(e -> e.getFormattedMessage().equals("Invalid argument: unknown option --dryrun")));
  }

  @Test
  void commandHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"query", "--help"}));
    assertTrue(buffer.toString().startsWith("Boost factor lookup"));
  }

  @Test
  void dispatchesRunInDryRunMode() {
    assertEquals(ExitCode.SUCCESS,
        Main.run(new String[] {"--dry-run", "run", "file=records.json", "metricsExporter=none"}));
    assertTrue(buffer.toString().contains("run dry-run: configuration is valid"));
  }
}
