package org.adsabs.boost.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ListenCliTest {
  private final StringWriter buffer = new StringWriter();

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void localTransportIsRejected() {
    assertEquals(ExitCode.CONFIG_ERROR, ListenCli.run(new String[] {"--dry-run", "transport=local"}));
  }

  @Test
  void dryRunPrintsKafkaSettings() {
    ExitCode exit = ListenCli.run(new String[] {
        "--dry-run", "transport=kafka", "kafkaBootstrap=localhost:9092", "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, exit);
    assertTrue(buffer.toString().startsWith("listen dry-run: configuration is valid"));
    assertTrue(buffer.toString().contains(" kafkaBootstrap = localhost:9092"));
  }
}
