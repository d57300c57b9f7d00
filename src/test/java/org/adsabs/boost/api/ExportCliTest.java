package org.adsabs.boost.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import org.adsabs.boost.infrastructure.persistence.BoostFactorsSchema;
import org.adsabs.boost.infrastructure.persistence.ConnectionProvider;
import org.adsabs.boost.infrastructure.persistence.JdbcBoostFactorsRepository;
import org.adsabs.boost.testutil.Records;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExportCliTest {
  @TempDir
  Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private final String url = "jdbc:h2:mem:export-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";

  @BeforeEach
  void setUp() throws Exception {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
    ConnectionProvider connections = ConnectionProvider.driverManager(url, "boost", "");
    BoostFactorsSchema.create(connections);
    JdbcBoostFactorsRepository repository = new JdbcBoostFactorsRepository(connections);
    repository.upsert(Records.factors("2024ApJ...001....1A", null, 0.9));
    repository.upsert(Records.factors("2024ApJ...002....1A", "scix:CCCC-0003", 0.3));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void exportsEveryRowToFile() throws Exception {
    Path out = tempDir.resolve("nested").resolve("boost.csv");

    ExitCode exit = ExportCli.run(new String[] {"jdbcUrl=" + url, "metricsExporter=none", "out=" + out});

    assertEquals(ExitCode.SUCCESS, exit);
    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).startsWith("bibcode,scix_id,created,"));
    assertTrue(lines.stream().anyMatch(line -> line.startsWith("2024ApJ...002....1A,scix:CCCC-0003,")));
  }

  @Test
  void exportsRequestedKeysToStdout() {
    ExitCode exit = ExportCli.run(new String[] {
        "jdbcUrl=" + url, "metricsExporter=none", "bibcodes=2024ApJ...001....1A,2024ApJ...999....1A"});

    assertEquals(ExitCode.SUCCESS, exit);
    List<String> lines = buffer.toString().lines().toList();
    assertEquals(2, lines.size());
    assertTrue(lines.get(1).startsWith("2024ApJ...001....1A,"));
  }
}
