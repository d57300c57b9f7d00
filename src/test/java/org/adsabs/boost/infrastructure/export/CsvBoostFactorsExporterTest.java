package org.adsabs.boost.infrastructure.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringWriter;
import org.adsabs.boost.testutil.Records;
import org.junit.jupiter.api.Test;

class CsvBoostFactorsExporterTest {

  @Test
  void writesHeaderThenOneLinePerRecord() throws Exception {
    StringWriter out = new StringWriter();
    try (CsvBoostFactorsExporter exporter = new CsvBoostFactorsExporter(out)) {
      exporter.write(Records.factors("2024ApJ...001....1A", null, 0.5));
      exporter.write(Records.factors(null, "scix:aaaa-bbbb-cccc", 0.25));
      assertEquals(2, exporter.rows());
    }

    String[] lines = out.toString().split("\\R");
    assertEquals(3, lines.length);
    assertEquals(String.join(",", CsvBoostFactorsExporter.HEADER), lines[0]);
    assertTrue(lines[1].startsWith("2024ApJ...001....1A,,2024-06-15T12:00:00Z,0.8,1.0,0.5,0.5,"));
    assertTrue(lines[2].startsWith(",scix:aaaa-bbbb-cccc,"));
    assertEquals(CsvBoostFactorsExporter.HEADER.size(), lines[2].split(",", -1).length);
  }

  @Test
  void quotesOnlyValuesThatNeedIt() throws Exception {
    StringWriter out = new StringWriter();
    try (CsvBoostFactorsExporter exporter = new CsvBoostFactorsExporter(out)) {
      exporter.write(Records.factors("2024A&A...681A..12B", "scix:aaaa-bbbb-cccc", 0.5));
      exporter.write(Records.factors("2024ApJ,broken", null, 0.5));
    }

    String[] lines = out.toString().split("\\R");
    assertFalse(lines[0].contains("\""));
    assertTrue(lines[0].contains(",planetary_science_final_boost,"));
    assertTrue(lines[0].endsWith(",general_final_boost"));
    assertTrue(lines[1].startsWith("2024A&A...681A..12B,scix:aaaa-bbbb-cccc,2024-06-15T12:00:00Z,"));
    assertTrue(lines[2].startsWith("\"2024ApJ,broken\",,"));
  }
}
