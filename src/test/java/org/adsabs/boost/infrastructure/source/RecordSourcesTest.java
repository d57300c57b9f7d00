package org.adsabs.boost.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.adsabs.boost.application.codec.UpstreamRecordParser;
import org.adsabs.boost.application.port.RecordSource;
import org.adsabs.boost.domain.BoostRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecordSourcesTest {
  private final UpstreamRecordParser parser = new UpstreamRecordParser();

  @TempDir
  Path tempDir;

  @Test
  void jsonArrayIsReadPageByPage() throws Exception {
    String json = """
        [
          {"bibcode": "2024ApJ...001....1A", "bib_data": {"doctype": "article", "refereed": true}},
          {"bibcode": "2024ApJ...002....1A", "classifications": ["physics"]},
          42,
          {"scix_id": "scix:abcd-efgh-ijkl"}
        ]
        """;
    try (JsonArrayRecordSource source = new JsonArrayRecordSource(new StringReader(json), parser)) {
      List<BoostRequest> first = source.nextPage(2);
      List<BoostRequest> second = source.nextPage(2);
      List<BoostRequest> third = source.nextPage(2);

      assertEquals(List.of("2024ApJ...001....1A", "2024ApJ...002....1A"),
          first.stream().map(BoostRequest::bibcode).toList());
      assertEquals(1, second.size());
      assertEquals("scix:abcd-efgh-ijkl", second.get(0).scixId());
      assertTrue(third.isEmpty());
    }
  }

  @Test
  void jsonFileMustHoldAnArray() {
    assertThrows(IOException.class,
        () -> new JsonArrayRecordSource(new StringReader("{\"bibcode\": \"x\"}"), parser));
  }

  @Test
  void csvRowsMapOntoRecords() throws Exception {
    String csv = "bibcode,scix_id,doctype,pubdate,entry_date,refereed,collections\n"
        + "2022A&A...660A...1Z,,article,2022-04-00,,true,astrophysics;heliophysics\n"
        + ",scix:1111-2222-3333,catalog,,2019-01-05,false,\n";
    try (CsvRecordSource source = new CsvRecordSource(new StringReader(csv), parser)) {
      List<BoostRequest> records = source.nextPage(10);

      assertEquals(2, records.size());
      BoostRequest first = records.get(0);
      assertEquals("2022A&A...660A...1Z", first.bibcode());
      assertTrue(first.refereed());
      assertEquals(LocalDate.of(2022, 4, 1), first.publicationDate());
      assertEquals(List.of("astrophysics", "heliophysics"), List.copyOf(first.collections()));
      BoostRequest second = records.get(1);
      assertEquals("scix:1111-2222-3333", second.scixId());
      assertEquals("catalog", second.docType());
      assertTrue(second.collections().isEmpty());
      assertTrue(source.nextPage(10).isEmpty());
    }
  }

  @Test
  void openPicksReaderByExtension() throws Exception {
    Path csv = tempDir.resolve("records.CSV");
    Files.writeString(csv, "bibcode\n2024ApJ...001....1A\n", StandardCharsets.UTF_8);
    Path json = tempDir.resolve("records.json");
    Files.writeString(json, "[]", StandardCharsets.UTF_8);

    try (RecordSource csvSource = RecordSources.open(csv, parser);
        RecordSource jsonSource = RecordSources.open(json, parser)) {
      assertInstanceOf(CsvRecordSource.class, csvSource);
      assertInstanceOf(JsonArrayRecordSource.class, jsonSource);
      assertEquals(1, csvSource.nextPage(5).size());
      assertTrue(jsonSource.nextPage(5).isEmpty());
    }
  }

  @Test
  void missingFilesAreReported() {
    assertThrows(IOException.class, () -> RecordSources.open(tempDir.resolve("absent.json"), parser));
  }
}
