package org.adsabs.boost.infrastructure.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.adsabs.boost.application.codec.UpstreamRecordParser;
import org.adsabs.boost.application.port.RecordSource;
import org.adsabs.boost.domain.BoostRequest;

/**
 * Streams records from a CSV file with a header row.
 *
 * <p>Recognized columns: {@code bibcode}, {@code scix_id}, {@code refereed}, {@code doctype},
 * {@code pubdate}, {@code entry_date} and {@code collections} (separated by {@code ;}). Values go
 * through the same rules as upstream messages.</p>
 *
 * @since 0.1.0
 */
public final class CsvRecordSource implements RecordSource {
  private final MappingIterator<Map<String, String>> rows;
  private final UpstreamRecordParser records;

  public CsvRecordSource(Path path, UpstreamRecordParser records) throws IOException {
    this(Files.newBufferedReader(path, StandardCharsets.UTF_8), records);
  }

  CsvRecordSource(Reader reader, UpstreamRecordParser records) throws IOException {
    this.records = records;
    CsvMapper mapper = new CsvMapper();
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    this.rows = mapper.readerForMapOf(String.class).with(schema).readValues(reader);
  }

  @Override
  public List<BoostRequest> nextPage(int maxRecords) throws IOException {
    List<BoostRequest> page = new ArrayList<>(Math.min(maxRecords, 1024));
    try {
      while (page.size() < maxRecords && rows.hasNextValue()) {
        page.add(records.fromMap(toMessage(rows.nextValue())));
      }
    } catch (RuntimeException ex) {
      throw new IOException("Malformed CSV record: " + ex.getMessage(), ex);
    }
    return page;
  }

  private static Map<String, Object> toMessage(Map<String, String> row) {
    Map<String, Object> bibData = new LinkedHashMap<>();
    bibData.put("doctype", row.get("doctype"));
    bibData.put("pubdate", row.get("pubdate"));
    bibData.put("entry_date", row.get("entry_date"));
    bibData.put("refereed", row.get("refereed"));
    Map<String, Object> message = new LinkedHashMap<>();
    message.put("bibcode", row.get("bibcode"));
    message.put("scix_id", row.get("scix_id"));
    message.put("bib_data", bibData);
    String collections = row.get("collections");
    message.put("collections", collections == null ? List.of() : List.of(collections.split(";")));
    return message;
  }

  @Override
  public void close() throws IOException {
    rows.close();
  }
}
