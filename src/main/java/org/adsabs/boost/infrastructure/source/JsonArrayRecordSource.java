package org.adsabs.boost.infrastructure.source;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.adsabs.boost.application.codec.JsonSupport;
import org.adsabs.boost.application.codec.UpstreamRecordParser;
import org.adsabs.boost.application.port.RecordSource;
import org.adsabs.boost.domain.BoostRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams records from a JSON array of upstream record messages without loading the whole file.
 *
 * <p>Non-object array elements are skipped with a warning.</p>
 *
 * @since 0.1.0
 */
public final class JsonArrayRecordSource implements RecordSource {
  private static final Logger log = LoggerFactory.getLogger(JsonArrayRecordSource.class);

  private final JsonParser parser;
  private final JsonSupport json = new JsonSupport();
  private final UpstreamRecordParser records;
  private boolean exhausted;

  /**
   * Opens a file.
   *
   * @param path JSON file whose root is an array
   * @param records message parser
   * @throws IOException if the file cannot be opened or does not start with an array
   */
  public JsonArrayRecordSource(Path path, UpstreamRecordParser records) throws IOException {
    this(Files.newBufferedReader(path, StandardCharsets.UTF_8), records);
  }

  JsonArrayRecordSource(Reader reader, UpstreamRecordParser records) throws IOException {
    this.records = Objects.requireNonNull(records, "records");
    this.parser = new JsonFactory().createParser(reader);
    JsonToken first = parser.nextToken();
    if (first == null) {
      exhausted = true;
    } else if (first != JsonToken.START_ARRAY) {
      parser.close();
      throw new IOException("record file must contain a JSON array");
    }
  }

  @Override
  public List<BoostRequest> nextPage(int maxRecords) throws IOException {
    List<BoostRequest> page = new ArrayList<>(Math.min(maxRecords, 1024));
    while (!exhausted && page.size() < maxRecords) {
      JsonToken token = parser.nextToken();
      if (token == null || token == JsonToken.END_ARRAY) {
        exhausted = true;
        break;
      }
      Object element = json.readValue(parser, token);
      if (element instanceof Map<?, ?> map) {
        @SuppressWarnings("unchecked")
        Map<String, Object> fields = (Map<String, Object>) map;
        page.add(records.fromMap(fields));
      } else {
        log.warn("Skipping non-object element in record file: {}", element);
      }
    }
    return page;
  }

  @Override
  public void close() throws IOException {
    parser.close();
  }
}
