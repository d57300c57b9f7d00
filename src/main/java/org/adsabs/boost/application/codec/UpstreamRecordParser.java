package org.adsabs.boost.application.codec;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts record-update messages from the upstream ingest pipeline into
 * {@link BoostRequest}s.
 * <p><strong>Why:</strong> Upstream messages are loosely typed: nested sections may arrive as
 * objects or as JSON-encoded strings, and collections may be a string, a list or an object.</p>
 * <p>Field rules:
 * <ul>
 *   <li>{@code bib_data} and {@code metrics}: object or JSON string; unparsable strings are treated
 *       as empty.</li>
 *   <li>Refereed: {@code metrics.refereed}, else {@code bib_data.refereed}.</li>
 *   <li>Collections: {@code classifications} (string, list, or object with {@code database}), else
 *       {@code collections}, else {@code bib_data.database}.</li>
 *   <li>Publication date: the earlier of {@code bib_data.pubdate} and {@code bib_data.entry_date};
 *       a {@code 00} month or day reads as {@code 01}; datetimes keep their date part.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class UpstreamRecordParser {
  private static final Logger log = LoggerFactory.getLogger(UpstreamRecordParser.class);

  private final JsonSupport json;

  public UpstreamRecordParser() {
    this(new JsonSupport());
  }

  public UpstreamRecordParser(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Parses a message payload.
   *
   * @param payload JSON object text
   * @return request; identifiers may still be missing and are validated later
   * @throws ValidationException if the payload is not a JSON object
   */
  public BoostRequest parse(String payload) throws ValidationException {
    if (payload == null || payload.isBlank()) {
      throw new ValidationException("empty record message");
    }
    Map<String, Object> root;
    try {
      root = json.parseObject(payload);
    } catch (IllegalArgumentException ex) {
      throw new ValidationException("record message is not a JSON object", ex);
    }
    return fromMap(root);
  }

  /**
   * Converts an already parsed message.
   *
   * @param root message fields
   * @return request
   */
  public BoostRequest fromMap(Map<String, Object> root) {
    Map<String, Object> bibData = section(root, "bib_data");
    Map<String, Object> metrics = section(root, "metrics");
    boolean refereed = metrics.containsKey("refereed")
        ? JsonSupport.asBoolean(metrics.get("refereed"))
        : JsonSupport.asBoolean(bibData.get("refereed"));
    String docType = JsonSupport.asString(bibData.get("doctype"));
    if (docType == null) {
      docType = JsonSupport.asString(root.get("doctype"));
    }
    LocalDate pubdate = parseDate(bibData.get("pubdate"));
    LocalDate entryDate = parseDate(bibData.get("entry_date"));
    return new BoostRequest(
        JsonSupport.asString(root.get("bibcode")),
        JsonSupport.asString(root.get("scix_id")),
        refereed,
        docType,
        earliest(pubdate, entryDate),
        collections(root, bibData));
  }

  private Map<String, Object> section(Map<String, Object> root, String name) {
    Object value = root.get(name);
    if (value instanceof String text && !text.isBlank()) {
      try {
        value = json.parse(text);
      } catch (IllegalArgumentException ex) {
        log.warn("Ignoring unparsable {} section: {}", name, ex.getMessage());
        return Map.of();
      }
    }
    Map<String, Object> map = JsonSupport.asObject(value);
    return map == null ? Map.of() : map;
  }

  private static Set<String> collections(Map<String, Object> root, Map<String, Object> bibData) {
    List<String> values = toStrings(root.get("classifications"));
    if (values.isEmpty()) {
      values = toStrings(root.get("collections"));
    }
    if (values.isEmpty()) {
      values = toStrings(bibData.get("database"));
    }
    return new LinkedHashSet<>(values);
  }

  private static List<String> toStrings(Object value) {
    List<String> result = new ArrayList<>();
    if (value instanceof String text) {
      if (!text.isBlank()) {
        result.add(text);
      }
    } else if (value instanceof Collection<?> items) {
      for (Object item : items) {
        String text = JsonSupport.asString(item);
        if (text != null) {
          result.add(text);
        }
      }
    } else if (value instanceof Map<?, ?> map) {
      return toStrings(map.get("database"));
    }
    return result;
  }

  /**
   * Parses upstream date strings such as {@code 2022-03-00}, {@code 2022-00-00},
   * {@code 2022-03-15T10:00:00Z} or {@code 2022}.
   *
   * @param value raw value
   * @return date, or {@code null} when absent or unparsable
   */
  static LocalDate parseDate(Object value) {
    String text = JsonSupport.asString(value);
    if (text == null) {
      return null;
    }
    int cut = text.indexOf('T');
    if (cut < 0) {
      cut = text.indexOf(' ');
    }
    String datePart = cut > 0 ? text.substring(0, cut) : text;
    String[] parts = datePart.split("-");
    try {
      int year = Integer.parseInt(parts[0]);
      int month = parts.length > 1 ? Math.max(1, Integer.parseInt(parts[1])) : 1;
      int day = parts.length > 2 ? Math.max(1, Integer.parseInt(parts[2])) : 1;
      return LocalDate.of(year, month, day);
    } catch (NumberFormatException | DateTimeException ex) {
      log.debug("Ignoring unparsable date '{}'", text);
      return null;
    }
  }

  private static LocalDate earliest(LocalDate a, LocalDate b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.isBefore(b) ? a : b;
  }
}
