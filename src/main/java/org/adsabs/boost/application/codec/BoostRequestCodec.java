package org.adsabs.boost.application.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.error.ValidationException;

/**
 * Encodes the normalized compute-stage envelope exchanged between stage workers.
 *
 * <p>Shape: {@code {"bibcode", "scix_id", "refereed", "doctype", "publication_date",
 * "collections": [...]}}.</p>
 *
 * @since 0.1.0
 */
public final class BoostRequestCodec {
  private final JsonSupport json;

  public BoostRequestCodec() {
    this(new JsonSupport());
  }

  public BoostRequestCodec(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public String encode(BoostRequest request) {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = json.factory().createGenerator(out)) {
      gen.writeStartObject();
      writeNullable(gen, "bibcode", request.bibcode());
      writeNullable(gen, "scix_id", request.scixId());
      gen.writeBooleanField("refereed", request.refereed());
      gen.writeStringField("doctype", request.docType());
      writeNullable(gen, "publication_date",
          request.publicationDate() == null ? null : request.publicationDate().toString());
      gen.writeArrayFieldStart("collections");
      for (String collection : request.collections()) {
        gen.writeString(collection);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode boost request", ex);
    }
    return out.toString();
  }

  /**
   * Decodes an envelope.
   *
   * @param payload JSON text
   * @return request
   * @throws ValidationException if the payload is malformed
   */
  public BoostRequest decode(String payload) throws ValidationException {
    try {
      Map<String, Object> root = json.parseObject(payload);
      String date = JsonSupport.asString(root.get("publication_date"));
      Object collections = root.get("collections");
      List<String> tags = collections instanceof List<?> list
          ? list.stream().map(JsonSupport::asString).filter(Objects::nonNull).toList()
          : List.of();
      return new BoostRequest(
          JsonSupport.asString(root.get("bibcode")),
          JsonSupport.asString(root.get("scix_id")),
          JsonSupport.asBoolean(root.get("refereed")),
          JsonSupport.asString(root.get("doctype")),
          date == null ? null : LocalDate.parse(date),
          new LinkedHashSet<>(tags));
    } catch (IllegalArgumentException | DateTimeParseException ex) {
      throw new ValidationException("malformed compute envelope", ex);
    }
  }

  static void writeNullable(JsonGenerator gen, String field, String value) throws IOException {
    if (value == null) {
      gen.writeNullField(field);
    } else {
      gen.writeStringField(field, value);
    }
  }
}
