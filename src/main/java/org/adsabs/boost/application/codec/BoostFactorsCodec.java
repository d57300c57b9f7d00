package org.adsabs.boost.application.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.adsabs.boost.domain.BasicBoosts;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.Discipline;
import org.adsabs.boost.domain.DisciplineScores;
import org.adsabs.boost.domain.RecordKey;
import org.adsabs.boost.domain.error.ValidationException;

/**
 * <strong>What:</strong> JSON form of {@link BoostFactors}, used for the store and send stage
 * envelopes and for the response published to downstream consumers.
 * <p>Field names follow the storage columns: {@code refereed_boost}, {@code doctype_boost},
 * {@code recency_boost}, {@code boost_factor}, {@code <discipline>_weight} and
 * {@code <discipline>_final_boost}, plus {@code bibcode}, {@code scix_id} and {@code created}. The
 * response form adds {@code "status": "updated"}.</p>
 *
 * @since 0.1.0
 */
public final class BoostFactorsCodec {
  /** Status value carried by published responses. */
  public static final String STATUS_UPDATED = "updated";

  private final JsonSupport json;

  public BoostFactorsCodec() {
    this(new JsonSupport());
  }

  public BoostFactorsCodec(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public String encode(BoostFactors factors) {
    return write(factors, null);
  }

  /**
   * Encodes the downstream response message.
   *
   * @param factors stored factors
   * @return JSON text including {@code status}
   */
  public String encodeResponse(BoostFactors factors) {
    return write(factors, STATUS_UPDATED);
  }

  /**
   * Decodes factors from either form.
   *
   * @param payload JSON text
   * @return factors
   * @throws ValidationException if a field is missing or malformed
   */
  public BoostFactors decode(String payload) throws ValidationException {
    try {
      Map<String, Object> root = json.parseObject(payload);
      RecordKey key = new RecordKey(
          JsonSupport.asString(root.get("bibcode")), JsonSupport.asString(root.get("scix_id")));
      BasicBoosts basics = new BasicBoosts(
          JsonSupport.asDouble(root.get("refereed_boost"), "refereed_boost"),
          JsonSupport.asDouble(root.get("doctype_boost"), "doctype_boost"),
          JsonSupport.asDouble(root.get("recency_boost"), "recency_boost"));
      EnumMap<Discipline, Double> weights = new EnumMap<>(Discipline.class);
      EnumMap<Discipline, Double> finals = new EnumMap<>(Discipline.class);
      for (Discipline discipline : Discipline.values()) {
        String weightField = discipline.tag() + "_weight";
        String finalField = discipline.tag() + "_final_boost";
        weights.put(discipline, JsonSupport.asDouble(root.get(weightField), weightField));
        finals.put(discipline, JsonSupport.asDouble(root.get(finalField), finalField));
      }
      String created = JsonSupport.asString(root.get("created"));
      if (created == null) {
        throw new IllegalArgumentException("field created is missing");
      }
      return new BoostFactors(
          key,
          basics,
          JsonSupport.asDouble(root.get("boost_factor"), "boost_factor"),
          DisciplineScores.of(weights),
          DisciplineScores.of(finals),
          Instant.parse(created));
    } catch (IllegalArgumentException | DateTimeParseException ex) {
      throw new ValidationException("malformed boost factors payload: " + ex.getMessage(), ex);
    }
  }

  private String write(BoostFactors factors, String status) {
    StringWriter out = new StringWriter(768);
    try (JsonGenerator gen = json.factory().createGenerator(out)) {
      gen.writeStartObject();
      BoostRequestCodec.writeNullable(gen, "bibcode", factors.key().bibcode());
      BoostRequestCodec.writeNullable(gen, "scix_id", factors.key().scixId());
      if (status != null) {
        gen.writeStringField("status", status);
      }
      gen.writeNumberField("refereed_boost", factors.basics().refereed());
      gen.writeNumberField("doctype_boost", factors.basics().doctype());
      gen.writeNumberField("recency_boost", factors.basics().recency());
      gen.writeNumberField("boost_factor", factors.combinedBoost());
      for (Discipline discipline : Discipline.values()) {
        gen.writeNumberField(discipline.tag() + "_weight", factors.disciplineWeights().get(discipline));
      }
      for (Discipline discipline : Discipline.values()) {
        gen.writeNumberField(discipline.tag() + "_final_boost", factors.finalBoosts().get(discipline));
      }
      gen.writeStringField("created", factors.created().toString());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode boost factors", ex);
    }
    return out.toString();
  }
}
