package org.adsabs.boost.domain;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import org.adsabs.boost.domain.error.ValidationException;

/**
 * <strong>What:</strong> Input record for boost computation.
 * <p><strong>Why:</strong> Carries only the fields the calculator needs; identifiers may be missing
 * so that malformed records can travel to the validation step and be counted instead of crashing the
 * batch.</p>
 *
 * @param bibcode bibcode, or {@code null}
 * @param scixId SciX identifier, or {@code null}
 * @param refereed whether the record is peer reviewed
 * @param docType document type; lower-cased, empty when unknown
 * @param publicationDate publication date, or {@code null} when unknown
 * @param collections normalized collection tags in upstream order
 * @since 0.1.0
 */
public record BoostRequest(
    String bibcode,
    String scixId,
    boolean refereed,
    String docType,
    LocalDate publicationDate,
    Set<String> collections) {

  public BoostRequest {
    bibcode = RecordKey.blankToNull(bibcode);
    scixId = RecordKey.blankToNull(scixId);
    docType = docType == null ? "" : docType.trim().toLowerCase(Locale.ROOT);
    Set<String> normalized = new LinkedHashSet<>();
    if (collections != null) {
      for (String tag : collections) {
        String clean = Discipline.normalizeTag(tag);
        if (!clean.isEmpty()) {
          normalized.add(clean);
        }
      }
    }
    collections = Collections.unmodifiableSet(normalized);
  }

  /**
   * Returns the record identity.
   *
   * @return key built from the identifiers
   * @throws ValidationException when neither bibcode nor scix_id is present
   */
  public RecordKey key() throws ValidationException {
    if (bibcode == null && scixId == null) {
      throw new ValidationException("record has neither bibcode nor scix_id");
    }
    return new RecordKey(bibcode, scixId);
  }

  /**
   * Returns a log label that never throws.
   *
   * @return bibcode, scix_id or {@code "<unidentified>"}
   */
  public String label() {
    if (bibcode != null) {
      return bibcode;
    }
    return scixId != null ? scixId : "<unidentified>";
  }
}
