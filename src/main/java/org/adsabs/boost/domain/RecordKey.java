package org.adsabs.boost.domain;

/**
 * Identity of a bibliographic record: a bibcode, a scix_id, or both.
 *
 * @param bibcode bibcode, or {@code null}
 * @param scixId SciX identifier, or {@code null}
 * @since 0.1.0
 */
public record RecordKey(String bibcode, String scixId) {
  public RecordKey {
    bibcode = blankToNull(bibcode);
    scixId = blankToNull(scixId);
    if (bibcode == null && scixId == null) {
      throw new IllegalArgumentException("record key requires a bibcode or a scix_id");
    }
  }

  /**
   * Returns a label for logs: the bibcode when present, otherwise the scix_id.
   *
   * @return non-null label
   */
  public String display() {
    return bibcode != null ? bibcode : scixId;
  }

  static String blankToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
