package org.adsabs.boost.application.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import org.adsabs.boost.domain.BoostRequest;
import org.adsabs.boost.domain.error.ValidationException;
import org.junit.jupiter.api.Test;

class BoostRequestCodecTest {
  private final BoostRequestCodec codec = new BoostRequestCodec();

  @Test
  void envelopeKeepsCollectionOrderAndMissingDate() throws ValidationException {
    BoostRequest request = new BoostRequest("2019Sci...363..001B", null, false, "eprint", null,
        new LinkedHashSet<>(List.of("physics", "astrophysics")));

    BoostRequest decoded = codec.decode(codec.encode(request));

    assertEquals(request, decoded);
    assertEquals(List.of("physics", "astrophysics"), List.copyOf(decoded.collections()));
  }

  @Test
  void envelopeCarriesPublicationDate() throws ValidationException {
    BoostRequest request = new BoostRequest(null, "scix:9", true, "article", LocalDate.of(2001, 2, 3), null);

    assertEquals(LocalDate.of(2001, 2, 3), codec.decode(codec.encode(request)).publicationDate());
  }

  @Test
  void malformedEnvelopesAreValidationFailures() {
    assertThrows(ValidationException.class, () -> codec.decode("{\"publication_date\": \"yesterday\"}"));
    assertThrows(ValidationException.class, () -> codec.decode("not json"));
  }
}
