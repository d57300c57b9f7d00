package org.adsabs.boost.domain.compute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import org.adsabs.boost.domain.error.ConfigurationException;
import org.junit.jupiter.api.Test;

class RecencyDecayTest {
  private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

  @Test
  void boostNeverIncreasesWithAge() {
    for (DecayCurve curve : DecayCurve.values()) {
      RecencyDecay decay = new RecencyDecay(curve, 0.1, 24, 0.05, 0.95);
      double previous = Double.POSITIVE_INFINITY;
      for (double age = 0.0; age <= 30.0; age += 0.5) {
        double boost = decay.boostForAge(age);
        assertTrue(boost <= previous, curve + " increased at age " + age);
        assertTrue(boost >= 0.05 && boost <= 0.95, curve + " left its bounds at age " + age);
        previous = boost;
      }
    }
  }

  @Test
  void ageZeroYieldsMaxAndCutoffYieldsFloor() {
    RecencyDecay decay = new RecencyDecay(DecayCurve.EXPONENTIAL, 0.2, 12, 0.1, 0.9);

    assertEquals(0.9, decay.boostForAge(0.0), 1e-12);
    assertEquals(0.1, decay.boostForAge(12.0), 1e-12);
    assertEquals(0.1, decay.boostForAge(240.0), 1e-12);
  }

  @Test
  void missingDateYieldsFloor() {
    RecencyDecay decay = new RecencyDecay(DecayCurve.RECIPROCAL, 0.1, 24, 0.2, 1.0);

    assertEquals(0.2, decay.boostFor(null, TODAY));
  }

  @Test
  void futureDatesCountAsPublishedToday() {
    RecencyDecay decay = RecencyDecay.defaults();

    assertEquals(decay.boostFor(TODAY, TODAY), decay.boostFor(TODAY.plusDays(40), TODAY));
    assertEquals(1.0, decay.boostFor(TODAY, TODAY), 1e-12);
  }

  @Test
  void zeroMultiplierFallsBackToLinearDecay() {
    RecencyDecay decay = new RecencyDecay(DecayCurve.RECIPROCAL, 0.0, 10, 0.0, 1.0);

    assertEquals(0.5, decay.boostForAge(5.0), 1e-12);
  }

  @Test
  void invalidBoundsAreRejected() {
    assertThrows(ConfigurationException.class, () -> new RecencyDecay(DecayCurve.LINEAR, 0.1, 24, 0.6, 0.5));
    assertThrows(ConfigurationException.class, () -> new RecencyDecay(DecayCurve.LINEAR, 0.1, 0, 0.0, 1.0));
    assertThrows(ConfigurationException.class, () -> DecayCurve.parse("logarithmic"));
  }
}
