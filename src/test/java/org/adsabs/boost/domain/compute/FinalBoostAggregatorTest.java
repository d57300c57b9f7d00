package org.adsabs.boost.domain.compute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.Map;
import org.adsabs.boost.domain.Discipline;
import org.adsabs.boost.domain.DisciplineScores;
import org.junit.jupiter.api.Test;

class FinalBoostAggregatorTest {

  @Test
  void multipliesEachWeightByCombinedBoost() {
    Map<Discipline, Double> values = new EnumMap<>(Discipline.class);
    for (Discipline discipline : Discipline.values()) {
      values.put(discipline, 0.0);
    }
    values.put(Discipline.ASTRONOMY, 1.0);
    values.put(Discipline.PHYSICS, 0.4);

    DisciplineScores finals = FinalBoostAggregator.aggregate(DisciplineScores.of(values), 0.75);

    assertEquals(0.75, finals.get(Discipline.ASTRONOMY), 1e-12);
    assertEquals(0.3, finals.get(Discipline.PHYSICS), 1e-12);
    assertEquals(0.0, finals.get(Discipline.GENERAL), 1e-12);
  }

  @Test
  void rejectsCombinedBoostOutsideUnitRange() {
    assertThrows(IllegalArgumentException.class,
        () -> FinalBoostAggregator.aggregate(DisciplineScores.uniform(0.5), 1.5));
  }
}
