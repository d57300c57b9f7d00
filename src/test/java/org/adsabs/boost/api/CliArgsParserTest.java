package org.adsabs.boost.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "file=records.json", "jdbcUrl=jdbc:h2:mem:x;MODE=PostgreSQL", " batchSize = 50 "});

    assertEquals("records.json", map.get("file"));
    assertEquals("jdbc:h2:mem:x;MODE=PostgreSQL", map.get("jdbcUrl"));
    assertEquals("50", map.get("batchSize"));
  }

  @Test
  void keepsEmptyValuesAndSkipsBlanks() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"jdbcPassword=", "", null});

    assertEquals(Map.of("jdbcPassword", ""), map);
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsArgumentsWithoutValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"records.json"}));
    assertTrue(ex.getMessage().contains("records.json"));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
  }

  @Test
  void rejectsInvalidKeysAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"file=a\u0007b"}));
  }
}
