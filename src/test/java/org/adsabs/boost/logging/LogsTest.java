package org.adsabs.boost.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("<null>", Logs.truncate(null, 10));
    assertEquals("short", Logs.truncate("short", 10));
    assertEquals("abc... (truncated, 6 chars)", Logs.truncate("abcdef", 3));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void redactsSecretLookingKeysAndSorts() {
    Map<String, String> config = new HashMap<>();
    config.put("jdbcUrl", "jdbc:postgresql://db/boost");
    config.put("jdbcPassword", "hunter2");
    config.put("apiToken", "");
    config.put("kafkaSecret", "s3");

    Map<String, String> printable = Logs.redactSecrets(config);

    assertEquals(List.of("apiToken", "jdbcPassword", "jdbcUrl", "kafkaSecret"), List.copyOf(printable.keySet()));
    assertEquals("[REDACTED]", printable.get("jdbcPassword"));
    assertEquals("[REDACTED]", printable.get("kafkaSecret"));
    assertEquals("", printable.get("apiToken"));
    assertEquals("jdbc:postgresql://db/boost", printable.get("jdbcUrl"));
  }
}
