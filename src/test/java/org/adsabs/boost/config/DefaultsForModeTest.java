package org.adsabs.boost.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.adsabs.boost.domain.error.ConfigurationException;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void runDefaultsProcessLocallyAndLogNotifications() {
    Map<String, String> run = DefaultsForMode.asFlatMap("run");

    assertEquals("local", run.get("transport"));
    assertEquals("log", run.get("notify"));
    assertEquals("100", run.get("batchSize"));
    assertEquals("5", run.get("retry.maxAttempts"));
  }

  @Test
  void lookupModesShareDefaults() {
    assertEquals(DefaultsForMode.asFlatMap("query"), DefaultsForMode.asFlatMap("export"));
    assertTrue(DefaultsForMode.asFlatMap("query").containsKey("bibcodes"));
    assertFalse(DefaultsForMode.asFlatMap("query").containsKey("transport"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(ConfigurationException.class, () -> DefaultsForMode.asFlatMap("replay"));
  }
}
