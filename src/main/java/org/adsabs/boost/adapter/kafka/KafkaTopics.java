package org.adsabs.boost.adapter.kafka;

import java.util.Map;

/**
 * Topic names for the pipeline channels.
 *
 * @param intake record-update messages from the upstream ingest pipeline
 * @param compute normalized records awaiting computation
 * @param store computed factors awaiting storage
 * @param send stored factors awaiting notification
 * @param response factors published to downstream consumers
 * @since 0.1.0
 */
public record KafkaTopics(String intake, String compute, String store, String send, String response) {
  public KafkaTopics {
    intake = KafkaClients.sanitizeTopic(intake);
    compute = KafkaClients.sanitizeTopic(compute);
    store = KafkaClients.sanitizeTopic(store);
    send = KafkaClients.sanitizeTopic(send);
    response = KafkaClients.sanitizeTopic(response);
  }

  public static KafkaTopics defaults() {
    return new KafkaTopics(
        "boost.update-record",
        "boost.compute-boost",
        "boost.store-boost",
        "boost.send-boost-response",
        "master.boost-response");
  }

  /**
   * Reads {@code topics.*} keys, keeping defaults for absent or blank keys.
   *
   * @param config effective configuration
   * @return topics
   */
  public static KafkaTopics fromMap(Map<String, String> config) {
    KafkaTopics d = defaults();
    return new KafkaTopics(
        pick(config, "topics.intake", d.intake()),
        pick(config, "topics.compute", d.compute()),
        pick(config, "topics.store", d.store()),
        pick(config, "topics.send", d.send()),
        pick(config, "topics.response", d.response()));
  }

  private static String pick(Map<String, String> config, String key, String fallback) {
    String value = config.get(key);
    return value == null || value.isBlank() ? fallback : value;
  }
}
