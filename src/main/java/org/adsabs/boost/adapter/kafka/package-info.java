/**
 * Kafka transport: stage topics, stage workers and the downstream response publisher.
 */
package org.adsabs.boost.adapter.kafka;
