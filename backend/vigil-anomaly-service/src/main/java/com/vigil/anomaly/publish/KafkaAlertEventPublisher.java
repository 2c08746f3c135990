package com.vigil.anomaly.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.anomaly.model.AnomalyAlert;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@Profile("kafka")
public class KafkaAlertEventPublisher implements AlertEventPublisher {

  private static final Logger log = LoggerFactory.getLogger(KafkaAlertEventPublisher.class);

  private final KafkaTemplate<String, String> kafka;
  private final ObjectMapper mapper;
  private final String topic;
  private final Counter published;

  public KafkaAlertEventPublisher(KafkaTemplate<String, String> kafka,
                                  ObjectMapper mapper,
                                  @Value("${vigil.alerts.topic:anomaly_alerts}") String topic,
                                  MeterRegistry metrics) {
    this.kafka = kafka;
    this.mapper = mapper;
    this.topic = topic;
    this.published = metrics.counter("vigil_alerts_published_total", "sink", "kafka");
  }

  @Override
  public void alertCreated(AnomalyAlert alert) {
    send(alert);
  }

  @Override
  public void alertResolved(AnomalyAlert alert) {
    send(alert);
  }

  private void send(AnomalyAlert alert) {
    try {
      kafka.send(topic, alert.metric(), mapper.writeValueAsString(alert));
      published.increment();
    } catch (JsonProcessingException ex) {
      log.warn("Alert {} could not be serialized for Kafka: {}", alert.id(), ex.getMessage());
    } catch (Exception ex) {
      log.debug("Kafka alert publish failed (non-fatal): alert={} {}", alert.id(), ex.getMessage());
    }
  }
}
