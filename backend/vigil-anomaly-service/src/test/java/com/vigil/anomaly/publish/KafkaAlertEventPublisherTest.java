package com.vigil.anomaly.publish;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vigil.anomaly.model.AnomalyAlert;
import com.vigil.detection.model.AnomalyScore;
import com.vigil.detection.model.DetectionMethod;
import com.vigil.detection.model.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;

public class KafkaAlertEventPublisherTest {

  @SuppressWarnings("unchecked")
  private final KafkaTemplate<String, String> kafka = mock(KafkaTemplate.class);
  private final SimpleMeterRegistry metrics = new SimpleMeterRegistry();
  private final KafkaAlertEventPublisher publisher = new KafkaAlertEventPublisher(
      kafka, new ObjectMapper().registerModule(new JavaTimeModule()), "alerts", metrics);

  private static AnomalyAlert alert() {
    AnomalyScore s = AnomalyScore.of(3, 50, 3.6, 0L, DetectionMethod.ZSCORE, null);
    return new AnomalyAlert("a1", "latency", Severity.CRITICAL, "msg", s, null,
        Instant.parse("2024-03-01T12:00:00Z"), null, null);
  }

  @Test
  void sendsJsonKeyedByMetric() {
    publisher.alertCreated(alert());

    ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
    verify(kafka).send(eq("alerts"), eq("latency"), payload.capture());
    assertThat(payload.getValue()).contains("\"id\":\"a1\"").contains("\"severity\":\"critical\"");
    assertThat(metrics.counter("vigil_alerts_published_total", "sink", "kafka").count()).isEqualTo(1.0);
  }

  @Test
  void brokerFailureIsSwallowed() {
    when(kafka.send(anyString(), anyString(), anyString())).thenThrow(new IllegalStateException("no broker"));
    assertThatCode(() -> publisher.alertResolved(alert())).doesNotThrowAnyException();
    assertThat(metrics.counter("vigil_alerts_published_total", "sink", "kafka").count()).isZero();
  }
}
