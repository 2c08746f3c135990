package com.vigil.anomaly.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.vigil.anomaly.model.AnomalyAlert;
import com.vigil.detection.model.Severity;
import java.time.Instant;
import org.junit.jupiter.api.Test;

public class AlertStreamServiceTest {

  @Test
  void registeredClientsReceiveEvents() {
    AlertStreamService stream = new AlertStreamService();
    stream.registerClient(1_000L);
    stream.registerClient(1_000L);
    assertThat(stream.clientCount()).isEqualTo(2);

    AnomalyAlert alert = new AnomalyAlert("a1", "cpu", Severity.HIGH, "m", null, null, Instant.EPOCH, null, null);
    assertThatCode(() -> {
      stream.alertCreated(alert);
      stream.alertResolved(alert);
    }).doesNotThrowAnyException();
    assertThat(stream.clientCount()).isEqualTo(2);
  }
}
