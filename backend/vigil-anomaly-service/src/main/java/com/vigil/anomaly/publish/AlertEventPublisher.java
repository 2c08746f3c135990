package com.vigil.anomaly.publish;

import com.vigil.anomaly.model.AnomalyAlert;

/**
 * Receives alert lifecycle events after they are persisted. Implementations must not throw for
 * delivery problems; the alert service treats every publisher as best effort.
 */
public interface AlertEventPublisher {

  void alertCreated(AnomalyAlert alert);

  default void alertResolved(AnomalyAlert alert) {}
}
