package com.vigil.anomaly.service;

import com.vigil.anomaly.model.AnomalyAlert;
import com.vigil.anomaly.publish.AlertEventPublisher;
import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Pushes alert lifecycle events to connected server-sent-event clients. */
@Service
public class AlertStreamService implements AlertEventPublisher {

  private static final Logger log = LoggerFactory.getLogger(AlertStreamService.class);

  private final CopyOnWriteArrayList<SseEmitter> clients = new CopyOnWriteArrayList<>();

  public SseEmitter registerClient(long timeoutMs) {
    SseEmitter emitter = new SseEmitter(timeoutMs);
    clients.add(emitter);
    emitter.onCompletion(() -> clients.remove(emitter));
    emitter.onTimeout(() -> clients.remove(emitter));
    emitter.onError(e -> clients.remove(emitter));
    try {
      emitter.send(SseEmitter.event().name("hello").data("connected"));
    } catch (IOException e) {
      clients.remove(emitter);
      log.debug("SSE client dropped on connect: {}", e.getMessage());
    }
    return emitter;
  }

  public int clientCount() {
    return clients.size();
  }

  @Override
  public void alertCreated(AnomalyAlert alert) {
    broadcast("alert", alert);
  }

  @Override
  public void alertResolved(AnomalyAlert alert) {
    broadcast("alert-resolved", alert);
  }

  private void broadcast(String name, AnomalyAlert alert) {
    for (SseEmitter client : clients) {
      try {
        client.send(SseEmitter.event().name(name).data(alert));
      } catch (IOException | IllegalStateException e) {
        clients.remove(client);
      }
    }
  }
}
