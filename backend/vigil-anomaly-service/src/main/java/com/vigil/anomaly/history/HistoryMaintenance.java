package com.vigil.anomaly.history;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class HistoryMaintenance {

  private static final Logger log = LoggerFactory.getLogger(HistoryMaintenance.class);

  private final MetricHistoryStore store;
  private final Duration idleEviction;

  public HistoryMaintenance(MetricHistoryStore store,
                            @Value("${vigil.history.idle-eviction:PT6H}") Duration idleEviction) {
    this.store = store;
    this.idleEviction = idleEviction;
  }

  // Periodic pruning so series for retired metrics don't accumulate
  @Scheduled(fixedDelayString = "${vigil.history.maintenance-interval-ms:60000}")
  public void pruneIdleSeries() {
    try {
      int removed = store.evictIdle(idleEviction);
      if (removed > 0) {
        log.info("[pruneIdleSeries] Evicted {} idle series (idle > {})", removed, idleEviction);
      } else {
        log.debug("[pruneIdleSeries] Nothing to evict; tracking {} series", store.keys().size());
      }
    } catch (Exception e) {
      log.error("Error in pruneIdleSeries task: {}", e.getMessage());
    }
  }
}
