package com.vigil.anomaly.repo;

import com.vigil.anomaly.entity.AnomalyAlertEntity;
import com.vigil.detection.model.Severity;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AnomalyAlertRepository extends JpaRepository<AnomalyAlertEntity, String> {
  List<AnomalyAlertEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

  List<AnomalyAlertEntity> findBySeverityOrderByCreatedAtDesc(Severity severity, Pageable pageable);

  List<AnomalyAlertEntity> findByCreatedAtBetweenOrderByCreatedAtDesc(Instant start, Instant end);

  List<AnomalyAlertEntity> findBySeverityAndCreatedAtBetweenOrderByCreatedAtDesc(Severity severity, Instant start, Instant end);

  Optional<AnomalyAlertEntity> findFirstByMetricAndSeverityAndMessageAndResolvedAtIsNullAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
      String metric, Severity severity, String message, Instant since);

  @Query("SELECT a.severity, COUNT(a) FROM AnomalyAlertEntity a " +
      "WHERE a.createdAt >= :since AND a.createdAt <= :until " +
      "GROUP BY a.severity")
  List<Object[]> countBySeverityBetween(@Param("since") Instant since, @Param("until") Instant until);

  long countByCreatedAtBetweenAndResolvedAtIsNotNull(Instant start, Instant end);
}
