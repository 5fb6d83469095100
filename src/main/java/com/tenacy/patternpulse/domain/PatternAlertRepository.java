package com.tenacy.patternpulse.domain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PatternAlertRepository extends JpaRepository<PatternAlert, String> {

    Optional<PatternAlert> findByOpenPatternId(String patternId);

    List<PatternAlert> findByPatternIdOrderByCreatedAtDesc(String patternId);

    List<PatternAlert> findByStatusIn(Collection<AlertStatus> statuses);

    List<PatternAlert> findByCreatedAtGreaterThanEqual(LocalDateTime since);

    @Query("SELECT a FROM PatternAlert a WHERE " +
            "(:status IS NULL OR a.status = :status) AND " +
            "(:severity IS NULL OR a.severity = :severity) " +
            "ORDER BY a.createdAt DESC")
    List<PatternAlert> search(
            @Param("status") AlertStatus status,
            @Param("severity") AlertSeverity severity);

    // 전송 결과 기록. 버전을 올리지 않으므로 상태 전이와 충돌하지 않는다
    @Transactional
    @Modifying
    @Query("UPDATE PatternAlert a SET a.lastDeliveryStatus = :status, a.lastDeliveryAt = :at, " +
            "a.deliveryFailures = a.deliveryFailures + :failureDelta, a.lastDeliveryError = :error " +
            "WHERE a.id = :id")
    int recordDelivery(
            @Param("id") String id,
            @Param("status") DeliveryStatus status,
            @Param("at") LocalDateTime at,
            @Param("failureDelta") int failureDelta,
            @Param("error") String error);
}
