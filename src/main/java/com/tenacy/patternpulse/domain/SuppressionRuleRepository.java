package com.tenacy.patternpulse.domain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface SuppressionRuleRepository extends JpaRepository<SuppressionRule, String> {

    List<SuppressionRule> findByActiveTrueOrderByCreatedAtAsc();

    List<SuppressionRule> findByActive(boolean active);

    @Transactional
    @Modifying
    @Query("UPDATE SuppressionRule r SET r.timesTriggered = r.timesTriggered + 1 WHERE r.id = :id")
    int incrementTimesTriggered(@Param("id") String id);
}
