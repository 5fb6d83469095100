package com.tenacy.patternpulse.domain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface PatternOccurrenceBucketRepository extends JpaRepository<PatternOccurrenceBucket, Long> {

    List<PatternOccurrenceBucket> findByPatternIdAndBucketStartBetweenOrderByBucketStartAsc(
            String patternId, LocalDateTime start, LocalDateTime end);

    // 기존 버킷이 있으면 발생 횟수 증가
    @Modifying
    @Query("UPDATE PatternOccurrenceBucket b SET b.occurrences = b.occurrences + :delta " +
            "WHERE b.patternId = :patternId AND b.bucketStart = :bucketStart")
    int incrementOccurrences(
            @Param("patternId") String patternId,
            @Param("bucketStart") LocalDateTime bucketStart,
            @Param("delta") int delta);

    @Transactional
    @Modifying
    @Query("DELETE FROM PatternOccurrenceBucket b WHERE b.bucketStart < :threshold")
    int deleteOlderThan(@Param("threshold") LocalDateTime threshold);
}
