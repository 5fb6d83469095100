package com.tenacy.patternpulse.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 패턴별 시간 단위 발생 횟수. 추세 분석의 입력 시계열이 된다.
 */
@Entity
@Table(name = "pattern_occurrence_buckets",
        uniqueConstraints = @UniqueConstraint(name = "uk_bucket_pattern_start",
                columnNames = {"patternId", "bucketStart"}),
        indexes = @Index(name = "idx_bucket_pattern", columnList = "patternId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternOccurrenceBucket {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String patternId;

    @Column(nullable = false)
    private LocalDateTime bucketStart;   // 정시로 절삭된 시각

    private int occurrences;
}
