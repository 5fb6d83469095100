package com.tenacy.patternpulse.service;

import com.tenacy.patternpulse.api.dto.PatternResponse;
import com.tenacy.patternpulse.api.dto.PatternStatisticsResponse;
import com.tenacy.patternpulse.api.dto.PatternTrendResponse;
import com.tenacy.patternpulse.api.dto.PatternUpdateRequest;
import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.ErrorPattern;
import com.tenacy.patternpulse.domain.ErrorPatternRepository;
import com.tenacy.patternpulse.domain.PatternOccurrenceBucket;
import com.tenacy.patternpulse.domain.PatternOccurrenceBucketRepository;
import com.tenacy.patternpulse.domain.PatternPriority;
import com.tenacy.patternpulse.domain.PatternStatus;
import com.tenacy.patternpulse.domain.PatternType;
import com.tenacy.patternpulse.domain.TrendDirection;
import com.tenacy.patternpulse.exception.PatternNotFoundException;
import com.tenacy.patternpulse.ingest.ErrorFact;
import com.tenacy.patternpulse.pattern.trend.PatternForecast;
import com.tenacy.patternpulse.pattern.trend.PatternTrend;
import com.tenacy.patternpulse.pattern.trend.TrendAnalyzer;
import com.tenacy.patternpulse.pattern.trend.TrendDataPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class PatternService {

    private static final int TOP_PATTERN_COUNT = 10;

    private final ErrorPatternRepository patternRepository;
    private final PatternOccurrenceBucketRepository bucketRepository;
    private final TrendAnalyzer trendAnalyzer;
    private final PatternPulseProperties properties;
    private final Clock clock;

    public List<PatternResponse> retrievePatterns(PatternType type, PatternPriority priority,
                                                  Double minConfidence, Integer timeframeHours) {
        List<ErrorPattern> patterns = timeframeHours != null
                ? patternRepository.findByLastOccurrenceGreaterThanEqualOrderByLastOccurrenceDesc(
                        LocalDateTime.now(clock).minusHours(timeframeHours))
                : patternRepository.findAll();

        return patterns.stream()
                .filter(p -> type == null || p.getType() == type)
                .filter(p -> priority == null || p.getPriority() == priority)
                .filter(p -> minConfidence == null || p.getConfidence() >= minConfidence)
                .sorted(Comparator.comparing(ErrorPattern::getLastOccurrence,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .map(PatternResponse::of)
                .toList();
    }

    public PatternResponse retrievePattern(String id) {
        return PatternResponse.of(findPattern(id));
    }

    @Transactional
    public PatternResponse updatePattern(String id, PatternUpdateRequest request) {
        ErrorPattern pattern = findPattern(id);

        if (request.getName() != null) {
            pattern.setName(request.getName());
        }
        if (request.getDescription() != null) {
            pattern.setDescription(request.getDescription());
        }
        if (request.getPriority() != null) {
            pattern.setPriority(request.getPriority());
        }
        if (request.getStatus() != null) {
            log.info("패턴 상태 변경 - {}: {} -> {}", pattern.getName(), pattern.getStatus(), request.getStatus());
            pattern.setStatus(request.getStatus());
        }
        if (request.getAssignedTo() != null) {
            pattern.setAssignedTo(request.getAssignedTo());
        }
        if (request.getResolutionNotes() != null) {
            pattern.setResolutionNotes(request.getResolutionNotes());
        }

        return PatternResponse.of(patternRepository.saveAndFlush(pattern));
    }

    public PatternTrendResponse retrieveTrend(String id) {
        ErrorPattern pattern = findPattern(id);
        PatternTrend trend = trendAnalyzer.analyze(loadSeries(pattern));
        return PatternTrendResponse.builder()
                .patternId(pattern.getId())
                .series(trend.getSeries())
                .slope(trend.getSlope())
                .direction(trend.getDirection())
                .changeRate(trend.getChangeRate())
                .accelerating(trend.isAccelerating())
                .forecast(trend.getForecast())
                .build();
    }

    public PatternStatisticsResponse statistics(int timeframeHours) {
        LocalDateTime since = LocalDateTime.now(clock).minusHours(timeframeHours);
        List<ErrorPattern> patterns = patternRepository.findByLastOccurrenceGreaterThanEqualOrderByLastOccurrenceDesc(since);

        return PatternStatisticsResponse.builder()
                .timeframeHours(timeframeHours)
                .totalPatterns(patterns.size())
                .totalOccurrences(patterns.stream().mapToLong(ErrorPattern::getOccurrenceCount).sum())
                .byStatus(countBy(patterns, p -> p.getStatus().name()))
                .byPriority(countBy(patterns, p -> p.getPriority().name()))
                .byType(countBy(patterns, p -> p.getType().name()))
                .byCategory(countBy(patterns, p -> p.getCategory().name()))
                .increasingPatterns(patterns.stream().filter(p -> p.getTrendDirection() == TrendDirection.INCREASING).count())
                .totalRevenueImpact(patterns.stream().mapToDouble(p -> p.getBusinessImpact().getRevenueImpact()).sum())
                .topPatterns(patterns.stream()
                        .sorted(Comparator.comparingInt(ErrorPattern::getOccurrenceCount).reversed())
                        .limit(TOP_PATTERN_COUNT)
                        .map(PatternResponse::of)
                        .toList())
                .build();
    }

    /**
     * 현재 시각 버킷에서 끝나는 시계열 (빈 버킷은 0). 조용해진 패턴은 뒤쪽 버킷이 0으로 채워진다.
     * 마지막 발생이 현재보다 뒤인 경우에만 그 버킷에서 끝난다.
     */
    public List<TrendDataPoint> loadSeries(ErrorPattern pattern) {
        LocalDateTime end = truncate(LocalDateTime.now(clock));
        LocalDateTime last = pattern.getLastOccurrence();
        if (last != null && !ErrorFact.MIN_TIMESTAMP.equals(last) && truncate(last).isAfter(end)) {
            end = truncate(last);
        }
        return loadSeries(pattern.getId(), end);
    }

    public List<TrendDataPoint> loadSeries(String patternId, LocalDateTime endBucket) {
        int windowBuckets = properties.getTrend().getWindowBuckets();
        LocalDateTime start = endBucket.minus(TrendAnalyzer.BUCKET_SIZE.multipliedBy(Math.max(0, windowBuckets - 1L)));

        Map<LocalDateTime, Integer> buckets = bucketRepository
                .findByPatternIdAndBucketStartBetweenOrderByBucketStartAsc(patternId, start, endBucket).stream()
                .collect(Collectors.toMap(PatternOccurrenceBucket::getBucketStart, PatternOccurrenceBucket::getOccurrences, Integer::sum));
        return trendAnalyzer.buildSeries(buckets, endBucket);
    }

    public List<ErrorPattern> findAnalysisCandidates(LocalDateTime since) {
        return patternRepository.findByLastOccurrenceGreaterThanEqualOrderByLastOccurrenceDesc(since);
    }

    /**
     * 추세 분석 결과 반영. 심각도와 유형은 발생률과 추세로 다시 계산한다.
     */
    @Transactional
    public void applyAnalysis(String patternId, PatternTrend trend, Set<String> relatedPatternIds) {
        ErrorPattern pattern = findPattern(patternId);

        pattern.setTrendDirection(trend.getDirection());
        pattern.setChangeRate(trend.getChangeRate());
        pattern.setAccelerating(trend.isAccelerating());

        PatternForecast forecast = trend.getForecast();
        pattern.setForecastOccurrences(forecast.getPredictedOccurrences());
        pattern.setForecastConfidence(forecast.getConfidence());
        pattern.setForecastPeriodHours(Math.round(forecast.getPeriodHours()));

        pattern.getRelatedPatternIds().clear();
        pattern.getRelatedPatternIds().addAll(relatedPatternIds);

        pattern.setSeverity(trendAnalyzer.classifySeverity(pattern.getOccurrenceRate(), trend));
        if (pattern.getType() != PatternType.CYCLIC) {
            pattern.setType(trendAnalyzer.classifyType(!relatedPatternIds.isEmpty(), trend, pattern.getTimespanHours()));
        }
        pattern.setLastAnalyzed(LocalDateTime.now(clock));

        patternRepository.saveAndFlush(pattern);
    }

    public List<ErrorPattern> findInactivePatterns(LocalDateTime threshold) {
        return patternRepository.findByStatusInAndLastOccurrenceBefore(
                EnumSet.of(PatternStatus.ACTIVE, PatternStatus.INVESTIGATION_PENDING,
                        PatternStatus.IN_PROGRESS, PatternStatus.RESOLVED),
                threshold);
    }

    @Transactional
    public boolean archiveIfInactive(String patternId, LocalDateTime threshold) {
        ErrorPattern pattern = findPattern(patternId);
        LocalDateTime lastActivity = lastActivity(pattern);
        if (pattern.getStatus() == PatternStatus.ARCHIVED || pattern.getStatus() == PatternStatus.IGNORED
                || lastActivity == null || !lastActivity.isBefore(threshold)) {
            return false;
        }
        pattern.setStatus(PatternStatus.ARCHIVED);
        patternRepository.saveAndFlush(pattern);
        log.info("비활성 패턴 보관 처리: {} (마지막 발생 {})", pattern.getName(), pattern.getLastOccurrence());
        return true;
    }

    public boolean isInactiveSince(String patternId, LocalDateTime threshold) {
        return patternRepository.findById(patternId)
                .map(p -> lastActivity(p) == null || lastActivity(p).isBefore(threshold))
                .orElse(true);
    }

    // 발생 시각을 읽지 못한 팩트만 있는 패턴은 생성 시각 기준
    static LocalDateTime lastActivity(ErrorPattern pattern) {
        LocalDateTime last = pattern.getLastOccurrence();
        if (last == null || ErrorFact.MIN_TIMESTAMP.equals(last)) {
            return pattern.getCreatedAt();
        }
        return last;
    }

    private static LocalDateTime truncate(LocalDateTime time) {
        return time.truncatedTo(ChronoUnit.HOURS);
    }

    private ErrorPattern findPattern(String id) {
        return patternRepository.findById(id)
                .orElseThrow(() -> new PatternNotFoundException(id));
    }

    private static Map<String, Long> countBy(List<ErrorPattern> patterns,
                                             Function<ErrorPattern, String> classifier) {
        return patterns.stream().collect(Collectors.groupingBy(classifier, TreeMap::new, Collectors.counting()));
    }
}
