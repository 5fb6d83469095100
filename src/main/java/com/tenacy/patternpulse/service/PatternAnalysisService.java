package com.tenacy.patternpulse.service;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.ErrorPattern;
import com.tenacy.patternpulse.pattern.trend.CorrelationAnalyzer;
import com.tenacy.patternpulse.pattern.trend.PatternTrend;
import com.tenacy.patternpulse.pattern.trend.TrendAnalyzer;
import com.tenacy.patternpulse.pattern.trend.TrendDataPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 탐지 주기: 최근 패턴의 추세, 예측, 상관관계를 다시 계산한다.
 * 패턴별로 따로 저장하며 충돌한 패턴은 다음 주기로 넘긴다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternAnalysisService {

    private final PatternService patternService;
    private final TrendAnalyzer trendAnalyzer;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final PatternPulseProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${patternpulse.trend.analysis-interval-ms:600000}",
            initialDelayString = "${patternpulse.trend.analysis-interval-ms:600000}")
    public void scheduledAnalysis() {
        try {
            runAnalysisCycle();
        } catch (Exception e) {
            log.error("패턴 분석 주기 실패: {}", e.getMessage(), e);
        }
    }

    public int runAnalysisCycle() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<ErrorPattern> candidates = patternService.findAnalysisCandidates(
                now.minus(properties.getTrend().getAnalysisLookback()));
        if (candidates.isEmpty()) {
            log.debug("분석 대상 패턴 없음");
            return 0;
        }

        log.info("패턴 분석 시작: {}개 패턴", candidates.size());

        // 상관관계는 같은 구간에 정렬된 시계열로 비교한다
        LocalDateTime alignedEnd = now.truncatedTo(ChronoUnit.HOURS);
        Map<String, List<TrendDataPoint>> alignedSeries = new LinkedHashMap<>();
        for (ErrorPattern pattern : candidates) {
            alignedSeries.put(pattern.getId(), patternService.loadSeries(pattern.getId(), alignedEnd));
        }

        int analyzed = 0;
        for (ErrorPattern pattern : candidates) {
            try {
                PatternTrend trend = trendAnalyzer.analyze(patternService.loadSeries(pattern));
                Set<String> related = findRelated(pattern.getId(), alignedSeries);
                patternService.applyAnalysis(pattern.getId(), trend, related);
                analyzed++;
            } catch (OptimisticLockingFailureException e) {
                log.debug("동시 수정으로 이번 주기에서 제외: {}", pattern.getId());
            } catch (Exception e) {
                log.error("패턴 분석 실패 - {}: {}", pattern.getId(), e.getMessage(), e);
            }
        }

        log.info("패턴 분석 완료: {}/{}", analyzed, candidates.size());
        return analyzed;
    }

    Set<String> findRelated(String patternId, Map<String, List<TrendDataPoint>> alignedSeries) {
        Set<String> related = new LinkedHashSet<>();
        List<TrendDataPoint> own = alignedSeries.get(patternId);
        for (Map.Entry<String, List<TrendDataPoint>> other : alignedSeries.entrySet()) {
            if (!other.getKey().equals(patternId) && correlationAnalyzer.isCorrelated(own, other.getValue())) {
                related.add(other.getKey());
            }
        }
        return related;
    }
}
