package com.tenacy.patternpulse.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenacy.patternpulse.api.dto.ImportResponse;
import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.SourceKind;
import com.tenacy.patternpulse.exception.ImportCancelledException;
import com.tenacy.patternpulse.ingest.ErrorFact;
import com.tenacy.patternpulse.ingest.ErrorFactNormalizer;
import com.tenacy.patternpulse.notification.AlertNotification;
import com.tenacy.patternpulse.notification.NotificationDispatcher;
import com.tenacy.patternpulse.pattern.PatternGroup;
import com.tenacy.patternpulse.pattern.PatternGroupingEngine;
import com.tenacy.patternpulse.pattern.scoring.PatternScoringService;
import com.tenacy.patternpulse.pattern.scoring.ScoringInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 가져오기 파이프라인: 정규화 → 그룹핑 → 스코어링 → 저장 → 알림 평가.
 * 저장 전까지는 모두 메모리에서 처리하며 그 사이 취소되면 아무것도 저장하지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ErrorImportService {

    private final ErrorFactNormalizer normalizer;
    private final PatternGroupingEngine groupingEngine;
    private final PatternScoringService scoringService;
    private final PatternMergeService mergeService;
    private final AlertService alertService;
    private final NotificationDispatcher notificationDispatcher;
    private final PatternMetricsService metricsService;
    private final PatternPulseProperties properties;

    public ImportResponse importRows(SourceKind source, List<JsonNode> rows, LocalDateTime since, Integer limit) {
        List<JsonNode> input = rows != null ? rows : List.of();
        int effectiveLimit = effectiveLimit(limit);

        List<ErrorFact> facts = new ArrayList<>(Math.min(input.size(), effectiveLimit));
        for (JsonNode row : input) {
            ErrorFact fact = normalizer.normalize(source, row);
            // 타임스탬프를 읽지 못한 행은 since 필터와 상관없이 유지
            if (since != null && fact.hasReadableTimestamp() && fact.getTimestamp().isBefore(since)) {
                continue;
            }
            if (facts.size() >= effectiveLimit) {
                break;
            }
            facts.add(fact);
        }
        checkCancelled("정규화");

        List<PatternGroup> groups = groupingEngine.group(facts);
        List<ScoredGroup> scoredGroups = new ArrayList<>(groups.size());
        for (PatternGroup group : groups) {
            scoredGroups.add(new ScoredGroup(group, scoringService.score(ScoringInput.of(group))));
        }
        checkCancelled("스코어링");

        List<MergeResult> results = mergeService.merge(scoredGroups);

        int alertsRaised = 0;
        List<String> patternIds = new ArrayList<>(results.size());
        for (MergeResult result : results) {
            patternIds.add(result.getPatternId());
            Optional<AlertNotification> notification = raiseAlert(result.getPatternId());
            if (notification.isPresent()) {
                notificationDispatcher.dispatchAsync(notification.get());
                alertsRaised++;
            }
        }

        int created = (int) results.stream().filter(MergeResult::isCreated).count();
        metricsService.recordImport(facts.size(), created);
        log.info("{} 가져오기 완료 - 행: {}, 팩트: {}, 신규 패턴: {}, 갱신 패턴: {}, 새 알림: {}",
                source, input.size(), facts.size(), created, results.size() - created, alertsRaised);

        return ImportResponse.builder()
                .source(source.name())
                .rowsReceived(input.size())
                .factsImported(facts.size())
                .patternsCreated(created)
                .patternsUpdated(results.size() - created)
                .alertsRaised(alertsRaised)
                .patternIds(patternIds)
                .build();
    }

    /**
     * 병합이 커밋된 뒤이므로 알림 단계의 실패는 로그만 남기고 가져오기 응답은 그대로 반환한다.
     */
    private Optional<AlertNotification> raiseAlert(String patternId) {
        try {
            return alertService.evaluate(patternId);
        } catch (DataIntegrityViolationException e) {
            // 다른 요청이 먼저 알림을 만들었다. 다시 평가하면 기존 알림을 재트리거한다
            log.debug("동시 알림 생성 감지 - 재트리거로 처리: {}", patternId);
            return reevaluate(patternId);
        } catch (OptimisticLockingFailureException e) {
            // 에스컬레이션 점검이나 보존 정리가 같은 알림을 먼저 수정했다
            log.debug("알림 동시 수정 감지 - 다시 평가: {}", patternId);
            return reevaluate(patternId);
        } catch (RuntimeException e) {
            log.error("알림 평가 실패 - pattern: {}", patternId, e);
            metricsService.recordAlertEvaluationFailure();
            return Optional.empty();
        }
    }

    private Optional<AlertNotification> reevaluate(String patternId) {
        try {
            return alertService.evaluate(patternId);
        } catch (RuntimeException e) {
            log.error("알림 재평가 실패 - 다음 가져오기에서 다시 평가됩니다. pattern: {}", patternId, e);
            metricsService.recordAlertEvaluationFailure();
            return Optional.empty();
        }
    }

    private int effectiveLimit(Integer limit) {
        int max = properties.getImport().getMaxBatchSize();
        if (limit == null || limit <= 0) {
            return max;
        }
        return Math.min(limit, max);
    }

    private void checkCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("가져오기 취소됨 ({} 단계) - 배치를 저장하지 않습니다", stage);
            throw new ImportCancelledException("가져오기가 " + stage + " 단계에서 취소되었습니다");
        }
    }
}
