package com.tenacy.patternpulse.service;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.AlertStatus;
import com.tenacy.patternpulse.domain.ErrorPattern;
import com.tenacy.patternpulse.domain.PatternAlert;
import com.tenacy.patternpulse.domain.PatternAlertRepository;
import com.tenacy.patternpulse.domain.PatternOccurrenceBucketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * 보존 정리: 비활성 패턴의 미해결 알림 자동 해결, 오래된 패턴 보관, 오래된 버킷 삭제.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternRetentionService {

    static final String AUTO_RESOLVE_NOTES = "패턴이 보존 기간 동안 재발하지 않아 자동 해결됨";

    private final PatternService patternService;
    private final AlertService alertService;
    private final PatternAlertRepository alertRepository;
    private final PatternOccurrenceBucketRepository bucketRepository;
    private final PatternPulseProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${patternpulse.retention.cron:0 30 * * * *}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("보존 정리 실패: {}", e.getMessage(), e);
        }
    }

    public RetentionResult sweep() {
        LocalDateTime now = LocalDateTime.now(clock);
        PatternPulseProperties.Retention settings = properties.getRetention();

        int resolvedAlerts = resolveInactiveAlerts(now.minus(settings.getAlertInactivity()));
        int archivedPatterns = archiveInactivePatterns(now.minus(settings.getPatternInactivity()));
        int deletedBuckets = bucketRepository.deleteOlderThan(now.minus(settings.getBucketRetention()));

        log.info("보존 정리 완료 - 자동 해결 알림: {}, 보관 패턴: {}, 삭제 버킷: {}",
                resolvedAlerts, archivedPatterns, deletedBuckets);
        return new RetentionResult(resolvedAlerts, archivedPatterns, deletedBuckets);
    }

    private int resolveInactiveAlerts(LocalDateTime threshold) {
        List<PatternAlert> candidates = alertRepository.findByStatusIn(
                EnumSet.of(AlertStatus.ACTIVE, AlertStatus.ACKNOWLEDGED));

        int resolved = 0;
        for (PatternAlert alert : candidates) {
            try {
                if (patternService.isInactiveSince(alert.getPatternId(), threshold)
                        && alertService.autoResolve(alert.getId(), AUTO_RESOLVE_NOTES)) {
                    resolved++;
                }
            } catch (OptimisticLockingFailureException e) {
                log.debug("동시 수정으로 이번 주기에서 제외: {}", alert.getId());
            } catch (Exception e) {
                log.error("알림 자동 해결 실패 - {}: {}", alert.getId(), e.getMessage(), e);
            }
        }
        return resolved;
    }

    private int archiveInactivePatterns(LocalDateTime threshold) {
        int archived = 0;
        for (ErrorPattern pattern : patternService.findInactivePatterns(threshold)) {
            try {
                if (patternService.archiveIfInactive(pattern.getId(), threshold)) {
                    archived++;
                }
            } catch (OptimisticLockingFailureException e) {
                log.debug("동시 수정으로 이번 주기에서 제외: {}", pattern.getId());
            } catch (Exception e) {
                log.error("패턴 보관 실패 - {}: {}", pattern.getId(), e.getMessage(), e);
            }
        }
        return archived;
    }
}
