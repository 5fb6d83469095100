package com.tenacy.patternpulse.service;

import com.tenacy.patternpulse.domain.ErrorPattern;
import com.tenacy.patternpulse.domain.ErrorPatternRepository;
import com.tenacy.patternpulse.domain.PatternOccurrenceBucket;
import com.tenacy.patternpulse.domain.PatternOccurrenceBucketRepository;
import com.tenacy.patternpulse.domain.PatternStatus;
import com.tenacy.patternpulse.ingest.ErrorFact;
import com.tenacy.patternpulse.pattern.PatternGroup;
import com.tenacy.patternpulse.pattern.PatternKey;
import com.tenacy.patternpulse.pattern.Signatures;
import com.tenacy.patternpulse.pattern.scoring.ErrorCategorizer;
import com.tenacy.patternpulse.pattern.scoring.PatternScore;
import com.tenacy.patternpulse.pattern.scoring.PatternScoringService;
import com.tenacy.patternpulse.pattern.scoring.ScoringInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 배치 그룹을 영속 패턴에 병합한다. 배치 전체가 하나의 트랜잭션이다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternMergeService {

    // 고유 메시지 수 추적용 해시 상한
    static final int MAX_MESSAGE_HASHES = 1000;

    private final ErrorPatternRepository patternRepository;
    private final PatternOccurrenceBucketRepository bucketRepository;
    private final PatternScoringService scoringService;
    private final ErrorCategorizer categorizer;
    private final Clock clock;

    @Transactional
    public List<MergeResult> merge(List<ScoredGroup> scoredGroups) {
        if (scoredGroups.isEmpty()) {
            return List.of();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Set<String> signatures = scoredGroups.stream()
                .map(sg -> sg.getGroup().getKey().signature())
                .collect(Collectors.toSet());
        Map<String, ErrorPattern> existing = patternRepository.findBySignatureIn(signatures).stream()
                .collect(Collectors.toMap(ErrorPattern::getSignature, Function.identity()));

        List<MergeResult> results = new ArrayList<>(scoredGroups.size());
        for (ScoredGroup scoredGroup : scoredGroups) {
            PatternGroup group = scoredGroup.getGroup();
            String signature = group.getKey().signature();
            ErrorPattern pattern = existing.get(signature);

            MergeResult result;
            if (pattern == null) {
                pattern = create(group, signature, scoredGroup.getScore(), now);
                existing.put(signature, pattern);
                result = new MergeResult(pattern.getId(), true, false);
            } else {
                boolean reopened = pattern.getStatus().isClosed();
                if (reopened) {
                    reopen(pattern);
                }
                absorb(pattern, group);
                applyScore(pattern, scoringService.score(ScoringInput.of(pattern)));
                result = new MergeResult(pattern.getId(), false, reopened);
            }

            patternRepository.save(pattern);
            recordBuckets(pattern.getId(), group);
            results.add(result);
        }

        log.info("패턴 병합 완료 - 그룹: {}, 신규: {}", scoredGroups.size(),
                results.stream().filter(MergeResult::isCreated).count());
        return results;
    }

    private ErrorPattern create(PatternGroup group, String signature, PatternScore score, LocalDateTime now) {
        PatternKey key = group.getKey();
        ErrorPattern pattern = ErrorPattern.builder()
                .id(UUID.randomUUID().toString())
                .signature(signature)
                .severityLabel(key.getSeverityLabel())
                .exceptionType(key.getExceptionType())
                .applicationName(key.getApplicationName())
                .componentName(key.getComponentName())
                .sourceKind(group.getSourceKind())
                .name(displayName(key))
                .status(PatternStatus.ACTIVE)
                .createdAt(now)
                .build();

        pattern.getTags().add(group.getSourceKind().getTag());
        addTag(pattern, key.getApplicationName());
        addTag(pattern, key.getSeverityLabel());
        addTag(pattern, key.getExceptionType());

        absorb(pattern, group);
        applyScore(pattern, score);
        log.debug("새 패턴 생성: {} ({})", pattern.getName(), pattern.getId());
        return pattern;
    }

    // 종료된 패턴이 재발하면 카운트를 초기화하고 다시 연다
    private void reopen(ErrorPattern pattern) {
        log.info("종료된 패턴 재발 - 다시 활성화: {} ({})", pattern.getName(), pattern.getStatus());
        pattern.setStatus(PatternStatus.ACTIVE);
        pattern.setOccurrenceCount(0);
        pattern.setFirstOccurrence(null);
        pattern.setLastOccurrence(null);
        pattern.getMessageHashes().clear();
        pattern.setUniqueMessageCount(0);
    }

    private void absorb(ErrorPattern pattern, PatternGroup group) {
        pattern.setOccurrenceCount(pattern.getOccurrenceCount() + group.getCount());
        pattern.setFirstOccurrence(earliest(pattern.getFirstOccurrence(), group.getFirstOccurrence()));
        pattern.setLastOccurrence(latest(pattern.getLastOccurrence(), group.getLastOccurrence()));

        pattern.getAffectedServices().addAll(group.getApplications());
        pattern.getAffectedComponents().addAll(group.getComponents());

        for (String message : group.getMessages()) {
            if (pattern.getMessageHashes().size() >= MAX_MESSAGE_HASHES) {
                break;
            }
            pattern.getMessageHashes().add(Signatures.sha256Hex(message));
        }
        pattern.setUniqueMessageCount(Math.max(1, pattern.getMessageHashes().size()));

        String longest = group.getLongestMessage();
        if (pattern.getDescription() == null || longest.length() > pattern.getLongestMessageLength()) {
            pattern.setDescription(longest);
            pattern.setLongestMessageLength(longest.length());
        }
        if (pattern.getSampleStackTrace() == null) {
            pattern.setSampleStackTrace(group.getFirstStackTrace());
        }
        pattern.setCategory(categorizer.categorize(pattern.getExceptionType(), pattern.getDescription()));
    }

    private void applyScore(ErrorPattern pattern, PatternScore score) {
        pattern.setConfidence(score.getConfidence());
        pattern.setPriority(score.getPriority());
        pattern.setAffectedUsers(score.getAffectedUsers());
        pattern.setOccurrenceRate(score.getOccurrenceRate());
        pattern.setBusinessImpact(score.toBusinessImpact());
    }

    private void recordBuckets(String patternId, PatternGroup group) {
        for (Map.Entry<LocalDateTime, Integer> bucket : group.getHourlyCounts().entrySet()) {
            int updated = bucketRepository.incrementOccurrences(patternId, bucket.getKey(), bucket.getValue());
            if (updated == 0) {
                bucketRepository.save(PatternOccurrenceBucket.builder()
                        .patternId(patternId)
                        .bucketStart(bucket.getKey())
                        .occurrences(bucket.getValue())
                        .build());
            }
        }
    }

    static String displayName(PatternKey key) {
        String where = StringUtils.hasText(key.getApplicationName()) ? key.getApplicationName() : key.getComponentName();
        return StringUtils.hasText(where) ? key.getExceptionType() + " in " + where : key.getExceptionType();
    }

    private static void addTag(ErrorPattern pattern, String value) {
        if (StringUtils.hasText(value)) {
            pattern.getTags().add(value);
        }
    }

    // 센티널 타임스탬프는 실제 시각이 있으면 무시한다
    static LocalDateTime earliest(LocalDateTime current, LocalDateTime candidate) {
        if (current == null || ErrorFact.MIN_TIMESTAMP.equals(current)) {
            return candidate != null ? candidate : current;
        }
        if (candidate == null || ErrorFact.MIN_TIMESTAMP.equals(candidate)) {
            return current;
        }
        return candidate.isBefore(current) ? candidate : current;
    }

    static LocalDateTime latest(LocalDateTime current, LocalDateTime candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate == null) {
            return current;
        }
        return candidate.isAfter(current) ? candidate : current;
    }
}
