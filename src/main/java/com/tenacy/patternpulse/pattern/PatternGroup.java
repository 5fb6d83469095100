package com.tenacy.patternpulse.pattern;

import com.tenacy.patternpulse.domain.SourceKind;
import com.tenacy.patternpulse.ingest.ErrorFact;
import lombok.Getter;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 한 배치 안에서 같은 {@link PatternKey}를 가진 팩트들의 집계.
 */
@Getter
public class PatternGroup {

    private final PatternKey key;
    private final SourceKind sourceKind;

    private int count;
    private LocalDateTime firstOccurrence;
    private LocalDateTime lastOccurrence;
    private final Set<String> applications = new LinkedHashSet<>();
    private final Set<String> components = new LinkedHashSet<>();
    private final Set<String> messages = new LinkedHashSet<>();
    private String longestMessage = "";
    private String firstStackTrace;

    // 시간 단위 버킷별 발생 수. 타임스탬프를 읽지 못한 팩트는 포함하지 않는다
    private final Map<LocalDateTime, Integer> hourlyCounts = new TreeMap<>();

    PatternGroup(PatternKey key, SourceKind sourceKind) {
        this.key = key;
        this.sourceKind = sourceKind;
    }

    void add(ErrorFact fact) {
        count++;

        LocalDateTime timestamp = fact.getTimestamp();
        if (fact.hasReadableTimestamp()) {
            // 센티널 값만 있던 그룹에 실제 시각이 들어오면 교체
            if (firstOccurrence == null || firstOccurrence.equals(ErrorFact.MIN_TIMESTAMP) || timestamp.isBefore(firstOccurrence)) {
                firstOccurrence = timestamp;
            }
            if (lastOccurrence == null || timestamp.isAfter(lastOccurrence)) {
                lastOccurrence = timestamp;
            }
            hourlyCounts.merge(timestamp.truncatedTo(ChronoUnit.HOURS), 1, Integer::sum);
        } else {
            if (firstOccurrence == null) {
                firstOccurrence = ErrorFact.MIN_TIMESTAMP;
            }
            if (lastOccurrence == null) {
                lastOccurrence = ErrorFact.MIN_TIMESTAMP;
            }
        }

        addIfPresent(applications, fact.getApplicationName());
        addIfPresent(components, fact.getComponentName());

        String message = fact.getMessage() == null ? "" : fact.getMessage();
        messages.add(message);
        if (message.length() > longestMessage.length()) {
            longestMessage = message;
        }
        if (firstStackTrace == null && fact.getStackTrace() != null) {
            firstStackTrace = fact.getStackTrace();
        }
    }

    public Map<LocalDateTime, Integer> getHourlyCounts() {
        return Collections.unmodifiableMap(hourlyCounts);
    }

    public int getUniqueMessageCount() {
        return messages.size();
    }

    public double getTimespanHours() {
        if (firstOccurrence == null || lastOccurrence == null) {
            return 0;
        }
        return ChronoUnit.MILLIS.between(firstOccurrence, lastOccurrence) / 3_600_000.0;
    }

    private static void addIfPresent(Set<String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.add(value);
        }
    }
}
