package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.PatternPriority;
import com.tenacy.patternpulse.domain.SourceKind;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * 데이터베이스 로그 테이블에서 가져온 행의 스코어링.
 */
@Component
public class DatabaseProfileScorer extends AbstractPatternScorer {

    private final PatternPulseProperties.Scoring.Database settings;

    public DatabaseProfileScorer(PatternPulseProperties properties) {
        this.settings = properties.getScoring().getDatabase();
    }

    @Override
    public SourceKind source() {
        return SourceKind.DATABASE;
    }

    @Override
    protected double confidence(ScoringInput input) {
        int count = input.getOccurrenceCount();
        if (count <= 0) {
            return 0;
        }
        int unique = input.getUniqueMessageCount();

        double base = Math.min(0.9, count / 20.0 + 0.3);
        double consistencyBonus = unique == 1 ? 0.2 : Math.max(0, 0.2 - (double) unique / count);
        double frequencyBonus = input.getTimespanHours() > 0 && count / input.getTimespanHours() > 1 ? 0.1 : 0;

        return Math.min(MAX_CONFIDENCE, base + consistencyBonus + frequencyBonus);
    }

    @Override
    protected PatternPriority priority(ScoringInput input) {
        return evaluate(settings.getPriorityRules(), settings.getDefaultPriority(), input);
    }

    @Override
    protected int userImpact(ScoringInput input) {
        double multiplier = lookup(settings.getUserImpactMultipliers(), input.getSeverityLabel(),
                settings.getDefaultUserImpactMultiplier());
        return (int) Math.floor(input.getOccurrenceCount() * multiplier);
    }

    @Override
    protected double revenueImpact(ScoringInput input) {
        return input.getOccurrenceCount() * lookup(settings.getRevenueBaseImpacts(), input.getSeverityLabel(),
                settings.getDefaultRevenueBaseImpact());
    }

    @Override
    protected double csat(int count) {
        return Math.max(1.0, 5.0 - count / 30.0);
    }

    @Override
    protected double serviceLevelImpact(int count) {
        return Math.min(100.0, count * 0.3);
    }

    private static double lookup(Map<String, Double> table, String severityLabel, double fallback) {
        if (severityLabel == null) {
            return fallback;
        }
        Double value = table.get(severityLabel.toLowerCase(Locale.ROOT));
        return value != null ? value : fallback;
    }
}
