package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.PatternPriority;
import com.tenacy.patternpulse.domain.SourceKind;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * APM 에러 이벤트의 스코어링. 메시지가 구체적일수록 신뢰도가 올라간다.
 */
@Component
public class ApmProfileScorer extends AbstractPatternScorer {

    private final PatternPulseProperties.Scoring.Apm settings;

    public ApmProfileScorer(PatternPulseProperties properties) {
        this.settings = properties.getScoring().getApm();
    }

    @Override
    public SourceKind source() {
        return SourceKind.APM;
    }

    @Override
    protected double confidence(ScoringInput input) {
        if (input.getOccurrenceCount() <= 0) {
            return 0;
        }
        double base = Math.min(0.9, input.getOccurrenceCount() / 100.0 + 0.5);
        double messageSpecificity = Math.min(0.3, input.getMessageLength() / 200.0);
        return Math.min(MAX_CONFIDENCE, base + messageSpecificity);
    }

    @Override
    protected PatternPriority priority(ScoringInput input) {
        return evaluate(settings.getPriorityRules(), settings.getDefaultPriority(), input);
    }

    @Override
    protected int userImpact(ScoringInput input) {
        return (int) Math.round(input.getOccurrenceCount() * settings.getUserImpactMultiplier());
    }

    @Override
    protected double revenueImpact(ScoringInput input) {
        String exceptionType = input.getExceptionType() == null ? "" : input.getExceptionType().toLowerCase(Locale.ROOT);
        double baseImpact = settings.getDefaultRevenueBaseImpact();
        for (KeywordRule rule : settings.getRevenueKeywords()) {
            if (rule.matches(exceptionType)) {
                baseImpact = rule.getValue();
                break;
            }
        }
        return input.getOccurrenceCount() * baseImpact;
    }

    @Override
    protected double csat(int count) {
        return Math.max(1.0, 5.0 - count / 20.0);
    }

    @Override
    protected double serviceLevelImpact(int count) {
        return Math.min(100.0, count * 0.5);
    }
}
