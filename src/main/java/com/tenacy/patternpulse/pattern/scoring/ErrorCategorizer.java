package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.config.PatternPulseProperties;
import com.tenacy.patternpulse.domain.ErrorCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class ErrorCategorizer {

    private final PatternPulseProperties properties;

    public ErrorCategory categorize(String exceptionType, String message) {
        String text = ((exceptionType == null ? "" : exceptionType) + " " + (message == null ? "" : message))
                .toLowerCase(Locale.ROOT);

        for (CategoryRule rule : properties.getScoring().getCategoryRules()) {
            if (rule.matches(text)) {
                return rule.getCategory();
            }
        }
        return ErrorCategory.UNKNOWN;
    }
}
