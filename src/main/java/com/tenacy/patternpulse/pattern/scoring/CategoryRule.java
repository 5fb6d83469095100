package com.tenacy.patternpulse.pattern.scoring;

import com.tenacy.patternpulse.domain.ErrorCategory;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CategoryRule {

    private List<String> keywords = new ArrayList<>();
    private ErrorCategory category;

    public static CategoryRule of(ErrorCategory category, String... keywords) {
        return new CategoryRule(new ArrayList<>(List.of(keywords)), category);
    }

    public boolean matches(String lowerCaseText) {
        for (String keyword : keywords) {
            if (lowerCaseText.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
