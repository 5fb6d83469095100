package com.tenacy.patternpulse.pattern.scoring;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * 소문자로 바꾼 텍스트에 keyword가 포함되면 value를 돌려주는 규칙.
 * 매출 영향 기준값 테이블에 쓰인다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class KeywordRule {

    private String keyword;
    private double value;

    public boolean matches(String lowerCaseText) {
        return keyword != null && lowerCaseText.contains(keyword.toLowerCase(Locale.ROOT));
    }
}
