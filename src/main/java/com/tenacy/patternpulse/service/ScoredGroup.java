package com.tenacy.patternpulse.service;

import com.tenacy.patternpulse.pattern.PatternGroup;
import com.tenacy.patternpulse.pattern.scoring.PatternScore;
import lombok.Value;

@Value
public class ScoredGroup {
    PatternGroup group;
    PatternScore score;
}
