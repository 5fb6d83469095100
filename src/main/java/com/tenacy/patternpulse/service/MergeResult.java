package com.tenacy.patternpulse.service;

import lombok.Value;

@Value
public class MergeResult {
    String patternId;
    boolean created;
    boolean reopened;
}
