package com.tenacy.patternpulse.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportResponse {
    private String source;
    private int rowsReceived;
    private int factsImported;
    private int patternsCreated;
    private int patternsUpdated;
    private int alertsRaised;
    private List<String> patternIds;
}
