package com.tenacy.patternpulse.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportRequest {
    private String source;
    private LocalDateTime since;
    private Integer limit;
    @Builder.Default
    private List<JsonNode> rows = new ArrayList<>();
}
