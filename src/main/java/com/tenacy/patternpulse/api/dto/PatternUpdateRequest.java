package com.tenacy.patternpulse.api.dto;

import com.tenacy.patternpulse.domain.PatternPriority;
import com.tenacy.patternpulse.domain.PatternStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * null 필드는 변경하지 않는다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternUpdateRequest {
    private String name;
    private String description;
    private PatternPriority priority;
    private PatternStatus status;
    private String assignedTo;
    private String resolutionNotes;
}
