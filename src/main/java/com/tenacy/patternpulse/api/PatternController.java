package com.tenacy.patternpulse.api;

import com.tenacy.patternpulse.api.dto.PatternResponse;
import com.tenacy.patternpulse.api.dto.PatternStatisticsResponse;
import com.tenacy.patternpulse.api.dto.PatternTrendResponse;
import com.tenacy.patternpulse.api.dto.PatternUpdateRequest;
import com.tenacy.patternpulse.domain.PatternPriority;
import com.tenacy.patternpulse.domain.PatternType;
import com.tenacy.patternpulse.service.PatternService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/patterns")
@RequiredArgsConstructor
public class PatternController {

    private final PatternService patternService;

    @GetMapping
    public ResponseEntity<List<PatternResponse>> getPatterns(
            @RequestParam(value = "type", required = false) PatternType type,
            @RequestParam(value = "priority", required = false) PatternPriority priority,
            @RequestParam(value = "minConfidence", required = false) Double minConfidence,
            @RequestParam(value = "timeframeHours", required = false) Integer timeframeHours) {
        return ResponseEntity.ok(patternService.retrievePatterns(type, priority, minConfidence, timeframeHours));
    }

    @GetMapping("/statistics")
    public ResponseEntity<PatternStatisticsResponse> getStatistics(
            @RequestParam(value = "timeframeHours", defaultValue = "24") int timeframeHours) {
        return ResponseEntity.ok(patternService.statistics(timeframeHours));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PatternResponse> getPattern(@PathVariable String id) {
        return ResponseEntity.ok(patternService.retrievePattern(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<PatternResponse> updatePattern(@PathVariable String id,
                                                         @RequestBody PatternUpdateRequest request) {
        return ResponseEntity.ok(patternService.updatePattern(id, request));
    }

    @GetMapping("/{id}/trend")
    public ResponseEntity<PatternTrendResponse> getTrend(@PathVariable String id) {
        return ResponseEntity.ok(patternService.retrieveTrend(id));
    }
}
