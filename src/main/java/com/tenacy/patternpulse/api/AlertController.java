package com.tenacy.patternpulse.api;

import com.tenacy.patternpulse.api.dto.AlertActionRequest;
import com.tenacy.patternpulse.api.dto.AlertResponse;
import com.tenacy.patternpulse.api.dto.AlertStatisticsResponse;
import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.AlertStatus;
import com.tenacy.patternpulse.service.AlertService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertService alertService;

    @GetMapping
    public ResponseEntity<List<AlertResponse>> getAlerts(
            @RequestParam(value = "status", required = false) AlertStatus status,
            @RequestParam(value = "severity", required = false) AlertSeverity severity) {
        return ResponseEntity.ok(alertService.retrieveAlerts(status, severity));
    }

    @GetMapping("/statistics")
    public ResponseEntity<AlertStatisticsResponse> getStatistics(
            @RequestParam(value = "timeframeHours", defaultValue = "24") int timeframeHours) {
        return ResponseEntity.ok(alertService.statistics(timeframeHours));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AlertResponse> getAlert(@PathVariable String id) {
        return ResponseEntity.ok(alertService.retrieveAlert(id));
    }

    @PostMapping("/{id}/acknowledge")
    public ResponseEntity<AlertResponse> acknowledge(@PathVariable String id,
                                                     @RequestBody(required = false) AlertActionRequest request) {
        String actor = request != null ? request.getActor() : null;
        return ResponseEntity.ok(alertService.acknowledge(id, actor));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<AlertResponse> resolve(@PathVariable String id,
                                                 @RequestBody(required = false) AlertActionRequest request) {
        String actor = request != null ? request.getActor() : null;
        String notes = request != null ? request.getNotes() : null;
        return ResponseEntity.ok(alertService.resolve(id, actor, notes));
    }
}
