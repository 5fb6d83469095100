package com.tenacy.patternpulse.api;

import com.tenacy.patternpulse.api.dto.SuppressionRuleRequest;
import com.tenacy.patternpulse.api.dto.SuppressionRuleResponse;
import com.tenacy.patternpulse.service.AlertSuppressionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/suppression-rules")
@RequiredArgsConstructor
public class SuppressionRuleController {

    private final AlertSuppressionService suppressionService;

    @GetMapping
    public ResponseEntity<List<SuppressionRuleResponse>> getRules(
            @RequestParam(value = "active", required = false) Boolean active) {
        return ResponseEntity.ok(suppressionService.retrieveRules(active));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SuppressionRuleResponse> getRule(@PathVariable String id) {
        return ResponseEntity.ok(suppressionService.retrieveRule(id));
    }

    @PostMapping
    public ResponseEntity<SuppressionRuleResponse> createRule(@RequestBody SuppressionRuleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(suppressionService.createRule(request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<SuppressionRuleResponse> updateRule(@PathVariable String id,
                                                              @RequestBody SuppressionRuleRequest request) {
        return ResponseEntity.ok(suppressionService.updateRule(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteRule(@PathVariable String id) {
        suppressionService.deleteRule(id);
        return ResponseEntity.noContent().build();
    }
}
