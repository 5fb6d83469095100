package com.tenacy.patternpulse.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenacy.patternpulse.api.dto.ImportRequest;
import com.tenacy.patternpulse.api.dto.ImportResponse;
import com.tenacy.patternpulse.domain.SourceKind;
import com.tenacy.patternpulse.ingest.ApmResponseDecoder;
import com.tenacy.patternpulse.service.ErrorImportService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/imports")
@RequiredArgsConstructor
public class ErrorImportController {

    private final ErrorImportService importService;
    private final ApmResponseDecoder apmResponseDecoder;

    @PostMapping
    public ResponseEntity<ImportResponse> importRows(@RequestBody ImportRequest request) {
        SourceKind source = SourceKind.from(request.getSource());
        return ResponseEntity.ok(importService.importRows(
                source, request.getRows(), request.getSince(), request.getLimit()));
    }

    @PostMapping("/apm-response")
    public ResponseEntity<ImportResponse> importApmResponse(
            @RequestBody JsonNode response,
            @RequestParam(value = "since", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime since,
            @RequestParam(value = "limit", required = false) Integer limit) {
        List<JsonNode> rows = apmResponseDecoder.decode(response);
        return ResponseEntity.ok(importService.importRows(SourceKind.APM, rows, since, limit));
    }
}
