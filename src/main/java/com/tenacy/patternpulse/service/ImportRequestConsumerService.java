package com.tenacy.patternpulse.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.patternpulse.api.dto.ImportRequest;
import com.tenacy.patternpulse.api.dto.ImportResponse;
import com.tenacy.patternpulse.domain.SourceKind;
import com.tenacy.patternpulse.ingest.MalformedImportRequestException;
import com.tenacy.patternpulse.ingest.UnsupportedSourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Kafka로 들어오는 가져오기 요청 처리. patternpulse.kafka.listener-enabled=true 일 때만 시작한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportRequestConsumerService {

    private final ErrorImportService importService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            id = "import-request-listener",
            topics = "${patternpulse.kafka.topics.import-requests}",
            groupId = "${spring.kafka.consumer.group-id:patternpulse}",
            autoStartup = "${patternpulse.kafka.listener-enabled:false}"
    )
    public void consumeImportRequest(String message) {
        ImportRequest request;
        try {
            request = objectMapper.readValue(message, ImportRequest.class);
        } catch (JsonProcessingException e) {
            log.error("가져오기 요청 역직렬화 실패: {}", message, e);
            return;
        }

        try {
            ImportResponse response = importService.importRows(
                    SourceKind.from(request.getSource()), request.getRows(), request.getSince(), request.getLimit());
            log.debug("Kafka 가져오기 처리 완료 - 팩트: {}", response.getFactsImported());
        } catch (UnsupportedSourceException | MalformedImportRequestException e) {
            // 재시도해도 결과가 같으므로 버린다
            log.error("잘못된 가져오기 요청 폐기: {}", e.getMessage());
        }
    }
}
