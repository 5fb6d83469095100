package com.tenacy.patternpulse.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * APM NRQL 응답 봉투(data.actor.account.nrql.results)에서 결과 행을 꺼낸다.
 * 형태가 맞지 않으면 {@link MalformedImportRequestException}.
 */
@Component
public class ApmResponseDecoder {

    private static final String[] RESULTS_PATH = {"data", "actor", "account", "nrql", "results"};

    public List<JsonNode> decode(JsonNode response) {
        if (response == null || !response.isObject()) {
            throw new MalformedImportRequestException("APM 응답은 JSON 객체여야 합니다");
        }

        JsonNode current = response;
        StringBuilder path = new StringBuilder();
        for (String segment : RESULTS_PATH) {
            path.append(path.length() == 0 ? "" : ".").append(segment);
            current = current.get(segment);
            if (current == null || current.isNull()) {
                throw new MalformedImportRequestException("APM 응답에 " + path + " 경로가 없습니다");
            }
        }

        if (!current.isArray()) {
            throw new MalformedImportRequestException("APM 응답의 results가 배열이 아닙니다");
        }

        List<JsonNode> rows = new ArrayList<>(current.size());
        for (int i = 0; i < current.size(); i++) {
            JsonNode row = current.get(i);
            if (!row.isObject()) {
                throw new MalformedImportRequestException("APM 결과 " + i + "번째 항목이 객체가 아닙니다");
            }
            rows.add(row);
        }
        return rows;
    }
}
