package com.tenacy.patternpulse.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenacy.patternpulse.api.dto.ImportRequest;
import com.tenacy.patternpulse.api.dto.SuppressionConditionDto;
import com.tenacy.patternpulse.api.dto.SuppressionRuleRequest;
import com.tenacy.patternpulse.domain.ErrorPatternRepository;
import com.tenacy.patternpulse.domain.PatternAlert;
import com.tenacy.patternpulse.domain.PatternAlertRepository;
import com.tenacy.patternpulse.domain.PatternOccurrenceBucketRepository;
import com.tenacy.patternpulse.domain.SuppressionOperator;
import com.tenacy.patternpulse.domain.SuppressionRuleRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class PatternPulseApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PatternAlertRepository alertRepository;

    @Autowired
    private ErrorPatternRepository patternRepository;

    @Autowired
    private PatternOccurrenceBucketRepository bucketRepository;

    @Autowired
    private SuppressionRuleRepository ruleRepository;

    @AfterEach
    void tearDown() {
        alertRepository.deleteAll();
        bucketRepository.deleteAll();
        patternRepository.deleteAll();
        ruleRepository.deleteAll();
    }

    @Test
    @DisplayName("가져오기 API - 반복 오류는 패턴과 CRITICAL 알림을 만든다")
    void importCreatesPatternAndAlert() throws Exception {
        // given
        ImportRequest request = ImportRequest.builder()
                .source("database")
                .rows(timeoutRows())
                .build();

        // when & then
        mockMvc.perform(post("/api/v1/imports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source", is("DATABASE")))
                .andExpect(jsonPath("$.factsImported", is(12)))
                .andExpect(jsonPath("$.patternsCreated", is(1)))
                .andExpect(jsonPath("$.alertsRaised", is(1)));

        assertThat(patternRepository.findAll()).hasSize(1);
        List<PatternAlert> alerts = alertRepository.findAll();
        assertThat(alerts).hasSize(1);

        mockMvc.perform(get("/api/v1/alerts").param("status", "ACTIVE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].severity", is("CRITICAL")))
                .andExpect(jsonPath("$[0].triggerCount", is(1)));
    }

    @Test
    @DisplayName("같은 행을 다시 가져오면 새 알림 없이 기존 알림을 재트리거한다")
    void reimportRetriggersOpenAlert() throws Exception {
        // given
        String body = objectMapper.writeValueAsString(ImportRequest.builder()
                .source("database")
                .rows(timeoutRows())
                .build());
        mockMvc.perform(post("/api/v1/imports").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());

        // when & then
        mockMvc.perform(post("/api/v1/imports").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.patternsCreated", is(0)))
                .andExpect(jsonPath("$.patternsUpdated", is(1)));

        List<PatternAlert> alerts = alertRepository.findAll();
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getTriggerCount()).isEqualTo(2);
        assertThat(patternRepository.findAll().get(0).getOccurrenceCount()).isEqualTo(24);
    }

    @Test
    @DisplayName("알림 확인 API - 두 번째 확인은 409를 반환한다")
    void acknowledgeTwiceIsConflict() throws Exception {
        // given
        mockMvc.perform(post("/api/v1/imports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(ImportRequest.builder()
                                .source("database")
                                .rows(timeoutRows())
                                .build())))
                .andExpect(status().isOk());
        String alertId = alertRepository.findAll().get(0).getId();

        // when & then
        mockMvc.perform(post("/api/v1/alerts/{id}/acknowledge", alertId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"oncall\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ACKNOWLEDGED")))
                .andExpect(jsonPath("$.acknowledgedBy", is("oncall")));

        mockMvc.perform(post("/api/v1/alerts/{id}/acknowledge", alertId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"oncall\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("지원하지 않는 소스는 400을 반환한다")
    void unsupportedSourceIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/imports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"splunk\",\"rows\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status", is(400)));
    }

    @Test
    @DisplayName("존재하지 않는 알림과 패턴은 404를 반환한다")
    void missingResourcesAreNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/alerts/{id}", "missing"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/patterns/{id}", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("억제 규칙 생성 API - 201과 함께 규칙을 반환한다")
    void createSuppressionRule() throws Exception {
        // given
        SuppressionRuleRequest request = SuppressionRuleRequest.builder()
                .name("orders maintenance")
                .conditions(List.of(new SuppressionConditionDto("application", SuppressionOperator.EQUALS, "Orders")))
                .suppressForMinutes(30L)
                .build();

        // when & then
        mockMvc.perform(post("/api/v1/suppression-rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name", is("orders maintenance")))
                .andExpect(jsonPath("$.active", is(true)))
                .andExpect(jsonPath("$.conditions", hasSize(1)))
                .andExpect(jsonPath("$.suppressForMinutes", is(30)));

        assertThat(ruleRepository.findAll()).hasSize(1);
    }

    private List<JsonNode> timeoutRows() {
        LocalDateTime start = LocalDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.HOURS).minusHours(2);
        List<JsonNode> rows = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            LocalDateTime at = i == 11 ? start.plusHours(2) : start.plusMinutes(i * 10L);
            ObjectNode row = objectMapper.createObjectNode();
            row.put("TimeStamp", at.toString());
            row.put("LogLevel", "Error");
            row.put("Message", "The operation has timed out");
            row.put("Exception", "System.TimeoutException: The operation has timed out");
            row.put("Application", "Orders");
            row.put("Logger", "Orders.Api.OrderController");
            rows.add(row);
        }
        return rows;
    }
}
