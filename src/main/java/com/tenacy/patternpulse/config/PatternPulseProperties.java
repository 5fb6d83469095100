package com.tenacy.patternpulse.config;

import com.tenacy.patternpulse.alert.AlertThresholdRule;
import com.tenacy.patternpulse.domain.AlertSeverity;
import com.tenacy.patternpulse.domain.ErrorCategory;
import com.tenacy.patternpulse.domain.PatternPriority;
import com.tenacy.patternpulse.pattern.scoring.CategoryRule;
import com.tenacy.patternpulse.pattern.scoring.KeywordRule;
import com.tenacy.patternpulse.pattern.scoring.PriorityRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * patternpulse.* 설정. 규칙 테이블은 리스트 순서대로 평가되며 처음 일치한 항목이 적용된다.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "patternpulse")
public class PatternPulseProperties {

    private final Import importing = new Import();
    private final Scoring scoring = new Scoring();
    private final Trend trend = new Trend();
    private final Alerting alerting = new Alerting();
    private final Escalation escalation = new Escalation();
    private final Retention retention = new Retention();
    private final Notification notification = new Notification();

    // "import"는 자바 예약어라 getter 이름을 따로 둔다
    public Import getImport() {
        return importing;
    }

    @Data
    public static class Import {
        private int maxBatchSize = 5000;
    }

    @Data
    public static class Scoring {
        private final Database database = new Database();
        private final Apm apm = new Apm();

        private List<CategoryRule> categoryRules = new ArrayList<>(List.of(
                CategoryRule.of(ErrorCategory.PERFORMANCE, "timeout", "slow"),
                CategoryRule.of(ErrorCategory.INFRASTRUCTURE, "connection", "network"),
                CategoryRule.of(ErrorCategory.SECURITY, "unauthorized", "forbidden"),
                CategoryRule.of(ErrorCategory.BUSINESS_LOGIC, "validation", "invalid"),
                CategoryRule.of(ErrorCategory.APPLICATION_LOGIC, "null", "reference"),
                CategoryRule.of(ErrorCategory.DATA_QUALITY, "format", "parse"),
                CategoryRule.of(ErrorCategory.DATA_ACCESS, "sql", "database")
        ));

        @Data
        public static class Database {
            private List<PriorityRule> priorityRules = new ArrayList<>(List.of(
                    PriorityRule.of("fatal", null, PatternPriority.CRITICAL),
                    PriorityRule.of("error", 10, PatternPriority.CRITICAL),
                    PriorityRule.of("error", null, PatternPriority.HIGH),
                    PriorityRule.of("warn", 50, PatternPriority.HIGH),
                    PriorityRule.of("warn", 10, PatternPriority.MEDIUM)
            ));
            private PatternPriority defaultPriority = PatternPriority.LOW;

            private Map<String, Double> userImpactMultipliers = new HashMap<>(Map.of(
                    "fatal", 5.0, "error", 2.0, "warn", 0.5));
            private double defaultUserImpactMultiplier = 0.1;

            private Map<String, Double> revenueBaseImpacts = new HashMap<>(Map.of(
                    "fatal", 500.0, "error", 100.0, "warn", 25.0));
            private double defaultRevenueBaseImpact = 5.0;
        }

        @Data
        public static class Apm {
            private List<PriorityRule> priorityRules = new ArrayList<>(List.of(
                    PriorityRule.of(null, 50, PatternPriority.CRITICAL),
                    PriorityRule.typeContains("Critical", PatternPriority.CRITICAL),
                    PriorityRule.of(null, 20, PatternPriority.HIGH),
                    PriorityRule.typeContains("Error", PatternPriority.HIGH),
                    PriorityRule.of(null, 5, PatternPriority.MEDIUM)
            ));
            private PatternPriority defaultPriority = PatternPriority.LOW;

            private double userImpactMultiplier = 1.5;

            private List<KeywordRule> revenueKeywords = new ArrayList<>(List.of(
                    new KeywordRule("payment", 100.0),
                    new KeywordRule("checkout", 75.0),
                    new KeywordRule("login", 25.0),
                    new KeywordRule("api", 50.0)
            ));
            private double defaultRevenueBaseImpact = 10.0;
        }
    }

    @Data
    public static class Trend {
        /** 1시간 버킷 개수 */
        private int windowBuckets = 24;
        private double slopeThreshold = 0.1;
        private double accelerationMargin = 0.2;
        private Duration forecastPeriod = Duration.ofHours(24);
        private Duration persistentThreshold = Duration.ofHours(24);
        private double correlationThreshold = 0.7;
        /** 분석 대상: 마지막 발생이 이 기간 안에 있는 패턴 */
        private Duration analysisLookback = Duration.ofDays(7);
    }

    @Data
    public static class Alerting {
        private List<AlertThresholdRule> thresholds = new ArrayList<>(List.of(
                new AlertThresholdRule(AlertSeverity.EMERGENCY, PatternPriority.CRITICAL, 0.9, 100),
                new AlertThresholdRule(AlertSeverity.CRITICAL, PatternPriority.CRITICAL, 0.7, 10),
                new AlertThresholdRule(AlertSeverity.WARNING, PatternPriority.HIGH, 0.6, 5),
                new AlertThresholdRule(AlertSeverity.INFO, PatternPriority.MEDIUM, 0.5, 3)
        ));
        private Duration defaultSuppressionWindow = Duration.ofHours(1);
        private String dashboardBaseUrl = "http://localhost:8080/dashboard/alerts";
    }

    @Data
    public static class Escalation {
        private Map<AlertSeverity, Duration> timeouts = new EnumMap<>(Map.of(
                AlertSeverity.EMERGENCY, Duration.ofMinutes(5),
                AlertSeverity.CRITICAL, Duration.ofMinutes(15),
                AlertSeverity.WARNING, Duration.ofHours(2),
                AlertSeverity.INFO, Duration.ofHours(8)));
        private int maxLevel = 3;
    }

    @Data
    public static class Retention {
        /** 패턴이 이 기간 동안 재발하지 않으면 미해결 알림을 자동 해결 */
        private Duration alertInactivity = Duration.ofHours(24);
        /** 패턴이 이 기간 동안 재발하지 않으면 ARCHIVED */
        private Duration patternInactivity = Duration.ofDays(7);
        /** 발생 버킷 보존 기간 */
        private Duration bucketRetention = Duration.ofDays(30);
    }

    @Data
    public static class Notification {
        private boolean emailEnabled = false;
        private boolean kafkaEnabled = false;
        private String sender = "patternpulse@localhost";
        private Map<AlertSeverity, List<String>> recipients = new EnumMap<>(AlertSeverity.class);
        private Map<Integer, List<String>> escalationRecipients = new HashMap<>();
    }
}
