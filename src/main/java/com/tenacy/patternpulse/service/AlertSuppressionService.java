package com.tenacy.patternpulse.service;

import com.tenacy.patternpulse.alert.SuppressionEvaluator;
import com.tenacy.patternpulse.alert.SuppressionSubject;
import com.tenacy.patternpulse.api.dto.SuppressionConditionDto;
import com.tenacy.patternpulse.api.dto.SuppressionRuleRequest;
import com.tenacy.patternpulse.api.dto.SuppressionRuleResponse;
import com.tenacy.patternpulse.domain.SuppressionCondition;
import com.tenacy.patternpulse.domain.SuppressionRule;
import com.tenacy.patternpulse.domain.SuppressionRuleRepository;
import com.tenacy.patternpulse.exception.SuppressionRuleNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class AlertSuppressionService {

    private final SuppressionRuleRepository ruleRepository;
    private final SuppressionEvaluator evaluator;
    private final Clock clock;

    public List<SuppressionRuleResponse> retrieveRules(Boolean active) {
        List<SuppressionRule> rules = active == null ? ruleRepository.findAll() : ruleRepository.findByActive(active);
        return rules.stream().map(SuppressionRuleResponse::of).toList();
    }

    public SuppressionRuleResponse retrieveRule(String id) {
        return SuppressionRuleResponse.of(findRule(id));
    }

    @Transactional
    public SuppressionRuleResponse createRule(SuppressionRuleRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        SuppressionRule rule = SuppressionRule.builder()
                .id(UUID.randomUUID().toString())
                .createdBy(request.getCreatedBy() != null ? request.getCreatedBy() : "system")
                .createdAt(now)
                .build();
        apply(rule, request);
        rule.setUpdatedAt(now);

        SuppressionRule saved = ruleRepository.save(rule);
        log.info("억제 규칙 생성: {} ({}), 조건 {}개", saved.getName(), saved.getId(), saved.getConditions().size());
        return SuppressionRuleResponse.of(saved);
    }

    @Transactional
    public SuppressionRuleResponse updateRule(String id, SuppressionRuleRequest request) {
        SuppressionRule rule = findRule(id);
        apply(rule, request);
        rule.setUpdatedAt(LocalDateTime.now(clock));
        log.info("억제 규칙 수정: {} ({})", rule.getName(), rule.getId());
        return SuppressionRuleResponse.of(ruleRepository.save(rule));
    }

    @Transactional
    public void deleteRule(String id) {
        SuppressionRule rule = findRule(id);
        ruleRepository.delete(rule);
        log.info("억제 규칙 삭제: {} ({})", rule.getName(), rule.getId());
    }

    /**
     * 활성 상태이고 만료되지 않은 규칙 중 처음 일치하는 규칙.
     */
    public Optional<SuppressionRule> findMatchingRule(SuppressionSubject subject, LocalDateTime now) {
        return evaluator.findMatch(ruleRepository.findByActiveTrueOrderByCreatedAtAsc(), subject, now);
    }

    public Optional<SuppressionRule> findRuleById(String id) {
        return id == null ? Optional.empty() : ruleRepository.findById(id);
    }

    @Transactional
    public void recordTrigger(String ruleId) {
        ruleRepository.incrementTimesTriggered(ruleId);
    }

    private SuppressionRule findRule(String id) {
        return ruleRepository.findById(id)
                .orElseThrow(() -> new SuppressionRuleNotFoundException(id));
    }

    private void apply(SuppressionRule rule, SuppressionRuleRequest request) {
        if (request.getName() != null) {
            rule.setName(request.getName());
        }
        if (request.getDescription() != null) {
            rule.setDescription(request.getDescription());
        }
        if (request.getConditions() != null) {
            List<SuppressionCondition> conditions = new ArrayList<>();
            for (SuppressionConditionDto dto : request.getConditions()) {
                conditions.add(dto.toCondition());
            }
            rule.getConditions().clear();
            rule.getConditions().addAll(conditions);
        }
        if (request.getActive() != null) {
            rule.setActive(request.getActive());
        }
        rule.setExpiresAt(request.getExpiresAt());
        rule.setSuppressFor(request.getSuppressForMinutes() != null
                ? Duration.ofMinutes(request.getSuppressForMinutes())
                : null);
    }
}
