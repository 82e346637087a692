package com.flagship.agreement_ledger.condition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Time condition. Parameters are a JSON object; {@code targetTime} (ledger
 * seconds) is met once the ledger clock has reached it. Without a target
 * time the condition imposes no constraint. Unreadable parameters are never
 * met.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TimeBasedPredicate implements ConditionPredicate {

    static final String TARGET_TIME = "targetTime";

    private final ObjectMapper objectMapper;

    @Override
    public ConditionType type() {
        return ConditionType.TIME_BASED;
    }

    @Override
    public boolean isMet(Condition condition, long timestamp) {
        String parameters = condition.getParameters();
        if (parameters == null || parameters.isBlank()) {
            return true;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(parameters);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable time condition parameters: {}", e.getOriginalMessage());
            return false;
        }
        if (!root.isObject()) {
            return false;
        }
        JsonNode target = root.get(TARGET_TIME);
        if (target == null || target.isNull()) {
            return true;
        }
        if (!target.canConvertToLong()) {
            log.warn("Time condition targetTime is not a timestamp: {}", target);
            return false;
        }
        return timestamp >= target.asLong();
    }
}
