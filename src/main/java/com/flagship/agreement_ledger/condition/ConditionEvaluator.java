package com.flagship.agreement_ledger.condition;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes each condition to the predicate for its type and composes the
 * results with AND semantics.
 */
@Component
@Slf4j
public class ConditionEvaluator {

    private final Map<ConditionType, ConditionPredicate> predicates = new EnumMap<>(ConditionType.class);

    public ConditionEvaluator(List<ConditionPredicate> predicates) {
        for (ConditionPredicate predicate : predicates) {
            ConditionPredicate previous = this.predicates.put(predicate.type(), predicate);
            if (previous != null) {
                throw new IllegalStateException("Duplicate predicate for condition type " + predicate.type());
            }
        }
        for (ConditionType type : ConditionType.values()) {
            if (!this.predicates.containsKey(type)) {
                throw new IllegalStateException("No predicate registered for condition type " + type);
            }
        }
    }

    /**
     * True iff every condition is met. Conditions are evaluated in order and
     * evaluation stops at the first unmet one. An empty list is met.
     */
    public boolean evaluateAll(List<Condition> conditions, long timestamp) {
        for (int i = 0; i < conditions.size(); i++) {
            if (!evaluate(conditions.get(i), timestamp)) {
                log.debug("Condition {} of {} not met: type={}", i + 1, conditions.size(),
                        conditions.get(i).getType());
                return false;
            }
        }
        return true;
    }

    public boolean evaluate(Condition condition, long timestamp) {
        return predicates.get(condition.getType()).isMet(condition, timestamp);
    }
}
