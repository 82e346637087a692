package com.flagship.agreement_ledger.condition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.agreement_ledger.common.Party;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flagship.agreement_ledger.LedgerTestFixture.party;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConditionEvaluatorTest {

    private static final Party VALIDATOR = party("validator");

    private OracleGateway oracleGateway;
    private InMemoryApprovalRegistry approvals;
    private ConditionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        oracleGateway = mock(OracleGateway.class);
        approvals = new InMemoryApprovalRegistry();
        evaluator = new ConditionEvaluator(List.of(
            new TimeBasedPredicate(new ObjectMapper()),
            new OraclePredicate(oracleGateway),
            new ManualApprovalPredicate(approvals)));
    }

    @Test
    @DisplayName("Empty condition list is met")
    void testVacuousTruth() {
        assertTrue(evaluator.evaluateAll(List.of(), 0));
    }

    @Test
    @DisplayName("Evaluation stops at the first unmet condition")
    void testShortCircuit() {
        Condition unmet = Condition.of(ConditionType.TIME_BASED, "{\"targetTime\": 500}", VALIDATOR);
        Condition oracle = Condition.of(ConditionType.ORACLE_BASED, "{}", VALIDATOR);

        assertFalse(evaluator.evaluateAll(List.of(unmet, oracle), 100));
        verify(oracleGateway, never()).confirms(any(), anyString());
    }

    @Test
    @DisplayName("All conditions must hold")
    void testConjunction() {
        when(oracleGateway.confirms(VALIDATOR, "{\"feed\":\"btc\"}")).thenReturn(true);
        List<Condition> conditions = List.of(
            Condition.of(ConditionType.TIME_BASED, "{\"targetTime\": 100}", VALIDATOR),
            Condition.of(ConditionType.ORACLE_BASED, "{\"feed\":\"btc\"}", VALIDATOR),
            Condition.of(ConditionType.MANUAL_APPROVAL, "delivery", VALIDATOR));

        assertFalse(evaluator.evaluateAll(conditions, 100));

        approvals.grant(VALIDATOR, "delivery");
        assertTrue(evaluator.evaluateAll(conditions, 100));

        approvals.revoke(VALIDATOR, "delivery");
        assertFalse(evaluator.evaluateAll(conditions, 100));
    }

    @Test
    @DisplayName("Backend failures propagate instead of counting as met")
    void testBackendFailurePropagates() {
        when(oracleGateway.confirms(any(), any())).thenThrow(new IllegalStateException("oracle down"));

        assertThrows(IllegalStateException.class, () -> evaluator.evaluate(
            Condition.of(ConditionType.ORACLE_BASED, "{}", VALIDATOR), 0));
    }

    @Test
    @DisplayName("Every condition type needs exactly one predicate")
    void testPredicateRegistration() {
        assertThrows(IllegalStateException.class, () -> new ConditionEvaluator(List.of(
            new TimeBasedPredicate(new ObjectMapper()),
            new OraclePredicate(oracleGateway))));

        assertThrows(IllegalStateException.class, () -> new ConditionEvaluator(List.of(
            new TimeBasedPredicate(new ObjectMapper()),
            new TimeBasedPredicate(new ObjectMapper()),
            new OraclePredicate(oracleGateway),
            new ManualApprovalPredicate(approvals))));
    }

    @Nested
    @DisplayName("Time-based predicate")
    class TimeBased {

        private final TimeBasedPredicate predicate = new TimeBasedPredicate(new ObjectMapper());

        private boolean met(String parameters, long now) {
            return predicate.isMet(Condition.of(ConditionType.TIME_BASED, parameters, VALIDATOR), now);
        }

        @Test
        @DisplayName("Met once the ledger time reaches the target")
        void testTargetTime() {
            assertFalse(met("{\"targetTime\": 200}", 199));
            assertTrue(met("{\"targetTime\": 200}", 200));
            assertTrue(met("{\"targetTime\": 200}", 201));
        }

        @Test
        @DisplayName("No target time imposes no constraint")
        void testNoTarget() {
            assertTrue(met("", 0));
            assertTrue(met("{}", 0));
            assertTrue(met("{\"other\": 1}", 0));
        }

        @Test
        @DisplayName("Unreadable parameters are never met")
        void testUnreadable() {
            assertFalse(met("not json", Long.MAX_VALUE));
            assertFalse(met("[1, 2]", Long.MAX_VALUE));
            assertFalse(met("{\"targetTime\": \"soon\"}", Long.MAX_VALUE));
        }
    }
}
