package com.flagship.agreement_ledger.contract;

import com.flagship.agreement_ledger.LedgerTestFixture;
import com.flagship.agreement_ledger.common.Amounts;
import com.flagship.agreement_ledger.common.LedgerError;
import com.flagship.agreement_ledger.common.LedgerException;
import com.flagship.agreement_ledger.common.Party;
import com.flagship.agreement_ledger.condition.Condition;
import com.flagship.agreement_ledger.condition.ConditionType;
import com.flagship.agreement_ledger.escrow.EscrowStatus;
import com.flagship.agreement_ledger.store.EntityKind;
import com.flagship.agreement_ledger.store.RecordKind;
import com.flagship.agreement_ledger.store.StoreKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static com.flagship.agreement_ledger.LedgerTestFixture.GENESIS;
import static com.flagship.agreement_ledger.LedgerTestFixture.party;
import static org.junit.jupiter.api.Assertions.*;

class LedgerContractTest {

    private static final Party ADMIN = party("admin");
    private static final Party ALICE = party("alice");
    private static final Party BOB = party("bob");
    private static final Party ORACLE = party("oracle");

    @Nested
    @DisplayName("Administration")
    class Administration {

        private final LedgerContract contract = LedgerTestFixture.create().contract;

        @Test
        @DisplayName("Initialize records the admin and refuses a second call")
        void testInitialize() {
            assertTrue(contract.getAdmin().isEmpty());

            contract.initialize(ADMIN);

            assertEquals(ADMIN, contract.getAdmin().orElseThrow());
            LedgerException e = assertThrows(LedgerException.class, () -> contract.initialize(ALICE));
            assertEquals(LedgerError.UNAUTHORIZED, e.getError());
            assertEquals(ADMIN, contract.getAdmin().orElseThrow());
        }

        @Test
        @DisplayName("Initialize validates the admin address")
        void testInitializeInvalidAdmin() {
            LedgerException e = assertThrows(LedgerException.class, () -> contract.initialize(Party.of("admin")));
            assertEquals(LedgerError.INVALID_ADDRESS, e.getError());
        }

        @Test
        @DisplayName("Version is 1")
        void testVersion() {
            assertEquals(1, contract.version());
        }
    }

    @Nested
    @DisplayName("Amount validation")
    class AmountValidation {

        private final LedgerContract contract = LedgerTestFixture.create().contract;

        private void assertInvalidAmount(Function<BigInteger, Object> creation, BigInteger amount) {
            LedgerException e = assertThrows(LedgerException.class, () -> creation.apply(amount));
            assertEquals(LedgerError.INVALID_AMOUNT, e.getError());
        }

        private void assertRejectedEverywhere(BigInteger amount) {
            assertInvalidAmount(a -> contract.executeTransaction(ALICE, BOB, a, null), amount);
            assertInvalidAmount(a -> contract.executeP2pTransaction(ALICE, BOB, a, null), amount);
            assertInvalidAmount(a -> contract.createEscrow(ALICE, BOB, a, List.of(), GENESIS + 60), amount);
            assertInvalidAmount(a -> contract.createInvoice(ALICE, BOB, a, "x", GENESIS + 60), amount);
        }

        @ParameterizedTest
        @ValueSource(longs = {0, -1, Long.MIN_VALUE})
        @DisplayName("Zero and negative amounts fail with INVALID_AMOUNT on every creation path")
        void testNonPositive(long amount) {
            assertRejectedEverywhere(BigInteger.valueOf(amount));
        }

        @Test
        @DisplayName("Amounts beyond the headroom bound fail with INVALID_AMOUNT on every creation path")
        void testOverflow() {
            assertRejectedEverywhere(Amounts.MAX_AMOUNT.add(BigInteger.ONE));
            assertRejectedEverywhere(Amounts.I128_MAX);
            assertRejectedEverywhere(Amounts.I128_MAX.add(BigInteger.ONE));
        }

        @Test
        @DisplayName("Missing amount fails with INVALID_AMOUNT")
        void testNullAmount() {
            assertRejectedEverywhere(null);
        }

        @Test
        @DisplayName("Largest allowed amount is accepted")
        void testMaxAmount() {
            assertEquals(1, contract.executeTransaction(ALICE, BOB, Amounts.MAX_AMOUNT, null).getTransactionId());
        }
    }

    @Nested
    @DisplayName("Reentrancy")
    class Reentrancy {

        @Test
        @DisplayName("Callback into the ledger during condition evaluation is rejected and the guard clears")
        void testNestedCallRejected() {
            AtomicReference<LedgerContract> self = new AtomicReference<>();
            AtomicReference<LedgerError> nestedError = new AtomicReference<>();
            LedgerTestFixture fixture = LedgerTestFixture.withOracle((oracle, parameters) -> {
                try {
                    self.get().executeTransaction(ALICE, BOB, BigInteger.ONE, "nested");
                } catch (LedgerException e) {
                    nestedError.set(e.getError());
                    throw e;
                }
                return true;
            });
            LedgerContract contract = fixture.contract;
            self.set(contract);

            long id = contract.createEscrow(ALICE, BOB, BigInteger.TEN,
                List.of(Condition.of(ConditionType.ORACLE_BASED, "{}", ORACLE)), GENESIS + 60).getEscrowId();

            LedgerException e = assertThrows(LedgerException.class, () -> contract.processEscrow(id));

            assertEquals(LedgerError.REENTRANCY_DETECTED, e.getError());
            assertEquals(LedgerError.REENTRANCY_DETECTED, nestedError.get());
            assertEquals(EscrowStatus.ACTIVE, contract.getEscrowDetails(id).getStatus());
            assertFalse(fixture.store.has(StoreKey.singleton(RecordKind.REENTRANCY_FLAG)));
            assertEquals(1, contract.executeTransaction(ALICE, BOB, BigInteger.ONE, null).getTransactionId());
        }

        @Test
        @DisplayName("Value transfer calling back into the ledger leaves no partial transaction behind")
        void testReentrantTransferLeavesNoState() {
            AtomicReference<LedgerContract> self = new AtomicReference<>();
            LedgerTestFixture fixture = LedgerTestFixture.withTransfer(instruction -> {
                self.get().executeTransaction(ALICE, BOB, BigInteger.ONE, "nested");
                return "unreachable";
            });
            LedgerContract contract = fixture.contract;
            self.set(contract);

            LedgerException e = assertThrows(LedgerException.class,
                () -> contract.executeTransaction(ALICE, BOB, BigInteger.TEN, "outer"));

            assertEquals(LedgerError.REENTRANCY_DETECTED, e.getError());
            LedgerException missing = assertThrows(LedgerException.class, () -> contract.getTransaction(1));
            assertEquals(LedgerError.TRANSACTION_NOT_FOUND, missing.getError());
            assertTrue(contract.getTransactionHistory(ALICE).isEmpty());
            assertTrue(contract.getTransactionHistory(BOB).isEmpty());
            assertFalse(fixture.store.has(StoreKey.counter(EntityKind.TRANSACTION)));
            assertFalse(fixture.store.has(StoreKey.singleton(RecordKind.REENTRANCY_FLAG)));
            assertEquals(1.0, fixture.meterRegistry.counter("ledger.operations",
                "operation", "execute_transaction", "outcome", "reentrancy_detected").count());
        }

        @Test
        @DisplayName("Guard is clear after a failed operation")
        void testGuardClearAfterFailure() {
            LedgerTestFixture fixture = LedgerTestFixture.create();

            assertThrows(LedgerException.class,
                () -> fixture.contract.executeTransaction(ALICE, BOB, BigInteger.ZERO, null));

            assertFalse(fixture.store.has(StoreKey.singleton(RecordKind.REENTRANCY_FLAG)));
            assertEquals(1, fixture.contract.executeTransaction(ALICE, BOB, BigInteger.ONE, null).getTransactionId());
        }
    }

    @Nested
    @DisplayName("Approvals")
    class Approvals {

        private final LedgerTestFixture fixture = LedgerTestFixture.create();
        private final LedgerContract contract = fixture.contract;

        @Test
        @DisplayName("Grant and revoke record the validator's approval")
        void testGrantAndRevoke() {
            contract.grantApproval(ALICE, "delivery-42");
            assertTrue(fixture.approvals.isApproved(ALICE, "delivery-42"));

            contract.revokeApproval(ALICE, "delivery-42");
            assertFalse(fixture.approvals.isApproved(ALICE, "delivery-42"));
        }

        @Test
        @DisplayName("Malformed validator is refused and nothing is recorded")
        void testMalformedValidatorRefused() {
            Party malformed = Party.of("validator");

            LedgerException e = assertThrows(LedgerException.class,
                () -> contract.grantApproval(malformed, "delivery-42"));

            assertEquals(LedgerError.INVALID_ADDRESS, e.getError());
            assertFalse(fixture.approvals.isApproved(malformed, "delivery-42"));
            assertEquals(1.0, fixture.meterRegistry.counter("ledger.operations",
                "operation", "grant_approval", "outcome", "invalid_address").count());
        }
    }
}
