package com.flagship.agreement_ledger.host;

import com.flagship.agreement_ledger.common.LedgerException;
import com.flagship.agreement_ledger.observability.LedgerMetrics;
import com.flagship.agreement_ledger.store.LedgerStore;
import com.flagship.agreement_ledger.store.StagedLedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.function.Function;

/**
 * Runs ledger operations with the guarantees of the replicated host.
 *
 * - Invocations are serialized: one top-level invocation runs at a time.
 * - The ledger timestamp is sampled once and frozen for the invocation.
 * - Writes are staged and committed as one batch on success. A rejected
 *   operation discards its writes, unless the {@link LedgerException} is a
 *   state correction, whose writes are committed with the error. A malformed
 *   request ({@link IllegalArgumentException}) is reported as
 *   {@code invalid_request}; anything else is a host fault.
 * - A call made from inside a running invocation on the same thread joins it
 *   instead of opening a new one, so it shares the staged store and sees the
 *   reentrancy flag.
 */
@Slf4j
public class LedgerHost {

    public static final String OPERATION_MDC_KEY = "operation";

    private final LedgerStore durableStore;
    private final LedgerClock clock;
    private final IdentityVerifier identity;
    private final ValueTransfer transfers;
    private final ReentrancyGuard guard;
    private final LedgerMetrics metrics;

    private InvocationContext active;

    public LedgerHost(LedgerStore durableStore,
                      LedgerClock clock,
                      IdentityVerifier identity,
                      ValueTransfer transfers,
                      ReentrancyGuard guard,
                      LedgerMetrics metrics) {
        this.durableStore = durableStore;
        this.clock = clock;
        this.identity = identity;
        this.transfers = transfers;
        this.guard = guard;
        this.metrics = metrics;
    }

    /**
     * Runs a state-mutating operation under the reentrancy guard.
     */
    public <T> T mutate(String operation, Function<InvocationContext, T> body) {
        return invoke(operation, true, body);
    }

    /**
     * Runs an operation without taking the guard. Reads may still write
     * (nothing prevents it), but they are not excluded against each other.
     */
    public <T> T read(String operation, Function<InvocationContext, T> body) {
        return invoke(operation, false, body);
    }

    public synchronized boolean isInvocationActive() {
        return active != null;
    }

    private synchronized <T> T invoke(String operation, boolean exclusive, Function<InvocationContext, T> body) {
        if (active != null) {
            log.debug("Nested call to {} joins running invocation {}", operation, active.getOperation());
            return run(active, exclusive, body);
        }

        long startTime = System.nanoTime();
        StagedLedgerStore staged = new StagedLedgerStore(durableStore);
        InvocationContext context = new InvocationContext(
                operation, staged, clock.now(), identity, transfers, guard);
        active = context;
        MDC.put(OPERATION_MDC_KEY, operation);

        try {
            T result = run(context, exclusive, body);
            staged.commit();
            metrics.recordOperation(operation, "success", elapsedSince(startTime));
            return result;
        } catch (LedgerException e) {
            if (e.isStateCorrection()) {
                staged.commit();
            } else {
                staged.discard();
            }
            metrics.recordOperation(operation, e.getError().name(), elapsedSince(startTime));
            log.info("Operation rejected: error={}, message={}, committed={}",
                    e.getError(), e.getMessage(), e.isStateCorrection());
            throw e;
        } catch (IllegalArgumentException e) {
            staged.discard();
            metrics.recordOperation(operation, "invalid_request", elapsedSince(startTime));
            log.warn("Operation refused, invalid request: message={}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            staged.discard();
            metrics.recordOperation(operation, "fault", elapsedSince(startTime));
            log.error("Operation aborted, staged writes discarded: error={}", e.getMessage(), e);
            throw e;
        } finally {
            active = null;
            MDC.remove(OPERATION_MDC_KEY);
        }
    }

    private <T> T run(InvocationContext context, boolean exclusive, Function<InvocationContext, T> body) {
        if (!exclusive) {
            return body.apply(context);
        }
        try (GuardPermit permit = context.enterExclusive()) {
            return body.apply(context);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
