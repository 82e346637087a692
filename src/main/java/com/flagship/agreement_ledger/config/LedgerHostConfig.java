package com.flagship.agreement_ledger.config;

import com.flagship.agreement_ledger.condition.ApprovalRegistry;
import com.flagship.agreement_ledger.condition.ConfiguredOracleGateway;
import com.flagship.agreement_ledger.condition.InMemoryApprovalRegistry;
import com.flagship.agreement_ledger.condition.OracleGateway;
import com.flagship.agreement_ledger.host.AddressFormatVerifier;
import com.flagship.agreement_ledger.host.IdentityVerifier;
import com.flagship.agreement_ledger.host.LedgerClock;
import com.flagship.agreement_ledger.host.LedgerHost;
import com.flagship.agreement_ledger.host.ReentrancyGuard;
import com.flagship.agreement_ledger.host.SyntheticValueTransfer;
import com.flagship.agreement_ledger.host.SystemLedgerClock;
import com.flagship.agreement_ledger.host.ValueTransfer;
import com.flagship.agreement_ledger.observability.LedgerMetrics;
import com.flagship.agreement_ledger.store.LedgerStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Host collaborators. Each default can be replaced by declaring a bean of
 * the same type.
 */
@Configuration
public class LedgerHostConfig {

    @Bean
    @ConditionalOnMissingBean
    public LedgerClock ledgerClock() {
        return new SystemLedgerClock(Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentityVerifier identityVerifier(
            @Value("${ledger.identity.address-pattern:" + AddressFormatVerifier.STRKEY_PATTERN + "}") String pattern) {
        return new AddressFormatVerifier(pattern);
    }

    @Bean
    @ConditionalOnMissingBean
    public ValueTransfer valueTransfer() {
        return new SyntheticValueTransfer();
    }

    @Bean
    @ConditionalOnMissingBean
    public OracleGateway oracleGateway(
            @Value("${ledger.conditions.oracle.default-outcome:false}") boolean defaultOutcome) {
        return new ConfiguredOracleGateway(defaultOutcome);
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalRegistry approvalRegistry() {
        return new InMemoryApprovalRegistry();
    }

    @Bean
    public LedgerHost ledgerHost(LedgerStore ledgerStore,
                                 LedgerClock ledgerClock,
                                 IdentityVerifier identityVerifier,
                                 ValueTransfer valueTransfer,
                                 ReentrancyGuard reentrancyGuard,
                                 LedgerMetrics ledgerMetrics) {
        return new LedgerHost(ledgerStore, ledgerClock, identityVerifier, valueTransfer, reentrancyGuard, ledgerMetrics);
    }
}
