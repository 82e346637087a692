package com.flagship.agreement_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.agreement_ledger.store.InMemoryLedgerStore;
import com.flagship.agreement_ledger.store.JdbcLedgerStore;
import com.flagship.agreement_ledger.store.LedgerStore;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable store selection.
 *
 * ledger.store.type=memory (default) keeps records for the process lifetime;
 * ledger.store.type=jdbc keeps them in PostgreSQL.
 */
@Configuration
@Slf4j
public class LedgerStoreConfig {

    @Bean
    @ConditionalOnMissingBean(LedgerStore.class)
    @ConditionalOnProperty(name = "ledger.store.type", havingValue = "memory", matchIfMissing = true)
    public LedgerStore inMemoryLedgerStore() {
        log.info("Using in-memory ledger store");
        return new InMemoryLedgerStore();
    }

    @Configuration
    @ConditionalOnProperty(name = "ledger.store.type", havingValue = "jdbc")
    static class Jdbc {

        @Value("${ledger.store.jdbc.url}")
        private String url;

        @Value("${ledger.store.jdbc.username:ledger}")
        private String username;

        @Value("${ledger.store.jdbc.password:}")
        private String password;

        @Value("${ledger.store.jdbc.initialize-schema:true}")
        private boolean initializeSchema;

        @Bean(destroyMethod = "close")
        public HikariDataSource ledgerDataSource() {
            HikariDataSource dataSource = new HikariDataSource();
            dataSource.setJdbcUrl(url);
            dataSource.setUsername(username);
            dataSource.setPassword(password);
            dataSource.setPoolName("ledger-store");
            return dataSource;
        }

        @Bean
        @ConditionalOnMissingBean(LedgerStore.class)
        public LedgerStore jdbcLedgerStore(HikariDataSource ledgerDataSource, ObjectMapper objectMapper) {
            JdbcLedgerStore store = new JdbcLedgerStore(
                new JdbcTemplate(ledgerDataSource),
                new TransactionTemplate(new DataSourceTransactionManager(ledgerDataSource)),
                objectMapper);
            if (initializeSchema) {
                store.initializeSchema();
            }
            log.info("Using jdbc ledger store at {}", url);
            return store;
        }
    }
}
