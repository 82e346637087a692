package com.flagship.agreement_ledger.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed ledger store.
 *
 * Every record is one row keyed by its flat store key, with the record body
 * serialized as JSON. A committed batch is applied in a single database
 * transaction, so an invocation is either fully visible or not at all.
 */
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    static final String CREATE_TABLE =
        "CREATE TABLE IF NOT EXISTS ledger_records (" +
        "  record_key VARCHAR(255) PRIMARY KEY," +
        "  record_kind VARCHAR(32) NOT NULL," +
        "  payload TEXT NOT NULL," +
        "  updated_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP" +
        ")";

    private static final String UPSERT =
        "INSERT INTO ledger_records (record_key, record_kind, payload, updated_at) " +
        "VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
        "ON CONFLICT (record_key) DO UPDATE SET payload = EXCLUDED.payload, updated_at = CURRENT_TIMESTAMP";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate,
                           TransactionTemplate transactionTemplate,
                           ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    public void initializeSchema() {
        jdbcTemplate.execute(CREATE_TABLE);
        log.info("Ledger record table is ready");
    }

    @Override
    public <T> Optional<T> get(StoreKey key, Class<T> type) {
        List<String> payloads = jdbcTemplate.queryForList(
            "SELECT payload FROM ledger_records WHERE record_key = ?",
            String.class,
            key.asString()
        );
        if (payloads.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(deserialize(key, payloads.get(0), type));
    }

    @Override
    public void set(StoreKey key, Object record) {
        jdbcTemplate.update(UPSERT, key.asString(), key.getKind().name(), serialize(key, record));
    }

    @Override
    public boolean has(StoreKey key) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_records WHERE record_key = ?",
            Integer.class,
            key.asString()
        );
        return count != null && count > 0;
    }

    @Override
    public void remove(StoreKey key) {
        jdbcTemplate.update("DELETE FROM ledger_records WHERE record_key = ?", key.asString());
    }

    @Override
    public void apply(List<StoreWrite> writes) {
        transactionTemplate.executeWithoutResult(status -> LedgerStore.super.apply(writes));
    }

    private String serialize(StoreKey key, Object record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize record " + key, e);
        }
    }

    private <T> T deserialize(StoreKey key, String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read record " + key + " as " + type.getSimpleName(), e);
        }
    }
}
