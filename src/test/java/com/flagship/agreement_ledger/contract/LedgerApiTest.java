package com.flagship.agreement_ledger.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.agreement_ledger.observability.CorrelationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.flagship.agreement_ledger.LedgerTestFixture.party;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST surface over the in-memory store, with the background sweeps off.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class LedgerApiTest {

    private static final String ALICE = party("alice").getAddress();
    private static final String BOB = party("bob").getAddress();
    private static final String VALIDATOR = party("validator").getAddress();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode postJson(String path, Object body, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)))
            .andExpect(status().is(expectedStatus))
            .andReturn();
        String content = result.getResponse().getContentAsString();
        return content.isEmpty() ? null : objectMapper.readTree(content);
    }

    private static long inOneDay() {
        return Instant.now().getEpochSecond() + 86_400;
    }

    @Test
    @DisplayName("Initialize once, then refuse with 403")
    void testInitialize() throws Exception {
        JsonNode info = postJson("/api/ledger/initialize", Map.of("admin", ALICE), 201);
        assertEquals(ALICE, info.get("admin").asText());
        assertEquals(1, info.get("version").asInt());

        JsonNode error = postJson("/api/ledger/initialize", Map.of("admin", BOB), 403);
        assertEquals("UNAUTHORIZED", error.get("error").asText());
        assertEquals(3, error.get("code").asInt());

        mockMvc.perform(get("/api/ledger/version"))
            .andExpect(status().isOk())
            .andExpect(content().string("1"));
    }

    @Test
    @DisplayName("Transaction is created, fetched and listed in history")
    void testTransactionFlow() throws Exception {
        JsonNode created = postJson("/api/transactions",
            Map.of("sender", ALICE, "recipient", BOB, "amount", 500, "metadata", "lunch"), 201);
        long id = created.get("transaction_id").asLong();
        assertEquals("CONFIRMED", created.get("status").asText());
        assertFalse(created.get("confirmation_reference").asText().isEmpty());

        mockMvc.perform(get("/api/transactions/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sender").value(ALICE))
            .andExpect(jsonPath("$.amount").value(500))
            .andExpect(jsonPath("$.kind").value("BASIC"));

        MvcResult history = mockMvc.perform(get("/api/transactions/history/{party}", BOB))
            .andExpect(status().isOk())
            .andReturn();
        JsonNode entries = objectMapper.readTree(history.getResponse().getContentAsString());
        assertTrue(entries.isArray());
        boolean listed = false;
        for (JsonNode entry : entries) {
            listed |= entry.get("id").asLong() == id;
        }
        assertTrue(listed);
    }

    @Test
    @DisplayName("Ledger errors map to HTTP status with kind and code")
    void testErrorMapping() throws Exception {
        JsonNode invalidAmount = postJson("/api/transactions",
            Map.of("sender", ALICE, "recipient", BOB, "amount", 0), 400);
        assertEquals("INVALID_AMOUNT", invalidAmount.get("error").asText());
        assertEquals(4, invalidAmount.get("code").asInt());

        JsonNode invalidAddress = postJson("/api/transactions/p2p",
            Map.of("sender", "alice", "recipient", BOB, "amount", 5), 400);
        assertEquals("INVALID_ADDRESS", invalidAddress.get("error").asText());

        mockMvc.perform(get("/api/escrows/{id}", 999_999))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("ESCROW_NOT_FOUND"))
            .andExpect(jsonPath("$.code").value(6));

        mockMvc.perform(get("/api/transactions/history/{party}", ALICE).param("limit", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

        JsonNode malformedValidator = postJson("/api/escrows/approvals",
            Map.of("validator", "validator", "parameters", "shipment-7"), 400);
        assertEquals("INVALID_ADDRESS", malformedValidator.get("error").asText());

        JsonNode missingField = postJson("/api/transactions", Map.of("sender", ALICE, "amount", 5), 400);
        assertEquals("VALIDATION_FAILED", missingField.get("error").asText());
        assertTrue(missingField.get("details").has("recipient"));
    }

    @Test
    @DisplayName("Escrow with manual approval is released after the validator approves")
    void testEscrowFlow() throws Exception {
        Map<String, Object> condition = Map.of("type", "MANUAL_APPROVAL", "parameters", "shipment-42", "validator", VALIDATOR);
        JsonNode created = postJson("/api/escrows", Map.of(
            "sender", ALICE, "recipient", BOB, "amount", 1_000,
            "conditions", List.of(condition), "expires_at", inOneDay()), 201);
        long id = created.get("escrow_id").asLong();
        assertEquals("ACTIVE", created.get("status").asText());

        mockMvc.perform(get("/api/escrows/{id}/conditions", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.conditions_met").value(false));

        JsonNode notMet = postJson("/api/escrows/" + id + "/release", Map.of(), 409);
        assertEquals("CONDITIONS_NOT_MET", notMet.get("error").asText());

        postJson("/api/escrows/approvals", Map.of("validator", VALIDATOR, "parameters", "shipment-42"), 204);

        JsonNode processed = postJson("/api/escrows/" + id + "/process", Map.of(), 200);
        assertEquals("RELEASED", processed.get("status").asText());

        mockMvc.perform(get("/api/escrows/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RELEASED"))
            .andExpect(jsonPath("$.conditions[0].type").value("MANUAL_APPROVAL"))
            .andExpect(jsonPath("$.conditions[0].validator").value(VALIDATOR));

        JsonNode refund = postJson("/api/escrows/" + id + "/refund", Map.of(), 404);
        assertEquals("ESCROW_NOT_FOUND", refund.get("error").asText());
    }

    @Test
    @DisplayName("Invoice goes from draft to executed")
    void testInvoiceFlow() throws Exception {
        JsonNode created = postJson("/api/invoices", Map.of(
            "creator", ALICE, "client", BOB, "amount", 300,
            "description", "Design work", "due_date", inOneDay()), 201);
        long id = created.get("invoice_id").asLong();
        assertEquals("DRAFT", created.get("status").asText());

        postJson("/api/invoices/" + id + "/send", Map.of("party", ALICE), 200);

        JsonNode wrongClient = postJson("/api/invoices/" + id + "/approve", Map.of("party", ALICE), 403);
        assertEquals("UNAUTHORIZED", wrongClient.get("error").asText());

        postJson("/api/invoices/" + id + "/approve", Map.of("party", BOB), 200);
        JsonNode executed = postJson("/api/invoices/" + id + "/execute", Map.of(), 200);
        assertEquals("EXECUTED", executed.get("status").asText());
        assertFalse(executed.get("payment_reference").asText().isEmpty());

        mockMvc.perform(get("/api/invoices/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("EXECUTED"))
            .andExpect(jsonPath("$.approved_at").isNumber());

        JsonNode again = postJson("/api/invoices/" + id + "/approve", Map.of("party", BOB), 409);
        assertEquals("INVOICE_ALREADY_APPROVED", again.get("error").asText());

        JsonNode check = postJson("/api/invoices/" + id + "/expiration-check", Map.of(), 200);
        assertEquals("EXECUTED", check.get("status").asText());
    }

    @Test
    @DisplayName("Correlation id is echoed back")
    void testCorrelationId() throws Exception {
        mockMvc.perform(get("/api/ledger").header(CorrelationContext.CORRELATION_ID_HEADER, "abc12345"))
            .andExpect(status().isOk())
            .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, "abc12345"));
    }
}
