package com.flagship.bookkeeping.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bookkeeping.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * The REST surface end to end: request binding, snake_case bodies and the
 * mapping of engine failures onto status codes.
 */
@SpringBootTest(properties = IntegrationTestSupport.TEST_PROPERTIES)
@AutoConfigureMockMvc
class BookkeepingApiTest extends IntegrationTestSupport {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() throws Exception {
        resetDatabase();
        createAccount("general", """
            {"account_number": "11", "account_name": "Current assets", "category": "ASSET"}
            """);
        createAccount("general", """
            {"account_number": "32", "account_name": "Equity", "category": "EQUITY"}
            """);
        createAccount("general", """
            {"account_number": "41", "account_name": "Sales", "category": "REVENUE"}
            """);
        createAccount("detail", """
            {"account_number": "1101", "account_name": "Cash", "category": "ASSET",
             "general_account_number": "11"}
            """);
        createAccount("detail", """
            {"account_number": "3203", "account_name": "Retained earnings", "category": "EQUITY",
             "general_account_number": "32"}
            """);
        createAccount("detail", """
            {"account_number": "4101", "account_name": "Product sales", "category": "REVENUE",
             "general_account_number": "41"}
            """);
    }

    private void createAccount(String kind, String body) throws Exception {
        mockMvc.perform(post("/api/accounts/" + kind)
                        .header(ACTOR_HEADER, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated());
    }

    private String batchBody(String debit, String credit) {
        return """
            {"lines": [
              {"detail_account_number": "1101", "general_account_number": "11", "entry_type": "DEBIT",
               "amount": %s, "description": "Cash sale", "ledger_date": "2025-01-15T10:00:00"},
              {"detail_account_number": "4101", "general_account_number": "41", "entry_type": "CREDIT",
               "amount": %s, "ledger_date": "2025-01-15T10:00:00"}
            ]}
            """.formatted(debit, credit);
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Accounts are created and read back in snake_case")
    void testAccountRoundTrip() throws Exception {
        printTestHeader("Account API");

        mockMvc.perform(get("/api/accounts/detail/4101"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.account_number").value("4101"))
                .andExpect(jsonPath("$.general_account_number").value("41"))
                .andExpect(jsonPath("$.report_type").value("INCOME_STATEMENT"))
                .andExpect(jsonPath("$.normal_side").value("CREDIT"))
                .andExpect(jsonPath("$.deleted").value(false));

        mockMvc.perform(post("/api/accounts/detail")
                        .header(ACTOR_HEADER, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"account_number": "1101", "account_name": "Again", "category": "ASSET",
                             "general_account_number": "11"}
                            """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ACCOUNT_EXISTS"));

        mockMvc.perform(delete("/api/accounts/detail/9999").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ACCOUNT_NOT_FOUND"));
        printSuccess("Account endpoints behave");
    }

    @Test
    @DisplayName("A batch goes in, is read back and is deleted while pending")
    void testBatchLifecycle() throws Exception {
        printTestHeader("Batch API");

        MvcResult created = mockMvc.perform(post("/api/ledgers/batches")
                        .header(ACTOR_HEADER, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batchBody("100.00", "100.00")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.line_count").value(2))
                .andReturn();
        String reference = body(created).get("reference_number").asText();
        printOutput("Reference", reference);

        mockMvc.perform(get("/api/ledgers/batches/" + reference))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lines.length()").value(2))
                .andExpect(jsonPath("$.lines[0].posting_status").value("PENDING"))
                .andExpect(jsonPath("$.fully_pending").value(true));

        mockMvc.perform(delete("/api/ledgers/batches/" + reference).header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted_lines").value(2));

        mockMvc.perform(get("/api/ledgers/batches/" + reference))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("BATCH_NOT_FOUND"));
    }

    @Test
    @DisplayName("Engine rejections carry their code and details")
    void testRejections() throws Exception {
        printTestHeader("Rejections");

        mockMvc.perform(post("/api/ledgers/batches")
                        .header(ACTOR_HEADER, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batchBody("100.00", "99.99")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION"))
                .andExpect(jsonPath("$.code").value("UNBALANCED_JOURNAL"))
                .andExpect(jsonPath("$.details.debit").value("100.00"))
                .andExpect(jsonPath("$.details.credit").value("99.99"));

        mockMvc.perform(post("/api/ledgers/batches")
                        .header(ACTOR_HEADER, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batchBody("0", "0")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(post("/api/ledgers/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batchBody("1.00", "1.00")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_HEADER"));

        mockMvc.perform(post("/api/posting/ledgers/not-a-date").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/posting/ledgers/2025-01-16").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOTHING_TO_POST"));
    }

    @Test
    @DisplayName("Post, apply, close and lock a year over HTTP")
    void testPostingAndClosingFlow() throws Exception {
        printTestHeader("Posting And Closing API");
        mockMvc.perform(post("/api/ledgers/batches")
                        .header(ACTOR_HEADER, ACTOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batchBody("500.00", "500.00")))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/posting/ledgers/2025-01-15").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.posted_count").value(2))
                .andExpect(jsonPath("$.group_count").value(2))
                .andExpect(jsonPath("$.debit_total").value("500.00"));

        mockMvc.perform(post("/api/posting/ledgers/2025-01-15").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_POSTED"));

        mockMvc.perform(post("/api/posting/balances/2025-01-15").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.journal_entries").value(2));

        mockMvc.perform(delete("/api/posting/ledgers/2025-01-15").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CANNOT_UNPOST"));

        MvcResult journals = mockMvc.perform(get("/api/journal-entries")
                        .param("from_date", "2025-01-15")
                        .param("to_date", "2025-01-15")
                        .param("status", "POSTED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.entries[0].detail_account_number").value("1101"))
                .andExpect(jsonPath("$.entries[0].posting_status").value("POSTED"))
                .andExpect(jsonPath("$.entries[1].detail_account_number").value("4101"))
                .andExpect(jsonPath("$.entries[1].line_count").value(1))
                .andReturn();
        String journalId = body(journals).path("entries").get(0).path("id").asText();

        mockMvc.perform(get("/api/journal-entries/" + journalId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.general_account_number").value("11"));

        mockMvc.perform(get("/api/journal-entries").param("status", "PENDING"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0));

        mockMvc.perform(get("/api/journal-entries").param("status", "BOGUS"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETER"));

        mockMvc.perform(get("/api/journal-entries/" + UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("JOURNAL_ENTRY_NOT_FOUND"));

        mockMvc.perform(get("/api/periods/2025/result"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.net_result").value("500.00"))
                .andExpect(jsonPath("$.can_save").value(true));

        mockMvc.perform(post("/api/periods/2025/result").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.operation").value("CREATED"))
                .andExpect(jsonPath("$.accumulation_credit").value("500.00"));

        mockMvc.perform(post("/api/periods/2025/lock").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.closed").value(true));

        mockMvc.perform(post("/api/periods/2025/result").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("PERIOD_CLOSED"));

        mockMvc.perform(delete("/api/posting/balances/2025-01-15").header(ACTOR_HEADER, ACTOR))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("PERIOD_CLOSED"));
        printSuccess("Year closed over HTTP");
    }
}
