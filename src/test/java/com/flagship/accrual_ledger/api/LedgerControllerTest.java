package com.flagship.accrual_ledger.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST endpoints against the application configuration in application.yml.
 */
@SpringBootTest
@AutoConfigureMockMvc
class LedgerControllerTest {

    private static final String ROWS = """
            {"rows": [
              {"id": "ch_1", "timestamp": "2024-01-15T10:00:00Z", "type": "charge", "gross_amount": "100.00",
               "currency": "usd", "correlation_id": "ch_1", "description": "Pro plan"},
              {"id": "fee_1", "timestamp": "2024-01-15T10:00:00Z", "type": "stripe_fee", "gross_amount": "-2.90",
               "currency": "usd", "correlation_id": "ch_1"},
              {"id": "po_1", "timestamp": "2024-01-17T00:00:00Z", "type": "payout", "gross_amount": "-97.10",
               "currency": "usd"}
            ]}
            """;

    private static final String STRIPE_EXPORT = String.join("\n",
            "id,Type,Source,Amount,Fee,Net,Currency,Created (UTC),Description",
            "txn_1,charge,ch_1,100.00,2.90,97.10,usd,2024-01-15 10:30,Pro plan",
            "txn_3,payout,po_1,-97.10,0.00,-97.10,usd,2024-01-17 00:00,STRIPE PAYOUT",
            "");

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("JSON rows are synthesized into balanced transactions")
    void testSynthesize() throws Exception {
        mockMvc.perform(post("/api/ledger/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ROWS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("COMPLETED_CLEAN"))
                .andExpect(jsonPath("$.exit_code").value(0))
                .andExpect(jsonPath("$.transactions.length()").value(2))
                .andExpect(jsonPath("$.transactions[0].event_type").value("CHARGE"))
                .andExpect(jsonPath("$.transactions[0].description").value("Subscription: Pro plan"))
                .andExpect(jsonPath("$.transactions[0].date").value("2024-01-15"))
                .andExpect(jsonPath("$.transactions[1].event_type").value("PAYOUT"))
                .andExpect(jsonPath("$.accrual_clearing_balance").value(0))
                .andExpect(jsonPath("$.year_to_date['2024']").value(10000))
                .andExpect(jsonPath("$.warnings").isEmpty());
    }

    @Test
    @DisplayName("Year-to-date income in the request seeds the run")
    void testSynthesizeWithYearToDate() throws Exception {
        String body = ROWS.replaceFirst("\\{\"rows\"", "{\"year_to_date\": {\"2024\": 5000}, \"rows\"");

        mockMvc.perform(post("/api/ledger/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.year_to_date['2024']").value(15000));
    }

    @Test
    @DisplayName("Row problems come back as warnings")
    void testWarnings() throws Exception {
        String body = """
                {"rows": [
                  {"id": "x_1", "timestamp": "2024-01-15T10:00:00Z", "type": "charge", "gross_amount": "abc",
                   "currency": "usd"}
                ]}
                """;

        mockMvc.perform(post("/api/ledger/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("COMPLETED_WITH_WARNINGS"))
                .andExpect(jsonPath("$.exit_code").value(1))
                .andExpect(jsonPath("$.warnings[0].kind").value("MALFORMED_ROW"))
                .andExpect(jsonPath("$.warnings[0].line_number").value(1));
    }

    @Test
    @DisplayName("A request without rows fails validation")
    void testValidation() throws Exception {
        mockMvc.perform(post("/api/ledger/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details.rows").exists());
    }

    @Test
    @DisplayName("Malformed JSON is rejected")
    void testMalformedJson() throws Exception {
        mockMvc.perform(post("/api/ledger/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rows\": ["))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("A Stripe balance export is imported and synthesized")
    void testStripeImport() throws Exception {
        mockMvc.perform(post("/api/ledger/imports/stripe")
                        .contentType("text/csv")
                        .content(STRIPE_EXPORT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("COMPLETED_CLEAN"))
                .andExpect(jsonPath("$.transactions.length()").value(2))
                .andExpect(jsonPath("$.accrual_clearing_balance").value(0));
    }

    @Test
    @DisplayName("A Stripe export without required columns is a bad request")
    void testStripeImportMissingColumns() throws Exception {
        mockMvc.perform(post("/api/ledger/imports/stripe")
                        .contentType("text/csv")
                        .content("id,Type\ntxn_1,charge\n"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Request"));
    }

    @Test
    @DisplayName("A Stripe export converts to GnuCash CSV with the outcome in a header")
    void testGnuCashExport() throws Exception {
        mockMvc.perform(post("/api/ledger/exports/gnucash")
                        .contentType("text/csv")
                        .content(STRIPE_EXPORT))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Ledger-Outcome", "COMPLETED_CLEAN"))
                .andExpect(header().string("X-Ledger-Warnings", "0"))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(startsWith("Date,Description,Account,Amount,Notes")))
                .andExpect(content().string(containsString("Income:Subscriptions")));
    }

    @Test
    @DisplayName("Health endpoint reports the loaded configuration")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.currency").value("USD"))
                .andExpect(jsonPath("$.taxCategories").value(3));
    }
}
