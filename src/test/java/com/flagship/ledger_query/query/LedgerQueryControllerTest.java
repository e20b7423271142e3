package com.flagship.ledger_query.query;

import com.flagship.ledger_query.AbstractLedgerIntegrationTest;
import com.flagship.ledger_query.observability.CorrelationContext;
import com.flagship.ledger_query.query.scope.RequesterHeaders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end tests of GET /api/transactions against the seeded ledger.
 */
@AutoConfigureMockMvc
class LedgerQueryControllerTest extends AbstractLedgerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Test
    @DisplayName("Default query returns all non-debt entries, newest event first")
    void defaultQuery() throws Exception {
        printTestHeader("Default query");

        mockMvc.perform(get("/api/transactions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(NON_DEBT_ENTRIES))
            .andExpect(jsonPath("$.limit").value(100))
            .andExpect(jsonPath("$.offset").value(0))
            .andExpect(jsonPath("$.nodes", hasSize(10)))
            .andExpect(jsonPath("$.nodes[0].group").value("g4"))
            .andExpect(jsonPath("$.nodes[0].type").value("CREDIT"))
            .andExpect(jsonPath("$.kinds").doesNotExist());
    }

    @Test
    @DisplayName("Ascending order starts with the main debit of the oldest event")
    void ascendingOrder() throws Exception {
        mockMvc.perform(get("/api/transactions").param("direction", "ASC"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nodes[0].id").value(1))
            .andExpect(jsonPath("$.nodes[1].id").value(2))
            .andExpect(jsonPath("$.nodes[2].kind").value("HOST_FEE"));
    }

    @Test
    @DisplayName("Children entries are included on request, vendors never")
    void childrenOfCollective() throws Exception {
        printTestHeader("Children of a collective");

        mockMvc.perform(get("/api/transactions").param("account", "babel").param("type", "DEBIT"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2));

        mockMvc.perform(get("/api/transactions")
                .param("account", "babel")
                .param("type", "DEBIT")
                .param("includeChildrenTransactions", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(3))
            .andExpect(jsonPath("$.nodes[*].account_id", containsInAnyOrder(20, 21, 20)));
    }

    @Test
    @DisplayName("Kind filter narrows the kinds facet too")
    void kindFilterWithFacet() throws Exception {
        mockMvc.perform(get("/api/transactions")
                .param("account", "babel")
                .param("kind", "HOST_FEE")
                .param("facets", "kinds"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(1))
            .andExpect(jsonPath("$.kinds", containsInAnyOrder("HOST_FEE")));
    }

    @Test
    @DisplayName("Search narrows the page, facets stay computed without it")
    void searchWithFacets() throws Exception {
        printTestHeader("Search with facets");

        mockMvc.perform(get("/api/transactions")
                .param("searchTerm", "pizza")
                .param("facets", "kinds", "paymentMethodTypes"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2))
            .andExpect(jsonPath("$.kinds", containsInAnyOrder("CONTRIBUTION", "HOST_FEE", "EXPENSE")))
            .andExpect(jsonPath("$.payment_method_types", hasSize(2)));
    }

    @Test
    @DisplayName("@slug search matches either side of the entry")
    void slugSearch() throws Exception {
        mockMvc.perform(get("/api/transactions").param("searchTerm", "@babel-meetup"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2))
            .andExpect(jsonPath("$.nodes[*].group", containsInAnyOrder("g2", "g2")));
    }

    @Test
    @DisplayName("#id search matches a single entry")
    void idSearch() throws Exception {
        mockMvc.perform(get("/api/transactions").param("searchTerm", "#7"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(1))
            .andExpect(jsonPath("$.nodes[0].id").value(7));
    }

    @Test
    @DisplayName("Incognito entries are visible to their owner only")
    void incognitoEntries() throws Exception {
        printTestHeader("Incognito entries");

        mockMvc.perform(get("/api/transactions")
                .param("account", "alice")
                .param("includeIncognitoTransactions", "true")
                .header(RequesterHeaders.ACCOUNT_ID_HEADER, "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(1))
            .andExpect(jsonPath("$.nodes[0].account_id").value(11));

        mockMvc.perform(get("/api/transactions")
                .param("account", "alice")
                .param("includeIncognitoTransactions", "true")
                .header(RequesterHeaders.ACCOUNT_ID_HEADER, "99")
                .header(RequesterHeaders.ADMIN_OF_HEADER, "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(0));

        mockMvc.perform(get("/api/transactions")
                .param("account", "alice")
                .param("includeIncognitoTransactions", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(0));
    }

    @Test
    @DisplayName("Page size ceiling is enforced except for root")
    void limitCeiling() throws Exception {
        printTestHeader("Page size ceiling");

        mockMvc.perform(get("/api/transactions")
                .param("limit", "10001")
                .header(RequesterHeaders.ACCOUNT_ID_HEADER, "10"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("Limit Exceeded"))
            .andExpect(jsonPath("$.details.maxLimit").value("10000"));

        mockMvc.perform(get("/api/transactions")
                .param("limit", "10001")
                .header(RequesterHeaders.ACCOUNT_ID_HEADER, "1")
                .header(RequesterHeaders.ROOT_HEADER, "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.limit").value(10001));
    }

    @Test
    @DisplayName("limit=0 returns the count only")
    void countOnly() throws Exception {
        mockMvc.perform(get("/api/transactions").param("limit", "0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nodes", hasSize(0)))
            .andExpect(jsonPath("$.total_count").value(NON_DEBT_ENTRIES));
    }

    @Test
    @DisplayName("An offset past the end still reports the total")
    void offsetPastEnd() throws Exception {
        mockMvc.perform(get("/api/transactions").param("offset", "50"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.nodes", hasSize(0)))
            .andExpect(jsonPath("$.total_count").value(NON_DEBT_ENTRIES));
    }

    @Test
    @DisplayName("Expense references accept public and legacy ids")
    void expenseReferences() throws Exception {
        mockMvc.perform(get("/api/transactions").param("expense", "exp-pub"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2));

        mockMvc.perform(get("/api/transactions").param("expense", "100"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2));

        mockMvc.perform(get("/api/transactions").param("expense", "exp-missing"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Order filters")
    void orderFilters() throws Exception {
        mockMvc.perform(get("/api/transactions").param("order", "ord-pub"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2));

        mockMvc.perform(get("/api/transactions").param("hasOrder", "false"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(8));
    }

    @Test
    @DisplayName("Expense type and virtual card filters only match entries with an expense")
    void expenseRelationFilters() throws Exception {
        mockMvc.perform(get("/api/transactions").param("expenseType", "CHARGE"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2))
            .andExpect(jsonPath("$.nodes[0].group").value("g3"));

        mockMvc.perform(get("/api/transactions").param("virtualCard", "vc-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2));
    }

    @Test
    @DisplayName("NONE payment method type matches entries without a payment method")
    void noPaymentMethod() throws Exception {
        mockMvc.perform(get("/api/transactions").param("paymentMethodType", "NONE"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(6));

        mockMvc.perform(get("/api/transactions").param("paymentMethodType", "CREDITCARD", "NONE"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(NON_DEBT_ENTRIES));
    }

    @Test
    @DisplayName("Amount bounds are sign-agnostic")
    void amountBounds() throws Exception {
        mockMvc.perform(get("/api/transactions").param("minAmount", "500"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(6));

        mockMvc.perform(get("/api/transactions").param("maxAmount", "100"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(2));
    }

    @Test
    @DisplayName("Date bounds are inclusive")
    void dateBounds() throws Exception {
        mockMvc.perform(get("/api/transactions").param("dateFrom", "2024-03-01T12:01:00Z"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(6));
    }

    @Test
    @DisplayName("Excluding the host drops its own book-keeping entries")
    void hostExcluded() throws Exception {
        mockMvc.perform(get("/api/transactions").param("host", "host").param("includeHost", "false"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(9));
    }

    @Test
    @DisplayName("Debts are only returned on request")
    void debts() throws Exception {
        mockMvc.perform(get("/api/transactions").param("includeDebts", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_count").value(11))
            .andExpect(jsonPath("$.nodes[0].is_debt").value(true));
    }

    @Test
    @DisplayName("Unknown account references return 404")
    void unknownAccount() throws Exception {
        mockMvc.perform(get("/api/transactions").param("fromAccount", "nobody"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Account Not Found: @nobody"));
    }

    @Test
    @DisplayName("Invalid enum values return 400")
    void invalidParameter() throws Exception {
        mockMvc.perform(get("/api/transactions").param("type", "SIDEWAYS"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/transactions").param("paymentMethodType", "BARTER"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Correlation id is echoed, or generated when absent")
    void correlationId() throws Exception {
        mockMvc.perform(get("/api/transactions")
                .param("limit", "0")
                .header(CorrelationContext.CORRELATION_ID_HEADER, "abc12345"))
            .andExpect(status().isOk())
            .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, "abc12345"));

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ledger").value("UP"))
            .andExpect(header().exists(CorrelationContext.CORRELATION_ID_HEADER));
    }
}
