package com.flagship.ledger_query.query.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_query.ledger.EntryType;
import com.flagship.ledger_query.ledger.LedgerEntry;
import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Response DTO for a ledger entry.
 */
@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("account_id")
    Long accountId;

    @JsonProperty("from_account_id")
    Long fromAccountId;

    @JsonProperty("host_account_id")
    Long hostAccountId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("type")
    EntryType type;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("group")
    String group;

    @JsonProperty("is_debt")
    boolean debt;

    @JsonProperty("payment_method_type")
    PaymentMethodType paymentMethodType;

    @JsonProperty("expense_id")
    Long expenseId;

    @JsonProperty("order_id")
    Long orderId;

    @JsonProperty("using_gift_card_from_account_id")
    Long usingGiftCardFromAccountId;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .accountId(entry.getOwnerAccountId())
            .fromAccountId(entry.getCounterpartyAccountId())
            .hostAccountId(entry.getHostAccountId())
            .amount(entry.getAmount())
            .currency(entry.getCurrency())
            .type(entry.getType())
            .kind(entry.getKind())
            .group(entry.getGroupId())
            .debt(entry.isDebt())
            .paymentMethodType(entry.getPaymentMethodType())
            .expenseId(entry.getLinkedExpenseId())
            .orderId(entry.getLinkedOrderId())
            .usingGiftCardFromAccountId(entry.getGiftCardIssuerAccountId())
            .description(entry.getDescription())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
