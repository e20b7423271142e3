package com.flagship.ledger_query.query.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Response DTO for a page of ledger entries.
 * Facets are null (and omitted from the JSON) unless requested.
 */
@Value
@Builder
public class TransactionsPageResponse {

    @JsonProperty("nodes")
    List<LedgerEntryResponse> nodes;

    @JsonProperty("total_count")
    long totalCount;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("offset")
    int offset;

    @JsonProperty("kinds")
    List<TransactionKind> kinds;

    @JsonProperty("payment_method_types")
    List<PaymentMethodType> paymentMethodTypes;
}
