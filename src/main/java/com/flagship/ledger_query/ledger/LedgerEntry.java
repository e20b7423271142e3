package com.flagship.ledger_query.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Domain model for a Ledger Entry.
 * Represents a single debit or credit leg of a real-world economic event.
 *
 * Entries are written by the payment subsystem and never mutated here.
 * Key invariant: every entry belongs to exactly one transaction group.
 */
@Value
@Builder
public class LedgerEntry {
    Long id;
    Long ownerAccountId;
    Long counterpartyAccountId;
    Long hostAccountId;
    /** Signed amount in minor currency units. */
    long amount;
    String currency;
    EntryType type;
    TransactionKind kind;
    String groupId;
    boolean debt;
    Long paymentMethodId;
    PaymentMethodType paymentMethodType;
    Long linkedExpenseId;
    Long linkedOrderId;
    Instant createdAt;
    Long giftCardIssuerAccountId;
    String description;
}
