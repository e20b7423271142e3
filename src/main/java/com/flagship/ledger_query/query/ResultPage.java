package com.flagship.ledger_query.query;

import com.flagship.ledger_query.ledger.LedgerEntry;
import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import lombok.Value;

import java.util.List;
import java.util.function.Supplier;

/**
 * One page of a ledger query.
 *
 * {@code kinds} and {@code paymentMethodTypes} are lazy: nothing runs until
 * {@code get()} is called, and the result is memoized.
 */
@Value
public class ResultPage {
    List<LedgerEntry> nodes;
    long totalCount;
    int limit;
    int offset;
    Supplier<List<TransactionKind>> kinds;
    Supplier<List<PaymentMethodType>> paymentMethodTypes;
}
