package com.flagship.ledger_query.persistence;

import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import com.flagship.ledger_query.query.GroupingOrder;
import com.flagship.ledger_query.query.predicate.CompiledFilter;

import java.util.List;

/**
 * Read-only access to ledger entries through compiled filters.
 *
 * Implementations run at most one count query and one page query per call;
 * store failures propagate unmodified.
 */
public interface LedgerEntryRepository {

    long count(CompiledFilter filter);

    /**
     * @param limit strictly positive page size
     */
    LedgerPage findPage(CompiledFilter filter, GroupingOrder order, int limit, int offset);

    /**
     * Distinct kinds present under the filter. May contain null.
     */
    List<TransactionKind> findDistinctKinds(CompiledFilter filter);

    /**
     * Distinct payment method types present under the filter, null standing for
     * entries without a payment method.
     */
    List<PaymentMethodType> findDistinctPaymentMethodTypes(CompiledFilter filter);
}
