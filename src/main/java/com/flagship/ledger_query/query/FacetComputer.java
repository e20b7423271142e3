package com.flagship.ledger_query.query;

import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import com.flagship.ledger_query.observability.QueryMetrics;
import com.flagship.ledger_query.persistence.LedgerEntryRepository;
import com.flagship.ledger_query.query.predicate.CompiledFilter;
import com.flagship.ledger_query.query.predicate.Join;
import com.flagship.ledger_query.query.predicate.JoinSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.function.SingletonSupplier;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds the lazy facets of a result page.
 *
 * Facets always run against the snapshot taken before the search term was applied.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FacetComputer {

    private final LedgerEntryRepository ledgerEntryRepository;
    private final QueryMetrics queryMetrics;

    /**
     * Distinct non-null kinds present under the filter.
     */
    public Supplier<List<TransactionKind>> kinds(CompiledFilter facetBase) {
        return SingletonSupplier.of(() -> queryMetrics.timeFacet("kinds", () -> {
            List<TransactionKind> kinds = ledgerEntryRepository.findDistinctKinds(facetBase).stream()
                .filter(Objects::nonNull)
                .toList();
            log.debug("Computed kinds facet: {}", kinds);
            return kinds;
        }));
    }

    /**
     * Distinct payment method types present under the filter; null stands for
     * entries without a payment method.
     */
    public Supplier<List<PaymentMethodType>> paymentMethodTypes(CompiledFilter facetBase) {
        CompiledFilter joined = facetBase.withJoin(JoinSpec.optional(Join.PAYMENT_METHOD));
        return SingletonSupplier.of(() -> queryMetrics.timeFacet("payment_method_types", () -> {
            List<PaymentMethodType> types = ledgerEntryRepository.findDistinctPaymentMethodTypes(joined);
            log.debug("Computed payment method types facet: {}", types);
            return types;
        }));
    }
}
