package com.flagship.ledger_query.query;

import com.flagship.ledger_query.ledger.PaymentMethodType;
import com.flagship.ledger_query.ledger.TransactionKind;
import com.flagship.ledger_query.observability.CorrelationContext;
import com.flagship.ledger_query.query.dto.LedgerEntryResponse;
import com.flagship.ledger_query.query.dto.TransactionQueryParams;
import com.flagship.ledger_query.query.dto.TransactionsPageResponse;
import com.flagship.ledger_query.query.scope.Requester;
import com.flagship.ledger_query.query.scope.RequesterHeaders;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * REST Controller for ledger queries.
 *
 * Facets are only computed when listed in the {@code facets} parameter;
 * when both are requested they run concurrently.
 */
@RestController
@RequestMapping("/api/transactions")
@Slf4j
public class LedgerQueryController {

    static final String KINDS_FACET = "kinds";
    static final String PAYMENT_METHOD_TYPES_FACET = "paymentMethodTypes";

    private final LedgerQueryService ledgerQueryService;
    private final RequesterHeaders requesterHeaders;
    private final Executor executor;

    public LedgerQueryController(LedgerQueryService ledgerQueryService,
                                 RequesterHeaders requesterHeaders,
                                 @Qualifier("ledgerQueryExecutor") Executor executor) {
        this.ledgerQueryService = ledgerQueryService;
        this.requesterHeaders = requesterHeaders;
        this.executor = executor;
    }

    /**
     * Lists ledger entries matching the filters, in grouping order.
     *
     * @param params filters, pagination and requested facets
     * @return the page, with the requested facets
     */
    @GetMapping
    public ResponseEntity<TransactionsPageResponse> listTransactions(
            @Valid @ModelAttribute TransactionQueryParams params,
            HttpServletRequest httpRequest) {

        Requester requester = requesterHeaders.fromRequest(httpRequest);
        if (requester.isAuthenticated()) {
            MDC.put(CorrelationContext.REQUESTER_ACCOUNT_ID_MDC_KEY, requester.getAccountId().toString());
        }

        ResultPage page = ledgerQueryService.query(params.toQueryRequest(), requester);

        CompletableFuture<List<TransactionKind>> kinds = params.wantsFacet(KINDS_FACET)
            ? CompletableFuture.supplyAsync(page.getKinds(), executor)
            : CompletableFuture.completedFuture(null);
        CompletableFuture<List<PaymentMethodType>> paymentMethodTypes = params.wantsFacet(PAYMENT_METHOD_TYPES_FACET)
            ? CompletableFuture.supplyAsync(page.getPaymentMethodTypes(), executor)
            : CompletableFuture.completedFuture(null);

        TransactionsPageResponse response = TransactionsPageResponse.builder()
            .nodes(page.getNodes().stream().map(LedgerEntryResponse::from).toList())
            .totalCount(page.getTotalCount())
            .limit(page.getLimit())
            .offset(page.getOffset())
            .kinds(await(kinds))
            .paymentMethodTypes(await(paymentMethodTypes))
            .build();

        return ResponseEntity.ok(response);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
