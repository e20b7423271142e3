package com.flagship.ledger_query.query;

import com.flagship.ledger_query.config.QueryEngineSettings;
import com.flagship.ledger_query.exception.LimitExceededException;
import com.flagship.ledger_query.ledger.LedgerEntry;
import com.flagship.ledger_query.observability.QueryMetrics;
import com.flagship.ledger_query.persistence.LedgerEntryRepository;
import com.flagship.ledger_query.persistence.LedgerPage;
import com.flagship.ledger_query.query.scope.AccessScoper;
import com.flagship.ledger_query.query.scope.AccountScope;
import com.flagship.ledger_query.query.scope.PermissionChecker;
import com.flagship.ledger_query.query.scope.Requester;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Entry point of the ledger query engine.
 *
 * Pipeline:
 * 1. Normalize pagination and enforce the page size ceiling (before any query runs)
 * 2. Resolve the account scope
 * 3. Compile the filter
 * 4. Count only ({@code limit == 0}) or fetch the page with its total
 * 5. Attach lazy facets over the pre-search snapshot
 *
 * Nothing is cached between calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerQueryService {

    private final QueryEngineSettings settings;
    private final AccessScoper accessScoper;
    private final FilterCompiler filterCompiler;
    private final FacetComputer facetComputer;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final PermissionChecker permissionChecker;
    private final QueryMetrics queryMetrics;

    /**
     * Runs a ledger query.
     *
     * @param request the query
     * @param requester the actor, null for anonymous
     * @return the page, echoing the normalized limit and offset
     * @throws LimitExceededException if the limit is above the ceiling and the requester is not root
     * @throws com.flagship.ledger_query.exception.NotFoundException if a reference does not resolve
     */
    @Transactional(readOnly = true)
    public ResultPage query(QueryRequest request, Requester requester) {
        Requester actor = requester != null ? requester : Requester.anonymous();
        int limit = normalizeLimit(request.getLimit());
        int offset = normalizeOffset(request.getOffset());

        if (limit > settings.getMaxLimit() && !permissionChecker.isRoot(actor)) {
            queryMetrics.recordRejected("limit_exceeded");
            throw new LimitExceededException(limit, settings.getMaxLimit());
        }

        AccountScope scope = accessScoper.resolve(request, actor);
        CompiledQuery compiled = filterCompiler.compile(request, scope);

        List<LedgerEntry> nodes;
        long totalCount;
        if (limit == 0) {
            totalCount = queryMetrics.timeQuery("count", () -> ledgerEntryRepository.count(compiled.getFilter()));
            nodes = List.of();
        } else {
            OrderBy orderBy = request.getOrderBy() != null ? request.getOrderBy() : OrderBy.DEFAULT;
            GroupingOrder order = new GroupingOrder(settings.getGroupingWindow(), orderBy.getDirection());
            LedgerPage page = queryMetrics.timeQuery("page",
                () -> ledgerEntryRepository.findPage(compiled.getFilter(), order, limit, offset));
            nodes = page.getEntries();
            totalCount = page.getTotalCount();
            queryMetrics.recordRowsReturned(nodes.size());
        }

        log.info("Ledger query completed: limit={}, offset={}, returned={}, totalCount={}",
            limit, offset, nodes.size(), totalCount);

        return new ResultPage(
            nodes,
            totalCount,
            limit,
            offset,
            facetComputer.kinds(compiled.getFacetBase()),
            facetComputer.paymentMethodTypes(compiled.getFacetBase())
        );
    }

    int normalizeLimit(Integer limit) {
        return limit == null || limit < 0 ? settings.getDefaultLimit() : limit;
    }

    static int normalizeOffset(Integer offset) {
        return offset == null || offset < 0 ? 0 : offset;
    }
}
