package com.flagship.ledger_query.persistence;

import com.flagship.ledger_query.ledger.LedgerEntry;
import lombok.Value;

import java.util.List;

/**
 * One page of entries plus the total number of entries matching the filter.
 */
@Value
public class LedgerPage {
    List<LedgerEntry> entries;
    long totalCount;
}
