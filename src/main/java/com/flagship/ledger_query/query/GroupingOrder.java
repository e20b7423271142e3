package com.flagship.ledger_query.query;

import com.flagship.ledger_query.ledger.EntryType;
import com.flagship.ledger_query.ledger.LedgerEntry;
import com.flagship.ledger_query.ledger.TransactionKind;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic presentation order of ledger entries.
 *
 * Sort keys, compared left to right, all in the same direction:
 * <ol>
 *   <li>createdAt rounded to a time bucket (default 10s), so that legs of one event written
 *       a few microseconds apart share the same primary key</li>
 *   <li>transaction group, to keep the legs of one event together</li>
 *   <li>kind rank, to put the main entry before its fees and tips</li>
 *   <li>type rank, DEBIT before CREDIT</li>
 * </ol>
 *
 * Known issue: a group can be split in two when its first entry rounds to the end of one bucket
 * and the next one to the beginning of the following bucket.
 *
 * No tie-break on the entry id: rows equal on every key come back in database order.
 */
public class GroupingOrder {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(10);

    public static final int OTHER_KIND_RANK = 9;

    private static final Map<TransactionKind, Integer> KIND_RANKS = new EnumMap<>(TransactionKind.class);

    static {
        KIND_RANKS.put(TransactionKind.CONTRIBUTION, 1);
        KIND_RANKS.put(TransactionKind.EXPENSE, 1);
        KIND_RANKS.put(TransactionKind.ADDED_FUNDS, 1);
        KIND_RANKS.put(TransactionKind.BALANCE_TRANSFER, 1);
        KIND_RANKS.put(TransactionKind.PREPAID_PAYMENT_METHOD, 1);
        KIND_RANKS.put(TransactionKind.PLATFORM_TIP, 2);
        KIND_RANKS.put(TransactionKind.PLATFORM_TIP_DEBT, 3);
        KIND_RANKS.put(TransactionKind.PAYMENT_PROCESSOR_FEE, 4);
        KIND_RANKS.put(TransactionKind.PAYMENT_PROCESSOR_COVER, 5);
        KIND_RANKS.put(TransactionKind.HOST_FEE, 6);
        KIND_RANKS.put(TransactionKind.HOST_FEE_SHARE, 7);
        KIND_RANKS.put(TransactionKind.HOST_FEE_SHARE_DEBT, 8);
    }

    /**
     * The sort keys, in comparison order.
     */
    public enum Key {
        TIME_BUCKET,
        GROUP,
        KIND_RANK,
        TYPE_RANK
    }

    private final Duration window;
    private final SortDirection direction;

    public GroupingOrder(Duration window, SortDirection direction) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Grouping window must be positive");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Sort direction is required");
        }
        this.window = window;
        this.direction = direction;
    }

    public static GroupingOrder defaultOrder() {
        return new GroupingOrder(DEFAULT_WINDOW, OrderBy.DEFAULT.getDirection());
    }

    public SortDirection getDirection() {
        return direction;
    }

    public List<Key> getKeys() {
        return List.of(Key.values());
    }

    /**
     * Window length in seconds, fractional part included.
     */
    public BigDecimal getWindowSeconds() {
        BigDecimal seconds = BigDecimal.valueOf(window.getSeconds())
            .add(BigDecimal.valueOf(window.getNano(), 9))
            .stripTrailingZeros();
        return seconds.scale() < 0 ? seconds.setScale(0) : seconds;
    }

    /**
     * Bucket of a timestamp: epoch seconds divided by the window, rounded half away from zero.
     */
    public long timeBucket(Instant createdAt) {
        BigDecimal epochSeconds = BigDecimal.valueOf(createdAt.getEpochSecond())
            .add(BigDecimal.valueOf(createdAt.getNano(), 9));
        return epochSeconds.divide(getWindowSeconds(), 0, RoundingMode.HALF_UP).longValueExact();
    }

    public static int kindRank(TransactionKind kind) {
        if (kind == null) {
            return OTHER_KIND_RANK;
        }
        return KIND_RANKS.getOrDefault(kind, OTHER_KIND_RANK);
    }

    public static int typeRank(EntryType type) {
        return type == EntryType.DEBIT ? 1 : 2;
    }

    /**
     * Kinds with an explicit rank; every other kind ranks {@link #OTHER_KIND_RANK}.
     */
    public static Map<TransactionKind, Integer> kindRanks() {
        return Collections.unmodifiableMap(KIND_RANKS);
    }

    /**
     * Comparator applying the same keys as the SQL rendering, for in-memory sorting.
     * Null group ids sort like PostgreSQL does: last ascending, first descending.
     */
    public Comparator<LedgerEntry> comparator() {
        Comparator<LedgerEntry> ascending = Comparator
            .comparingLong((LedgerEntry entry) -> timeBucket(entry.getCreatedAt()))
            .thenComparing(LedgerEntry::getGroupId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(entry -> kindRank(entry.getKind()))
            .thenComparingInt(entry -> typeRank(entry.getType()));

        return direction == SortDirection.ASC ? ascending : ascending.reversed();
    }

    @Override
    public String toString() {
        return "GroupingOrder{window=" + window + ", direction=" + direction + "}";
    }
}
