package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.models.Indicator;

import java.util.Comparator;

/**
 * The supported orderings of query results. Ties are broken by the indicator key so that paging is stable.
 * The kind is compared by its textual id, the form the database stores, so that all backends page alike.
 */
public enum SortOrder {
    FIRST_SEEN_DESC(Comparator.comparing(Indicator::firstSeen).reversed(), "first_seen DESC"),
    LAST_SEEN_DESC(Comparator.comparing(Indicator::lastSeen).reversed(), "last_seen DESC"),
    THREAT_SCORE_DESC(Comparator.comparingInt(Indicator::threatScore).reversed()
            .thenComparing(Comparator.comparing(Indicator::lastSeen).reversed()), "threat_score DESC, last_seen DESC");

    private final Comparator<Indicator> _comparator;
    private final String _orderByClause;

    SortOrder(Comparator<Indicator> comparator, String orderByClause) {
        _comparator = comparator
                .thenComparing(Indicator::value)
                .thenComparing(indicator -> indicator.kind().id());
        _orderByClause = orderByClause + ", value ASC, kind ASC";
    }

    public Comparator<Indicator> comparator() {
        return _comparator;
    }

    /**
     * Returns the SQL ORDER BY expression list equivalent to {@link #comparator()}.
     */
    public String orderByClause() {
        return _orderByClause;
    }
}
