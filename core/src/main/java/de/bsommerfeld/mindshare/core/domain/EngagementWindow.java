package de.bsommerfeld.mindshare.core.domain;

/**
 * The eight lookback windows an upstream ingestion period reports engagement
 * counters for. Each constant carries the short label used in exports and the
 * column name used by the store.
 */
public enum EngagementWindow {

    ALL("all", "yaps_all"),
    LAST_24H("24h", "yaps_l24h"),
    LAST_48H("48h", "yaps_l48h"),
    LAST_7D("7d", "yaps_l7d"),
    LAST_30D("30d", "yaps_l30d"),
    LAST_3M("3m", "yaps_l3m"),
    LAST_6M("6m", "yaps_l6m"),
    LAST_12M("12m", "yaps_l12m");

    private final String label;
    private final String column;

    EngagementWindow(String label, String column) {
        this.label = label;
        this.column = column;
    }

    public String label() {
        return label;
    }

    public String column() {
        return column;
    }
}
