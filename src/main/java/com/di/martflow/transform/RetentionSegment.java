package com.di.martflow.transform;

/**
 * Customer retention segment by days since the last order. Closed set; boundaries are
 * inclusive upper bounds.
 */
public enum RetentionSegment {

    ACTIVE("active"),
    WARM("warm"),
    CHURN_RISK("churn-risk");

    public static final long ACTIVE_MAX_DAYS = 7;
    public static final long WARM_MAX_DAYS = 21;

    private final String label;

    RetentionSegment(String label) {
        this.label = label;
    }

    /** Label as reported by the warehouse ("churn-risk"). */
    public String label() {
        return label;
    }

    public static RetentionSegment classify(long daysSinceLastOrder) {
        if (daysSinceLastOrder <= ACTIVE_MAX_DAYS) {
            return ACTIVE;
        }
        if (daysSinceLastOrder <= WARM_MAX_DAYS) {
            return WARM;
        }
        return CHURN_RISK;
    }

    public static RetentionSegment fromLabel(String label) {
        for (RetentionSegment s : values()) {
            if (s.label.equals(label)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown retention segment: '" + label + "'");
    }

    /**
     * The same classification as a SQL expression over {@code arg}, so warehouse queries and
     * {@link #classify(long)} share one set of boundaries.
     */
    public static String toSqlCase(String arg) {
        return "CASE WHEN " + arg + " <= " + ACTIVE_MAX_DAYS + " THEN '" + ACTIVE.label + "'"
                + " WHEN " + arg + " <= " + WARM_MAX_DAYS + " THEN '" + WARM.label + "'"
                + " ELSE '" + CHURN_RISK.label + "' END";
    }
}
