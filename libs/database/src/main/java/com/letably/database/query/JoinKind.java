package com.letably.database.query;

/**
 * Supported join kinds.
 */
public enum JoinKind {

    INNER("INNER JOIN"),
    LEFT("LEFT JOIN");

    private final String keyword;

    JoinKind(String keyword) {
        this.keyword = keyword;
    }

    /** The SQL keyword sequence for this join kind. */
    public String keyword() {
        return keyword;
    }
}
