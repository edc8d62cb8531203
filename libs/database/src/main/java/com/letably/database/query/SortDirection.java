package com.letably.database.query;

/**
 * ORDER BY direction.
 */
public enum SortDirection {
    ASC,
    DESC;

    /**
     * Parses a direction, ignoring case.
     *
     * @throws IllegalArgumentException if the text is neither ASC nor DESC
     */
    public static SortDirection parse(String text) {
        if (text != null) {
            for (SortDirection direction : values()) {
                if (direction.name().equalsIgnoreCase(text.trim())) {
                    return direction;
                }
            }
        }
        throw new IllegalArgumentException("Invalid ORDER BY direction: " + text + ". Must be ASC or DESC.");
    }
}
