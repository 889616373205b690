package io.trigger4j.core;

/**
 * Filters and pagination of an event listing. Pages are 1-based.
 */
public record EventQuery(boolean includeTest, int page, int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 10;

    public EventQuery {
        if (page < 1) {
            throw ValidationException.invalidArgument("page must be >= 1");
        }
        if (pageSize < 1) {
            throw ValidationException.invalidArgument("pageSize must be >= 1");
        }
    }

    public static EventQuery defaults() {
        return new EventQuery(false, 1, DEFAULT_PAGE_SIZE);
    }

    /**
     * Number of rows skipped before this page. Computed in {@code long}: any valid page has an offset.
     */
    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
