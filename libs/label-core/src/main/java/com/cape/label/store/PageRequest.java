package com.cape.label.store;

/**
 * Optional limit/offset window for list queries. Results are always ordered by row id.
 *
 * @param limit maximum number of rows, or {@code null} for no limit
 * @param offset number of rows to skip
 */
public record PageRequest(Integer limit, int offset) {

    private static final PageRequest UNPAGED = new PageRequest(null, 0);

    public PageRequest {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }

    /** Builds a page from optional request parameters; a missing offset means zero. */
    public static PageRequest of(Integer limit, Integer offset) {
        if (limit == null && (offset == null || offset == 0)) {
            return UNPAGED;
        }
        return new PageRequest(limit, offset == null ? 0 : offset);
    }

    public static PageRequest unpaged() {
        return UNPAGED;
    }

    public boolean isLimited() {
        return limit != null;
    }
}
