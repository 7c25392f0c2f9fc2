package org.databaseclone.clone.common;

/** One page of a listing: at most {@code limit} items following the item keyed {@code cursorAfter}. */
public record PageRequest(int limit, String cursorAfter) {
    public PageRequest {
        if (limit <= 0) {
            throw new IllegalArgumentException("Page limit must be positive, was " + limit);
        }
    }

    public static PageRequest first(int limit) {
        return new PageRequest(limit, null);
    }

    public PageRequest after(String key) {
        return new PageRequest(limit, key);
    }

    public boolean hasCursor() {
        return cursorAfter != null;
    }
}
