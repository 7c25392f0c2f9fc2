package org.databaseclone.clone.paging;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.databaseclone.clone.common.PageRequest;

import lombok.extern.slf4j.Slf4j;

/**
 * Walks a cursor paginated listing to the end.  A page shorter than the page size ends the
 * traversal, so a listing whose size is an exact multiple of the page size costs one extra,
 * empty request.  Errors from the fetcher propagate immediately and nothing is returned.
 */
@Slf4j
public class Paginator<T> {
    public static final int SCHEMA_PAGE_SIZE = 100;

    @FunctionalInterface
    public interface PageFetcher<T> {
        List<T> fetch(PageRequest page);
    }

    private final int pageSize;
    private final PageFetcher<T> fetcher;
    private final Function<T, String> cursorKey;

    public Paginator(int pageSize, PageFetcher<T> fetcher, Function<T, String> cursorKey) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, was " + pageSize);
        }
        this.pageSize = pageSize;
        this.fetcher = fetcher;
        this.cursorKey = cursorKey;
    }

    public List<T> fetchAll() {
        var items = new ArrayList<T>();
        var page = PageRequest.first(pageSize);
        int requests = 0;
        while (true) {
            var batch = fetcher.fetch(page);
            requests++;
            items.addAll(batch);
            if (batch.size() < pageSize) {
                break;
            }
            page = page.after(cursorKey.apply(batch.get(batch.size() - 1)));
        }
        log.atDebug().setMessage("Fetched {} items in {} requests").addArgument(items.size()).addArgument(requests).log();
        return items;
    }
}
