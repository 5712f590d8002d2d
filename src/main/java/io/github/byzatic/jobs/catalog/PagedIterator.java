package io.github.byzatic.jobs.catalog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Walks a catalog page by page, fetching the next page only when the current one is exhausted.
 */
public final class PagedIterator<T> implements Iterator<T> {
    private final EntityCatalog<T> catalog;
    private final int pageSize;

    private List<T> page = List.of();
    private int indexInPage;
    private int offset;
    private boolean exhausted;

    public PagedIterator(EntityCatalog<T> catalog, int pageSize) {
        if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0");
        this.catalog = catalog;
        this.pageSize = pageSize;
    }

    /**
     * @throws UncheckedIOException when the catalog can't be read
     */
    @Override
    public boolean hasNext() {
        if (indexInPage < page.size()) return true;
        if (exhausted) return false;
        try {
            page = catalog.page(offset, pageSize);
        } catch (IOException e) {
            throw new UncheckedIOException("Can't read catalog page at offset " + offset, e);
        }
        indexInPage = 0;
        offset += page.size();
        if (page.size() < pageSize) exhausted = true;
        return !page.isEmpty();
    }

    @Override
    public T next() {
        if (!hasNext()) throw new NoSuchElementException();
        return page.get(indexInPage++);
    }
}
