package de.caluga.dataapi.query;

import de.caluga.dataapi.driver.CursorIsStartedException;
import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.commands.FindCommand;
import de.caluga.dataapi.driver.http.DataApiHttpClient;
import de.caluga.dataapi.driver.http.DataApiResponse;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;
import de.caluga.dataapi.driver.timeouts.TimeoutOverride;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Lazy cursor over the result of a <code>find</code>. Nothing is fetched before the first read, pages are fetched
 * one at a time using the paging state the server returned with the previous one.
 * <p>
 * The query can only be changed while the cursor is {@link CursorState#UNINITIALIZED}, use {@link #rewind()} or
 * {@link #clone()} to change a started one. Not thread safe, one consumer per cursor.
 *
 * @param <T> type of the documents returned, {@link Map} unless a mapping is set via {@link #map(Function)}
 */
@SuppressWarnings("unchecked")
public class FindCursor<T> implements Iterable<T>, AutoCloseable {
    public static final String STARTED_MESSAGE = "Cursor is already initialized/in use; cannot perform options modification. Rewind or clone the cursor.";

    private final Logger log = LoggerFactory.getLogger(FindCursor.class);

    private final DataApiHttpClient client;
    private final String keyspace;
    private final String collection;

    private Map<String, Object> filter;
    private Map<String, Object> sort;
    private Map<String, Object> projection;
    private int limit;
    private Integer skip;
    private int batchSize;
    private boolean includeSimilarity;
    private TimeoutOverride timeout;
    private Function<Object, Object> mapping;

    private CursorState state = CursorState.UNINITIALIZED;
    private final Deque<Map<String, Object>> buffer = new ArrayDeque<>();
    private String nextPageState;
    private boolean exhausted;
    private long returned;

    public FindCursor(DataApiHttpClient client, String keyspace, String collection, Map<String, Object> filter) {
        this.client = client;
        this.keyspace = keyspace;
        this.collection = collection;
        this.filter = filter == null ? new Doc() : filter;
    }

    public enum CursorState {
        UNINITIALIZED, STARTED, CLOSED
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getCollection() {
        return collection;
    }

    public CursorState getState() {
        return state;
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public Map<String, Object> getSort() {
        return sort;
    }

    public Map<String, Object> getProjection() {
        return projection;
    }

    public int getLimit() {
        return limit;
    }

    public Integer getSkip() {
        return skip;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isIncludeSimilarity() {
        return includeSimilarity;
    }

    public boolean hasMapping() {
        return mapping != null;
    }

    /**
     * documents fetched from the server so far
     */
    public long getReturnedCount() {
        return returned;
    }

    public FindCursor<T> filter(Map<String, Object> filter) {
        assertUninitialized();
        this.filter = filter == null ? new Doc() : filter;
        return this;
    }

    public FindCursor<T> sort(Map<String, Object> sort) {
        assertUninitialized();
        this.sort = SortHelper.normalize(sort);
        return this;
    }

    public FindCursor<T> project(Map<String, Object> projection) {
        assertUninitialized();
        this.projection = projection;
        return this;
    }

    /**
     * 0 means no limit
     */
    public FindCursor<T> limit(int limit) {
        assertUninitialized();
        if (limit < 0) throw new IllegalArgumentException("limit must not be negative: " + limit);
        this.limit = limit;
        return this;
    }

    public FindCursor<T> skip(Integer skip) {
        assertUninitialized();
        this.skip = skip;
        return this;
    }

    /**
     * upper bound of documents per page, 0 leaves it to the server
     */
    public FindCursor<T> batchSize(int batchSize) {
        assertUninitialized();
        if (batchSize < 0) throw new IllegalArgumentException("batchSize must not be negative: " + batchSize);
        this.batchSize = batchSize;
        return this;
    }

    public FindCursor<T> includeSimilarity(boolean includeSimilarity) {
        assertUninitialized();
        this.includeSimilarity = includeSimilarity;
        return this;
    }

    public FindCursor<T> timeout(TimeoutOverride timeout) {
        assertUninitialized();
        this.timeout = timeout;
        return this;
    }

    /**
     * mappings compose: <code>map(f).map(g)</code> returns <code>g(f(doc))</code>.
     * Mappings are kept by {@link #rewind()} but not by {@link #clone()}.
     */
    public <R> FindCursor<R> map(Function<? super T, ? extends R> fn) {
        assertUninitialized();
        Function<Object, Object> f = (Function<Object, Object>) fn;
        mapping = mapping == null ? f : mapping.andThen(f);
        return (FindCursor<R>) this;
    }

    /**
     * new, uninitialized cursor with the same query but without mapping
     */
    @Override
    public FindCursor<Map<String, Object>> clone() {
        FindCursor<Map<String, Object>> ret = new FindCursor<>(client, keyspace, collection, filter);
        ret.sort = sort;
        ret.projection = projection;
        ret.limit = limit;
        ret.skip = skip;
        ret.batchSize = batchSize;
        ret.includeSimilarity = includeSimilarity;
        ret.timeout = timeout;
        return ret;
    }

    /**
     * back to {@link CursorState#UNINITIALIZED}, the query and the mapping stay
     */
    public void rewind() {
        state = CursorState.UNINITIALIZED;
        buffer.clear();
        nextPageState = null;
        exhausted = false;
        returned = 0;
    }

    @Override
    public void close() {
        state = CursorState.CLOSED;
        buffer.clear();
    }

    /**
     * true if there is another document, fetches the next page if the buffer is empty
     */
    public boolean hasNext() {
        if (!buffer.isEmpty()) return true;
        Object doc = nextInternal(true, true);
        if (doc == null) return false;
        buffer.addFirst((Map<String, Object>) doc);
        return true;
    }

    /**
     * next document, null if the cursor is exhausted or closed
     */
    public T next() {
        return (T) nextInternal(false, true);
    }

    /**
     * like {@link #next()}, but does not keep fetching if a page came back empty
     */
    public T tryNext() {
        return (T) nextInternal(false, false);
    }

    /**
     * reads all remaining documents and closes the cursor
     */
    public List<T> toList() {
        List<T> ret = new ArrayList<>();

        try {
            T doc;

            while ((doc = next()) != null) {
                ret.add(doc);
            }
        } finally {
            close();
        }

        return ret;
    }

    @Override
    public void forEach(Consumer<? super T> consumer) {
        forEachUntil(doc -> {
            consumer.accept(doc);
            return true;
        });
    }

    /**
     * iterates until the callback returns false or the cursor is exhausted, closes the cursor in any case
     */
    public void forEachUntil(Predicate<? super T> callback) {
        try {
            T doc;

            while ((doc = next()) != null) {
                if (!callback.test(doc)) {
                    break;
                }
            }
        } finally {
            close();
        }
    }

    /**
     * Iterator that closes the cursor once it is exhausted. Callers breaking out early should close the cursor,
     * best in try-with-resources.
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            @Override
            public boolean hasNext() {
                boolean ret = FindCursor.this.hasNext();
                if (!ret) close();
                return ret;
            }

            @Override
            public T next() {
                T doc = FindCursor.this.next();

                if (doc == null) {
                    close();
                    throw new NoSuchElementException();
                }

                return doc;
            }
        };
    }

    public int bufferedCount() {
        return buffer.size();
    }

    /**
     * takes all buffered documents, without fetching and without mapping
     */
    public List<Map<String, Object>> readBufferedDocuments() {
        return readBufferedDocuments(buffer.size());
    }

    /**
     * takes up to <code>max</code> buffered documents, without fetching and without mapping
     */
    public List<Map<String, Object>> readBufferedDocuments(int max) {
        List<Map<String, Object>> ret = new ArrayList<>();

        while (ret.size() < max && !buffer.isEmpty()) {
            ret.add(buffer.pollFirst());
        }

        return ret;
    }

    private Object nextInternal(boolean raw, boolean block) {
        if (state == CursorState.CLOSED) {
            return null;
        }

        if (state == CursorState.UNINITIALIZED) {
            state = CursorState.STARTED;
        }

        for (;;) {
            if (!buffer.isEmpty()) {
                Map<String, Object> doc = buffer.pollFirst();
                if (raw || mapping == null) return doc;

                try {
                    return mapping.apply(doc);
                } catch (RuntimeException e) {
                    close();
                    throw e;
                }
            }

            if (exhausted) {
                return null;
            }

            try {
                getMore();
            } catch (RuntimeException e) {
                close();
                throw e;
            }

            if (buffer.isEmpty() && !block) {
                return null;
            }
        }
    }

    private void getMore() {
        long remaining = limit > 0 ? limit - returned : Long.MAX_VALUE;
        long pageLimit = Math.min(remaining, batchSize > 0 ? batchSize : Long.MAX_VALUE);

        if (pageLimit <= 0) {
            exhausted = true;
            return;
        }

        FindCommand cmd = new FindCommand()
                .setFilter(filter)
                .setSort(sort)
                .setProjection(projection)
                .setSkip(skip)
                .setPagingState(nextPageState)
                .setKeyspace(keyspace)
                .setCollection(collection);

        if (pageLimit != Long.MAX_VALUE) cmd.setLimit((int) pageLimit);
        if (includeSimilarity) cmd.setIncludeSimilarity(true);

        TimeoutManager tm = client.timeouts().single(TimeoutCategory.GENERAL_METHOD, timeout);
        DataApiResponse resp = client.execute(cmd, tm);
        List<Map<String, Object>> docs = resp.getDocuments();
        nextPageState = resp.getNextPageState();
        exhausted = nextPageState == null;
        buffer.clear();

        for (Map<String, Object> d : docs) {
            if (d != null) buffer.add(d);
        }

        returned += docs.size();
        log.debug("Fetched {} documents from {}, {} in total, more: {}", docs.size(), collection, returned, !exhausted);
    }

    private void assertUninitialized() {
        if (state != CursorState.UNINITIALIZED) {
            throw new CursorIsStartedException(STARTED_MESSAGE);
        }
    }
}
