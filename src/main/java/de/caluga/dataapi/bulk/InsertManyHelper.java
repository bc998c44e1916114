package de.caluga.dataapi.bulk;

import de.caluga.dataapi.driver.DataApiResponseException;
import de.caluga.dataapi.driver.DetailedErrorDescriptor;
import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.InsertManyException;
import de.caluga.dataapi.driver.commands.InsertManyCommand;
import de.caluga.dataapi.driver.http.DataApiHttpClient;
import de.caluga.dataapi.driver.http.DataApiResponse;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Splits a batch of documents into chunks of <code>chunkSize</code> and sends one <code>insertMany</code> per chunk.
 * Ordered: chunk by chunk, stopping at the first failure.
 * Unordered: up to <code>concurrency</code> workers pull chunks from a shared index, every chunk is sent,
 * all failures are reported together.
 * All chunks share the timeout manager of the whole call.
 */
public class InsertManyHelper {
    private static final Logger log = LoggerFactory.getLogger(InsertManyHelper.class);
    private static final AtomicInteger poolNum = new AtomicInteger(1);

    private final DataApiHttpClient client;
    private final String keyspace;
    private final String collection;

    public InsertManyHelper(DataApiHttpClient client, String keyspace, String collection) {
        this.client = client;
        this.keyspace = keyspace;
        this.collection = collection;
    }

    public InsertManyResult insertMany(List<? extends Map<String, Object>> documents, InsertManyOptions options, TimeoutManager tm) {
        if (options == null) options = new InsertManyOptions();
        if (documents == null || documents.isEmpty()) return new InsertManyResult(Collections.emptyList());

        if (options.isOrdered()) {
            return insertOrdered(documents, options.getChunkSize(), tm);
        }

        return insertUnordered(documents, options.getChunkSize(), options.getConcurrency(), tm);
    }

    private InsertManyResult insertOrdered(List<? extends Map<String, Object>> documents, int chunkSize, TimeoutManager tm) {
        List<Object> insertedIds = new ArrayList<>();

        for (int i = 0; i < documents.size(); i += chunkSize) {
            List<? extends Map<String, Object>> chunk = documents.subList(i, Math.min(i + chunkSize, documents.size()));

            try {
                insertedIds.addAll(insertChunk(chunk, true, tm));
            } catch (DataApiResponseException e) {
                insertedIds.addAll(idsFrom(e.getRawResponse()));
                log.debug("Ordered insert stopped at chunk starting with document {}: {}", i, e.getMessage());
                throw new InsertManyException(e.getDetailedErrorDescriptors(), new InsertManyResult(insertedIds));
            }
        }

        return new InsertManyResult(insertedIds);
    }

    private InsertManyResult insertUnordered(List<? extends Map<String, Object>> documents, int chunkSize, int concurrency, TimeoutManager tm) {
        List<Object> insertedIds = Collections.synchronizedList(new ArrayList<>());
        List<DetailedErrorDescriptor> failures = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger masterIndex = new AtomicInteger(0);
        int chunks = (documents.size() + chunkSize - 1) / chunkSize;
        int workers = Math.min(concurrency, chunks);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), threadFactory());
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int w = 0; w < workers; w++) {
                futures.add(executor.submit(() -> {
                    for (;;) {
                        int start = masterIndex.getAndAdd(chunkSize);
                        if (start >= documents.size()) return;
                        List<? extends Map<String, Object>> chunk = documents.subList(start, Math.min(start + chunkSize, documents.size()));

                        try {
                            insertedIds.addAll(insertChunk(chunk, false, tm));
                        } catch (DataApiResponseException e) {
                            insertedIds.addAll(idsFrom(e.getRawResponse()));
                            failures.addAll(e.getDetailedErrorDescriptors());
                        }
                    }
                }));
            }

            RuntimeException other = null;

            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    if (other == null) {
                        other = e.getCause() instanceof RuntimeException ? (RuntimeException) e.getCause() : new RuntimeException(e.getCause());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException("Interrupted while inserting documents", e);
                }
            }

            if (other != null) {
                throw other;
            }
        } finally {
            executor.shutdownNow();
        }

        if (!failures.isEmpty()) {
            throw new InsertManyException(new ArrayList<>(failures), new InsertManyResult(insertedIds));
        }

        return new InsertManyResult(insertedIds);
    }

    private List<Object> insertChunk(List<? extends Map<String, Object>> chunk, boolean ordered, TimeoutManager tm) {
        InsertManyCommand cmd = new InsertManyCommand()
                .setDocuments(new ArrayList<>(chunk))
                .setOrdered(ordered)
                .setReturnDocumentResponses(true)
                .setKeyspace(keyspace)
                .setCollection(collection);
        DataApiResponse resp = client.execute(cmd, tm);
        return idsFrom(resp.getRaw());
    }

    /**
     * ids of the documents a response reports as inserted, works for error responses as well
     */
    static List<Object> idsFrom(Map<String, Object> raw) {
        List<Object> ret = new ArrayList<>();
        if (raw == null) return ret;
        Doc status = Doc.of(raw).getDoc("status");
        if (status == null) return ret;
        List<Object> responses = status.getList("documentResponses");

        if (responses != null) {
            for (Object o : responses) {
                Map<String, Object> r = Doc.asMap(o);

                if (r != null && "OK".equals(r.get("status"))) {
                    ret.add(r.get("_id"));
                }
            }

            return ret;
        }

        List<Object> ids = status.getList("insertedIds");
        if (ids != null) ret.addAll(ids);
        return ret;
    }

    private static ThreadFactory threadFactory() {
        int pool = poolNum.getAndIncrement();
        AtomicInteger num = new AtomicInteger(1);
        return r -> {
            Thread ret = new Thread(r, "insertMany-" + pool + "-" + num.getAndIncrement());
            ret.setDaemon(true);
            return ret;
        };
    }
}
