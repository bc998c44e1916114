package de.caluga.dataapi;

import de.caluga.dataapi.bulk.InsertManyHelper;
import de.caluga.dataapi.bulk.InsertManyOptions;
import de.caluga.dataapi.bulk.InsertManyResult;
import de.caluga.dataapi.driver.DataApiResponseException;
import de.caluga.dataapi.driver.DeleteManyException;
import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.TooManyDocumentsToCountException;
import de.caluga.dataapi.driver.UpdateManyException;
import de.caluga.dataapi.driver.commands.CountDocumentsCommand;
import de.caluga.dataapi.driver.commands.DataApiCommand;
import de.caluga.dataapi.driver.commands.DeleteManyCommand;
import de.caluga.dataapi.driver.commands.DeleteOneCommand;
import de.caluga.dataapi.driver.commands.EstimatedDocumentCountCommand;
import de.caluga.dataapi.driver.commands.FindOneAndDeleteCommand;
import de.caluga.dataapi.driver.commands.FindOneAndReplaceCommand;
import de.caluga.dataapi.driver.commands.FindOneAndUpdateCommand;
import de.caluga.dataapi.driver.commands.FindOneCommand;
import de.caluga.dataapi.driver.commands.InsertOneCommand;
import de.caluga.dataapi.driver.commands.UpdateManyCommand;
import de.caluga.dataapi.driver.commands.UpdateOneCommand;
import de.caluga.dataapi.driver.http.DataApiHttpClient;
import de.caluga.dataapi.driver.http.DataApiResponse;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutManager;
import de.caluga.dataapi.driver.timeouts.TimeoutOverride;
import de.caluga.dataapi.events.DataApiEventListener;
import de.caluga.dataapi.events.DataApiEventType;
import de.caluga.dataapi.events.HierarchicalEmitter;
import de.caluga.dataapi.query.DistinctHelper;
import de.caluga.dataapi.query.FindCursor;
import de.caluga.dataapi.query.FindOptions;
import de.caluga.dataapi.query.SortHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Document operations on one collection. Events raised here bubble up to the {@link Db} and the {@link DataApiClient}.
 */
public class Collection {
    private final Logger log = LoggerFactory.getLogger(Collection.class);

    private final Db db;
    private final String keyspace;
    private final String name;
    private final DataApiHttpClient httpClient;
    private final HierarchicalEmitter emitter;

    Collection(Db db, String keyspace, String name, DataApiHttpClient httpClient, HierarchicalEmitter emitter) {
        this.db = db;
        this.keyspace = keyspace;
        this.name = name;
        this.httpClient = httpClient;
        this.emitter = emitter;
    }

    public Db getDb() {
        return db;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public String getName() {
        return name;
    }

    public HierarchicalEmitter getEmitter() {
        return emitter;
    }

    public DataApiEventListener on(DataApiEventType type, DataApiEventListener listener) {
        return emitter.on(type, listener);
    }

    public void off(DataApiEventType type, DataApiEventListener listener) {
        emitter.off(type, listener);
    }

    /**
     * @return the id of the new document, generated by the server unless the document has an <code>_id</code>
     */
    public Object insertOne(Map<String, Object> document) {
        return insertOne(document, null);
    }

    public Object insertOne(Map<String, Object> document, TimeoutOverride timeout) {
        DataApiResponse resp = execute(new InsertOneCommand().setDocument(document), single(timeout));
        List<Object> ids = resp.getStatus().getList("insertedIds");
        return ids == null || ids.isEmpty() ? null : ids.get(0);
    }

    public InsertManyResult insertMany(List<? extends Map<String, Object>> documents) {
        return insertMany(documents, null);
    }

    /**
     * @throws de.caluga.dataapi.driver.InsertManyException if a chunk failed, with the ids inserted so far
     */
    public InsertManyResult insertMany(List<? extends Map<String, Object>> documents, InsertManyOptions options) {
        if (options == null) options = new InsertManyOptions();
        TimeoutManager tm = httpClient.timeouts().multipart(TimeoutCategory.GENERAL_METHOD, options.getTimeout());
        return new InsertManyHelper(httpClient, keyspace, name).insertMany(documents, options, tm);
    }

    public UpdateResult updateOne(Map<String, Object> filter, Map<String, Object> update) {
        return updateOne(filter, update, null);
    }

    public UpdateResult updateOne(Map<String, Object> filter, Map<String, Object> update, UpdateOptions options) {
        if (options == null) options = new UpdateOptions();
        UpdateOneCommand cmd = new UpdateOneCommand()
                .setFilter(filter(filter))
                .setUpdate(update)
                .setSort(SortHelper.normalize(options.getSort()));
        if (options.isUpsert()) cmd.setUpsert(true);
        DataApiResponse resp = execute(cmd, single(options.getTimeout()));
        return UpdateResult.fromStatus(resp.getStatus());
    }

    /**
     * updates page by page until the server reports no further page
     *
     * @throws UpdateManyException with the counts of the pages done before the failure
     */
    public UpdateResult updateMany(Map<String, Object> filter, Map<String, Object> update, UpdateOptions options) {
        if (options == null) options = new UpdateOptions();
        TimeoutManager tm = httpClient.timeouts().multipart(TimeoutCategory.GENERAL_METHOD, options.getTimeout());
        UpdateResult total = new UpdateResult();
        String pagingState = null;

        do {
            UpdateManyCommand cmd = new UpdateManyCommand()
                    .setFilter(filter(filter))
                    .setUpdate(update)
                    .setPagingState(pagingState);
            if (options.isUpsert()) cmd.setUpsert(true);
            DataApiResponse resp;

            try {
                resp = execute(cmd, tm);
            } catch (DataApiResponseException e) {
                Doc raw = Doc.of(e.getRawResponse());
                Doc status = raw.getDoc("status");
                if (status != null) total.add(UpdateResult.fromStatus(status));
                throw new UpdateManyException(e.getDetailedErrorDescriptors(), total);
            }

            total.add(UpdateResult.fromStatus(resp.getStatus()));
            pagingState = resp.getStatus().getString("nextPageState");
        } while (pagingState != null);

        return total;
    }

    public UpdateResult updateMany(Map<String, Object> filter, Map<String, Object> update) {
        return updateMany(filter, update, null);
    }

    public UpdateResult replaceOne(Map<String, Object> filter, Map<String, Object> replacement) {
        return replaceOne(filter, replacement, null);
    }

    public UpdateResult replaceOne(Map<String, Object> filter, Map<String, Object> replacement, UpdateOptions options) {
        if (options == null) options = new UpdateOptions();
        FindOneAndReplaceCommand cmd = new FindOneAndReplaceCommand()
                .setFilter(filter(filter))
                .setReplacement(replacement)
                .setSort(SortHelper.normalize(options.getSort()))
                .setProjection(Doc.of("*", 0))
                .setReturnDocument(ReturnDocument.BEFORE.getWireName());
        if (options.isUpsert()) cmd.setUpsert(true);
        DataApiResponse resp = execute(cmd, single(options.getTimeout()));
        return UpdateResult.fromStatus(resp.getStatus());
    }

    public DeleteResult deleteOne(Map<String, Object> filter) {
        return deleteOne(filter, null, null);
    }

    public DeleteResult deleteOne(Map<String, Object> filter, Map<String, Object> sort, TimeoutOverride timeout) {
        DeleteOneCommand cmd = new DeleteOneCommand().setFilter(filter(filter)).setSort(SortHelper.normalize(sort));
        DataApiResponse resp = execute(cmd, single(timeout));
        return new DeleteResult(resp.getStatus().getLong("deletedCount", 0));
    }

    public DeleteResult deleteMany(Map<String, Object> filter) {
        return deleteMany(filter, null);
    }

    /**
     * deletes in rounds while the server reports <code>moreData</code>
     *
     * @throws IllegalArgumentException for an empty filter, use {@link #deleteAll()} for that
     * @throws DeleteManyException      with the number of documents deleted before the failure
     */
    public DeleteResult deleteMany(Map<String, Object> filter, TimeoutOverride timeout) {
        if (filter == null || filter.isEmpty()) {
            throw new IllegalArgumentException("deleteMany with an empty filter would delete all documents; use deleteAll() if that is what you want");
        }

        return deleteLoop(filter, timeout);
    }

    public DeleteResult deleteAll() {
        return deleteAll(null);
    }

    public DeleteResult deleteAll(TimeoutOverride timeout) {
        return deleteLoop(new Doc(), timeout);
    }

    private DeleteResult deleteLoop(Map<String, Object> filter, TimeoutOverride timeout) {
        TimeoutManager tm = httpClient.timeouts().multipart(TimeoutCategory.GENERAL_METHOD, timeout);
        long deleted = 0;
        boolean moreData;

        do {
            DataApiResponse resp;

            try {
                resp = execute(new DeleteManyCommand().setFilter(filter), tm);
            } catch (DataApiResponseException e) {
                Doc status = Doc.of(e.getRawResponse()).getDoc("status");
                if (status != null) deleted += status.getLong("deletedCount", 0);
                throw new DeleteManyException(e.getDetailedErrorDescriptors(), deleted);
            }

            deleted += resp.getStatus().getLong("deletedCount", 0);
            moreData = resp.getStatus().getBoolean("moreData");
        } while (moreData);

        log.debug("Deleted {} documents from {}", deleted, name);
        return new DeleteResult(deleted);
    }

    public FindCursor<Map<String, Object>> find(Map<String, Object> filter) {
        return find(filter, null);
    }

    /**
     * nothing is sent before the cursor is read
     */
    public FindCursor<Map<String, Object>> find(Map<String, Object> filter, FindOptions options) {
        FindCursor<Map<String, Object>> cursor = new FindCursor<>(httpClient, keyspace, name, filter(filter));
        if (options == null) return cursor;
        return cursor.sort(options.getSort())
                .project(options.getProjection())
                .limit(options.getLimit())
                .skip(options.getSkip())
                .batchSize(options.getBatchSize())
                .includeSimilarity(options.isIncludeSimilarity())
                .timeout(options.getTimeout());
    }

    public Map<String, Object> findOne(Map<String, Object> filter) {
        return findOne(filter, null);
    }

    /**
     * @return the first matching document or null. Limit, skip and batch size of the options are ignored.
     */
    public Map<String, Object> findOne(Map<String, Object> filter, FindOptions options) {
        if (options == null) options = new FindOptions();
        FindOneCommand cmd = new FindOneCommand()
                .setFilter(filter(filter))
                .setSort(SortHelper.normalize(options.getSort()))
                .setProjection(options.getProjection());
        if (options.isIncludeSimilarity()) cmd.setIncludeSimilarity(true);
        DataApiResponse resp = execute(cmd, single(options.getTimeout()));
        return resp.getDocument();
    }

    public List<Object> distinct(String key) {
        return distinct(key, null);
    }

    /**
     * distinct values at <code>key</code> (dotted path, array indexes allowed) among the matching documents,
     * in the order they were first seen. Reads all matching documents.
     */
    public List<Object> distinct(String key, Map<String, Object> filter) {
        return distinct(key, filter, null);
    }

    /**
     * @param timeout applies to each page request of the underlying cursor
     */
    public List<Object> distinct(String key, Map<String, Object> filter, TimeoutOverride timeout) {
        DistinctHelper helper = new DistinctHelper(key, httpClient.getJson());
        FindCursor<Map<String, Object>> cursor = find(filter).project(helper.projection()).timeout(timeout);
        return helper.distinct(cursor);
    }

    public long countDocuments(Map<String, Object> filter, int upperBound) {
        return countDocuments(filter, upperBound, null);
    }

    /**
     * exact count, up to <code>upperBound</code>
     *
     * @throws TooManyDocumentsToCountException if there are more than <code>upperBound</code> documents or more than
     *                                          the server is willing to count
     */
    public long countDocuments(Map<String, Object> filter, int upperBound, TimeoutOverride timeout) {
        if (upperBound <= 0) {
            throw new IllegalArgumentException("upperBound must be a positive number, got " + upperBound);
        }

        DataApiResponse resp = execute(new CountDocumentsCommand().setFilter(filter(filter)), single(timeout));
        long count = resp.getStatus().getLong("count", 0);

        if (resp.getStatus().getBoolean("moreData")) {
            throw new TooManyDocumentsToCountException(count, true);
        }

        if (count > upperBound) {
            throw new TooManyDocumentsToCountException(upperBound, false);
        }

        return count;
    }

    public long estimatedDocumentCount() {
        return estimatedDocumentCount(null);
    }

    public long estimatedDocumentCount(TimeoutOverride timeout) {
        DataApiResponse resp = execute(new EstimatedDocumentCountCommand(), single(timeout));
        return resp.getStatus().getLong("count", 0);
    }

    public Map<String, Object> findOneAndUpdate(Map<String, Object> filter, Map<String, Object> update, FindOneAndOptions options) {
        if (options == null) options = new FindOneAndOptions();
        FindOneAndUpdateCommand cmd = new FindOneAndUpdateCommand()
                .setFilter(filter(filter))
                .setUpdate(update)
                .setSort(SortHelper.normalize(options.getSort()))
                .setProjection(options.getProjection())
                .setReturnDocument(options.getReturnDocument().getWireName());
        if (options.isUpsert()) cmd.setUpsert(true);
        return resultOf(execute(cmd, single(options.getTimeout())), options);
    }

    public Map<String, Object> findOneAndReplace(Map<String, Object> filter, Map<String, Object> replacement, FindOneAndOptions options) {
        if (options == null) options = new FindOneAndOptions();
        FindOneAndReplaceCommand cmd = new FindOneAndReplaceCommand()
                .setFilter(filter(filter))
                .setReplacement(replacement)
                .setSort(SortHelper.normalize(options.getSort()))
                .setProjection(options.getProjection())
                .setReturnDocument(options.getReturnDocument().getWireName());
        if (options.isUpsert()) cmd.setUpsert(true);
        return resultOf(execute(cmd, single(options.getTimeout())), options);
    }

    public Map<String, Object> findOneAndDelete(Map<String, Object> filter, FindOneAndOptions options) {
        if (options == null) options = new FindOneAndOptions();
        FindOneAndDeleteCommand cmd = new FindOneAndDeleteCommand()
                .setFilter(filter(filter))
                .setSort(SortHelper.normalize(options.getSort()))
                .setProjection(options.getProjection());
        return resultOf(execute(cmd, single(options.getTimeout())), options);
    }

    private static Map<String, Object> resultOf(DataApiResponse resp, FindOneAndOptions options) {
        Map<String, Object> doc = resp.getDocument();

        if (options.isIncludeResultMetadata()) {
            return Doc.of("value", doc, "ok", 1);
        }

        return doc;
    }

    private DataApiResponse execute(DataApiCommand<?> cmd, TimeoutManager tm) {
        cmd.setKeyspace(keyspace).setCollection(name);
        return httpClient.execute(cmd, tm);
    }

    private TimeoutManager single(TimeoutOverride timeout) {
        return httpClient.timeouts().single(TimeoutCategory.GENERAL_METHOD, timeout);
    }

    private static Map<String, Object> filter(Map<String, Object> filter) {
        return filter == null ? new Doc() : filter;
    }

    @Override
    public String toString() {
        return "Collection{" + keyspace + "." + name + "}";
    }
}
