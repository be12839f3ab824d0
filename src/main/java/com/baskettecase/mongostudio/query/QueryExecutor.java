package com.baskettecase.mongostudio.query;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import com.baskettecase.mongostudio.connection.MongoClientManager;
import com.baskettecase.mongostudio.connection.ResolvedConnection;
import com.baskettecase.mongostudio.exception.MongoExceptionTranslator;
import com.mongodb.MongoException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.result.UpdateResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Query Executor
 *
 * Parses user query text, runs it as a find or an aggregation against a resolved connection
 * and returns one page of documents. Parsing happens before any connection is opened, so
 * malformed input never reaches the server.
 *
 * Result order is only stable when the query sorts; natural order may differ between pages.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryExecutor {

    static final String SKIP_STAGE = "$skip";
    static final String LIMIT_STAGE = "$limit";

    private final MongoClientManager clientManager;
    private final QueryParser queryParser;
    private final MongoStudioProperties properties;
    private final MeterRegistry meterRegistry;

    private Counter queryCounter;
    private Counter queryErrorCounter;
    private Timer queryTimer;

    @PostConstruct
    public void initializeMetrics() {
        queryCounter = Counter.builder("mongo_studio.query.executions")
                .description("Total number of query executions")
                .register(meterRegistry);
        queryErrorCounter = Counter.builder("mongo_studio.query.errors")
                .description("Query executions that failed")
                .register(meterRegistry);
        queryTimer = Timer.builder("mongo_studio.query.duration")
                .description("Time taken to execute queries")
                .register(meterRegistry);
    }

    /**
     * Execute a find (JSON object) or aggregation (JSON array) and return the requested page
     *
     * @param page     page number starting at 1
     * @param pageSize documents per page, clamped to the configured maximum
     */
    public ResultPage execute(ResolvedConnection connection, String collection, String queryText,
                              int page, int pageSize) {
        return execute(connection, collection, queryText, null, null, page, pageSize);
    }

    /**
     * Execute with the projection supplied separately from the filter
     */
    public ResultPage execute(ResolvedConnection connection, String collection, String filterText,
                              String projectionText, int page, int pageSize) {
        return execute(connection, collection, filterText, projectionText, null, page, pageSize);
    }

    /**
     * Execute with projection and sort supplied separately from the filter
     */
    public ResultPage execute(ResolvedConnection connection, String collection, String filterText,
                              String projectionText, String sortText, int page, int pageSize) {
        QuerySpec query = queryParser.parse(filterText, projectionText, sortText);
        return execute(connection, collection, query, page, pageSize);
    }

    /**
     * Execute an already parsed query
     */
    public ResultPage execute(ResolvedConnection connection, String collection, QuerySpec query,
                              int page, int pageSize) {
        String target = requireCollection(query.targetCollection(collection));
        int pageNumber = Math.max(page, 1);
        int size = clampPageSize(pageSize);

        log.info("🔧 Executing {} on {}.{} (page {}, size {})", query.kind(), connection.getName(), target,
            pageNumber, size);

        queryCounter.increment();
        Timer.Sample sample = Timer.start(meterRegistry);
        if (skipFor(pageNumber, size) > Integer.MAX_VALUE) {
            log.info("📭 Page {} lies beyond any reachable document, returning an empty page", pageNumber);
            return ResultPage.of(new ArrayList<>(), pageNumber, size);
        }

        try {
            MongoCollection<Document> mongoCollection = clientManager.getDatabase(connection).getCollection(target);

            List<Document> documents = query.isAggregate()
                ? runAggregate(mongoCollection, query.pipeline(), pageNumber, size)
                : runFind(mongoCollection, query, pageNumber, size);

            ResultPage result = ResultPage.of(documents, pageNumber, size);
            log.info("✅ Query executed: {} document(s) returned", documents.size());
            return result;

        } catch (MongoException e) {
            queryErrorCounter.increment();
            log.error("❌ Query execution failed on {}.{}: {}", connection.getName(), target, e.getMessage());
            throw MongoExceptionTranslator.translate(e, connection.getName());
        } finally {
            sample.stop(queryTimer);
        }
    }

    /**
     * Names of all collections in the profile database, in the order the server reports them
     */
    public List<String> listCollections(ResolvedConnection connection) {
        return withDatabase(connection, "list collections", database ->
            database.listCollectionNames().into(new ArrayList<>()));
    }

    /**
     * Up to {@code limit} documents of a collection, unfiltered, for structural preview.
     * A limit of 0 or less yields an empty list without contacting the server.
     */
    public List<Document> sampleDocuments(ResolvedConnection connection, String collection, int limit) {
        String target = requireCollection(collection);
        if (limit <= 0) {
            return new ArrayList<>();
        }
        int sampleSize = Math.min(limit, properties.getQuery().getMaxSampleSize());

        return withDatabase(connection, "sample " + target, database ->
            database.getCollection(target)
                .find()
                .limit(sampleSize)
                .maxTime(properties.getQuery().getMaxTimeMs(), TimeUnit.MILLISECONDS)
                .into(new ArrayList<>()));
    }

    /**
     * Server query plan for a find or aggregation
     */
    public Document explain(ResolvedConnection connection, String collection, String queryText) {
        QuerySpec query = queryParser.parse(queryText);
        String target = requireCollection(query.targetCollection(collection));

        return withDatabase(connection, "explain on " + target, database -> {
            MongoCollection<Document> mongoCollection = database.getCollection(target);
            if (query.isAggregate()) {
                return mongoCollection.aggregate(query.pipeline()).explain();
            }
            return applyFindOptions(mongoCollection.find(query.filter()), query).explain();
        });
    }

    public List<Document> listIndexes(ResolvedConnection connection, String collection) {
        String target = requireCollection(collection);
        return withDatabase(connection, "list indexes on " + target, database ->
            database.getCollection(target).listIndexes().into(new ArrayList<>()));
    }

    /**
     * Create an index from a key document such as {@code {"email": 1}}
     *
     * @return name of the created index
     */
    public String createIndex(ResolvedConnection connection, String collection, String keysText,
                              String indexName, boolean unique) {
        String target = requireCollection(collection);
        Document keys = queryParser.parseDocument(keysText, "Index keys");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Index keys must name at least one field");
        }

        IndexOptions options = new IndexOptions().unique(unique);
        if (indexName != null && !indexName.trim().isEmpty()) {
            options.name(indexName.trim());
        }

        String created = withDatabase(connection, "create index on " + target, database ->
            database.getCollection(target).createIndex(keys, options));
        log.info("📇 Created index '{}' on {}.{}", created, connection.getName(), target);
        return created;
    }

    public void dropIndex(ResolvedConnection connection, String collection, String indexName) {
        String target = requireCollection(collection);
        if (indexName == null || indexName.trim().isEmpty()) {
            throw new IllegalArgumentException("Index name is required");
        }

        withDatabase(connection, "drop index on " + target, database -> {
            database.getCollection(target).dropIndex(indexName);
            return null;
        });
        log.info("🗑️ Dropped index '{}' on {}.{}", indexName, connection.getName(), target);
    }

    /**
     * Change an index by dropping it and creating it again from the new key document.
     * Nothing is created when the drop fails.
     *
     * @param newName name for the recreated index, or blank to keep {@code indexName}
     * @return name of the recreated index
     */
    public String updateIndex(ResolvedConnection connection, String collection, String indexName,
                              String keysText, String newName, boolean unique) {
        String target = requireCollection(collection);
        if (indexName == null || indexName.trim().isEmpty()) {
            throw new IllegalArgumentException("Index name is required");
        }
        // parse before dropping so a bad key document leaves the index in place
        Document keys = queryParser.parseDocument(keysText, "Index keys");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Index keys must name at least one field");
        }

        String name = newName != null && !newName.trim().isEmpty() ? newName.trim() : indexName.trim();
        dropIndex(connection, target, indexName.trim());
        String created = createIndex(connection, target, keysText, name, unique);
        log.info("🔁 Updated index '{}' on {}.{} as '{}'", indexName, connection.getName(), target, created);
        return created;
    }

    /**
     * Replace the document with the given {@code _id}. A 24-hex-digit id is matched as an ObjectId.
     *
     * @return true when a document was modified
     */
    public boolean replaceDocument(ResolvedConnection connection, String collection, String id, String documentText) {
        String target = requireCollection(collection);
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Document id is required");
        }
        Object documentId = QueryParser.toId(id.trim());
        Document replacement = queryParser.parseDocument(documentText, "Replacement document");
        replacement.remove("_id");

        UpdateResult result = withDatabase(connection, "replace document in " + target, database ->
            database.getCollection(target).replaceOne(Filters.eq("_id", documentId), replacement));

        log.info("✏️ Replaced document {} in {}.{}: modified={}", id, connection.getName(), target,
            result.getModifiedCount());
        return result.getModifiedCount() > 0;
    }

    private List<Document> runFind(MongoCollection<Document> collection, QuerySpec query, int page, int size) {
        FindIterable<Document> find = applyFindOptions(collection.find(query.filter()), query)
            .maxTime(properties.getQuery().getMaxTimeMs(), TimeUnit.MILLISECONDS);

        if (query.single()) {
            // findOne ignores paging: page 1 holds the document, later pages are empty
            return page == 1 ? find.limit(1).into(new ArrayList<>()) : new ArrayList<>();
        }

        return find.skip((int) skipFor(page, size))
            .limit(size)
            .into(new ArrayList<>());
    }

    private FindIterable<Document> applyFindOptions(FindIterable<Document> find, QuerySpec query) {
        if (query.projection() != null) {
            find = find.projection(query.projection());
        }
        if (query.sort() != null) {
            find = find.sort(query.sort());
        }
        return find;
    }

    private List<Document> runAggregate(MongoCollection<Document> collection, List<Document> pipeline,
                                        int page, int size) {
        PaginationMode mode = properties.getQuery().getAggregationPagination();

        if (mode == PaginationMode.SERVER_STAGES) {
            return collection.aggregate(withPaginationStages(pipeline, page, size))
                .maxTime(properties.getQuery().getMaxTimeMs(), TimeUnit.MILLISECONDS)
                .into(new ArrayList<>());
        }

        // Client side: the pipeline runs as written, the page is cut from the cursor
        long skip = skipFor(page, size);
        List<Document> documents = new ArrayList<>(size);
        AggregateIterable<Document> aggregate = collection.aggregate(pipeline)
            .maxTime(properties.getQuery().getMaxTimeMs(), TimeUnit.MILLISECONDS)
            .batchSize(size);
        try (MongoCursor<Document> cursor = aggregate.iterator()) {
            long position = 0;
            while (cursor.hasNext() && documents.size() < size) {
                Document document = cursor.next();
                if (position++ >= skip) {
                    documents.add(document);
                }
            }
        }
        return documents;
    }

    /**
     * Append {@code $skip}/{@code $limit} unless the pipeline already contains them
     */
    static List<Document> withPaginationStages(List<Document> pipeline, int page, int size) {
        long skip = skipFor(page, size);
        boolean hasSkip = pipeline.stream().anyMatch(stage -> stage.containsKey(SKIP_STAGE));
        boolean hasLimit = pipeline.stream().anyMatch(stage -> stage.containsKey(LIMIT_STAGE));

        List<Document> paginated = new ArrayList<>(pipeline);
        if (!hasSkip) {
            paginated.add(skip > Integer.MAX_VALUE ? new Document(SKIP_STAGE, skip)
                : new Document(SKIP_STAGE, (int) skip));
        }
        if (!hasLimit) {
            paginated.add(new Document(LIMIT_STAGE, size));
        }
        return paginated;
    }

    private <T> T withDatabase(ResolvedConnection connection, String action, Function<MongoDatabase, T> operation) {
        try {
            return operation.apply(clientManager.getDatabase(connection));
        } catch (MongoException e) {
            log.error("❌ Failed to {} for connection '{}': {}", action, connection.getName(), e.getMessage());
            throw MongoExceptionTranslator.translate(e, connection.getName());
        }
    }

    private int clampPageSize(int pageSize) {
        if (pageSize <= 0) {
            return properties.getQuery().getDefaultPageSize();
        }
        return Math.min(pageSize, properties.getQuery().getMaxPageSize());
    }

    private static long skipFor(int page, int size) {
        return (long) (page - 1) * size;
    }

    private static String requireCollection(String collection) {
        if (collection == null || collection.trim().isEmpty()) {
            throw new IllegalArgumentException("Collection name is required");
        }
        return collection.trim();
    }
}
