package com.baskettecase.mongostudio.query;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import com.baskettecase.mongostudio.connection.ConnectionProfile;
import com.baskettecase.mongostudio.connection.MongoClientManager;
import com.baskettecase.mongostudio.connection.ResolvedConnection;
import com.baskettecase.mongostudio.exception.ConnectionFailedException;
import com.baskettecase.mongostudio.exception.DriverException;
import com.baskettecase.mongostudio.exception.InvalidQueryShapeException;
import com.baskettecase.mongostudio.exception.QueryParseException;
import com.mongodb.client.MongoCollection;
import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryExecutor against an in-process MongoDB server
 */
class QueryExecutorTest {

    private MongoServer server;
    private MongoClientManager clientManager;
    private MongoStudioProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private QueryExecutor executor;
    private ResolvedConnection connection;

    @BeforeEach
    void setUp() {
        server = new MongoServer(new MemoryBackend());
        InetSocketAddress address = server.bind();

        properties = new MongoStudioProperties();
        meterRegistry = new SimpleMeterRegistry();
        clientManager = new MongoClientManager(properties);
        executor = new QueryExecutor(clientManager, new QueryParser(), properties, meterRegistry);
        executor.initializeMetrics();

        ConnectionProfile profile = new ConnectionProfile("local", address.getHostString(), address.getPort(),
            "testdb", null, false);
        connection = new ResolvedConnection(profile, "");

        MongoCollection<Document> employees = clientManager.getDatabase(connection).getCollection("employees");
        employees.insertMany(List.of(
            new Document("name", "Ada").append("department", "engineering").append("status", "active"),
            new Document("name", "Grace").append("department", "engineering").append("status", "active"),
            new Document("name", "Linus").append("department", "engineering").append("status", "inactive"),
            new Document("name", "Barbara").append("department", "sales").append("status", "active"),
            new Document("name", "Edsger").append("department", "research").append("status", "active")
        ));

        List<Document> items = IntStream.rangeClosed(1, 25)
            .mapToObj(i -> new Document("seq", i))
            .collect(Collectors.toList());
        clientManager.getDatabase(connection).getCollection("items").insertMany(items);
    }

    @AfterEach
    void tearDown() {
        clientManager.cleanup();
        server.shutdownNow();
    }

    @Test
    void testFindReturnsOnlyMatchingDocuments() {
        ResultPage page = executor.execute(connection, "employees", "{\"status\": \"active\"}", 1, 50);

        assertEquals(4, page.documents().size());
        assertTrue(page.documents().stream().allMatch(doc -> "active".equals(doc.getString("status"))));
        assertEquals(1, page.page());
        assertEquals(4, page.totalKnown());
        assertFalse(page.hasMore());
    }

    @Test
    void testEmptyQueryReturnsAllDocuments() {
        ResultPage page = executor.execute(connection, "employees", "", 1, 50);

        assertEquals(5, page.documents().size());
    }

    @Test
    void testAggregationGroupsByDepartment() {
        String pipeline = "[{\"$match\": {\"status\": \"active\"}},"
            + " {\"$group\": {\"_id\": \"$department\", \"count\": {\"$sum\": 1}}}]";

        ResultPage page = executor.execute(connection, "employees", pipeline, 1, 50);

        Map<String, Integer> counts = new HashMap<>();
        for (Document document : page.documents()) {
            counts.put(document.getString("_id"), ((Number) document.get("count")).intValue());
        }
        assertEquals(Map.of("engineering", 2, "sales", 1, "research", 1), counts);
    }

    @Test
    void testSecondPageReturnsDocumentsElevenToTwenty() {
        ResultPage page = executor.execute(connection, "items", "{}", null, "{\"seq\": 1}", 2, 10);

        assertEquals(List.of(11, 12, 13, 14, 15, 16, 17, 18, 19, 20), sequence(page));
        assertEquals(20, page.totalKnown());
        assertTrue(page.hasMore());
    }

    @Test
    void testLastPageIsPartialAndPageAfterItIsEmpty() {
        ResultPage last = executor.execute(connection, "items", "{}", null, "{\"seq\": 1}", 3, 10);
        ResultPage beyond = executor.execute(connection, "items", "{}", null, "{\"seq\": 1}", 4, 10);

        assertEquals(List.of(21, 22, 23, 24, 25), sequence(last));
        assertFalse(last.hasMore());
        assertTrue(beyond.isEmpty());
        assertFalse(beyond.hasMore());
    }

    @Test
    void testAggregationPagesOnClientSide() {
        ResultPage page = executor.execute(connection, "items", "[{\"$sort\": {\"seq\": 1}}]", 2, 10);

        assertEquals(List.of(11, 12, 13, 14, 15, 16, 17, 18, 19, 20), sequence(page));
    }

    @Test
    void testAggregationPagesWithServerStages() {
        properties.getQuery().setAggregationPagination(PaginationMode.SERVER_STAGES);

        ResultPage page = executor.execute(connection, "items", "[{\"$sort\": {\"seq\": 1}}]", 3, 10);

        assertEquals(List.of(21, 22, 23, 24, 25), sequence(page));
    }

    @Test
    void testPaginationStagesAreNotAddedTwice() {
        List<Document> pipeline = List.of(new Document("$match", new Document()), new Document("$limit", 3));

        List<Document> paginated = QueryExecutor.withPaginationStages(pipeline, 2, 10);

        assertEquals(3, paginated.size());
        assertEquals(new Document("$skip", 10), paginated.get(2));
    }

    @Test
    void testProjectionLimitsReturnedFields() {
        ResultPage page = executor.execute(connection, "employees", "{\"name\": \"Ada\"}",
            "{\"name\": 1, \"_id\": 0}", 1, 50);

        assertEquals(1, page.documents().size());
        assertEquals(new Document("name", "Ada"), page.documents().get(0));
    }

    @Test
    void testShellSyntaxChoosesCollection() {
        ResultPage page = executor.execute(connection, null, "db.employees.find({department: 'engineering'})", 1, 50);

        assertEquals(3, page.documents().size());
    }

    @Test
    void testFindOneReturnsSingleDocument() {
        ResultPage page = executor.execute(connection, null, "db.employees.findOne({status: 'active'})", 1, 50);

        assertEquals(1, page.documents().size());
    }

    @Test
    void testPageSizeIsClampedToMaximum() {
        properties.getQuery().setMaxPageSize(5);

        ResultPage page = executor.execute(connection, "items", "{}", 1, 500);

        assertEquals(5, page.pageSize());
        assertEquals(5, page.documents().size());
    }

    @Test
    void testMalformedJsonFailsBeforeConnecting() {
        MongoClientManager freshManager = new MongoClientManager(properties);
        QueryExecutor freshExecutor = new QueryExecutor(freshManager, new QueryParser(), properties, meterRegistry);
        freshExecutor.initializeMetrics();

        assertThrows(QueryParseException.class,
            () -> freshExecutor.execute(connection, "employees", "{\"status\":}", 1, 10));
        assertEquals(0, freshManager.getOpenClientCount());
    }

    @Test
    void testScalarQueryIsRejected() {
        assertThrows(InvalidQueryShapeException.class,
            () -> executor.execute(connection, "employees", "\"active\"", 1, 10));
    }

    @Test
    void testMissingCollectionNameIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> executor.execute(connection, " ", "{}", 1, 10));
    }

    @Test
    void testListCollections() {
        List<String> collections = executor.listCollections(connection);

        assertTrue(collections.contains("employees"));
        assertTrue(collections.contains("items"));
    }

    @Test
    void testSampleDocumentsRespectsLimit() {
        List<Document> sample = executor.sampleDocuments(connection, "items", 3);

        assertEquals(3, sample.size());
    }

    @Test
    void testSampleDocumentsWithNonPositiveLimitIsEmpty() {
        assertTrue(executor.sampleDocuments(connection, "items", 0).isEmpty());
        assertTrue(executor.sampleDocuments(connection, "items", -5).isEmpty());
    }

    @Test
    void testFindPageFarBeyondTheEndIsEmpty() {
        ResultPage page = executor.execute(connection, "items", "{}", 300_000_000, 10);

        assertTrue(page.isEmpty());
        assertEquals(300_000_000, page.page());
        assertFalse(page.hasMore());
    }

    @Test
    void testAggregationPageFarBeyondTheEndIsEmpty() {
        ResultPage page = executor.execute(connection, "items", "[{\"$sort\": {\"seq\": 1}}]", 300_000_000, 10);

        assertTrue(page.isEmpty());
        assertFalse(page.hasMore());
    }

    @Test
    void testPaginationStagesUseLongSkipWhenIntOverflows() {
        List<Document> stages = QueryExecutor.withPaginationStages(List.of(), 300_000_000, 10);

        assertEquals(new Document("$skip", 2_999_999_990L), stages.get(0));
    }

    @Test
    void testUnreachableServerRaisesConnectionFailed() throws Exception {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        properties.setServerSelectionTimeoutMs(500);
        ResolvedConnection offline = new ResolvedConnection(
            new ConnectionProfile("offline", "127.0.0.1", freePort, "testdb", null, false), "");

        ConnectionFailedException e = assertThrows(ConnectionFailedException.class,
            () -> executor.execute(offline, "items", "{}", 1, 10));

        assertTrue(e.getMessage().contains("Cannot reach MongoDB server for connection 'offline'"));
    }

    @Test
    void testStoppedServerRaisesConnectionFailed() {
        MongoServer stopped = new MongoServer(new MemoryBackend());
        InetSocketAddress address = stopped.bind();
        stopped.shutdownNow();
        properties.setServerSelectionTimeoutMs(500);
        ResolvedConnection gone = new ResolvedConnection(
            new ConnectionProfile("gone", address.getHostString(), address.getPort(), "testdb", null, false), "");

        assertThrows(ConnectionFailedException.class, () -> executor.execute(gone, "items", "{}", 1, 10));
    }

    @Test
    void testUnknownPipelineStageReportsServerMessage() {
        DriverException e = assertThrows(DriverException.class,
            () -> executor.execute(connection, "items", "[{\"$bogusStage\": 1}]", 1, 10));

        assertEquals("Unrecognized pipeline stage name: '$bogusStage'", e.getMessage());
        assertEquals(1.0, meterRegistry.get("mongo_studio.query.errors").counter().count());
    }

    @Test
    void testCreateListAndDropIndex() {
        String name = executor.createIndex(connection, "employees", "{name: 1}", "by_name", true);

        assertEquals("by_name", name);
        List<String> names = indexNames();
        assertTrue(names.contains("_id_"));
        assertTrue(names.contains("by_name"));

        executor.dropIndex(connection, "employees", "by_name");

        assertFalse(indexNames().contains("by_name"));
    }

    @Test
    void testUpdateIndexRecreatesWithNewDefinition() {
        executor.createIndex(connection, "employees", "{name: 1}", "by_name", false);

        String updated = executor.updateIndex(connection, "employees", "by_name", "{name: 1, department: 1}",
            "by_name_department", true);

        assertEquals("by_name_department", updated);
        List<String> names = indexNames();
        assertFalse(names.contains("by_name"));
        assertTrue(names.contains("by_name_department"));
    }

    @Test
    void testUpdateIndexKeepsNameWhenNoNewNameGiven() {
        executor.createIndex(connection, "employees", "{name: 1}", "by_name", false);

        assertEquals("by_name", executor.updateIndex(connection, "employees", "by_name", "{name: -1}", " ", false));
        assertTrue(indexNames().contains("by_name"));
    }

    @Test
    void testUpdateMissingIndexCreatesNothing() {
        assertThrows(DriverException.class,
            () -> executor.updateIndex(connection, "employees", "no_such_index", "{status: 1}", "by_status", false));

        assertFalse(indexNames().contains("by_status"));
    }

    @Test
    void testUpdateIndexWithBadKeysLeavesIndexInPlace() {
        executor.createIndex(connection, "employees", "{name: 1}", "by_name", false);

        assertThrows(QueryParseException.class,
            () -> executor.updateIndex(connection, "employees", "by_name", "{name: ", null, false));

        assertTrue(indexNames().contains("by_name"));
    }

    @Test
    void testReplaceDocumentByObjectId() {
        Document ada = clientManager.getDatabase(connection).getCollection("employees")
            .find(new Document("name", "Ada")).first();
        assertNotNull(ada);
        ObjectId id = ada.getObjectId("_id");

        boolean modified = executor.replaceDocument(connection, "employees", id.toHexString(),
            "{name: 'Ada', department: 'research', status: 'active'}");

        assertTrue(modified);
        Document replaced = clientManager.getDatabase(connection).getCollection("employees")
            .find(new Document("_id", id)).first();
        assertNotNull(replaced);
        assertEquals("research", replaced.getString("department"));
    }

    @Test
    void testQueryMetricsAreRecorded() {
        executor.execute(connection, "employees", "{}", 1, 10);

        assertEquals(1.0, meterRegistry.get("mongo_studio.query.executions").counter().count());
        assertEquals(1, meterRegistry.get("mongo_studio.query.duration").timer().count());
    }

    private List<String> indexNames() {
        return executor.listIndexes(connection, "employees").stream()
            .map(index -> index.getString("name"))
            .collect(Collectors.toList());
    }

    private static List<Integer> sequence(ResultPage page) {
        List<Integer> values = new ArrayList<>();
        page.documents().forEach(document -> values.add(document.getInteger("seq")));
        return values;
    }
}
