package com.baskettecase.mongostudio.tools;

import com.baskettecase.mongostudio.connection.ConnectionProfile;
import com.baskettecase.mongostudio.connection.ConnectionStore;
import com.baskettecase.mongostudio.connection.ResolvedConnection;
import com.baskettecase.mongostudio.exception.NotFoundException;
import com.baskettecase.mongostudio.query.QueryExecutor;
import com.baskettecase.mongostudio.query.QueryParser;
import com.baskettecase.mongostudio.query.QuerySpec;
import com.baskettecase.mongostudio.query.ResultPage;
import com.baskettecase.mongostudio.template.QueryTemplate;
import com.baskettecase.mongostudio.template.QueryTemplateService;
import com.baskettecase.mongostudio.util.FuzzyMatcher;
import com.baskettecase.mongostudio.util.JsonResponseFormatter;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springaicommunity.mcp.annotation.McpTool;
import org.springaicommunity.mcp.annotation.McpToolParam;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * MongoDB Tools for MCP Server
 *
 * Read-only browsing of saved connections: collections, queries, samples, plans, indexes
 * and saved query templates.
 * Results are returned as fenced JSON so clients can render them as tables.
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/api/mcp/mcp-annotations-server.html">Spring AI MCP Annotations</a>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoTools {

    private static final int DEFAULT_SAMPLE_SIZE = 10;

    private final ConnectionStore connectionStore;
    private final QueryExecutor queryExecutor;
    private final QueryParser queryParser;
    private final QueryTemplateService templateService;
    private final MeterRegistry meterRegistry;

    private Counter toolCallCounter;

    @PostConstruct
    public void initializeMetrics() {
        toolCallCounter = Counter.builder("mongo_studio.tool.calls")
                .description("Total number of MCP tool calls")
                .register(meterRegistry);
    }

    @McpTool(
        name = "mongo.listConnections",
        description = "List saved MongoDB connection profiles (name, host, port, database, username, tls). Passwords are never returned."
    )
    public String listConnections() {
        log.info("🔧 TOOL CALLED: mongo.listConnections");
        toolCallCounter.increment();
        try {
            List<ConnectionProfile> profiles = connectionStore.list();
            return JsonResponseFormatter.formatWithMessage(
                String.format("Found %d saved connection(s):", profiles.size()), profiles);
        } catch (Exception e) {
            log.error("❌ Failed to list connections", e);
            throw new RuntimeException("Failed to list connections: " + e.getMessage(), e);
        }
    }

    @McpTool(
        name = "mongo.listCollections",
        description = "List the collections in the database of a saved connection."
    )
    public String listCollections(
        @McpToolParam(description = "Name of the saved connection", required = true) String connection
    ) {
        log.info("🔧 TOOL CALLED: mongo.listCollections (connection: {})", connection);
        toolCallCounter.increment();
        try {
            ResolvedConnection resolved = resolve(connection);
            List<String> collections = queryExecutor.listCollections(resolved);
            return JsonResponseFormatter.formatWithMessage(
                String.format("Database '%s' has %d collection(s):", resolved.getProfile().getDatabase(),
                    collections.size()),
                collections);
        } catch (Exception e) {
            log.error("❌ Failed to list collections", e);
            throw new RuntimeException("Failed to list collections: " + e.getMessage(), e);
        }
    }

    @McpTool(
        name = "mongo.runQuery",
        description = "Run a query against a collection. A JSON object is a find filter, a JSON array is an aggregation pipeline. "
            + "Shell syntax such as db.orders.find({status: 'active'}) is also accepted. Results are paginated."
    )
    public String runQuery(
        @McpToolParam(description = "Name of the saved connection", required = true) String connection,
        @McpToolParam(description = "Collection to query (optional when the query uses shell syntax)", required = false) String collection,
        @McpToolParam(description = "Find filter object, aggregation pipeline array, or shell query", required = false) String query,
        @McpToolParam(description = "Projection object for find queries", required = false) String projection,
        @McpToolParam(description = "Sort object for find queries, e.g. {\"createdAt\": -1}", required = false) String sort,
        @McpToolParam(description = "Page number starting at 1 (default: 1)", required = false) Integer page,
        @McpToolParam(description = "Documents per page (default: 50, max: 1000)", required = false) Integer pageSize
    ) {
        log.info("🔧 TOOL CALLED: mongo.runQuery");
        log.info("   📊 Parameters:");
        log.info("      - connection: {}", connection);
        log.info("      - collection: {}", collection);
        log.info("      - query: {}", query);
        log.info("      - page: {}, pageSize: {}", page, pageSize);

        toolCallCounter.increment();
        try {
            ResolvedConnection resolved = resolve(connection);
            QuerySpec parsed = queryParser.parse(query, projection, sort);
            ResultPage result = queryExecutor.execute(resolved, collection, parsed,
                page != null ? page : 1, pageSize != null ? pageSize : 0);
            return formatPageOrHint(resolved, parsed.targetCollection(collection), result);
        } catch (Exception e) {
            log.error("❌ Query execution failed", e);
            throw new RuntimeException("Query execution failed: " + e.getMessage(), e);
        }
    }

    @McpTool(
        name = "mongo.sampleDocuments",
        description = "Return a few documents from a collection to show its structure."
    )
    public String sampleDocuments(
        @McpToolParam(description = "Name of the saved connection", required = true) String connection,
        @McpToolParam(description = "Collection to sample", required = true) String collection,
        @McpToolParam(description = "Number of documents (default: 10, max: 100)", required = false) Integer limit
    ) {
        log.info("🔧 TOOL CALLED: mongo.sampleDocuments ({}.{})", connection, collection);
        toolCallCounter.increment();
        try {
            ResolvedConnection resolved = resolve(connection);
            List<Document> documents = queryExecutor.sampleDocuments(resolved, collection,
                limit != null ? limit : DEFAULT_SAMPLE_SIZE);

            if (documents.isEmpty() && limit != null && limit <= 0) {
                return "No documents requested (limit must be at least 1).";
            }
            if (documents.isEmpty()) {
                String hint = missingCollectionHint(resolved, collection);
                return hint != null ? hint : String.format("Collection '%s' is empty.", collection);
            }

            return String.format("Sample of %d document(s) from '%s':\n\n%s", documents.size(), collection,
                JsonResponseFormatter.formatDocuments(documents));
        } catch (Exception e) {
            log.error("❌ Failed to sample documents", e);
            throw new RuntimeException("Failed to sample documents: " + e.getMessage(), e);
        }
    }

    @McpTool(
        name = "mongo.explain",
        description = "Show the query plan the server chooses for a find filter or aggregation pipeline."
    )
    public String explain(
        @McpToolParam(description = "Name of the saved connection", required = true) String connection,
        @McpToolParam(description = "Collection to explain against (optional when the query uses shell syntax)", required = false) String collection,
        @McpToolParam(description = "Find filter object, aggregation pipeline array, or shell query", required = true) String query
    ) {
        log.info("🔧 TOOL CALLED: mongo.explain ({}.{})", connection, collection);
        toolCallCounter.increment();
        try {
            Document plan = queryExecutor.explain(resolve(connection), collection, query);
            return "Query plan:\n\n" + JsonResponseFormatter.formatDocument(plan);
        } catch (Exception e) {
            log.error("❌ Query explanation failed", e);
            throw new RuntimeException("Query explanation failed: " + e.getMessage(), e);
        }
    }

    @McpTool(
        name = "mongo.listIndexes",
        description = "List the indexes of a collection with their keys and options."
    )
    public String listIndexes(
        @McpToolParam(description = "Name of the saved connection", required = true) String connection,
        @McpToolParam(description = "Collection whose indexes to list", required = true) String collection
    ) {
        log.info("🔧 TOOL CALLED: mongo.listIndexes ({}.{})", connection, collection);
        toolCallCounter.increment();
        try {
            ResolvedConnection resolved = resolve(connection);
            List<Document> indexes = queryExecutor.listIndexes(resolved, collection);
            if (indexes.isEmpty()) {
                String hint = missingCollectionHint(resolved, collection);
                return hint != null ? hint : String.format("Collection '%s' has no indexes.", collection);
            }
            return String.format("Collection '%s' has %d index(es):\n\n%s", collection, indexes.size(),
                JsonResponseFormatter.formatDocuments(indexes));
        } catch (Exception e) {
            log.error("❌ Failed to list indexes", e);
            throw new RuntimeException("Failed to list indexes: " + e.getMessage(), e);
        }
    }

    @McpTool(
        name = "mongo.listTemplates",
        description = "List saved query templates (name, type, query, description, tags). "
            + "Optionally filter by a search text matched against name and description."
    )
    public String listTemplates(
        @McpToolParam(description = "Case-insensitive text to match in template name or description", required = false) String search
    ) {
        log.info("🔧 TOOL CALLED: mongo.listTemplates (search: {})", search);
        toolCallCounter.increment();
        try {
            List<QueryTemplate> templates = templateService.search(search);
            return JsonResponseFormatter.formatWithMessage(
                String.format("Found %d query template(s):", templates.size()), templates);
        } catch (Exception e) {
            log.error("❌ Failed to list query templates", e);
            throw new RuntimeException("Failed to list query templates: " + e.getMessage(), e);
        }
    }

    @McpTool(
        name = "mongo.runTemplate",
        description = "Run a saved query template against a collection of a saved connection. Results are paginated."
    )
    public String runTemplate(
        @McpToolParam(description = "Name of the saved connection", required = true) String connection,
        @McpToolParam(description = "Collection to run the template against", required = true) String collection,
        @McpToolParam(description = "Name of the saved query template", required = true) String template,
        @McpToolParam(description = "Page number starting at 1 (default: 1)", required = false) Integer page,
        @McpToolParam(description = "Documents per page (default: 50, max: 1000)", required = false) Integer pageSize
    ) {
        log.info("🔧 TOOL CALLED: mongo.runTemplate ('{}' on {}.{})", template, connection, collection);
        toolCallCounter.increment();
        try {
            ResolvedConnection resolved = resolve(connection);
            QuerySpec query = templateService.toQuery(resolveTemplate(template));
            ResultPage result = queryExecutor.execute(resolved, collection, query,
                page != null ? page : 1, pageSize != null ? pageSize : 0);
            return formatPageOrHint(resolved, query.targetCollection(collection), result);
        } catch (Exception e) {
            log.error("❌ Template execution failed", e);
            throw new RuntimeException("Template execution failed: " + e.getMessage(), e);
        }
    }

    /**
     * A page of results, or a hint when an empty page comes from a collection that does not exist
     */
    private String formatPageOrHint(ResolvedConnection resolved, String collection, ResultPage result)
            throws JsonProcessingException {
        if (result.isEmpty() && collection != null) {
            String hint = missingCollectionHint(resolved, collection);
            if (hint != null) {
                return hint;
            }
        }
        return JsonResponseFormatter.formatPage(result.page(), result.totalKnown(), result.hasMore(),
            result.documents());
    }

    private QueryTemplate resolveTemplate(String template) {
        return templateService.load(template).orElseThrow(() -> {
            List<String> names = templateService.list().stream()
                .map(QueryTemplate::getName)
                .collect(Collectors.toList());
            List<String> suggestions = FuzzyMatcher.findClosestMatches(template, names);
            String message = "Query template not found: " + template;
            return new IllegalArgumentException(suggestions.isEmpty()
                ? message
                : message + ". Did you mean: " + String.join(", ", suggestions) + "?");
        });
    }

    /**
     * Resolve a connection, suggesting saved names when it is not found
     */
    private ResolvedConnection resolve(String connection) {
        try {
            return connectionStore.resolve(connection);
        } catch (NotFoundException e) {
            List<String> names = connectionStore.list().stream()
                .map(ConnectionProfile::getName)
                .collect(Collectors.toList());
            List<String> suggestions = FuzzyMatcher.findClosestMatches(connection, names);
            if (suggestions.isEmpty()) {
                throw e;
            }
            throw new IllegalArgumentException(e.getMessage() + ". Did you mean: " + String.join(", ", suggestions) + "?", e);
        }
    }

    /**
     * Message for a collection that does not exist, or null when it does
     */
    private String missingCollectionHint(ResolvedConnection resolved, String collection) {
        List<String> collections = queryExecutor.listCollections(resolved);
        if (collections.contains(collection)) {
            return null;
        }

        String message = String.format("Collection '%s' does not exist in database '%s'.", collection,
            resolved.getProfile().getDatabase());
        List<String> suggestions = FuzzyMatcher.findClosestMatches(collection, collections);
        if (!suggestions.isEmpty()) {
            message += " Did you mean: " + String.join(", ", suggestions) + "?";
        }
        log.info("🔍 {}", message);
        return message;
    }
}
