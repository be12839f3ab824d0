package com.baskettecase.mongostudio.api;

import com.baskettecase.mongostudio.connection.ConnectionStore;
import com.baskettecase.mongostudio.connection.ResolvedConnection;
import com.baskettecase.mongostudio.query.QueryExecutor;
import com.baskettecase.mongostudio.query.ResultPage;
import com.baskettecase.mongostudio.util.DocumentJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Query Controller
 *
 * Collections, queries and indexes of a saved connection. Query fields may be sent either as
 * JSON values or as strings holding query text (relaxed JSON or shell syntax).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/connections/{name}/collections")
@RequiredArgsConstructor
public class QueryController {

    private final ConnectionStore connectionStore;
    private final QueryExecutor queryExecutor;

    @GetMapping
    public List<String> listCollections(@PathVariable String name) {
        return queryExecutor.listCollections(connectionStore.resolve(name));
    }

    @PostMapping("/{collection}/query")
    public QueryResponse runQuery(@PathVariable String name, @PathVariable String collection,
                                  @RequestBody QueryRequest request) {
        ResolvedConnection connection = connectionStore.resolve(name);
        ResultPage page = queryExecutor.execute(connection, collection,
            text(request.query()), text(request.projection()), text(request.sort()),
            request.page() != null ? request.page() : 1,
            request.pageSize() != null ? request.pageSize() : 0);
        return QueryResponse.from(page);
    }

    @PostMapping("/{collection}/explain")
    public JsonNode explain(@PathVariable String name, @PathVariable String collection,
                            @RequestBody QueryRequest request) {
        return DocumentJson.toNode(queryExecutor.explain(connectionStore.resolve(name), collection, text(request.query())));
    }

    @GetMapping("/{collection}/sample")
    public ArrayNode sampleDocuments(@PathVariable String name, @PathVariable String collection,
                                     @RequestParam(defaultValue = "10") int limit) {
        return DocumentJson.toNodes(queryExecutor.sampleDocuments(connectionStore.resolve(name), collection, limit));
    }

    @GetMapping("/{collection}/indexes")
    public ArrayNode listIndexes(@PathVariable String name, @PathVariable String collection) {
        return DocumentJson.toNodes(queryExecutor.listIndexes(connectionStore.resolve(name), collection));
    }

    @PostMapping("/{collection}/indexes")
    public ResponseEntity<CreateIndexResponse> createIndex(@PathVariable String name, @PathVariable String collection,
                                                           @RequestBody CreateIndexRequest request) {
        String indexName = queryExecutor.createIndex(connectionStore.resolve(name), collection,
            text(request.keys()), request.name(), Boolean.TRUE.equals(request.unique()));
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreateIndexResponse(indexName));
    }

    /**
     * Redefine an index: the old one is dropped, then the new definition is created
     */
    @PutMapping("/{collection}/indexes/{indexName}")
    public CreateIndexResponse updateIndex(@PathVariable String name, @PathVariable String collection,
                                           @PathVariable String indexName, @RequestBody CreateIndexRequest request) {
        String created = queryExecutor.updateIndex(connectionStore.resolve(name), collection, indexName,
            text(request.keys()), request.name(), Boolean.TRUE.equals(request.unique()));
        return new CreateIndexResponse(created);
    }

    @DeleteMapping("/{collection}/indexes/{indexName}")
    public ResponseEntity<Void> dropIndex(@PathVariable String name, @PathVariable String collection,
                                          @PathVariable String indexName) {
        queryExecutor.dropIndex(connectionStore.resolve(name), collection, indexName);
        return ResponseEntity.noContent().build();
    }

    /**
     * Replace a whole document. The body is the new document; its {@code _id}, if any, is ignored.
     */
    @PutMapping("/{collection}/documents/{id}")
    public ReplaceDocumentResponse replaceDocument(@PathVariable String name, @PathVariable String collection,
                                                   @PathVariable String id, @RequestBody JsonNode document) {
        boolean modified = queryExecutor.replaceDocument(connectionStore.resolve(name), collection, id, text(document));
        return new ReplaceDocumentResponse(id, modified);
    }

    // A JSON string carries query text as typed; any other JSON value is the query itself
    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    public record QueryRequest(
        JsonNode query,
        JsonNode projection,
        JsonNode sort,
        Integer page,
        Integer pageSize
    ) {}

    public record QueryResponse(
        ArrayNode documents,
        int page,
        int pageSize,
        long totalKnown,
        boolean hasMore
    ) {
        static QueryResponse from(ResultPage page) {
            return new QueryResponse(DocumentJson.toNodes(page.documents()), page.page(), page.pageSize(),
                page.totalKnown(), page.hasMore());
        }
    }

    public record CreateIndexRequest(
        JsonNode keys,
        String name,
        Boolean unique
    ) {}

    public record CreateIndexResponse(String name) {}

    public record ReplaceDocumentResponse(String id, boolean modified) {}
}
