package com.baskettecase.mongostudio.query;

import com.baskettecase.mongostudio.exception.InvalidQueryShapeException;
import com.baskettecase.mongostudio.exception.QueryParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonInvalidOperationException;
import org.bson.Document;
import org.bson.json.JsonParseException;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns user query text into a {@link QuerySpec}.
 *
 * Accepted input:
 * <ul>
 *   <li>a JSON object: find filter</li>
 *   <li>a JSON array of objects: aggregation pipeline</li>
 *   <li>shell syntax: {@code db.orders.find({...}, {...})}, {@code db.orders.findOne({...})},
 *       {@code db.getCollection("orders").aggregate([...])}</li>
 * </ul>
 * Field names may be unquoted, strings may use single quotes, and Extended JSON
 * ({@code {"$oid": ...}}, {@code {"$date": ...}}) as well as {@code ObjectId("...")} and
 * {@code ISODate("...")} are converted to BSON types.
 */
@Slf4j
@Component
public class QueryParser {

    private static final Pattern SHELL_QUERY = Pattern.compile(
        "^db\\.(?:getCollection\\(\\s*[\"']([^\"']+)[\"']\\s*\\)|([A-Za-z_][\\w.-]*?))\\.(find|findOne|aggregate)\\s*\\((.*)\\)\\s*;?$",
        Pattern.DOTALL
    );

    private static final Pattern OBJECT_ID_CALL = Pattern.compile(
        "ObjectId\\(\\s*[\"']([0-9a-fA-F]{24})[\"']\\s*\\)");

    private static final Pattern ISO_DATE_CALL = Pattern.compile(
        "ISODate\\(\\s*[\"']([^\"']+)[\"']\\s*\\)");

    private static final Pattern OBJECT_ID_HEX = Pattern.compile("^[0-9a-fA-F]{24}$");

    private final ObjectMapper relaxedMapper = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    public QuerySpec parse(String queryText) {
        return parse(queryText, null, null);
    }

    /**
     * Parse a query with optional projection and sort given as separate texts.
     * A blank query means "find everything".
     */
    public QuerySpec parse(String queryText, String projectionText, String sortText) {
        String text = queryText == null ? "" : queryText.trim();

        Matcher shell = SHELL_QUERY.matcher(text);
        if (shell.matches()) {
            String collection = shell.group(1) != null ? shell.group(1) : shell.group(2);
            return parseShellQuery(collection, shell.group(3), shell.group(4), projectionText, sortText);
        }

        Document projection = parseOptionalDocument(projectionText, "Projection");
        Document sort = parseOptionalDocument(sortText, "Sort");

        if (text.isEmpty()) {
            return QuerySpec.find(null, new Document(), projection, sort, false);
        }

        JsonNode root = readTree(text);
        if (root.isObject()) {
            return QuerySpec.find(null, toDocument(root), projection, sort, false);
        }
        if (root.isArray()) {
            return QuerySpec.aggregate(null, toPipeline((ArrayNode) root));
        }
        throw new InvalidQueryShapeException(String.format(
            "Query must be a JSON object (find filter) or a JSON array (aggregation pipeline), got %s",
            describe(root)));
    }

    /**
     * Parse text that must be a single JSON object, e.g. index keys or a replacement document
     */
    public Document parseDocument(String text, String what) {
        if (text == null || text.trim().isEmpty()) {
            throw new InvalidQueryShapeException(what + " is required");
        }
        JsonNode node = readTree(text.trim());
        if (!node.isObject()) {
            throw new InvalidQueryShapeException(what + " must be a JSON object, got " + describe(node));
        }
        return toDocument(node);
    }

    /**
     * Document id as stored: 24 hex digits become an ObjectId, anything else stays a string
     */
    public static Object toId(String id) {
        if (id != null && OBJECT_ID_HEX.matcher(id).matches()) {
            return new ObjectId(id);
        }
        return id;
    }

    private QuerySpec parseShellQuery(String collection, String method, String arguments,
                                      String projectionText, String sortText) {
        log.debug("Parsing shell query: db.{}.{}(...)", collection, method);

        JsonNode args = readTree("[" + arguments + "]");

        if ("aggregate".equals(method)) {
            if (args.size() == 0) {
                return QuerySpec.aggregate(collection, List.of());
            }
            if (!args.get(0).isArray()) {
                throw new InvalidQueryShapeException(
                    "aggregate() expects an array of pipeline stages, got " + describe(args.get(0)));
            }
            return QuerySpec.aggregate(collection, toPipeline((ArrayNode) args.get(0)));
        }

        Document filter = new Document();
        if (args.size() > 0) {
            if (!args.get(0).isObject()) {
                throw new InvalidQueryShapeException(method + "() filter must be a JSON object, got " + describe(args.get(0)));
            }
            filter = toDocument(args.get(0));
        }

        Document projection = parseOptionalDocument(projectionText, "Projection");
        if (projection == null && args.size() > 1) {
            if (!args.get(1).isObject()) {
                throw new InvalidQueryShapeException(method + "() projection must be a JSON object, got " + describe(args.get(1)));
            }
            projection = toDocument(args.get(1));
        }

        return QuerySpec.find(collection, filter, projection, parseOptionalDocument(sortText, "Sort"),
            "findOne".equals(method));
    }

    private Document parseOptionalDocument(String text, String what) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        return parseDocument(text, what);
    }

    private List<Document> toPipeline(ArrayNode stages) {
        List<Document> pipeline = new ArrayList<>(stages.size());
        for (JsonNode stage : stages) {
            if (!stage.isObject()) {
                throw new InvalidQueryShapeException(
                    "Every aggregation pipeline stage must be a JSON object, got " + describe(stage));
            }
            pipeline.add(toDocument(stage));
        }
        return pipeline;
    }

    private JsonNode readTree(String text) {
        String normalized = ISO_DATE_CALL.matcher(OBJECT_ID_CALL.matcher(text).replaceAll("{\"\\$oid\":\"$1\"}"))
            .replaceAll("{\"\\$date\":\"$1\"}");
        try {
            JsonNode node = relaxedMapper.readTree(normalized);
            if (node == null || node.isMissingNode()) {
                throw new QueryParseException("Invalid JSON: no content", null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new QueryParseException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    // Round-trip through strict JSON so the BSON reader resolves Extended JSON types
    private Document toDocument(JsonNode node) {
        try {
            return Document.parse(relaxedMapper.writeValueAsString(node));
        } catch (JsonProcessingException | JsonParseException | BsonInvalidOperationException e) {
            throw new QueryParseException("Invalid Extended JSON: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new QueryParseException("Invalid value: " + e.getMessage(), e);
        }
    }

    private static String describe(JsonNode node) {
        return node.getNodeType().name().toLowerCase();
    }
}
