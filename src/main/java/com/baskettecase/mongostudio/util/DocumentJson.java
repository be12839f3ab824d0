package com.baskettecase.mongostudio.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

import java.util.List;

/**
 * Converts BSON documents to relaxed Extended JSON, the form results are shown in.
 *
 * ObjectIds render as {@code {"$oid": "..."}} and dates as {@code {"$date": "..."}} so that
 * a document can be edited and sent back through the query parser unchanged.
 */
public final class DocumentJson {

    private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder()
            .outputMode(JsonMode.RELAXED)
            .build();

    private static final ObjectMapper mapper = new ObjectMapper();

    private DocumentJson() {
    }

    public static String toJson(Document document) {
        return document.toJson(RELAXED);
    }

    /**
     * Document as a Jackson tree, for embedding in REST and tool responses
     */
    public static JsonNode toNode(Document document) {
        try {
            return mapper.readTree(toJson(document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Document could not be rendered as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static ArrayNode toNodes(List<Document> documents) {
        ArrayNode array = mapper.createArrayNode();
        documents.forEach(document -> array.add(toNode(document)));
        return array;
    }
}
