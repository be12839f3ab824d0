package com.baskettecase.mongostudio.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.bson.Document;

import java.util.List;

/**
 * Formats MCP tool responses as JSON wrapped in a markdown code block.
 *
 * Clients render fenced JSON arrays as tables, so every tool that returns documents or
 * names goes through here.
 */
public class JsonResponseFormatter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Format a list of values as a JSON array wrapped in a ```json code block
     *
     * @return formatted block, or an empty string when there is nothing to show
     */
    public static String formatAsJsonTable(List<?> data) throws JsonProcessingException {
        if (data == null || data.isEmpty()) {
            return "";
        }

        String json = mapper.writeValueAsString(data);
        return "```json\n" + json + "\n```";
    }

    /**
     * Format documents as relaxed Extended JSON so ObjectIds and dates keep their type markers
     */
    public static String formatDocuments(List<Document> documents) throws JsonProcessingException {
        if (documents == null || documents.isEmpty()) {
            return "";
        }

        String json = mapper.writeValueAsString(DocumentJson.toNodes(documents));
        return "```json\n" + json + "\n```";
    }

    public static String formatDocument(Document document) throws JsonProcessingException {
        return "```json\n" + mapper.writeValueAsString(DocumentJson.toNode(document)) + "\n```";
    }

    /**
     * Format a list with a descriptive message
     */
    public static String formatWithMessage(String message, List<?> data) throws JsonProcessingException {
        if (data == null || data.isEmpty()) {
            return message + "\n\nNo data found.";
        }

        return message + "\n\n" + formatAsJsonTable(data);
    }

    /**
     * Format one page of query results with its position
     */
    public static String formatPage(int page, long totalKnown, boolean hasMore, List<Document> documents)
            throws JsonProcessingException {
        if (documents == null || documents.isEmpty()) {
            return String.format("Page %d returned 0 documents.", page);
        }

        String plural = documents.size() == 1 ? "document" : "documents";
        String more = hasMore ? " More results are available on the next page." : "";
        return String.format("Page %d returned %d %s (%d seen so far).%s\n\n%s",
            page, documents.size(), plural, totalKnown, more, formatDocuments(documents));
    }
}
