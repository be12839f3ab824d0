package com.baskettecase.mongostudio.query;

import org.bson.Document;

import java.util.List;

/**
 * One page of query results.
 *
 * @param page       page number, starting at 1
 * @param totalKnown documents seen up to and including this page
 * @param hasMore    true when the page is full, so a next page may exist
 */
public record ResultPage(
    List<Document> documents,
    int page,
    int pageSize,
    long totalKnown,
    boolean hasMore
) {

    public static ResultPage of(List<Document> documents, int page, int pageSize) {
        long totalKnown = (long) (page - 1) * pageSize + documents.size();
        return new ResultPage(List.copyOf(documents), page, pageSize, totalKnown, documents.size() >= pageSize);
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
