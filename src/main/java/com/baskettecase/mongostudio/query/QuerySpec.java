package com.baskettecase.mongostudio.query;

import org.bson.Document;

import java.util.List;

/**
 * A parsed query: a find filter (with optional projection and sort) or an aggregation pipeline.
 *
 * @param collection collection named by shell syntax ({@code db.orders.find(...)}), null otherwise
 * @param single     true for {@code findOne}
 */
public record QuerySpec(
    Kind kind,
    String collection,
    Document filter,
    Document projection,
    Document sort,
    List<Document> pipeline,
    boolean single
) {

    public enum Kind {
        FIND,
        AGGREGATE
    }

    public static QuerySpec find(String collection, Document filter, Document projection, Document sort, boolean single) {
        return new QuerySpec(Kind.FIND, collection, filter, projection, sort, List.of(), single);
    }

    public static QuerySpec aggregate(String collection, List<Document> pipeline) {
        return new QuerySpec(Kind.AGGREGATE, collection, null, null, null, List.copyOf(pipeline), false);
    }

    public boolean isAggregate() {
        return kind == Kind.AGGREGATE;
    }

    /**
     * Collection to run against: the one named in the query text wins over the caller's
     */
    public String targetCollection(String requested) {
        return collection != null ? collection : requested;
    }
}
