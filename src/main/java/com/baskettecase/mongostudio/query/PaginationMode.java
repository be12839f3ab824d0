package com.baskettecase.mongostudio.query;

/**
 * How aggregation results are paginated.
 */
public enum PaginationMode {

    /**
     * The pipeline runs unmodified and the page is cut from the cursor on the client.
     */
    CLIENT_SIDE,

    /**
     * {@code $skip} and {@code $limit} stages are appended unless the pipeline already has them.
     */
    SERVER_STAGES
}
