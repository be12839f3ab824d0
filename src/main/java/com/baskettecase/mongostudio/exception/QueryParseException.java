package com.baskettecase.mongostudio.exception;

/**
 * Query text is not valid JSON.
 */
public class QueryParseException extends MongoStudioException {

    public QueryParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
