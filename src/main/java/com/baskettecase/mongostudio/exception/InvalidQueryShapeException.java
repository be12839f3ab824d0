package com.baskettecase.mongostudio.exception;

/**
 * Query text parsed as JSON but is neither a find filter (object) nor a pipeline (array of objects).
 */
public class InvalidQueryShapeException extends MongoStudioException {

    public InvalidQueryShapeException(String message) {
        super(message);
    }
}
