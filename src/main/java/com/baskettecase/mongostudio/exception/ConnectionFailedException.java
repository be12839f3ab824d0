package com.baskettecase.mongostudio.exception;

/**
 * The server could not be reached or rejected the credentials within the configured timeouts.
 */
public class ConnectionFailedException extends MongoStudioException {

    public ConnectionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
