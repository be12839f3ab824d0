package com.baskettecase.mongostudio.exception;

/**
 * Base class of every failure raised at the connection store and query executor boundary.
 * None of them is fatal: the caller shows the message and lets the user retry or correct input.
 */
public class MongoStudioException extends RuntimeException {

    public MongoStudioException(String message) {
        super(message);
    }

    public MongoStudioException(String message, Throwable cause) {
        super(message, cause);
    }
}
