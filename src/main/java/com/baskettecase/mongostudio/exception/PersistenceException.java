package com.baskettecase.mongostudio.exception;

/**
 * Reading or writing the profile file or the secret store failed.
 */
public class PersistenceException extends MongoStudioException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
