package com.baskettecase.mongostudio.exception;

/**
 * Any other driver or server failure. The message is the server-provided message, unchanged.
 */
public class DriverException extends MongoStudioException {

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
