package com.baskettecase.mongostudio.exception;

import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;

/**
 * Converts driver exceptions into the studio's error taxonomy.
 */
public final class MongoExceptionTranslator {

    private MongoExceptionTranslator() {
    }

    public static MongoStudioException translate(MongoException e, String connectionName) {
        if (e instanceof MongoSecurityException) {
            return new ConnectionFailedException(String.format(
                "MongoDB authentication failed for connection '%s'. Please check your username and password.",
                connectionName), e);
        }
        if (e instanceof MongoTimeoutException || e instanceof MongoSocketException) {
            return new ConnectionFailedException(String.format(
                "Cannot reach MongoDB server for connection '%s'. Check the host, port, and network.",
                connectionName), e);
        }
        if (e instanceof MongoCommandException commandException) {
            return new DriverException(commandException.getErrorMessage(), e);
        }
        return new DriverException(e.getMessage(), e);
    }
}
