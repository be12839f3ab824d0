package com.baskettecase.mongostudio.connection;

/**
 * Outcome of a connection test
 */
public record ConnectionTestResult(
    boolean success,
    String message,
    String serverVersion
) {

    public static ConnectionTestResult ok(String serverVersion) {
        return new ConnectionTestResult(true, "Connection successful!", serverVersion);
    }

    public static ConnectionTestResult failed(String reason) {
        return new ConnectionTestResult(false, "Connection failed: " + reason, null);
    }
}
