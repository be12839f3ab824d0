package com.baskettecase.mongostudio.connection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionProfileValidator
 */
class ConnectionProfileValidatorTest {

    private ConnectionProfileValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ConnectionProfileValidator();
    }

    @Test
    void testValidProfile() {
        ConnectionProfile profile = new ConnectionProfile("prod", "mongo-1.internal.example.com", 27017,
            "sales", "reporter", true);

        ConnectionProfileValidator.ValidationResult result = validator.validate(profile);

        assertTrue(result.isValid());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void testHosts() {
        assertTrue(validator.isValidHost("localhost"));
        assertTrue(validator.isValidHost("192.168.0.10"));
        assertTrue(validator.isValidHost("cluster0.ab12c.mongodb.net"));

        assertFalse(validator.isValidHost("256.1.1.1"));
        assertFalse(validator.isValidHost("-bad.example.com"));
        assertFalse(validator.isValidHost("host name"));
        assertFalse(validator.isValidHost(""));
        assertFalse(validator.isValidHost(null));
    }

    @Test
    void testPorts() {
        assertTrue(validator.isValidPort(1));
        assertTrue(validator.isValidPort(27017));
        assertTrue(validator.isValidPort(65535));

        assertFalse(validator.isValidPort(0));
        assertFalse(validator.isValidPort(65536));
    }

    @Test
    void testDatabaseNames() {
        assertTrue(validator.isValidDatabaseName("sales_2024"));

        assertFalse(validator.isValidDatabaseName("my.db"));
        assertFalse(validator.isValidDatabaseName("my db"));
        assertFalse(validator.isValidDatabaseName("a/b"));
        assertFalse(validator.isValidDatabaseName("price$"));
        assertFalse(validator.isValidDatabaseName("x".repeat(65)));
        assertFalse(validator.isValidDatabaseName(" "));
    }

    @Test
    void testAllProblemsAreReported() {
        ConnectionProfile profile = new ConnectionProfile(" ", "bad host", 70000, "", null, false);

        ConnectionProfileValidator.ValidationResult result = validator.validate(profile);

        assertFalse(result.isValid());
        assertEquals(4, result.errors().size());
        assertTrue(result.getErrorMessage().contains("Connection name is required"));
        assertTrue(result.getErrorMessage().contains("; "));
    }

    @Test
    void testNullProfile() {
        assertFalse(validator.validate(null).isValid());
    }
}
