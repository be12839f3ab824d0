package com.baskettecase.mongostudio.connection;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates connection profile fields before they are saved or tested.
 *
 * Database names follow the MongoDB naming restrictions.
 *
 * @see <a href="https://www.mongodb.com/docs/manual/reference/limits/#naming-restrictions">MongoDB Naming Restrictions</a>
 */
@Component
public class ConnectionProfileValidator {

    private static final Pattern IPV4 = Pattern.compile("^(?:\\d{1,3}\\.){3}\\d{1,3}$");

    private static final Pattern HOST_NAME = Pattern.compile(
        "^(?=.{1,253}$)[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?)*$"
    );

    private static final String INVALID_DB_CHARS = "/\\. \"$*<>:|?";

    private static final int MAX_DB_NAME_LENGTH = 64;

    /**
     * Validate every field of the profile and collect all problems
     */
    public ValidationResult validate(ConnectionProfile profile) {
        List<String> errors = new ArrayList<>();

        if (profile == null) {
            errors.add("Connection profile is required");
            return new ValidationResult(false, errors);
        }

        if (isBlank(profile.getName())) {
            errors.add("Connection name is required");
        }

        if (!isValidHost(profile.getHost())) {
            errors.add("Invalid host: must be an IPv4 address or a host name");
        }

        if (!isValidPort(profile.getPort())) {
            errors.add("Port must be an integer between 1 and 65535");
        }

        if (!isValidDatabaseName(profile.getDatabase())) {
            errors.add("Invalid database name");
        }

        return new ValidationResult(errors.isEmpty(), errors);
    }

    boolean isValidHost(String host) {
        if (isBlank(host)) {
            return false;
        }
        if (IPV4.matcher(host).matches()) {
            for (String part : host.split("\\.")) {
                if (Integer.parseInt(part) > 255) {
                    return false;
                }
            }
            return true;
        }
        return HOST_NAME.matcher(host).matches();
    }

    boolean isValidPort(int port) {
        return port >= 1 && port <= 65535;
    }

    boolean isValidDatabaseName(String database) {
        if (isBlank(database) || database.length() > MAX_DB_NAME_LENGTH) {
            return false;
        }
        for (char c : database.toCharArray()) {
            if (INVALID_DB_CHARS.indexOf(c) >= 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * Validation result
     */
    public record ValidationResult(
        boolean isValid,
        List<String> errors
    ) {
        public String getErrorMessage() {
            return String.join("; ", errors);
        }
    }
}
