package com.baskettecase.mongostudio.connection;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Saved MongoDB connection profile.
 *
 * The password is never part of a profile: it lives in the secret store under the profile name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionProfile {

    public static final int DEFAULT_PORT = 27017;

    private String name;        // unique, keys the profile file and the secret store
    private String host;
    private int port = DEFAULT_PORT;
    private String database;
    private String username;    // optional
    private boolean tls;

    /**
     * Copy of this profile under another name
     */
    public ConnectionProfile withName(String newName) {
        return new ConnectionProfile(newName, host, port, database, username, tls);
    }

    public boolean hasUsername() {
        return username != null && !username.trim().isEmpty();
    }
}
