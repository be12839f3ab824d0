package com.baskettecase.mongostudio.connection;

import lombok.Data;
import lombok.ToString;

/**
 * Connection profile merged with its password, ready for the driver.
 * Never log or persist this object - the password is in plaintext!
 */
@Data
public class ResolvedConnection {

    private final ConnectionProfile profile;

    @ToString.Exclude
    private final String password;  // empty string when none stored

    public String getName() {
        return profile.getName();
    }

    /**
     * Fingerprint of everything a cached client depends on. A change means the client must be rebuilt.
     */
    public String getSettingsKey() {
        return String.format("%s|%s|%d|%s|%s|%s|%d",
            profile.getName(), profile.getHost(), profile.getPort(), profile.getDatabase(),
            profile.getUsername(), profile.isTls(), password == null ? 0 : password.hashCode());
    }
}
