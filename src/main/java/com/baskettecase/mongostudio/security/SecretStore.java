package com.baskettecase.mongostudio.security;

import java.util.Optional;

/**
 * Keyed secret storage: {@code (service, key) -> secret}.
 *
 * Implementations raise {@link com.baskettecase.mongostudio.exception.PersistenceException}
 * when the underlying storage cannot be read or written.
 */
public interface SecretStore {

    Optional<String> get(String service, String key);

    void put(String service, String key, String secret);

    /**
     * Remove a secret. Returns false when nothing was stored under the key.
     */
    boolean delete(String service, String key);

    /**
     * Whether the store passed its write/read/delete self-check.
     */
    boolean isAvailable();
}
