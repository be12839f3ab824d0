package com.baskettecase.mongostudio.connection;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import com.baskettecase.mongostudio.exception.MongoExceptionTranslator;
import com.baskettecase.mongostudio.exception.NotFoundException;
import com.baskettecase.mongostudio.security.SecretStore;
import com.mongodb.MongoException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Connection Store
 *
 * Persists named connection profiles to the local profile file and their passwords to the
 * secret store. The profile name keys both, so renaming migrates both.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionStore {

    private final ConnectionProfileRepository repository;
    private final SecretStore secretStore;
    private final MongoClientManager clientManager;
    private final ConnectionProfileValidator validator;
    private final MongoStudioProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Save a profile, replacing an existing one with the same name in place.
     * A blank password keeps whatever password is already stored.
     *
     * The password is written before the profile file, so a failing secret store leaves
     * the profile list untouched. If the profile file cannot be written the previous
     * password is restored.
     */
    public synchronized void save(ConnectionProfile profile, String password) {
        assertValid(profile);

        List<ConnectionProfile> profiles = repository.findAll();
        int index = indexOf(profiles, profile.getName());
        if (index >= 0) {
            profiles.set(index, profile);
        } else {
            profiles.add(profile);
        }

        boolean newPassword = password != null && !password.isEmpty();
        Optional<String> previousPassword = Optional.empty();
        if (newPassword) {
            previousPassword = secretStore.get(service(), profile.getName());
            secretStore.put(service(), profile.getName(), password);
        }

        try {
            repository.saveAll(profiles);
        } catch (RuntimeException e) {
            if (newPassword) {
                restoreSecret(profile.getName(), previousPassword, e);
            }
            throw e;
        }

        // Drop a client built from the old settings
        clientManager.evict(profile.getName());

        log.info("💾 {} connection profile '{}' ({}:{}/{})", index >= 0 ? "Updated" : "Saved",
            profile.getName(), profile.getHost(), profile.getPort(), profile.getDatabase());
    }

    /**
     * All stored profiles without passwords, in insertion order
     */
    public List<ConnectionProfile> list() {
        return repository.findAll();
    }

    public boolean exists(String name) {
        return repository.findByName(name).isPresent();
    }

    /**
     * Profile merged with its stored password (empty string if none)
     *
     * @throws NotFoundException if no profile has this name
     */
    public ResolvedConnection resolve(String name) {
        ConnectionProfile profile = repository.findByName(name)
            .orElseThrow(() -> new NotFoundException(name));
        String password = secretStore.get(service(), name).orElse("");
        return new ResolvedConnection(profile, password);
    }

    /**
     * Remove a profile and its stored password
     *
     * @throws NotFoundException if no profile has this name
     */
    public synchronized void delete(String name) {
        List<ConnectionProfile> profiles = repository.findAll();
        int index = indexOf(profiles, name);
        if (index < 0) {
            throw new NotFoundException(name);
        }

        profiles.remove(index);
        repository.saveAll(profiles);
        secretStore.delete(service(), name);
        clientManager.evict(name);

        log.info("🗑️ Deleted connection profile '{}'", name);
    }

    /**
     * Move a profile and its password to a new name, keeping its position in the list
     *
     * @throws NotFoundException if {@code oldName} is not stored
     * @throws IllegalArgumentException if {@code newName} is blank or already taken
     */
    public synchronized void rename(String oldName, String newName) {
        if (newName == null || newName.trim().isEmpty()) {
            throw new IllegalArgumentException("Connection name is required");
        }
        if (newName.equals(oldName)) {
            return;
        }

        List<ConnectionProfile> profiles = repository.findAll();
        int index = indexOf(profiles, oldName);
        if (index < 0) {
            throw new NotFoundException(oldName);
        }
        if (indexOf(profiles, newName) >= 0) {
            throw new IllegalArgumentException("A connection named '" + newName + "' already exists");
        }

        String password = secretStore.get(service(), oldName).orElse(null);
        if (password != null) {
            secretStore.put(service(), newName, password);
        }

        profiles.set(index, profiles.get(index).withName(newName));
        try {
            repository.saveAll(profiles);
        } catch (RuntimeException e) {
            if (password != null) {
                restoreSecret(newName, Optional.empty(), e);
            }
            throw e;
        }

        secretStore.delete(service(), oldName);
        clientManager.evict(oldName);

        log.info("✏️ Renamed connection profile '{}' to '{}'", oldName, newName);
    }

    /**
     * Update a stored profile, renaming it first when the profile carries a different name
     *
     * @throws NotFoundException if {@code currentName} is not stored
     */
    public synchronized void update(String currentName, ConnectionProfile profile, String password) {
        assertValid(profile);
        if (!exists(currentName)) {
            throw new NotFoundException(currentName);
        }
        if (!profile.getName().equals(currentName)) {
            rename(currentName, profile.getName());
        }
        save(profile, password);
    }

    /**
     * Attempt a short-lived connection with the given settings. Nothing is persisted.
     */
    public ConnectionTestResult test(ConnectionProfile profile, String password) {
        ConnectionProfileValidator.ValidationResult validation = validator.validate(profile);
        if (!validation.isValid()) {
            recordTest("invalid");
            return ConnectionTestResult.failed(validation.getErrorMessage());
        }

        try {
            String version = clientManager.ping(new ResolvedConnection(profile, password != null ? password : ""));
            log.info("✅ Connection test successful: {}:{}", profile.getHost(), profile.getPort());
            recordTest("success");
            return ConnectionTestResult.ok(version);
        } catch (MongoException e) {
            String reason = MongoExceptionTranslator.translate(e, profile.getName()).getMessage();
            log.error("❌ Connection test failed for {}:{}: {}", profile.getHost(), profile.getPort(), e.getMessage());
            recordTest("failure");
            return ConnectionTestResult.failed(reason);
        }
    }

    private void assertValid(ConnectionProfile profile) {
        ConnectionProfileValidator.ValidationResult validation = validator.validate(profile);
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid connection profile: " + validation.getErrorMessage());
        }
    }

    /**
     * Put back the secret held before a failed profile write
     */
    private void restoreSecret(String name, Optional<String> previous, RuntimeException failure) {
        try {
            if (previous.isPresent()) {
                secretStore.put(service(), name, previous.get());
            } else {
                secretStore.delete(service(), name);
            }
        } catch (RuntimeException rollbackFailure) {
            log.error("❌ Could not restore the stored password of '{}': {}", name, rollbackFailure.getMessage());
            failure.addSuppressed(rollbackFailure);
        }
    }

    private void recordTest(String result) {
        meterRegistry.counter("mongo_studio.connection.tests", "result", result).increment();
    }

    private String service() {
        return properties.getKeyringService();
    }

    private static int indexOf(List<ConnectionProfile> profiles, String name) {
        for (int i = 0; i < profiles.size(); i++) {
            if (profiles.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
