package com.baskettecase.mongostudio.security;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import com.baskettecase.mongostudio.exception.PersistenceException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Secret store backed by a JSON file of AES-256-GCM encrypted values.
 *
 * Layout: {@code {"<service>": {"<key>": "<base64 iv+ciphertext>"}}}. Plaintext never touches disk.
 */
@Slf4j
@Service
public class EncryptedFileSecretStore implements SecretStore {

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, String>>> SECRETS_TYPE =
        new TypeReference<>() {};

    static final String SELF_CHECK_SUFFIX = "-selfcheck";
    private static final String SELF_CHECK_KEY = "__test_key__";
    private static final String SELF_CHECK_VALUE = "__test_value__";

    private final CredentialEncryptionService encryptionService;
    private final Path secretsPath;
    private final String selfCheckService;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private volatile boolean available = true;
    private volatile String unavailableReason;

    public EncryptedFileSecretStore(CredentialEncryptionService encryptionService, MongoStudioProperties properties) {
        this.encryptionService = encryptionService;
        this.secretsPath = properties.getStoragePath().resolve(properties.getSecretsFile());
        // separate from the service holding profile passwords
        this.selfCheckService = properties.getKeyringService() + SELF_CHECK_SUFFIX;
    }

    /**
     * Verify the store can write, read back and delete a secret
     */
    @PostConstruct
    public void verifyStorage() {
        try {
            put(selfCheckService, SELF_CHECK_KEY, SELF_CHECK_VALUE);
            String value = get(selfCheckService, SELF_CHECK_KEY).orElse(null);
            if (!SELF_CHECK_VALUE.equals(value)) {
                throw new PersistenceException("Secret store returned a different value than was written");
            }
            log.info("✅ Secret store verified at {}", secretsPath);
        } catch (RuntimeException e) {
            available = false;
            unavailableReason = e.getMessage();
            log.warn("⚠️ Secret store verification failed, stored passwords are unavailable: {}", e.getMessage());
        } finally {
            if (available) {
                delete(selfCheckService, SELF_CHECK_KEY);
            }
        }
    }

    @Override
    public synchronized Optional<String> get(String service, String key) {
        assertAvailable();
        Map<String, String> entries = readAll().get(service);
        if (entries == null || !entries.containsKey(key)) {
            return Optional.empty();
        }
        try {
            return Optional.of(encryptionService.decrypt(entries.get(key)));
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new PersistenceException("Stored secret for '" + key + "' cannot be decrypted", e);
        }
    }

    @Override
    public synchronized void put(String service, String key, String secret) {
        assertAvailable();
        LinkedHashMap<String, LinkedHashMap<String, String>> secrets = readAll();
        secrets.computeIfAbsent(service, s -> new LinkedHashMap<>())
            .put(key, encryptionService.encrypt(secret));
        writeAll(secrets);
    }

    @Override
    public synchronized boolean delete(String service, String key) {
        assertAvailable();
        LinkedHashMap<String, LinkedHashMap<String, String>> secrets = readAll();
        Map<String, String> entries = secrets.get(service);
        if (entries == null || entries.remove(key) == null) {
            return false;
        }
        if (entries.isEmpty()) {
            secrets.remove(service);
        }
        writeAll(secrets);
        return true;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    private void assertAvailable() {
        if (!available) {
            throw new PersistenceException(
                "Secure credential storage is not available or not working: " + unavailableReason);
        }
    }

    private LinkedHashMap<String, LinkedHashMap<String, String>> readAll() {
        if (!Files.exists(secretsPath)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, LinkedHashMap<String, String>> secrets =
                mapper.readValue(secretsPath.toFile(), SECRETS_TYPE);
            return secrets != null ? secrets : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new PersistenceException("Failed to read secret store: " + e.getMessage(), e);
        }
    }

    private void writeAll(Map<String, LinkedHashMap<String, String>> secrets) {
        try {
            Files.createDirectories(secretsPath.getParent());
            Path temp = Files.createTempFile(secretsPath.getParent(), "secrets", ".tmp");
            try {
                mapper.writeValue(temp.toFile(), secrets);
                try {
                    Files.move(temp, secretsPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, secretsPath, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to write secret store: " + e.getMessage(), e);
        }
    }
}
