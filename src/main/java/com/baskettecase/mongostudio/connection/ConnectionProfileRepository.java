package com.baskettecase.mongostudio.connection;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import com.baskettecase.mongostudio.exception.PersistenceException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Repository for connection profile persistence.
 *
 * Profiles are kept as one JSON array in the storage directory. The file is read in full
 * and rewritten in full on every mutation.
 */
@Slf4j
@Repository
public class ConnectionProfileRepository {

    private static final TypeReference<List<ConnectionProfile>> PROFILE_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path profilesPath;

    public ConnectionProfileRepository(MongoStudioProperties properties) {
        this.profilesPath = properties.getStoragePath().resolve(properties.getProfilesFile());
    }

    /**
     * All stored profiles in insertion order
     */
    public List<ConnectionProfile> findAll() {
        if (!Files.exists(profilesPath)) {
            return new ArrayList<>();
        }
        try {
            List<ConnectionProfile> profiles = mapper.readValue(profilesPath.toFile(), PROFILE_LIST);
            return profiles != null ? new ArrayList<>(profiles) : new ArrayList<>();
        } catch (IOException e) {
            log.error("❌ Failed to read connection profiles from {}", profilesPath, e);
            throw new PersistenceException("Failed to read connection profiles: " + e.getMessage(), e);
        }
    }

    public Optional<ConnectionProfile> findByName(String name) {
        return findAll().stream()
            .filter(profile -> profile.getName().equals(name))
            .findFirst();
    }

    /**
     * Replace the stored list with the given profiles
     */
    public void saveAll(List<ConnectionProfile> profiles) {
        try {
            Files.createDirectories(profilesPath.getParent());
            Path temp = Files.createTempFile(profilesPath.getParent(), "connections", ".tmp");
            try {
                mapper.writeValue(temp.toFile(), profiles);
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Wrote {} connection profile(s) to {}", profiles.size(), profilesPath);
        } catch (IOException e) {
            log.error("❌ Failed to write connection profiles to {}", profilesPath, e);
            throw new PersistenceException("Failed to write connection profiles: " + e.getMessage(), e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, profilesPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, profilesPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public Path getProfilesPath() {
        return profilesPath;
    }
}
