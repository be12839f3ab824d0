package com.baskettecase.mongostudio.connection;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import com.baskettecase.mongostudio.exception.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionProfileRepository
 */
class ConnectionProfileRepositoryTest {

    @TempDir
    Path storageDir;

    private ConnectionProfileRepository repository;

    @BeforeEach
    void setUp() {
        MongoStudioProperties properties = new MongoStudioProperties();
        properties.setStorageDir(storageDir.resolve("nested").toString());
        repository = new ConnectionProfileRepository(properties);
    }

    @Test
    void testMissingFileMeansNoProfiles() {
        assertTrue(repository.findAll().isEmpty());
        assertTrue(repository.findByName("any").isEmpty());
    }

    @Test
    void testSaveAllCreatesDirectoryAndKeepsOrder() {
        repository.saveAll(List.of(
            new ConnectionProfile("b", "localhost", 27017, "one", null, false),
            new ConnectionProfile("a", "localhost", 27018, "two", "admin", true)
        ));

        assertTrue(Files.exists(repository.getProfilesPath()));
        List<ConnectionProfile> profiles = repository.findAll();
        assertEquals("b", profiles.get(0).getName());
        assertEquals("a", profiles.get(1).getName());
        assertEquals(27018, repository.findByName("a").orElseThrow().getPort());
        assertTrue(repository.findByName("a").orElseThrow().isTls());
    }

    @Test
    void testUnknownFieldsAreIgnored() throws Exception {
        Files.createDirectories(repository.getProfilesPath().getParent());
        Files.writeString(repository.getProfilesPath(),
            "[{\"name\":\"legacy\",\"host\":\"localhost\",\"port\":27017,\"database\":\"db\",\"color\":\"red\"}]");

        ConnectionProfile profile = repository.findByName("legacy").orElseThrow();

        assertEquals("db", profile.getDatabase());
        assertFalse(profile.isTls());
    }

    @Test
    void testCorruptFileIsPersistenceError() throws Exception {
        Files.createDirectories(repository.getProfilesPath().getParent());
        Files.writeString(repository.getProfilesPath(), "{not json");

        assertThrows(PersistenceException.class, () -> repository.findAll());
    }
}
