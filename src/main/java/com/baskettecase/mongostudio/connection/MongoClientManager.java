package com.baskettecase.mongostudio.connection;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoCredential;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * MongoDB Client Manager
 *
 * Keeps one driver client per connection profile. The driver pools connections inside each
 * client, so a client is reused for every operation on its profile until the profile changes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MongoClientManager {

    private static final String APPLICATION_NAME = "mongo-studio";

    private final MongoStudioProperties properties;

    // Cache of clients per profile name
    private final Map<String, CachedClient> clients = new ConcurrentHashMap<>();

    /**
     * Get the profile's database, creating or rebuilding the client as needed
     */
    public MongoDatabase getDatabase(ResolvedConnection connection) {
        return getClient(connection).getDatabase(connection.getProfile().getDatabase());
    }

    /**
     * Get the cached client for a profile. A client built from different settings is closed and replaced.
     */
    public MongoClient getClient(ResolvedConnection connection) {
        String settingsKey = connection.getSettingsKey();

        CachedClient cached = clients.compute(connection.getName(), (name, existing) -> {
            if (existing != null && existing.settingsKey().equals(settingsKey)) {
                return existing;
            }
            if (existing != null) {
                log.info("♻️ Settings changed for connection '{}', rebuilding client", name);
                existing.client().close();
            }
            log.info("🔗 Creating MongoDB client for: {} ({}:{}/{})", name,
                connection.getProfile().getHost(), connection.getProfile().getPort(),
                connection.getProfile().getDatabase());
            return new CachedClient(settingsKey,
                MongoClients.create(buildSettings(connection, properties.getServerSelectionTimeoutMs())));
        });

        return cached.client();
    }

    /**
     * Close and forget the client of a profile, if any
     */
    public void evict(String name) {
        CachedClient removed = clients.remove(name);
        if (removed != null) {
            removed.client().close();
            log.info("🔌 Closed MongoDB client for: {}", name);
        }
    }

    /**
     * Open a short-lived client, ping the server and return its version.
     * Used by connection tests; nothing is cached.
     *
     * @return server version, or null when the server does not report one
     */
    public String ping(ResolvedConnection connection) {
        log.info("🔐 Testing connection to {}:{} (user: {})", connection.getProfile().getHost(),
            connection.getProfile().getPort(), connection.getProfile().getUsername());

        try (MongoClient client = MongoClients.create(buildSettings(connection, properties.getTestTimeoutMs()))) {
            MongoDatabase database = client.getDatabase(connection.getProfile().getDatabase());
            database.runCommand(new Document("ping", 1));
            try {
                Document buildInfo = database.runCommand(new Document("buildInfo", 1));
                return buildInfo.getString("version");
            } catch (MongoCommandException e) {
                log.debug("buildInfo not available: {}", e.getErrorMessage());
                return null;
            }
        }
    }

    MongoClientSettings buildSettings(ResolvedConnection connection, int serverSelectionTimeoutMs) {
        ConnectionProfile profile = connection.getProfile();

        MongoClientSettings.Builder builder = MongoClientSettings.builder()
            .applicationName(APPLICATION_NAME)
            .applyToClusterSettings(cluster -> cluster
                .hosts(List.of(new ServerAddress(profile.getHost(), profile.getPort())))
                .serverSelectionTimeout(serverSelectionTimeoutMs, TimeUnit.MILLISECONDS))
            .applyToSocketSettings(socket -> socket
                .connectTimeout(properties.getConnectTimeoutMs(), TimeUnit.MILLISECONDS))
            .applyToSslSettings(ssl -> ssl.enabled(profile.isTls()));

        // Credentials authenticate against the profile database
        if (profile.hasUsername()) {
            String password = connection.getPassword() != null ? connection.getPassword() : "";
            builder.credential(MongoCredential.createCredential(
                profile.getUsername(), profile.getDatabase(), password.toCharArray()));
        }

        return builder.build();
    }

    /**
     * Clean up all clients on shutdown
     */
    @PreDestroy
    public void cleanup() {
        log.info("🔌 Shutting down {} MongoDB client(s)", clients.size());
        clients.values().forEach(cached -> cached.client().close());
        clients.clear();
    }

    public int getOpenClientCount() {
        return clients.size();
    }

    private record CachedClient(String settingsKey, MongoClient client) {}
}
