package com.baskettecase.mongostudio.config;

import com.baskettecase.mongostudio.query.PaginationMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Mongo Studio configuration (prefix {@code mongo.studio}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "mongo.studio")
public class MongoStudioProperties {

    /**
     * Directory holding the profile list, the encrypted secrets and the generated key file.
     */
    private String storageDir = System.getProperty("user.home") + "/.mongo-studio";

    /**
     * Profile list file name, relative to {@link #storageDir}.
     */
    private String profilesFile = "connections.json";

    /**
     * Encrypted secret file name, relative to {@link #storageDir}.
     */
    private String secretsFile = "secrets.json";

    /**
     * Saved query template file name, relative to {@link #storageDir}.
     */
    private String templatesFile = "query_templates.json";

    /**
     * Service identifier used for every secret-store lookup.
     */
    private String keyringService = "mongo-client-app";

    private int connectTimeoutMs = 10000;

    /**
     * Upper bound for reaching the server and authenticating.
     */
    private int serverSelectionTimeoutMs = 10000;

    /**
     * Upper bound used by connection tests.
     */
    private int testTimeoutMs = 5000;

    private Query query = new Query();

    private Security security = new Security();

    public Path getStoragePath() {
        return Paths.get(storageDir);
    }

    @Data
    public static class Query {

        private int defaultPageSize = 50;

        private int maxPageSize = 1000;

        private int maxSampleSize = 100;

        /**
         * Server-side time limit applied to find and aggregate.
         */
        private long maxTimeMs = 30000;

        private PaginationMode aggregationPagination = PaginationMode.CLIENT_SIDE;
    }

    @Data
    public static class Security {

        /**
         * Base64 encoded 32-byte AES key. When blank a key is generated into the storage directory.
         */
        private String encryptionKey = "";

        /**
         * Token required on /api/** and /mcp. Blank disables authentication.
         */
        private String accessToken = "";
    }
}
