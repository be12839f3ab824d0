package com.baskettecase.mongostudio;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Mongo Studio Application
 *
 * Browses MongoDB databases through saved connection profiles: collections, find and
 * aggregation queries, paginated results. Exposed as a REST API and as MCP tools.
 *
 * MongoDB auto-configuration is excluded because every client is built from a saved profile.
 */
@Slf4j
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
@RequiredArgsConstructor
public class MongoStudioApplication {

    private final MongoStudioProperties properties;

    public static void main(String[] args) {
        SpringApplication.run(MongoStudioApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 Mongo Studio is ready!");
        log.info("📁 Connection profiles stored in: {}", properties.getStoragePath().toAbsolutePath());
        log.info("🌐 REST API at: /api/v1/connections");
        log.info("📡 MCP Server running on Streamable-HTTP transport at: /mcp");
        log.info("🔧 Available tools: mongo.listConnections, mongo.listCollections, mongo.runQuery, mongo.sampleDocuments, mongo.explain, mongo.listIndexes, mongo.listTemplates, mongo.runTemplate");
        log.info("🏥 Health check at: /actuator/health");
    }
}
