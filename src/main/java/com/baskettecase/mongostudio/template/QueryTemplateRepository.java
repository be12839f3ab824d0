package com.baskettecase.mongostudio.template;

import com.baskettecase.mongostudio.config.MongoStudioProperties;
import com.baskettecase.mongostudio.exception.PersistenceException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
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
 * Query templates in a local JSON file, read whole and rewritten in full on every mutation.
 * Template names are unique; file order is the order templates were first saved.
 */
@Slf4j
@Repository
public class QueryTemplateRepository {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path templatesPath;

    public QueryTemplateRepository(MongoStudioProperties properties) {
        this.templatesPath = properties.getStoragePath().resolve(properties.getTemplatesFile());
    }

    public List<QueryTemplate> findAll() {
        if (!Files.exists(templatesPath)) {
            return new ArrayList<>();
        }
        try {
            TemplateBundle bundle = mapper.readValue(templatesPath.toFile(), TemplateBundle.class);
            if (bundle == null || bundle.getTemplates() == null) {
                return new ArrayList<>();
            }
            return new ArrayList<>(bundle.getTemplates());
        } catch (IOException e) {
            log.error("❌ Failed to read query templates from {}", templatesPath, e);
            throw new PersistenceException("Failed to read query templates: " + e.getMessage(), e);
        }
    }

    public Optional<QueryTemplate> findByName(String name) {
        return findAll().stream()
            .filter(template -> template.getName().equals(name))
            .findFirst();
    }

    /**
     * Replace the stored templates with the given list
     */
    public void saveAll(List<QueryTemplate> templates) {
        TemplateBundle bundle = new TemplateBundle(TemplateBundle.FORMAT_VERSION, null, new ArrayList<>(templates));
        try {
            Files.createDirectories(templatesPath.getParent());
            Path temp = Files.createTempFile(templatesPath.getParent(), "query_templates", ".tmp");
            try {
                mapper.writeValue(temp.toFile(), bundle);
                try {
                    Files.move(temp, templatesPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, templatesPath, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Wrote {} query template(s) to {}", templates.size(), templatesPath);
        } catch (IOException e) {
            log.error("❌ Failed to write query templates to {}", templatesPath, e);
            throw new PersistenceException("Failed to write query templates: " + e.getMessage(), e);
        }
    }

    public Path getTemplatesPath() {
        return templatesPath;
    }
}
