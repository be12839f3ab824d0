package com.baskettecase.mongostudio.template;

import com.baskettecase.mongostudio.exception.InvalidQueryShapeException;
import com.baskettecase.mongostudio.exception.NotFoundException;
import com.baskettecase.mongostudio.query.QueryParser;
import com.baskettecase.mongostudio.query.QuerySpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Query Template Service
 *
 * Saves named find and aggregate queries for reuse, with a description and tags for
 * finding them again. A template is checked by the query parser before it is stored,
 * so every stored template can be run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryTemplateService {

    private static final String TEMPLATE = "Query template";

    private final QueryTemplateRepository repository;
    private final QueryParser queryParser;

    /**
     * Save a template, replacing one with the same name in place
     *
     * @throws IllegalArgumentException if the name is blank or the type is neither find nor aggregate
     */
    public synchronized QueryTemplate save(String name, String queryType, JsonNode queryData,
                                           String description, List<String> tags) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Template name is required");
        }

        QueryTemplate template = new QueryTemplate(
            name.trim(),
            normalizeType(queryType),
            queryData != null ? queryData : JsonNodeFactory.instance.objectNode(),
            description != null ? description.trim() : "",
            tags != null ? new ArrayList<>(tags) : new ArrayList<>(),
            LocalDateTime.now()
        );
        toQuery(template);

        List<QueryTemplate> templates = repository.findAll();
        int index = indexOf(templates, template.getName());
        if (index >= 0) {
            templates.set(index, template);
        } else {
            templates.add(template);
        }
        repository.saveAll(templates);

        log.info("💾 {} {} template '{}'", index >= 0 ? "Replaced" : "Saved", template.getQueryType(), template.getName());
        return template;
    }

    public Optional<QueryTemplate> load(String name) {
        return repository.findByName(name);
    }

    /**
     * @throws NotFoundException if no template has this name
     */
    public QueryTemplate get(String name) {
        return load(name).orElseThrow(() -> new NotFoundException(TEMPLATE, name));
    }

    /**
     * @return false when no template has this name
     */
    public synchronized boolean delete(String name) {
        List<QueryTemplate> templates = repository.findAll();
        int index = indexOf(templates, name);
        if (index < 0) {
            return false;
        }
        templates.remove(index);
        repository.saveAll(templates);
        log.info("🗑️ Deleted query template '{}'", name);
        return true;
    }

    public List<QueryTemplate> list() {
        return repository.findAll();
    }

    public List<QueryTemplate> listByType(String queryType) {
        String type = normalizeType(queryType);
        return list().stream()
            .filter(template -> type.equals(template.getQueryType()))
            .collect(Collectors.toList());
    }

    /**
     * Templates carrying any of the tags. No tags means every template.
     */
    public List<QueryTemplate> listByTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return list();
        }
        return list().stream()
            .filter(template -> template.hasAnyTag(tags))
            .collect(Collectors.toList());
    }

    /**
     * Case-insensitive substring match on name or description. Blank text means every template.
     */
    public List<QueryTemplate> search(String text) {
        String needle = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return list();
        }
        return list().stream()
            .filter(template -> template.getName().toLowerCase(Locale.ROOT).contains(needle)
                || (template.getDescription() != null
                    && template.getDescription().toLowerCase(Locale.ROOT).contains(needle)))
            .collect(Collectors.toList());
    }

    /**
     * @throws NotFoundException if {@code oldName} is not stored
     * @throws IllegalArgumentException if {@code newName} is blank or already taken
     */
    public synchronized QueryTemplate rename(String oldName, String newName) {
        if (newName == null || newName.trim().isEmpty()) {
            throw new IllegalArgumentException("Template name is required");
        }
        String target = newName.trim();

        List<QueryTemplate> templates = repository.findAll();
        int index = indexOf(templates, oldName);
        if (index < 0) {
            throw new NotFoundException(TEMPLATE, oldName);
        }
        QueryTemplate template = templates.get(index);
        if (target.equals(oldName)) {
            return template;
        }
        if (indexOf(templates, target) >= 0) {
            throw new IllegalArgumentException("A template named '" + target + "' already exists");
        }

        template.setName(target);
        repository.saveAll(templates);
        log.info("✏️ Renamed query template '{}' to '{}'", oldName, target);
        return template;
    }

    /**
     * Change description and/or tags. A null argument leaves that field as it is.
     *
     * @throws NotFoundException if no template has this name
     */
    public synchronized QueryTemplate updateMetadata(String name, String description, List<String> tags) {
        List<QueryTemplate> templates = repository.findAll();
        int index = indexOf(templates, name);
        if (index < 0) {
            throw new NotFoundException(TEMPLATE, name);
        }

        QueryTemplate template = templates.get(index);
        if (description != null) {
            template.setDescription(description.trim());
        }
        if (tags != null) {
            template.setTags(new ArrayList<>(tags));
        }
        repository.saveAll(templates);
        return template;
    }

    /**
     * Every template in the shared file layout, stamped with the export time
     */
    public TemplateBundle exportTemplates() {
        List<QueryTemplate> templates = list();
        log.info("📤 Exporting {} query template(s)", templates.size());
        return new TemplateBundle(TemplateBundle.FORMAT_VERSION, LocalDateTime.now(), templates);
    }

    /**
     * Add templates from an export. Existing names are kept unless {@code overwrite} is set.
     * Every incoming template is checked first; one bad template rejects the whole import.
     *
     * @return number of templates added or replaced
     */
    public synchronized int importTemplates(TemplateBundle bundle, boolean overwrite) {
        if (bundle == null || bundle.getTemplates() == null) {
            throw new IllegalArgumentException("Import must contain a templates list");
        }

        List<QueryTemplate> incoming = new ArrayList<>();
        for (QueryTemplate template : bundle.getTemplates()) {
            incoming.add(checkImported(template));
        }

        List<QueryTemplate> templates = repository.findAll();
        int imported = 0;
        for (QueryTemplate template : incoming) {
            int index = indexOf(templates, template.getName());
            if (index < 0) {
                templates.add(template);
                imported++;
            } else if (overwrite) {
                templates.set(index, template);
                imported++;
            }
        }

        if (imported > 0) {
            repository.saveAll(templates);
        }
        log.info("📥 Imported {} of {} query template(s) (overwrite={})", imported, incoming.size(), overwrite);
        return imported;
    }

    public int count() {
        return list().size();
    }

    public synchronized void clear() {
        repository.saveAll(new ArrayList<>());
        log.info("🧹 Cleared all query templates");
    }

    /**
     * Parse the stored query data into a runnable query
     *
     * @throws InvalidQueryShapeException if the data does not fit the template type
     */
    public QuerySpec toQuery(QueryTemplate template) {
        JsonNode data = template.getQueryData();
        if (data == null || !data.isObject()) {
            throw new InvalidQueryShapeException("Template query data must be a JSON object");
        }

        if (template.isAggregate()) {
            JsonNode pipeline = data.get("pipeline");
            if (pipeline == null || !pipeline.isArray()) {
                throw new InvalidQueryShapeException("Aggregate template needs a \"pipeline\" array");
            }
            return queryParser.parse(pipeline.toString());
        }

        JsonNode filter = data.get("filter");
        if (filter != null && !filter.isNull() && !filter.isObject()) {
            throw new InvalidQueryShapeException("Find template \"filter\" must be a JSON object");
        }
        return queryParser.parse(text(filter), text(data.get("projection")), text(data.get("sort")));
    }

    private QueryTemplate checkImported(QueryTemplate template) {
        if (template == null || template.getName() == null || template.getName().trim().isEmpty()) {
            throw new IllegalArgumentException("Every imported template needs a name");
        }
        template.setName(template.getName().trim());
        template.setQueryType(normalizeType(template.getQueryType()));
        if (template.getDescription() == null) {
            template.setDescription("");
        }
        if (template.getTags() == null) {
            template.setTags(new ArrayList<>());
        }
        if (template.getCreatedAt() == null) {
            template.setCreatedAt(LocalDateTime.now());
        }
        toQuery(template);
        return template;
    }

    private static String normalizeType(String queryType) {
        String type = queryType == null ? "" : queryType.trim().toLowerCase(Locale.ROOT);
        if (!QueryTemplate.TYPE_FIND.equals(type) && !QueryTemplate.TYPE_AGGREGATE.equals(type)) {
            throw new IllegalArgumentException("Template query type must be 'find' or 'aggregate', got '" + queryType + "'");
        }
        return type;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.toString();
    }

    private static int indexOf(List<QueryTemplate> templates, String name) {
        for (int i = 0; i < templates.size(); i++) {
            if (templates.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
