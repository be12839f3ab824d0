package com.baskettecase.mongostudio.api;

import com.baskettecase.mongostudio.connection.ConnectionStore;
import com.baskettecase.mongostudio.exception.NotFoundException;
import com.baskettecase.mongostudio.query.QueryExecutor;
import com.baskettecase.mongostudio.query.ResultPage;
import com.baskettecase.mongostudio.template.QueryTemplate;
import com.baskettecase.mongostudio.template.QueryTemplateService;
import com.baskettecase.mongostudio.template.TemplateBundle;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Query Template Controller
 *
 * Saved queries: listing and search, metadata edits, export/import, and running a template
 * against a saved connection.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/templates")
@RequiredArgsConstructor
public class QueryTemplateController {

    private final QueryTemplateService templateService;
    private final ConnectionStore connectionStore;
    private final QueryExecutor queryExecutor;

    /**
     * All templates, or those matching one filter: {@code search}, then {@code type}, then {@code tag}
     */
    @GetMapping
    public List<QueryTemplate> listTemplates(@RequestParam(required = false) String search,
                                             @RequestParam(required = false) String type,
                                             @RequestParam(required = false) List<String> tag) {
        if (search != null) {
            return templateService.search(search);
        }
        if (type != null) {
            return templateService.listByType(type);
        }
        return templateService.listByTags(tag);
    }

    @GetMapping("/count")
    public TemplateCount countTemplates() {
        return new TemplateCount(templateService.count());
    }

    @GetMapping("/{templateName}")
    public QueryTemplate getTemplate(@PathVariable String templateName) {
        return templateService.get(templateName);
    }

    @PostMapping
    public ResponseEntity<QueryTemplate> saveTemplate(@RequestBody SaveTemplateRequest request) {
        boolean existed = request.name() != null && templateService.load(request.name().trim()).isPresent();
        QueryTemplate saved = templateService.save(request.name(), request.queryType(), request.queryData(),
            request.description(), request.tags());
        return ResponseEntity.status(existed ? HttpStatus.OK : HttpStatus.CREATED).body(saved);
    }

    /**
     * Rename and/or change description and tags. Absent fields stay as they are.
     */
    @PatchMapping("/{templateName}")
    public QueryTemplate updateTemplate(@PathVariable String templateName,
                                        @RequestBody UpdateTemplateRequest request) {
        String current = templateName;
        if (request.name() != null && !request.name().trim().equals(templateName)) {
            current = templateService.rename(templateName, request.name()).getName();
        }
        return templateService.updateMetadata(current, request.description(), request.tags());
    }

    @DeleteMapping("/{templateName}")
    public ResponseEntity<Void> deleteTemplate(@PathVariable String templateName) {
        if (!templateService.delete(templateName)) {
            throw new NotFoundException("Query template", templateName);
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> clearTemplates() {
        templateService.clear();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/export")
    public TemplateBundle exportTemplates() {
        return templateService.exportTemplates();
    }

    @PostMapping("/import")
    public ImportResponse importTemplates(@RequestBody TemplateBundle bundle,
                                          @RequestParam(defaultValue = "false") boolean overwrite) {
        return new ImportResponse(templateService.importTemplates(bundle, overwrite));
    }

    /**
     * Run a template against a collection of a saved connection
     */
    @PostMapping("/{templateName}/run")
    public QueryController.QueryResponse runTemplate(@PathVariable String templateName,
                                                     @RequestBody RunTemplateRequest request) {
        QueryTemplate template = templateService.get(templateName);
        ResultPage page = queryExecutor.execute(connectionStore.resolve(request.connection()), request.collection(),
            templateService.toQuery(template),
            request.page() != null ? request.page() : 1,
            request.pageSize() != null ? request.pageSize() : 0);
        return QueryController.QueryResponse.from(page);
    }

    public record SaveTemplateRequest(
        String name,
        @JsonProperty("query_type") String queryType,
        @JsonProperty("query_data") JsonNode queryData,
        String description,
        List<String> tags
    ) {}

    public record UpdateTemplateRequest(
        String name,
        String description,
        List<String> tags
    ) {}

    public record RunTemplateRequest(
        String connection,
        String collection,
        Integer page,
        Integer pageSize
    ) {}

    public record TemplateCount(int count) {}

    public record ImportResponse(int imported) {}
}
