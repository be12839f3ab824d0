package com.baskettecase.mongostudio.template;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Template file layout, shared by the local template file and by export/import:
 * {@code {"version": "1.0", "exported_at": ..., "templates": [...]}}.
 * {@code exported_at} is only present in exports.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TemplateBundle {

    public static final String FORMAT_VERSION = "1.0";

    private String version = FORMAT_VERSION;

    @JsonProperty("exported_at")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private LocalDateTime exportedAt;

    private List<QueryTemplate> templates = new ArrayList<>();
}
