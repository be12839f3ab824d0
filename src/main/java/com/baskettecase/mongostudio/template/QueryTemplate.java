package com.baskettecase.mongostudio.template;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A saved, reusable query.
 *
 * {@code queryData} holds {@code {"filter", "projection", "sort"}} for a find template and
 * {@code {"pipeline": [...]}} for an aggregate template. Field names on the wire and in the
 * template file are snake_case.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryTemplate {

    public static final String TYPE_FIND = "find";
    public static final String TYPE_AGGREGATE = "aggregate";

    private String name;

    @JsonProperty("query_type")
    private String queryType;

    @JsonProperty("query_data")
    private JsonNode queryData;

    private String description = "";

    private List<String> tags = new ArrayList<>();

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonIgnore
    public boolean isAggregate() {
        return TYPE_AGGREGATE.equals(queryType);
    }

    public boolean hasAnyTag(List<String> wanted) {
        return tags != null && wanted.stream().anyMatch(tags::contains);
    }
}
