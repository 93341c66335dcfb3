package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Category group as delivered by the categories endpoint, with its categories nested.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CategoryGroup(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("hidden") boolean hidden,
        @JsonProperty("deleted") boolean deleted,
        @JsonProperty("categories") List<Category> categories
) implements ReferenceEntity {

    public CategoryGroup {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public CategoryGroup withCategories(List<Category> newCategories) {
        return new CategoryGroup(id, name, hidden, deleted, newCategories);
    }
}
