package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A budget category. Money fields are milliunits (1000 = one unit of currency).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Category(
        @JsonProperty("id") String id,
        @JsonProperty("category_group_id") String categoryGroupId,
        @JsonProperty("category_group_name") String categoryGroupName,
        @JsonProperty("name") String name,
        @JsonProperty("hidden") boolean hidden,
        @JsonProperty("note") String note,
        @JsonProperty("budgeted") Long budgeted,
        @JsonProperty("activity") Long activity,
        @JsonProperty("balance") Long balance,
        @JsonProperty("deleted") boolean deleted
) implements ReferenceEntity {
}
