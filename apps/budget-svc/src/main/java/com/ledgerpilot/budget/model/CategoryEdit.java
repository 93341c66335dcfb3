package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fields of a category to change. Null components are left out of the request and stay untouched.
 * {@code goalTarget} is in milliunits.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CategoryEdit(
        @JsonProperty("name") String name,
        @JsonProperty("note") String note,
        @JsonProperty("category_group_id") String categoryGroupId,
        @JsonProperty("goal_target") Long goalTarget
) {

    @JsonIgnore
    public boolean isEmpty() {
        return name == null && note == null && categoryGroupId == null && goalTarget == null;
    }
}
