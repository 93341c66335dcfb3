package com.ledgerpilot.budget.staging;

import com.ledgerpilot.budget.error.ValidationException;

/**
 * Category named by the caller either by id or by name, never both.
 */
public sealed interface CategoryReference permits CategoryReference.ById, CategoryReference.ByName {

    static CategoryReference of(String categoryId, String categoryName) {
        boolean hasId = categoryId != null && !categoryId.isBlank();
        boolean hasName = categoryName != null && !categoryName.isBlank();
        if (hasId && hasName) {
            throw new ValidationException("Cannot provide both categoryId and categoryName");
        }
        if (hasId) {
            return new ById(categoryId);
        }
        if (hasName) {
            return new ByName(categoryName);
        }
        throw new ValidationException("Either categoryId or categoryName must be provided");
    }

    /** Same as {@link #of} but yields null when neither is given. */
    static CategoryReference ofOptional(String categoryId, String categoryName) {
        boolean hasId = categoryId != null && !categoryId.isBlank();
        boolean hasName = categoryName != null && !categoryName.isBlank();
        return hasId || hasName ? of(categoryId, categoryName) : null;
    }

    record ById(String categoryId) implements CategoryReference {
    }

    record ByName(String categoryName) implements CategoryReference {
    }
}
