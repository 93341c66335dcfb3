package com.ledgerpilot.budget.resolve;

import com.ledgerpilot.budget.cache.AccountCacheStore;
import com.ledgerpilot.budget.cache.CategoryCacheStore;
import com.ledgerpilot.budget.cache.PayeeCacheStore;
import com.ledgerpilot.budget.error.NotFoundException;
import com.ledgerpilot.budget.model.Category;
import com.ledgerpilot.budget.model.ReferenceEntity;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Turns human-supplied names into ids using the cached reference data.
 *
 * <p>Matching is case-insensitive on trimmed input. An exact name match wins; otherwise the first
 * candidate whose name contains the query is returned. Categories are matched across all groups in
 * group order.
 */
@Component
public class EntityResolver {

    private static final int MAX_LISTED_ALTERNATIVES = 10;

    private final AccountCacheStore accountCacheStore;
    private final PayeeCacheStore payeeCacheStore;
    private final CategoryCacheStore categoryCacheStore;

    public EntityResolver(
            AccountCacheStore accountCacheStore,
            PayeeCacheStore payeeCacheStore,
            CategoryCacheStore categoryCacheStore
    ) {
        this.accountCacheStore = accountCacheStore;
        this.payeeCacheStore = payeeCacheStore;
        this.categoryCacheStore = categoryCacheStore;
    }

    public Optional<String> resolvePayeeId(String budgetId, String name) {
        return match(payeeCacheStore.get(budgetId), name);
    }

    public Optional<String> resolveCategoryId(String budgetId, String name) {
        return match(categoryCacheStore.getFlattenedCategories(budgetId), name);
    }

    public Optional<String> resolveCategoryGroupId(String budgetId, String name) {
        return match(categoryCacheStore.get(budgetId), name);
    }

    public String requireAccountId(String budgetId, String name) {
        return require("account", accountCacheStore.get(budgetId), name);
    }

    public String requirePayeeId(String budgetId, String name) {
        return require("payee", payeeCacheStore.get(budgetId), name);
    }

    public String requireCategoryId(String budgetId, String name) {
        return require("category", categoryCacheStore.getFlattenedCategories(budgetId), name);
    }

    /**
     * Display name of a category, "Uncategorized" for a null id, or the id itself when unknown.
     */
    public String categoryName(String budgetId, String categoryId) {
        if (categoryId == null) {
            return "Uncategorized";
        }
        return categoryCacheStore.getFlattenedCategories(budgetId).stream()
                .filter(category -> category.id().equals(categoryId))
                .map(Category::name)
                .findFirst()
                .orElse(categoryId);
    }

    public String payeeName(String budgetId, String payeeId) {
        if (payeeId == null) {
            return "Unknown";
        }
        return payeeCacheStore.get(budgetId).stream()
                .filter(payee -> payee.id().equals(payeeId))
                .map(ReferenceEntity::name)
                .findFirst()
                .orElse(payeeId);
    }

    static Optional<String> match(List<? extends ReferenceEntity> candidates, String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(query);
        return firstId(candidates, name -> name.equals(normalized))
                .or(() -> firstId(candidates, name -> name.contains(normalized)));
    }

    private static Optional<String> firstId(List<? extends ReferenceEntity> candidates, Predicate<String> nameTest) {
        return candidates.stream()
                .filter(candidate -> candidate.name() != null && nameTest.test(normalize(candidate.name())))
                .map(ReferenceEntity::id)
                .findFirst();
    }

    private static String require(String entityType, List<? extends ReferenceEntity> candidates, String query) {
        return match(candidates, query).orElseThrow(() -> new NotFoundException(entityType, query,
                candidates.stream()
                        .map(ReferenceEntity::name)
                        .limit(MAX_LISTED_ALTERNATIVES)
                        .toList()));
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
