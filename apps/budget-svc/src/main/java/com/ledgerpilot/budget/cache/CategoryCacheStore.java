package com.ledgerpilot.budget.cache;

import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.model.Category;
import com.ledgerpilot.budget.model.CategoryGroup;
import com.ledgerpilot.budget.remote.BudgetApi;
import com.ledgerpilot.budget.remote.DeltaPage;
import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Category groups per budget, each carrying its categories.
 *
 * <p>Merging works one level deeper than the base store: a deleted group takes all of its cached
 * categories with it, while a changed group merges its categories by id. A category id lives in at
 * most one group; when a delta places it in another group it is removed from the old one.
 */
@Component
public class CategoryCacheStore extends DeltaCacheStore<CategoryGroup> {

    private final BudgetApi budgetApi;

    public CategoryCacheStore(BudgetApi budgetApi, BudgetContext budgetContext) {
        super("categories", budgetContext, Clock.systemUTC());
        this.budgetApi = budgetApi;
    }

    @Override
    protected DeltaPage<CategoryGroup> fetch(String budgetId, OptionalLong sinceToken) {
        return budgetApi.getCategories(budgetId, sinceToken);
    }

    @Override
    protected Map<String, CategoryGroup> merge(Map<String, CategoryGroup> current, List<CategoryGroup> delta) {
        Map<String, CategoryGroup> merged = new LinkedHashMap<>(current);
        for (CategoryGroup deltaGroup : delta) {
            if (deltaGroup.deleted()) {
                merged.remove(deltaGroup.id());
                continue;
            }
            Map<String, Category> categories = new LinkedHashMap<>();
            CategoryGroup existing = merged.get(deltaGroup.id());
            if (existing != null) {
                existing.categories().forEach(category -> categories.put(category.id(), category));
            }
            Set<String> moved = new HashSet<>();
            for (Category category : deltaGroup.categories()) {
                if (category.deleted()) {
                    categories.remove(category.id());
                } else {
                    categories.put(category.id(), category);
                    moved.add(category.id());
                }
            }
            removeFromOtherGroups(merged, deltaGroup.id(), moved);
            merged.put(deltaGroup.id(), deltaGroup.withCategories(List.copyOf(categories.values())));
        }
        return merged;
    }

    private static void removeFromOtherGroups(Map<String, CategoryGroup> groups, String keepGroupId, Set<String> categoryIds) {
        if (categoryIds.isEmpty()) {
            return;
        }
        groups.replaceAll((groupId, group) -> {
            if (groupId.equals(keepGroupId)
                    || group.categories().stream().noneMatch(category -> categoryIds.contains(category.id()))) {
                return group;
            }
            return group.withCategories(group.categories().stream()
                    .filter(category -> !categoryIds.contains(category.id()))
                    .toList());
        });
    }

    /**
     * Categories of every group, in group order.
     */
    public List<Category> getFlattenedCategories(String budgetId) {
        return get(budgetId).stream()
                .flatMap(group -> group.categories().stream())
                .toList();
    }
}
