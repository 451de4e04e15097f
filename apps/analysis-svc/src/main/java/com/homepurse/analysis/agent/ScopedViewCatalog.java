package com.homepurse.analysis.agent;

import com.homepurse.analysis.config.HomepurseProperties;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Registry of the scoped views the agent may reference. The configured allow-list selects a
 * subset; naming a view that does not exist fails application startup.
 */
@Component
public class ScopedViewCatalog {

    private static final String SCOPE_PREDICATE =
            "CAST(NULLIF(current_setting('app.household_id', true), '') AS uuid)";

    public static final ScopedView HOUSEHOLD_EXPENSES = new ScopedView(
            "household_expenses",
            "One row per expense of this household, joined to the member who logged it.",
            """
            SELECT
              e.id AS expense_id,
              e.household_id AS household_id,
              e.logged_by_user_id AS logged_by_user_id,
              COALESCE(u.full_name, 'Unknown') AS logged_by,
              CAST(e.status AS TEXT) AS status,
              COALESCE(e.category, 'Other') AS category,
              e.subcategory AS subcategory,
              e.description AS description,
              e.merchant_or_item AS merchant_or_item,
              e.amount AS amount,
              e.currency AS currency,
              e.date_incurred AS date_incurred,
              e.is_recurring AS is_recurring,
              e.created_at AS created_at
            FROM expenses e
            LEFT JOIN users u ON u.id = e.logged_by_user_id
            WHERE e.household_id = %s
            """.formatted(SCOPE_PREDICATE));

    public static final ScopedView HOUSEHOLD_CATEGORIES = new ScopedView(
            "household_categories",
            "The household's own expense categories, including inactive ones.",
            """
            SELECT
              c.name AS category,
              c.normalized_name AS normalized_name,
              c.is_active AS is_active,
              c.sort_order AS sort_order
            FROM household_categories c
            WHERE c.household_id = %s
            """.formatted(SCOPE_PREDICATE));

    private final List<ScopedView> allowedViews;

    public ScopedViewCatalog(HomepurseProperties properties) {
        this(List.of(HOUSEHOLD_EXPENSES, HOUSEHOLD_CATEGORIES), properties.analysis().allowedTables());
    }

    ScopedViewCatalog(Collection<ScopedView> views, List<String> allowedNames) {
        Map<String, ScopedView> byName = new LinkedHashMap<>();
        for (ScopedView view : views) {
            byName.put(view.name().toLowerCase(Locale.ROOT), view);
        }
        this.allowedViews = allowedNames.stream()
                .map(name -> {
                    ScopedView view = byName.get(name.toLowerCase(Locale.ROOT));
                    if (view == null) {
                        throw new IllegalArgumentException("Unknown scoped view in allowed-tables: " + name
                                + ". Known views: " + byName.keySet());
                    }
                    return view;
                })
                .toList();
    }

    public List<ScopedView> allowedViews() {
        return allowedViews;
    }

    public Set<String> allowedNames() {
        return allowedViews.stream().map(ScopedView::name).collect(Collectors.toUnmodifiableSet());
    }

    public boolean isAllowed(String name) {
        return name != null && allowedNames().contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Builds the {@code WITH} prefix that defines the given views as CTEs.
     */
    public String withClause(Collection<ScopedView> views) {
        return views.stream()
                .map(view -> view.name() + " AS (\n" + view.body().strip() + "\n)")
                .collect(Collectors.joining(",\n", "WITH ", "\n"));
    }
}
