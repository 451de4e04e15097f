package com.homepurse.analysis.agent;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of what the model may query for one household, rebuilt on every request.
 */
public record SchemaContext(
        UUID householdId,
        List<ViewSchema> views,
        HouseholdHints hints,
        LocalDate referenceDate
) {

    public SchemaContext {
        if (householdId == null) {
            throw new IllegalArgumentException("householdId is required");
        }
        views = views == null ? List.of() : List.copyOf(views);
        hints = hints == null ? HouseholdHints.empty() : hints;
        if (referenceDate == null) {
            throw new IllegalArgumentException("referenceDate is required");
        }
    }

    public Set<String> allowedTables() {
        return views.stream()
                .map(view -> view.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean allows(String viewName) {
        return viewName != null && allowedTables().contains(viewName.toLowerCase(Locale.ROOT));
    }

    public record ViewSchema(String name, String description, List<Column> columns) {
        public ViewSchema {
            columns = columns == null ? List.of() : List.copyOf(columns);
        }
    }

    public record Column(String name, String type) {
    }

    /**
     * Distinct values observed in the household's own data, used to ground filters in the prompt.
     * The expense date bounds are null when the household has no expenses yet.
     */
    public record HouseholdHints(
            List<String> categories,
            List<String> subcategories,
            List<String> members,
            List<String> merchants,
            LocalDate firstExpenseDate,
            LocalDate lastExpenseDate
    ) {
        public HouseholdHints {
            categories = categories == null ? List.of() : List.copyOf(categories);
            subcategories = subcategories == null ? List.of() : List.copyOf(subcategories);
            members = members == null ? List.of() : List.copyOf(members);
            merchants = merchants == null ? List.of() : List.copyOf(merchants);
        }

        public static HouseholdHints empty() {
            return new HouseholdHints(List.of(), List.of(), List.of(), List.of(), null, null);
        }

        public boolean isEmpty() {
            return categories.isEmpty() && subcategories.isEmpty() && members.isEmpty() && merchants.isEmpty();
        }

        public boolean hasExpenseDates() {
            return firstExpenseDate != null && lastExpenseDate != null;
        }
    }
}
