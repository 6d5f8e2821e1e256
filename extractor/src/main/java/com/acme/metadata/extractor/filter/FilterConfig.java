package com.acme.metadata.extractor.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Operator-supplied filter settings, parsed from their command-line forms.
 *
 * @param allowedCategories  allowed {@code types.resourceTypeGeneral} values, empty for no restriction
 * @param requireAllFields   enables the {@link CompletenessGate}
 */
public record FilterConfig(
    Set<String> allowedCategories,
    List<RequiredValuePredicate> requiredValues,
    List<NonExistencePredicate> exclusions,
    boolean requireAllFields,
    RoutingFilter routing
) {
    public static final FilterConfig NONE = new FilterConfig(Set.of(), List.of(), List.of(), false, RoutingFilter.ANY);

    public FilterConfig {
        allowedCategories = Set.copyOf(allowedCategories);
        requiredValues = List.copyOf(requiredValues);
        exclusions = List.copyOf(exclusions);
        routing = Objects.requireNonNullElse(routing, RoutingFilter.ANY);
    }

    /**
     * @param resourceTypes    comma-separated category list, or {@code null}
     * @param valueFilters     {@code path=value} entries
     * @param notExistPaths    dotted paths that must be absent or empty
     * @throws IllegalArgumentException on a value filter without {@code =} or with an empty path
     */
    public static FilterConfig parse(String resourceTypes,
                                     Collection<String> valueFilters,
                                     Collection<String> notExistPaths,
                                     boolean requireAllFields,
                                     String provider,
                                     String client) {
        Set<String> categories = new LinkedHashSet<>();
        if (resourceTypes != null) {
            for (String item : resourceTypes.split(",")) {
                String t = item.trim();
                if (!t.isEmpty()) {
                    categories.add(t);
                }
            }
        }

        List<RequiredValuePredicate> required = new ArrayList<>();
        if (valueFilters != null) {
            for (String raw : valueFilters) {
                int eq = raw.indexOf('=');
                if (eq < 0) {
                    throw new IllegalArgumentException(
                        "Invalid field-value filter '" + raw + "'. Expected 'path.to.field=value'");
                }
                required.add(new RequiredValuePredicate(splitPath(raw.substring(0, eq)), raw.substring(eq + 1)));
            }
        }

        List<NonExistencePredicate> excluded = new ArrayList<>();
        if (notExistPaths != null) {
            for (String raw : notExistPaths) {
                excluded.add(new NonExistencePredicate(splitPath(raw)));
            }
        }

        return new FilterConfig(categories, required, excluded, requireAllFields,
            new RoutingFilter(blankToNull(provider), blankToNull(client)));
    }

    private static List<String> splitPath(String dotted) {
        String trimmed = dotted.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Filter path must not be empty");
        }
        return Arrays.asList(trimmed.split("\\."));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
