package com.vidnyan.rulecov.domain.query;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural summary of a query. Derived data, recomputable from the query text.
 */
public record QueryAnalysis(
    Set<String> nodeTypes,
    Set<String> attributes,
    Set<String> operators,
    List<Conditional> conditionals,
    Map<String, String> letVariables,
    boolean hasLetExpressions,
    boolean hasUnions
) {

    public static QueryAnalysis empty() {
        return new QueryAnalysis(Set.of(), Set.of(), Set.of(), List.of(), Map.of(), false, false);
    }
}
