package de.bsommerfeld.tscache.aggregation.definition;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One version of a context dimension's partition: the enumerated values and
 * the {@link OtherPolicy} that says whether they are exhaustive.
 *
 * @param id      context key, e.g. {@code channel}
 * @param version version label, unique per id
 * @param values  declared values in declaration order
 * @param policy  completeness policy
 */
public record ContextDefinition(String id, String version, List<String> values, OtherPolicy policy) {

    public ContextDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(version, "version");
        values = List.copyOf(values);
        policy = policy == null ? OtherPolicy.UNDEFINED : policy;
    }

    public Set<String> expectedValues() {
        return policy.expectedValues(values);
    }

    public boolean isMece() {
        return policy.isAggregatable();
    }
}
