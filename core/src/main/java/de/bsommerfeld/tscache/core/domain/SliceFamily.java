package de.bsommerfeld.tscache.core.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stable identity of a slice: mode plus context dimensions, with the
 * window/cohort arguments dropped. Two slice keys that only differ by their
 * date arguments (or by clause order) belong to the same family.
 *
 * <p>
 * The canonical form lists context clauses sorted by key and value, followed
 * by the argument-less mode clause, e.g.
 * {@code context(channel:google).window()}. The uncontexted family of a mode
 * is just {@code window()} or {@code cohort()}.
 *
 * @param mode       the query mode
 * @param dimensions context dimensions, sorted and immutable
 */
public record SliceFamily(QueryMode mode, List<ContextDimension> dimensions) {

    public SliceFamily {
        Objects.requireNonNull(mode, "mode");
        List<ContextDimension> sorted = new ArrayList<>(dimensions == null ? List.of() : dimensions);
        sorted.sort(null);
        dimensions = List.copyOf(sorted);
    }

    public static SliceFamily uncontexted(QueryMode mode) {
        return new SliceFamily(mode, List.of());
    }

    /** Parses any slice DSL string and returns its family. */
    public static SliceFamily parse(String dsl) {
        return SliceKey.parse(dsl).family();
    }

    public boolean isUncontexted() {
        return dimensions.isEmpty();
    }

    /** The canonical string form used for matching and grouping. */
    public String canonical() {
        StringBuilder sb = new StringBuilder();
        for (ContextDimension d : dimensions) {
            sb.append(d.toClause()).append('.');
        }
        return sb.append(mode.clause()).append("()").toString();
    }

    @Override
    public String toString() {
        return canonical();
    }
}
