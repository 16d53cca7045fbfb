package de.bsommerfeld.tscache.core.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed form of a slice DSL string such as
 * {@code context(channel:google).window(-30d:-1d)}.
 *
 * <p>
 * Slice keys are parsed once at the boundary and passed around as this typed
 * structure; the string form only exists for persistence ({@link #toDsl()}).
 * Clauses are separated by dots outside of parentheses. Supported clauses:
 * <ul>
 * <li>{@code context(key:value)}: any number, order irrelevant</li>
 * <li>{@code window(args)} or {@code cohort(args)}: at most one; defaults to
 * an argument-less window when absent</li>
 * </ul>
 *
 * @param mode       the query mode
 * @param dimensions context dimensions, sorted and immutable
 * @param modeArgs   raw arguments of the mode clause, empty if none. Volatile
 *                   by nature and excluded from the {@link SliceFamily}
 */
public record SliceKey(QueryMode mode, List<ContextDimension> dimensions, String modeArgs) {

    public SliceKey {
        Objects.requireNonNull(mode, "mode");
        List<ContextDimension> sorted = new ArrayList<>(dimensions == null ? List.of() : dimensions);
        sorted.sort(null);
        dimensions = List.copyOf(sorted);
        modeArgs = modeArgs == null ? "" : modeArgs.trim();
    }

    public static SliceKey uncontexted(QueryMode mode) {
        return new SliceKey(mode, List.of(), "");
    }

    /**
     * Parses a slice DSL string. {@code null} and the empty string denote the
     * uncontexted window slice.
     *
     * @throws IllegalArgumentException on unknown clauses, duplicate mode
     *                                  clauses or malformed context clauses
     */
    public static SliceKey parse(String dsl) {
        if (dsl == null || dsl.isBlank())
            return uncontexted(QueryMode.WINDOW);

        QueryMode mode = null;
        String args = "";
        List<ContextDimension> dims = new ArrayList<>();

        for (String clause : splitClauses(dsl.trim())) {
            int open = clause.indexOf('(');
            if (open <= 0 || !clause.endsWith(")"))
                throw new IllegalArgumentException("Malformed slice clause '" + clause + "' in: " + dsl);

            String name = clause.substring(0, open).trim();
            String body = clause.substring(open + 1, clause.length() - 1).trim();

            if ("context".equals(name)) {
                int sep = body.indexOf(':');
                if (sep <= 0)
                    throw new IllegalArgumentException("Context clause needs key:value, got '" + clause + "'");
                dims.add(new ContextDimension(body.substring(0, sep).trim(), body.substring(sep + 1).trim()));
                continue;
            }

            QueryMode clauseMode = QueryMode.fromClause(name);
            if (clauseMode == null)
                throw new IllegalArgumentException("Unknown slice clause '" + name + "' in: " + dsl);
            if (mode != null)
                throw new IllegalArgumentException("Slice declares more than one mode clause: " + dsl);
            mode = clauseMode;
            args = body;
        }

        return new SliceKey(mode == null ? QueryMode.WINDOW : mode, dims, args);
    }

    /** Splits on dots that are not enclosed in parentheses. */
    private static List<String> splitClauses(String dsl) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < dsl.length(); i++) {
            char c = dsl.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == '.' && depth == 0) {
                addClause(out, dsl.substring(start, i));
                start = i + 1;
            }
        }
        addClause(out, dsl.substring(start));
        return out;
    }

    private static void addClause(List<String> out, String raw) {
        String clause = raw.trim();
        if (!clause.isEmpty())
            out.add(clause);
    }

    public SliceFamily family() {
        return new SliceFamily(mode, dimensions);
    }

    public boolean isUncontexted() {
        return dimensions.isEmpty();
    }

    /**
     * Canonical DSL form including the mode arguments, e.g.
     * {@code context(channel:google).window(-30d:-1d)}. This is the value
     * persisted as {@code slice_key}.
     */
    public String toDsl() {
        StringBuilder sb = new StringBuilder();
        for (ContextDimension d : dimensions) {
            sb.append(d.toClause()).append('.');
        }
        return sb.append(mode.clause()).append('(').append(modeArgs).append(')').toString();
    }

    @Override
    public String toString() {
        return toDsl();
    }
}
