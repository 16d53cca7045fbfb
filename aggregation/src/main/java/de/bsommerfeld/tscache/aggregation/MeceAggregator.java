package de.bsommerfeld.tscache.aggregation;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.aggregation.definition.ContextDefinition;
import de.bsommerfeld.tscache.aggregation.definition.DefinitionResolver;
import de.bsommerfeld.tscache.core.config.AggregationConfig;
import de.bsommerfeld.tscache.core.config.MultiDimensionPolicy;
import de.bsommerfeld.tscache.core.domain.ContextDimension;
import de.bsommerfeld.tscache.core.domain.QueryMode;
import de.bsommerfeld.tscache.core.domain.SnapshotMetrics;
import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Sums mutually exclusive, collectively exhaustive context slices into an
 * uncontexted total, but only for days whose partition provably was complete
 * when the data was produced.
 *
 * <h3>Per day</h3>
 * <ol>
 * <li>An uncontexted row, if present, is used as is.</li>
 * <li>Otherwise every contributing {@code (subject, hash, retrieved_at)} group
 * is judged by the definition in force at its {@code retrieved_at}, never by
 * today's. Groups judged by different versions refuse the day.</li>
 * <li>The values present must match the expected set exactly once each.</li>
 * </ol>
 *
 * <p>
 * Only counts are summed. Lag statistics are not additive and are dropped from
 * aggregated days. A refusal is a regular result, never an exception.
 */
@Singleton
public class MeceAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(MeceAggregator.class);

    private record Producer(String subjectId, String coreHash, Instant retrievedAt) {

        static Producer of(SnapshotRow row) {
            return new Producer(row.subjectId(), row.coreHash(), row.retrievedAt());
        }
    }

    private final DefinitionResolver resolver;
    private final MultiDimensionPolicy policy;

    @Inject
    public MeceAggregator(DefinitionResolver resolver, AggregationConfig config) {
        this(resolver, config.getMultiDimensionPolicy());
    }

    public MeceAggregator(DefinitionResolver resolver, MultiDimensionPolicy policy) {
        this.resolver = resolver;
        this.policy = policy;
    }

    public AggregationResult aggregate(List<SnapshotRow> rows) {
        if (rows.isEmpty())
            return new AggregationResult(List.of(), null, null);

        Set<QueryMode> modes = new HashSet<>();
        rows.forEach(r -> modes.add(r.sliceKey().mode()));
        if (modes.size() > 1) {
            LOG.info("Refusing aggregation over mixed modes {}", modes);
            return refuseAll(rows, RefusalReason.MIXED_MODES, "rows mix modes " + modes);
        }

        Map<LocalDate, List<SnapshotRow>> byDay = new TreeMap<>();
        for (SnapshotRow row : rows)
            byDay.computeIfAbsent(row.anchorDay(), d -> new ArrayList<>()).add(row);

        List<SnapshotRow> contexted = new ArrayList<>();
        for (List<SnapshotRow> dayRows : byDay.values()) {
            if (dayRows.stream().noneMatch(r -> r.sliceKey().isUncontexted()))
                contexted.addAll(dayRows);
        }

        String key = null;
        String keyProblem = null;
        if (!contexted.isEmpty()) {
            Set<String> keys = new TreeSet<>();
            boolean multiDimRow = false;
            for (SnapshotRow row : contexted) {
                row.sliceKey().dimensions().forEach(d -> keys.add(d.key()));
                multiDimRow |= row.sliceKey().dimensions().size() > 1;
            }
            if (!multiDimRow && keys.size() == 1) {
                key = keys.iterator().next();
            } else if (policy == MultiDimensionPolicy.BEST_SINGLE_KEY) {
                key = bestSingleKey(contexted);
                if (key == null)
                    keyProblem = "no single-dimension rows to choose a key from";
                else
                    LOG.debug("Multiple context keys {}, summing over '{}'", keys, key);
            } else {
                keyProblem = "rows vary over keys " + keys + (multiDimRow ? " and carry multi-dimension slices" : "");
            }
        }

        List<DayAggregate> days = new ArrayList<>();
        for (Map.Entry<LocalDate, List<SnapshotRow>> entry : byDay.entrySet()) {
            LocalDate day = entry.getKey();
            List<SnapshotRow> dayRows = entry.getValue();

            Optional<SnapshotRow> uncontexted = dayRows.stream()
                    .filter(r -> r.sliceKey().isUncontexted())
                    .max(Comparator.comparing(SnapshotRow::retrievedAt));
            if (uncontexted.isPresent()) {
                days.add(DayAggregate.explicit(day, uncontexted.get().metrics()));
            } else if (keyProblem != null) {
                days.add(DayAggregate.refused(day, RefusalReason.MULTIPLE_DIMENSIONS, keyProblem));
            } else {
                days.add(aggregateDay(day, candidates(dayRows, key), key));
            }
        }

        return new AggregationResult(days, key, keyProblem == null ? null : RefusalReason.MULTIPLE_DIMENSIONS);
    }

    private DayAggregate aggregateDay(LocalDate day, List<SnapshotRow> rows, String key) {
        if (rows.isEmpty())
            return DayAggregate.refused(day, RefusalReason.INCOMPLETE_PARTITION, "no rows for key '" + key + "'");

        Map<Producer, ContextDefinition> definitions = new HashMap<>();
        for (SnapshotRow row : rows) {
            Producer producer = Producer.of(row);
            if (definitions.containsKey(producer))
                continue;
            Optional<ContextDefinition> def = resolver.getDefinitionAsOf(key, producer.retrievedAt());
            if (def.isEmpty())
                return DayAggregate.refused(day, RefusalReason.UNKNOWN_DEFINITION,
                        "no definition of '" + key + "' in force at " + producer.retrievedAt());
            definitions.put(producer, def.get());
        }

        Set<String> versions = new TreeSet<>();
        definitions.values().forEach(d -> versions.add(d.version()));
        if (versions.size() > 1)
            return DayAggregate.refused(day, RefusalReason.MIXED_EPOCHS,
                    "rows judged by definition versions " + versions);

        ContextDefinition definition = definitions.values().iterator().next();
        if (!definition.isMece())
            return DayAggregate.refused(day, RefusalReason.NOT_MECE,
                    "definition '" + key + "' " + definition.version() + " has an undefined other bucket");

        Set<String> expected = definition.expectedValues();
        Set<String> seen = new LinkedHashSet<>();
        for (SnapshotRow row : rows) {
            String value = valueOf(row, key);
            if (!seen.add(value))
                return DayAggregate.refused(day, RefusalReason.NOT_MECE, "value '" + value + "' appears twice");
            if (!expected.contains(value))
                return DayAggregate.refused(day, RefusalReason.NOT_MECE,
                        "value '" + value + "' is not part of " + key + " " + definition.version());
        }

        Set<String> missing = new TreeSet<>(expected);
        missing.removeAll(seen);
        if (!missing.isEmpty())
            return DayAggregate.incomplete(day, missing, definition.version());

        for (SnapshotRow row : rows) {
            SnapshotMetrics m = row.metrics();
            if (m.denominator() == null || m.numerator() == null)
                return DayAggregate.refused(day, RefusalReason.MISSING_COUNTS,
                        "value '" + valueOf(row, key) + "' has no " + (m.denominator() == null ? "denominator"
                                : "numerator"));
        }

        return DayAggregate.aggregated(day, sum(rows), definition.version());
    }

    /** Requires both counts on every row. */
    private static SnapshotMetrics sum(List<SnapshotRow> rows) {
        Long anchorEntrants = 0L;
        long denominator = 0;
        long numerator = 0;
        for (SnapshotRow row : rows) {
            SnapshotMetrics m = row.metrics();
            denominator += m.denominator();
            numerator += m.numerator();
            if (anchorEntrants != null && m.anchorEntrants() != null)
                anchorEntrants += m.anchorEntrants();
            else
                anchorEntrants = null;
        }
        return new SnapshotMetrics(anchorEntrants, denominator, numerator, null, null, null, null, null);
    }

    /** Single-dimension rows over {@code key}. */
    private static List<SnapshotRow> candidates(List<SnapshotRow> dayRows, String key) {
        List<SnapshotRow> out = new ArrayList<>();
        for (SnapshotRow row : dayRows) {
            List<ContextDimension> dims = row.sliceKey().dimensions();
            if (dims.size() == 1 && dims.get(0).key().equals(key))
                out.add(row);
        }
        return out;
    }

    private static String valueOf(SnapshotRow row, String key) {
        return row.sliceKey().dimensions().stream()
                .filter(d -> d.key().equals(key))
                .findFirst()
                .map(ContextDimension::value)
                .orElseThrow();
    }

    /** The key with the most distinct values among single-dimension rows; ties go to the smaller key. */
    private static String bestSingleKey(List<SnapshotRow> rows) {
        Map<String, Set<String>> valuesByKey = new TreeMap<>();
        for (SnapshotRow row : rows) {
            List<ContextDimension> dims = row.sliceKey().dimensions();
            if (dims.size() == 1)
                valuesByKey.computeIfAbsent(dims.get(0).key(), k -> new HashSet<>()).add(dims.get(0).value());
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Set<String>> e : valuesByKey.entrySet()) {
            if (e.getValue().size() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue().size();
            }
        }
        return best;
    }

    private static AggregationResult refuseAll(List<SnapshotRow> rows, RefusalReason reason, String detail) {
        Set<LocalDate> days = new TreeSet<>();
        rows.forEach(r -> days.add(r.anchorDay()));
        List<DayAggregate> out = new ArrayList<>();
        for (LocalDate day : days)
            out.add(DayAggregate.refused(day, reason, detail));
        return new AggregationResult(out, null, reason);
    }
}
