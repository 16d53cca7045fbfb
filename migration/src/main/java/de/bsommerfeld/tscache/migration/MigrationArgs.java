package de.bsommerfeld.tscache.migration;

import de.bsommerfeld.tscache.core.config.MigrationConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Command line of {@link MigrationMain}. Options take their value either as
 * the next argument or after {@code =}.
 */
final class MigrationArgs {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: tscache-migrate (--subject ID | --subject-prefix PREFIX) [options]",
            "Rewrites retrieved_at so every retrieval batch carries one timestamp. Dry run unless --commit.",
            "",
            "  --subject ID                 migrate exactly this subject",
            "  --subject-prefix PREFIX      migrate every subject whose id starts with PREFIX",
            "  --retrieved-from TIME        only select subjects with rows retrieved at/after TIME",
            "  --retrieved-to TIME          only select subjects with rows retrieved at/before TIME",
            "                               (TIME is an ISO instant or a date; selection only,",
            "                               a selected subject is always migrated in full)",
            "  --window-seconds N           batch gap in seconds, 1..3600 (default from config)",
            "  --commit                     apply the changes",
            "  --allow-delete-identical     permit deleting identical duplicate rows",
            "  --db PATH                    SQLite database (default from config)",
            "  --config PATH                config.toml to load",
            "  --help                       print this text");

    private static final Set<String> VALUED = Set.of("--subject", "--subject-prefix", "--retrieved-from",
            "--retrieved-to", "--window-seconds", "--db", "--config");
    private static final Set<String> FLAGS = Set.of("--commit", "--allow-delete-identical", "--help");

    private final Map<String, String> values;
    private final boolean help;
    private final boolean commit;
    private final boolean allowDeleteIdentical;

    private MigrationArgs(Map<String, String> values, Set<String> flags) {
        this.values = values;
        this.help = flags.contains("--help");
        this.commit = flags.contains("--commit");
        this.allowDeleteIdentical = flags.contains("--allow-delete-identical");
    }

    /**
     * @throws IllegalArgumentException on unknown options, missing values or
     *                                  repeated options
     */
    static MigrationArgs parse(String[] args) {
        Map<String, String> values = new HashMap<>();
        Set<String> flags = new HashSet<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }

            if (FLAGS.contains(name)) {
                if (value != null)
                    throw new IllegalArgumentException(name + " takes no value");
                flags.add(name);
            } else if (VALUED.contains(name)) {
                if (value == null) {
                    if (i + 1 >= args.length)
                        throw new IllegalArgumentException("Missing value for " + name);
                    value = args[++i];
                }
                if (values.put(name, value) != null)
                    throw new IllegalArgumentException(name + " given more than once");
            } else {
                throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        return new MigrationArgs(values, flags);
    }

    boolean help() {
        return help;
    }

    Path db() {
        String db = values.get("--db");
        return db == null ? null : Path.of(db);
    }

    Path config() {
        String config = values.get("--config");
        return config == null ? null : Path.of(config);
    }

    /**
     * Builds the run options. The window falls back to
     * {@code defaultWindowSeconds} when not given.
     *
     * @throws IllegalArgumentException if the scope is missing or a value is malformed
     */
    MigrationOptions toOptions(int defaultWindowSeconds) {
        String subject = values.get("--subject");
        String prefix = values.get("--subject-prefix");
        if (subject == null && prefix == null)
            throw new IllegalArgumentException("A scope is required: --subject or --subject-prefix");

        int windowSeconds = defaultWindowSeconds;
        String window = values.get("--window-seconds");
        if (window != null) {
            try {
                windowSeconds = Integer.parseInt(window.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--window-seconds is not a number: " + window, e);
            }
        }
        if (windowSeconds < MigrationConfig.MIN_WINDOW_SECONDS
                || windowSeconds > MigrationConfig.MAX_WINDOW_SECONDS)
            throw new IllegalArgumentException("--window-seconds must be between " + MigrationConfig.MIN_WINDOW_SECONDS
                    + " and " + MigrationConfig.MAX_WINDOW_SECONDS + ", got " + windowSeconds);

        Instant from = parseTime("--retrieved-from", false);
        Instant to = parseTime("--retrieved-to", true);
        return new MigrationOptions(subject, prefix, from, to, Duration.ofSeconds(windowSeconds), commit,
                allowDeleteIdentical);
    }

    /** A bare date covers the whole UTC day. */
    private Instant parseTime(String name, boolean endOfDay) {
        String raw = values.get(name);
        if (raw == null)
            return null;
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException notInstant) {
            try {
                LocalDate day = LocalDate.parse(raw);
                return endOfDay
                        ? day.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusMillis(1)
                        : day.atStartOfDay().toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(name + " is neither an ISO instant nor a date: " + raw, e);
            }
        }
    }
}
