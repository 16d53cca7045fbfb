package de.bsommerfeld.tscache.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classpath SQL for the snapshot database.
 *
 * <p>
 * Statements live in {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code insert-snapshot.sql} or {@code select-links-for-subject.sql}, and
 * are cached after the first read. The DDL lives in {@code schema.sql} at the
 * classpath root and is handed out as individual statements by
 * {@link #schemaStatements()}. Lines starting with {@code --} are dropped in
 * both cases.
 */
public final class SqlLoader {

    static final String SCHEMA_RESOURCE = "schema.sql";

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement from {@code sql/<name>.sql}.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, n -> stripComments(read("sql/" + n + ".sql")));
    }

    /** The DDL split on statement-terminating semicolons, in file order. */
    public static List<String> schemaStatements() {
        List<String> statements = new ArrayList<>();
        for (String raw : read(SCHEMA_RESOURCE).split(";\\s*(\\r?\\n|$)")) {
            String statement = stripComments(raw);
            if (!statement.isEmpty())
                statements.add(statement);
        }
        return statements;
    }

    static String stripComments(String sql) {
        StringBuilder sb = new StringBuilder();
        for (String line : sql.split("\\r?\\n")) {
            if (!line.trim().startsWith("--"))
                sb.append(line).append('\n');
        }
        return sb.toString().trim();
    }

    private static String read(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null)
                throw new IllegalStateException("SQL resource not found: " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
