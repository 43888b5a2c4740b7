package de.bsommerfeld.quizbank.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Loads SQL from classpath resources. Single statements live under
 * {@code sql/<operation>-<entity>.sql}, e.g. {@code insert-option.sql};
 * multi-statement scripts such as {@code schema.sql} sit at the classpath
 * root and are split into individual statements.
 *
 * <p>
 * Every resource is read once and cached for the lifetime of the JVM.
 *
 * @see SchemaManager
 */
public final class SqlLoader {

    private static final String STATEMENT_DIR = "sql/";
    private static final Pattern STATEMENT_END = Pattern.compile(";\\s*(\\r?\\n|$)");
    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement stored in {@code sql/<name>.sql}, trimmed.
     *
     * @param name file stem without directory or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(STATEMENT_DIR + name + ".sql", SqlLoader::read);
    }

    /**
     * Returns the statements of a script resource in file order. Line comments
     * ({@code --}) are dropped, statements are separated by a semicolon at the
     * end of a line.
     *
     * @param resource classpath path of the script, e.g. {@code schema.sql}
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> loadScript(String resource) {
        String script = CACHE.computeIfAbsent(resource, SqlLoader::read);

        StringBuilder withoutComments = new StringBuilder();
        for (String line : script.split("\\r?\\n")) {
            if (!line.trim().startsWith("--")) {
                withoutComments.append(line).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        for (String statement : STATEMENT_END.split(withoutComments)) {
            if (!statement.isBlank()) {
                statements.add(statement.trim());
            }
        }
        return statements;
    }

    private static String read(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
