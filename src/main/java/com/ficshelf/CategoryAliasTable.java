package com.ficshelf;

import com.ficshelf.storage.JsonStorage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-project rules that file stories of one category under another, stored
 * in {@code aliases.json}. Lookups take exactly one hop: with {@code A -> B}
 * and {@code B -> C}, {@code A} resolves to {@code B}.
 */
public class CategoryAliasTable {

    public static final String FILE_NAME = "aliases.json";

    private final Path file;
    private final Map<String, String> aliases = new LinkedHashMap<>();

    private CategoryAliasTable(Path file) {
        this.file = file;
    }

    /**
     * Load the alias table of the project at {@code projectRoot}. A missing file is an empty table.
     */
    public static CategoryAliasTable load(Path projectRoot) throws IOException {
        CategoryAliasTable table = new CategoryAliasTable(projectRoot.resolve(FILE_NAME));
        for (Map.Entry<String, Object> entry : JsonStorage.readJsonObject(table.file).entrySet()) {
            if (entry.getValue() instanceof String) {
                table.aliases.put(entry.getKey(), (String) entry.getValue());
            } else {
                logWarn("Ignoring non-text alias target for '" + entry.getKey() + "' in " + table.file);
            }
        }
        return table;
    }

    static void writeEmpty(Path projectRoot) throws IOException {
        JsonStorage.writeJson(projectRoot.resolve(FILE_NAME), new LinkedHashMap<String, String>());
    }

    /**
     * Treat category {@code from} as {@code to} from now on. Replaces any
     * existing rule for {@code from} and is written to disk immediately.
     */
    public synchronized void addAlias(String from, String to) throws IOException {
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("Alias source category is required");
        }
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("Alias target category is required");
        }
        aliases.put(from, to);
        JsonStorage.writeJson(file, aliases);
        log("Category alias '" + from + "' -> '" + to + "'");
    }

    public synchronized String resolve(String category) {
        if (category == null) {
            return null;
        }
        return aliases.getOrDefault(category, category);
    }

    public synchronized Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    private static void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[CategoryAliasTable] " + message);
        }
    }

    private static void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[CategoryAliasTable] " + message);
        }
    }
}
