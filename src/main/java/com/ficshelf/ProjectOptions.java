package com.ficshelf;

import com.ficshelf.storage.JsonStorage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options stored in a project's {@code project.json}, grouped by category.
 * The file doubles as the marker that makes a directory a project. Every call
 * reads the file afresh; {@link #set} is a whole-file read-modify-write.
 */
public class ProjectOptions {

    public static final String FILE_NAME = "project.json";
    public static final String VERSION = "0.2";
    static final String VERSION_KEY = "version";

    private final Path file;

    public ProjectOptions(Path projectRoot) {
        this.file = projectRoot.resolve(FILE_NAME);
    }

    static void writeDefaults(Path projectRoot) throws IOException {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(VERSION_KEY, VERSION);
        JsonStorage.writeJson(projectRoot.resolve(FILE_NAME), content);
    }

    public String getVersion() throws IOException {
        Object version = JsonStorage.readJsonObject(file).get(VERSION_KEY);
        return version != null ? version.toString() : null;
    }

    /**
     * Get an option value.
     *
     * @param category     option category
     * @param name         option name; null returns the whole category value
     * @param defaultValue returned when the category or name is not set
     */
    public Object get(String category, String name, Object defaultValue) throws IOException {
        Map<String, Object> content = JsonStorage.readJsonObject(file);
        if (!content.containsKey(category)) {
            return defaultValue;
        }
        Object categoryValue = content.get(category);
        if (name == null) {
            return categoryValue;
        }
        if (!(categoryValue instanceof Map)) {
            return defaultValue;
        }
        Map<?, ?> options = (Map<?, ?>) categoryValue;
        return options.containsKey(name) ? options.get(name) : defaultValue;
    }

    public String getString(String category, String name, String defaultValue) throws IOException {
        Object value = get(category, name, defaultValue);
        return value != null ? value.toString() : null;
    }

    /**
     * Booleans may have been stored as JSON booleans or as the strings
     * {@code true}/{@code false} (values entered as text).
     */
    public boolean getBoolean(String category, String name, boolean defaultValue) throws IOException {
        Object value = get(category, name, defaultValue);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String s = ((String) value).strip();
            if ("true".equalsIgnoreCase(s) || "1".equals(s) || "yes".equalsIgnoreCase(s)) {
                return true;
            }
            if ("false".equalsIgnoreCase(s) || "0".equals(s) || "no".equalsIgnoreCase(s)) {
                return false;
            }
        }
        return defaultValue;
    }

    /**
     * Set an option value. With a null name the whole category is replaced.
     */
    @SuppressWarnings("unchecked")
    public void set(String category, String name, Object value) throws IOException {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Option category is required");
        }
        if (VERSION_KEY.equals(category)) {
            throw new IllegalArgumentException("The project version cannot be changed through options");
        }
        Map<String, Object> content = JsonStorage.readJsonObject(file);
        if (name == null) {
            content.put(category, value);
        } else {
            Object existing = content.get(category);
            Map<String, Object> options = existing instanceof Map
                ? new LinkedHashMap<>((Map<String, Object>) existing)
                : new LinkedHashMap<>();
            options.put(name, value);
            content.put(category, options);
        }
        JsonStorage.writeJson(file, content);
        log("Set option " + category + (name != null ? "." + name : "") + " = " + value);
    }

    public Map<String, Object> asMap() throws IOException {
        return JsonStorage.readJsonObject(file);
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[ProjectOptions] " + message);
        }
    }
}
