package com.ficshelf.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whole-file JSON reads and writes for the small files a project keeps.
 * Writes replace the file in place; there is no locking or atomic rename.
 */
public class JsonStorage {

    private static final ObjectMapper mapper = new ObjectMapper();

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    public static ObjectMapper mapper() {
        return mapper;
    }

    public static <T> List<T> readJsonList(Path filePath, Class<T[]> clazz) throws IOException {
        if (!Files.exists(filePath)) {
            return Collections.emptyList();
        }
        T[] items = mapper.readValue(filePath.toFile(), clazz);
        if (items == null || items.length == 0) {
            return Collections.emptyList();
        }
        return new ArrayList<>(Arrays.asList(items));
    }

    public static void writeJsonList(Path filePath, List<?> data) throws IOException {
        writeJson(filePath, data);
    }

    /**
     * Reads a JSON object as an insertion-ordered map. A missing file reads as an empty map.
     */
    public static Map<String, Object> readJsonObject(Path filePath) throws IOException {
        if (!Files.exists(filePath)) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> content = mapper.readValue(filePath.toFile(), OBJECT_TYPE);
        return content != null ? content : new LinkedHashMap<>();
    }

    public static void writeJson(Path filePath, Object data) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(filePath.toFile(), data);
    }
}
