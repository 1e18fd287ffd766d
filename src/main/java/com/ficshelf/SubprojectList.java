package com.ficshelf;

import com.ficshelf.storage.FileTrees;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The project's {@code subprojects.txt}: one path per line, relative to the
 * project directory, {@code #} comments ignored.
 */
public class SubprojectList {

    public static final String FILE_NAME = "subprojects.txt";

    static final String DEFAULT_CONTENT = "\n"
        + "# Subprojects of this project, one path per line, relative to this directory.\n"
        + "# Their stories are merged into this project's catalog.\n";

    private final Path file;

    public SubprojectList(Path projectRoot) {
        this.file = projectRoot.resolve(FILE_NAME);
    }

    static void writeDefaults(Path projectRoot) throws IOException {
        FileTrees.createFileWithContent(projectRoot.resolve(FILE_NAME), DEFAULT_CONTENT);
    }

    public List<String> list() throws IOException {
        Set<String> paths = new LinkedHashSet<>();
        for (String entry : FileTrees.readEntries(file)) {
            paths.add(normalize(entry));
        }
        return new ArrayList<>(paths);
    }

    /**
     * @return false if the path was already listed
     */
    public boolean add(String relativePath) throws IOException {
        String normalized = normalize(relativePath);
        if (list().contains(normalized)) {
            return false;
        }
        FileTrees.appendEntries(file, List.of(normalized));
        return true;
    }

    private static String normalize(String relativePath) {
        String normalized = relativePath.strip().replace('\\', '/');
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
