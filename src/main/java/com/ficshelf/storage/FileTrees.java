package com.ficshelf.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Filesystem helpers for project directories and the line-based list files.
 */
public final class FileTrees {

    private FileTrees() {
    }

    /**
     * Delete a file or a directory with all its contents. Missing paths are ignored.
     */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        if (!Files.isDirectory(path)) {
            Files.delete(path);
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder())
                .forEach(p -> {
                    try {
                        Files.delete(p);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to delete: " + p, e);
                    }
                });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public static void copyDirectory(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()));
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Names of the direct subdirectories of {@code dir}, sorted. Empty if {@code dir} is missing.
     */
    public static List<String> listSubdirectories(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        List<String> names = new ArrayList<>();
        try (Stream<Path> entries = Files.list(dir)) {
            entries.filter(Files::isDirectory)
                .map(p -> p.getFileName().toString())
                .filter(name -> !name.startsWith("."))
                .sorted()
                .forEach(names::add);
        }
        return names;
    }

    /**
     * Read a list file: one entry per line, surrounding whitespace stripped,
     * blank lines and lines starting with {@code #} skipped.
     */
    public static List<String> readEntries(Path file) throws IOException {
        if (!Files.exists(file)) {
            return Collections.emptyList();
        }
        List<String> entries = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String entry = line.strip();
            if (entry.isEmpty() || entry.startsWith("#")) {
                continue;
            }
            entries.add(entry);
        }
        return entries;
    }

    /**
     * Append entries, one per line, starting on a fresh line.
     */
    public static void appendEntries(Path file, List<String> entries) throws IOException {
        if (entries.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder();
        if (Files.exists(file) && Files.size(file) > 0) {
            String existing = Files.readString(file, StandardCharsets.UTF_8);
            if (!existing.endsWith("\n")) {
                sb.append('\n');
            }
        }
        for (String entry : entries) {
            sb.append(entry).append('\n');
        }
        Files.writeString(file, sb.toString(), StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /**
     * Create a file with the given content, failing if it already exists.
     */
    public static void createFileWithContent(Path file, String content) throws IOException {
        Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
    }
}
