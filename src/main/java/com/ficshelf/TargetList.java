package com.ficshelf;

import com.ficshelf.errors.InvalidReferenceException;
import com.ficshelf.errors.InvalidTargetException;
import com.ficshelf.models.AddResult;
import com.ficshelf.models.BulkAddResult;
import com.ficshelf.storage.FileTrees;
import com.ficshelf.target.Target;
import com.ficshelf.target.TargetIdentity;
import com.ficshelf.target.TargetResolver;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The project's {@code target_urls.txt}: one reference per line, {@code #}
 * comments and blank lines ignored. The file is only ever appended to;
 * duplicates that slipped in (by hand editing, or two spellings of one story)
 * are dropped when the list is read.
 */
public class TargetList {

    public static final String FILE_NAME = "target_urls.txt";

    static final String DEFAULT_CONTENT = "\n"
        + "# Welcome to FicShelf.\n"
        + "# Please add the stories you want to download to this file.\n"
        + "# Each line should contain exactly one story URL or fanfiction.net story id.\n"
        + "# Lines starting with '#' will be ignored.\n";

    private final Path file;

    public TargetList(Path projectRoot) {
        this.file = projectRoot.resolve(FILE_NAME);
    }

    static void writeDefaults(Path projectRoot) throws IOException {
        FileTrees.createFileWithContent(projectRoot.resolve(FILE_NAME), DEFAULT_CONTENT);
    }

    /**
     * All targets in file order, each identity once. Lines that no longer
     * resolve are skipped with a warning.
     */
    public List<Target> list() throws IOException {
        Map<TargetIdentity, Target> targets = new LinkedHashMap<>();
        for (String line : FileTrees.readEntries(file)) {
            try {
                Target target = TargetResolver.resolve(line);
                targets.putIfAbsent(target.getIdentity(), target);
            } catch (InvalidReferenceException e) {
                logWarn("Skipping invalid line in " + FILE_NAME + ": " + e.getMessage());
            }
        }
        return new ArrayList<>(targets.values());
    }

    public boolean contains(Target target) throws IOException {
        return list().contains(target);
    }

    /**
     * Add one reference.
     *
     * @throws InvalidTargetException if the reference does not resolve
     */
    public AddResult add(String reference) throws IOException {
        Target target;
        try {
            target = TargetResolver.resolve(reference);
        } catch (InvalidReferenceException e) {
            throw new InvalidTargetException(reference);
        }
        if (contains(target)) {
            log("Target already defined, skipping: " + target.getUrl());
            return AddResult.ALREADY_PRESENT;
        }
        FileTrees.appendEntries(file, List.of(target.getUrl()));
        log("Added target " + target.getUrl());
        return AddResult.ADDED;
    }

    /**
     * Add many references at once. Candidates and existing targets are both
     * sorted by identity and merged with two cursors, so the insertion
     * decisions cost at most {@code n + m} comparisons. New targets are
     * appended in the order they were given, in a single write.
     */
    public BulkAddResult addAll(Collection<String> references) throws IOException {
        BulkAddResult result = new BulkAddResult();

        Map<TargetIdentity, Target> candidates = new LinkedHashMap<>();
        for (String reference : references) {
            try {
                Target target = TargetResolver.resolve(reference);
                if (candidates.putIfAbsent(target.getIdentity(), target) != null) {
                    result.recordAlreadyPresent();
                }
            } catch (InvalidReferenceException e) {
                result.recordInvalid(reference);
            }
        }

        List<TargetIdentity> sortedCandidates = new ArrayList<>(candidates.keySet());
        sortedCandidates.sort(null);
        List<TargetIdentity> sortedExisting = new ArrayList<>();
        for (Target existing : list()) {
            sortedExisting.add(existing.getIdentity());
        }
        sortedExisting.sort(null);

        Set<TargetIdentity> fresh = new HashSet<>();
        int i = 0;
        int j = 0;
        while (i < sortedCandidates.size()) {
            TargetIdentity candidate = sortedCandidates.get(i);
            if (j >= sortedExisting.size()) {
                fresh.add(candidate);
                i++;
                continue;
            }
            result.recordComparison();
            int cmp = candidate.compareTo(sortedExisting.get(j));
            if (cmp == 0) {
                result.recordAlreadyPresent();
                i++;
                j++;
            } else if (cmp < 0) {
                fresh.add(candidate);
                i++;
            } else {
                j++;
            }
        }

        List<String> lines = new ArrayList<>();
        for (Target target : candidates.values()) {
            if (fresh.contains(target.getIdentity())) {
                lines.add(target.getUrl());
                result.recordAdded(target.getUrl());
            }
        }
        FileTrees.appendEntries(file, lines);
        log("Bulk add: " + result);
        return result;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[TargetList] " + message);
        }
    }

    private void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[TargetList] " + message);
        }
    }
}
