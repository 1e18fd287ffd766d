package com.ficshelf;

import com.ficshelf.errors.InvalidReferenceException;
import com.ficshelf.storage.JsonStorage;
import com.ficshelf.target.Target;
import com.ficshelf.target.TargetIdentity;
import com.ficshelf.target.TargetResolver;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Targets flagged for re-download, kept in {@code update_marks.json} as a JSON
 * array of URLs. Membership is decided by identity, so any spelling of a
 * story's URL marks and unmarks the same entry.
 */
public class UpdateMarkStore {

    public static final String FILE_NAME = "update_marks.json";

    private final Path file;

    public UpdateMarkStore(Path projectRoot) {
        this.file = projectRoot.resolve(FILE_NAME);
    }

    public List<Target> list() throws IOException {
        return new ArrayList<>(load().values());
    }

    public boolean isMarked(Target target) throws IOException {
        return load().containsKey(target.getIdentity());
    }

    /**
     * Mark or unmark a target. Repeating a call is a no-op.
     *
     * @return whether the stored set changed
     */
    public boolean mark(Target target, boolean required) throws IOException {
        Map<TargetIdentity, Target> marks = load();
        boolean changed;
        if (required) {
            changed = marks.putIfAbsent(target.getIdentity(), target) == null;
        } else {
            changed = marks.remove(target.getIdentity()) != null;
        }
        if (changed) {
            List<String> urls = new ArrayList<>();
            for (Target marked : marks.values()) {
                urls.add(marked.getUrl());
            }
            JsonStorage.writeJsonList(file, urls);
            log((required ? "Marked " : "Unmarked ") + target.getUrl() + " for update");
        }
        return changed;
    }

    private Map<TargetIdentity, Target> load() throws IOException {
        Map<TargetIdentity, Target> marks = new LinkedHashMap<>();
        for (String url : JsonStorage.readJsonList(file, String[].class)) {
            try {
                Target target = TargetResolver.resolve(url);
                marks.putIfAbsent(target.getIdentity(), target);
            } catch (InvalidReferenceException e) {
                logWarn("Ignoring invalid update mark: " + e.getMessage());
            }
        }
        return marks;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[UpdateMarkStore] " + message);
        }
    }

    private void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[UpdateMarkStore] " + message);
        }
    }
}
