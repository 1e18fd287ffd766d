package com.ficshelf.aggregate;

import com.ficshelf.AppLogger;
import com.ficshelf.Project;
import com.ficshelf.models.AuthorEntry;
import com.ficshelf.models.CanonicalMetadata;
import com.ficshelf.models.CatalogIndex;
import com.ficshelf.models.CatalogWarning;
import com.ficshelf.storage.FileTrees;
import com.ficshelf.storage.JsonStorage;
import com.ficshelf.target.TargetIdentity;
import com.ficshelf.target.TargetResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes a catalog out as the static content of an archive:
 *
 * <pre>
 * catalog.json                         statistics, category sizes, warnings
 * category/{name}/stories.json         metadata of the category's stories
 * author/{source}-{authorId}/author.json
 * author/{source}-{authorId}/stories.json
 * stories/{source}-{id}/story.html     plus images/ when present
 * </pre>
 *
 * Directory names are bleached so they are safe as path segments.
 */
public class CatalogExporter {

    public static final String CATALOG_FILE = "catalog.json";
    public static final String CATEGORY_DIR = "category";
    public static final String AUTHOR_DIR = "author";
    public static final String STORIES_DIR = "stories";
    public static final String STORIES_FILE = "stories.json";
    public static final String AUTHOR_FILE = "author.json";

    /**
     * @return the number of story directories copied
     */
    public int export(CatalogIndex index, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);

        int copied = 0;
        for (TargetIdentity identity : index.getStories().keySet()) {
            if (copyStory(identity, index.getLocation(identity), outputDir.resolve(STORIES_DIR).resolve(identity.key()))) {
                copied++;
            }
        }

        Map<String, String> categoryDirs = new LinkedHashMap<>();
        Set<String> usedCategoryDirs = new HashSet<>();
        for (Map.Entry<String, List<TargetIdentity>> entry : index.getByCategory().entrySet()) {
            String dirName = uniqueDirName(entry.getKey(), usedCategoryDirs);
            categoryDirs.put(entry.getKey(), dirName);
            Path file = outputDir.resolve(CATEGORY_DIR).resolve(dirName).resolve(STORIES_FILE);
            JsonStorage.writeJsonList(file, index.metadataOf(entry.getValue()));
        }

        Set<String> usedAuthorDirs = new HashSet<>();
        for (AuthorEntry author : index.getByAuthor().values()) {
            Path dir = outputDir.resolve(AUTHOR_DIR).resolve(uniqueDirName(author.getIdentity().key(), usedAuthorDirs));
            Map<String, Object> authorData = new LinkedHashMap<>();
            authorData.put("name", author.getName());
            authorData.put("id", author.getId());
            authorData.put("source", author.getIdentity().getSource());
            authorData.put("url", author.getUrl());
            authorData.put("html", author.getHtml());
            authorData.put("stories", storyKeys(author.getStories()));
            JsonStorage.writeJson(dir.resolve(AUTHOR_FILE), authorData);
            JsonStorage.writeJsonList(dir.resolve(STORIES_FILE), index.metadataOf(author.getStories()));
        }

        JsonStorage.writeJson(outputDir.resolve(CATALOG_FILE), summary(index, categoryDirs));
        log("Exported " + index.getStories().size() + " stories (" + copied + " copied) to " + outputDir);
        return copied;
    }

    private boolean copyStory(TargetIdentity identity, Path location, Path destination) throws IOException {
        if (location == null || !Files.isDirectory(location)) {
            logWarn("No stored copy of " + identity + " to export");
            return false;
        }
        Files.createDirectories(destination);
        Path story = location.resolve(Project.STORY_FILE);
        if (Files.isRegularFile(story)) {
            Files.copy(story, destination.resolve(Project.STORY_FILE), StandardCopyOption.REPLACE_EXISTING);
        } else {
            logWarn(identity + " has no " + Project.STORY_FILE);
        }
        Path images = location.resolve(Project.IMAGES_DIR);
        if (Files.isDirectory(images)) {
            FileTrees.copyDirectory(images, destination.resolve(Project.IMAGES_DIR));
        }
        return true;
    }

    /**
     * Bleached directory name, suffixed with {@code -2}, {@code -3}, ... when an
     * earlier name already took it. Names are compared ignoring case.
     */
    static String uniqueDirName(String name, Set<String> used) {
        String base = TargetResolver.bleachName(name);
        String candidate = base;
        int n = 2;
        while (!used.add(candidate.toLowerCase(Locale.ROOT))) {
            candidate = base + "-" + n++;
        }
        return candidate;
    }

    private Map<String, Object> summary(CatalogIndex index, Map<String, String> categoryDirs) {
        Map<String, Integer> categories = new LinkedHashMap<>();
        for (Map.Entry<String, List<TargetIdentity>> entry : index.getByCategory().entrySet()) {
            categories.put(entry.getKey(), entry.getValue().size());
        }
        List<Map<String, String>> warnings = new ArrayList<>();
        for (CatalogWarning warning : index.getWarnings()) {
            Map<String, String> w = new LinkedHashMap<>();
            w.put("subject", warning.getSubject());
            w.put("message", warning.getMessage());
            warnings.add(w);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("stats", CatalogStats.of(index));
        summary.put("categories", categories);
        summary.put("categoryDirectories", categoryDirs);
        summary.put("discardedDuplicates", index.getDiscardedDuplicates());
        summary.put("warnings", warnings);
        return summary;
    }

    private static List<String> storyKeys(List<TargetIdentity> identities) {
        List<String> keys = new ArrayList<>(identities.size());
        for (TargetIdentity identity : identities) {
            keys.add(identity.key());
        }
        return keys;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[CatalogExporter] " + message);
        }
    }

    private void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[CatalogExporter] " + message);
        }
    }
}
