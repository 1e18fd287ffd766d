package com.ficshelf;

import com.ficshelf.storage.JsonStorage;
import com.ficshelf.target.TargetIdentity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for laying out stored stories without going through a download.
 */
public final class ProjectFixtures {

    private ProjectFixtures() {
    }

    public static Map<String, Object> metadata(String source, String id, String title, String category, String authorId) {
        Map<String, Object> md = new LinkedHashMap<>();
        md.put("storyId", id);
        md.put("siteabbrev", source);
        md.put("title", title);
        md.put("author", "Author " + authorId);
        md.put("authorId", authorId);
        md.put("authorUrl", "https://example.org/u/" + authorId);
        md.put("authorHTML", "<a>Author " + authorId + "</a>");
        if (category != null) {
            md.put("category", category);
        }
        md.put("numWords", "1,000");
        md.put("numChapters", "2");
        return md;
    }

    public static Path storeStory(Project project, String source, String id, Map<String, Object> metadata) throws IOException {
        Path dir = project.targetDirectory(new TargetIdentity(source, id));
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(Project.STORY_FILE), "<html>" + source + "/" + id + "</html>", StandardCharsets.UTF_8);
        JsonStorage.writeJson(dir.resolve(Project.METADATA_FILE), metadata);
        return dir;
    }

    public static Path storeStory(Project project, String source, String id, String title, String category) throws IOException {
        return storeStory(project, source, id, metadata(source, id, title, category, "a" + id));
    }
}
