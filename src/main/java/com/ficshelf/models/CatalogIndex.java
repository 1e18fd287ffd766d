package com.ficshelf.models;

import com.ficshelf.target.TargetIdentity;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The merged catalog of a project tree: every story once, plus the category
 * and author indexes over them. Built by the aggregation engine and read-only
 * once returned.
 */
public class CatalogIndex {

    public static final String ALL_CATEGORY = "ALL";

    private final Map<TargetIdentity, CanonicalMetadata> stories = new LinkedHashMap<>();
    private final Map<TargetIdentity, Path> locations = new LinkedHashMap<>();
    private final Map<String, List<TargetIdentity>> byCategory = new LinkedHashMap<>();
    private final Map<AuthorIdentity, AuthorEntry> byAuthor = new LinkedHashMap<>();
    private final List<CatalogWarning> warnings = new ArrayList<>();
    private int discardedDuplicates;

    public CatalogIndex() {
        byCategory.put(ALL_CATEGORY, new ArrayList<>());
    }

    /**
     * Insert a story unless its identity is already present.
     *
     * @return false if an earlier insertion already claimed the identity
     */
    public boolean insert(TargetIdentity identity, CanonicalMetadata metadata, String category) {
        return insert(identity, metadata, category, null);
    }

    /**
     * @param location directory the winning copy of the story is stored in, may be null
     */
    public boolean insert(TargetIdentity identity, CanonicalMetadata metadata, String category, Path location) {
        if (stories.containsKey(identity)) {
            discardedDuplicates++;
            return false;
        }
        stories.put(identity, metadata);
        if (location != null) {
            locations.put(identity, location);
        }
        byCategory.get(ALL_CATEGORY).add(identity);
        if (!ALL_CATEGORY.equals(category)) {
            byCategory.computeIfAbsent(category, c -> new ArrayList<>()).add(identity);
        }

        AuthorIdentity author = new AuthorIdentity(identity.getSource(), metadata.getAuthorId());
        byAuthor.computeIfAbsent(author, a -> new AuthorEntry(a, metadata.getAuthor(), metadata.getAuthorUrl(), metadata.getAuthorHtml()))
            .addStory(identity);
        return true;
    }

    public void addWarning(CatalogWarning warning) {
        warnings.add(warning);
    }

    public Map<TargetIdentity, CanonicalMetadata> getStories() {
        return Collections.unmodifiableMap(stories);
    }

    public CanonicalMetadata getStory(TargetIdentity identity) {
        return stories.get(identity);
    }

    /**
     * Directory holding the stored copy of a story, or null if unknown.
     */
    public Path getLocation(TargetIdentity identity) {
        return locations.get(identity);
    }

    public Map<String, List<TargetIdentity>> getByCategory() {
        return Collections.unmodifiableMap(byCategory);
    }

    public List<TargetIdentity> getCategory(String category) {
        List<TargetIdentity> ids = byCategory.get(category);
        return ids != null ? Collections.unmodifiableList(ids) : Collections.emptyList();
    }

    public Map<AuthorIdentity, AuthorEntry> getByAuthor() {
        return Collections.unmodifiableMap(byAuthor);
    }

    public AuthorEntry getAuthor(AuthorIdentity identity) {
        return byAuthor.get(identity);
    }

    public List<CatalogWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public int getDiscardedDuplicates() {
        return discardedDuplicates;
    }

    /**
     * Metadata of the given stories, in the given order.
     */
    public List<CanonicalMetadata> metadataOf(List<TargetIdentity> ids) {
        List<CanonicalMetadata> result = new ArrayList<>(ids.size());
        for (TargetIdentity id : ids) {
            CanonicalMetadata md = stories.get(id);
            if (md != null) {
                result.add(md);
            }
        }
        return result;
    }
}
