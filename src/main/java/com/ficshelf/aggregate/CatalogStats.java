package com.ficshelf.aggregate;

import com.ficshelf.models.CanonicalMetadata;
import com.ficshelf.models.CatalogIndex;
import com.ficshelf.target.TargetIdentity;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Totals and ratios over a catalog, for the archive's statistics page.
 */
public final class CatalogStats {

    static final double NOVEL_WORDS_LONG = 90_000.0;
    static final double NOVEL_WORDS_SHORT = 60_000.0;
    static final double BIBLE_WORDS = 789_650.0;

    private final int sources;
    private final int categories;
    private final int authors;
    private final int stories;
    private final long chapters;
    private final long words;

    private CatalogStats(int sources, int categories, int authors, int stories, long chapters, long words) {
        this.sources = sources;
        this.categories = categories;
        this.authors = authors;
        this.stories = stories;
        this.chapters = chapters;
        this.words = words;
    }

    /**
     * The synthetic {@code ALL} category is not counted.
     */
    public static CatalogStats of(CatalogIndex index) {
        Set<String> sources = new HashSet<>();
        long chapters = 0;
        long words = 0;
        for (Map.Entry<TargetIdentity, CanonicalMetadata> entry : index.getStories().entrySet()) {
            sources.add(entry.getKey().getSource());
            chapters += entry.getValue().getNumChapters();
            words += entry.getValue().getNumWords();
        }
        int categories = 0;
        for (String category : index.getByCategory().keySet()) {
            if (!CatalogIndex.ALL_CATEGORY.equals(category)) {
                categories++;
            }
        }
        return new CatalogStats(sources.size(), categories, index.getByAuthor().size(),
            index.getStories().size(), chapters, words);
    }

    public int getSources() {
        return sources;
    }

    public int getCategories() {
        return categories;
    }

    public int getAuthors() {
        return authors;
    }

    public int getStories() {
        return stories;
    }

    public long getChapters() {
        return chapters;
    }

    public long getWords() {
        return words;
    }

    public double getStoriesPerCategory() {
        return ratio(stories, categories);
    }

    public double getStoriesPerAuthor() {
        return ratio(stories, authors);
    }

    public double getChaptersPerStory() {
        return ratio(chapters, stories);
    }

    public double getWordsPerChapter() {
        return ratio(words, chapters);
    }

    /**
     * Word count expressed in novels of 90,000 words.
     */
    public double getNovelsLowerBound() {
        return words / NOVEL_WORDS_LONG;
    }

    /**
     * Word count expressed in novels of 60,000 words.
     */
    public double getNovelsUpperBound() {
        return words / NOVEL_WORDS_SHORT;
    }

    public double getBibles() {
        return words / BIBLE_WORDS;
    }

    private static double ratio(double numerator, double denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }
}
