package com.ficshelf.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalized description of one story. Instances are immutable; use
 * {@link #toBuilder()} or {@link #withCategory(String)} to derive changed copies.
 *
 * <p>Serialized with the same key names the retrieval tool uses, so exported
 * JSON reads like the stored metadata with counts turned into numbers and
 * characters/ships split into lists.</p>
 */
public final class CanonicalMetadata {

    public static final String UNKNOWN = "???";

    public static final String STORY_ID = "storyId";
    public static final String SITE_ABBREV = "siteabbrev";
    public static final String TITLE = "title";
    public static final String AUTHOR = "author";
    public static final String AUTHOR_ID = "authorId";
    public static final String AUTHOR_URL = "authorUrl";
    public static final String AUTHOR_HTML = "authorHTML";
    public static final String CATEGORY = "category";
    public static final String DESCRIPTION = "description";
    public static final String RATING = "rating";
    public static final String STATUS = "status";
    public static final String DATE_PUBLISHED = "datePublished";
    public static final String DATE_UPDATED = "dateUpdated";
    public static final String DATE_CREATED = "dateCreated";
    public static final String NUM_WORDS = "numWords";
    public static final String NUM_CHAPTERS = "numChapters";
    public static final String FAVS = "favs";
    public static final String FOLLOWS = "follows";
    public static final String REVIEWS = "reviews";
    public static final String CHARACTERS = "characters";
    public static final String SHIPS = "ships";

    /**
     * Every key with a dedicated field; anything else in the raw record is carried as an extra.
     */
    public static final Set<String> CANONICAL_KEYS = Set.of(
        STORY_ID, SITE_ABBREV, TITLE, AUTHOR, AUTHOR_ID, AUTHOR_URL, AUTHOR_HTML, CATEGORY,
        DESCRIPTION, RATING, STATUS, DATE_PUBLISHED, DATE_UPDATED, DATE_CREATED,
        NUM_WORDS, NUM_CHAPTERS, FAVS, FOLLOWS, REVIEWS, CHARACTERS, SHIPS
    );

    private final String storyId;
    private final String siteAbbrev;
    private final String title;
    private final String author;
    private final String authorId;
    private final String authorUrl;
    private final String authorHtml;
    private final String category;
    private final String description;
    private final String rating;
    private final String status;
    private final String datePublished;
    private final String dateUpdated;
    private final String dateCreated;
    private final int numWords;
    private final int numChapters;
    private final int favs;
    private final int follows;
    private final int reviews;
    private final Set<String> characters;
    private final List<List<String>> ships;
    private final Map<String, Object> extras;

    private CanonicalMetadata(Builder b) {
        this.storyId = b.storyId != null ? b.storyId : UNKNOWN;
        this.siteAbbrev = b.siteAbbrev;
        this.title = b.title;
        this.author = b.author;
        this.authorId = b.authorId != null ? b.authorId : UNKNOWN;
        this.authorUrl = b.authorUrl;
        this.authorHtml = b.authorHtml;
        this.category = b.category;
        this.description = b.description;
        this.rating = b.rating;
        this.status = b.status;
        this.datePublished = b.datePublished;
        this.dateUpdated = b.dateUpdated;
        this.dateCreated = b.dateCreated;
        this.numWords = Math.max(0, b.numWords);
        this.numChapters = Math.max(0, b.numChapters);
        this.favs = Math.max(0, b.favs);
        this.follows = Math.max(0, b.follows);
        this.reviews = Math.max(0, b.reviews);
        this.characters = Collections.unmodifiableSet(new LinkedHashSet<>(b.characters));
        List<List<String>> shipCopies = new ArrayList<>();
        for (List<String> ship : b.ships) {
            shipCopies.add(Collections.unmodifiableList(new ArrayList<>(ship)));
        }
        this.ships = Collections.unmodifiableList(shipCopies);
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(b.extras));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.storyId = storyId;
        b.siteAbbrev = siteAbbrev;
        b.title = title;
        b.author = author;
        b.authorId = authorId;
        b.authorUrl = authorUrl;
        b.authorHtml = authorHtml;
        b.category = category;
        b.description = description;
        b.rating = rating;
        b.status = status;
        b.datePublished = datePublished;
        b.dateUpdated = dateUpdated;
        b.dateCreated = dateCreated;
        b.numWords = numWords;
        b.numChapters = numChapters;
        b.favs = favs;
        b.follows = follows;
        b.reviews = reviews;
        b.characters = new LinkedHashSet<>(characters);
        b.ships = new ArrayList<>(ships);
        b.extras = new LinkedHashMap<>(extras);
        return b;
    }

    public CanonicalMetadata withCategory(String newCategory) {
        return toBuilder().category(newCategory).build();
    }

    public String getStoryId() {
        return storyId;
    }

    @JsonProperty(SITE_ABBREV)
    public String getSiteAbbrev() {
        return siteAbbrev;
    }

    public String getTitle() {
        return title;
    }

    public String getAuthor() {
        return author;
    }

    public String getAuthorId() {
        return authorId;
    }

    public String getAuthorUrl() {
        return authorUrl;
    }

    @JsonProperty(AUTHOR_HTML)
    public String getAuthorHtml() {
        return authorHtml;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public String getRating() {
        return rating;
    }

    public String getStatus() {
        return status;
    }

    public String getDatePublished() {
        return datePublished;
    }

    public String getDateUpdated() {
        return dateUpdated;
    }

    public String getDateCreated() {
        return dateCreated;
    }

    public int getNumWords() {
        return numWords;
    }

    public int getNumChapters() {
        return numChapters;
    }

    public int getFavs() {
        return favs;
    }

    public int getFollows() {
        return follows;
    }

    public int getReviews() {
        return reviews;
    }

    public Set<String> getCharacters() {
        return characters;
    }

    public List<List<String>> getShips() {
        return ships;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @Override
    public String toString() {
        return "CanonicalMetadata{" +
            "siteabbrev='" + siteAbbrev + '\'' +
            ", storyId='" + storyId + '\'' +
            ", title='" + title + '\'' +
            ", category='" + category + '\'' +
            ", authorId='" + authorId + '\'' +
            '}';
    }

    public static class Builder {
        private String storyId;
        private String siteAbbrev;
        private String title;
        private String author;
        private String authorId;
        private String authorUrl;
        private String authorHtml;
        private String category;
        private String description;
        private String rating;
        private String status;
        private String datePublished;
        private String dateUpdated;
        private String dateCreated;
        private int numWords;
        private int numChapters;
        private int favs;
        private int follows;
        private int reviews;
        private Set<String> characters = new LinkedHashSet<>();
        private List<List<String>> ships = new ArrayList<>();
        private Map<String, Object> extras = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder storyId(String storyId) {
            this.storyId = storyId;
            return this;
        }

        public Builder siteAbbrev(String siteAbbrev) {
            this.siteAbbrev = siteAbbrev;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder authorId(String authorId) {
            this.authorId = authorId;
            return this;
        }

        public Builder authorUrl(String authorUrl) {
            this.authorUrl = authorUrl;
            return this;
        }

        public Builder authorHtml(String authorHtml) {
            this.authorHtml = authorHtml;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder rating(String rating) {
            this.rating = rating;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder datePublished(String datePublished) {
            this.datePublished = datePublished;
            return this;
        }

        public Builder dateUpdated(String dateUpdated) {
            this.dateUpdated = dateUpdated;
            return this;
        }

        public Builder dateCreated(String dateCreated) {
            this.dateCreated = dateCreated;
            return this;
        }

        public Builder numWords(int numWords) {
            this.numWords = numWords;
            return this;
        }

        public Builder numChapters(int numChapters) {
            this.numChapters = numChapters;
            return this;
        }

        public Builder favs(int favs) {
            this.favs = favs;
            return this;
        }

        public Builder follows(int follows) {
            this.follows = follows;
            return this;
        }

        public Builder reviews(int reviews) {
            this.reviews = reviews;
            return this;
        }

        public Builder characters(Set<String> characters) {
            this.characters = characters != null ? new LinkedHashSet<>(characters) : new LinkedHashSet<>();
            return this;
        }

        public Builder ships(List<List<String>> ships) {
            this.ships = ships != null ? new ArrayList<>(ships) : new ArrayList<>();
            return this;
        }

        public Builder extra(String key, Object value) {
            if (key != null && !CANONICAL_KEYS.contains(key)) {
                this.extras.put(key, value);
            }
            return this;
        }

        public CanonicalMetadata build() {
            return new CanonicalMetadata(this);
        }
    }
}
