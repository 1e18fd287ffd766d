package com.ficshelf.convert;

import com.ficshelf.errors.MalformedSourceException;
import com.ficshelf.models.CanonicalMetadata;
import com.ficshelf.models.RawMetadata;
import com.ficshelf.target.TargetIdentity;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ficshelf.models.CanonicalMetadata.*;

/**
 * Dispatch table of the per-site converters, keyed by site abbreviation.
 * Unknown abbreviations get {@link #DEFAULT}, which reads every field under its
 * canonical name.
 */
public final class MetadataConverters {

    /**
     * Raw keys that are never carried over: output bookkeeping and per-chapter data.
     */
    static final Set<String> DROPPED_KEYS = Set.of("output_filename", "zchapters");

    static final String FORUM_STATUS = "Unknown";

    public static final MetadataConverter DEFAULT = MetadataConverters::convertDefault;

    private static final Map<String, MetadataConverter> CONVERTERS = Map.of(
        "ffnet", MetadataConverters::convertDefault,
        "fpcom", MetadataConverters::convertDefault,
        "ao3", MetadataConverters::convertAo3,
        "fsb", MetadataConverters::convertForum,
        "fsv", MetadataConverters::convertForum,
        "fqq", MetadataConverters::convertForum
    );

    private MetadataConverters() {
    }

    /**
     * Get the converter for the specified site, or the default converter.
     */
    public static MetadataConverter forSource(String abbrev) {
        if (abbrev == null) {
            return DEFAULT;
        }
        return CONVERTERS.getOrDefault(abbrev, DEFAULT);
    }

    public static boolean hasDedicatedConverter(String abbrev) {
        return abbrev != null && CONVERTERS.containsKey(abbrev);
    }

    /**
     * Convert with the converter registered for the origin's source, falling
     * back to the record's own site abbreviation when there is no origin.
     */
    public static CanonicalMetadata convert(RawMetadata raw, TargetIdentity origin) {
        String abbrev = origin != null ? origin.getSource() : null;
        if (abbrev == null && raw != null) {
            abbrev = raw.getString(SITE_ABBREV);
        }
        return forSource(abbrev).convert(raw, origin);
    }

    static CanonicalMetadata convertDefault(RawMetadata raw, TargetIdentity origin) {
        return common(raw, origin)
            .numWords(CountParser.parse(raw.get(NUM_WORDS)))
            .numChapters(CountParser.parse(raw.get(NUM_CHAPTERS)))
            .favs(CountParser.parse(raw.get(FAVS)))
            .follows(CountParser.parse(raw.get(FOLLOWS)))
            .reviews(CountParser.parse(raw.get(REVIEWS)))
            .build();
    }

    static CanonicalMetadata convertAo3(RawMetadata raw, TargetIdentity origin) {
        // ao3 has no favourites/follows; kudos and bookmarks are the closest equivalents
        return common(raw, origin)
            .numWords(CountParser.parse(raw.get(NUM_WORDS)))
            .numChapters(CountParser.parse(raw.get(NUM_CHAPTERS)))
            .favs(CountParser.parse(raw.get("kudos")))
            .follows(CountParser.parse(raw.get("bookmarks")))
            .reviews(CountParser.parse(raw.get("comments")))
            .build();
    }

    static CanonicalMetadata convertForum(RawMetadata raw, TargetIdentity origin) {
        CanonicalMetadata.Builder builder = common(raw, origin);
        Object chapters = raw.get("zchapters");
        long numWords = 0;
        int chapterCount = 0;
        if (chapters != null) {
            if (!(chapters instanceof List)) {
                throw new MalformedSourceException(subjectOf(raw, origin),
                    "Field 'zchapters' must be a list, got " + chapters.getClass().getSimpleName());
            }
            for (Object chapter : (List<?>) chapters) {
                chapterCount++;
                numWords += wordsOfChapter(chapter);
            }
        }
        int numChapters = CountParser.parse(raw.get(NUM_CHAPTERS));
        return builder
            .numWords((int) Math.min(numWords, Integer.MAX_VALUE))
            .numChapters(numChapters > 0 ? numChapters : chapterCount)
            .status(FORUM_STATUS)
            .build();
    }

    // a chapter entry is [title, {"kwords": "..."}]
    private static int wordsOfChapter(Object chapter) {
        if (!(chapter instanceof List) || ((List<?>) chapter).size() < 2) {
            return 0;
        }
        Object meta = ((List<?>) chapter).get(1);
        if (!(meta instanceof Map)) {
            return 0;
        }
        return CountParser.parse(((Map<?, ?>) meta).get("kwords"));
    }

    /**
     * Fields every converter handles the same way: identity, descriptive strings,
     * characters and ships, and the pass-through extras.
     */
    private static CanonicalMetadata.Builder common(RawMetadata raw, TargetIdentity origin) {
        if (raw == null) {
            throw new MalformedSourceException(origin != null ? origin.subpath() : "unknown", "No metadata record");
        }
        if (!raw.isScalarOrAbsent(STORY_ID)) {
            throw new MalformedSourceException(subjectOf(raw, origin), "Field 'storyId' is not a plain value");
        }

        String storyId = nonBlank(raw.getString(STORY_ID));
        if (storyId == null && origin != null) {
            storyId = origin.getId();
        }
        String abbrev = nonBlank(raw.getString(SITE_ABBREV));
        if (abbrev == null && origin != null) {
            abbrev = origin.getSource();
        }

        var characters = ShipParser.parseCharacters(raw.getString(CHARACTERS));
        var ships = ShipParser.parseShips(raw.getString(SHIPS), characters);

        CanonicalMetadata.Builder builder = CanonicalMetadata.builder()
            .storyId(storyId)
            .siteAbbrev(abbrev)
            .title(raw.getString(TITLE))
            .author(raw.getString(AUTHOR))
            .authorId(nonBlank(raw.getString(AUTHOR_ID)))
            .authorUrl(raw.getString(AUTHOR_URL))
            .authorHtml(raw.getString(AUTHOR_HTML))
            .category(nonBlank(raw.getString(CATEGORY)))
            .description(raw.getString(DESCRIPTION))
            .rating(raw.getString(RATING))
            .status(raw.getString(STATUS))
            .datePublished(raw.getString(DATE_PUBLISHED))
            .dateUpdated(raw.getString(DATE_UPDATED))
            .dateCreated(raw.getString(DATE_CREATED))
            .characters(characters)
            .ships(ships);

        for (Map.Entry<String, Object> entry : raw.asMap().entrySet()) {
            if (!DROPPED_KEYS.contains(entry.getKey())) {
                builder.extra(entry.getKey(), entry.getValue());
            }
        }
        return builder;
    }

    private static String subjectOf(RawMetadata raw, TargetIdentity origin) {
        if (origin != null) {
            return origin.subpath();
        }
        String abbrev = raw.getString(SITE_ABBREV, "unknown");
        return abbrev + "/" + raw.getString(STORY_ID, "?");
    }

    private static String nonBlank(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
