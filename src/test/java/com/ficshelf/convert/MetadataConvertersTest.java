package com.ficshelf.convert;

import com.ficshelf.errors.MalformedSourceException;
import com.ficshelf.models.CanonicalMetadata;
import com.ficshelf.models.RawMetadata;
import com.ficshelf.target.TargetIdentity;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetadataConvertersTest {

    private static final TargetIdentity FFNET_42 = new TargetIdentity("ffnet", "42");

    private static Map<String, Object> ffnetRecord() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("storyId", "42");
        raw.put("siteabbrev", "ffnet");
        raw.put("title", "The Answer");
        raw.put("author", "Deep Thought");
        raw.put("authorId", "1001");
        raw.put("category", "Hitchhiker's Guide");
        raw.put("numWords", "12,345");
        raw.put("numChapters", "7");
        raw.put("favs", "1.2k");
        raw.put("follows", "(300)");
        raw.put("reviews", "");
        raw.put("characters", "Arthur D., Ford P., Zaphod/Trillian");
        raw.put("ships", "Arthur D./Zaphod/Trillian");
        raw.put("language", "English");
        raw.put("output_filename", "/tmp/x/story.html");
        return raw;
    }

    @Test
    void defaultConverterNormalizesCountsAndKeepsExtras() {
        CanonicalMetadata md = MetadataConverters.convert(new RawMetadata(ffnetRecord()), FFNET_42);

        assertEquals("42", md.getStoryId());
        assertEquals("ffnet", md.getSiteAbbrev());
        assertEquals("The Answer", md.getTitle());
        assertEquals("1001", md.getAuthorId());
        assertEquals(12345, md.getNumWords());
        assertEquals(7, md.getNumChapters());
        assertEquals(1200, md.getFavs());
        assertEquals(300, md.getFollows());
        assertEquals(0, md.getReviews());
        assertEquals(List.of("Arthur D.", "Ford P.", "Zaphod/Trillian"), List.copyOf(md.getCharacters()));
        assertEquals(List.of(List.of("Arthur D.", "Zaphod/Trillian")), md.getShips());
        assertEquals("English", md.getExtras().get("language"));
        assertFalse(md.getExtras().containsKey("output_filename"));
        assertFalse(md.getExtras().containsKey("title"));
    }

    @Test
    void conversionNeverMutatesTheRawRecord() {
        Map<String, Object> source = ffnetRecord();
        RawMetadata raw = new RawMetadata(source);
        Map<String, Object> before = new LinkedHashMap<>(raw.asMap());

        MetadataConverters.convert(raw, FFNET_42);

        assertEquals(before, raw.asMap());
        assertEquals("12,345", source.get("numWords"));
    }

    @Test
    void archiveOfOurOwnMapsKudosBookmarksAndComments() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("storyId", "99");
        raw.put("kudos", "2,000");
        raw.put("bookmarks", "150");
        raw.put("comments", "45");
        raw.put("favs", "999");

        CanonicalMetadata md = MetadataConverters.convert(new RawMetadata(raw), new TargetIdentity("ao3", "99"));

        assertEquals(2000, md.getFavs());
        assertEquals(150, md.getFollows());
        assertEquals(45, md.getReviews());
        assertEquals("ao3", md.getSiteAbbrev());
    }

    @Test
    void forumConverterSumsChapterWords() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("storyId", "31337");
        raw.put("status", "In-Progress");
        raw.put("zchapters", List.of(
            List.of("Chapter 1", Map.of("kwords", "1.5k")),
            List.of("Chapter 2", Map.of("kwords", "500")),
            List.of("Broken")));

        CanonicalMetadata md = MetadataConverters.convert(new RawMetadata(raw), new TargetIdentity("fsb", "31337"));

        assertEquals(2000, md.getNumWords());
        assertEquals(3, md.getNumChapters());
        assertEquals("Unknown", md.getStatus());
        assertFalse(md.getExtras().containsKey("zchapters"));
    }

    @Test
    void forumWordTotalStopsAtIntegerMaximum() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("storyId", "5");
        raw.put("zchapters", List.of(
            List.of("Chapter 1", Map.of("kwords", "2000m")),
            List.of("Chapter 2", Map.of("kwords", "2000m"))));

        CanonicalMetadata md = MetadataConverters.convert(new RawMetadata(raw), new TargetIdentity("fsb", "5"));

        assertEquals(Integer.MAX_VALUE, md.getNumWords());
    }

    @Test
    void forumChaptersMustBeAList() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("storyId", "1");
        raw.put("zchapters", "twelve");
        assertThrows(MalformedSourceException.class,
            () -> MetadataConverters.convert(new RawMetadata(raw), new TargetIdentity("fsv", "1")));
    }

    @Test
    void structuredStoryIdIsMalformed() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("storyId", List.of("1", "2"));
        assertThrows(MalformedSourceException.class, () -> MetadataConverters.convert(new RawMetadata(raw), FFNET_42));
        assertThrows(MalformedSourceException.class, () -> MetadataConverters.convert(null, FFNET_42));
    }

    @Test
    void missingIdsFallBackToOriginOrUnknown() {
        CanonicalMetadata fromOrigin = MetadataConverters.convert(RawMetadata.empty(), FFNET_42);
        assertEquals("42", fromOrigin.getStoryId());
        assertEquals("ffnet", fromOrigin.getSiteAbbrev());
        assertEquals(CanonicalMetadata.UNKNOWN, fromOrigin.getAuthorId());
        assertEquals(0, fromOrigin.getNumWords());
        assertTrue(fromOrigin.getCharacters().isEmpty());
        assertNull(fromOrigin.getCategory());

        CanonicalMetadata orphan = MetadataConverters.DEFAULT.convert(RawMetadata.empty());
        assertEquals(CanonicalMetadata.UNKNOWN, orphan.getStoryId());
    }

    @Test
    void unknownSourcesUseDefaultConverter() {
        assertSame(MetadataConverters.DEFAULT, MetadataConverters.forSource("unknown"));
        assertSame(MetadataConverters.DEFAULT, MetadataConverters.forSource(null));
        assertTrue(MetadataConverters.hasDedicatedConverter("ao3"));
        assertFalse(MetadataConverters.hasDedicatedConverter("unknown"));

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("siteabbrev", "ao3");
        raw.put("kudos", "10");
        CanonicalMetadata md = MetadataConverters.convert(new RawMetadata(raw), null);
        assertEquals(10, md.getFavs());
    }

    @Test
    void withCategoryLeavesOriginalUntouched() {
        CanonicalMetadata md = MetadataConverters.convert(new RawMetadata(ffnetRecord()), FFNET_42);
        CanonicalMetadata moved = md.withCategory("H2G2");
        assertEquals("Hitchhiker's Guide", md.getCategory());
        assertEquals("H2G2", moved.getCategory());
        assertEquals(md.getNumWords(), moved.getNumWords());
    }
}
