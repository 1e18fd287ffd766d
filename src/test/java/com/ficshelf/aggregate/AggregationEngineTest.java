package com.ficshelf.aggregate;

import com.ficshelf.Project;
import com.ficshelf.ProjectFixtures;
import com.ficshelf.models.AuthorEntry;
import com.ficshelf.models.AuthorIdentity;
import com.ficshelf.models.CatalogIndex;
import com.ficshelf.target.TargetIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AggregationEngineTest {

    private static final TargetIdentity FFNET_42 = new TargetIdentity("ffnet", "42");

    @TempDir
    Path tempDir;

    private final AggregationEngine engine = new AggregationEngine();

    @Test
    void rootCopyWinsOverSubprojectCopy() throws IOException {
        Project root = Project.init(tempDir.resolve("root"));
        Project sub = Project.init(root.getRoot().resolve("sub"));
        root.addSubproject("sub");
        ProjectFixtures.storeStory(root, "ffnet", "42", "Root Version", "Cat");
        ProjectFixtures.storeStory(sub, "ffnet", "42", "Sub Version", "Other");
        ProjectFixtures.storeStory(sub, "ao3", "7", "Only In Sub", "Other");

        CatalogIndex index = engine.aggregate(root, true);

        assertEquals(2, index.getStories().size());
        assertEquals("Root Version", index.getStory(FFNET_42).getTitle());
        assertEquals(root.targetDirectory(FFNET_42), index.getLocation(FFNET_42));
        assertEquals(1, index.getDiscardedDuplicates());
        assertEquals(List.of(FFNET_42), index.getCategory("Cat"));
        assertEquals(List.of(new TargetIdentity("ao3", "7")), index.getCategory("Other"));
    }

    @Test
    void oversizedCountInOneStoryDoesNotStopAggregation() throws IOException {
        Project root = Project.init(tempDir.resolve("root"));
        ProjectFixtures.storeStory(root, "ffnet", "1", "Good", "Cat");
        Path huge = root.targetDirectory(new TargetIdentity("ffnet", "2"));
        Files.createDirectories(huge);
        Files.writeString(huge.resolve(Project.METADATA_FILE),
            "{\"storyId\":\"2\",\"siteabbrev\":\"ffnet\",\"numWords\":1e400}");

        CatalogIndex index = engine.aggregate(root, true);

        assertEquals(2, index.getStories().size());
        assertEquals(1000, index.getStory(new TargetIdentity("ffnet", "1")).getNumWords());
        assertEquals(Integer.MAX_VALUE, index.getStory(new TargetIdentity("ffnet", "2")).getNumWords());
        assertTrue(index.getWarnings().isEmpty());
    }

    @Test
    void subprojectsCanBeLeftOut() throws IOException {
        Project root = Project.init(tempDir.resolve("root"));
        Project sub = Project.init(root.getRoot().resolve("sub"));
        root.addSubproject("sub");
        ProjectFixtures.storeStory(sub, "ao3", "7", "Only In Sub", "Other");

        assertTrue(engine.aggregate(root, false).getStories().isEmpty());
        assertEquals(1, engine.aggregate(root, true).getStories().size());
    }

    @Test
    void everyStoryIsOnceInAllAndOnceInItsCategory() throws IOException {
        Project root = Project.init(tempDir.resolve("root"));
        ProjectFixtures.storeStory(root, "ffnet", "1", "One", "Alpha");
        ProjectFixtures.storeStory(root, "ffnet", "2", "Two", "Beta");
        ProjectFixtures.storeStory(root, "ffnet", "3", "Three", "Alpha");
        ProjectFixtures.storeStory(root, "ffnet", "4", "Four", null);
        ProjectFixtures.storeStory(root, "ffnet", "5", "Five", CatalogIndex.ALL_CATEGORY);

        CatalogIndex index = engine.aggregate(root, true);

        List<TargetIdentity> all = index.getCategory(CatalogIndex.ALL_CATEGORY);
        assertEquals(5, all.size());
        assertEquals(5, Set.copyOf(all).size());
        for (TargetIdentity id : index.getStories().keySet()) {
            String category = index.getStory(id).getCategory();
            long inCategory = index.getCategory(category).stream().filter(id::equals).count();
            assertEquals(1, inCategory, id.toString());
        }
        assertEquals(2, index.getCategory("Alpha").size());
        assertEquals(1, index.getCategory(Project.UNCATEGORIZED).size());
    }

    @Test
    void aliasesApplyOnlyWithinTheirOwnProject() throws IOException {
        Project root = Project.init(tempDir.resolve("root"));
        Project sub = Project.init(root.getRoot().resolve("sub"));
        root.addSubproject("sub");
        root.addCategoryAlias("Harry Potter", "HP");
        ProjectFixtures.storeStory(root, "ffnet", "1", "Root HP", "Harry Potter");
        ProjectFixtures.storeStory(sub, "ffnet", "2", "Sub HP", "Harry Potter");

        CatalogIndex index = engine.aggregate(root, true);

        assertEquals(List.of(new TargetIdentity("ffnet", "1")), index.getCategory("HP"));
        assertEquals(List.of(new TargetIdentity("ffnet", "2")), index.getCategory("Harry Potter"));
    }

    @Test
    void brokenStoriesBecomeWarnings() throws IOException {
        Project root = Project.init(tempDir.resolve("root"));
        ProjectFixtures.storeStory(root, "ffnet", "1", "Fine", "Cat");
        Path noMetadata = root.targetDirectory(new TargetIdentity("ffnet", "2"));
        Files.createDirectories(noMetadata);
        Path garbled = root.targetDirectory(new TargetIdentity("ffnet", "3"));
        Files.createDirectories(garbled);
        Files.writeString(garbled.resolve(Project.METADATA_FILE), "{not json");

        CatalogIndex index = engine.aggregate(root, true);

        assertEquals(1, index.getStories().size());
        assertEquals(2, index.getWarnings().size());
        assertEquals(noMetadata.toString(), index.getWarnings().get(0).getSubject());
    }

    @Test
    void authorsAreKeyedBySourceAndAuthorId() throws IOException {
        Project root = Project.init(tempDir.resolve("root"));
        ProjectFixtures.storeStory(root, "ffnet", "1", ProjectFixtures.metadata("ffnet", "1", "One", "Cat", "9"));
        ProjectFixtures.storeStory(root, "ffnet", "2", ProjectFixtures.metadata("ffnet", "2", "Two", "Cat", "9"));
        ProjectFixtures.storeStory(root, "ao3", "3", ProjectFixtures.metadata("ao3", "3", "Three", "Cat", "9"));

        CatalogIndex index = engine.aggregate(root, true);

        Map<AuthorIdentity, AuthorEntry> authors = index.getByAuthor();
        assertEquals(2, authors.size());
        AuthorEntry ffnetAuthor = index.getAuthor(new AuthorIdentity("ffnet", "9"));
        assertEquals("Author 9", ffnetAuthor.getName());
        assertEquals(List.of(new TargetIdentity("ffnet", "1"), new TargetIdentity("ffnet", "2")), ffnetAuthor.getStories());
        assertEquals(1, index.getAuthor(new AuthorIdentity("ao3", "9")).getStories().size());
    }
}
