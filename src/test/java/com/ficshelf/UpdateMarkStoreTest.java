package com.ficshelf;

import com.ficshelf.storage.JsonStorage;
import com.ficshelf.target.TargetResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpdateMarkStoreTest {

    @TempDir
    Path root;

    @Test
    void marksAreStoredAsUrlArray() throws IOException {
        UpdateMarkStore store = new UpdateMarkStore(root);
        store.mark(TargetResolver.resolve("https://archiveofourown.org/works/8/chapters/2"), true);
        store.mark(TargetResolver.resolve("5"), true);

        List<String> stored = JsonStorage.readJsonList(root.resolve(UpdateMarkStore.FILE_NAME), String[].class);
        assertEquals(List.of("https://archiveofourown.org/works/8", "https://www.fanfiction.net/s/5/1/"), stored);
    }

    @Test
    void repeatedCallsDoNotRewrite() throws IOException {
        UpdateMarkStore store = new UpdateMarkStore(root);
        assertFalse(store.mark(TargetResolver.resolve("5"), false));
        assertFalse(Files.exists(root.resolve(UpdateMarkStore.FILE_NAME)));

        assertTrue(store.mark(TargetResolver.resolve("5"), true));
        assertFalse(store.mark(TargetResolver.resolve("https://m.fanfiction.net/s/5/"), true));
        assertTrue(store.isMarked(TargetResolver.resolve("5")));
    }

    @Test
    void invalidStoredEntriesAreSkipped() throws IOException {
        Files.writeString(root.resolve(UpdateMarkStore.FILE_NAME), "[\"nonsense\", \"7\", \"https://www.fanfiction.net/s/7/1/\"]");
        UpdateMarkStore store = new UpdateMarkStore(root);
        assertEquals(1, store.list().size());
        assertEquals("7", store.list().get(0).getId());
    }
}
