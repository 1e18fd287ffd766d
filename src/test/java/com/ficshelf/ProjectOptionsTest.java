package com.ficshelf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProjectOptionsTest {

    @TempDir
    Path root;

    @Test
    void setKeepsOtherOptionsOfTheCategory() throws IOException {
        ProjectOptions.writeDefaults(root);
        ProjectOptions options = new ProjectOptions(root);
        options.set("build", "title", "Shelf");
        options.set("build", "language", "DE");

        assertEquals("Shelf", options.getString("build", "title", null));
        assertEquals("DE", options.getString("build", "language", null));
        assertEquals(Map.of("title", "Shelf", "language", "DE"), options.get("build", null, null));
        assertEquals("0.2", options.getVersion());
    }

    @Test
    void booleansAcceptTextForms() throws IOException {
        ProjectOptions.writeDefaults(root);
        ProjectOptions options = new ProjectOptions(root);
        assertTrue(options.getBoolean("download", "include_images", true));
        options.set("download", "include_images", "no");
        assertFalse(options.getBoolean("download", "include_images", true));
        options.set("download", "include_images", "yes");
        assertTrue(options.getBoolean("download", "include_images", false));
    }

    @Test
    void categoryIsRequired() throws IOException {
        ProjectOptions.writeDefaults(root);
        assertThrows(IllegalArgumentException.class, () -> new ProjectOptions(root).set(" ", "a", 1));
    }
}
