package com.ficshelf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CategoryAliasTableTest {

    @TempDir
    Path root;

    @Test
    void resolveTakesExactlyOneHop() throws IOException {
        CategoryAliasTable.writeEmpty(root);
        CategoryAliasTable table = CategoryAliasTable.load(root);
        table.addAlias("A", "B");
        table.addAlias("B", "C");

        assertEquals("B", table.resolve("A"));
        assertEquals("C", table.resolve("B"));
        assertEquals("Z", table.resolve("Z"));
        assertNull(table.resolve(null));
    }

    @Test
    void aliasesArePersistedImmediately() throws IOException {
        CategoryAliasTable.writeEmpty(root);
        CategoryAliasTable.load(root).addAlias("Harry Potter", "HP");

        CategoryAliasTable reloaded = CategoryAliasTable.load(root);
        assertEquals(Map.of("Harry Potter", "HP"), reloaded.asMap());
    }

    @Test
    void addAliasOverwritesExistingRule() throws IOException {
        CategoryAliasTable table = CategoryAliasTable.load(root);
        table.addAlias("X", "Y");
        table.addAlias("X", "Z");
        assertEquals("Z", table.resolve("X"));
        assertEquals("Z", CategoryAliasTable.load(root).resolve("X"));
    }

    @Test
    void blankNamesAreRejected() throws IOException {
        CategoryAliasTable table = CategoryAliasTable.load(root);
        assertThrows(IllegalArgumentException.class, () -> table.addAlias(" ", "B"));
        assertThrows(IllegalArgumentException.class, () -> table.addAlias("A", null));
        assertFalse(Files.exists(root.resolve(CategoryAliasTable.FILE_NAME)));
    }

    @Test
    void nonTextTargetsAreIgnoredOnLoad() throws IOException {
        Files.writeString(root.resolve(CategoryAliasTable.FILE_NAME), "{\"A\": \"B\", \"C\": 3}");
        CategoryAliasTable table = CategoryAliasTable.load(root);
        assertEquals(Map.of("A", "B"), table.asMap());
        assertThrows(UnsupportedOperationException.class, () -> table.asMap().put("D", "E"));
    }
}
