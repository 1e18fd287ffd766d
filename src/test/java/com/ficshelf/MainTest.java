package com.ficshelf;

import com.ficshelf.storage.JsonStorage;
import io.javalin.Javalin;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void createAppWiresControllersAgainstOpenProject() throws IOException {
        Project project = Project.init(tempDir.resolve("shelf"));
        ProjectContext context = new ProjectContext(project.getRoot(), new FakeRetrieval(),
            (storyDir, metadata, output) -> { }, request -> { });

        Javalin app = Main.createApp(context, JsonStorage.mapper());

        assertNotNull(app);
        assertEquals(project.getRoot(), context.project().getRoot());
    }
}
