package com.ficshelf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesProjectAndFlags() throws IOException {
        AppConfig config = new AppConfig.Builder()
            .logPath(tempDir.resolve("test.log"))
            .parseArgs(new String[] {"--project", tempDir.resolve("shelf").toString(), "--dev", "--init",
                "--fanficfare=/opt/fanficfare"})
            .build();

        assertEquals(tempDir.resolve("shelf").toAbsolutePath().normalize(), config.getProjectPath());
        assertTrue(config.isDevMode());
        assertTrue(config.isInitProject());
        assertEquals("/opt/fanficfare", config.getFanficfareCommand());
        assertEquals(tempDir.resolve("test.log"), config.getLogPath());
    }

    @Test
    void rejectsUnknownArgumentsAndBadPorts() {
        assertThrows(IllegalArgumentException.class, () -> new AppConfig.Builder().parseArgs(new String[] {"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> new AppConfig.Builder().parseArgs(new String[] {"--port=abc"}));
    }
}
