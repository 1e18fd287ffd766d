package com.ficshelf.collab;

import com.ficshelf.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Stdout is captured in
 * memory; stderr goes to a temporary file so a chatty tool cannot block on a
 * full pipe while we read stdout.
 */
public class SystemCommandRunner implements CommandRunner {

    @Override
    public ProcessResult run(List<String> command, Path workingDir) throws IOException {
        Path stderrFile = Files.createTempFile("ficshelf-", ".stderr");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            if (workingDir != null) {
                pb.directory(workingDir.toFile());
            }
            pb.redirectError(stderrFile.toFile());
            log("Running: " + String.join(" ", command));

            Process process = pb.start();
            String stdout;
            try (InputStream in = process.getInputStream()) {
                stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for " + command.get(0), e);
            }
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
            return new ProcessResult(exitCode, stdout, stderr);
        } finally {
            Files.deleteIfExists(stderrFile);
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[SystemCommandRunner] " + message);
        }
    }
}
