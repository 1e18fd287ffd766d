package com.ficshelf.collab;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external command to completion. Split out so the collaborators can
 * be exercised without the real tools installed.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @param command    program and arguments
     * @param workingDir working directory, or null for the current one
     * @throws IOException if the process cannot be started or its output read
     */
    ProcessResult run(List<String> command, Path workingDir) throws IOException;
}
