package com.ficshelf.collab;

import com.ficshelf.Project;
import com.ficshelf.errors.CollaboratorFailureException;
import com.ficshelf.models.CanonicalMetadata;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversion through calibre's {@code ebook-convert}.
 */
public class EbookConvertCollaborator implements BookConversionCollaborator {

    static final String EXECUTABLE = "ebook-convert";

    private final CommandRunner runner;

    public EbookConvertCollaborator() {
        this(new SystemCommandRunner());
    }

    public EbookConvertCollaborator(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public void convert(Path storyDir, CanonicalMetadata metadata, Path output) {
        List<String> command = buildCommand(storyDir, metadata, output);
        ProcessResult result;
        try {
            result = runner.run(command, storyDir);
        } catch (IOException e) {
            throw new CollaboratorFailureException(storyDir.toString(), "Could not run " + EXECUTABLE + ": " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new CollaboratorFailureException(storyDir.toString(),
                EXECUTABLE + " exited with code " + result.getExitCode() + ": " + result.lastErrorLine(),
                result.getExitCode());
        }
    }

    List<String> buildCommand(Path storyDir, CanonicalMetadata metadata, Path output) {
        List<String> args = new ArrayList<>();
        args.add(EXECUTABLE);
        args.add(storyDir.resolve(Project.STORY_FILE).toString());
        args.add(output.toAbsolutePath().toString());
        addOption(args, "--title", metadata.getTitle());
        addOption(args, "--authors", metadata.getAuthor());
        addOption(args, "--comments", metadata.getDescription());
        addOption(args, "--pubdate", metadata.getDatePublished());
        addOption(args, "--tags", metadata.getCategory());
        return args;
    }

    private static void addOption(List<String> args, String option, String value) {
        if (value != null && !value.isBlank()) {
            args.add(option);
            args.add(value);
        }
    }
}
