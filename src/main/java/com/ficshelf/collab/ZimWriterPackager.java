package com.ficshelf.collab;

import com.ficshelf.errors.CollaboratorFailureException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Packaging through {@code zimwriterfs}.
 */
public class ZimWriterPackager implements ArchivePackager {

    static final String EXECUTABLE = "zimwriterfs";

    private final CommandRunner runner;

    public ZimWriterPackager() {
        this(new SystemCommandRunner());
    }

    public ZimWriterPackager(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public void pack(PackageRequest request) {
        String subject = request.getOutput().toString();
        ProcessResult result;
        try {
            result = runner.run(buildCommand(request), null);
        } catch (IOException e) {
            throw new CollaboratorFailureException(subject, "Could not run " + EXECUTABLE + ": " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new CollaboratorFailureException(subject,
                EXECUTABLE + " exited with code " + result.getExitCode() + ": " + result.lastErrorLine(),
                result.getExitCode());
        }
    }

    List<String> buildCommand(PackageRequest request) {
        PackageOptions options = request.getOptions();
        List<String> args = new ArrayList<>();
        args.add(EXECUTABLE);
        args.add("-w");
        args.add(PackageRequest.WELCOME_PAGE);
        args.add("-f");
        args.add(PackageRequest.FAVICON);
        args.add("-l");
        args.add(options.getLanguage());
        args.add("-t");
        args.add(options.getTitle());
        args.add("-d");
        args.add(options.getDescription());
        args.add("-c");
        args.add(options.getCreator());
        args.add("-p");
        args.add(options.getPublisher());
        args.add("-i");
        args.add(request.getContentDirectory().toAbsolutePath().toString());
        args.add(request.getOutput().toAbsolutePath().toString());
        return args;
    }
}
