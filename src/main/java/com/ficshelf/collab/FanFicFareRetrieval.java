package com.ficshelf.collab;

import com.ficshelf.errors.CollaboratorFailureException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Retrieval through the {@code fanficfare} command line tool, writing HTML
 * output and printing the story metadata as JSON on stdout.
 */
public class FanFicFareRetrieval implements RetrievalCollaborator {

    static final String EXECUTABLE = "fanficfare";

    private final CommandRunner runner;
    private final String executable;

    public FanFicFareRetrieval() {
        this(new SystemCommandRunner(), EXECUTABLE);
    }

    public FanFicFareRetrieval(CommandRunner runner, String executable) {
        this.runner = runner;
        this.executable = executable != null && !executable.isBlank() ? executable : EXECUTABLE;
    }

    @Override
    public RetrievalResult retrieve(RetrievalRequest request) {
        List<String> command = buildCommand(request);
        ProcessResult result;
        try {
            result = runner.run(command, null);
        } catch (IOException e) {
            throw new CollaboratorFailureException(request.getUrl(), "Could not run " + executable + ": " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new CollaboratorFailureException(request.getUrl(),
                executable + " exited with code " + result.getExitCode() + ": " + result.lastErrorLine(),
                result.getExitCode());
        }
        return new RetrievalResult(result.getStdout());
    }

    List<String> buildCommand(RetrievalRequest request) {
        List<String> args = new ArrayList<>();
        args.add(executable);
        args.add("-f");
        args.add("html");
        args.add("-j");
        args.add("--non-interactive");
        args.add("-o");
        args.add("is_adult=true");
        args.add("-o");
        args.add("output_filename=" + request.getOutputTemplate());
        if (request.isIncludeImages()) {
            args.add("-o");
            args.add("include_images=true");
            args.add("-o");
            args.add("skip_author_cover=false");
        }
        args.add(request.getUrl());
        return args;
    }
}
