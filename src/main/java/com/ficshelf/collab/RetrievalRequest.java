package com.ficshelf.collab;

import com.ficshelf.target.Target;

import java.nio.file.Path;

/**
 * Everything the retrieval tool needs to fetch one story.
 */
public final class RetrievalRequest {

    private final Target target;
    private final Path targetDirectory;
    private final String outputTemplate;
    private final boolean includeImages;

    public RetrievalRequest(Target target, Path targetDirectory, String outputTemplate, boolean includeImages) {
        this.target = target;
        this.targetDirectory = targetDirectory;
        this.outputTemplate = outputTemplate;
        this.includeImages = includeImages;
    }

    public Target getTarget() {
        return target;
    }

    public String getUrl() {
        return target.getUrl();
    }

    /**
     * Where the story is expected to end up: {@code fanfics/{source}/{id}}.
     */
    public Path getTargetDirectory() {
        return targetDirectory;
    }

    /**
     * Output filename template in the retrieval tool's own {@code ${key}} syntax.
     */
    public String getOutputTemplate() {
        return outputTemplate;
    }

    public boolean isIncludeImages() {
        return includeImages;
    }
}
