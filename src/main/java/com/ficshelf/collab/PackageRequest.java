package com.ficshelf.collab;

import java.nio.file.Path;

public final class PackageRequest {

    public static final String WELCOME_PAGE = "index.html";
    public static final String FAVICON = "resources/favicon.icon";

    private final Path contentDirectory;
    private final Path output;
    private final PackageOptions options;

    public PackageRequest(Path contentDirectory, Path output, PackageOptions options) {
        this.contentDirectory = contentDirectory;
        this.output = output;
        this.options = options;
    }

    /**
     * Directory with the rendered pages, the catalog JSON and the story copies.
     */
    public Path getContentDirectory() {
        return contentDirectory;
    }

    public Path getOutput() {
        return output;
    }

    public PackageOptions getOptions() {
        return options;
    }
}
