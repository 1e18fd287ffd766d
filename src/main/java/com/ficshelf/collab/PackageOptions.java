package com.ficshelf.collab;

import com.ficshelf.Project;
import com.ficshelf.ProjectOptions;

import java.io.IOException;

/**
 * Archive header fields, read from the {@code build} category of the project options.
 */
public final class PackageOptions {

    static final String CATEGORY = "build";

    public static final String DEFAULT_TITLE = "fanfiction archive";
    public static final String DEFAULT_LANGUAGE = "EN";
    public static final String DEFAULT_DESCRIPTION = "Archived fanfictions";
    public static final String DEFAULT_CREATOR = "various";
    public static final String DEFAULT_PUBLISHER = "UNKNOWN";

    private final String title;
    private final String language;
    private final String description;
    private final String creator;
    private final String publisher;

    public PackageOptions(String title, String language, String description, String creator, String publisher) {
        this.title = title;
        this.language = language;
        this.description = description;
        this.creator = creator;
        this.publisher = publisher;
    }

    public static PackageOptions defaults() {
        return new PackageOptions(DEFAULT_TITLE, DEFAULT_LANGUAGE, DEFAULT_DESCRIPTION, DEFAULT_CREATOR, DEFAULT_PUBLISHER);
    }

    public static PackageOptions fromProject(Project project) throws IOException {
        ProjectOptions options = project.options();
        return new PackageOptions(
            options.getString(CATEGORY, "title", DEFAULT_TITLE),
            options.getString(CATEGORY, "language", DEFAULT_LANGUAGE),
            options.getString(CATEGORY, "description", DEFAULT_DESCRIPTION),
            options.getString(CATEGORY, "creator", DEFAULT_CREATOR),
            options.getString(CATEGORY, "publisher", DEFAULT_PUBLISHER));
    }

    public String getTitle() {
        return title;
    }

    public String getLanguage() {
        return language;
    }

    public String getDescription() {
        return description;
    }

    public String getCreator() {
        return creator;
    }

    public String getPublisher() {
        return publisher;
    }
}
