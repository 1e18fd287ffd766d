package com.ficshelf.collab;

import com.ficshelf.models.CanonicalMetadata;

import java.nio.file.Path;

/**
 * Turns one stored story into an e-book.
 */
public interface BookConversionCollaborator {

    /**
     * @param storyDir directory holding the story's HTML and images
     * @param metadata converted metadata used for the book's title page fields
     * @param output   file to write; the format follows from its extension
     * @throws com.ficshelf.errors.CollaboratorFailureException if conversion failed
     */
    void convert(Path storyDir, CanonicalMetadata metadata, Path output);
}
