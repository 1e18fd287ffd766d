package com.ficshelf.collab;

/**
 * Fetches one story into its target directory.
 */
public interface RetrievalCollaborator {

    /**
     * @throws com.ficshelf.errors.CollaboratorFailureException if the fetch failed;
     *         the caller is responsible for removing any partial output
     */
    RetrievalResult retrieve(RetrievalRequest request);
}
