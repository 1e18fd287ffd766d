package com.ficshelf.collab;

/**
 * Packs a prepared content directory into a single archive file.
 */
public interface ArchivePackager {

    /**
     * @throws com.ficshelf.errors.CollaboratorFailureException if packaging failed
     */
    void pack(PackageRequest request);
}
