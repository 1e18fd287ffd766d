package com.ficshelf.errors;

/**
 * A stored target directory has no readable metadata file.
 */
public class MissingMetadataException extends FicShelfException {

    public MissingMetadataException(String subject, String message) {
        super(subject, message);
    }

    public MissingMetadataException(String subject, String message, Throwable cause) {
        super(subject, message, cause);
    }
}
