package com.ficshelf.errors;

/**
 * Raw metadata is too broken to build a canonical record from.
 */
public class MalformedSourceException extends FicShelfException {

    public MalformedSourceException(String subject, String message) {
        super(subject, message);
    }
}
