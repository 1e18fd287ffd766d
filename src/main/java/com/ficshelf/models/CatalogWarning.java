package com.ficshelf.models;

/**
 * A target skipped while collecting metadata, and why.
 */
public final class CatalogWarning {

    private final String subject;
    private final String message;

    public CatalogWarning(String subject, String message) {
        this.subject = subject;
        this.message = message;
    }

    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return subject + ": " + message;
    }
}
