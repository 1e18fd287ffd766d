package com.ficshelf.errors;

/**
 * Base for all failures this library raises itself. Every failure names the
 * target reference or filesystem path it concerns.
 */
public class FicShelfException extends RuntimeException {

    private final String subject;

    public FicShelfException(String subject, String message) {
        super(message);
        this.subject = subject;
    }

    public FicShelfException(String subject, String message, Throwable cause) {
        super(message, cause);
        this.subject = subject;
    }

    /**
     * The target reference or path this failure is about.
     */
    public String getSubject() {
        return subject;
    }
}
