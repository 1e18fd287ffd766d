package com.ficshelf.errors;

/**
 * An external tool (retrieval, e-book conversion, packaging) failed.
 */
public class CollaboratorFailureException extends FicShelfException {

    private final int exitCode;

    public CollaboratorFailureException(String subject, String message, int exitCode) {
        super(subject, message);
        this.exitCode = exitCode;
    }

    public CollaboratorFailureException(String subject, String message, Throwable cause) {
        super(subject, message, cause);
        this.exitCode = -1;
    }

    /**
     * Process exit code, or -1 if the process never ran to completion.
     */
    public int getExitCode() {
        return exitCode;
    }
}
