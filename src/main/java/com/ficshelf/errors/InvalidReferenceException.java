package com.ficshelf.errors;

/**
 * A reference string does not match any supported story pattern.
 */
public class InvalidReferenceException extends FicShelfException {

    public InvalidReferenceException(String reference) {
        super(reference, "Not a valid story reference: '" + reference + "'");
    }

    protected InvalidReferenceException(String reference, String message) {
        super(reference, message);
    }
}
