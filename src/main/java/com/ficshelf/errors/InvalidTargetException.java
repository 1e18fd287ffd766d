package com.ficshelf.errors;

/**
 * Raised when a reference cannot be added to a project's target list.
 */
public class InvalidTargetException extends InvalidReferenceException {

    public InvalidTargetException(String reference) {
        super(reference, "Cannot add target '" + reference + "': not a valid story reference");
    }
}
