package com.ficshelf.errors;

public class AlreadyExistsException extends FicShelfException {

    public AlreadyExistsException(String subject, String message) {
        super(subject, message);
    }
}
