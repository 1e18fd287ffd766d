package com.ficshelf.errors;

public class NotAProjectException extends FicShelfException {

    public NotAProjectException(String path) {
        super(path, "Path '" + path + "' does not point to a valid project.");
    }
}
