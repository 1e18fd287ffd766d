package com.ficshelf.errors;

/**
 * A subproject chain leads back to a project already on the walk.
 */
public class CyclicSubprojectException extends FicShelfException {

    public CyclicSubprojectException(String path, String via) {
        super(path, "Subproject '" + path + "' is already part of the walk (reached via '" + via + "')");
    }
}
