package com.ficshelf.controllers;

import com.ficshelf.errors.FicShelfException;
import io.javalin.Javalin;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * Error payload with a message that is never null. Domain errors also
     * carry the reference or path they concern.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", m);
        if (e instanceof FicShelfException && ((FicShelfException) e).getSubject() != null) {
            body.put("subject", ((FicShelfException) e).getSubject());
        }
        return body;
    }
}
