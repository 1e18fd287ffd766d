package com.ficshelf.controllers;

import com.ficshelf.errors.AlreadyExistsException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ControllerTest {

    @Test
    void errorBodyNamesSubjectOfDomainErrors() {
        Map<String, Object> body = Controller.errorBody(new AlreadyExistsException("ffnet/42", "Target already downloaded"));
        assertEquals("Target already downloaded", body.get("error"));
        assertEquals("ffnet/42", body.get("subject"));
    }

    @Test
    void errorBodyFallsBackToExceptionName() {
        Map<String, Object> body = Controller.errorBody(new IllegalStateException());
        assertEquals("IllegalStateException", body.get("error"));
        assertFalse(body.containsKey("subject"));
    }
}
