package com.ficshelf.models;

public enum AddResult {
    ADDED,
    ALREADY_PRESENT
}
