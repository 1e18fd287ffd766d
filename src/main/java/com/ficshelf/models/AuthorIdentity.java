package com.ficshelf.models;

import java.util.Objects;

/**
 * An author is only unique within one site, so the site abbreviation is part of the key.
 */
public final class AuthorIdentity implements Comparable<AuthorIdentity> {

    private final String source;
    private final String authorId;

    public AuthorIdentity(String source, String authorId) {
        this.source = Objects.requireNonNull(source, "source");
        this.authorId = Objects.requireNonNull(authorId, "authorId");
    }

    public String getSource() {
        return source;
    }

    public String getAuthorId() {
        return authorId;
    }

    /**
     * Flat key used for exported directory names, {@code source-authorId}.
     */
    public String key() {
        return source + "-" + authorId;
    }

    @Override
    public int compareTo(AuthorIdentity other) {
        int c = source.compareTo(other.source);
        return c != 0 ? c : authorId.compareTo(other.authorId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuthorIdentity)) return false;
        AuthorIdentity that = (AuthorIdentity) o;
        return source.equals(that.source) && authorId.equals(that.authorId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, authorId);
    }

    @Override
    public String toString() {
        return key();
    }
}
