package com.ficshelf.target;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one story regardless of how it was referenced: the site
 * abbreviation plus the site's own story id.
 */
public final class TargetIdentity implements Comparable<TargetIdentity> {

    private static final Comparator<TargetIdentity> ORDER = Comparator
        .comparing(TargetIdentity::getSource)
        .thenComparing(TargetIdentity::getId);

    private final String source;
    private final String id;

    public TargetIdentity(String source, String id) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Target source must not be empty");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Target id must not be empty");
        }
        this.source = source;
        this.id = id;
    }

    public String getSource() {
        return source;
    }

    public String getId() {
        return id;
    }

    /**
     * Relative directory of this story's artifacts, {@code source/id}.
     */
    public String subpath() {
        return source + "/" + id;
    }

    /**
     * Flat key used for exported directory names, {@code source-id}.
     */
    public String key() {
        return source + "-" + id;
    }

    @Override
    public int compareTo(TargetIdentity other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetIdentity)) return false;
        TargetIdentity that = (TargetIdentity) o;
        return source.equals(that.source) && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, id);
    }

    @Override
    public String toString() {
        return subpath();
    }
}
