package com.ficshelf.target;

import java.util.Objects;

/**
 * A resolved reference: the canonical URL handed to the retrieval tool, plus
 * the identity used for every equality decision.
 */
public final class Target implements Comparable<Target> {

    private final String url;
    private final TargetIdentity identity;

    public Target(String url, TargetIdentity identity) {
        this.url = Objects.requireNonNull(url, "url");
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    public String getUrl() {
        return url;
    }

    public TargetIdentity getIdentity() {
        return identity;
    }

    public String getSource() {
        return identity.getSource();
    }

    public String getId() {
        return identity.getId();
    }

    public String subpath() {
        return identity.subpath();
    }

    @Override
    public int compareTo(Target other) {
        return identity.compareTo(other.identity);
    }

    // equal by identity only; the url is just one spelling of it
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Target)) return false;
        return identity.equals(((Target) o).identity);
    }

    @Override
    public int hashCode() {
        return identity.hashCode();
    }

    @Override
    public String toString() {
        return url;
    }
}
