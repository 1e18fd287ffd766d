package com.ficshelf.models;

import com.ficshelf.target.TargetIdentity;

/**
 * A stored story's identity together with its converted metadata.
 */
public final class StoryRecord {

    private final TargetIdentity identity;
    private final CanonicalMetadata metadata;

    public StoryRecord(TargetIdentity identity, CanonicalMetadata metadata) {
        this.identity = identity;
        this.metadata = metadata;
    }

    public TargetIdentity getIdentity() {
        return identity;
    }

    public CanonicalMetadata getMetadata() {
        return metadata;
    }
}
