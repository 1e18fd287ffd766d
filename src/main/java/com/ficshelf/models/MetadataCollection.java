package com.ficshelf.models;

import java.util.Collections;
import java.util.List;

/**
 * A project's locally stored stories after conversion, plus the ones that
 * had to be skipped.
 */
public final class MetadataCollection {

    private final List<StoryRecord> records;
    private final List<CatalogWarning> warnings;

    public MetadataCollection(List<StoryRecord> records, List<CatalogWarning> warnings) {
        this.records = Collections.unmodifiableList(records);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public List<StoryRecord> getRecords() {
        return records;
    }

    public List<CatalogWarning> getWarnings() {
        return warnings;
    }
}
