package com.ficshelf.aggregate;

import com.ficshelf.AppLogger;
import com.ficshelf.Project;
import com.ficshelf.models.CatalogIndex;
import com.ficshelf.models.CatalogWarning;
import com.ficshelf.models.MetadataCollection;
import com.ficshelf.models.StoryRecord;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges the stories of a project and its subprojects into one catalog.
 *
 * <p>Projects are visited root first, then each subproject subtree in the
 * order it is listed. The first project to contribute a story identity wins;
 * later copies are discarded. Each project's own category aliases are applied
 * to its stories before merging.</p>
 */
public class AggregationEngine {

    public CatalogIndex aggregate(Project root, boolean includeSubprojects) throws IOException {
        List<Project> projects = new ArrayList<>();
        projects.add(root);
        if (includeSubprojects) {
            projects.addAll(root.getSubprojects());
        }

        CatalogIndex index = new CatalogIndex();
        for (Project project : projects) {
            MetadataCollection collected = project.collectMetadata();
            for (CatalogWarning warning : collected.getWarnings()) {
                index.addWarning(new CatalogWarning(
                    project.getRoot().resolve(warning.getSubject()).toString(), warning.getMessage()));
            }
            int added = 0;
            for (StoryRecord record : collected.getRecords()) {
                boolean inserted = index.insert(record.getIdentity(), record.getMetadata(),
                    record.getMetadata().getCategory(), project.targetDirectory(record.getIdentity()));
                if (inserted) {
                    added++;
                } else {
                    log("Discarding duplicate " + record.getIdentity() + " from " + project.getRoot());
                }
            }
            log("Merged " + added + " of " + collected.getRecords().size() + " stories from " + project.getRoot());
        }
        if (!index.getWarnings().isEmpty()) {
            logWarn(index.getWarnings().size() + " stories skipped while aggregating " + root.getRoot());
        }
        return index;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[AggregationEngine] " + message);
        }
    }

    private void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[AggregationEngine] " + message);
        }
    }
}
