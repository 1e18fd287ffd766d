package com.ficshelf;

import com.ficshelf.aggregate.AggregationEngine;
import com.ficshelf.aggregate.CatalogExporter;
import com.ficshelf.aggregate.CatalogStats;
import com.ficshelf.collab.ArchivePackager;
import com.ficshelf.collab.PackageOptions;
import com.ficshelf.collab.PackageRequest;
import com.ficshelf.errors.AlreadyExistsException;
import com.ficshelf.models.CatalogIndex;
import com.ficshelf.storage.FileTrees;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds an archive of a project tree: aggregate the catalog, lay out the
 * content directory and hand it to the packager.
 *
 * <p>The content directory is assembled from the pre-rendered pages (when
 * given), the project's {@code resources/} folder and the exported catalog.
 * It is a temporary directory removed after packaging.</p>
 */
public class BuildService {

    private final AggregationEngine engine;
    private final CatalogExporter exporter;
    private final ArchivePackager packager;

    public BuildService(AggregationEngine engine, CatalogExporter exporter, ArchivePackager packager) {
        this.engine = engine;
        this.exporter = exporter;
        this.packager = packager;
    }

    /**
     * @param pagesDir rendered HTML pages to include at the archive root, may be null
     */
    public CatalogStats build(Project project, Path output, Path pagesDir, boolean includeSubprojects) throws IOException {
        if (Files.exists(output)) {
            throw new AlreadyExistsException(output.toString(), "Output already exists: " + output);
        }
        CatalogIndex index = engine.aggregate(project, includeSubprojects);

        Path contentDir = Files.createTempDirectory("ficshelf-build-");
        try {
            if (pagesDir != null) {
                FileTrees.copyDirectory(pagesDir, contentDir);
            }
            if (!Files.isRegularFile(contentDir.resolve(PackageRequest.WELCOME_PAGE))) {
                logWarn("No " + PackageRequest.WELCOME_PAGE + " in the content directory");
            }
            Path resources = project.getRoot().resolve(Project.RESOURCES_DIR);
            if (Files.isDirectory(resources)) {
                FileTrees.copyDirectory(resources, contentDir.resolve(Project.RESOURCES_DIR));
            }
            exporter.export(index, contentDir);

            log("Packaging " + index.getStories().size() + " stories into " + output);
            packager.pack(new PackageRequest(contentDir, output, PackageOptions.fromProject(project)));
        } finally {
            FileTrees.deleteRecursively(contentDir);
        }
        return CatalogStats.of(index);
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[BuildService] " + message);
        }
    }

    private void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[BuildService] " + message);
        }
    }
}
