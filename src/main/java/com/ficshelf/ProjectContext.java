package com.ficshelf;

import com.ficshelf.aggregate.AggregationEngine;
import com.ficshelf.aggregate.CatalogExporter;
import com.ficshelf.collab.ArchivePackager;
import com.ficshelf.collab.BookConversionCollaborator;
import com.ficshelf.collab.RetrievalCollaborator;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runtime holder for the open project and the services working on it.
 * Requests that change project files go through {@link #write(ProjectCall)},
 * which runs them one at a time.
 */
public class ProjectContext {

    private final BookConversionCollaborator bookConverter;
    private final AggregationEngine aggregationEngine;
    private final DownloadService downloadService;
    private final BuildService buildService;
    private final Object lock = new Object();
    private Project project;

    public ProjectContext(Path projectRoot, RetrievalCollaborator retrieval,
                          BookConversionCollaborator bookConverter, ArchivePackager packager) {
        this.bookConverter = bookConverter;
        this.aggregationEngine = new AggregationEngine();
        this.downloadService = new DownloadService(retrieval);
        this.buildService = new BuildService(aggregationEngine, new CatalogExporter(), packager);
        load(projectRoot);
    }

    public synchronized void load(Path projectRoot) {
        this.project = Project.open(projectRoot);
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("Project context loaded for " + project.getRoot());
        }
    }

    /**
     * Create a new project at {@code projectRoot} and switch to it.
     */
    public synchronized Project initAndLoad(Path projectRoot) throws IOException {
        Project.init(projectRoot);
        load(projectRoot);
        return project;
    }

    public synchronized Project project() {
        return project;
    }

    public <T> T write(ProjectCall<T> call) throws Exception {
        synchronized (lock) {
            return call.apply(project());
        }
    }

    public BookConversionCollaborator bookConverter() {
        return bookConverter;
    }

    public AggregationEngine aggregation() {
        return aggregationEngine;
    }

    public DownloadService downloads() {
        return downloadService;
    }

    public BuildService builds() {
        return buildService;
    }

    @FunctionalInterface
    public interface ProjectCall<T> {
        T apply(Project project) throws Exception;
    }
}
