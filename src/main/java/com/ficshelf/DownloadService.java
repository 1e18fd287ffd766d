package com.ficshelf;

import com.ficshelf.collab.RetrievalCollaborator;
import com.ficshelf.errors.AlreadyExistsException;
import com.ficshelf.errors.FicShelfException;
import com.ficshelf.models.DownloadOutcome;
import com.ficshelf.target.Target;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch download and update of a project's targets, one at a time in list
 * order. A failing target is reported in its outcome and the batch moves on;
 * only failures to read the target lists stop the batch.
 */
public class DownloadService {

    private final RetrievalCollaborator retrieval;

    public DownloadService(RetrievalCollaborator retrieval) {
        this.retrieval = retrieval;
    }

    /**
     * Download targets that are not stored locally yet.
     *
     * @param limit maximum number of targets to process, or 0 for all
     */
    public List<DownloadOutcome> downloadPending(Project project, int limit) throws IOException {
        List<Target> pending = limit(project.listTargets(true), limit);
        List<DownloadOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            Target target = pending.get(i);
            progress("[" + (i + 1) + "/" + pending.size() + "] Downloading " + target.getUrl());
            outcomes.add(downloadOne(project, target));
        }
        logSummary("Download", outcomes);
        return outcomes;
    }

    /**
     * Re-download targets marked for update.
     *
     * @param limit maximum number of targets to process, or 0 for all
     */
    public List<DownloadOutcome> updateMarked(Project project, int limit) throws IOException {
        List<Target> marked = limit(project.listMarkedForUpdate(), limit);
        List<DownloadOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < marked.size(); i++) {
            Target target = marked.get(i);
            progress("[" + (i + 1) + "/" + marked.size() + "] Updating " + target.getUrl());
            DownloadOutcome outcome;
            try {
                outcome = project.updateTarget(target, retrieval);
            } catch (FicShelfException | IOException e) {
                logError("Update of " + target.getUrl() + " failed", e);
                outcome = DownloadOutcome.failed(target, e.getMessage());
            }
            outcomes.add(outcome);
        }
        logSummary("Update", outcomes);
        return outcomes;
    }

    public DownloadOutcome downloadOne(Project project, Target target) {
        try {
            return project.downloadTarget(target, retrieval);
        } catch (AlreadyExistsException e) {
            return DownloadOutcome.alreadyExists(target);
        } catch (FicShelfException | IOException e) {
            logError("Download of " + target.getUrl() + " failed", e);
            return DownloadOutcome.failed(target, e.getMessage());
        }
    }

    private static List<Target> limit(List<Target> targets, int limit) {
        if (limit <= 0 || limit >= targets.size()) {
            return targets;
        }
        return new ArrayList<>(targets.subList(0, limit));
    }

    private void logSummary(String action, List<DownloadOutcome> outcomes) {
        int failed = 0;
        for (DownloadOutcome outcome : outcomes) {
            if (outcome.getStatus() == DownloadOutcome.Status.FAILED) {
                failed++;
            }
        }
        progress(action + " finished: " + (outcomes.size() - failed) + " ok, " + failed + " failed");
    }

    private void progress(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.progress("[DownloadService] " + message);
        }
    }

    private void logError(String message, Exception e) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.error("[DownloadService] " + message + ": " + e.getMessage());
        }
    }
}
