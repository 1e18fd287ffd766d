package com.ficshelf.models;

import com.ficshelf.target.Target;

/**
 * Result of downloading or updating a single target.
 */
public final class DownloadOutcome {

    public enum Status {
        DOWNLOADED,
        UPDATED,
        ALREADY_EXISTS,
        FAILED
    }

    private final Target target;
    private final Status status;
    private final String message;

    private DownloadOutcome(Target target, Status status, String message) {
        this.target = target;
        this.status = status;
        this.message = message;
    }

    public static DownloadOutcome downloaded(Target target) {
        return new DownloadOutcome(target, Status.DOWNLOADED, "Downloaded " + target.getUrl());
    }

    public static DownloadOutcome updated(Target target) {
        return new DownloadOutcome(target, Status.UPDATED, "Updated " + target.getUrl());
    }

    public static DownloadOutcome alreadyExists(Target target) {
        return new DownloadOutcome(target, Status.ALREADY_EXISTS, "Story " + target.subpath() + " already exists");
    }

    public static DownloadOutcome failed(Target target, String reason) {
        return new DownloadOutcome(target, Status.FAILED, reason);
    }

    public Target getTarget() {
        return target;
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public boolean isSuccess() {
        return status == Status.DOWNLOADED || status == Status.UPDATED;
    }

    @Override
    public String toString() {
        return status + " " + target.getUrl() + (message != null ? " (" + message + ")" : "");
    }
}
