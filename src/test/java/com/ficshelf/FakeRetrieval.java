package com.ficshelf;

import com.ficshelf.collab.RetrievalCollaborator;
import com.ficshelf.collab.RetrievalRequest;
import com.ficshelf.collab.RetrievalResult;
import com.ficshelf.errors.CollaboratorFailureException;
import com.ficshelf.target.TargetIdentity;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Stands in for the retrieval tool. By default it writes a story file into
 * the requested directory and returns a small metadata document.
 */
public class FakeRetrieval implements RetrievalCollaborator {

    public enum Mode {
        SUCCEED,
        FAIL_AFTER_PARTIAL_WRITE,
        SUCCEED_WITHOUT_OUTPUT,
        THROW_UNEXPECTED,
        BLOCK_METADATA_FILE
    }

    private final List<RetrievalRequest> requests = new ArrayList<>();
    private final Set<TargetIdentity> failing = new HashSet<>();
    private Mode mode = Mode.SUCCEED;
    private String title = "Fetched";

    public FakeRetrieval mode(Mode mode) {
        this.mode = mode;
        return this;
    }

    public FakeRetrieval title(String title) {
        this.title = title;
        return this;
    }

    public FakeRetrieval failFor(TargetIdentity identity) {
        failing.add(identity);
        return this;
    }

    public List<RetrievalRequest> getRequests() {
        return requests;
    }

    public static String metadataJson(TargetIdentity identity, String title) {
        return "{\"storyId\": \"" + identity.getId() + "\", \"siteabbrev\": \"" + identity.getSource()
            + "\", \"title\": \"" + title + "\", \"category\": \"Test\", \"authorId\": \"7\"}";
    }

    @Override
    public RetrievalResult retrieve(RetrievalRequest request) {
        requests.add(request);
        TargetIdentity identity = request.getTarget().getIdentity();
        Mode effective = failing.contains(identity) ? Mode.FAIL_AFTER_PARTIAL_WRITE : mode;
        try {
            switch (effective) {
                case FAIL_AFTER_PARTIAL_WRITE:
                    Files.createDirectories(request.getTargetDirectory());
                    Files.writeString(request.getTargetDirectory().resolve("partial.tmp"), "half", StandardCharsets.UTF_8);
                    throw new CollaboratorFailureException(request.getUrl(), "story not available", 1);
                case SUCCEED_WITHOUT_OUTPUT:
                    return new RetrievalResult(metadataJson(identity, title));
                case BLOCK_METADATA_FILE:
                    Files.createDirectories(request.getTargetDirectory().resolve(Project.METADATA_FILE));
                    Files.writeString(request.getTargetDirectory().resolve(Project.STORY_FILE),
                        "<html>" + title + "</html>", StandardCharsets.UTF_8);
                    return new RetrievalResult(metadataJson(identity, title));
                case THROW_UNEXPECTED:
                    Files.createDirectories(request.getTargetDirectory());
                    throw new IllegalStateException("unexpected failure");
                default:
                    Files.createDirectories(request.getTargetDirectory());
                    Files.writeString(request.getTargetDirectory().resolve(Project.STORY_FILE),
                        "<html>" + title + "</html>", StandardCharsets.UTF_8);
                    return new RetrievalResult(metadataJson(identity, title));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
