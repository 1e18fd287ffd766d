package com.ficshelf.collab;

import com.ficshelf.errors.CollaboratorFailureException;
import com.ficshelf.target.TargetResolver;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FanFicFareRetrievalTest {

    private static RetrievalRequest request(boolean images) {
        return new RetrievalRequest(TargetResolver.resolve("42"), Path.of("/shelf/fanfics/ffnet/42"),
            "/shelf/fanfics/${siteabbrev}/${storyId}/story${formatext}", images);
    }

    @Test
    void buildsToolCommandLine() {
        FanFicFareRetrieval retrieval = new FanFicFareRetrieval((command, dir) -> new ProcessResult(0, "", ""), null);

        List<String> command = retrieval.buildCommand(request(true));

        assertEquals(List.of("fanficfare", "-f", "html", "-j", "--non-interactive",
            "-o", "is_adult=true",
            "-o", "output_filename=/shelf/fanfics/${siteabbrev}/${storyId}/story${formatext}",
            "-o", "include_images=true",
            "-o", "skip_author_cover=false",
            "https://www.fanfiction.net/s/42/1/"), command);
        assertFalse(retrieval.buildCommand(request(false)).contains("include_images=true"));
    }

    @Test
    void returnsStdoutAsMetadata() {
        List<List<String>> calls = new ArrayList<>();
        CommandRunner runner = (command, dir) -> {
            calls.add(command);
            return new ProcessResult(0, "{\"title\": \"x\"}", "some progress noise");
        };

        RetrievalResult result = new FanFicFareRetrieval(runner, "/opt/fff/bin/fanficfare").retrieve(request(true));

        assertEquals("{\"title\": \"x\"}", result.getMetadataJson());
        assertEquals("/opt/fff/bin/fanficfare", calls.get(0).get(0));
    }

    @Test
    void nonZeroExitIsCollaboratorFailure() {
        CommandRunner runner = (command, dir) -> new ProcessResult(2, "", "Traceback...\nStoryDoesNotExist: 42\n");

        CollaboratorFailureException e = assertThrows(CollaboratorFailureException.class,
            () -> new FanFicFareRetrieval(runner, null).retrieve(request(true)));

        assertEquals(2, e.getExitCode());
        assertTrue(e.getMessage().contains("StoryDoesNotExist: 42"));
        assertEquals("https://www.fanfiction.net/s/42/1/", e.getSubject());
    }

    @Test
    void unstartableToolIsCollaboratorFailure() {
        CommandRunner runner = (command, dir) -> {
            throw new IOException("No such file or directory");
        };

        CollaboratorFailureException e = assertThrows(CollaboratorFailureException.class,
            () -> new FanFicFareRetrieval(runner, null).retrieve(request(true)));
        assertEquals(-1, e.getExitCode());
    }
}
