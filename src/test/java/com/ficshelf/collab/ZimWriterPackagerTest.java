package com.ficshelf.collab;

import com.ficshelf.errors.CollaboratorFailureException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ZimWriterPackagerTest {

    @Test
    void passesHeaderFieldsInOrder() {
        PackageRequest request = new PackageRequest(Path.of("/tmp/build"), Path.of("/tmp/shelf.zim"),
            new PackageOptions("My Shelf", "DE", "Stories", "many", "me"));

        List<String> command = new ZimWriterPackager((c, d) -> new ProcessResult(0, "", "")).buildCommand(request);

        assertEquals(List.of("zimwriterfs", "-w", "index.html", "-f", "resources/favicon.icon",
            "-l", "DE", "-t", "My Shelf", "-d", "Stories", "-c", "many", "-p", "me",
            "-i", Path.of("/tmp/build").toAbsolutePath().toString(),
            Path.of("/tmp/shelf.zim").toAbsolutePath().toString()), command);
    }

    @Test
    void failureCarriesExitCode() {
        ZimWriterPackager packager = new ZimWriterPackager((c, d) -> new ProcessResult(3, "", "bad favicon"));
        PackageRequest request = new PackageRequest(Path.of("/tmp/build"), Path.of("/tmp/shelf.zim"), PackageOptions.defaults());

        CollaboratorFailureException e = assertThrows(CollaboratorFailureException.class, () -> packager.pack(request));
        assertEquals(3, e.getExitCode());
        assertTrue(e.getMessage().endsWith("bad favicon"));
    }
}
