package com.ficshelf.collab;

import com.ficshelf.models.CanonicalMetadata;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EbookConvertCollaboratorTest {

    @Test
    void passesOnlyKnownMetadataFields() {
        List<Path> dirs = new ArrayList<>();
        List<List<String>> commands = new ArrayList<>();
        EbookConvertCollaborator converter = new EbookConvertCollaborator((command, dir) -> {
            commands.add(command);
            dirs.add(dir);
            return new ProcessResult(0, "", "");
        });
        CanonicalMetadata metadata = CanonicalMetadata.builder()
            .title("The Answer")
            .author("Deep Thought")
            .category("Sci-Fi")
            .build();
        Path storyDir = Path.of("/shelf/fanfics/ffnet/42");

        converter.convert(storyDir, metadata, Path.of("/books/answer.epub"));

        assertEquals(List.of("ebook-convert", storyDir.resolve("story.html").toString(),
            Path.of("/books/answer.epub").toAbsolutePath().toString(),
            "--title", "The Answer", "--authors", "Deep Thought", "--tags", "Sci-Fi"), commands.get(0));
        assertEquals(storyDir, dirs.get(0));
    }
}
