package Presentation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImageScannerTest {

    private final ImageScanner scanner = new ImageScanner();

    @Test
    void findsImagesRecursivelyInSortedOrder(@TempDir Path root) throws IOException {
        Files.createDirectories(root.resolve("burst"));
        Files.writeString(root.resolve("b.JPG"), "x");
        Files.writeString(root.resolve("a.png"), "x");
        Files.writeString(root.resolve("burst/c.webp"), "x");
        Files.writeString(root.resolve("notes.txt"), "x");

        List<Path> found = scanner.scan(root);

        assertEquals(List.of(root.resolve("a.png"), root.resolve("b.JPG"), root.resolve("burst/c.webp")), found);
    }

    @Test
    void imageIdIsRelativePathWithoutExtension(@TempDir Path root) {
        assertEquals("a", scanner.imageId(root, root.resolve("a.png")));
        assertEquals("burst/c", scanner.imageId(root, root.resolve("burst").resolve("c.webp")));
        assertEquals("archive.v2", scanner.imageId(root, root.resolve("archive.v2.jpg")));
    }

    @Test
    void missingFolder_fails(@TempDir Path root) {
        assertThrows(IOException.class, () -> scanner.scan(root.resolve("nope")));
    }
}
