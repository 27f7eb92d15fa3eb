package info.isaksson.erland.metatree.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SourceScannerTest {

    @TempDir
    Path root;

    private void touch(String rel) throws Exception {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, "x");
    }

    private List<String> rel(List<Path> paths) {
        return paths.stream().map(p -> SourceScanner.relative(root, p)).collect(Collectors.toList());
    }

    @Test
    void scanIsSortedAndFilteredByExtension() throws Exception {
        touch("z/Last.java");
        touch("a/First.java");
        touch("a/readme.md");
        touch("m/Mid.JAVA");
        touch("target/classes/Gen.java");
        touch("src/build/Kept.java");

        List<Path> files = SourceScanner.scan(root, Set.of("java"), List.of());
        assertEquals(List.of("a/First.java", "m/Mid.JAVA", "src/build/Kept.java", "z/Last.java"), rel(files));
    }

    @Test
    void excludeGlobsAndBareDirectories() throws Exception {
        touch("a/One.mini");
        touch("gen/Two.mini");
        touch("a/deep/Three.mini");

        List<Path> files = SourceScanner.scan(root, Set.of(".mini"), List.of("gen", "**/deep/**"));
        assertEquals(List.of("a/One.mini"), rel(files));
    }

    @Test
    void singleFileRoot() throws Exception {
        touch("One.mini");
        Path file = root.resolve("One.mini");
        assertEquals(List.of(file), SourceScanner.scan(file, Set.of(".mini"), List.of()));
        assertEquals(List.of(), SourceScanner.scan(file, Set.of(".java"), List.of()));
    }
}
