package info.isaksson.erland.csmap.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceScannerTest {

    @TempDir
    Path root;

    private void touch(String rel) throws Exception {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, "class X {}");
    }

    private List<String> rel(List<Path> paths) {
        return paths.stream().map(p -> root.relativize(p).toString().replace('\\', '/')).toList();
    }

    private void layout() throws Exception {
        touch("A.cs");
        touch("Sub/B.cs");
        touch("Sub/notes.txt");
        touch("Sub/B.cs.meta");
        touch("Tests/T.cs");
        touch("Game/EditMode/E.cs");
        touch("Library/PackageCache/L.cs");
        touch("Game/obj/O.cs");
        touch("_interface_maps/M.cs");
        touch("Vendor/V.cs");
    }

    @Test
    void findsSourcesSortedAndSkipsBuildAndTestFolders() throws Exception {
        layout();

        List<Path> found = SourceScanner.scan(root, List.of(), false);

        assertEquals(List.of("A.cs", "Sub/B.cs", "Vendor/V.cs"), rel(found));
    }

    @Test
    void includeTestsKeepsTestFolders() throws Exception {
        layout();

        List<Path> found = SourceScanner.scan(root, List.of(), true);

        assertEquals(List.of("A.cs", "Game/EditMode/E.cs", "Sub/B.cs", "Tests/T.cs", "Vendor/V.cs"), rel(found));
    }

    @Test
    void excludeGlobsAndPlainDirectoryNames() throws Exception {
        layout();

        assertEquals(List.of("A.cs", "Sub/B.cs"), rel(SourceScanner.scan(root, List.of("Vendor"), false)));
        assertEquals(List.of("A.cs", "Vendor/V.cs"), rel(SourceScanner.scan(root, List.of("Sub/*.cs"), false)));
        assertEquals(List.of("A.cs", "Vendor/V.cs"), rel(SourceScanner.scan(root, List.of("**/B.cs", " ", ""), false)));
    }

    @Test
    void emptyRootFindsNothing() throws Exception {
        assertTrue(SourceScanner.scan(root, null, false).isEmpty());
    }

    @Test
    void testPathHeuristicIsCaseInsensitive() {
        assertTrue(SourceScanner.looksLikeTestPath(root, root.resolve("tests/X.cs")));
        assertTrue(SourceScanner.looksLikeTestPath(root, root.resolve("Game/PlayMode/X.cs")));
        assertFalse(SourceScanner.looksLikeTestPath(root, root.resolve("Game/Testing/X.cs")));
        assertFalse(SourceScanner.looksLikeTestPath(root, root.resolve("Contest.cs")));
    }

    @Test
    void buildFoldersAreMatchedByWholeFolderName() {
        assertTrue(SourceScanner.isInCommonBuildDir(root, root.resolve("Packages/Foo/obj/Debug/X.cs")));
        assertTrue(SourceScanner.isInCommonBuildDir(root, root.resolve("target/X.cs")));
        assertFalse(SourceScanner.isInCommonBuildDir(root, root.resolve("Assets/target/X.cs")));
        assertFalse(SourceScanner.isInCommonBuildDir(root, root.resolve("Assets/Objects/X.cs")));
        assertFalse(SourceScanner.isInCommonBuildDir(root, root.resolve("Library.cs")));
        assertTrue(SourceScanner.looksLikeTestPath(root, root.resolve("EditMode/X.cs")));
    }
}
