package info.isaksson.erland.csmap;

import info.isaksson.erland.csmap.testutil.TestPaths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @Test
    void generatesMapsForSample(@TempDir Path out) throws Exception {
        Path source = TestPaths.resolveInRepo("samples/unity-mini");

        int code = Main.run(new String[] {source.toString(), out.toString(), "--json", "--threads", "2"});

        assertEquals(0, code);
        assertTrue(Files.isRegularFile(out.resolve("README.md")));
        assertTrue(Files.isRegularFile(out.resolve("Player.md")));
        assertTrue(Files.isRegularFile(out.resolve("PlayerEditor.md")));
        assertTrue(Files.isRegularFile(out.resolve("model.json")));
        assertFalse(Files.exists(out.resolve("PlayerTests.md")));
    }

    @Test
    void defaultOutputIsUnderInput(@TempDir Path root) throws Exception {
        Files.writeString(root.resolve("Mover.cs"), "public class Mover { public void Go() {} }");

        assertEquals(0, Main.run(new String[] {"--source", root.toString()}));
        assertTrue(Files.isRegularFile(root.resolve("_interface_maps/Mover.md")));
        assertTrue(Files.isRegularFile(root.resolve("_interface_maps/README.md")));

        // A second run must not pick up its own output.
        assertEquals(0, Main.run(new String[] {root.toString()}));
        assertTrue(Files.readString(root.resolve("_interface_maps/README.md")).contains("**1** C# scripts"));
    }

    @Test
    void emptyInputWritesNothing(@TempDir Path root) {
        assertEquals(0, Main.run(new String[] {root.toString()}));
        assertFalse(Files.exists(root.resolve("_interface_maps")));
    }

    @Test
    void exitCodesForUsageErrors(@TempDir Path root) {
        assertEquals(0, Main.run(new String[] {"--help"}));
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"--nope"}));
        assertEquals(1, Main.run(new String[] {root.resolve("missing").toString()}));
    }
}
