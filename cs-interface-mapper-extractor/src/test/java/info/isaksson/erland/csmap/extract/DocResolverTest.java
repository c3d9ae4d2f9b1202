package info.isaksson.erland.csmap.extract;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DocResolverTest {

    private static String[] lines(String text) {
        return text.split("\n", -1);
    }

    @Test
    void collectsLineDocsAboveAttributesAndStopsAtBlankLine() {
        String src = "class C\n"
                + "{\n"
                + "    /// Unrelated earlier text.\n"
                + "\n"
                + "    /// First line.\n"
                + "    /// Second line.\n"
                + "    [A]\n"
                + "    [B(1)]\n"
                + "    [C(\"x\")]\n"
                + "    public void Run() { }\n"
                + "}\n";
        assertEquals("First line. Second line.", DocResolver.resolveAtLine(lines(src), 9));
        assertEquals("First line. Second line.", DocResolver.resolve(src, "Run"));
    }

    @Test
    void blockCommentIsCollectedWhole() {
        String src = "/**\n"
                + " * Spawns enemies.\n"
                + " * Uses a pool.\n"
                + " */\n"
                + "public class Spawner { }\n";
        assertEquals("Spawns enemies. Uses a pool.", DocResolver.resolveAtLine(lines(src), 4));
    }

    @Test
    void codeLineAboveMeansNoDoc() {
        String src = "int x = 1;\npublic void F() { }\n";
        assertNull(DocResolver.resolveAtLine(lines(src), 1));
    }

    @Test
    void codeWithTrailingBlockCommentIsNotADoc() {
        String src = "public class C {\n"
                + "    public int A; /* hp */\n"
                + "    public void Run() { }\n"
                + "}\n";
        assertNull(DocResolver.resolve(src, "Run"));
        assertNull(DocResolver.resolveAtLine(lines(src), 2));
    }

    @Test
    void multiLineBlockEndingAfterTextIsStillADoc() {
        String src = "/* Moves\n"
                + "   the player. */\n"
                + "public void Move() { }\n";
        assertEquals("Moves the player.", DocResolver.resolveAtLine(lines(src), 2));
    }

    @Test
    void summaryTagWinsAndReferencesAreFlattened() {
        String src = "/// <summary>\n"
                + "/// Moves toward <see cref=\"Target\"/> using <paramref name=\"speed\"/>.\n"
                + "/// </summary>\n"
                + "/// <param name=\"speed\">Units per second.</param>\n"
                + "public void Move(float speed) { }\n";
        assertEquals("Moves toward Target using speed.", DocResolver.resolveAtLine(lines(src), 4));
    }

    @Test
    void decorationLinesAreDropped() {
        assertEquals("Section", DocResolver.normalize(List.of("// ------", "// Section", "// ======")));
    }

    @Test
    void longDocsAreTruncated() {
        String big = "x".repeat(DocResolver.MAX_DOC_CHARS + 10);
        String doc = DocResolver.normalize(List.of("// " + big));
        assertTrue(doc.endsWith("…(truncated)"));
        assertEquals(DocResolver.MAX_DOC_CHARS + "…(truncated)".length(), doc.length());
    }

    @Test
    void resolveIgnoresNamesMentionedOnlyInComments() {
        String src = "// public Run is documented elsewhere\n"
                + "class C {\n"
                + "    /// Does the run.\n"
                + "    public void Run() { }\n"
                + "}\n";
        assertEquals("Does the run.", DocResolver.resolve(src, "Run"));
        assertNull(DocResolver.resolve(src, "Missing"));
    }

    @Test
    void resolutionIsIdempotent() {
        String src = "/// Stable.\npublic int Value;\n";
        assertEquals(DocResolver.resolve(src, "Value"), DocResolver.resolve(src, "Value"));
    }

    @Test
    void fileDocRequiresMinimumLength() {
        String longHeader = "// This file drives the wave spawner and its difficulty curve.\n// Second line.\nusing System;\n";
        assertEquals("This file drives the wave spawner and its difficulty curve. Second line.",
                DocResolver.resolveFileDoc(longHeader, 40));
        assertNull(DocResolver.resolveFileDoc("// short\nusing System;\n", 40));
        assertNull(DocResolver.resolveFileDoc("using System;\n", 0));
    }

    @Test
    void fileDocSkipsByteOrderMarkAndLeadingBlankLines() {
        String src = "\uFEFF\n\n/* Shared math helpers used across the gameplay code. */\nusing System;\n";
        assertEquals("Shared math helpers used across the gameplay code.", DocResolver.resolveFileDoc(src, 10));
    }

    @Test
    void firstLineHasNoDoc() {
        assertNull(DocResolver.resolveAtLine(lines("public class A { }"), 0));
    }
}
