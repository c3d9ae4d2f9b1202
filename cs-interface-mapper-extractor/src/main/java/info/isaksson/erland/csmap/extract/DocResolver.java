package info.isaksson.erland.csmap.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers the comment block written directly above a declaration and reduces it to one line
 * of plain text.
 *
 * <p>The walk goes upward from the declaration line. Blank lines and single-line attribute
 * sections are skipped before the first comment line; once collection has started, a blank or
 * code line ends it. Both {@code //}-style runs and one {@code /* ... *}{@code /} block are
 * recognised.</p>
 */
public final class DocResolver {

    private DocResolver() {}

    /** Upper bound of a resolved doc string. */
    public static final int MAX_DOC_CHARS = 4096;
    static final String TRUNCATION_MARKER = "…(truncated)";

    private enum State { SEEKING, COLLECTING_LINES, COLLECTING_BLOCK, DONE }

    private enum LineKind { BLANK, ATTRIBUTE, LINE_COMMENT, BLOCK_END, CODE }

    private static final Pattern SUMMARY = Pattern.compile("(?s)<summary>(.*?)(?:</summary>|$)");
    private static final Pattern REFERENCE_TAG = Pattern.compile(
            "<(?:see|seealso|paramref|typeparamref)\\s+(?:cref|name|langword|href)\\s*=\\s*\"(?:[A-Z]:)?([^\"]*)\"\\s*/?>");
    private static final Pattern KNOWN_TAG = Pattern.compile(
            "</?(?:summary|remarks|returns|param|typeparam|para|c|code|value|example|exception|see|seealso"
                    + "|inheritdoc|list|item|description|term|listheader|br|paramref|typeparamref|b|i)\\b[^>]*>");
    private static final Pattern DECORATION = Pattern.compile("^[-=*#_~/\\\\\\s]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Doc of the first member named {@code memberName} that is introduced by a visibility keyword.
     * Comments are stripped before searching so that a name mentioned inside a comment never
     * matches.
     */
    public static String resolve(String source, String memberName) {
        if (source == null || memberName == null || memberName.isBlank()) return null;
        String text = stripBom(source);
        String[] original = text.split("\n", -1);
        String[] clean = CommentStripper.strip(text).split("\n", -1);
        Pattern declaration = Pattern.compile(
                "\\b(?:public|private|protected|internal)\\b.*(?<!\\w)" + Pattern.quote(memberName) + "(?!\\w)");
        for (int i = 0; i < clean.length; i++) {
            if (declaration.matcher(clean[i]).find()) {
                return resolveAtLine(original, i);
            }
        }
        return null;
    }

    /**
     * Doc for the declaration on zero-based line {@code declarationLine} of {@code lines}, or null
     * when no comment block sits above it.
     */
    public static String resolveAtLine(String[] lines, int declarationLine) {
        if (lines == null || declarationLine <= 0) return null;
        int i = Math.min(declarationLine, lines.length) - 1;

        List<String> collected = new ArrayList<>();
        State state = State.SEEKING;
        while (state != State.DONE && i >= 0) {
            String line = lines[i].trim();
            LineKind kind = classify(line);
            switch (state) {
                case SEEKING:
                    if (kind == LineKind.BLANK || kind == LineKind.ATTRIBUTE) {
                        i--;
                    } else if (kind == LineKind.LINE_COMMENT) {
                        collected.add(line);
                        state = State.COLLECTING_LINES;
                        i--;
                    } else if (kind == LineKind.BLOCK_END) {
                        state = State.COLLECTING_BLOCK;
                    } else {
                        state = State.DONE;
                    }
                    break;
                case COLLECTING_LINES:
                    if (kind == LineKind.LINE_COMMENT) {
                        collected.add(line);
                        i--;
                    } else if (kind == LineKind.ATTRIBUTE) {
                        i--;
                    } else {
                        state = State.DONE;
                    }
                    break;
                case COLLECTING_BLOCK:
                    collected.add(line);
                    if (line.contains("/*")) state = State.DONE;
                    else i--;
                    break;
                default:
                    state = State.DONE;
            }
        }
        Collections.reverse(collected);
        return normalize(collected);
    }

    /**
     * Leading comment block of a file (a {@code //} run or one block comment before any code),
     * or null when absent or shorter than {@code minLength} characters after normalization.
     */
    public static String resolveFileDoc(String source, int minLength) {
        if (source == null) return null;
        String[] lines = stripBom(source).split("\n", -1);
        int i = 0;
        while (i < lines.length && lines[i].trim().isEmpty()) i++;
        if (i >= lines.length) return null;

        List<String> collected = new ArrayList<>();
        String first = lines[i].trim();
        if (first.startsWith("//")) {
            while (i < lines.length && lines[i].trim().startsWith("//")) {
                collected.add(lines[i].trim());
                i++;
            }
        } else if (first.startsWith("/*")) {
            while (i < lines.length) {
                String line = lines[i].trim();
                collected.add(line);
                i++;
                if (line.contains("*/")) break;
            }
        } else {
            return null;
        }

        String doc = normalize(collected);
        if (doc == null || doc.length() < minLength) return null;
        return doc;
    }

    static String normalize(List<String> rawLines) {
        if (rawLines == null || rawLines.isEmpty()) return null;
        StringBuilder sb = new StringBuilder();
        for (String raw : rawLines) {
            String s = stripMarkers(raw);
            if (s.isEmpty() || DECORATION.matcher(s).matches()) continue;
            sb.append(s).append('\n');
        }

        String text = sb.toString();
        Matcher summary = SUMMARY.matcher(text);
        if (summary.find() && !summary.group(1).isBlank()) {
            text = summary.group(1);
        }
        text = REFERENCE_TAG.matcher(text).replaceAll("$1");
        text = KNOWN_TAG.matcher(text).replaceAll(" ");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        if (text.isEmpty()) return null;
        if (text.length() > MAX_DOC_CHARS) {
            text = text.substring(0, MAX_DOC_CHARS) + TRUNCATION_MARKER;
        }
        return text;
    }

    private static String stripMarkers(String raw) {
        String s = raw.trim();
        if (s.startsWith("///")) s = s.substring(3);
        else if (s.startsWith("//")) s = s.substring(2);
        if (s.startsWith("/**")) s = s.substring(3);
        else if (s.startsWith("/*")) s = s.substring(2);
        if (s.endsWith("*/")) s = s.substring(0, s.length() - 2);
        s = s.trim();
        while (s.startsWith("*") && !s.startsWith("**")) {
            s = s.substring(1).trim();
        }
        return s;
    }

    private static LineKind classify(String line) {
        if (line.isEmpty()) return LineKind.BLANK;
        if (line.startsWith("//")) return LineKind.LINE_COMMENT;
        if (line.endsWith("*/")) {
            // Code followed by a trailing comment is still code.
            int open = line.indexOf("/*");
            return line.startsWith("*") || open <= 0 ? LineKind.BLOCK_END : LineKind.CODE;
        }
        if (line.startsWith("[") && line.endsWith("]")) return LineKind.ATTRIBUTE;
        return LineKind.CODE;
    }

    static String stripBom(String s) {
        if (s != null && !s.isEmpty() && s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
