package info.isaksson.erland.csmap.extract;

/**
 * Lexical normalizer: produces "clean" views of C# source for structural matching.
 *
 * <p>Both views have exactly the same length as the input and keep every line break, so an
 * offset or line number found in a view is valid in the original text as well.</p>
 * <ul>
 *   <li>{@link #strip(String)} blanks {@code //} and {@code /* *}{@code /} comments and keeps
 *   string/char literals as written (attribute arguments and default values are read from it).</li>
 *   <li>{@link #maskLiterals(String)} additionally blanks literal contents (quotes stay), so that
 *   braces, semicolons and commas inside strings cannot disturb brace matching or splitting.</li>
 * </ul>
 *
 * <p>Literals are recognised (regular, verbatim {@code @"..."}, interpolated {@code $"..."},
 * raw {@code """...""" } and char literals), so comment markers inside a string are not treated
 * as comments.</p>
 */
public final class CommentStripper {

    private CommentStripper() {}

    public static String strip(String src) {
        return normalize(src, false);
    }

    public static String maskLiterals(String src) {
        return normalize(src, true);
    }

    /** Zero-based line number of {@code offset} in {@code text}. */
    public static int lineOf(String text, int offset) {
        int line = 0;
        int end = Math.min(offset, text.length());
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }

    private static String normalize(String src, boolean maskLiterals) {
        if (src == null || src.isEmpty()) return src == null ? "" : src;
        char[] out = src.toCharArray();
        int n = out.length;
        int i = 0;
        while (i < n) {
            char c = src.charAt(i);
            char next = i + 1 < n ? src.charAt(i + 1) : '\0';

            if (c == '/' && next == '/') {
                while (i < n && src.charAt(i) != '\n') {
                    blank(out, i);
                    i++;
                }
                continue;
            }
            if (c == '/' && next == '*') {
                blank(out, i);
                blank(out, i + 1);
                i += 2;
                while (i < n) {
                    if (src.charAt(i) == '*' && i + 1 < n && src.charAt(i + 1) == '/') {
                        blank(out, i);
                        blank(out, i + 1);
                        i += 2;
                        break;
                    }
                    blank(out, i);
                    i++;
                }
                continue;
            }
            if (c == '"' && src.startsWith("\"\"\"", i)) {
                i = skipRawString(src, out, i, maskLiterals);
                continue;
            }
            if (c == '@' && next == '"') {
                i = skipVerbatimString(src, out, i + 1, maskLiterals);
                continue;
            }
            if ((c == '$' && next == '@' || c == '@' && next == '$') && i + 2 < n && src.charAt(i + 2) == '"') {
                i = skipVerbatimString(src, out, i + 2, maskLiterals);
                continue;
            }
            if (c == '"') {
                i = skipQuoted(src, out, i, '"', maskLiterals);
                continue;
            }
            if (c == '\'') {
                i = skipQuoted(src, out, i, '\'', maskLiterals);
                continue;
            }
            i++;
        }
        return new String(out);
    }

    /** Regular string or char literal starting at the opening quote; stops at an unescaped quote or end of line. */
    private static int skipQuoted(String src, char[] out, int open, char quote, boolean mask) {
        int i = open + 1;
        int n = src.length();
        while (i < n) {
            char c = src.charAt(i);
            if (c == '\n') return i;
            if (c == '\\' && i + 1 < n && src.charAt(i + 1) != '\n') {
                if (mask) {
                    blank(out, i);
                    blank(out, i + 1);
                }
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            if (mask) blank(out, i);
            i++;
        }
        return n;
    }

    /** Verbatim string; {@code ""} is an escaped quote and line breaks are allowed. */
    private static int skipVerbatimString(String src, char[] out, int quotePos, boolean mask) {
        int i = quotePos + 1;
        int n = src.length();
        while (i < n) {
            char c = src.charAt(i);
            if (c == '"') {
                if (i + 1 < n && src.charAt(i + 1) == '"') {
                    if (mask) {
                        blank(out, i);
                        blank(out, i + 1);
                    }
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            if (mask) blank(out, i);
            i++;
        }
        return n;
    }

    private static int skipRawString(String src, char[] out, int open, boolean mask) {
        int quotes = 0;
        int i = open;
        int n = src.length();
        while (i < n && src.charAt(i) == '"') {
            quotes++;
            i++;
        }
        String closing = "\"".repeat(quotes);
        int end = src.indexOf(closing, i);
        int stop = end < 0 ? n : end;
        if (mask) {
            for (int k = i; k < stop; k++) blank(out, k);
        }
        return end < 0 ? n : end + quotes;
    }

    private static void blank(char[] out, int i) {
        if (i < out.length && out[i] != '\n' && out[i] != '\r') out[i] = ' ';
    }
}
