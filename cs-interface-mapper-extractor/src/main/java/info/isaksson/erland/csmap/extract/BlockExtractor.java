package info.isaksson.erland.csmap.extract;

/**
 * Balanced-bracket span extraction on a normalized view.
 *
 * <p>Malformed input never fails: when the closing bracket is missing the remainder of the text
 * is returned, so callers can still produce partial output for the rest of the file.</p>
 */
public final class BlockExtractor {

    private BlockExtractor() {}

    /** Span from the brace at {@code openOffset} through its matching {@code '}'}. */
    public static String extract(String text, int openOffset) {
        return extract(text, openOffset, '{', '}');
    }

    public static String extract(String text, int openOffset, char open, char close) {
        if (text == null || openOffset < 0 || openOffset >= text.length()) return "";
        return text.substring(openOffset, endOf(text, openOffset, open, close));
    }

    /**
     * Exclusive end offset of the block opening at {@code openOffset}, or {@code text.length()}
     * when the block is not closed.
     */
    public static int endOf(String text, int openOffset, char open, char close) {
        int depth = 0;
        for (int i = openOffset; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) return i + 1;
            }
        }
        return text.length();
    }

    /** Content between the outer pair; tolerates a missing closing bracket. */
    public static String inner(String block, char close) {
        if (block == null || block.length() < 1) return "";
        int end = block.length();
        if (end >= 2 && block.charAt(end - 1) == close) end--;
        return block.substring(1, end);
    }

    /** Brace depth at {@code offset} relative to the start of {@code text}. */
    static int depthAt(String text, int offset) {
        int depth = 0;
        int end = Math.min(offset, text.length());
        for (int i = 0; i < end; i++) {
            char c = text.charAt(i);
            if (c == '{') depth++;
            else if (c == '}') depth--;
        }
        return depth;
    }
}
