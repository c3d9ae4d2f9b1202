package info.isaksson.erland.csmap.extract;

import java.util.List;

/**
 * A type body in both normalized views, with the bodies of nested types blanked out.
 *
 * <p>{@code offset} is where the body starts in the whole file, so a body-relative position plus
 * {@code offset} is a file offset.</p>
 */
record BodyView(String masked, String clean, int offset) {

    /**
     * Cut {@code [start, end)} out of both views and blank every {@code [from, to)} range in
     * {@code holes} (file offsets). Line breaks are kept.
     */
    static BodyView of(String masked, String clean, int start, int end, List<int[]> holes) {
        char[] m = masked.substring(start, end).toCharArray();
        char[] c = clean.substring(start, end).toCharArray();
        for (int[] hole : holes) {
            int from = Math.max(hole[0], start) - start;
            int to = Math.min(hole[1], end) - start;
            for (int i = from; i < to; i++) {
                if (m[i] != '\n') {
                    m[i] = ' ';
                    c[i] = ' ';
                }
            }
        }
        return new BodyView(new String(m), new String(c), start);
    }
}
