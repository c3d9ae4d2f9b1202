package info.isaksson.erland.csmap.extract;

import info.isaksson.erland.csmap.model.CsParam;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits the text between a method's parentheses into parameters.
 *
 * <p>Commas nested in generic argument lists, parentheses, brackets or literals do not split.
 * Each fragment is reduced to (type, name, default); a fragment without whitespace is taken as a
 * bare name whose type is {@link CsParam#UNKNOWN_TYPE}.</p>
 */
public final class ParameterSplitter {

    private ParameterSplitter() {}

    private static final Set<String> MODIFIERS = Set.of("ref", "out", "in", "params", "this", "scoped", "readonly");

    public static List<CsParam> split(String raw) {
        List<CsParam> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String fragment : splitTopLevel(raw)) {
            CsParam p = parseFragment(fragment);
            if (p != null) out.add(p);
        }
        return out;
    }

    /** Top-level comma split; empty fragments are dropped. */
    static List<String> splitTopLevel(String raw) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        int n = raw.length();
        while (i < n) {
            char c = raw.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipLiteral(raw, i, c);
                continue;
            }
            if (c == '<' || c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == '>' || c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                addFragment(out, raw.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        addFragment(out, raw.substring(start));
        return out;
    }

    static CsParam parseFragment(String fragment) {
        String s = fragment.trim();
        while (s.startsWith("[")) {
            int end = BlockExtractor.endOf(s, 0, '[', ']');
            s = s.substring(end).trim();
        }

        String modifier = null;
        while (true) {
            int ws = firstWhitespace(s);
            if (ws < 0) break;
            String word = s.substring(0, ws);
            if (!MODIFIERS.contains(word)) break;
            modifier = modifier == null ? word : modifier + " " + word;
            s = s.substring(ws).trim();
        }

        String defaultValue = null;
        int eq = topLevelIndexOf(s, '=');
        if (eq >= 0) {
            defaultValue = s.substring(eq + 1).trim();
            if (defaultValue.isEmpty()) defaultValue = null;
            s = s.substring(0, eq).trim();
        }
        if (s.isEmpty()) return null;

        int ws = lastTopLevelWhitespace(s);
        if (ws < 0) {
            return new CsParam(s, CsParam.UNKNOWN_TYPE, defaultValue, modifier);
        }
        String type = CsSyntax.squash(s.substring(0, ws));
        String name = s.substring(ws + 1).trim();
        return new CsParam(name, type, defaultValue, modifier);
    }

    private static void addFragment(List<String> out, String fragment) {
        String f = fragment.trim();
        if (!f.isEmpty()) out.add(f);
    }

    private static int skipLiteral(String s, int open, char quote) {
        int i = open + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            i++;
        }
        return s.length();
    }

    private static int firstWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }

    private static int topLevelIndexOf(String s, char target) {
        int depth = 0;
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipLiteral(s, i, c);
                continue;
            }
            if (c == '<' || c == '(' || c == '[') depth++;
            else if (c == '>' || c == ')' || c == ']') depth = Math.max(0, depth - 1);
            else if (c == target && depth == 0) return i;
            i++;
        }
        return -1;
    }

    private static int lastTopLevelWhitespace(String s) {
        int depth = 0;
        int last = -1;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<' || c == '(' || c == '[') depth++;
            else if (c == '>' || c == ')' || c == ']') depth = Math.max(0, depth - 1);
            else if (Character.isWhitespace(c) && depth == 0) last = i;
        }
        return last;
    }
}
