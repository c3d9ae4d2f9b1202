package info.isaksson.erland.csmap.extract;

import info.isaksson.erland.csmap.model.CsVisibility;

import java.util.Set;

/**
 * Regex fragments and keyword sets shared by the scanners.
 *
 * <p>All patterns are meant to run on the literal-masked view produced by
 * {@link CommentStripper#maskLiterals(String)}.</p>
 */
final class CsSyntax {

    private CsSyntax() {}

    /** Access modifiers; compound forms must come before their single-word prefixes. */
    static final String ACCESS =
            "public|private\\s+protected|protected\\s+private|protected\\s+internal|internal\\s+protected"
                    + "|private|protected|internal";

    /** Single access keywords, for modifier runs where they may be mixed with other modifiers. */
    static final String ACCESS_WORDS = "public|private|protected|internal";

    /** Characters a type expression may consist of (generics, arrays, nullable, qualified names, tuples' commas). */
    static final String TYPE_CHARS = "[\\w<>\\[\\],\\s?.]";

    /** One attribute section. Literal contents are masked, so no brackets can hide inside strings. */
    static final String ATTRIBUTE = "\\[[^\\[\\]]*\\]";

    /** A member declaration starts at a line start or right after a statement/block boundary. */
    static final String MEMBER_START = "(?:^|(?<=[;{}]))";

    /** Tokens that can never start a member's type; guards against statements read as declarations. */
    static final Set<String> RESERVED_TYPE_TOKENS = Set.of(
            "return", "yield", "var", "throw", "new", "else", "await", "using", "goto", "case",
            "delegate", "operator", "implicit", "explicit", "if", "while", "for", "foreach", "switch", "lock",
            "do", "try", "catch", "finally", "break", "continue", "default", "checked", "unchecked", "fixed");

    /** Additional tokens rejected for properties: a type header followed by '{' looks like a property. */
    static final Set<String> RESERVED_PROPERTY_TYPE_TOKENS = Set.of(
            "class", "enum", "struct", "interface", "event", "record", "namespace");

    /** True when the first word of {@code type} (or the whole of it) is reserved. */
    static boolean startsWithReserved(String type, Set<String> reserved) {
        if (type == null) return true;
        String t = type.trim();
        if (t.isEmpty()) return true;
        int end = 0;
        while (end < t.length() && (Character.isLetterOrDigit(t.charAt(end)) || t.charAt(end) == '_')) end++;
        String first = t.substring(0, end);
        return reserved.contains(first) || reserved.contains(t);
    }

    /** Collapse internal whitespace runs (types may be written across lines). */
    static String squash(String s) {
        if (s == null) return null;
        return s.trim().replaceAll("\\s+", " ");
    }

    /** Visibility named by the access keywords among {@code mods}, in whatever order they were written. */
    static CsVisibility visibilityOf(Set<String> mods, CsVisibility fallback) {
        boolean isProtected = mods.contains("protected");
        if (mods.contains("public")) return CsVisibility.PUBLIC;
        if (isProtected && mods.contains("internal")) return CsVisibility.PROTECTED_INTERNAL;
        if (isProtected && mods.contains("private")) return CsVisibility.PRIVATE_PROTECTED;
        if (isProtected) return CsVisibility.PROTECTED;
        if (mods.contains("internal")) return CsVisibility.INTERNAL;
        if (mods.contains("private")) return CsVisibility.PRIVATE;
        return fallback;
    }
}
