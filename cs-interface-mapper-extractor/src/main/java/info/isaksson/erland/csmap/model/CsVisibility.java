package info.isaksson.erland.csmap.model;

import java.util.Locale;

/** C# accessibility levels, including the two compound forms. */
public enum CsVisibility {
    PUBLIC("public"),
    PROTECTED_INTERNAL("protected internal"),
    PROTECTED("protected"),
    INTERNAL("internal"),
    PRIVATE_PROTECTED("private protected"),
    PRIVATE("private");

    private final String keyword;

    CsVisibility(String keyword) {
        this.keyword = keyword;
    }

    /** Source spelling, e.g. {@code "protected internal"}. */
    public String keyword() {
        return keyword;
    }

    public boolean isPrivate() {
        return this == PRIVATE;
    }

    /**
     * Parse a captured access modifier. Whitespace between compound keywords is normalized and
     * either keyword order is accepted ({@code internal protected} is legal C#).
     *
     * @return the visibility, or {@code null} when {@code raw} is null/blank
     */
    public static CsVisibility parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        switch (s) {
            case "public":
                return PUBLIC;
            case "protected internal":
            case "internal protected":
                return PROTECTED_INTERNAL;
            case "protected":
                return PROTECTED;
            case "internal":
                return INTERNAL;
            case "private protected":
            case "protected private":
                return PRIVATE_PROTECTED;
            case "private":
                return PRIVATE;
            default:
                throw new IllegalArgumentException("Unknown access modifier: " + raw);
        }
    }
}
