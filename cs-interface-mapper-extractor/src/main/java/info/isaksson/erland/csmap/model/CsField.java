package info.isaksson.erland.csmap.model;

import java.util.Objects;

public final class CsField {
    public final String name;
    /** Declared type exactly as written (generic brackets, arrays and nullable markers kept). */
    public final String type;
    public final CsVisibility visibility;
    public final boolean isStatic;
    public final boolean isReadonly;
    public final boolean isConst;
    /** True when the field carries an inclusion attribute such as {@code [SerializeField]}. */
    public final boolean isSerialized;
    /** Literal initializer text, or null. */
    public final String defaultValue;
    /** {@code [Header("...")]} grouping label, or null. */
    public final String header;
    /** {@code [Tooltip("...")]} description, or null. */
    public final String tooltip;

    public CsField(String name, String type, CsVisibility visibility,
                   boolean isStatic, boolean isReadonly, boolean isConst, boolean isSerialized,
                   String defaultValue) {
        this(name, type, visibility, isStatic, isReadonly, isConst, isSerialized, defaultValue, null, null);
    }

    public CsField(String name,
                   String type,
                   CsVisibility visibility,
                   boolean isStatic,
                   boolean isReadonly,
                   boolean isConst,
                   boolean isSerialized,
                   String defaultValue,
                   String header,
                   String tooltip) {
        this.name = Objects.requireNonNullElse(name, "");
        this.type = Objects.requireNonNullElse(type, "?");
        this.visibility = visibility == null ? CsVisibility.PRIVATE : visibility;
        this.isStatic = isStatic;
        this.isReadonly = isReadonly;
        this.isConst = isConst;
        this.isSerialized = isSerialized;
        this.defaultValue = blankToNull(defaultValue);
        this.header = blankToNull(header);
        this.tooltip = blankToNull(tooltip);
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
