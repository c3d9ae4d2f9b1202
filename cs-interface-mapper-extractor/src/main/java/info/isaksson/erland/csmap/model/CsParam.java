package info.isaksson.erland.csmap.model;

import java.util.Objects;

public final class CsParam {
    /** Type placeholder used when the type could not be separated from the name. */
    public static final String UNKNOWN_TYPE = "?";

    public final String name;
    public final String type;
    /** Default value text after {@code =}, or null. */
    public final String defaultValue;
    /** Passing modifier ({@code ref}, {@code out}, {@code in}, {@code params}, {@code this}), or null. */
    public final String modifier;

    public CsParam(String name, String type, String defaultValue) {
        this(name, type, defaultValue, null);
    }

    public CsParam(String name, String type, String defaultValue, String modifier) {
        this.name = Objects.requireNonNullElse(name, "");
        this.type = (type == null || type.isBlank()) ? UNKNOWN_TYPE : type;
        this.defaultValue = defaultValue;
        this.modifier = modifier;
    }

    public boolean hasKnownType() {
        return !UNKNOWN_TYPE.equals(type);
    }

    @Override
    public String toString() {
        return type + " " + name + (defaultValue == null ? "" : " = " + defaultValue);
    }
}
