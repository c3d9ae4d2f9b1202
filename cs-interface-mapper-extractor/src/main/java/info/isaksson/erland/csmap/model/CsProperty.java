package info.isaksson.erland.csmap.model;

import java.util.Objects;

public final class CsProperty {
    public final String name;
    public final String type;
    public final CsVisibility visibility;
    /** A getter exists and is not narrowed by its own access modifier. */
    public final boolean hasGetter;
    /** A setter (or init accessor) exists and is not narrowed by its own access modifier. */
    public final boolean hasSetter;
    public final boolean isStatic;

    public CsProperty(String name, String type, CsVisibility visibility,
                      boolean hasGetter, boolean hasSetter, boolean isStatic) {
        this.name = Objects.requireNonNullElse(name, "");
        this.type = Objects.requireNonNullElse(type, "?");
        this.visibility = visibility == null ? CsVisibility.PUBLIC : visibility;
        this.hasGetter = hasGetter;
        this.hasSetter = hasSetter;
        this.isStatic = isStatic;
    }
}
