package info.isaksson.erland.csmap.model;

import java.util.List;
import java.util.Objects;

/** An enum declaration. Only symbolic member names are kept; explicit values are dropped. */
public final class CsEnum {
    public final String name;
    public final CsVisibility visibility;
    /** Member names in declaration order. */
    public final List<String> values;

    public CsEnum(String name, CsVisibility visibility, List<String> values) {
        this.name = Objects.requireNonNullElse(name, "");
        this.visibility = visibility == null ? CsVisibility.INTERNAL : visibility;
        this.values = values == null ? List.of() : List.copyOf(values);
    }
}
