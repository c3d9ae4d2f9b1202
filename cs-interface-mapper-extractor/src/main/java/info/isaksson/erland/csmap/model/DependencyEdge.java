package info.isaksson.erland.csmap.model;

import java.util.Objects;

/**
 * Directed reference from one unit to a type name declared by another unit.
 *
 * <p>Edges are inferred from textual type-name matches and recomputed on every run.</p>
 */
public final class DependencyEdge {
    /** Id of the referencing unit. */
    public final String fromUnit;
    /** Bare type name declared by some other unit. */
    public final String toTypeName;

    public DependencyEdge(String fromUnit, String toTypeName) {
        this.fromUnit = Objects.requireNonNull(fromUnit, "fromUnit");
        this.toTypeName = Objects.requireNonNull(toTypeName, "toTypeName");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencyEdge)) return false;
        DependencyEdge that = (DependencyEdge) o;
        return fromUnit.equals(that.fromUnit) && toTypeName.equals(that.toTypeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromUnit, toTypeName);
    }

    @Override
    public String toString() {
        return fromUnit + " -> " + toTypeName;
    }
}
