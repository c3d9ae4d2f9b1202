package info.isaksson.erland.csmap.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A class, struct or interface declaration and the members surfaced by the inclusion policy.
 *
 * <p>Nested types are separate {@code CsType} instances in the owning unit's type list, with
 * {@link #outerName} naming the directly enclosing type. Members of a nested type are never
 * repeated on the enclosing type.</p>
 */
public final class CsType {
    public final String name;
    public final CsVisibility visibility;
    public final CsTypeKind kind;
    public final boolean isAbstract;
    public final boolean isStatic;
    public final boolean isPartial;
    public final boolean isSealed;

    /**
     * Base list in declaration order. The first entry may be a superclass, the rest implemented
     * interfaces; the parser does not tell them apart.
     */
    public final List<String> baseTypes;

    public final List<CsField> fields;
    public final List<CsProperty> properties;
    /** Overloads are kept as separate entries. */
    public final List<CsMethod> methods;
    public final List<CsEnum> enums;

    /** Documentation preceding the declaration, or null. */
    public final String doc;

    /** Dotted chain of enclosing types (e.g. {@code Outer.Middle}) when nested, otherwise null. */
    public final String outerName;

    /** Zero-based line of the declaration keyword in the source file. */
    public final int declarationLine;

    public CsType(String name,
                  CsVisibility visibility,
                  CsTypeKind kind,
                  boolean isAbstract,
                  boolean isStatic,
                  boolean isPartial,
                  boolean isSealed,
                  List<String> baseTypes,
                  List<CsField> fields,
                  List<CsProperty> properties,
                  List<CsMethod> methods,
                  List<CsEnum> enums,
                  String doc,
                  String outerName,
                  int declarationLine) {
        this.name = Objects.requireNonNullElse(name, "");
        this.visibility = visibility == null ? CsVisibility.INTERNAL : visibility;
        this.kind = kind == null ? CsTypeKind.CLASS : kind;
        this.isAbstract = isAbstract;
        this.isStatic = isStatic;
        this.isPartial = isPartial;
        this.isSealed = isSealed;
        this.baseTypes = baseTypes == null ? List.of() : List.copyOf(baseTypes);
        this.fields = fields == null ? List.of() : List.copyOf(new ArrayList<>(fields));
        this.properties = properties == null ? List.of() : List.copyOf(new ArrayList<>(properties));
        this.methods = methods == null ? List.of() : List.copyOf(new ArrayList<>(methods));
        this.enums = enums == null ? List.of() : List.copyOf(new ArrayList<>(enums));
        this.doc = doc;
        this.outerName = (outerName == null || outerName.isBlank()) ? null : outerName;
        this.declarationLine = declarationLine;
    }

    public boolean isNested() {
        return outerName != null;
    }

    /** Dotted name including enclosing types, e.g. {@code Outer.Inner}. */
    public String displayName() {
        return outerName == null ? name : outerName + "." + name;
    }
}
