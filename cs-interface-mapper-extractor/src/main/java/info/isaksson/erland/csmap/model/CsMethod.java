package info.isaksson.erland.csmap.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class CsMethod {
    public final String name;
    public final String returnType;
    public final CsVisibility visibility;
    public final boolean isStatic;
    public final boolean isVirtual;
    public final boolean isOverride;
    public final boolean isAbstract;
    public final boolean isAsync;
    /**
     * True when the return type is lexically an iterator marker (e.g. {@code IEnumerator}).
     * This is a naming heuristic, not proof that the body yields.
     */
    public final boolean isCoroutine;
    public final List<CsParam> params;
    /** Documentation preceding the declaration, normalized to one line; null when absent. */
    public final String doc;

    public CsMethod(String name,
                    String returnType,
                    CsVisibility visibility,
                    boolean isStatic,
                    boolean isVirtual,
                    boolean isOverride,
                    boolean isAbstract,
                    boolean isAsync,
                    boolean isCoroutine,
                    List<CsParam> params,
                    String doc) {
        this.name = Objects.requireNonNullElse(name, "");
        this.returnType = Objects.requireNonNullElse(returnType, "void");
        this.visibility = visibility == null ? CsVisibility.PRIVATE : visibility;
        this.isStatic = isStatic;
        this.isVirtual = isVirtual;
        this.isOverride = isOverride;
        this.isAbstract = isAbstract;
        this.isAsync = isAsync;
        this.isCoroutine = isCoroutine;
        this.params = params == null ? List.of() : List.copyOf(new ArrayList<>(params));
        this.doc = doc;
    }
}
