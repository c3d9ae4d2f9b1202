package info.isaksson.erland.csmap.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural model of one source file.
 *
 * <p>Everything except {@link #dependencies} is fixed at construction. Dependencies are filled in
 * by a second pass once every unit of the corpus is known.</p>
 */
public final class CsUnit {
    /** Identifier of the file, usually its path relative to the scanned root. */
    public final String id;
    /** Bare file name, e.g. {@code Player.cs}. */
    public final String fileName;
    /** First namespace declared in the file, or null. */
    public final String namespace;
    public final List<String> usings;
    /** Types in document order, nested types included. */
    public final List<CsType> types;
    public final List<CsEnum> topLevelEnums;
    /** Leading file comment, or null when absent or too short to be meaningful. */
    public final String fileDoc;
    /** True when the file contains a conditional compilation guard naming a restricted symbol. */
    public final boolean restrictedBuild;
    /** Restricted symbols actually referenced by {@code #if} directives, in first-seen order. */
    public final List<String> restrictedBuildSymbols;

    /** Resolved cross-unit references, sorted by target name. Populated after all units are parsed. */
    public final List<DependencyEdge> dependencies = new ArrayList<>();

    public CsUnit(String id,
                  String fileName,
                  String namespace,
                  List<String> usings,
                  List<CsType> types,
                  List<CsEnum> topLevelEnums,
                  String fileDoc,
                  List<String> restrictedBuildSymbols) {
        this.id = Objects.requireNonNullElse(id, "");
        this.fileName = Objects.requireNonNullElse(fileName, this.id);
        this.namespace = (namespace == null || namespace.isBlank()) ? null : namespace;
        this.usings = usings == null ? List.of() : List.copyOf(usings);
        this.types = types == null ? List.of() : List.copyOf(types);
        this.topLevelEnums = topLevelEnums == null ? List.of() : List.copyOf(topLevelEnums);
        this.fileDoc = fileDoc;
        this.restrictedBuildSymbols = restrictedBuildSymbols == null ? List.of() : List.copyOf(restrictedBuildSymbols);
        this.restrictedBuild = !this.restrictedBuildSymbols.isEmpty();
    }

    /** Names of the non-nested types this unit declares; these are what other units can depend on. */
    public List<String> primaryTypeNames() {
        List<String> out = new ArrayList<>();
        for (CsType t : types) {
            if (!t.isNested() && !out.contains(t.name)) out.add(t.name);
        }
        return out;
    }

    /** File name without the {@code .cs} extension. */
    public String baseName() {
        String n = fileName;
        int dot = n.lastIndexOf('.');
        return dot > 0 ? n.substring(0, dot) : n;
    }
}
