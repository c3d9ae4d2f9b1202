package info.isaksson.erland.csmap.emitter;

import info.isaksson.erland.csmap.model.CsEnum;
import info.isaksson.erland.csmap.model.CsMethod;
import info.isaksson.erland.csmap.model.CsModel;
import info.isaksson.erland.csmap.model.CsType;
import info.isaksson.erland.csmap.model.CsUnit;
import info.isaksson.erland.csmap.model.CsVisibility;
import info.isaksson.erland.csmap.model.DependencyEdge;
import info.isaksson.erland.csmap.model.UnitParseFailure;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/** Renders the project-wide index that links all per-unit maps. */
public final class ReadmeWriter {

    private ReadmeWriter() {}

    private static final Comparator<CsUnit> BY_FILE_NAME =
            Comparator.comparing((CsUnit u) -> u.fileName.toLowerCase(Locale.ROOT)).thenComparing(u -> u.id);

    public static String render(CsModel model) {
        List<CsUnit> units = new ArrayList<>(model.units);
        units.sort(BY_FILE_NAME);
        Map<String, String> mapFiles = MapFileNames.assign(model.units);

        List<String> lines = new ArrayList<>();
        lines.add("# Project Interface Map");
        lines.add("");
        lines.add("Auto-generated API surface for **" + units.size() + "** C# scripts.");
        lines.add("Each linked file lists the public API, serialized fields, dependencies");
        lines.add("and Unity lifecycle hooks of one script.");
        lines.add("");

        lines.add("## Script Index");
        lines.add("");
        lines.add("| Script | Classes | Base | Depends On |");
        lines.add("|--------|---------|------|------------|");
        for (CsUnit u : units) {
            String classes = u.types.stream()
                    .map(t -> MarkdownInterfaceMapWriter.code(t.displayName()))
                    .collect(Collectors.joining(", "));
            TreeSet<String> bases = new TreeSet<>();
            for (CsType t : u.types) bases.addAll(t.baseTypes);
            lines.add("| [" + u.fileName + "](" + mapFiles.get(u.id) + ") | " + classes
                    + " | " + codeListOrDash(bases)
                    + " | " + codeListOrDash(targets(u)) + " |");
        }
        lines.add("");

        lines.add("## Dependency Graph (Adjacency)");
        lines.add("```");
        for (CsUnit u : units) {
            for (DependencyEdge e : u.dependencies) {
                lines.add(u.baseName() + " -> " + e.toTypeName);
            }
        }
        lines.add("```");
        lines.add("");

        lines.add("## All Public Methods (Quick Reference)");
        lines.add("");
        for (CsUnit u : units) {
            for (CsType t : u.types) {
                List<CsMethod> api = t.methods.stream()
                        .filter(m -> m.visibility == CsVisibility.PUBLIC)
                        .filter(m -> !UnityConventions.isLifecycleCallback(m.name))
                        .collect(Collectors.toList());
                if (api.isEmpty()) continue;
                lines.add("### " + MarkdownInterfaceMapWriter.code(t.displayName()));
                for (CsMethod m : api) {
                    lines.add("- " + MarkdownInterfaceMapWriter.code(MarkdownInterfaceMapWriter.signature(m)));
                }
                lines.add("");
            }
        }

        List<EnumEntry> enums = new ArrayList<>();
        for (CsUnit u : units) {
            for (CsEnum e : u.topLevelEnums) enums.add(new EnumEntry(u.fileName, null, e));
            for (CsType t : u.types) {
                for (CsEnum e : t.enums) enums.add(new EnumEntry(u.fileName, t.displayName(), e));
            }
        }
        if (!enums.isEmpty()) {
            enums.sort(Comparator.comparing((EnumEntry x) -> x.decl.name).thenComparing(x -> x.fileName));
            lines.add("## All Enums");
            lines.add("");
            for (EnumEntry x : enums) {
                String scope = x.scope == null ? "" : x.scope + ".";
                lines.add("- **" + scope + x.decl.name + "**: "
                        + x.decl.values.stream().map(MarkdownInterfaceMapWriter::code).collect(Collectors.joining(", "))
                        + "  *(in " + x.fileName + ")*");
            }
            lines.add("");
        }

        if (!model.failures.isEmpty()) {
            lines.add("## Skipped Files");
            lines.add("");
            for (UnitParseFailure f : model.failures) {
                lines.add("- " + MarkdownInterfaceMapWriter.code(f.unitId) + ": " + MarkdownInterfaceMapWriter.cell(f.message));
            }
            lines.add("");
        }

        return String.join("\n", lines) + "\n";
    }

    private static List<String> targets(CsUnit u) {
        List<String> out = new ArrayList<>();
        for (DependencyEdge e : u.dependencies) out.add(e.toTypeName);
        return out;
    }

    private static String codeListOrDash(Iterable<String> items) {
        List<String> out = new ArrayList<>();
        for (String s : items) out.add(MarkdownInterfaceMapWriter.code(s));
        return out.isEmpty() ? "—" : String.join(", ", out);
    }

    private static final class EnumEntry {
        final String fileName;
        final String scope;
        final CsEnum decl;

        EnumEntry(String fileName, String scope, CsEnum decl) {
            this.fileName = fileName;
            this.scope = scope;
            this.decl = decl;
        }
    }
}
