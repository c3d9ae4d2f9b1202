package info.isaksson.erland.csmap.emitter;

import info.isaksson.erland.csmap.model.CsEnum;
import info.isaksson.erland.csmap.model.CsField;
import info.isaksson.erland.csmap.model.CsMethod;
import info.isaksson.erland.csmap.model.CsParam;
import info.isaksson.erland.csmap.model.CsProperty;
import info.isaksson.erland.csmap.model.CsType;
import info.isaksson.erland.csmap.model.CsUnit;
import info.isaksson.erland.csmap.model.CsVisibility;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the interface map of one source unit as Markdown.
 *
 * <p>Output depends only on the unit, so rendering is deterministic and may run for several
 * units concurrently.</p>
 */
public final class MarkdownInterfaceMapWriter {

    private MarkdownInterfaceMapWriter() {}

    public static String render(CsUnit unit) {
        List<String> lines = new ArrayList<>();
        lines.add("# " + unit.fileName);
        lines.add("");

        if (unit.namespace != null) {
            lines.add("**Namespace:** `" + unit.namespace + "`");
            lines.add("");
        }

        if (!unit.dependencies.isEmpty()) {
            lines.add("**Depends on:** " + unit.dependencies.stream()
                    .map(e -> code(e.toTypeName))
                    .collect(Collectors.joining(", ")));
            lines.add("");
        }

        if (unit.restrictedBuild) {
            lines.add("**Build-restricted:** compiled only under " + unit.restrictedBuildSymbols.stream()
                    .map(MarkdownInterfaceMapWriter::code)
                    .collect(Collectors.joining(", ")));
            lines.add("");
        }

        if (unit.fileDoc != null) {
            lines.add("> " + unit.fileDoc);
            lines.add("");
        }

        for (CsEnum e : unit.topLevelEnums) {
            lines.add("## enum " + code(e.name));
            lines.add(enumValues(e));
            lines.add("");
        }

        for (CsType type : unit.types) {
            renderType(lines, type);
        }

        return String.join("\n", lines) + "\n";
    }

    private static void renderType(List<String> lines, CsType type) {
        lines.add(typeHeader(type));
        lines.add("");
        if (type.doc != null) {
            lines.add(type.doc);
            lines.add("");
        }

        for (CsEnum e : type.enums) {
            lines.add("### enum " + code(e.name));
            lines.add(enumValues(e));
            lines.add("");
        }

        List<CsField> publicFields = new ArrayList<>();
        List<CsField> serialized = new ArrayList<>();
        List<CsField> constants = new ArrayList<>();
        for (CsField f : type.fields) {
            if (f.visibility == CsVisibility.PUBLIC) publicFields.add(f);
            else if (f.isSerialized) serialized.add(f);
            else constants.add(f);
        }

        if (!publicFields.isEmpty()) {
            lines.add("### Public Fields");
            fieldTable(lines, publicFields, true);
        }
        if (!serialized.isEmpty()) {
            lines.add("### Serialized Fields (Inspector)");
            fieldTable(lines, serialized, false);
        }
        if (!constants.isEmpty()) {
            lines.add("### Constants (protected/internal)");
            fieldTable(lines, constants, true);
        }

        if (!type.properties.isEmpty()) {
            lines.add("### Properties");
            lines.add("| Type | Name | get | set | Notes |");
            lines.add("|------|------|-----|-----|-------|");
            for (CsProperty p : type.properties) {
                lines.add("| " + code(p.type) + " | " + code(p.name)
                        + " | " + (p.hasGetter ? "✓" : "—")
                        + " | " + (p.hasSetter ? "✓" : "—")
                        + " | " + (p.isStatic ? "static" : "") + " |");
            }
            lines.add("");
        }

        boolean unityType = UnityConventions.isUnityType(type);
        List<CsMethod> lifecycle = new ArrayList<>();
        List<CsMethod> publicApi = new ArrayList<>();
        List<CsMethod> overridable = new ArrayList<>();
        for (CsMethod m : type.methods) {
            if (unityType && UnityConventions.isLifecycleCallback(m.name)) {
                lifecycle.add(m);
            } else if (m.visibility == CsVisibility.PUBLIC) {
                publicApi.add(m);
            } else {
                overridable.add(m);
            }
        }

        if (!lifecycle.isEmpty()) {
            lines.add("### Unity Lifecycle");
            lines.add(lifecycle.stream().map(m -> code(m.name)).collect(Collectors.joining(", ")));
            lines.add("");
        }

        if (!publicApi.isEmpty()) {
            lines.add("### Public Methods");
            for (CsMethod m : publicApi) {
                List<String> mods = new ArrayList<>();
                if (m.isStatic) mods.add("static");
                if (m.isAsync) mods.add("async");
                if (m.isCoroutine) mods.add("coroutine");
                if (m.isVirtual) mods.add("virtual");
                if (m.isAbstract) mods.add("abstract");
                if (m.isOverride) mods.add("override");
                methodLine(lines, m, mods);
            }
            lines.add("");
        }

        if (!overridable.isEmpty()) {
            lines.add("### Overridable (protected/internal)");
            for (CsMethod m : overridable) {
                List<String> mods = new ArrayList<>();
                mods.add(m.visibility.keyword());
                if (m.isVirtual) mods.add("virtual");
                if (m.isAbstract) mods.add("abstract");
                if (m.isOverride) mods.add("override");
                methodLine(lines, m, mods);
            }
            lines.add("");
        }
    }

    static String typeHeader(CsType type) {
        StringBuilder sb = new StringBuilder("## ");
        sb.append(type.visibility.keyword()).append(' ');
        if (type.isAbstract) sb.append("abstract ");
        if (type.isStatic) sb.append("static ");
        if (type.isSealed) sb.append("sealed ");
        if (type.isPartial) sb.append("partial ");
        sb.append(type.kind.keyword()).append(' ').append(code(type.displayName()));
        if (!type.baseTypes.isEmpty()) {
            sb.append(" : ").append(type.baseTypes.stream()
                    .map(MarkdownInterfaceMapWriter::code)
                    .collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }

    static String signature(CsMethod m) {
        return m.returnType + " " + m.name + "("
                + m.params.stream().map(MarkdownInterfaceMapWriter::param).collect(Collectors.joining(", "))
                + ")";
    }

    private static String param(CsParam p) {
        String s = p.hasKnownType() ? p.type + " " + p.name : p.name;
        if (p.modifier != null) s = p.modifier + " " + s;
        if (p.defaultValue != null) s += " = " + p.defaultValue;
        return s;
    }

    private static void methodLine(List<String> lines, CsMethod m, List<String> mods) {
        String modText = mods.isEmpty() ? "" : " *[" + String.join(", ", mods) + "]*";
        lines.add("- " + code(signature(m)) + modText);
        if (m.doc != null) {
            lines.add("  " + m.doc);
        }
    }

    private static void fieldTable(List<String> lines, List<CsField> fields, boolean withModifiers) {
        lines.add("| Type | Name | Notes |");
        lines.add("|------|------|-------|");
        for (CsField f : fields) {
            List<String> notes = new ArrayList<>();
            if (withModifiers) {
                if (f.isConst) notes.add("const");
                if (f.isStatic) notes.add("static");
                if (f.isReadonly) notes.add("readonly");
            }
            if (f.defaultValue != null) notes.add("= " + f.defaultValue);
            if (f.header != null) notes.add("header: " + f.header);
            if (f.tooltip != null) notes.add("tooltip: " + f.tooltip);
            lines.add("| " + code(f.type) + " | " + code(f.name) + " | " + cell(String.join(", ", notes)) + " |");
        }
        lines.add("");
    }

    static String enumValues(CsEnum e) {
        return "Values: " + e.values.stream().map(MarkdownInterfaceMapWriter::code).collect(Collectors.joining(", "));
    }

    static String code(String s) {
        return "`" + cell(s) + "`";
    }

    /** Table cells cannot hold raw pipes or line breaks. */
    static String cell(String s) {
        if (s == null) return "";
        return s.replace("|", "\\|").replace("\r", "").replace("\n", " ");
    }
}
