package info.isaksson.erland.csmap.extract;

import info.isaksson.erland.csmap.model.CsEnum;
import info.isaksson.erland.csmap.model.CsField;
import info.isaksson.erland.csmap.model.CsMethod;
import info.isaksson.erland.csmap.model.CsParam;
import info.isaksson.erland.csmap.model.CsProperty;
import info.isaksson.erland.csmap.model.CsTypeKind;
import info.isaksson.erland.csmap.model.CsVisibility;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the surfaced members of one type body.
 *
 * <p>Positions are found on the masked view and text (attribute arguments, default values,
 * parameter lists) is sliced from the clean view at the same offsets.</p>
 */
final class MemberExtractor {

    private MemberExtractor() {}

    private static final String PREFIX = CsSyntax.MEMBER_START
            + "\\s*(?<attrs>(?:" + CsSyntax.ATTRIBUTE + "\\s*)*)";

    /** Access keywords may sit anywhere among the modifiers ({@code static public} is legal). */
    private static String modifiers(String words) {
        return "(?<mods>(?:(?:" + CsSyntax.ACCESS_WORDS + "|" + words + ")\\s+)*)";
    }

    private static final Pattern FIELD = Pattern.compile(PREFIX
            + modifiers("static|readonly|const|new|volatile|unsafe|required")
            + "(?<type>" + CsSyntax.TYPE_CHARS + "+?)\\s+(?<name>@?\\w+)"
            + "\\s*(?:=(?!>)\\s*(?<default>[^;]*?))?\\s*;", Pattern.MULTILINE);

    private static final Pattern PROPERTY = Pattern.compile(PREFIX
            + modifiers("static|virtual|override|abstract|sealed|new|readonly|required|extern|unsafe")
            + "(?<type>" + CsSyntax.TYPE_CHARS + "+?)\\s+(?<name>@?\\w+)"
            + "\\s*(?<open>\\{|=>)", Pattern.MULTILINE);

    private static final Pattern METHOD = Pattern.compile(PREFIX
            + modifiers("static|virtual|override|abstract|sealed|async|new|extern|unsafe|partial|readonly")
            + "(?<type>" + CsSyntax.TYPE_CHARS + "+?)\\s+(?<name>@?\\w+)"
            + "\\s*(?<generics><[^<>(){};]*(?:<[^<>(){};]*>[^<>(){};]*)*>)?\\s*\\(", Pattern.MULTILINE);

    private static final Pattern ACCESSOR = Pattern.compile(
            "(?<![\\w.])(?:(?<access>" + CsSyntax.ACCESS + ")\\s+)?(?<kind>get|set|init)\\s*(?:;|\\{|=>)");

    private static final Pattern HEADER = Pattern.compile("\\bHeader\\s*\\(\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern TOOLTIP = Pattern.compile("\\bTooltip\\s*\\(\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");

    private static final Set<String> COROUTINE_MARKERS = Set.of("IEnumerator", "System.Collections.IEnumerator");
    private static final Set<String> RESERVED_NAMES = Set.of("if", "while", "for", "foreach", "switch", "catch",
            "using", "lock", "return", "nameof", "typeof", "sizeof", "default", "fixed", "when");

    record Members(List<CsField> fields,
                   List<CsProperty> properties,
                   List<CsMethod> methods,
                   List<CsEnum> enums) {}

    /**
     * @param body            body view with nested type bodies blanked
     * @param ownerKind       kind of the enclosing type; interface members default to public
     * @param nestedTypeNames names of types declared directly in this body
     * @param inclusion       matches attributes that surface a non-public field
     * @param docAt           resolves the doc for a file offset
     */
    static Members extract(BodyView body,
                           CsTypeKind ownerKind,
                           Set<String> nestedTypeNames,
                           Pattern inclusion,
                           IntFunction<String> docAt) {
        CsVisibility defaultAccess = ownerKind == CsTypeKind.INTERFACE ? CsVisibility.PUBLIC : CsVisibility.PRIVATE;

        List<CsEnum> enums = extractEnums(body.masked());
        Set<String> siblingNames = new HashSet<>(nestedTypeNames);
        for (CsEnum e : enums) siblingNames.add(e.name);
        int[] depth = braceDepths(body.masked());

        return new Members(
                extractFields(body, depth, defaultAccess, inclusion),
                extractProperties(body, depth, defaultAccess, siblingNames),
                extractMethods(body, depth, defaultAccess, docAt),
                enums);
    }

    /** Brace depth before each offset of {@code text}; members live at depth 0 of a body. */
    static int[] braceDepths(String text) {
        int[] depth = new int[text.length() + 1];
        int d = 0;
        for (int i = 0; i < text.length(); i++) {
            depth[i] = d;
            char c = text.charAt(i);
            if (c == '{') d++;
            else if (c == '}') d--;
        }
        depth[text.length()] = d;
        return depth;
    }

    static List<CsEnum> extractEnums(String masked) {
        List<CsEnum> out = new ArrayList<>();
        for (DeclarationScanner.ScannedEnum e : DeclarationScanner.scanEnums(masked)) {
            CsVisibility v = e.explicitVisibility();
            if (v == null || v == CsVisibility.PUBLIC || v == CsVisibility.INTERNAL) {
                out.add(e.toEnum(CsVisibility.PRIVATE));
            }
        }
        return out;
    }

    static List<CsField> extractFields(BodyView body, int[] depth, CsVisibility defaultAccess, Pattern inclusion) {
        List<CsField> out = new ArrayList<>();
        Matcher m = FIELD.matcher(body.masked());
        while (m.find()) {
            if (depth[m.start()] != 0) continue;
            String type = CsSyntax.squash(m.group("type"));
            if (!isPlausibleType(type)) continue;

            Set<String> mods = DeclarationScanner.words(m.group("mods"));
            CsVisibility visibility = CsSyntax.visibilityOf(mods, defaultAccess);
            String attrs = body.clean().substring(m.start("attrs"), m.end("attrs"));
            boolean serialized = inclusion != null && inclusion.matcher(attrs).find();
            boolean isConst = mods.contains("const");
            boolean isStatic = mods.contains("static");
            boolean isReadonly = mods.contains("readonly");

            boolean surfaced = visibility == CsVisibility.PUBLIC
                    || serialized
                    || ((isConst || (isStatic && isReadonly)) && !visibility.isPrivate());
            if (!surfaced) continue;

            String defaultValue = m.group("default") == null
                    ? null
                    : body.clean().substring(m.start("default"), m.end("default")).trim();
            out.add(new CsField(
                    m.group("name"), type, visibility,
                    isStatic, isReadonly, isConst, serialized,
                    defaultValue,
                    firstGroup(HEADER, attrs),
                    firstGroup(TOOLTIP, attrs)));
        }
        return out;
    }

    static List<CsProperty> extractProperties(BodyView body, int[] depth, CsVisibility defaultAccess,
                                              Set<String> siblingNames) {
        List<CsProperty> out = new ArrayList<>();
        String masked = body.masked();
        Matcher m = PROPERTY.matcher(masked);
        while (m.find()) {
            if (depth[m.start()] != 0) continue;
            String type = CsSyntax.squash(m.group("type"));
            String name = m.group("name");
            if (!isPlausibleType(type)) continue;
            if (CsSyntax.startsWithReserved(type, CsSyntax.RESERVED_PROPERTY_TYPE_TOKENS)) continue;
            if (siblingNames.contains(name) || RESERVED_NAMES.contains(name)) continue;

            Set<String> mods = DeclarationScanner.words(m.group("mods"));
            CsVisibility visibility = CsSyntax.visibilityOf(mods, defaultAccess);
            if (visibility != CsVisibility.PUBLIC) continue;

            boolean hasGetter;
            boolean hasSetter;
            if ("=>".equals(m.group("open"))) {
                hasGetter = true;
                hasSetter = false;
            } else {
                String block = BlockExtractor.extract(masked, m.start("open"));
                boolean[] accessors = publicAccessors(block);
                hasGetter = accessors[0];
                hasSetter = accessors[1];
            }
            out.add(new CsProperty(name, type, visibility, hasGetter, hasSetter, mods.contains("static")));
        }
        return out;
    }

    /**
     * {@code [hasGetter, hasSetter]} for an accessor block. Only accessors directly inside the block
     * count, and an accessor carrying its own access modifier is not part of the public surface.
     */
    static boolean[] publicAccessors(String block) {
        boolean getter = false;
        boolean setter = false;
        Matcher a = ACCESSOR.matcher(block);
        while (a.find()) {
            if (BlockExtractor.depthAt(block, a.start()) != 1) continue;
            if (a.group("access") != null) continue;
            if ("get".equals(a.group("kind"))) getter = true;
            else setter = true;
        }
        return new boolean[] {getter, setter};
    }

    static List<CsMethod> extractMethods(BodyView body, int[] depth, CsVisibility defaultAccess,
                                         IntFunction<String> docAt) {
        List<CsMethod> out = new ArrayList<>();
        String masked = body.masked();
        Matcher m = METHOD.matcher(masked);
        while (m.find()) {
            if (depth[m.start()] != 0) continue;
            String returnType = CsSyntax.squash(m.group("type"));
            String name = m.group("name");
            if (!isPlausibleType(returnType)) continue;
            if (returnType.contains("operator") || RESERVED_NAMES.contains(name)) continue;

            Set<String> mods = DeclarationScanner.words(m.group("mods"));
            CsVisibility visibility = CsSyntax.visibilityOf(mods, defaultAccess);
            boolean isVirtual = mods.contains("virtual");
            boolean isOverride = mods.contains("override");
            boolean isAbstract = mods.contains("abstract");
            boolean surfaced = visibility == CsVisibility.PUBLIC
                    || (!visibility.isPrivate() && (isVirtual || isOverride || isAbstract));
            if (!surfaced) continue;

            int paren = m.end() - 1;
            int end = BlockExtractor.endOf(masked, paren, '(', ')');
            int innerEnd = (end > paren + 1 && masked.charAt(end - 1) == ')') ? end - 1 : end;
            List<CsParam> params = ParameterSplitter.split(body.clean().substring(paren + 1, innerEnd));

            out.add(new CsMethod(
                    name, returnType, visibility,
                    mods.contains("static"), isVirtual, isOverride, isAbstract, mods.contains("async"),
                    COROUTINE_MARKERS.contains(returnType),
                    params,
                    docAt == null ? null : docAt.apply(body.offset() + m.start("mods"))));
        }
        return out;
    }

    private static boolean isPlausibleType(String type) {
        if (type == null || type.isEmpty()) return false;
        if (CsSyntax.startsWithReserved(type, CsSyntax.RESERVED_TYPE_TOKENS)) return false;
        // An access keyword inside the type means the lazy match ran across two declarations.
        return !type.matches(".*\\b(?:public|private|protected|internal|static|class|struct|interface)\\b.*");
    }

    private static String firstGroup(Pattern p, String s) {
        Matcher m = p.matcher(s);
        return m.find() ? m.group(1) : null;
    }
}
