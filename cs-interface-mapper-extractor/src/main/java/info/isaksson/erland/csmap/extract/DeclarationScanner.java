package info.isaksson.erland.csmap.extract;

import info.isaksson.erland.csmap.model.CsEnum;
import info.isaksson.erland.csmap.model.CsTypeKind;
import info.isaksson.erland.csmap.model.CsVisibility;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File-level declaration scan: using directives, namespace, type declarations and top-level enums.
 *
 * <p>Runs on the literal-masked view. Offsets in the returned records are offsets into that view
 * (and therefore into the original text).</p>
 */
final class DeclarationScanner {

    private DeclarationScanner() {}

    private static final Pattern USING = Pattern.compile(
            "^\\s*(?:global\\s+)?using\\s+(?:static\\s+)?(?:\\w+\\s*=\\s*)?(?<name>[\\w.]+)\\s*;",
            Pattern.MULTILINE);

    private static final Pattern NAMESPACE = Pattern.compile(
            "^\\s*namespace\\s+(?<name>[\\w.]+)",
            Pattern.MULTILINE);

    static final Pattern TYPE = Pattern.compile(
            "(?<![\\w.])"
                    + "(?<mods>(?:(?:" + CsSyntax.ACCESS_WORDS + "|abstract|static|partial|sealed|unsafe|new|readonly|ref)\\s+)*)"
                    + "(?<kind>class|struct|interface)\\s+"
                    + "(?<name>\\w+)\\s*"
                    + "(?<generics><[^<>{};]*(?:<[^<>{};]*>[^<>{};]*)*>)?"
                    + "(?:\\s*:(?<bases>[^{;]+?))?"
                    + "(?<where>\\s+where\\s[^{;]*)?"
                    + "\\s*\\{");

    static final Pattern ENUM = Pattern.compile(
            "(?<![\\w.])"
                    + "(?:(?<access>" + CsSyntax.ACCESS + ")\\s+)?"
                    + "(?:new\\s+)?enum\\s+(?<name>\\w+)\\s*"
                    + "(?::\\s*[\\w.]+\\s*)?\\{");

    private static final Pattern WHERE_KEYWORD = Pattern.compile("(?<![\\w.])where(?![\\w.])");
    private static final Pattern IDENTIFIER = Pattern.compile("@?\\w+");

    record ScannedType(String name,
                       CsVisibility explicitVisibility,
                       CsTypeKind kind,
                       Set<String> modifiers,
                       List<String> baseTypes,
                       int headerStart,
                       int braceOffset,
                       int blockEnd) {

        /** True when {@code other} is declared inside this type's body. */
        boolean encloses(ScannedType other) {
            return other != this && braceOffset < other.headerStart && other.blockEnd <= blockEnd;
        }

        boolean isClosed(String text) {
            return blockEnd > braceOffset + 1 && blockEnd <= text.length() && text.charAt(blockEnd - 1) == '}';
        }
    }

    record ScannedEnum(String name, CsVisibility explicitVisibility, List<String> values, int start) {
        CsEnum toEnum(CsVisibility fallback) {
            return new CsEnum(name, explicitVisibility == null ? fallback : explicitVisibility, values);
        }
    }

    record Declarations(List<String> usings,
                        String namespace,
                        List<ScannedType> types,
                        List<ScannedEnum> topLevelEnums) {}

    static Declarations scan(String masked) {
        List<String> usings = new ArrayList<>();
        Matcher um = USING.matcher(masked);
        while (um.find()) {
            usings.add(um.group("name"));
        }

        Matcher nm = NAMESPACE.matcher(masked);
        String namespace = nm.find() ? nm.group("name") : null;

        List<ScannedType> types = scanTypes(masked);

        // Enums after the first type body opens are nested; the member extractor owns those.
        int boundary = types.isEmpty() ? masked.length() : types.get(0).braceOffset();
        List<ScannedEnum> topLevel = new ArrayList<>();
        for (ScannedEnum e : scanEnums(masked)) {
            if (e.start() >= boundary) break;
            topLevel.add(e);
        }
        return new Declarations(usings, namespace, types, topLevel);
    }

    static List<ScannedType> scanTypes(String masked) {
        List<ScannedType> out = new ArrayList<>();
        Matcher m = TYPE.matcher(masked);
        while (m.find()) {
            int brace = m.end() - 1;
            int blockEnd = BlockExtractor.endOf(masked, brace, '{', '}');
            Set<String> mods = words(m.group("mods"));
            out.add(new ScannedType(
                    m.group("name"),
                    CsSyntax.visibilityOf(mods, null),
                    CsTypeKind.fromKeyword(m.group("kind")),
                    mods,
                    splitBaseList(m.group("bases")),
                    m.start(),
                    brace,
                    blockEnd));
            // Continue inside the body so nested types are found too.
            m.region(brace + 1, masked.length());
        }
        return out;
    }

    static List<ScannedEnum> scanEnums(String masked) {
        List<ScannedEnum> out = new ArrayList<>();
        Matcher m = ENUM.matcher(masked);
        while (m.find()) {
            int brace = m.end() - 1;
            String block = BlockExtractor.extract(masked, brace);
            out.add(new ScannedEnum(
                    m.group("name"),
                    CsVisibility.parse(m.group("access")),
                    parseEnumValues(BlockExtractor.inner(block, '}')),
                    m.start()));
        }
        return out;
    }

    /**
     * Split a raw base list on top-level commas. Commas inside generic argument lists do not
     * split, and a {@code where} constraint clause ends the list.
     */
    static List<String> splitBaseList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;

        String s = cutAtTopLevelWhere(raw);
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<' || c == '(') {
                depth++;
            } else if (c == '>' || c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                addBase(out, current);
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        addBase(out, current);
        return out;
    }

    private static String cutAtTopLevelWhere(String s) {
        Matcher w = WHERE_KEYWORD.matcher(s);
        while (w.find()) {
            if (depthOfAngles(s, w.start()) == 0) return s.substring(0, w.start());
        }
        return s;
    }

    private static int depthOfAngles(String s, int end) {
        int depth = 0;
        for (int i = 0; i < end; i++) {
            char c = s.charAt(i);
            if (c == '<') depth++;
            else if (c == '>') depth--;
        }
        return depth;
    }

    private static void addBase(List<String> out, StringBuilder current) {
        String b = CsSyntax.squash(current.toString());
        if (b != null && !b.isEmpty()) out.add(b);
    }

    /** Symbolic member names of an enum body; explicit values and attributes are dropped. */
    static List<String> parseEnumValues(String inner) {
        List<String> values = new ArrayList<>();
        if (inner == null) return values;
        String body = inner.replaceAll(CsSyntax.ATTRIBUTE, " ");
        for (String part : body.split(",")) {
            String p = part;
            int eq = p.indexOf('=');
            if (eq >= 0) p = p.substring(0, eq);
            p = p.trim();
            if (p.isEmpty()) continue;
            if (IDENTIFIER.matcher(p).matches()) values.add(p);
        }
        return values;
    }

    static Set<String> words(String s) {
        Set<String> out = new LinkedHashSet<>();
        if (s == null) return out;
        for (String w : s.trim().split("\\s+")) {
            if (!w.isEmpty()) out.add(w);
        }
        return out;
    }
}
