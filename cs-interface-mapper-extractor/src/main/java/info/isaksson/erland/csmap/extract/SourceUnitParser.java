package info.isaksson.erland.csmap.extract;

import info.isaksson.erland.csmap.io.SourceText;
import info.isaksson.erland.csmap.model.CsEnum;
import info.isaksson.erland.csmap.model.CsType;
import info.isaksson.erland.csmap.model.CsUnit;
import info.isaksson.erland.csmap.model.CsVisibility;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses one source unit into a {@link CsUnit}. Stateless apart from its options, so a single
 * instance is shared by all worker threads.
 */
public final class SourceUnitParser {

    private static final Logger logger = LogManager.getLogger(SourceUnitParser.class);

    private static final Pattern CONDITIONAL = Pattern.compile("^[ \\t]*#[ \\t]*(?:el)?if\\b(.*)$", Pattern.MULTILINE);

    private final ExtractionOptions options;
    private final Pattern inclusionPattern;
    private final List<Pattern> restrictedSymbolPatterns;

    public SourceUnitParser() {
        this(new ExtractionOptions());
    }

    public SourceUnitParser(ExtractionOptions options) {
        this.options = options == null ? new ExtractionOptions() : options;
        this.inclusionPattern = wordAlternation(this.options.inclusionAttributes);
        this.restrictedSymbolPatterns = new ArrayList<>();
        for (String symbol : this.options.restrictedBuildSymbols) {
            restrictedSymbolPatterns.add(Pattern.compile("(?<!\\w)" + Pattern.quote(symbol) + "(?!\\w)"));
        }
    }

    public CsUnit parse(SourceText source) {
        String text = DocResolver.stripBom(source.text);
        String clean = CommentStripper.strip(text);
        String masked = CommentStripper.maskLiterals(text);
        String[] lines = text.split("\n", -1);
        LineIndex index = new LineIndex(text);

        DeclarationScanner.Declarations decl = DeclarationScanner.scan(masked);
        List<DeclarationScanner.ScannedType> scanned = decl.types();

        List<CsType> types = new ArrayList<>();
        for (DeclarationScanner.ScannedType st : scanned) {
            DeclarationScanner.ScannedType outer = innermostEnclosing(st, scanned);

            CsVisibility visibility = st.explicitVisibility() != null
                    ? st.explicitVisibility()
                    : (outer == null ? CsVisibility.INTERNAL : CsVisibility.PRIVATE);

            int bodyStart = st.braceOffset() + 1;
            int bodyEnd = st.isClosed(masked) ? st.blockEnd() - 1 : st.blockEnd();
            List<int[]> holes = new ArrayList<>();
            Set<String> nestedNames = new LinkedHashSet<>();
            for (DeclarationScanner.ScannedType inner : scanned) {
                if (!st.encloses(inner)) continue;
                holes.add(new int[] {inner.headerStart(), inner.blockEnd()});
                if (innermostEnclosing(inner, scanned) == st) nestedNames.add(inner.name());
            }
            BodyView body = BodyView.of(masked, clean, bodyStart, Math.max(bodyStart, bodyEnd), holes);

            MemberExtractor.Members members = MemberExtractor.extract(
                    body, st.kind(), nestedNames, inclusionPattern,
                    offset -> DocResolver.resolveAtLine(lines, index.lineOf(offset)));

            int headerLine = index.lineOf(st.headerStart());
            types.add(new CsType(
                    st.name(),
                    visibility,
                    st.kind(),
                    st.modifiers().contains("abstract"),
                    st.modifiers().contains("static"),
                    st.modifiers().contains("partial"),
                    st.modifiers().contains("sealed"),
                    st.baseTypes(),
                    members.fields(),
                    members.properties(),
                    members.methods(),
                    members.enums(),
                    DocResolver.resolveAtLine(lines, headerLine),
                    outer == null ? null : qualifiedName(outer, scanned),
                    headerLine));
        }

        List<CsEnum> topLevelEnums = new ArrayList<>();
        for (DeclarationScanner.ScannedEnum e : decl.topLevelEnums()) {
            topLevelEnums.add(e.toEnum(CsVisibility.INTERNAL));
        }

        List<String> restrictedSymbols = restrictedSymbols(clean);
        CsUnit unit = new CsUnit(
                source.id,
                source.fileName,
                decl.namespace(),
                decl.usings(),
                types,
                topLevelEnums,
                DocResolver.resolveFileDoc(text, options.minFileDocChars),
                restrictedSymbols);
        logger.debug("Parsed {}: {} type(s), {} top-level enum(s)", source.id, types.size(), topLevelEnums.size());
        return unit;
    }

    private List<String> restrictedSymbols(String clean) {
        List<String> found = new ArrayList<>();
        Matcher m = CONDITIONAL.matcher(clean);
        while (m.find()) {
            String condition = m.group(1);
            int i = 0;
            for (String symbol : options.restrictedBuildSymbols) {
                if (!found.contains(symbol) && restrictedSymbolPatterns.get(i).matcher(condition).find()) {
                    found.add(symbol);
                }
                i++;
            }
        }
        return found;
    }

    private static DeclarationScanner.ScannedType innermostEnclosing(DeclarationScanner.ScannedType t,
                                                                     List<DeclarationScanner.ScannedType> all) {
        DeclarationScanner.ScannedType best = null;
        for (DeclarationScanner.ScannedType candidate : all) {
            if (!candidate.encloses(t)) continue;
            if (best == null || best.encloses(candidate)) best = candidate;
        }
        return best;
    }

    /** Dotted name of a type including its own enclosing types. */
    private static String qualifiedName(DeclarationScanner.ScannedType t, List<DeclarationScanner.ScannedType> all) {
        DeclarationScanner.ScannedType outer = innermostEnclosing(t, all);
        return outer == null ? t.name() : qualifiedName(outer, all) + "." + t.name();
    }

    private static Pattern wordAlternation(Set<String> words) {
        if (words == null || words.isEmpty()) return null;
        String alternation = words.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        return Pattern.compile("(?<![\\w.])(?:\\w+\\.)*(?:" + alternation + ")(?:Attribute)?(?!\\w)");
    }

    /** Offset to zero-based line lookups in O(log n). */
    private static final class LineIndex {
        private final int[] lineStarts;

        LineIndex(String text) {
            int count = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') count++;
            }
            lineStarts = new int[count];
            int line = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') lineStarts[line++] = i + 1;
            }
        }

        int lineOf(int offset) {
            int pos = Arrays.binarySearch(lineStarts, offset);
            return pos >= 0 ? pos : -pos - 2;
        }
    }
}
