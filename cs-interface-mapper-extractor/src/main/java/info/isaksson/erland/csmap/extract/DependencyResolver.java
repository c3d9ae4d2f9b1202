package info.isaksson.erland.csmap.extract;

import info.isaksson.erland.csmap.model.CsField;
import info.isaksson.erland.csmap.model.CsMethod;
import info.isaksson.erland.csmap.model.CsParam;
import info.isaksson.erland.csmap.model.CsProperty;
import info.isaksson.erland.csmap.model.CsType;
import info.isaksson.erland.csmap.model.CsUnit;
import info.isaksson.erland.csmap.model.DependencyEdge;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Second pass over all parsed units: links each unit to the project types its surfaced
 * signatures mention.
 *
 * <p>Names are matched by bare type name only, without namespace resolution. Types with the same
 * short name in different namespaces therefore collapse into one edge target.</p>
 */
public final class DependencyResolver {

    private DependencyResolver() {}

    private static final Pattern SEPARATORS = Pattern.compile("[\\[\\]<>,?():\\s]+");

    /**
     * Resolve edges for {@code units}, store each unit's edges on {@link CsUnit#dependencies} and
     * return all edges in unit order. Edges of one unit are sorted by target name.
     */
    public static List<DependencyEdge> resolve(List<CsUnit> units) {
        List<DependencyEdge> all = new ArrayList<>();
        if (units == null || units.isEmpty()) return all;

        Map<String, Set<String>> declaredBy = new HashMap<>();
        for (CsUnit unit : units) {
            for (String name : unit.primaryTypeNames()) {
                declaredBy.computeIfAbsent(name, k -> new LinkedHashSet<>()).add(unit.id);
            }
        }

        for (CsUnit unit : units) {
            Set<String> own = new HashSet<>(unit.primaryTypeNames());
            Set<String> targets = new TreeSet<>();
            for (String token : referencedTokens(unit)) {
                if (own.contains(token)) continue;
                if (declaredBy.containsKey(token)) targets.add(token);
            }
            unit.dependencies.clear();
            for (String target : targets) {
                DependencyEdge edge = new DependencyEdge(unit.id, target);
                unit.dependencies.add(edge);
                all.add(edge);
            }
        }
        return all;
    }

    /** Every candidate type name mentioned by the unit's base lists and surfaced signatures. */
    static Set<String> referencedTokens(CsUnit unit) {
        Set<String> tokens = new LinkedHashSet<>();
        for (CsType type : unit.types) {
            for (String base : type.baseTypes) addTokens(tokens, base);
            for (CsField f : type.fields) addTokens(tokens, f.type);
            for (CsProperty p : type.properties) addTokens(tokens, p.type);
            for (CsMethod m : type.methods) {
                addTokens(tokens, m.returnType);
                for (CsParam p : m.params) {
                    if (p.hasKnownType()) addTokens(tokens, p.type);
                }
            }
        }
        return tokens;
    }

    static List<String> tokens(String typeExpression) {
        List<String> out = new ArrayList<>();
        if (typeExpression == null) return out;
        for (String raw : SEPARATORS.split(typeExpression)) {
            if (raw.isEmpty()) continue;
            out.add(raw);
            int dot = raw.lastIndexOf('.');
            if (dot >= 0 && dot < raw.length() - 1) out.add(raw.substring(dot + 1));
        }
        return out;
    }

    private static void addTokens(Set<String> into, String typeExpression) {
        into.addAll(tokens(typeExpression));
    }
}
