package info.isaksson.erland.csmap.emitter;

import info.isaksson.erland.csmap.model.CsUnit;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Output file names for per-unit maps.
 *
 * <p>A unit normally maps to {@code <BaseName>.md}. When two units share a base name (same file
 * name in different folders) both use their relative path with '/' replaced by '_'. No unit is
 * ever assigned the index file name {@link #README}.</p>
 */
public final class MapFileNames {

    private MapFileNames() {}

    public static final String README = "README.md";

    /** Unit id to map file name, in unit order. */
    public static Map<String, String> assign(List<CsUnit> units) {
        Map<String, Integer> counts = new HashMap<>();
        for (CsUnit u : units) {
            counts.merge(key(u.baseName()), 1, Integer::sum);
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (CsUnit u : units) {
            boolean clash = counts.get(key(u.baseName())) > 1 || key(u.baseName()).equals("readme");
            String name = clash ? flattened(u.id) : u.baseName();
            // A root-level Readme.cs must not overwrite the index.
            if ((name + ".md").equalsIgnoreCase(README)) name += "_cs";
            out.put(u.id, name + ".md");
        }
        return out;
    }

    private static String flattened(String id) {
        String s = id.endsWith(".cs") ? id.substring(0, id.length() - 3) : id;
        return s.replace('/', '_').replace('\\', '_');
    }

    private static String key(String baseName) {
        return baseName.toLowerCase(Locale.ROOT);
    }
}
