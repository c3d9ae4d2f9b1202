package info.isaksson.erland.csmap.extract;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Knobs for {@link InterfaceExtractor}. */
public final class ExtractionOptions {
    /** Worker threads for the per-file phase. */
    public int threads = Math.max(1, Runtime.getRuntime().availableProcessors());

    /** A leading file comment shorter than this is treated as noise (license stubs, separators). */
    public int minFileDocChars = 40;

    /** Conditional-compilation symbols that mark a unit as restricted to a special build. */
    public Set<String> restrictedBuildSymbols = new LinkedHashSet<>(List.of("UNITY_EDITOR"));

    /** Attribute names that surface a non-public field. */
    public Set<String> inclusionAttributes = new LinkedHashSet<>(List.of("SerializeField", "SerializeReference"));
}
