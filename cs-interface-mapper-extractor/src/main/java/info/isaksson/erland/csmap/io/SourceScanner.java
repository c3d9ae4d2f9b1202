package info.isaksson.erland.csmap.io;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Finds the .cs scripts of a Unity project or plain C# solution.
 *
 * Engine caches ({@code Library/}, {@code Temp/}), MSBuild output ({@code obj/}, {@code bin/}) and
 * IDE folders are never walked into. Test assemblies ({@code Tests/}, {@code EditMode/},
 * {@code PlayMode/}) are left out unless asked for. Results are ordered by relative path.
 */
public final class SourceScanner {

    private SourceScanner() {}

    /** Output folder name written by the report step; never scanned back in. */
    public static final String DEFAULT_OUTPUT_FOLDER = "_interface_maps";

    /** Folder names skipped at any depth. Case-sensitive, as Unity and MSBuild write them. */
    private static final Set<String> SKIPPED_FOLDERS = Set.of(
            "Library", "Temp", "Logs", "UserSettings", "obj", "bin",
            ".git", ".vs", ".idea", DEFAULT_OUTPUT_FOLDER);

    /** Folder names skipped only directly under the scan root. */
    private static final Set<String> SKIPPED_TOP_FOLDERS = Set.of("target", "build");

    /** Lower-cased folder names that hold test scripts. */
    private static final Set<String> TEST_FOLDERS = Set.of("test", "tests", "editmode", "playmode");

    /**
     * Scan for .cs files under {@code sourceRoot}. Unity {@code .meta} sidecars and other files are ignored.
     *
     * @param sourceRoot project or Assets folder to scan
     * @param excludeGlobs globs matched against the '/'-separated path relative to sourceRoot;
     *                     a bare folder name such as {@code Plugins} excludes everything beneath it
     * @param includeTests whether to keep scripts from test assembly folders such as Tests/EditMode
     */
    public static List<Path> scan(Path sourceRoot, List<String> excludeGlobs, boolean includeTests) throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot");
        List<PathMatcher> excludes = compileExcludes(excludeGlobs);

        List<Path> scripts = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(sourceRoot)) {
            walk.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".cs"))
                .filter(p -> !isInCommonBuildDir(sourceRoot, p))
                .filter(p -> includeTests || !looksLikeTestPath(sourceRoot, p))
                .filter(p -> !isExcluded(relative(sourceRoot, p), excludes))
                .forEach(scripts::add);
        }
        scripts.sort(Comparator.comparing(p -> relative(sourceRoot, p)));
        return scripts;
    }

    private static List<PathMatcher> compileExcludes(List<String> globs) {
        List<PathMatcher> matchers = new ArrayList<>();
        if (globs == null) return matchers;
        for (String raw : globs) {
            String glob = raw == null ? "" : raw.trim().replace('\\', '/');
            if (glob.isEmpty()) continue;
            boolean wildcard = glob.contains("*") || glob.contains("?") || glob.contains("[");
            if (!wildcard && !glob.endsWith("/")) {
                glob += "/**";
            }
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        return matchers;
    }

    private static boolean isExcluded(String relativePath, List<PathMatcher> excludes) {
        if (excludes.isEmpty()) return false;
        Path rel = Path.of(relativePath);
        return excludes.stream().anyMatch(m -> m.matches(rel));
    }

    static boolean looksLikeTestPath(Path root, Path absolutePath) {
        return folders(root, absolutePath).stream()
                .anyMatch(f -> TEST_FOLDERS.contains(f.toLowerCase(Locale.ROOT)));
    }

    static boolean isInCommonBuildDir(Path root, Path absolutePath) {
        List<String> folders = folders(root, absolutePath);
        if (!folders.isEmpty() && SKIPPED_TOP_FOLDERS.contains(folders.get(0))) return true;
        return folders.stream().anyMatch(SKIPPED_FOLDERS::contains);
    }

    /** Folder names between the root and the file, outermost first. */
    private static List<String> folders(Path root, Path absolutePath) {
        String[] parts = relative(root, absolutePath).split("/");
        return List.of(parts).subList(0, parts.length - 1);
    }

    private static String relative(Path root, Path p) {
        return root.relativize(p).toString().replace('\\', '/');
    }
}
