package info.isaksson.erland.csmap;

import info.isaksson.erland.csmap.core.InterfaceMapOptions;
import info.isaksson.erland.csmap.core.InterfaceMapResult;
import info.isaksson.erland.csmap.core.InterfaceMapService;
import info.isaksson.erland.csmap.model.UnitParseFailure;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CLI entrypoint: scan a folder of C# scripts and write one Markdown interface map per script
 * plus a README index.
 */
public final class Main {

    private static final Logger logger = LogManager.getLogger(Main.class);

    private static final InterfaceMapService SERVICE = new InterfaceMapService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.source == null) {
            System.err.println("Error: an input directory is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path sourcePath = Paths.get(parsed.source).toAbsolutePath().normalize();
        if (!Files.isDirectory(sourcePath)) {
            System.err.println("Error: '" + sourcePath + "' is not a directory.");
            return 1;
        }

        InterfaceMapOptions options = toCoreOptions(parsed);
        final Path outputDir = (parsed.output == null || parsed.output.isBlank())
                ? sourcePath.resolve(options.outputFolderName)
                : Paths.get(parsed.output).toAbsolutePath().normalize();

        final InterfaceMapResult res;
        final List<Path> written;
        try {
            res = SERVICE.generateFromSource(sourcePath, parsed.excludes, options);
            if (res.sourceFiles.isEmpty()) {
                System.out.println("No .cs files found in '" + sourcePath + "'.");
                return 0;
            }
            System.out.println("Found " + res.sourceFiles.size() + " C# files in '" + sourcePath + "'");
            written = SERVICE.writeOutputs(res, outputDir);
        } catch (RuntimeException | IOException e) {
            logger.debug("Interface map generation failed", e);
            System.err.println("Error: interface map generation failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        for (UnitParseFailure f : res.model.failures) {
            System.out.println("  WARN: Skipped " + f.unitId + ": " + f.message);
        }
        System.out.println("Generated " + res.maps.size() + " interface maps + README.md in '" + outputDir + "'");

        try {
            long sourceBytes = InterfaceMapService.totalBytes(res.sourceFiles);
            long mapBytes = InterfaceMapService.totalBytes(written);
            System.out.println(sizeSummary(sourceBytes, mapBytes));
        } catch (IOException e) {
            // The maps are written; only the summary line is lost.
            logger.warn("Could not compute output size summary: {}", e.getMessage());
        }
        return 0;
    }

    static String sizeSummary(long sourceBytes, long mapBytes) {
        double ratio = sourceBytes > 0 ? (mapBytes * 100.0 / sourceBytes) : 0.0;
        return String.format(Locale.ROOT, "Source total: %,d bytes -> Interface maps total: %,d bytes (%.1f%%)",
                sourceBytes, mapBytes, ratio);
    }

    private static InterfaceMapOptions toCoreOptions(CliArgs parsed) {
        InterfaceMapOptions o = new InterfaceMapOptions();
        o.includeTests = parsed.includeTests;
        o.writeJson = parsed.json;
        if (parsed.threads != null) o.extraction.threads = parsed.threads;
        if (parsed.minFileDoc != null) o.extraction.minFileDocChars = parsed.minFileDoc;
        return o;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String source;
        String output;

        boolean includeTests = false;
        boolean json = false;
        Integer threads;
        Integer minFileDoc;
        final List<String> excludes = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--source":
                        out.source = requireValue(args, ++i, "--source");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--include-tests":
                        out.includeTests = true;
                        break;
                    case "--json":
                        out.json = true;
                        break;
                    case "--threads":
                        out.threads = parsePositiveInt(requireValue(args, ++i, "--threads"), "--threads", 1);
                        break;
                    case "--min-file-doc":
                        out.minFileDoc = parsePositiveInt(requireValue(args, ++i, "--min-file-doc"), "--min-file-doc", 0);
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // <input_dir> [output_dir]
                        if (out.source == null) {
                            out.source = a;
                        } else if (out.output == null) {
                            out.output = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static int parsePositiveInt(String v, String flag, int min) {
            final int n;
            try {
                n = Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v, e);
            }
            if (n < min) {
                throw new IllegalArgumentException(flag + " must be at least " + min + ": " + v);
            }
            return n;
        }

        static void printHelp() {
            System.out.println(
                    "cs-interface-mapper\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar cs-interface-mapper.jar <input_dir> [output_dir] [options]\n" +
                    "  java -jar cs-interface-mapper.jar --source <dir> [--output <dir>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --source <path>        Directory containing .cs files (searched recursively)\n" +
                    "  --output <path>        Output folder (default: <input_dir>/_interface_maps)\n" +
                    "  --exclude <glob>       Exclude paths matching glob (repeatable). Matches are evaluated\n" +
                    "                         against paths relative to the input directory using '/' separators.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  --include-tests        Include test folders (default: excluded)\n" +
                    "  --threads <n>          Parser worker threads (default: available processors)\n" +
                    "  --json                 Also write model.json with the extracted model\n" +
                    "  --min-file-doc <n>     Minimum length of a leading file comment to keep (default: 40)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/cs-interface-mapper.jar Assets/Scripts\n" +
                    "  java -jar target/cs-interface-mapper.jar Assets/Scripts out --json\n" +
                    "  java -jar target/cs-interface-mapper.jar --source . --exclude \"Plugins/**\"\n"
            );
        }
    }
}
