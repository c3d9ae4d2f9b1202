package info.isaksson.erland.csmap.core;

import info.isaksson.erland.csmap.emitter.InterfaceModelJson;
import info.isaksson.erland.csmap.emitter.MapFileNames;
import info.isaksson.erland.csmap.emitter.MarkdownInterfaceMapWriter;
import info.isaksson.erland.csmap.emitter.ReadmeWriter;
import info.isaksson.erland.csmap.extract.InterfaceExtractor;
import info.isaksson.erland.csmap.io.SourceScanner;
import info.isaksson.erland.csmap.model.CsModel;
import info.isaksson.erland.csmap.model.CsUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Core API for generating interface maps.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline.</p>
 */
public final class InterfaceMapService {

    private static final Logger logger = LogManager.getLogger(InterfaceMapService.class);

    public static final String JSON_FILE_NAME = "model.json";

    /** Scan, parse and render maps for a C# source directory. Nothing is written to disk. */
    public InterfaceMapResult generateFromSource(Path sourceRoot, List<String> excludeGlobs, InterfaceMapOptions options) throws IOException {
        if (sourceRoot == null) throw new IllegalArgumentException("sourceRoot must not be null");
        if (!Files.isDirectory(sourceRoot)) throw new IllegalArgumentException("Not a directory: " + sourceRoot);
        if (options == null) options = new InterfaceMapOptions();

        List<String> excludes = new ArrayList<>(excludeGlobs == null ? List.of() : excludeGlobs);
        if (options.outputFolderName != null && !options.outputFolderName.isBlank()) {
            excludes.add(options.outputFolderName);
        }
        List<Path> files = SourceScanner.scan(sourceRoot, excludes, options.includeTests);
        logger.info("Found {} C# file(s) under {}", files.size(), sourceRoot);

        CsModel model = new InterfaceExtractor(options.extraction).extractFiles(sourceRoot, files);

        Map<String, String> names = MapFileNames.assign(model.units);
        Map<String, String> maps = new LinkedHashMap<>();
        for (CsUnit unit : model.units) {
            maps.put(names.get(unit.id), MarkdownInterfaceMapWriter.render(unit));
        }
        String readme = ReadmeWriter.render(model);
        String json = options.writeJson ? InterfaceModelJson.toJsonString(model) : null;
        logger.info("Rendered {} map(s)", maps.size());

        return new InterfaceMapResult(files, model, Collections.unmodifiableMap(maps), readme, json);
    }

    /** Write all rendered documents into {@code outputDir}; returns the written paths in write order. */
    public List<Path> writeOutputs(InterfaceMapResult result, Path outputDir) throws IOException {
        if (result == null) throw new IllegalArgumentException("result must not be null");
        if (outputDir == null) throw new IllegalArgumentException("outputDir must not be null");
        Files.createDirectories(outputDir);

        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, String> e : result.maps.entrySet()) {
            written.add(writeString(outputDir.resolve(e.getKey()), e.getValue()));
        }
        written.add(writeString(outputDir.resolve(MapFileNames.README), result.readme));
        if (result.json != null) {
            written.add(writeString(outputDir.resolve(JSON_FILE_NAME), result.json));
        }
        logger.info("Wrote {} file(s) to {}", written.size(), outputDir);
        return written;
    }

    /** Combined size of the scanned sources, in bytes. */
    public static long totalBytes(List<Path> files) throws IOException {
        long total = 0;
        for (Path p : files) total += Files.size(p);
        return total;
    }

    private static Path writeString(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }
}
