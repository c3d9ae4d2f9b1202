package info.isaksson.erland.csmap.core;

import info.isaksson.erland.csmap.model.CsModel;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Generation result container for programmatic usage. */
public final class InterfaceMapResult {
    /** Scanned source files, sorted by relative path. */
    public final List<Path> sourceFiles;

    public final CsModel model;

    /** Map file name to rendered Markdown, in unit order. */
    public final Map<String, String> maps;

    public final String readme;

    /** Present when JSON output was requested. */
    public final String json;

    InterfaceMapResult(List<Path> sourceFiles, CsModel model, Map<String, String> maps, String readme, String json) {
        this.sourceFiles = List.copyOf(sourceFiles);
        this.model = model;
        this.maps = maps;
        this.readme = readme;
        this.json = json;
    }
}
