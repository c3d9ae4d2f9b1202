package info.isaksson.erland.csmap.core;

import info.isaksson.erland.csmap.extract.ExtractionOptions;
import info.isaksson.erland.csmap.io.SourceScanner;

/**
 * Core options for interface map generation.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class InterfaceMapOptions {
    public ExtractionOptions extraction = new ExtractionOptions();

    /** Source scanning controls. */
    public boolean includeTests = false;

    /** Also produce {@code model.json} next to the Markdown maps. */
    public boolean writeJson = false;

    /** Folder created under the source root when no output directory is given. */
    public String outputFolderName = SourceScanner.DEFAULT_OUTPUT_FOLDER;
}
