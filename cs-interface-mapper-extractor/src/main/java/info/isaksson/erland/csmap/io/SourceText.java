package info.isaksson.erland.csmap.io;

import java.util.Objects;

/** One decoded source file: stable id (relative path with '/' separators), file name and text. */
public final class SourceText {
    public final String id;
    public final String fileName;
    public final String text;

    public SourceText(String id, String fileName, String text) {
        this.id = Objects.requireNonNull(id, "id");
        this.fileName = fileName == null ? baseFileName(id) : fileName;
        this.text = text == null ? "" : text;
    }

    private static String baseFileName(String id) {
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }
}
