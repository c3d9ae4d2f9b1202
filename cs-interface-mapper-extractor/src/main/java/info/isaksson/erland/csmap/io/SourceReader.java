package info.isaksson.erland.csmap.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads source files into {@link SourceText}. A byte-order mark selects UTF-8 or UTF-16;
 * otherwise UTF-8 is assumed and malformed bytes are replaced rather than rejected.
 */
public final class SourceReader {

    private SourceReader() {}

    public static SourceText read(Path sourceRoot, Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return new SourceText(relativeId(sourceRoot, file), file.getFileName().toString(), decode(bytes));
    }

    public static String decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) return "";
        int b0 = bytes[0] & 0xFF;
        int b1 = bytes.length > 1 ? bytes[1] & 0xFF : -1;
        int b2 = bytes.length > 2 ? bytes[2] & 0xFF : -1;
        if (b0 == 0xEF && b1 == 0xBB && b2 == 0xBF) {
            return new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        }
        if (b0 == 0xFE && b1 == 0xFF) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
        }
        if (b0 == 0xFF && b1 == 0xFE) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /** Path of {@code file} relative to {@code sourceRoot}, '/'-separated; the bare file name when unrelated. */
    public static String relativeId(Path sourceRoot, Path file) {
        Path p = file;
        if (sourceRoot != null) {
            try {
                p = sourceRoot.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
            } catch (IllegalArgumentException e) {
                p = file.getFileName();
            }
        }
        return p.toString().replace("\\", "/");
    }
}
