package info.isaksson.erland.csmap.emitter;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import info.isaksson.erland.csmap.model.CsModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON export of the extracted model.
 *
 * <p>Serializes the public fields of the model classes only (no derived getters). Writing is
 * deterministic: properties are sorted and the model lists are already in stable order.</p>
 */
public final class InterfaceModelJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private InterfaceModelJson() {}

    public static void write(CsModel model, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        if (model == null) throw new IllegalArgumentException("model is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, model);
            // Trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(CsModel model) throws IOException {
        if (model == null) throw new IllegalArgumentException("model is null");
        return MAPPER.writer(PRETTY).writeValueAsString(model) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .build();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        om.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.PUBLIC_ONLY);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
