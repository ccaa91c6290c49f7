package info.isaksson.erland.vbform.model.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.introspect.VisibilityChecker;
import info.isaksson.erland.vbform.model.ControlNode;
import info.isaksson.erland.vbform.model.FormDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON export of parsed forms.
 *
 * <p>Output is deterministic: map keys are sorted and fields keep declaration order, so two parses
 * of the same input produce byte-identical JSON.</p>
 */
public final class FormJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private FormJson() {}

    public static String toJsonString(FormDocument document) throws IOException {
        if (document == null) throw new IllegalArgumentException("document is null");
        return MAPPER.writer(PRETTY).writeValueAsString(document) + "\n";
    }

    /** A single control subtree, for callers that only materialize part of a form. */
    public static String toJsonString(ControlNode node) throws IOException {
        if (node == null) throw new IllegalArgumentException("node is null");
        return MAPPER.writer(PRETTY).writeValueAsString(node) + "\n";
    }

    public static void write(FormDocument document, Path path) throws IOException {
        if (document == null) throw new IllegalArgumentException("document is null");
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, document);
            out.write('\n');
        }
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        // Model classes expose public fields only; helper methods such as asText() are not properties.
        om.setVisibility(VisibilityChecker.Std.defaultInstance()
                .withFieldVisibility(JsonAutoDetect.Visibility.PUBLIC_ONLY)
                .withGetterVisibility(JsonAutoDetect.Visibility.NONE)
                .withIsGetterVisibility(JsonAutoDetect.Visibility.NONE));
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
