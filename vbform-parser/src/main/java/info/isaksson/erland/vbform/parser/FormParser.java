package info.isaksson.erland.vbform.parser;

import info.isaksson.erland.vbform.model.ControlNode;
import info.isaksson.erland.vbform.model.FileAttributes;
import info.isaksson.erland.vbform.model.FormDocument;
import info.isaksson.erland.vbform.parser.resource.ResourceResolver;

/**
 * Parses the text of a {@code .frm} file: header, control tree and attribute block. The code that
 * follows is not parsed; its start is reported as {@link ParsedForm#codeOffset}.
 */
public final class FormParser {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private final ControlTreeBuilder treeBuilder;

    public FormParser(ResourceResolver resolver) {
        this(resolver, DEFAULT_MAX_NESTING_DEPTH);
    }

    public FormParser(ResourceResolver resolver, int maxNestingDepth) {
        this.treeBuilder = new ControlTreeBuilder(resolver, maxNestingDepth);
    }

    public ParsedForm parse(String fileName, String text) throws FormParseException {
        FormSource source = new FormSource(fileName, text);
        FormHeaderParser.Header header = FormHeaderParser.parseHeader(source);
        ControlNode root = treeBuilder.build(source);
        FileAttributes attributes = FormHeaderParser.parseAttributes(source, root.name);
        if (!attributes.name.equals(root.name)) {
            root = root.withName(attributes.name);
        }
        FormDocument document = new FormDocument(root, header.version, header.objects, attributes);
        return new ParsedForm(document, source.position());
    }
}
