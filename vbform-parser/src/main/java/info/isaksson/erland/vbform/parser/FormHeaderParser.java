package info.isaksson.erland.vbform.parser;

import info.isaksson.erland.vbform.model.FileAttributes;
import info.isaksson.erland.vbform.model.FormVersion;
import info.isaksson.erland.vbform.model.ObjectReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The parts of a form file around the control tree: the {@code VERSION} line and {@code Object}
 * references before it, the {@code Attribute} block after it.
 */
final class FormHeaderParser {
    private static final Logger LOG = LoggerFactory.getLogger(FormHeaderParser.class);

    private static final Pattern VERSION =
            Pattern.compile("(?i)^VERSION\\s+(\\d+)\\.(\\d+)(?:\\s+CLASS)?\\s*(?:'.*)?$");

    /** {@code Object = "{uuid}#2.0#0"; "MSCOMCTL.OCX"} or {@code Object = *\G{uuid}#2.0#0; "Lib.ocx"}. */
    private static final Pattern OBJECT = Pattern.compile(
            "(?i)^Object\\s*=\\s*(?:\"\\{([^}]*)\\}#([^#\"]*)#([^\"]*)\"|\\*\\\\G\\{([^}]*)\\}#([^#;]*)#([^;]*))\\s*;\\s*\"([^\"]*)\"\\s*$");

    private static final Pattern GUID = Pattern.compile(
            "[0-9A-Fa-f]{8}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{12}");

    /** Header contents; {@link #objects} in file order. */
    static final class Header {
        final FormVersion version;
        final List<ObjectReference> objects;

        Header(FormVersion version, List<ObjectReference> objects) {
            this.version = version;
            this.objects = List.copyOf(objects);
        }
    }

    private FormHeaderParser() {}

    /** Reads header lines up to, not including, the first {@code Begin} line. */
    static Header parseHeader(FormSource source) throws FormParseException {
        FormVersion version = FormVersion.DEFAULT;
        List<ObjectReference> objects = new ArrayList<>();
        boolean first = true;
        FormSource.Line line;
        while ((line = source.peekLine()) != null) {
            if (line.isBlank()) {
                source.nextLine();
                continue;
            }
            if (PropertyLines.isKeyword(line, "Begin")) break;
            source.nextLine();
            String text = line.text().strip();
            Matcher v = VERSION.matcher(text);
            if (first && v.matches()) {
                version = new FormVersion(Integer.parseInt(v.group(1)), Integer.parseInt(v.group(2)));
            } else if (PropertyLines.keyword(line).toLowerCase(Locale.ROOT).startsWith("object")) {
                objects.add(objectReference(source, line, text));
            } else {
                throw source.error(FormErrorKind.INVALID_HEADER, line,
                        "expected 'VERSION', 'Object' or 'Begin' but found '" + text + "'");
            }
            first = false;
        }
        return new Header(version, objects);
    }

    private static ObjectReference objectReference(FormSource source, FormSource.Line line, String text)
            throws FormParseException {
        Matcher m = OBJECT.matcher(text);
        if (!m.matches()) {
            throw source.error(FormErrorKind.INVALID_HEADER, line, "malformed object reference '" + text + "'");
        }
        boolean quoted = m.group(1) != null;
        String guid = quoted ? m.group(1) : m.group(4);
        if (!GUID.matcher(guid).matches()) {
            throw source.error(FormErrorKind.INVALID_GUID, line,
                    "'{" + guid + "}' is not a GUID of the form {8-4-4-4-12}");
        }
        return new ObjectReference(UUID.fromString(guid),
                quoted ? m.group(2) : m.group(5),
                quoted ? m.group(3) : m.group(6),
                m.group(7));
    }

    /**
     * Reads the {@code Attribute} block following the control tree. Leaves {@code source} at the
     * first line that is not an attribute, which starts the code section.
     */
    static FileAttributes parseAttributes(FormSource source, String rootName) throws FormParseException {
        String name = rootName;
        FileAttributes defaults = FileAttributes.defaults(rootName);
        boolean globalNameSpace = defaults.globalNameSpace;
        boolean creatable = defaults.creatable;
        boolean predeclaredId = defaults.predeclaredId;
        boolean exposed = defaults.exposed;
        Map<String, String> extensions = new TreeMap<>();

        FormSource.Line line;
        while ((line = source.peekLine()) != null) {
            if (line.isBlank()) {
                source.nextLine();
                continue;
            }
            if (!PropertyLines.isKeyword(line, "Attribute")) break;
            source.nextLine();
            PropertyLines.Assignment a = PropertyLines.parseAssignment(source, line, PropertyLines.keywordEnd(line));
            switch (a.name) {
                case "VB_Name":
                    name = a.text;
                    break;
                case "VB_GlobalNameSpace":
                    globalNameSpace = flag(source, line, a);
                    break;
                case "VB_Creatable":
                    creatable = flag(source, line, a);
                    break;
                case "VB_PredeclaredId":
                    predeclaredId = flag(source, line, a);
                    break;
                case "VB_Exposed":
                    exposed = flag(source, line, a);
                    break;
                default:
                    LOG.warn("{}:{}: unknown attribute '{}' kept as an extension", source.fileName(), line.number, a.name);
                    extensions.put(a.name, a.isResourceReference() ? a.companionFile : a.text);
            }
        }
        return new FileAttributes(name, globalNameSpace, creatable, predeclaredId, exposed, extensions);
    }

    private static boolean flag(FormSource source, FormSource.Line line, PropertyLines.Assignment a) throws FormParseException {
        String v = a.text == null ? "" : a.text.strip();
        if (v.equalsIgnoreCase("True") || v.equals("-1") || v.equals("1")) return true;
        if (v.equalsIgnoreCase("False") || v.equals("0")) return false;
        throw source.error(FormErrorKind.INVALID_PROPERTY_VALUE, line,
                "The `" + a.name + "` value is invalid: '" + v + "'. Only True, or False are valid values.");
    }
}
