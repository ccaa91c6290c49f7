package info.isaksson.erland.vbform.parser;

import info.isaksson.erland.vbform.model.PropertyGroup;
import info.isaksson.erland.vbform.model.PropertyGroupEntry;
import info.isaksson.erland.vbform.parser.resource.ResourceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Parses a {@code BeginProperty <name> [{uuid}] ... EndProperty} block, including any nested
 * blocks, into a {@link PropertyGroup}.
 *
 * <p>Open groups are kept on an explicit stack, so nesting depth is bounded only by
 * {@code maxDepth}.</p>
 */
public final class PropertyGroupParser {
    private static final Logger LOG = LoggerFactory.getLogger(PropertyGroupParser.class);

    private static final Pattern GUID = Pattern.compile(
            "[0-9A-Fa-f]{8}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{4}-[0-9A-Fa-f]{12}");

    private static final class OpenGroup {
        final String name;
        final UUID guid;
        final Map<String, PropertyGroupEntry> entries = new LinkedHashMap<>();

        OpenGroup(String name, UUID guid) {
            this.name = name;
            this.guid = guid;
        }

        PropertyGroup seal() {
            return new PropertyGroup(name, guid, entries);
        }
    }

    private final ResourceResolver resolver;
    private final int maxDepth;

    public PropertyGroupParser(ResourceResolver resolver, int maxDepth) {
        if (resolver == null) throw new IllegalArgumentException("resolver must not be null");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive");
        this.resolver = resolver;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses the group opened by {@code beginLine}, which has already been consumed from
     * {@code source}. On return the matching {@code EndProperty} line has been consumed too.
     */
    public PropertyGroup parse(FormSource source, FormSource.Line beginLine) throws FormParseException {
        Deque<OpenGroup> open = new ArrayDeque<>();
        open.push(header(source, beginLine));

        while (true) {
            FormSource.Line line = source.nextLine();
            if (line == null) {
                throw source.errorAtEnd(FormErrorKind.NO_END_PROPERTY,
                        "group '" + open.peek().name + "' is not closed");
            }
            if (line.isBlank()) continue;

            if (PropertyLines.isKeyword(line, "EndProperty")) {
                String rest = PropertyLines.afterKeyword(line);
                if (!rest.isEmpty() || !line.terminated) {
                    throw source.errorAt(FormErrorKind.NO_LINE_ENDING_AFTER_END_PROPERTY, line,
                            PropertyLines.keywordEnd(line),
                            rest.isEmpty() ? "input ends after 'EndProperty'" : "found '" + rest + "'");
                }
                PropertyGroup group = open.pop().seal();
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Closed property group {} ({} entries) at line {}", group.name, group.entries.size(), line.number);
                }
                if (open.isEmpty()) return group;
                put(open.peek(), group.name, PropertyGroupEntry.nested(group));
            } else if (PropertyLines.isKeyword(line, "BeginProperty")) {
                if (open.size() >= maxDepth) {
                    throw source.error(FormErrorKind.NESTING_TOO_DEEP, line,
                            "property groups nested more than " + maxDepth + " deep");
                }
                open.push(header(source, line));
            } else if (PropertyLines.isBareKeyword(line, "End")) {
                throw source.error(FormErrorKind.NO_END_PROPERTY, line,
                        "group '" + open.peek().name + "' is not closed before 'End'");
            } else {
                PropertyLines.Assignment a = PropertyLines.parseAssignment(source, line);
                put(open.peek(), a.name, PropertyGroupEntry.scalar(PropertyLines.valueOf(source, line, a, resolver)));
            }
        }
    }

    private static void put(OpenGroup group, String key, PropertyGroupEntry entry) {
        if (group.entries.put(key, entry) != null) {
            LOG.warn("Property group {} assigns '{}' more than once; keeping the last value", group.name, key);
        }
    }

    /** Reads {@code <name> [{uuid}]} following the {@code BeginProperty} keyword. */
    private static OpenGroup header(FormSource source, FormSource.Line line) throws FormParseException {
        String s = line.text();
        int i = PropertyLines.keywordEnd(line);
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        int nameStart = i;
        while (i < s.length() && !Character.isWhitespace(s.charAt(i)) && s.charAt(i) != '{') i++;
        String name = s.substring(nameStart, i);
        if (name.isEmpty()) {
            throw source.errorAt(FormErrorKind.PROPERTY_VALUE_UNPARSABLE, line, nameStart,
                    "'BeginProperty' must be followed by a group name");
        }
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) i++;

        UUID guid = null;
        if (i < s.length() && s.charAt(i) == '{') {
            int close = s.indexOf('}', i);
            String text = close < 0 ? s.substring(i + 1) : s.substring(i + 1, close);
            if (close < 0 || !GUID.matcher(text).matches()) {
                throw source.errorAt(FormErrorKind.INVALID_GUID, line, i,
                        "'{" + text + (close < 0 ? "" : "}") + "' is not a GUID of the form {8-4-4-4-12}");
            }
            guid = UUID.fromString(text);
            i = close + 1;
        }
        if (!PropertyLines.isBlankOrComment(s.substring(i))) {
            throw source.errorAt(FormErrorKind.PROPERTY_VALUE_UNPARSABLE, line, i,
                    "unexpected text after group '" + name + "': '" + s.substring(i).strip() + "'");
        }
        return new OpenGroup(name, guid);
    }
}
