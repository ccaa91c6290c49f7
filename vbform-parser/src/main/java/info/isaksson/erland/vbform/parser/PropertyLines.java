package info.isaksson.erland.vbform.parser;

import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.parser.resource.CorruptedResourceException;
import info.isaksson.erland.vbform.parser.resource.ResourceOffsetOutOfBoundsException;
import info.isaksson.erland.vbform.parser.resource.ResourceResolver;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level syntax shared by the control-tree builder and the property-group parser:
 * keywords, {@code name = value} assignments and companion-file references.
 */
final class PropertyLines {

    /** {@code $"Form1.frx":0000} or {@code "Form1.frx":&H1A}; the offset is hexadecimal. */
    private static final Pattern RESOURCE_REFERENCE =
            Pattern.compile("^\\$?\"([^\"]*)\":(?:&[Hh])?([0-9A-Fa-f]+)\\s*(?:'.*)?$");

    private PropertyLines() {}

    /** A parsed assignment. Exactly one of {@link #text} and {@link #companionFile} is set. */
    static final class Assignment {
        final String name;
        final String text;
        final String companionFile;
        final long offset;

        private Assignment(String name, String text, String companionFile, long offset) {
            this.name = name;
            this.text = text;
            this.companionFile = companionFile;
            this.offset = offset;
        }

        boolean isResourceReference() {
            return companionFile != null;
        }
    }

    /** First whitespace-delimited token of the line, or {@code ""} for a blank line. */
    static String keyword(FormSource.Line line) {
        String t = line.text().strip();
        int i = 0;
        while (i < t.length() && !Character.isWhitespace(t.charAt(i))) i++;
        return t.substring(0, i);
    }

    /** Text following the first token, stripped. */
    static String afterKeyword(FormSource.Line line) {
        String t = line.text().strip();
        return t.substring(keyword(line).length()).strip();
    }

    /** Column just past the first token. */
    static int keywordEnd(FormSource.Line line) {
        String k = keyword(line);
        return line.text().indexOf(k) + k.length();
    }

    static boolean isKeyword(FormSource.Line line, String keyword) {
        return keyword(line).equalsIgnoreCase(keyword);
    }

    /** Whether {@code rest} is empty or only a {@code '} comment. */
    static boolean isBlankOrComment(String rest) {
        String t = rest.strip();
        return t.isEmpty() || t.charAt(0) == '\'';
    }

    /** Keyword alone on its line, optionally followed by a comment. */
    static boolean isBareKeyword(FormSource.Line line, String keyword) {
        return isKeyword(line, keyword) && isBlankOrComment(afterKeyword(line));
    }

    static Assignment parseAssignment(FormSource source, FormSource.Line line) throws FormParseException {
        return parseAssignment(source, line, 0);
    }

    /** Parses the assignment starting at column {@code from} of {@code line}. */
    static Assignment parseAssignment(FormSource source, FormSource.Line line, int from) throws FormParseException {
        String s = line.text();
        int i = skipSpaces(s, from);
        int nameStart = i;
        while (i < s.length() && !Character.isWhitespace(s.charAt(i)) && s.charAt(i) != '=') i++;
        String name = s.substring(nameStart, i);
        i = skipSpaces(s, i);
        if (name.isEmpty() || i >= s.length() || s.charAt(i) != '=') {
            throw source.errorAt(FormErrorKind.PROPERTY_VALUE_UNPARSABLE, line, nameStart,
                    "expected 'name = value' but found '" + s.strip() + "'");
        }
        i = skipSpaces(s, i + 1);
        String rest = s.substring(i);

        Matcher m = RESOURCE_REFERENCE.matcher(rest);
        if (m.matches()) {
            String digits = m.group(2);
            long offset = digits.length() > 8 ? Long.MAX_VALUE : Long.parseLong(digits, 16);
            return new Assignment(name, null, m.group(1), offset);
        }

        if (rest.startsWith("\"")) {
            StringBuilder sb = new StringBuilder();
            int j = 1;
            while (true) {
                if (j >= rest.length()) {
                    throw source.errorAt(FormErrorKind.PROPERTY_VALUE_UNPARSABLE, line, i,
                            "unterminated string value for '" + name + "'");
                }
                char c = rest.charAt(j);
                if (c == '"') {
                    if (j + 1 < rest.length() && rest.charAt(j + 1) == '"') {
                        sb.append('"');
                        j += 2;
                        continue;
                    }
                    j++;
                    break;
                }
                sb.append(c);
                j++;
            }
            requireTrailingComment(source, line, i + j, rest.substring(j), name);
            return new Assignment(name, sb.toString(), null, 0);
        }

        int j = 0;
        while (j < rest.length() && !Character.isWhitespace(rest.charAt(j)) && rest.charAt(j) != '\'') j++;
        requireTrailingComment(source, line, i + j, rest.substring(j), name);
        return new Assignment(name, rest.substring(0, j), null, 0);
    }

    /** The assignment's value, reading the companion file when it is a resource reference. */
    static PropertyValue valueOf(FormSource source, FormSource.Line line, Assignment a, ResourceResolver resolver)
            throws FormParseException {
        if (!a.isResourceReference()) return PropertyValue.text(a.text);
        if (a.offset > Integer.MAX_VALUE) {
            throw source.error(FormErrorKind.RESOURCE_OFFSET_OUT_OF_BOUNDS, line,
                    "offset of '" + a.name + "' does not fit a companion file");
        }
        try {
            return PropertyValue.resource(resolver.resolve(a.companionFile, (int) a.offset));
        } catch (CorruptedResourceException e) {
            throw source.error(FormErrorKind.CORRUPTED_RESOURCE, line,
                    a.companionFile + " at offset " + e.getOffset() + ": " + e.getDetail(), e);
        } catch (ResourceOffsetOutOfBoundsException e) {
            throw source.error(FormErrorKind.RESOURCE_OFFSET_OUT_OF_BOUNDS, line, e.getMessage(), e);
        } catch (IOException e) {
            throw source.error(FormErrorKind.RESOURCE_FILE_IO_ERROR, line,
                    a.companionFile + ": " + e.getMessage(), e);
        }
    }

    private static void requireTrailingComment(FormSource source, FormSource.Line line, int column, String rest, String name)
            throws FormParseException {
        if (!isBlankOrComment(rest)) {
            throw source.errorAt(FormErrorKind.PROPERTY_VALUE_UNPARSABLE, line, column,
                    "unexpected text after the value of '" + name + "': '" + rest.strip() + "'");
        }
    }

    private static int skipSpaces(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return i;
    }
}
