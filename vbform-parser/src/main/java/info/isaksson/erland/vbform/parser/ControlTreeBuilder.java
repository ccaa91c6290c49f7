package info.isaksson.erland.vbform.parser;

import info.isaksson.erland.vbform.model.ControlKind;
import info.isaksson.erland.vbform.model.ControlNode;
import info.isaksson.erland.vbform.model.Properties;
import info.isaksson.erland.vbform.model.PropertyGroup;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.parser.materialize.ControlMaterializer;
import info.isaksson.erland.vbform.parser.materialize.PropertyDecodeException;
import info.isaksson.erland.vbform.parser.resource.ResourceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the control tree from {@code Begin <namespace>.<kind> <name> ... End} blocks.
 *
 * <p>Scopes that are still open sit on an explicit stack. {@code End} seals the top scope through
 * the {@link ControlMaterializer} and hands the node to its parent: menus go to the parent's menu
 * list, everything else to its children. The first scope to be sealed with no parent is the root.</p>
 */
public final class ControlTreeBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(ControlTreeBuilder.class);

    /** A control whose {@code End} has not been read yet. */
    private static final class Scope {
        final String namespace;
        final String kind;
        final String name;
        final ControlKind.Type type;
        final FormSource.Line beginLine;
        final Properties.Builder properties = Properties.builder();
        final Map<String, FormSource.Line> propertyLines = new HashMap<>();
        final List<PropertyGroup> groups = new ArrayList<>();
        final List<ControlNode> children = new ArrayList<>();
        final List<ControlNode> menus = new ArrayList<>();

        Scope(String namespace, String kind, String name, ControlKind.Type type, FormSource.Line beginLine) {
            this.namespace = namespace;
            this.kind = kind;
            this.name = name;
            this.type = type;
            this.beginLine = beginLine;
        }
    }

    private final ResourceResolver resolver;
    private final ControlMaterializer materializer;
    private final PropertyGroupParser groupParser;
    private final int maxDepth;

    public ControlTreeBuilder(ResourceResolver resolver, int maxDepth) {
        this(resolver, new ControlMaterializer(), maxDepth);
    }

    public ControlTreeBuilder(ResourceResolver resolver, ControlMaterializer materializer, int maxDepth) {
        if (resolver == null) throw new IllegalArgumentException("resolver must not be null");
        if (materializer == null) throw new IllegalArgumentException("materializer must not be null");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive");
        this.resolver = resolver;
        this.materializer = materializer;
        this.groupParser = new PropertyGroupParser(resolver, maxDepth);
        this.maxDepth = maxDepth;
    }

    /**
     * Reads one control block starting at the next non-blank line of {@code source}, which must be
     * a {@code Begin} line. Consumes input up to and including the matching {@code End}.
     */
    public ControlNode build(FormSource source) throws FormParseException {
        FormSource.Line first = source.nextNonBlankLine();
        if (first == null) {
            throw source.errorAtEnd(FormErrorKind.INVALID_HEADER, "no 'Begin' control block found");
        }
        if (!PropertyLines.isKeyword(first, "Begin")) {
            throw source.error(FormErrorKind.INVALID_HEADER, first,
                    "expected 'Begin' but found '" + first.text().strip() + "'");
        }
        Deque<Scope> stack = new ArrayDeque<>();
        stack.push(open(source, first, null));

        while (true) {
            FormSource.Line line = source.nextLine();
            if (line == null) {
                Scope top = stack.peek();
                throw source.errorAtEnd(FormErrorKind.UNTERMINATED_CONTROL_BLOCK,
                        stack.size() + " control block(s) still open, innermost '" + top.name
                                + "' begun on line " + top.beginLine.number);
            }
            if (line.isBlank()) continue;
            Scope current = stack.peek();

            if (PropertyLines.isBareKeyword(line, "End")) {
                stack.pop();
                ControlNode node = seal(source, current, line);
                if (stack.isEmpty()) return node;
                Scope parent = stack.peek();
                if (current.type == ControlKind.Type.MENU) {
                    parent.menus.add(node);
                } else {
                    parent.children.add(node);
                }
            } else if (PropertyLines.isKeyword(line, "Begin")) {
                if (stack.size() >= maxDepth) {
                    throw source.error(FormErrorKind.NESTING_TOO_DEEP, line,
                            "controls nested more than " + maxDepth + " deep");
                }
                stack.push(open(source, line, current));
            } else if (PropertyLines.isKeyword(line, "BeginProperty")) {
                current.groups.add(groupParser.parse(source, line));
            } else {
                PropertyLines.Assignment a = PropertyLines.parseAssignment(source, line);
                PropertyValue value = PropertyLines.valueOf(source, line, a, resolver);
                if (current.properties.put(a.name, value) != null) {
                    LOG.warn("{}:{}: '{}' assigns '{}' more than once; keeping the last value",
                            source.fileName(), line.number, current.name, a.name);
                }
                current.propertyLines.put(a.name, line);
            }
        }
    }

    /** Parses {@code Begin <namespace>.<kind> <name>} and checks the new control may live in {@code parent}. */
    private static Scope open(FormSource source, FormSource.Line line, Scope parent) throws FormParseException {
        String s = line.text();
        int i = PropertyLines.keywordEnd(line);
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        int fqStart = i;
        while (i < s.length() && !Character.isWhitespace(s.charAt(i)) && s.charAt(i) != '\'') i++;
        String qualified = s.substring(fqStart, i);
        int dot = qualified.indexOf('.');
        if (dot <= 0 || dot == qualified.length() - 1) {
            throw source.errorAt(FormErrorKind.MISSING_NAMESPACE_DOT, line, fqStart,
                    "expected <namespace>.<kind> but found '" + qualified + "'");
        }
        String namespace = qualified.substring(0, dot);
        String kind = qualified.substring(dot + 1);

        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        int nameStart = i;
        while (i < s.length() && !Character.isWhitespace(s.charAt(i)) && s.charAt(i) != '\'') i++;
        String name = s.substring(nameStart, i);
        if (name.isEmpty()) {
            throw source.errorAt(FormErrorKind.NO_CONTROL_NAME_AFTER_KIND, line, nameStart,
                    "'" + qualified + "' is not followed by a control name");
        }
        if (!PropertyLines.isBlankOrComment(s.substring(i))) {
            throw source.errorAt(FormErrorKind.PROPERTY_VALUE_UNPARSABLE, line, i,
                    "unexpected text after control name '" + name + "'");
        }

        ControlKind.Type type;
        try {
            type = ControlMaterializer.resolveType(namespace, kind);
        } catch (PropertyDecodeException e) {
            throw source.errorAt(e.getKind(), line, fqStart, e.getMessage());
        }
        if (parent != null && !ControlMaterializer.acceptsChild(parent.type, type)) {
            throw source.errorAt(FormErrorKind.UNEXPECTED_CHILD_KIND, line, fqStart,
                    "'" + name + "' (" + qualified + ") cannot be placed inside '" + parent.name
                            + "' (" + parent.namespace + "." + parent.kind + ")");
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Begin {} {} at line {}", qualified, name, line.number);
        }
        return new Scope(namespace, kind, name, type, line);
    }

    private ControlNode seal(FormSource source, Scope scope, FormSource.Line endLine) throws FormParseException {
        try {
            return materializer.materialize(scope.namespace, scope.kind, scope.name, scope.properties.build(),
                    scope.groups, scope.children, scope.menus);
        } catch (PropertyDecodeException e) {
            FormSource.Line at = e.getPropertyName() == null ? null : scope.propertyLines.get(e.getPropertyName());
            throw source.error(e.getKind(), at == null ? endLine : at,
                    "'" + scope.name + "': " + e.getMessage(), e);
        }
    }
}
