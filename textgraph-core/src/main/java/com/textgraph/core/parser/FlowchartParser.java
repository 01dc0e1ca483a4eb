package com.textgraph.core.parser;

import com.textgraph.core.model.Direction;
import com.textgraph.core.model.Edge;
import com.textgraph.core.model.EdgeType;
import com.textgraph.core.model.Graph;
import com.textgraph.core.model.Group;
import com.textgraph.core.model.Node;
import com.textgraph.core.model.NodeShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the flowchart subset of the Mermaid language into a {@link Graph}.
 *
 * <p>Supported syntax:
 * <ul>
 *   <li>header {@code graph TD} or {@code flowchart LR} (TD, TB, LR, RL, BT); TD when absent</li>
 *   <li>nodes {@code A}, {@code A[Box]}, {@code A(Rounded)}, {@code A{Diamond}}, {@code A((Circle))};
 *       labels may be quoted, with {@code \n}, {@code \"} and {@code \\} escapes</li>
 *   <li>edges {@code -->}, {@code ---}, {@code -.->}, {@code -.-}, {@code ==>}, {@code ===},
 *       {@code <-->}, {@code <-.->}, {@code <==>}, optionally labelled {@code A -->|yes| B},
 *       and chained {@code A --> B --> C}</li>
 *   <li>{@code subgraph Name} ... {@code end} blocks, nested, with an optional
 *       {@code direction} line and an optional {@code %% desc: text} description line</li>
 *   <li>{@code %%} comments</li>
 * </ul>
 * Anything else is skipped one character at a time; the parser never fails on bad input.
 *
 * <p>A node id written without a shape only refers to the node; the first declaration with
 * a shape defines its label.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Graph graph = new FlowchartParser().parse("graph LR\n  A[Start] -->|go| B(End)\n");
 * }</pre>
 */
public class FlowchartParser {

    private static final Logger log = LoggerFactory.getLogger(FlowchartParser.class);

    private static final Pattern COMMENT = Pattern.compile("%%[^\\r\\n]*");
    private static final Pattern WHITESPACE = Pattern.compile("[ \\t]+");
    private static final Pattern NEWLINE = Pattern.compile("\\r\\n|\\n|\\r");
    private static final Pattern NODE_ID = Pattern.compile("[a-zA-Z_](?:[a-zA-Z0-9_]|-(?![-.>]))*");
    private static final Pattern DIRECTION = Pattern.compile("TD|TB|LR|RL|BT");
    private static final Pattern BARE_LABEL = Pattern.compile("[^\\]\\)\\}\\r\\n]+");
    private static final Pattern EDGE_LABEL = Pattern.compile("[^|\\r\\n]+");
    private static final Pattern REST_OF_LINE = Pattern.compile("[^\\r\\n]+");
    private static final Pattern DESCRIPTION = Pattern.compile("%%\\s*desc(?:ription)?\\s*:\\s*([^\\r\\n]*)");

    /** Connector tokens, longest and most specific first. */
    private static final List<Map.Entry<String, EdgeType>> CONNECTORS = List.of(
        Map.entry("<-.->", EdgeType.BIDIR_DOTTED),
        Map.entry("<==>", EdgeType.BIDIR_THICK),
        Map.entry("<-->", EdgeType.BIDIR_ARROW),
        Map.entry("-.->", EdgeType.DOTTED_ARROW),
        Map.entry("==>", EdgeType.THICK_ARROW),
        Map.entry("-->", EdgeType.ARROW),
        Map.entry("-.-", EdgeType.DOTTED_LINE),
        Map.entry("===", EdgeType.THICK_LINE),
        Map.entry("---", EdgeType.LINE));

    /**
     * Parses diagram source.
     *
     * @param source flowchart text
     * @return parsed graph
     */
    public Graph parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        Cursor cursor = new Cursor(source);
        Graph.Builder builder = Graph.builder(Direction.TD);

        Direction direction = cursor.header();
        if (direction != null) {
            builder.direction(direction);
        }

        Block root = new Block(null);
        while (!cursor.eof()) {
            cursor.skipBlanks();
            if (cursor.eof()) {
                break;
            }
            if (cursor.newline()) {
                continue;
            }
            if (!statement(cursor, builder, root)) {
                cursor.skipChar();
            }
        }
        for (Block block : root.children) {
            builder.group(block.toGroup());
        }

        Graph graph = builder.build();
        log.debug("Parsed {} nodes, {} edges, {} groups (direction {})",
            graph.nodes().size(), graph.edges().size(), graph.allGroups().size(), graph.direction());
        return graph;
    }

    private boolean statement(Cursor cursor, Graph.Builder builder, Block block) {
        cursor.skipBlanks();
        if (cursor.eof()) {
            return false;
        }
        if (subgraph(cursor, builder, block)) {
            return true;
        }

        int saved = cursor.pos;
        NodeRef first = nodeRef(cursor);
        if (first == null) {
            cursor.pos = saved;
            return false;
        }
        List<NodeRef> refs = new ArrayList<>();
        refs.add(first);
        List<Edge> edges = new ArrayList<>();
        NodeRef previous = first;
        while (true) {
            int beforeLink = cursor.pos;
            EdgeType type = connector(cursor);
            if (type == null) {
                cursor.pos = beforeLink;
                break;
            }
            String label = edgeLabel(cursor);
            NodeRef next = nodeRef(cursor);
            if (next == null) {
                cursor.pos = beforeLink;
                break;
            }
            edges.add(new Edge(previous.id, next.id, type, label, Map.of()));
            refs.add(next);
            previous = next;
        }

        for (NodeRef ref : refs) {
            if (ref.node != null) {
                builder.node(ref.node);
            } else {
                builder.reference(ref.id);
            }
            block.members.add(ref.id);
        }
        edges.forEach(builder::edge);
        cursor.skipBlanks();
        cursor.newline();
        return true;
    }

    private boolean subgraph(Cursor cursor, Graph.Builder builder, Block parent) {
        int saved = cursor.pos;
        if (!cursor.keyword("subgraph")) {
            cursor.pos = saved;
            return false;
        }
        cursor.skipSpaces();
        String name = cursor.peek('"') ? cursor.quoted() : trimmed(cursor.match(REST_OF_LINE));
        cursor.skipBlanks();
        cursor.newline();

        Block block = new Block(name);
        while (!cursor.eof()) {
            cursor.skipSpaces();
            String description = cursor.description();
            if (description != null) {
                block.description = description;
                continue;
            }
            cursor.skipBlanks();
            if (cursor.keyword("end")) {
                cursor.skipBlanks();
                cursor.newline();
                break;
            }
            if (cursor.keyword("direction")) {
                cursor.skipSpaces();
                cursor.match(DIRECTION);
                cursor.skipBlanks();
                cursor.newline();
                continue;
            }
            if (!statement(cursor, builder, block) && !cursor.newline()) {
                cursor.skipChar();
            }
        }
        parent.children.add(block);
        return true;
    }

    private static NodeRef nodeRef(Cursor cursor) {
        cursor.skipSpaces();
        String id = cursor.match(NODE_ID);
        if (id == null) {
            return null;
        }
        NodeShape shape;
        String close;
        if (cursor.consume("((")) {
            shape = NodeShape.CIRCLE;
            close = "))";
        } else if (cursor.consume("(")) {
            shape = NodeShape.ROUNDED;
            close = ")";
        } else if (cursor.consume("{")) {
            shape = NodeShape.DIAMOND;
            close = "}";
        } else if (cursor.consume("[")) {
            shape = NodeShape.RECTANGLE;
            close = "]";
        } else {
            return new NodeRef(id, null);
        }
        cursor.skipSpaces();
        String label = cursor.peek('"') ? cursor.quoted() : trimmed(cursor.match(BARE_LABEL));
        cursor.skipSpaces();
        cursor.consume(close);
        return new NodeRef(id, Node.of(id, label, shape));
    }

    private static EdgeType connector(Cursor cursor) {
        cursor.skipSpaces();
        for (Map.Entry<String, EdgeType> entry : CONNECTORS) {
            if (cursor.consume(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String edgeLabel(Cursor cursor) {
        cursor.skipSpaces();
        if (!cursor.consume("|")) {
            return null;
        }
        String text = cursor.peek('"') ? cursor.quoted() : trimmed(cursor.match(EDGE_LABEL));
        cursor.consume("|");
        return text;
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }

    private record NodeRef(String id, Node node) {
    }

    /**
     * Subgraph under construction.
     */
    private static final class Block {

        private final String name;
        private final Set<String> members = new LinkedHashSet<>();
        private final List<Block> children = new ArrayList<>();
        private String description;

        Block(String name) {
            this.name = name;
        }

        Group toGroup() {
            List<Group> nested = new ArrayList<>();
            for (Block child : children) {
                nested.add(child.toGroup());
            }
            return new Group(name, new ArrayList<>(members), nested, description);
        }
    }

    /**
     * Position in the source text plus the lexical helpers that move it.
     */
    private static final class Cursor {

        private final String src;
        private int pos;

        Cursor(String src) {
            this.src = src;
        }

        boolean eof() {
            return pos >= src.length();
        }

        void skipChar() {
            pos++;
        }

        boolean peek(char c) {
            return pos < src.length() && src.charAt(pos) == c;
        }

        boolean consume(String token) {
            if (src.startsWith(token, pos)) {
                pos += token.length();
                return true;
            }
            return false;
        }

        /**
         * Consumes a word that is not directly followed by an identifier character.
         */
        boolean keyword(String word) {
            if (!src.startsWith(word, pos)) {
                return false;
            }
            int after = pos + word.length();
            if (after < src.length()) {
                char c = src.charAt(after);
                if (Character.isLetterOrDigit(c) || c == '_' || c == '-') {
                    return false;
                }
            }
            pos = after;
            return true;
        }

        String match(Pattern pattern) {
            Matcher matcher = pattern.matcher(src).region(pos, src.length());
            if (matcher.lookingAt()) {
                pos = matcher.end();
                return matcher.group();
            }
            return null;
        }

        void skipSpaces() {
            match(WHITESPACE);
        }

        /** Skips spaces and comments, not line breaks. */
        void skipBlanks() {
            while (match(WHITESPACE) != null || match(COMMENT) != null) {
                // keep skipping
            }
        }

        boolean newline() {
            return match(NEWLINE) != null;
        }

        String description() {
            Matcher matcher = DESCRIPTION.matcher(src).region(pos, src.length());
            if (!matcher.lookingAt()) {
                return null;
            }
            pos = matcher.end();
            newline();
            return matcher.group(1).trim();
        }

        Direction header() {
            int saved = pos;
            while (match(WHITESPACE) != null || match(COMMENT) != null || match(NEWLINE) != null) {
                // skip leading blank lines
            }
            if (keyword("flowchart") || keyword("graph")) {
                skipSpaces();
                String value = match(DIRECTION);
                skipBlanks();
                newline();
                return value == null ? Direction.TD : Direction.parse(value);
            }
            pos = saved;
            return null;
        }

        String quoted() {
            pos++;
            StringBuilder out = new StringBuilder();
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '"') {
                    pos++;
                    break;
                }
                if (c == '\\' && pos + 1 < src.length()) {
                    char next = src.charAt(pos + 1);
                    out.append(next == 'n' ? '\n' : next);
                    pos += 2;
                } else {
                    out.append(c);
                    pos++;
                }
            }
            return out.toString();
        }
    }
}
