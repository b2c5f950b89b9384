package org.formulafmt;

import java.util.List;

/**
 * Document tree handed to the {@link Renderer}.
 *
 * Every node knows its flat width, the number of columns it takes when
 * nothing inside it breaks, so fitting a group is a single comparison.
 */
public sealed interface FormatNode
        permits FormatNode.Nodes, FormatNode.Group, FormatNode.Indent,
                FormatNode.Text, FormatNode.SpaceOrLine, FormatNode.Line {

    int width();

    // A plain sequence
    record Nodes(List<FormatNode> nodes, int width) implements FormatNode {}

    // Rendered flat if it fits in what's left of the line, else every line
    // break directly inside it breaks
    record Group(List<FormatNode> nodes, int width) implements FormatNode {}

    // One more indent level for its contents, only when broken
    record Indent(List<FormatNode> nodes, int width) implements FormatNode {}

    record Text(String text) implements FormatNode {
        @Override
        public int width() {
            return text.length();
        }
    }

    // " " when flat, a new line when broken
    record SpaceOrLine() implements FormatNode {
        @Override
        public int width() {
            return 1;
        }
    }

    // Nothing when flat, a new line when broken
    record Line() implements FormatNode {
        @Override
        public int width() {
            return 0;
        }
    }

    static Nodes nodes(List<FormatNode> nodes) {
        return new Nodes(List.copyOf(nodes), totalWidth(nodes));
    }

    static Group group(List<FormatNode> nodes) {
        return new Group(List.copyOf(nodes), totalWidth(nodes));
    }

    static Indent indent(List<FormatNode> nodes) {
        return new Indent(List.copyOf(nodes), totalWidth(nodes));
    }

    static Text text(String text) {
        return new Text(text);
    }

    static Text text(Token token) {
        return new Text(token.content());
    }

    static SpaceOrLine spaceOrLine() {
        return new SpaceOrLine();
    }

    static Line line() {
        return new Line();
    }

    private static int totalWidth(List<FormatNode> nodes) {
        return nodes.stream().mapToInt(FormatNode::width).sum();
    }
}
