package org.formulafmt;

import java.util.*;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lays a {@link FormatNode} document out into lines.
 *
 * Based on Philip Wadler's "A prettier printer": every group is tested on its
 * own against what's left of the current line, and either stays flat or has
 * all of its direct line breaks taken. One pass, no backtracking.
 */
public class Renderer {
    enum WrapMode { DETECT, ENABLED }

    static final String SPACE = " ";

    /*
     * Constants
     */
    final int lineWidth;
    final String tab;

    /*
     * Renderer state
     */
    final List<StringBuilder> linesBuffer = new ArrayList<>();
    int indentLevel = 0;
    int currentColumn;

    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("formatter");

    public Renderer(FormatOptions options) {
        this.lineWidth = options.lineWidth();
        this.tab = SPACE.repeat(options.indentWidth());
    }

    public static List<String> render(FormatNode document, FormatOptions options) {
        return new Renderer(options).run(document);
    }

    public List<String> run(FormatNode document) {
        linesBuffer.clear();
        linesBuffer.add(new StringBuilder());
        indentLevel = 0;
        // The first line starts after the leading "="
        currentColumn = 1;

        renderNode(document, WrapMode.DETECT);

        return linesBuffer.stream()
            .map(StringBuilder::toString)
            .collect(Collectors.toList());
    }

    void renderNode(FormatNode node, WrapMode wrapMode) {
        if (node instanceof FormatNode.Group group) {
            // Decided fresh for every group, whatever its parent did
            var mode = currentColumn + group.width() > lineWidth
                ? WrapMode.ENABLED
                : WrapMode.DETECT;
            log.debug("group of width {} at column {}: {}", group.width(), currentColumn, mode);
            renderAll(group.nodes(), mode);
        } else if (node instanceof FormatNode.Nodes nodes) {
            renderAll(nodes.nodes(), wrapMode);
        } else if (node instanceof FormatNode.Indent indent) {
            var needsIndent = wrapMode == WrapMode.ENABLED;
            if (needsIndent) {
                indentLevel++;
                insertText(tab);
            }
            renderAll(indent.nodes(), wrapMode);
            if (needsIndent) {
                indentLevel--;
            }
        } else if (node instanceof FormatNode.Text text) {
            insertText(text.text());
        } else if (node instanceof FormatNode.SpaceOrLine) {
            if (wrapMode == WrapMode.ENABLED) {
                insertLine();
            } else {
                insertText(SPACE);
            }
        } else if (node instanceof FormatNode.Line) {
            if (wrapMode == WrapMode.ENABLED) {
                insertLine();
            }
        } else {
            throw new IllegalStateException("unknown format node: " + node);
        }
    }

    void renderAll(List<FormatNode> nodes, WrapMode wrapMode) {
        for (var child : nodes) {
            renderNode(child, wrapMode);
        }
    }

    void insertText(String text) {
        if (text.isEmpty()) {
            return;
        }
        linesBuffer.get(linesBuffer.size() - 1).append(text);
        currentColumn += text.length();
    }

    // Start a new line at the current indent level
    void insertLine() {
        var newLineTab = tab.repeat(indentLevel);
        linesBuffer.add(new StringBuilder(newLineTab));
        currentColumn = newLineTab.length();
    }
}
