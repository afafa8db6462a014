package konputer.narytree.render;

import konputer.narytree.ChildSlot;
import konputer.narytree.TreeNode;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Draws a tree as a vertical text diagram. Every node below the root takes two rows: a connector
 * row and a label row.
 * <pre>
 * A
 * |
 * |_ B
 * |  |
 * |  |_ D
 * |
 * |_ C
 * </pre>
 * The traversal is iterative and pre-order; the tree is never modified.
 */
public class TreeRenderer<T> {
    public static final String EMPTY_TREE_MARKER = "[empty tree]";

    private static final String STEM = "|";
    private static final String BLANK = " ";
    private static final String PADDING = "  ";
    private static final String BRANCH = "_ ";
    private static final char NEWLINE = '\n';

    private final boolean showDebugMessages;

    public TreeRenderer(boolean showDebugMessages) {
        this.showDebugMessages = showDebugMessages;
    }

    public <A extends Appendable> A render(@Nullable TreeNode<T> root, A out) throws IOException {
        if (root == null) {
            out.append(EMPTY_TREE_MARKER).append(NEWLINE);
            return out;
        }

        Deque<MarginFrame<T>> toExplore = new ArrayDeque<>();
        toExplore.push(MarginFrame.root(ChildSlot.live(root)));

        while (!toExplore.isEmpty()) {
            MarginFrame<T> cur = toExplore.pop();
            TreeNode<T> node = cur.slot().node();
            String label = node == null ? TreeNode.NULL_MARKER : node.describe();

            if (showDebugMessages) {
                out.append("Depth: ").append(String.valueOf(cur.depth()))
                        .append(" Data: ").append(label).append(NEWLINE);
            } else {
                appendConnectorRow(out, cur.currentMargin());
                appendLabelRow(out, cur.currentMargin(), label);
            }

            if (node != null) {
                List<ChildSlot<T>> children = node.childSlots();
                // rightmost first, so that popping visits left to right
                for (int i = children.size() - 1; i >= 0; i--) {
                    toExplore.push(cur.child(children.get(i), i == children.size() - 1));
                }
            }
        }
        return out;
    }

    private static void appendConnectorRow(Appendable out, List<Boolean> margin) throws IOException {
        if (margin.isEmpty()) {
            return;
        }
        appendLeadingColumns(out, margin);
        if (margin.get(margin.size() - 1)) {
            out.append(STEM);
        }
        out.append(NEWLINE);
    }

    private static void appendLabelRow(Appendable out, List<Boolean> margin, String label) throws IOException {
        if (!margin.isEmpty()) {
            appendLeadingColumns(out, margin);
            out.append(margin.get(margin.size() - 1) ? STEM : BLANK).append(BRANCH);
        }
        out.append(label).append(NEWLINE);
    }

    private static void appendLeadingColumns(Appendable out, List<Boolean> margin) throws IOException {
        for (int i = 0; i < margin.size() - 1; i++) {
            if (margin.get(i)) {
                out.append(STEM).append(PADDING);
            } else {
                out.append(BLANK).append(PADDING);
            }
        }
    }
}
