package konputer.narytree;

import konputer.narytree.render.TreeRenderer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;

/**
 * An ordered N-ary tree. The tree owns its root and, through it, every node.
 * <p>
 * Deleting a subtree leaves a tombstone in the parent's child sequence so sibling positions do
 * not move; {@link #compress()} removes the tombstones later.
 * <p>
 * Not thread safe.
 */
public class GenericTree<T> implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenericTree.class);

    private @Nullable TreeNode<T> root;
    private boolean showDebugMessages;
    private final @Nullable PrintStream diagnostics;

    public GenericTree() {
        this(TreeSettings.DEFAULT);
    }

    public GenericTree(TreeSettings settings) {
        this.showDebugMessages = settings.showDebugMessages();
        this.diagnostics = settings.diagnostics();
    }

    public static <T> GenericTree<T> withRoot(@Nullable T rootData) {
        return withRoot(rootData, TreeSettings.DEFAULT);
    }

    public static <T> GenericTree<T> withRoot(@Nullable T rootData, TreeSettings settings) {
        GenericTree<T> tree = new GenericTree<>(settings);
        tree.createRoot(rootData);
        return tree;
    }

    public TreeNode<T> createRoot(@Nullable T rootData) {
        checkState(root == null, "Tried to createRoot when root already exists");
        root = new TreeNode<>(rootData);
        LOGGER.trace("Created root {}", root);
        return root;
    }

    public @Nullable TreeNode<T> getRoot() {
        return root;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Removes {@code target} and all of its descendants. Does nothing for null.
     *
     * @throws IllegalArgumentException if {@code target} does not belong to this tree
     * @throws com.google.common.base.VerifyException if the parent does not list {@code target}
     */
    public void deleteSubtree(@Nullable TreeNode<T> target) {
        if (target == null) {
            return;
        }
        boolean targetingWholeTree = target == root;
        int count = new SubtreeDeleter<T>(traceSink()).delete(root, target);
        if (targetingWholeTree) {
            root = null;
        }
        LOGGER.trace("Deleted subtree of {} nodes", count);
    }

    private @Nullable PrintStream traceSink() {
        if (!showDebugMessages) {
            return null;
        }
        return diagnostics != null ? diagnostics : System.err;
    }

    public void compress() {
        if (root == null) {
            return;
        }
        new TreeCompactor<T>().compact(root);
    }

    public void clear() {
        deleteSubtree(root);
        verify(root == null, "clear() detected that deleteSubtree() had not reset the root");
    }

    @Override
    public void close() {
        clear();
    }

    public <A extends Appendable> A print(A out) throws IOException {
        return new TreeRenderer<T>(showDebugMessages).render(root, out);
    }

    public boolean isShowDebugMessages() {
        return showDebugMessages;
    }

    public void setShowDebugMessages(boolean showDebugMessages) {
        this.showDebugMessages = showDebugMessages;
    }

    @Override
    public String toString() {
        try {
            return print(new StringBuilder()).toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
