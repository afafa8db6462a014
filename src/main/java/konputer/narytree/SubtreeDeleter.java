package konputer.narytree;

import org.jspecify.annotations.Nullable;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Verify.verify;

/**
 * Tears down a subtree in two iterative passes: the explore pass records every node of the
 * subtree, then the destroy pass releases them. No node is touched after it is destroyed and
 * the call depth does not grow with the height of the tree.
 * <p>
 * With a trace sink, the explore and delete order is written to it as plain text lines.
 */
class SubtreeDeleter<T> {
    private final @Nullable PrintStream traceSink;

    /**
     * @param traceSink where to write the visit order, or null for no traces
     */
    SubtreeDeleter(@Nullable PrintStream traceSink) {
        this.traceSink = traceSink;
    }

    /**
     * @return the number of destroyed nodes
     */
    int delete(@Nullable TreeNode<T> root, TreeNode<T> target) {
        checkOwnership(root, target);
        detach(target);
        Deque<TreeNode<T>> toDelete = explore(target);
        int count = toDelete.size();
        destroy(toDelete);
        return count;
    }

    private void checkOwnership(@Nullable TreeNode<T> root, TreeNode<T> target) {
        TreeNode<T> walkBack = target;
        while (walkBack.parent() != null) {
            walkBack = walkBack.parent();
        }
        checkArgument(walkBack == root, "Tried to delete a node from a different tree");
    }

    private void detach(TreeNode<T> target) {
        TreeNode<T> parent = target.parent();
        if (parent == null) {
            return;
        }
        verify(parent.tombstoneChild(target),
                "Target node to delete was not listed as a child of its parent");
    }

    Deque<TreeNode<T>> explore(TreeNode<T> target) {
        Deque<TreeNode<T>> toExplore = new ArrayDeque<>();
        Deque<TreeNode<T>> toDelete = new ArrayDeque<>();
        toExplore.push(target);

        while (!toExplore.isEmpty()) {
            TreeNode<T> cur = toExplore.pop();
            if (cur.isDestroyed()) {
                // unreachable through GenericTree; a released node has nothing left to reach
                trace("Exploring node: ", TreeNode.NULL_MARKER);
                continue;
            }
            trace("Exploring node: ", cur.describe());
            toDelete.push(cur);
            for (ChildSlot<T> slot : cur.slots()) {
                if (!slot.isTombstone()) {
                    toExplore.push(slot.node());
                }
            }
        }
        return toDelete;
    }

    private void destroy(Deque<TreeNode<T>> toDelete) {
        while (!toDelete.isEmpty()) {
            TreeNode<T> cur = toDelete.pop();
            trace("Deleting node: ", cur.describe());
            cur.destroy();
        }
    }

    private void trace(String event, String data) {
        if (traceSink != null) {
            traceSink.println(event + data);
        }
    }
}
