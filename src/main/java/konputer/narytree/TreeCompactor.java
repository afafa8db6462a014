package konputer.narytree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.google.common.base.Verify.verify;

/**
 * Removes tombstones from every child sequence with a breadth-first pass. Only live slots are
 * ever queued, so a tombstone coming out of the work list means the tree is corrupt.
 */
class TreeCompactor<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeCompactor.class);

    /**
     * @return the number of tombstones removed
     */
    int compact(TreeNode<T> root) {
        Deque<ChildSlot<T>> toExplore = new ArrayDeque<>();
        toExplore.add(ChildSlot.live(root));
        int removed = drain(toExplore);
        LOGGER.trace("Compaction removed {} tombstones", removed);
        return removed;
    }

    int drain(Deque<ChildSlot<T>> toExplore) {
        int removed = 0;
        while (!toExplore.isEmpty()) {
            ChildSlot<T> front = toExplore.poll();
            verify(!front.isTombstone(), "Compression exploration queued a tombstone");
            TreeNode<T> node = front.node();
            verify(!node.isDestroyed(), "Compression exploration reached a deleted node: %s", node);

            List<ChildSlot<T>> slots = node.slots();
            ArrayList<ChildSlot<T>> compacted = new ArrayList<>(slots.size());
            for (ChildSlot<T> slot : slots) {
                if (slot.isTombstone()) {
                    removed++;
                } else {
                    compacted.add(slot);
                    toExplore.add(slot);
                }
            }
            node.replaceSlots(compacted);
        }
        return removed;
    }
}
