package konputer.narytree;

import org.jspecify.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One entry of a node's child sequence: either a live child or a tombstone left behind by
 * {@link GenericTree#deleteSubtree(TreeNode)} until the next {@link GenericTree#compress()}.
 */
public sealed interface ChildSlot<T> permits ChildSlot.Live, ChildSlot.Tombstone {

    static <T> ChildSlot<T> live(TreeNode<T> node) {
        return new Live<>(node);
    }

    static <T> ChildSlot<T> tombstone() {
        return new Tombstone<>();
    }

    boolean isTombstone();

    /**
     * @return the child, or null for a tombstone
     */
    @Nullable TreeNode<T> node();

    record Live<T>(TreeNode<T> node) implements ChildSlot<T> {
        public Live {
            checkNotNull(node, "live slot needs a node");
        }

        @Override
        public boolean isTombstone() {
            return false;
        }
    }

    // carries no state, so all tombstones are equal
    record Tombstone<T>() implements ChildSlot<T> {

        @Override
        public boolean isTombstone() {
            return true;
        }

        @Override
        public @Nullable TreeNode<T> node() {
            return null;
        }
    }
}
