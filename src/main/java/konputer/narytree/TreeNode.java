package konputer.narytree;

import org.jooq.lambda.Seq;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;

import static com.google.common.base.Preconditions.checkState;

/**
 * A node of a {@link GenericTree}. The node owns its live children; the parent reference is
 * informational only.
 */
public final class TreeNode<T> {
    public static final String NULL_MARKER = "[null]";

    private @Nullable TreeNode<T> parent;
    private @Nullable T data;
    private ArrayList<ChildSlot<T>> slots = new ArrayList<>();
    private boolean destroyed;

    TreeNode(@Nullable T data) {
        this.data = data;
    }

    /**
     * Appends a rightmost child holding {@code childData}.
     */
    public TreeNode<T> addChild(@Nullable T childData) {
        checkState(!destroyed, "Tried to addChild on a node that was already deleted");
        TreeNode<T> child = new TreeNode<>(childData);
        child.parent = this;
        slots.add(ChildSlot.live(child));
        return child;
    }

    public @Nullable T data() {
        return data;
    }

    public @Nullable TreeNode<T> parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null && !destroyed;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    // includes tombstones, in slot order
    public List<ChildSlot<T>> childSlots() {
        return Collections.unmodifiableList(slots);
    }

    public List<TreeNode<T>> liveChildren() {
        return Seq.seq(slots)
                .filter(slot -> !slot.isTombstone())
                .map(ChildSlot::node)
                .toUnmodifiableList();
    }

    /**
     * @return the payload as text, or {@link #NULL_MARKER} when there is none
     */
    public String describe() {
        return data == null ? NULL_MARKER : data.toString();
    }

    List<ChildSlot<T>> slots() {
        return slots;
    }

    boolean tombstoneChild(TreeNode<T> child) {
        for (ListIterator<ChildSlot<T>> it = slots.listIterator(); it.hasNext(); ) {
            if (it.next().node() == child) {
                it.set(ChildSlot.tombstone());
                return true;
            }
        }
        return false;
    }

    void replaceSlots(ArrayList<ChildSlot<T>> compacted) {
        slots = compacted;
    }

    void destroy() {
        slots.clear();
        parent = null;
        data = null;
        destroyed = true;
    }

    @Override
    public String toString() {
        return "TreeNode[" + describe() + (destroyed ? ", destroyed]" : "]");
    }
}
