package konputer.narytree.render;

import com.google.common.collect.ImmutableList;
import konputer.narytree.ChildSlot;

/**
 * A pending entry of the render work list.
 *
 * @param slot           the slot to draw; a tombstone draws as a {@code [null]} leaf
 * @param depth          distance from the root
 * @param currentMargin  stems drawn on this entry's own two rows, one flag per level
 * @param trailingMargin stems still running below this entry, handed down to its children
 */
record MarginFrame<T>(
        ChildSlot<T> slot,
        int depth,
        ImmutableList<Boolean> currentMargin,
        ImmutableList<Boolean> trailingMargin
) {

    static <T> MarginFrame<T> root(ChildSlot<T> root) {
        return new MarginFrame<>(root, 0, ImmutableList.of(), ImmutableList.of());
    }

    MarginFrame<T> child(ChildSlot<T> child, boolean rightmost) {
        return new MarginFrame<>(child, depth + 1,
                append(trailingMargin, true),
                append(trailingMargin, !rightmost));
    }

    private static ImmutableList<Boolean> append(ImmutableList<Boolean> margin, boolean flag) {
        return ImmutableList.<Boolean>builderWithExpectedSize(margin.size() + 1)
                .addAll(margin)
                .add(flag)
                .build();
    }
}
