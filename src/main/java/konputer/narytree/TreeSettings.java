package konputer.narytree;

import org.jspecify.annotations.Nullable;

import java.io.PrintStream;

/**
 * @param showDebugMessages when set, deletion writes the order in which nodes are explored and
 *                          deleted to {@code diagnostics}, and printing lists each node's depth
 *                          and data instead of drawing the diagram.
 * @param diagnostics       receives the deletion traces; null means the current standard error
 */
public record TreeSettings(
        boolean showDebugMessages,
        @Nullable PrintStream diagnostics
) {
    public static final String DEBUG_PROPERTY = "narytree.debug";
    public static final TreeSettings DEFAULT = new TreeSettings(false);

    public TreeSettings(boolean showDebugMessages) {
        this(showDebugMessages, null);
    }

    public static TreeSettings fromSystemProperties() {
        return new TreeSettings(Boolean.getBoolean(DEBUG_PROPERTY));
    }
}
