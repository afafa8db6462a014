package konputer.narytree.render;

import konputer.narytree.GenericTree;
import konputer.narytree.TreeNode;
import konputer.narytree.TreeSettings;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class TreeRendererTest {

    private static String render(GenericTree<String> tree) throws IOException {
        return tree.print(new StringWriter()).toString();
    }

    @Test
    void testEmptyTree() throws IOException {
        assertEquals("[empty tree]\n", render(new GenericTree<>()));
    }

    @Test
    void testRootOnly() throws IOException {
        assertEquals("A\n", render(GenericTree.withRoot("A")));
    }

    @Test
    void testTwoChildren() throws IOException {
        GenericTree<String> tree = GenericTree.withRoot("A");
        tree.getRoot().addChild("B");
        tree.getRoot().addChild("C");

        assertEquals("""
                A
                |
                |_ B
                |
                |_ C
                """, render(tree));
    }

    @Test
    void testStemContinuesBelowNonRightmostChild() throws IOException {
        GenericTree<String> tree = GenericTree.withRoot("A");
        TreeNode<String> b = tree.getRoot().addChild("B");
        TreeNode<String> c = tree.getRoot().addChild("C");
        b.addChild("D");
        b.addChild("E");
        c.addChild("F");

        // B's descendants keep a stem in the first column since C is still below;
        // under C, the rightmost child, that column is blank
        assertEquals("""
                A
                |
                |_ B
                |  |
                |  |_ D
                |  |
                |  |_ E
                |
                |_ C
                   |
                   |_ F
                """, render(tree));
    }

    @Test
    void testDeepNesting() throws IOException {
        GenericTree<String> tree = GenericTree.withRoot("A");
        TreeNode<String> b = tree.getRoot().addChild("B");
        TreeNode<String> c = b.addChild("C");
        c.addChild("D");
        c.addChild("E");
        b.addChild("F");

        assertEquals("""
                A
                |
                |_ B
                   |
                   |_ C
                   |  |
                   |  |_ D
                   |  |
                   |  |_ E
                   |
                   |_ F
                """, render(tree));
    }

    @Test
    void testTombstoneRendersAsNullLeaf() throws IOException {
        GenericTree<String> tree = GenericTree.withRoot("A");
        tree.getRoot().addChild("B");
        TreeNode<String> c = tree.getRoot().addChild("C");
        tree.deleteSubtree(c);

        assertEquals("""
                A
                |
                |_ B
                |
                |_ [null]
                """, render(tree));

        tree.compress();
        assertEquals("""
                A
                |
                |_ B
                """, render(tree));
    }

    @Test
    void testNullPayload() throws IOException {
        GenericTree<String> tree = GenericTree.withRoot("A");
        tree.getRoot().addChild(null);
        assertEquals("A\n|\n|_ [null]\n", render(tree));
    }

    @Test
    void testNonStringPayload() {
        GenericTree<Integer> tree = GenericTree.withRoot(1);
        tree.getRoot().addChild(2).addChild(3);
        assertEquals("1\n|\n|_ 2\n   |\n   |_ 3\n", tree.toString());
    }

    @Test
    void testDebugModeListsDepths() throws IOException {
        GenericTree<String> tree = GenericTree.withRoot("A", new TreeSettings(true));
        TreeNode<String> b = tree.getRoot().addChild("B");
        b.addChild("D");
        tree.getRoot().addChild("C");

        assertEquals("""
                Depth: 0 Data: A
                Depth: 1 Data: B
                Depth: 2 Data: D
                Depth: 1 Data: C
                """, render(tree));
    }

    @Test
    void testPrintDoesNotMutate() throws IOException {
        GenericTree<String> tree = GenericTree.withRoot("A");
        TreeNode<String> b = tree.getRoot().addChild("B");
        tree.getRoot().addChild("C");
        tree.deleteSubtree(b);

        String first = render(tree);
        assertEquals(first, render(tree));
        assertTrue(tree.getRoot().childSlots().get(0).isTombstone());
    }

    @Test
    void testRenderAppendsToExistingContent() throws IOException {
        StringBuilder out = new StringBuilder("> ");
        StringBuilder returned = new TreeRenderer<String>(false).render(null, out);
        assertSame(out, returned);
        assertEquals("> [empty tree]\n", out.toString());
    }

    @Test
    void testDeepChainRendersIteratively() {
        GenericTree<Integer> tree = GenericTree.withRoot(0);
        TreeNode<Integer> cur = tree.getRoot();
        for (int i = 1; i <= 300; i++) {
            cur = cur.addChild(i);
        }
        String out = tree.toString();
        String[] lines = out.split("\n");
        assertEquals(1 + 2 * 300, lines.length);
        assertEquals(" ".repeat(3 * 299) + "|_ 300", lines[lines.length - 1]);
    }
}
