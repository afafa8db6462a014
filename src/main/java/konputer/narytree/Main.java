package konputer.narytree;

import java.io.IOException;

public class Main {

    static GenericTree<String> sampleTree() {
        GenericTree<String> tree = GenericTree.withRoot("A");
        TreeNode<String> a = tree.getRoot();
        TreeNode<String> b = a.addChild("B");
        b.addChild("E");
        b.addChild("F");
        TreeNode<String> c = a.addChild("C");
        c.addChild("G");
        a.addChild("D");
        return tree;
    }

    public static void main(String[] args) throws IOException {
        try (GenericTree<String> tree = sampleTree()) {
            tree.setShowDebugMessages(TreeSettings.fromSystemProperties().showDebugMessages());
            tree.print(System.out);

            TreeNode<String> c = tree.getRoot().liveChildren().get(1);
            tree.deleteSubtree(c);
            System.out.println("Before compress:");
            tree.print(System.out);

            tree.compress();
            tree.getRoot().addChild("H");
            System.out.println("After compress:");
            tree.print(System.out);
        }
    }
}
