package max.repertoire.tree;

import java.util.ArrayDeque;
import java.util.Deque;

public record TreeMetadata(int totalNodes, int totalMoves, int deepestDepth) {

    public static TreeMetadata ofSingleRoot() {
        return new TreeMetadata(1, 0, 0);
    }

    /** Full traversal from the root. */
    public static TreeMetadata of(Node root) {
        int totalNodes = 0;
        int deepestDepth = 0;
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while(!stack.isEmpty()) {
            Node node = stack.pop();
            totalNodes++;
            deepestDepth = Math.max(deepestDepth, node.plyIndex());
            for(Node child : node.children()) {
                stack.push(child);
            }
        }
        return new TreeMetadata(totalNodes, totalNodes - 1, deepestDepth);
    }

    TreeMetadata withAddedNode(int plyIndex) {
        return new TreeMetadata(totalNodes + 1, totalMoves + 1, Math.max(deepestDepth, plyIndex));
    }
}
