package max.repertoire.tree;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import max.repertoire.common.Color;
import max.repertoire.utils.notations.FENUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * The move tree of one repertoire. The tree owns every node; nodes are indexed by id so parent
 * references stay plain ids.
 * <p>
 * Not thread-safe: mutations go through {@link TreeMutator} under the caller's single-writer lock.
 */
public final class RepertoireTree {
    private final String id;
    private String name;
    private final Color colorOwned;
    private final Node root;
    private final Long2ObjectOpenHashMap<Node> index = new Long2ObjectOpenHashMap<>();
    private TreeMetadata metadata;
    private long nextNodeId;

    RepertoireTree(String id, String name, Color colorOwned, String rootPosition) {
        this.id = Objects.requireNonNull(id);
        this.name = name;
        this.colorOwned = Objects.requireNonNull(colorOwned);
        Color rootSide = FENUtils.getSideToMove(rootPosition).orElse(Color.WHITE);
        this.root = new Node(nextNodeId++, rootPosition, null, 0, rootSide, Node.NO_PARENT);
        this.index.put(root.id(), root);
        this.metadata = TreeMetadata.ofSingleRoot();
    }

    /** A fresh tree holding only its root. */
    public static RepertoireTree newRepertoire(String name, Color colorOwned, String rootPosition) {
        return new RepertoireTree(UUID.randomUUID().toString(), name, colorOwned, rootPosition);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    void rename(String name) {
        this.name = name;
    }

    public Color colorOwned() {
        return colorOwned;
    }

    public Node root() {
        return root;
    }

    public TreeMetadata metadata() {
        return metadata;
    }

    public Optional<Node> findNode(long nodeId) {
        return Optional.ofNullable(index.get(nodeId));
    }

    public boolean contains(long nodeId) {
        return index.containsKey(nodeId);
    }

    /** Root first, target last; empty if the node is not in this tree. */
    public List<Node> pathTo(long nodeId) {
        Node node = index.get(nodeId);
        if(node == null) {
            return List.of();
        }
        List<Node> path = new ArrayList<>(node.plyIndex() + 1);
        while(node != null) {
            path.add(node);
            node = node.isRoot() ? null : index.get(node.parentId());
        }
        Collections.reverse(path);
        return path;
    }

    /** Every node, breadth first from the root. */
    public List<Node> nodes() {
        List<Node> nodes = new ArrayList<>(index.size());
        Deque<Node> queue = new ArrayDeque<>();
        queue.add(root);
        while(!queue.isEmpty()) {
            Node node = queue.poll();
            nodes.add(node);
            queue.addAll(node.children());
        }
        return nodes;
    }

    /**
     * The shallowest node showing the same board as {@code position}, with the same side to move when
     * {@code position} carries one. Castling and en passant fields are not compared.
     */
    public Optional<Node> findPosition(String position) {
        String placement = FENUtils.getPiecePlacement(position);
        Optional<Color> side = FENUtils.getSideToMove(position);
        for(Node node : nodes()) {
            if(FENUtils.getPiecePlacement(node.position()).equals(placement)
                    && (side.isEmpty() || side.get() == node.sideToMove())) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    Node attachChild(Node parent, String position, String move) {
        Node child = new Node(nextNodeId++, position, move, parent.plyIndex() + 1,
                parent.sideToMove().getOppositeColor(), parent.id());
        parent.appendChild(child);
        index.put(child.id(), child);
        metadata = metadata.withAddedNode(child.plyIndex());
        return child;
    }

    void detach(Node node) {
        Node parent = index.get(node.parentId());
        if(parent == null || !parent.removeChild(node)) {
            throw new IllegalStateException("Node "+node.id()+" is not attached to tree "+id);
        }
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(node);
        while(!stack.isEmpty()) {
            Node removed = stack.pop();
            index.remove(removed.id());
            for(Node child : removed.children()) {
                stack.push(child);
            }
        }
        recomputeMetadata();
    }

    void recomputeMetadata() {
        metadata = TreeMetadata.of(root);
    }

    /** Deep copy keeping the identity and node ids: a consistent snapshot for readers. */
    public RepertoireTree copy() {
        return copyAs(id, name);
    }

    /** Deep copy under another identity, node ids preserved. */
    public RepertoireTree copyAs(String newId, String newName) {
        RepertoireTree copy = new RepertoireTree(newId, newName, colorOwned, root.position());
        copy.root.setComment(root.comment());
        copyChildren(root, copy.root, copy);
        copy.nextNodeId = nextNodeId;
        copy.metadata = metadata;
        return copy;
    }

    private static void copyChildren(Node source, Node target, RepertoireTree targetTree) {
        for(Node child : source.children()) {
            Node copied = new Node(child.id(), child.position(), child.move(), child.plyIndex(),
                    child.sideToMove(), target.id());
            copied.setComment(child.comment());
            target.appendChild(copied);
            targetTree.index.put(copied.id(), copied);
            copyChildren(child, copied, targetTree);
        }
    }

    @Override
    public String toString() {
        return "RepertoireTree{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", color=" + colorOwned +
                ", metadata=" + metadata +
                '}';
    }
}
