package max.repertoire.tree;

import max.repertoire.common.Color;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A position of the repertoire and the move that reached it.
 * The parent is only known by id: ownership flows from the root to the leaves.
 */
public final class Node {
    public static final long NO_PARENT = -1L;

    private final long id;
    private final String position;
    private final String move;
    private final int plyIndex;
    private final Color sideToMove;
    private final long parentId;
    private final List<Node> children = new ArrayList<>();
    private String comment;

    Node(long id, String position, String move, int plyIndex, Color sideToMove, long parentId) {
        this.id = id;
        this.position = position;
        this.move = move;
        this.plyIndex = plyIndex;
        this.sideToMove = sideToMove;
        this.parentId = parentId;
    }

    public long id() {
        return id;
    }

    public String position() {
        return position;
    }

    /** @return the move in short algebraic notation, null for the root. */
    public String move() {
        return move;
    }

    public int plyIndex() {
        return plyIndex;
    }

    public Color sideToMove() {
        return sideToMove;
    }

    public long parentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == NO_PARENT;
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<Node> childByMove(String move) {
        for(Node child : children) {
            if(child.move.equals(move)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public String comment() {
        return comment;
    }

    void setComment(String comment) {
        this.comment = comment;
    }

    void appendChild(Node child) {
        children.add(child);
    }

    boolean removeChild(Node child) {
        return children.remove(child);
    }

    @Override
    public String toString() {
        return "Node{" +
                "id=" + id +
                ", move=" + move +
                ", ply=" + plyIndex +
                ", children=" + children.size() +
                '}';
    }
}
