package max.repertoire.tree;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import max.repertoire.rules.ChessRulesEngine;
import max.repertoire.rules.MoveValidation;
import max.repertoire.utils.notations.FENUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The only place nodes are created and destroyed. Every operation leaves the five tree invariants
 * intact: root without move or parent, children legal successors of their parent, one child per move,
 * plies increasing by one, metadata matching the reachable nodes.
 * <p>
 * Operations are synchronous and must be serialized per tree by the caller.
 */
public class TreeMutator {
    private static final Logger log = LoggerFactory.getLogger(TreeMutator.class);

    private record SourceNode(String treeId, Node node) {}

    private final ChessRulesEngine rules;

    public TreeMutator(ChessRulesEngine rules) {
        this.rules = Objects.requireNonNull(rules);
    }

    public ChessRulesEngine rules() {
        return rules;
    }

    public Node addNode(RepertoireTree tree, long parentId, String move) {
        Node parent = tree.findNode(parentId)
                .orElseThrow(() -> new RepertoireException(ErrorKind.PARENT_NOT_FOUND, "parent node not found: "+parentId));
        MoveValidation validation = validate(parent, move);
        if(parent.childByMove(validation.san()).isPresent()) {
            throw new RepertoireException(ErrorKind.MOVE_EXISTS, "move already exists: "+validation.san());
        }
        Node child = tree.attachChild(parent, validation.resultPosition(), validation.san());
        log.debug("Added {} under node {} of {}", child.move(), parentId, tree.id());
        return child;
    }

    /**
     * Walks {@code moves} from the given node, reusing children that already carry the move and
     * creating the rest. The whole line is validated before the tree is touched.
     * @return the node reached by the last move
     */
    public Node addLine(RepertoireTree tree, long fromNodeId, List<String> moves) {
        Node start = tree.findNode(fromNodeId)
                .orElseThrow(() -> new RepertoireException(ErrorKind.PARENT_NOT_FOUND, "parent node not found: "+fromNodeId));

        List<MoveValidation> line = new ArrayList<>(moves.size());
        String position = start.position();
        for(String move : moves) {
            MoveValidation validation = validate(position, move);
            line.add(validation);
            position = validation.resultPosition();
        }

        Node cursor = start;
        for(MoveValidation validation : line) {
            Optional<Node> existing = cursor.childByMove(validation.san());
            cursor = existing.isPresent()
                    ? existing.get()
                    : tree.attachChild(cursor, validation.resultPosition(), validation.san());
        }
        return cursor;
    }

    public TreeMetadata deleteNode(RepertoireTree tree, long nodeId) {
        if(tree.root().id() == nodeId) {
            throw new RepertoireException(ErrorKind.CANNOT_DELETE_ROOT, "cannot delete root node");
        }
        Node node = tree.findNode(nodeId)
                .orElseThrow(() -> new RepertoireException(ErrorKind.NODE_NOT_FOUND, "node not found: "+nodeId));
        // metadata is recomputed: the deepest line may run through another branch
        tree.detach(node);
        log.debug("Deleted node {} ({}) of {}", nodeId, node.move(), tree.id());
        return tree.metadata();
    }

    /**
     * Copies the subtree rooted at {@code nodeId} into a new tree of the same color. The copy is
     * re-rooted: plies restart at 0, positions are kept as they are. The source tree is left untouched.
     */
    public RepertoireTree extractSubtree(RepertoireTree tree, long nodeId, String newName) {
        if(tree.root().id() == nodeId) {
            throw new RepertoireException(ErrorKind.CANNOT_EXTRACT_ROOT, "cannot extract root node");
        }
        Node node = tree.findNode(nodeId)
                .orElseThrow(() -> new RepertoireException(ErrorKind.NODE_NOT_FOUND, "node not found: "+nodeId));

        RepertoireTree extracted = RepertoireTree.newRepertoire(newName, tree.colorOwned(), node.position());
        extracted.root().setComment(node.comment());
        Deque<Node[]> pending = new ArrayDeque<>();
        pending.push(new Node[]{node, extracted.root()});
        while(!pending.isEmpty()) {
            Node[] pair = pending.pop();
            for(Node child : pair[0].children()) {
                Node copied = extracted.attachChild(pair[1], child.position(), child.move());
                copied.setComment(child.comment());
                pending.push(new Node[]{child, copied});
            }
        }
        extracted.recomputeMetadata();
        log.info("Extracted node {} of {} into {} ({} nodes)", nodeId, tree.id(), extracted.id(),
                extracted.metadata().totalNodes());
        return extracted;
    }

    /**
     * Folds the given trees into a new one, walking them in lock-step from their roots and merging
     * children by move. Comments follow first-source-wins; every comment left out is reported.
     */
    public MergeResult mergeRepertoires(List<RepertoireTree> trees, String newName) {
        if(trees == null || trees.size() < 2) {
            throw new RepertoireException(ErrorKind.MERGE_MINIMUM_TWO, "at least two repertoires are required to merge");
        }
        ObjectOpenHashSet<String> seen = new ObjectOpenHashSet<>();
        for(RepertoireTree tree : trees) {
            if(!seen.add(tree.id())) {
                throw new RepertoireException(ErrorKind.DUPLICATE_SOURCES, "duplicate repertoire: "+tree.id());
            }
        }
        RepertoireTree first = trees.get(0);
        for(RepertoireTree tree : trees) {
            if(tree.colorOwned() != first.colorOwned()) {
                throw new RepertoireException(ErrorKind.COLOR_MISMATCH, "cannot merge repertoires of different colors");
            }
            if(!FENUtils.normalize(tree.root().position()).equals(FENUtils.normalize(first.root().position()))) {
                throw new RepertoireException(ErrorKind.ROOT_MISMATCH, "cannot merge repertoires rooted at different positions");
            }
        }

        RepertoireTree merged = RepertoireTree.newRepertoire(newName, first.colorOwned(), first.root().position());
        List<AnnotationConflict> conflicts = new ArrayList<>();
        List<SourceNode> roots = new ArrayList<>(trees.size());
        for(RepertoireTree tree : trees) {
            roots.add(new SourceNode(tree.id(), tree.root()));
        }
        resolveComment(merged.root(), roots, conflicts);
        mergeChildren(merged, merged.root(), roots, conflicts);
        merged.recomputeMetadata();

        for(AnnotationConflict conflict : conflicts) {
            log.warn("Merge kept comment '{}' on {} and left out '{}' from {}",
                    conflict.keptComment(), conflict.move(), conflict.discardedComment(), conflict.sourceTreeId());
        }
        log.info("Merged {} repertoires into {} ({} nodes)", trees.size(), merged.id(), merged.metadata().totalNodes());
        return new MergeResult(merged, conflicts);
    }

    private void mergeChildren(RepertoireTree merged, Node mergedNode, List<SourceNode> sources, List<AnnotationConflict> conflicts) {
        Map<String, List<SourceNode>> byMove = new LinkedHashMap<>();
        for(SourceNode source : sources) {
            for(Node child : source.node().children()) {
                byMove.computeIfAbsent(child.move(), move -> new ArrayList<>()).add(new SourceNode(source.treeId(), child));
            }
        }
        for(Map.Entry<String, List<SourceNode>> entry : byMove.entrySet()) {
            List<SourceNode> next = entry.getValue();
            Node mergedChild = merged.attachChild(mergedNode, next.get(0).node().position(), entry.getKey());
            resolveComment(mergedChild, next, conflicts);
            mergeChildren(merged, mergedChild, next, conflicts);
        }
    }

    private static void resolveComment(Node mergedNode, List<SourceNode> sources, List<AnnotationConflict> conflicts) {
        for(SourceNode source : sources) {
            String comment = source.node().comment();
            if(comment == null) {
                continue;
            }
            if(mergedNode.comment() == null) {
                mergedNode.setComment(comment);
            } else if(!mergedNode.comment().equals(comment)) {
                conflicts.add(new AnnotationConflict(mergedNode.id(), mergedNode.move(), mergedNode.comment(), comment, source.treeId()));
            }
        }
    }

    /**
     * Merges a detached fragment into the tree, at the shallowest node sharing the fragment root's
     * placement and side to move. Moves are replayed from the tree's own positions.
     * On failure the tree may be partially grafted: callers work on a copy.
     * @return the number of nodes created
     */
    public int graft(RepertoireTree tree, RepertoireTree fragment) {
        Node anchor = tree.findPosition(fragment.root().position())
                .orElseThrow(() -> new RepertoireException(ErrorKind.ROOT_MISMATCH,
                        "fragment root is not a position of "+tree.id()));
        int created = graftChildren(tree, anchor, fragment.root());
        log.info("Grafted fragment {} onto node {} of {}: {} new nodes", fragment.id(), anchor.id(), tree.id(), created);
        return created;
    }

    private int graftChildren(RepertoireTree tree, Node target, Node fragmentNode) {
        int created = 0;
        for(Node fragmentChild : fragmentNode.children()) {
            Optional<Node> existing = target.childByMove(fragmentChild.move());
            Node next;
            if(existing.isPresent()) {
                next = existing.get();
                if(next.comment() == null) {
                    next.setComment(fragmentChild.comment());
                }
            } else {
                MoveValidation validation = validate(target, fragmentChild.move());
                next = target.childByMove(validation.san())
                        .orElseGet(() -> tree.attachChild(target, validation.resultPosition(), validation.san()));
                if(next.comment() == null) {
                    next.setComment(fragmentChild.comment());
                }
                created++;
            }
            created += graftChildren(tree, next, fragmentChild);
        }
        return created;
    }

    public Node updateComment(RepertoireTree tree, long nodeId, String comment) {
        Node node = tree.findNode(nodeId)
                .orElseThrow(() -> new RepertoireException(ErrorKind.NODE_NOT_FOUND, "node not found: "+nodeId));
        String trimmed = comment == null ? "" : comment.trim();
        node.setComment(trimmed.isEmpty() ? null : trimmed);
        return node;
    }

    public void rename(RepertoireTree tree, String name) {
        tree.rename(name);
    }

    private MoveValidation validate(Node parent, String move) {
        return validate(parent.position(), move);
    }

    private MoveValidation validate(String position, String move) {
        MoveValidation validation;
        try {
            validation = rules.validateMove(position, move);
        } catch (IllegalArgumentException e) {
            throw new RepertoireException(ErrorKind.INVALID_MOVE, "invalid move "+move+": "+e.getMessage(), e);
        }
        if(!validation.legal()) {
            throw new RepertoireException(ErrorKind.INVALID_MOVE, "invalid move: "+move);
        }
        return validation;
    }
}
