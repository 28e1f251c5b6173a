package max.repertoire.tree;

import max.repertoire.common.Color;
import max.repertoire.rules.ChessRulesEngine;
import max.repertoire.rules.ChessRulesEngineImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TreeMutatorTest {
    private final ChessRulesEngine rules = new ChessRulesEngineImpl();
    private final TreeMutator mutator = new TreeMutator(rules);
    private RepertoireTree tree;

    @BeforeEach
    public void setup() {
        tree = RepertoireTree.newRepertoire("Italian", Color.WHITE, rules.startingPosition());
    }

    private long rootId() {
        return tree.root().id();
    }

    private static ErrorKind kindOf(Runnable action) {
        return assertThrows(RepertoireException.class, action::run).kind();
    }

    // Every path from the root, e.g. "e4 e5 Nf3"
    private static Set<String> lines(RepertoireTree tree) {
        Set<String> lines = new HashSet<>();
        for(Node node : tree.nodes()) {
            List<String> moves = new ArrayList<>();
            for(Node step : tree.pathTo(node.id())) {
                if(!step.isRoot()) {
                    moves.add(step.move());
                }
            }
            lines.add(String.join(" ", moves));
        }
        return lines;
    }

    private static void assertInvariants(RepertoireTree tree) {
        int count = 0;
        int deepest = 0;
        for(Node node : tree.nodes()) {
            count++;
            deepest = Math.max(deepest, node.plyIndex());
            Set<String> moves = new HashSet<>();
            for(Node child : node.children()) {
                assertTrue(moves.add(child.move()), "duplicate move "+child.move()+" under "+node.id());
                assertEquals(node.plyIndex() + 1, child.plyIndex());
                assertEquals(node.id(), child.parentId());
                assertEquals(node.sideToMove().getOppositeColor(), child.sideToMove());
            }
        }
        assertTrue(tree.root().isRoot());
        assertNull(tree.root().move());
        assertEquals(new TreeMetadata(count, count - 1, deepest), tree.metadata());
    }

    @Test
    public void newTree_shouldHoldOnlyTheRoot() {
        assertEquals(new TreeMetadata(1, 0, 0), tree.metadata());
        assertEquals(0, tree.root().plyIndex());
        assertEquals(Color.WHITE, tree.root().sideToMove());
        assertEquals(rules.startingPosition(), tree.root().position());
    }

    @Test
    public void addNode_shouldAppendALegalChild() {
        // When
        Node e4 = mutator.addNode(tree, rootId(), "e4");

        // Then
        assertEquals("e4", e4.move());
        assertEquals(1, e4.plyIndex());
        assertEquals(Color.BLACK, e4.sideToMove());
        assertEquals("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq -", e4.position());
        assertEquals(new TreeMetadata(2, 1, 1), tree.metadata());
        assertInvariants(tree);
    }

    @Test
    public void addNode_shouldRejectTheSameMoveTwiceWhateverItsNotation() {
        // Given
        mutator.addNode(tree, rootId(), "e4");

        // Then
        assertEquals(ErrorKind.MOVE_EXISTS, kindOf(() -> mutator.addNode(tree, rootId(), "e4")));
        assertEquals(ErrorKind.MOVE_EXISTS, kindOf(() -> mutator.addNode(tree, rootId(), "e2e4")));
        assertEquals(1, tree.root().children().size());
    }

    @Test
    public void addNode_shouldReportMissingParentBeforeIllegalMove() {
        assertEquals(ErrorKind.PARENT_NOT_FOUND, kindOf(() -> mutator.addNode(tree, 42L, "e5")));
        assertEquals(ErrorKind.INVALID_MOVE, kindOf(() -> mutator.addNode(tree, rootId(), "e5")));
        assertEquals(ErrorKind.INVALID_MOVE, kindOf(() -> mutator.addNode(tree, rootId(), "garbage")));
        assertEquals(new TreeMetadata(1, 0, 0), tree.metadata());
    }

    @Test
    public void addThenDelete_shouldRestoreTheTree() {
        // Given
        mutator.addLine(tree, rootId(), List.of("e4", "e5"));
        TreeMetadata before = tree.metadata();
        Set<String> linesBefore = lines(tree);
        long e5 = tree.root().children().get(0).children().get(0).id();

        // When
        Node nf3 = mutator.addNode(tree, e5, "Nf3");
        mutator.deleteNode(tree, nf3.id());

        // Then
        assertEquals(before, tree.metadata());
        assertEquals(linesBefore, lines(tree));
        assertFalse(tree.contains(nf3.id()));
    }

    @Test
    public void deleteNode_shouldRecomputeTheDeepestLine() {
        // Given
        Node nf3 = mutator.addLine(tree, rootId(), List.of("e4", "e5", "Nf3"));
        mutator.addNode(tree, rootId(), "d4");
        long e4 = tree.root().children().get(0).id();

        // When
        TreeMetadata metadata = mutator.deleteNode(tree, e4);

        // Then
        assertEquals(new TreeMetadata(2, 1, 1), metadata);
        assertFalse(tree.contains(nf3.id()));
        assertEquals(Set.of("", "d4"), lines(tree));
        assertInvariants(tree);
    }

    @Test
    public void deleteNode_shouldRefuseTheRootAndUnknownNodes() {
        assertEquals(ErrorKind.CANNOT_DELETE_ROOT, kindOf(() -> mutator.deleteNode(tree, rootId())));
        assertEquals(ErrorKind.NODE_NOT_FOUND, kindOf(() -> mutator.deleteNode(tree, 99L)));
    }

    @Test
    public void manyInsertions_shouldKeepEveryInvariant() {
        // When
        mutator.addLine(tree, rootId(), List.of("e4", "e5", "Nf3", "Nc6", "Bc4"));
        mutator.addLine(tree, rootId(), List.of("e4", "e5", "Nf3", "Nc6", "Bb5"));
        mutator.addLine(tree, rootId(), List.of("e4", "c5", "Nf3"));
        mutator.addLine(tree, rootId(), List.of("d4", "d5", "c4"));
        mutator.addLine(tree, rootId(), List.of("Nf3", "d5", "d4"));

        // Then
        assertEquals(new TreeMetadata(15, 14, 5), tree.metadata());
        assertInvariants(tree);
    }

    @Test
    public void addLine_shouldValidateTheWholeLineFirst() {
        // Given
        mutator.addNode(tree, rootId(), "e4");

        // When
        ErrorKind kind = kindOf(() -> mutator.addLine(tree, rootId(), List.of("e4", "e5", "Ke3")));

        // Then
        assertEquals(ErrorKind.INVALID_MOVE, kind);
        assertEquals(new TreeMetadata(2, 1, 1), tree.metadata());
    }

    @Test
    public void extractSubtree_shouldRefuseTheRoot() {
        assertEquals(ErrorKind.CANNOT_EXTRACT_ROOT, kindOf(() -> mutator.extractSubtree(tree, rootId(), "x")));
        assertEquals(ErrorKind.NODE_NOT_FOUND, kindOf(() -> mutator.extractSubtree(tree, 7L, "x")));
    }

    @Test
    public void extractSubtree_ofALeaf_shouldGiveASingleNodeTree() {
        // Given
        Node leaf = mutator.addLine(tree, rootId(), List.of("e4", "e5"));

        // When
        RepertoireTree extracted = mutator.extractSubtree(tree, leaf.id(), "x");

        // Then
        assertEquals(0, extracted.root().plyIndex());
        assertEquals(leaf.position(), extracted.root().position());
        assertEquals(Color.WHITE, extracted.root().sideToMove());
        assertEquals(new TreeMetadata(1, 0, 0), extracted.metadata());
        assertEquals("x", extracted.name());
    }

    @Test
    public void extractSubtree_shouldReRootACopyAndLeaveTheSourceAlone() {
        // Given
        mutator.addLine(tree, rootId(), List.of("e4", "e5", "Nf3"));
        mutator.addLine(tree, rootId(), List.of("e4", "c5"));
        Node e4 = tree.root().children().get(0);
        mutator.updateComment(tree, e4.id(), "King pawn");
        TreeMetadata sourceBefore = tree.metadata();

        // When
        RepertoireTree extracted = mutator.extractSubtree(tree, e4.id(), "1.e4");

        // Then
        assertEquals(new TreeMetadata(4, 3, 2), extracted.metadata());
        assertEquals(Color.BLACK, extracted.root().sideToMove());
        assertEquals("King pawn", extracted.root().comment());
        assertEquals(Set.of("", "e5", "e5 Nf3", "c5"), lines(extracted));
        assertEquals(Color.WHITE, extracted.colorOwned());
        assertFalse(extracted.id().equals(tree.id()));
        assertEquals(sourceBefore, tree.metadata());
        assertInvariants(extracted);
    }

    @Test
    public void mergingATreeWithACopyOfItself_shouldBeIdempotent() {
        // Given
        mutator.addLine(tree, rootId(), List.of("e4", "e5", "Nf3"));
        mutator.addLine(tree, rootId(), List.of("e4", "c5"));
        mutator.addLine(tree, rootId(), List.of("d4"));
        RepertoireTree copy = tree.copyAs("copy", "Italian copy");

        // When
        MergeResult result = mutator.mergeRepertoires(List.of(tree, copy), "merged");

        // Then
        assertEquals(lines(tree), lines(result.merged()));
        assertEquals(tree.metadata(), result.merged().metadata());
        assertTrue(result.annotationConflicts().isEmpty());
        assertInvariants(result.merged());
    }

    @Test
    public void merge_shouldUniteLinesByMove() {
        // Given
        RepertoireTree other = RepertoireTree.newRepertoire("Sicilian", Color.WHITE, rules.startingPosition());
        mutator.addLine(tree, rootId(), List.of("e4", "e5"));
        mutator.addLine(other, other.root().id(), List.of("e4", "c5"));
        mutator.addNode(other, other.root().id(), "d4");

        // When
        RepertoireTree merged = mutator.mergeRepertoires(List.of(tree, other), "White").merged();

        // Then
        assertEquals(new TreeMetadata(5, 4, 2), merged.metadata());
        assertEquals(List.of("e4", "d4"), merged.root().children().stream().map(Node::move).toList());
        assertEquals(List.of("e5", "c5"), merged.root().children().get(0).children().stream().map(Node::move).toList());
        assertEquals("White", merged.name());
        assertInvariants(merged);
    }

    @Test
    public void merge_shouldKeepTheFirstCommentAndReportTheOthers() {
        // Given
        RepertoireTree other = RepertoireTree.newRepertoire("Other", Color.WHITE, rules.startingPosition());
        Node e4 = mutator.addNode(tree, rootId(), "e4");
        mutator.updateComment(tree, e4.id(), "main line");
        Node otherE5 = mutator.addLine(other, other.root().id(), List.of("e4", "e5"));
        mutator.updateComment(other, other.root().children().get(0).id(), "sharp");
        mutator.updateComment(other, otherE5.id(), "symmetric");

        // When
        MergeResult result = mutator.mergeRepertoires(List.of(tree, other), "merged");

        // Then
        Node mergedE4 = result.merged().root().children().get(0);
        assertEquals("main line", mergedE4.comment());
        assertEquals("symmetric", mergedE4.children().get(0).comment());
        assertEquals(1, result.annotationConflicts().size());
        AnnotationConflict conflict = result.annotationConflicts().get(0);
        assertEquals("e4", conflict.move());
        assertEquals("main line", conflict.keptComment());
        assertEquals("sharp", conflict.discardedComment());
        assertEquals(other.id(), conflict.sourceTreeId());
    }

    @Test
    public void merge_shouldRejectInvalidSources() {
        // Given
        RepertoireTree black = RepertoireTree.newRepertoire("Black", Color.BLACK, rules.startingPosition());
        RepertoireTree elsewhere = RepertoireTree.newRepertoire("Elsewhere", Color.WHITE,
                "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq -");

        // Then
        assertEquals(ErrorKind.MERGE_MINIMUM_TWO, kindOf(() -> mutator.mergeRepertoires(List.of(tree), "x")));
        assertEquals(ErrorKind.DUPLICATE_SOURCES, kindOf(() -> mutator.mergeRepertoires(List.of(tree, tree), "x")));
        assertEquals(ErrorKind.COLOR_MISMATCH, kindOf(() -> mutator.mergeRepertoires(List.of(tree, black), "x")));
        assertEquals(ErrorKind.ROOT_MISMATCH, kindOf(() -> mutator.mergeRepertoires(List.of(tree, elsewhere), "x")));
    }

    @Test
    public void updateComment_shouldTrimAndClear() {
        // Given
        Node e4 = mutator.addNode(tree, rootId(), "e4");

        // When / Then
        assertEquals("best by test", mutator.updateComment(tree, e4.id(), "  best by test ").comment());
        assertNull(mutator.updateComment(tree, e4.id(), "   ").comment());
        assertEquals(ErrorKind.NODE_NOT_FOUND, kindOf(() -> mutator.updateComment(tree, 12L, "x")));
    }

    @Test
    public void graft_shouldMergeAFragmentAtTheMatchingNode() {
        // Given
        Node e4 = mutator.addLine(tree, rootId(), List.of("e4"));
        mutator.addNode(tree, e4.id(), "e5");
        RepertoireTree fragment = RepertoireTree.newRepertoire("video", Color.BLACK, e4.position());
        mutator.addLine(fragment, fragment.root().id(), List.of("e5", "Nf3"));
        Node c5 = mutator.addNode(fragment, fragment.root().id(), "c5");
        mutator.updateComment(fragment, c5.id(), "Sicilian");

        // When
        int created = mutator.graft(tree, fragment);

        // Then
        assertEquals(2, created);
        assertEquals(Set.of("", "e4", "e4 e5", "e4 e5 Nf3", "e4 c5"), lines(tree));
        assertEquals("Sicilian", tree.root().children().get(0).childByMove("c5").orElseThrow().comment());
        assertInvariants(tree);
    }

    @Test
    public void graft_shouldRefuseAFragmentFromElsewhere() {
        // Given
        RepertoireTree fragment = RepertoireTree.newRepertoire("video", Color.WHITE, "4k3/8/8/8/8/8/8/4K3 w - -");

        // Then
        assertEquals(ErrorKind.ROOT_MISMATCH, kindOf(() -> mutator.graft(tree, fragment)));
    }
}
