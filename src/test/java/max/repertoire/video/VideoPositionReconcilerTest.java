package max.repertoire.video;

import max.repertoire.common.Color;
import max.repertoire.rules.ChessRulesEngine;
import max.repertoire.rules.ChessRulesEngineImpl;
import max.repertoire.tree.ErrorKind;
import max.repertoire.tree.Node;
import max.repertoire.tree.RepertoireException;
import max.repertoire.tree.RepertoireTree;
import max.repertoire.tree.TreeMetadata;
import max.repertoire.tree.TreeMutator;
import max.repertoire.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VideoPositionReconcilerTest {
    private static final ChessRulesEngine RULES = new ChessRulesEngineImpl();
    private static final String START = RULES.startingPosition();
    private static final String KINGS_ONLY = "4k3/8/8/8/8/8/8/4K3 w - -";

    private final TreeMutator mutator = new TreeMutator(RULES);
    private final VideoPositionReconciler reconciler = new VideoPositionReconciler(mutator, new ReconcilerConfig.Builder()
            .maxSearchDepth(2)
            .structuralFilter(true)
            .closestMoveFallback(false)
            .build());

    private static String play(String... moves) {
        String position = START;
        for(String move : moves) {
            position = RULES.validateMove(position, move).resultPosition();
        }
        return position;
    }

    private static String board(String position) {
        return FENUtils.getPiecePlacement(position);
    }

    private static List<VideoSample> samples(String... positions) {
        List<VideoSample> samples = new ArrayList<>();
        for(int i = 0; i < positions.length; i++) {
            samples.add(new VideoSample(positions[i], i * 30, i * 1.0));
        }
        return samples;
    }

    private static List<String> movesFromRoot(RepertoireTree tree) {
        List<String> moves = new ArrayList<>();
        Node node = tree.root();
        while(!node.children().isEmpty()) {
            node = node.children().get(0);
            moves.add(node.move());
        }
        return moves;
    }

    @Test
    public void simpleConnect_shouldAppendOneNode() {
        // Given
        String afterD4 = play("d4");

        // When
        ReconciliationResult result = reconciler.reconcile(samples(START, afterD4));

        // Then
        RepertoireTree fragment = result.fragment();
        assertEquals(START, fragment.root().position());
        assertEquals(1, fragment.root().children().size());
        Node d4 = fragment.root().children().get(0);
        assertEquals("d4", d4.move());
        assertEquals(afterD4, d4.position());
        assertTrue(result.unlinkedGaps().isEmpty());
        assertFalse(result.cancelled());
    }

    @Test
    public void unconnectablePair_shouldBeReportedAsAGap() {
        // When
        ReconciliationResult result = reconciler.reconcile(samples(START, KINGS_ONLY));

        // Then
        assertEquals(new TreeMetadata(1, 0, 0), result.fragment().metadata());
        assertEquals(1, result.unlinkedGaps().size());
        UnlinkedGap gap = result.unlinkedGaps().get(0);
        assertEquals(START, gap.fromPosition());
        assertEquals(KINGS_ONLY, gap.to().position());
    }

    @Test
    public void afterAGap_theCursorShouldStayAndLaterSamplesConnect() {
        // When
        ReconciliationResult result = reconciler.reconcile(samples(START, KINGS_ONLY, play("e4"), play("e4", "e5")));

        // Then
        assertEquals(1, result.unlinkedGaps().size());
        assertEquals(List.of("e4", "e5"), movesFromRoot(result.fragment()));
    }

    @Test
    public void duplicateSamples_shouldNotCreateNodes() {
        // When
        ReconciliationResult result = reconciler.reconcile(samples(START, START, play("e4"), play("e4"), play("e4")));

        // Then
        assertEquals(new TreeMetadata(2, 1, 1), result.fragment().metadata());
    }

    @Test
    public void skippedFrames_shouldBeBridgedWithSeveralMoves() {
        // When
        ReconciliationResult result = reconciler.reconcile(samples(START, play("e4", "e5"), play("e4", "e5", "Nf3", "Nc6")));

        // Then
        assertEquals(List.of("e4", "e5", "Nf3", "Nc6"), movesFromRoot(result.fragment()));
        assertEquals(new TreeMetadata(5, 4, 4), result.fragment().metadata());
        assertTrue(result.unlinkedGaps().isEmpty());
    }

    @Test
    public void boardOnlySamples_shouldBeCompleted() {
        // When
        ReconciliationResult result = reconciler.reconcile(samples(
                FENUtils.STARTING_PIECE_PLACEMENT, board(play("e4")), board(play("e4", "c5"))));

        // Then
        assertEquals(START, result.fragment().root().position());
        assertEquals(List.of("e4", "c5"), movesFromRoot(result.fragment()));
        assertEquals(Color.WHITE, result.detectColor());
    }

    @Test
    public void boardOnlyRoot_shouldGetBlackToMoveWhenOnlyBlackCanLeaveIt() {
        // When
        ReconciliationResult result = reconciler.reconcile(samples(board(play("e4")), board(play("e4", "c5"))));

        // Then
        assertEquals(play("e4"), result.fragment().root().position());
        assertEquals(Color.BLACK, result.fragment().root().sideToMove());
        assertEquals(List.of("c5"), movesFromRoot(result.fragment()));
        assertEquals(Color.BLACK, result.detectColor());
        assertEquals(Color.BLACK, result.fragment().colorOwned());
    }

    @Test
    public void goingBackInTheVideo_shouldBranchFromTheEarlierNode() {
        // When
        ReconciliationResult result = reconciler.reconcile(samples(
                START, play("e4"), play("e4", "e5"), play("e4"), play("e4", "c5")));

        // Then
        RepertoireTree fragment = result.fragment();
        assertEquals(new TreeMetadata(4, 3, 2), fragment.metadata());
        Node e4 = fragment.root().children().get(0);
        assertEquals(List.of("e5", "c5"), e4.children().stream().map(Node::move).toList());
        assertTrue(result.unlinkedGaps().isEmpty());
        assertEquals(1, result.buildLog().resyncs().size());
        assertTrue(result.buildLog().resyncs().get(0).jumped());
    }

    @Test
    public void returningToAShownPosition_shouldJumpBackInsteadOfAddingMoves() {
        // When
        // Ng1 Ng8 would also connect the last two samples
        ReconciliationResult result = reconciler.reconcile(samples(
                START, play("Nf3"), play("Nf3", "Nf6"), START));

        // Then
        assertEquals(new TreeMetadata(3, 2, 2), result.fragment().metadata());
        assertEquals(1, result.buildLog().resyncs().size());
    }

    @Test
    public void transposition_shouldBeStoredUnderEachMoveOrder() {
        // Given
        String italian = play("e4", "e5", "Nf3", "Nc6");
        String transposed = play("Nf3", "Nc6", "e4", "e5");

        // When
        ReconciliationResult result = reconciler.reconcile(samples(
                START, play("e4"), play("e4", "e5"), play("e4", "e5", "Nf3"), italian,
                START, play("Nf3"), play("Nf3", "Nc6"), play("Nf3", "Nc6", "e4"), transposed));

        // Then
        RepertoireTree fragment = result.fragment();
        long sameBoard = fragment.nodes().stream().filter(node -> board(node.position()).equals(board(italian))).count();
        assertEquals(2, sameBoard);
        assertEquals(new TreeMetadata(9, 8, 4), fragment.metadata());
        assertTrue(result.unlinkedGaps().isEmpty());
    }

    @Test
    public void impossibleBoards_shouldBeReportedAsGapsWithoutMovingTheCursor() {
        // Given
        String twoWhiteKings = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBKKBNR";

        // When
        ReconciliationResult result = reconciler.reconcile(samples(START, twoWhiteKings, play("e4")));

        // Then
        assertEquals(List.of("e4"), movesFromRoot(result.fragment()));
        assertEquals(1, result.unlinkedGaps().size());
        assertEquals(START, result.unlinkedGaps().get(0).fromPosition());
        assertEquals(twoWhiteKings, result.unlinkedGaps().get(0).to().position());
        assertEquals(1, result.buildLog().filtered().size());
        assertEquals(twoWhiteKings, result.buildLog().filtered().get(0).sample().position());
    }

    @Test
    public void rejectedSample_shouldBeReportedFromTheCursorItInterrupted() {
        // Given
        String pawnOnFirstRank = "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNP";

        // When
        ReconciliationResult pawn = reconciler.reconcile(samples(START, play("e4"), pawnOnFirstRank, play("e4", "e5")));
        ReconciliationResult unreadable = reconciler.reconcile(samples(START, "not-a-board"));

        // Then
        assertEquals(List.of("e4", "e5"), movesFromRoot(pawn.fragment()));
        assertEquals(1, pawn.unlinkedGaps().size());
        assertEquals(board(play("e4")), board(pawn.unlinkedGaps().get(0).fromPosition()));
        assertEquals(1, unreadable.unlinkedGaps().size());
        assertEquals("not-a-board", unreadable.unlinkedGaps().get(0).to().position());
        assertEquals(new TreeMetadata(1, 0, 0), unreadable.fragment().metadata());
    }

    @Test
    public void whenEverySampleIsFiltered_theUnfilteredSamplesShouldBeUsed() {
        // Given
        String noBlackKing = "rnbq1bnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR";
        String noBlackKingAfterE4 = "rnbq1bnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR";

        // When
        ReconciliationResult result = reconciler.reconcile(samples(noBlackKing, noBlackKingAfterE4));

        // Then
        assertTrue(result.buildLog().unfilteredFallback());
        assertEquals(List.of("e4"), movesFromRoot(result.fragment()));
    }

    @Test
    public void noisyFrame_shouldUseTheClosestMoveWhenEnabled() {
        // Given
        // e4 played, but the h7 pawn was not recognized
        String noisyE4 = "rnbqkbnr/ppppppp1/8/8/4P3/8/PPPP1PPP/RNBQKBNR";
        VideoPositionReconciler lenient = new VideoPositionReconciler(mutator, new ReconcilerConfig.Builder()
                .closestMoveFallback(true)
                .closestMoveMaxDiff(4)
                .build());

        // When
        ReconciliationResult strict = reconciler.reconcile(samples(START, noisyE4));
        ReconciliationResult fallback = lenient.reconcile(samples(START, noisyE4));

        // Then
        assertEquals(1, strict.unlinkedGaps().size());
        assertTrue(fallback.unlinkedGaps().isEmpty());
        assertEquals(List.of("e4"), movesFromRoot(fallback.fragment()));
        assertEquals(1, fallback.buildLog().fallbacks().size());
        assertEquals(1, fallback.buildLog().fallbacks().get(0).diff());
    }

    @Test
    public void cancellation_shouldStopBetweenSamples() {
        // Given
        AtomicBoolean stopFlag = new AtomicBoolean(false);
        List<ProgressEvent> events = new ArrayList<>();

        // When
        ReconciliationResult result = reconciler.reconcile(
                samples(START, play("e4"), play("e4", "e5"), play("e4", "e5", "Nf3")),
                stopFlag,
                event -> {
                    events.add(event);
                    if(event.percentComplete() > 0) {
                        stopFlag.set(true);
                    }
                });

        // Then
        assertTrue(result.cancelled());
        assertEquals(new TreeMetadata(2, 1, 1), result.fragment().metadata());
        assertEquals(ProgressStatus.BUILDING_TREE, events.get(0).status());
        assertEquals(2, events.size());
    }

    @Test
    public void noUsableSample_shouldFail() {
        assertEquals(ErrorKind.INVALID_INPUT_SEQUENCE,
                assertThrows(RepertoireException.class, () -> reconciler.reconcile(List.of())).kind());
        assertEquals(ErrorKind.INVALID_INPUT_SEQUENCE,
                assertThrows(RepertoireException.class, () -> reconciler.reconcile(samples("garbage", "more/garbage"))).kind());
    }

    @Test
    public void singleSample_shouldGiveARootOnlyWhiteFragment() {
        // When
        ReconciliationResult result = reconciler.reconcile(samples(play("e4")));

        // Then
        assertEquals(new TreeMetadata(1, 0, 0), result.fragment().metadata());
        assertEquals(Color.WHITE, result.detectColor());
        assertEquals(Color.WHITE, result.fragment().colorOwned());
    }
}
