package max.repertoire.video;

import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongLinkedOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2LongOpenHashMap;
import max.repertoire.common.Color;
import max.repertoire.rules.ChessRulesEngine;
import max.repertoire.rules.MoveValidation;
import max.repertoire.tree.ErrorKind;
import max.repertoire.tree.Node;
import max.repertoire.tree.RepertoireException;
import max.repertoire.tree.RepertoireTree;
import max.repertoire.tree.TreeMutator;
import max.repertoire.utils.notations.FENUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Builds a tree fragment out of the positions recognized on a video.
 * <p>
 * Each sample is connected to the fragment's cursor by a short sequence of legal moves. A sample
 * that cannot be connected never fails the run: the cursor may jump back to a node showing the same
 * board, branch from a recently visited node, or, as a last resort, the pair is reported as an
 * {@link UnlinkedGap} and the cursor stays where it is.
 * <p>
 * Moves define the fragment: a position reached through two different move orders is stored twice.
 * Cancellation is checked between samples.
 */
public class VideoPositionReconciler {
    private static final Logger log = LoggerFactory.getLogger(VideoPositionReconciler.class);
    public static final String FRAGMENT_NAME = "Video import";
    private static final long NO_NODE = -1L;

    private final TreeMutator mutator;
    private final ChessRulesEngine rules;
    private final ReconcilerConfig config;

    public VideoPositionReconciler(TreeMutator mutator, ReconcilerConfig config) {
        this.mutator = Objects.requireNonNull(mutator);
        this.rules = mutator.rules();
        this.config = Objects.requireNonNull(config);
    }

    public ReconcilerConfig config() {
        return config;
    }

    public ReconciliationResult reconcile(List<VideoSample> samples) {
        return reconcile(samples, new AtomicBoolean(), event -> {});
    }

    public ReconciliationResult reconcile(List<VideoSample> samples, AtomicBoolean stopFlag, Consumer<ProgressEvent> progress) {
        if(samples == null || samples.isEmpty()) {
            throw new RepertoireException(ErrorKind.INVALID_INPUT_SEQUENCE, "no samples to reconcile");
        }
        BuildLog buildLog = new BuildLog();
        Screening screening = screen(samples, buildLog);
        List<VideoSample> usable = screening.usable;
        if(usable.isEmpty()) {
            throw new RepertoireException(ErrorKind.INVALID_INPUT_SEQUENCE, "no usable samples among "+samples.size());
        }
        progress.accept(ProgressEvent.of(ProgressStatus.BUILDING_TREE, 0, "building tree from "+usable.size()+" positions"));

        String rootPosition = resolveRootPosition(usable);
        Color rootSide = FENUtils.getSideToMove(rootPosition).orElse(Color.WHITE);
        Run run = new Run(RepertoireTree.newRepertoire(FRAGMENT_NAME, rootSide, rootPosition), buildLog);
        run.unlinked(screening.rejectedBeforeFirst);
        run.unlinked(screening.rejectedAfter.get(0));

        boolean cancelled = false;
        for(int i = 1; i < usable.size(); i++) {
            if(stopFlag.get()) {
                cancelled = true;
                log.info("Reconciliation cancelled after {} of {} samples", i - 1, usable.size() - 1);
                break;
            }
            run.accept(usable.get(i));
            run.unlinked(screening.rejectedAfter.get(i));
            progress.accept(ProgressEvent.of(ProgressStatus.BUILDING_TREE, i * 100 / (usable.size() - 1),
                    "processed frame "+usable.get(i).frameIndex()));
        }

        RepertoireTree fragment = run.fragment;
        if(fragment.root().children().isEmpty() && fragment.colorOwned() != Color.WHITE) {
            fragment = RepertoireTree.newRepertoire(FRAGMENT_NAME, Color.WHITE, rootPosition);
        }
        log.info("Reconciled {} samples into {} nodes, {} gaps, {} filtered, {} fallbacks",
                usable.size(), fragment.metadata().totalNodes(), run.gaps.size(),
                buildLog.filtered().size(), buildLog.fallbacks().size());
        return new ReconciliationResult(fragment, List.copyOf(run.gaps), buildLog, cancelled);
    }

    /**
     * Splits the samples into the usable ones, without consecutive duplicates, and the rejected ones,
     * each kept behind the usable sample it followed so it can be reported from the right cursor.
     */
    private Screening screen(List<VideoSample> samples, BuildLog buildLog) {
        Set<VideoSample> rejected = Collections.newSetFromMap(new IdentityHashMap<>());
        List<VideoSample> readable = new ArrayList<>(samples.size());
        for(VideoSample sample : samples) {
            try {
                FENUtils.getBoardFrom(sample.position());
                readable.add(sample);
            } catch (IllegalArgumentException e) {
                buildLog.filtered(sample, "unreadable: "+e.getMessage());
                rejected.add(sample);
            }
        }
        if(config.structuralFilter) {
            List<VideoSample> impossible = new ArrayList<>();
            for(VideoSample sample : readable) {
                Optional<String> reason = StructuralFilter.rejectionReason(sample.position());
                if(reason.isPresent()) {
                    log.debug("Frame {} rejected: {}", sample.frameIndex(), reason.get());
                    buildLog.filtered(sample, reason.get());
                    impossible.add(sample);
                }
            }
            if(!readable.isEmpty() && impossible.size() == readable.size()) {
                buildLog.usedUnfilteredSamples();
            } else {
                rejected.addAll(impossible);
            }
        }

        Screening screening = new Screening();
        String previous = null;
        for(VideoSample sample : samples) {
            if(rejected.contains(sample)) {
                screening.rejectedAt(sample);
                continue;
            }
            String placement = FENUtils.getPiecePlacement(sample.position());
            if(!placement.equals(previous)) {
                screening.usable.add(sample);
                screening.rejectedAfter.add(new ArrayList<>());
                previous = placement;
            }
        }
        return screening;
    }

    private static final class Screening {
        private final List<VideoSample> usable = new ArrayList<>();
        private final List<VideoSample> rejectedBeforeFirst = new ArrayList<>();
        private final List<List<VideoSample>> rejectedAfter = new ArrayList<>();

        void rejectedAt(VideoSample sample) {
            if(usable.isEmpty()) {
                rejectedBeforeFirst.add(sample);
            } else {
                rejectedAfter.get(usable.size() - 1).add(sample);
            }
        }
    }

    /**
     * The first sample, completed into a four-field FEN. A bare board gets white to move unless only
     * black to move lets the fragment leave the root.
     */
    private String resolveRootPosition(List<VideoSample> samples) {
        String first = samples.get(0).position();
        if(!FENUtils.isPlacementOnly(first)) {
            return FENUtils.getNormalizedFEN(FENUtils.getBoardFrom(first));
        }
        String asWhite = FENUtils.getNormalizedFEN(FENUtils.getBoardFrom(first + " w"));
        if(samples.size() < 2) {
            return asWhite;
        }
        String next = samples.get(1).position();
        if(rules.findConnectingMoves(asWhite, next, config.maxSearchDepth).isPresent()) {
            return asWhite;
        }
        String asBlack = FENUtils.getNormalizedFEN(FENUtils.getBoardFrom(first + " b"));
        if(rules.findConnectingMoves(asBlack, next, config.maxSearchDepth).isPresent()) {
            log.debug("Root {} resolved with black to move", first);
            return asBlack;
        }
        return asWhite;
    }

    /** State of one reconciliation. */
    private final class Run {
        private final RepertoireTree fragment;
        private final BuildLog buildLog;
        private final List<UnlinkedGap> gaps = new ArrayList<>();
        private final Object2LongOpenHashMap<String> nodeByBoard = new Object2LongOpenHashMap<>();
        private final LongLinkedOpenHashSet recentlyVisited = new LongLinkedOpenHashSet();
        private Node cursor;

        private Run(RepertoireTree fragment, BuildLog buildLog) {
            this.fragment = fragment;
            this.buildLog = buildLog;
            this.nodeByBoard.defaultReturnValue(NO_NODE);
            this.cursor = fragment.root();
            visit(cursor);
        }

        void accept(VideoSample sample) {
            String board = FENUtils.getPiecePlacement(sample.position());
            if(board.equals(FENUtils.getPiecePlacement(cursor.position()))) {
                return;
            }

            long known = nodeByBoard.getLong(board);
            // The video went back along the line it was showing
            if(known != NO_NODE && isAncestorOfCursor(known)) {
                jumpTo(sample, known);
                return;
            }

            Optional<List<String>> connection = rules.findConnectingMoves(cursor.position(), sample.position(), config.maxSearchDepth);
            if(connection.isPresent() && !connection.get().isEmpty()) {
                log.debug("Frame {}: {} from node {}", sample.frameIndex(), connection.get(), cursor.id());
                cursor = append(cursor, connection.get());
                return;
            }

            // Another line shown again
            if(known != NO_NODE) {
                jumpTo(sample, known);
                return;
            }

            if(branchFromRecent(sample)) {
                return;
            }

            if(config.closestMoveFallback && closestMove(sample)) {
                return;
            }

            log.debug("Frame {}: no connection from node {}", sample.frameIndex(), cursor.id());
            gaps.add(new UnlinkedGap(cursor.position(), sample));
        }

        // Rejected samples never move the cursor
        void unlinked(List<VideoSample> rejected) {
            for(VideoSample sample : rejected) {
                gaps.add(new UnlinkedGap(cursor.position(), sample));
            }
        }

        private boolean branchFromRecent(VideoSample sample) {
            int tried = 0;
            LongIterator iterator = recentlyVisited.iterator();
            while(iterator.hasNext() && tried < config.resyncCandidates) {
                long nodeId = iterator.nextLong();
                if(nodeId == cursor.id()) {
                    continue;
                }
                tried++;
                Node candidate = fragment.findNode(nodeId).orElseThrow();
                Optional<List<String>> connection = rules.findConnectingMoves(candidate.position(), sample.position(), config.resyncSearchDepth);
                if(connection.isPresent() && !connection.get().isEmpty()) {
                    log.debug("Frame {}: branching {} from node {}", sample.frameIndex(), connection.get(), nodeId);
                    buildLog.resync(sample, nodeId, false);
                    cursor = append(candidate, connection.get());
                    return true;
                }
            }
            return false;
        }

        private boolean closestMove(VideoSample sample) {
            String best = null;
            MoveValidation bestValidation = null;
            int bestDiff = config.closestMoveMaxDiff + 1;
            for(String move : rules.legalMoves(cursor.position())) {
                MoveValidation validation = rules.validateMove(cursor.position(), move);
                int diff = FENUtils.countBoardDiffs(validation.resultPosition(), sample.position());
                if(diff < bestDiff) {
                    best = validation.san();
                    bestValidation = validation;
                    bestDiff = diff;
                }
            }
            if(best == null) {
                return false;
            }
            log.debug("Frame {}: closest move {} ({} squares off)", sample.frameIndex(), best, bestDiff);
            buildLog.fallback(sample, best, bestValidation.resultPosition(), bestDiff);
            cursor = append(cursor, List.of(best));
            return true;
        }

        private void jumpTo(VideoSample sample, long nodeId) {
            log.debug("Frame {}: back to node {}", sample.frameIndex(), nodeId);
            buildLog.resync(sample, nodeId, true);
            cursor = fragment.findNode(nodeId).orElseThrow();
            visit(cursor);
        }

        private Node append(Node from, List<String> moves) {
            Node last = mutator.addLine(fragment, from.id(), moves);
            Node node = from;
            for(String move : moves) {
                node = node.childByMove(move).orElse(last);
                visit(node);
            }
            return last;
        }

        private void visit(Node node) {
            nodeByBoard.put(FENUtils.getPiecePlacement(node.position()), node.id());
            recentlyVisited.addAndMoveToFirst(node.id());
        }

        private boolean isAncestorOfCursor(long nodeId) {
            Node node = cursor;
            while(!node.isRoot()) {
                node = fragment.findNode(node.parentId()).orElseThrow();
                if(node.id() == nodeId) {
                    return true;
                }
            }
            return false;
        }
    }
}
