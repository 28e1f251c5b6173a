package max.repertoire.analysis;

import max.repertoire.common.Color;
import max.repertoire.tree.ErrorKind;
import max.repertoire.tree.Node;
import max.repertoire.tree.RepertoireException;
import max.repertoire.tree.RepertoireTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Walks the plies of a game down a repertoire tree. Moves are matched on their notation only:
 * the parser already normalized them and a child's position is always the legal successor of its parent.
 * <p>
 * Once the game leaves the tree it never comes back: every later ply is classified by its mover alone.
 * The tree is only read.
 */
public class GameMatchAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(GameMatchAnalyzer.class);

    /**
     * Starts from the node showing the game's starting position. A game set up from a position the
     * tree never reaches is out of the repertoire from its first ply.
     */
    public GameAnalysis analyzeGame(RepertoireTree tree, ParsedGame game) {
        String start = game.startingPosition();
        Optional<Node> startNode = start == null ? Optional.of(tree.root()) : tree.findPosition(start);
        if(startNode.isEmpty()) {
            log.debug("Starting position {} is not in {}", start, tree.id());
        }
        return analyze(tree, startNode.orElse(null), game.plies());
    }

    /** Plies played from the root position. */
    public GameAnalysis analyzeGame(RepertoireTree tree, List<Ply> plies) {
        return analyze(tree, tree.root(), plies);
    }

    private GameAnalysis analyze(RepertoireTree tree, Node start, List<Ply> plies) {
        if(plies == null || plies.isEmpty()) {
            throw new RepertoireException(ErrorKind.INVALID_INPUT_SEQUENCE, "game has no moves");
        }
        Color owner = tree.colorOwned();
        List<PlyClassification> classifications = new ArrayList<>(plies.size());
        Node cursor = start;
        boolean diverged = start == null;
        int divergencePly = diverged ? 0 : -1;
        int ownerMovesInRepertoire = 0;

        for(int plyIndex = 0; plyIndex < plies.size(); plyIndex++) {
            Ply ply = plies.get(plyIndex);
            boolean ownerMove = ply.mover() == owner;
            if(diverged) {
                classifications.add(new PlyClassification(plyIndex, ply.san(), ply.mover(),
                        ownerMove ? MoveStatus.OUT_OF_REPERTOIRE : MoveStatus.OPPONENT_NEW, null));
                continue;
            }

            Optional<Node> child = cursor.childByMove(ply.san());
            if(child.isPresent()) {
                classifications.add(new PlyClassification(plyIndex, ply.san(), ply.mover(), MoveStatus.IN_REPERTOIRE, null));
                if(ownerMove) {
                    ownerMovesInRepertoire++;
                }
                cursor = child.get();
                continue;
            }

            diverged = true;
            divergencePly = plyIndex;
            if(ownerMove) {
                String expected = cursor.children().isEmpty() ? null : cursor.children().get(0).move();
                classifications.add(new PlyClassification(plyIndex, ply.san(), ply.mover(), MoveStatus.OUT_OF_REPERTOIRE, expected));
            } else {
                classifications.add(new PlyClassification(plyIndex, ply.san(), ply.mover(), MoveStatus.OPPONENT_NEW, null));
            }
        }

        log.debug("Analyzed {} plies against {}: divergence at {}, {} owner moves in repertoire",
                plies.size(), tree.id(), divergencePly, ownerMovesInRepertoire);
        return new GameAnalysis(List.copyOf(classifications), divergencePly, ownerMovesInRepertoire);
    }

    /**
     * Picks, among the repertoires of the given color, the one covering the most owner moves of the game.
     * Ties go to the first candidate.
     */
    public Optional<RepertoireMatch> findBestMatchingRepertoire(Collection<RepertoireTree> repertoires, ParsedGame game, Color userColor) {
        RepertoireMatch best = null;
        for(RepertoireTree repertoire : repertoires) {
            if(repertoire.colorOwned() != userColor) {
                continue;
            }
            int score = game.plies().isEmpty() ? 0 : analyzeGame(repertoire, game).ownerMovesInRepertoire();
            if(best == null || score > best.score()) {
                best = new RepertoireMatch(repertoire, score);
            }
        }
        return Optional.ofNullable(best);
    }
}
