package max.repertoire.rules;

import java.util.List;
import java.util.Optional;

/**
 * Chess legality and derived-position facts, consumed by the repertoire tree and its reconcilers.
 * Positions are FEN strings; a placement-only FEN is accepted wherever a position is read.
 */
public interface ChessRulesEngine {

    /** Normalized FEN (four fields) of the standard starting position. */
    String startingPosition();

    /**
     * Confirms the legality of {@code move} in {@code position}.
     * @throws IllegalArgumentException if {@code position} is not a readable FEN
     */
    MoveValidation validateMove(String position, String move);

    /**
     * Finds the shortest sequence of at most {@code maxDepth} legal moves leading from {@code from}
     * to a position whose placement equals the one of {@code to} (and whose side to move matches,
     * when {@code to} carries one).
     * @return the moves in short algebraic notation, an empty list when both positions already match,
     * or empty when no sequence exists within the bound
     */
    Optional<List<String>> findConnectingMoves(String from, String to, int maxDepth);

    /** All legal moves of the position, in short algebraic notation. */
    List<String> legalMoves(String position);
}
