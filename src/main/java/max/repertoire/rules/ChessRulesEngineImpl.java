package max.repertoire.rules;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import max.repertoire.common.Color;
import max.repertoire.utils.notations.FENUtils;
import max.repertoire.utils.notations.MoveIOUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ChessRulesEngineImpl implements ChessRulesEngine {
    public static final String STARTING_POSITION = FENUtils.STARTING_PIECE_PLACEMENT + " w KQkq -";

    private record Frontier(Board board, List<Move> path) {}

    @Override
    public String startingPosition() {
        return STARTING_POSITION;
    }

    @Override
    public MoveValidation validateMove(String position, String move) {
        Board board = FENUtils.getBoardFrom(position);
        Optional<Move> resolved = MoveIOUtils.readAlgebraicNotation(board, move);
        if(resolved.isEmpty()) {
            return MoveValidation.illegal(move);
        }
        String san = MoveIOUtils.writeAlgebraicNotation(board, resolved.get());
        return MoveValidation.legal(san, FENUtils.getNormalizedFEN(board.play(resolved.get())));
    }

    @Override
    public Optional<List<String>> findConnectingMoves(String from, String to, int maxDepth) {
        Board start = FENUtils.getBoardFrom(from);
        String targetPlacement = FENUtils.getPiecePlacement(to);
        Color targetSide = FENUtils.getSideToMove(to).orElse(null);
        if(matches(start, targetPlacement, targetSide)) {
            return Optional.of(List.of());
        }

        ObjectOpenHashSet<String> visited = new ObjectOpenHashSet<>();
        visited.add(FENUtils.getNormalizedFEN(start));
        List<Frontier> layer = List.of(new Frontier(start, List.of()));
        for(int depth = 1; depth <= maxDepth && !layer.isEmpty(); depth++) {
            List<Frontier> nextLayer = new ArrayList<>();
            for(Frontier frontier : layer) {
                for(Move move : MoveGenerator.getLegalMoves(frontier.board())) {
                    Board next = frontier.board().play(move);
                    if(!visited.add(FENUtils.getNormalizedFEN(next))) {
                        continue;
                    }
                    List<Move> path = new ArrayList<>(frontier.path());
                    path.add(move);
                    if(matches(next, targetPlacement, targetSide)) {
                        return Optional.of(toAlgebraicNotation(start, path));
                    }
                    nextLayer.add(new Frontier(next, path));
                }
            }
            layer = nextLayer;
        }
        return Optional.empty();
    }

    @Override
    public List<String> legalMoves(String position) {
        Board board = FENUtils.getBoardFrom(position);
        List<Move> legalMoves = MoveGenerator.getLegalMoves(board);
        List<String> sans = new ArrayList<>(legalMoves.size());
        for(Move move : legalMoves) {
            sans.add(MoveIOUtils.writeAlgebraicNotation(board, move, legalMoves));
        }
        return sans;
    }

    private static boolean matches(Board board, String targetPlacement, Color targetSide) {
        if(targetSide != null && board.getCurrentPlayer() != targetSide) {
            return false;
        }
        return FENUtils.getPiecePlacement(FENUtils.getNormalizedFEN(board)).equals(targetPlacement);
    }

    private static List<String> toAlgebraicNotation(Board start, List<Move> path) {
        List<String> sans = new ArrayList<>(path.size());
        Board board = start;
        for(Move move : path) {
            sans.add(MoveIOUtils.writeAlgebraicNotation(board, move));
            board = board.play(move);
        }
        return sans;
    }
}
