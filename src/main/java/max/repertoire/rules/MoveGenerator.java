package max.repertoire.rules;

import max.repertoire.common.Color;
import max.repertoire.common.PieceType;

import java.util.ArrayList;
import java.util.List;

public final class MoveGenerator {
    private static final int[][] KNIGHT_STEPS = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};
    private static final int[][] KING_STEPS = {{1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}};
    private static final int[][] DIAGONALS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    private static final int[][] ORTHOGONALS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};

    private MoveGenerator() {
    }

    public static List<Move> getLegalMoves(Board board) {
        Color mover = board.getCurrentPlayer();
        List<Move> pseudoLegalMoves = getPseudoLegalMoves(board);
        List<Move> legalMoves = new ArrayList<>(pseudoLegalMoves.size());
        for(Move move : pseudoLegalMoves) {
            Board next = board.play(move);
            int kingIndex = next.kingIndex(mover);
            // recognized boards may miss a king, nothing to keep safe then
            if(kingIndex == -1 || !isSquareAttacked(next, kingIndex, mover.getOppositeColor())) {
                legalMoves.add(move);
            }
        }
        return legalMoves;
    }

    public static boolean isInCheck(Board board) {
        Color mover = board.getCurrentPlayer();
        int kingIndex = board.kingIndex(mover);
        return kingIndex != -1 && isSquareAttacked(board, kingIndex, mover.getOppositeColor());
    }

    public static boolean isSquareAttacked(Board board, int index, Color attacker) {
        int file = Move.fileOf(index);
        int rank = Move.rankOf(index);

        // a pawn attacks diagonally forward, so look one rank "behind" the square from its point of view
        int pawnRank = attacker == Color.WHITE ? rank - 1 : rank + 1;
        char pawn = PieceType.PAWN.toFENLetter(attacker);
        for(int df = -1; df <= 1; df += 2) {
            if(Move.isOnBoard(file + df, pawnRank) && board.pieceAt(Move.indexOf(file + df, pawnRank)) == pawn) {
                return true;
            }
        }

        if(isAttackedByStep(board, file, rank, KNIGHT_STEPS, PieceType.KNIGHT.toFENLetter(attacker))
                || isAttackedByStep(board, file, rank, KING_STEPS, PieceType.KING.toFENLetter(attacker))) {
            return true;
        }

        char queen = PieceType.QUEEN.toFENLetter(attacker);
        return isAttackedBySlider(board, file, rank, DIAGONALS, PieceType.BISHOP.toFENLetter(attacker), queen)
                || isAttackedBySlider(board, file, rank, ORTHOGONALS, PieceType.ROOK.toFENLetter(attacker), queen);
    }

    private static boolean isAttackedByStep(Board board, int file, int rank, int[][] steps, char attackerPiece) {
        for(int[] step : steps) {
            int f = file + step[0];
            int r = rank + step[1];
            if(Move.isOnBoard(f, r) && board.pieceAt(Move.indexOf(f, r)) == attackerPiece) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAttackedBySlider(Board board, int file, int rank, int[][] directions, char slider, char queen) {
        for(int[] direction : directions) {
            int f = file + direction[0];
            int r = rank + direction[1];
            while(Move.isOnBoard(f, r)) {
                char piece = board.pieceAt(Move.indexOf(f, r));
                if(piece != Board.EMPTY) {
                    if(piece == slider || piece == queen) {
                        return true;
                    }
                    break;
                }
                f += direction[0];
                r += direction[1];
            }
        }
        return false;
    }

    static List<Move> getPseudoLegalMoves(Board board) {
        List<Move> moves = new ArrayList<>(48);
        Color mover = board.getCurrentPlayer();
        for(int index = 0; index < 64; index++) {
            if(board.colorAt(index) != mover) {
                continue;
            }
            switch (board.pieceTypeAt(index)) {
                case PAWN -> addPawnMoves(board, index, mover, moves);
                case KNIGHT -> addStepMoves(board, index, mover, KNIGHT_STEPS, moves);
                case BISHOP -> addSlidingMoves(board, index, mover, DIAGONALS, moves);
                case ROOK -> addSlidingMoves(board, index, mover, ORTHOGONALS, moves);
                case QUEEN -> {
                    addSlidingMoves(board, index, mover, DIAGONALS, moves);
                    addSlidingMoves(board, index, mover, ORTHOGONALS, moves);
                }
                case KING -> {
                    addStepMoves(board, index, mover, KING_STEPS, moves);
                    addCastlingMoves(board, index, mover, moves);
                }
                case NONE -> { }
            }
        }
        return moves;
    }

    private static void addPawnMoves(Board board, int index, Color mover, List<Move> moves) {
        int file = Move.fileOf(index);
        int rank = Move.rankOf(index);
        int direction = mover == Color.WHITE ? 1 : -1;
        int startRank = mover == Color.WHITE ? 1 : 6;
        int promotionRank = mover == Color.WHITE ? 7 : 0;
        int nextRank = rank + direction;
        if(!Move.isOnBoard(file, nextRank)) {
            return;
        }

        int oneStep = Move.indexOf(file, nextRank);
        if(board.isEmptySquare(oneStep)) {
            addPawnMove(index, oneStep, nextRank == promotionRank, moves);
            int twoSteps = Move.indexOf(file, rank + 2 * direction);
            if(rank == startRank && board.isEmptySquare(twoSteps)) {
                moves.add(new Move(index, twoSteps));
            }
        }

        for(int df = -1; df <= 1; df += 2) {
            if(!Move.isOnBoard(file + df, nextRank)) {
                continue;
            }
            int target = Move.indexOf(file + df, nextRank);
            Color targetColor = board.colorAt(target);
            if(targetColor == mover.getOppositeColor()) {
                addPawnMove(index, target, nextRank == promotionRank, moves);
            } else if(target == board.getEnPassantIndex() && targetColor == null) {
                moves.add(new Move(index, target));
            }
        }
    }

    private static void addPawnMove(int from, int to, boolean promotes, List<Move> moves) {
        if(!promotes) {
            moves.add(new Move(from, to));
            return;
        }
        for(PieceType promotion : PieceType.PROMOTIONS) {
            moves.add(new Move(from, to, promotion));
        }
    }

    private static void addStepMoves(Board board, int index, Color mover, int[][] steps, List<Move> moves) {
        int file = Move.fileOf(index);
        int rank = Move.rankOf(index);
        for(int[] step : steps) {
            int f = file + step[0];
            int r = rank + step[1];
            if(Move.isOnBoard(f, r)) {
                int target = Move.indexOf(f, r);
                if(board.colorAt(target) != mover) {
                    moves.add(new Move(index, target));
                }
            }
        }
    }

    private static void addSlidingMoves(Board board, int index, Color mover, int[][] directions, List<Move> moves) {
        int file = Move.fileOf(index);
        int rank = Move.rankOf(index);
        for(int[] direction : directions) {
            int f = file + direction[0];
            int r = rank + direction[1];
            while(Move.isOnBoard(f, r)) {
                int target = Move.indexOf(f, r);
                Color targetColor = board.colorAt(target);
                if(targetColor == mover) {
                    break;
                }
                moves.add(new Move(index, target));
                if(targetColor != null) {
                    break;
                }
                f += direction[0];
                r += direction[1];
            }
        }
    }

    private static void addCastlingMoves(Board board, int index, Color mover, List<Move> moves) {
        int homeRank = mover == Color.WHITE ? 0 : 7;
        if(index != Move.indexOf(4, homeRank)) {
            return;
        }
        boolean kingSide = mover == Color.WHITE ? board.whiteCanCastleKingSide() : board.blackCanCastleKingSide();
        boolean queenSide = mover == Color.WHITE ? board.whiteCanCastleQueenSide() : board.blackCanCastleQueenSide();
        if(!kingSide && !queenSide) {
            return;
        }
        Color enemy = mover.getOppositeColor();
        if(isSquareAttacked(board, index, enemy)) {
            return;
        }
        char rook = PieceType.ROOK.toFENLetter(mover);
        if(kingSide
                && board.pieceAt(Move.indexOf(7, homeRank)) == rook
                && board.isEmptySquare(Move.indexOf(5, homeRank))
                && board.isEmptySquare(Move.indexOf(6, homeRank))
                && !isSquareAttacked(board, Move.indexOf(5, homeRank), enemy)
                && !isSquareAttacked(board, Move.indexOf(6, homeRank), enemy)) {
            moves.add(new Move(index, Move.indexOf(6, homeRank)));
        }
        if(queenSide
                && board.pieceAt(Move.indexOf(0, homeRank)) == rook
                && board.isEmptySquare(Move.indexOf(1, homeRank))
                && board.isEmptySquare(Move.indexOf(2, homeRank))
                && board.isEmptySquare(Move.indexOf(3, homeRank))
                && !isSquareAttacked(board, Move.indexOf(3, homeRank), enemy)
                && !isSquareAttacked(board, Move.indexOf(2, homeRank), enemy)) {
            moves.add(new Move(index, Move.indexOf(2, homeRank)));
        }
    }
}
