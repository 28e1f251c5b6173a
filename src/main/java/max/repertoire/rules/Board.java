package max.repertoire.rules;

import max.repertoire.common.Color;
import max.repertoire.common.PieceType;

import java.util.Arrays;

/**
 * Mailbox board: one FEN letter per square, {@link #EMPTY} for empty squares.
 * Boards are treated as values, {@link #play(Move)} returns a new instance.
 */
public final class Board {
    public static final char EMPTY = '.';

    private final char[] squares = new char[64];
    private Color currentPlayer = Color.WHITE;
    private boolean whiteCanCastleKingSide;
    private boolean whiteCanCastleQueenSide;
    private boolean blackCanCastleKingSide;
    private boolean blackCanCastleQueenSide;
    private int enPassantIndex = -1;
    private int halfMoveClock = 0;
    private int fullMoveClock = 1;

    public Board() {
        Arrays.fill(squares, EMPTY);
    }

    public Board copy() {
        Board copy = new Board();
        System.arraycopy(squares, 0, copy.squares, 0, 64);
        copy.currentPlayer = currentPlayer;
        copy.whiteCanCastleKingSide = whiteCanCastleKingSide;
        copy.whiteCanCastleQueenSide = whiteCanCastleQueenSide;
        copy.blackCanCastleKingSide = blackCanCastleKingSide;
        copy.blackCanCastleQueenSide = blackCanCastleQueenSide;
        copy.enPassantIndex = enPassantIndex;
        copy.halfMoveClock = halfMoveClock;
        copy.fullMoveClock = fullMoveClock;
        return copy;
    }

    public char pieceAt(int index) {
        return squares[index];
    }

    public void setPiece(int index, char fenLetter) {
        squares[index] = fenLetter;
    }

    public boolean isEmptySquare(int index) {
        return squares[index] == EMPTY;
    }

    public PieceType pieceTypeAt(int index) {
        return PieceType.fromFENLetter(squares[index]);
    }

    /** @return the color of the piece on that square, or null when empty. */
    public Color colorAt(int index) {
        char piece = squares[index];
        if(piece == EMPTY) {
            return null;
        }
        return Character.isUpperCase(piece) ? Color.WHITE : Color.BLACK;
    }

    /** @return the king square of that color, or -1 if the board has no such king. */
    public int kingIndex(Color color) {
        char king = PieceType.KING.toFENLetter(color);
        for(int i = 0; i < 64; i++) {
            if(squares[i] == king) {
                return i;
            }
        }
        return -1;
    }

    public Board play(Move move) {
        Board next = copy();
        int from = move.startPosition();
        int to = move.endPosition();
        char piece = squares[from];
        PieceType pieceType = PieceType.fromFENLetter(piece);
        Color mover = currentPlayer;
        boolean capture = squares[to] != EMPTY;

        if(pieceType == PieceType.PAWN && to == enPassantIndex && squares[to] == EMPTY) {
            // the captured pawn sits beside the start square
            next.squares[Move.indexOf(Move.fileOf(to), Move.rankOf(from))] = EMPTY;
            capture = true;
        }

        next.squares[to] = move.isPromotion() ? move.promotion().toFENLetter(mover) : piece;
        next.squares[from] = EMPTY;

        if(pieceType == PieceType.KING && Math.abs(Move.fileOf(to) - Move.fileOf(from)) == 2) {
            int rank = Move.rankOf(from);
            boolean kingSide = Move.fileOf(to) > Move.fileOf(from);
            int rookFrom = Move.indexOf(kingSide ? 7 : 0, rank);
            int rookTo = Move.indexOf(kingSide ? 5 : 3, rank);
            next.squares[rookTo] = next.squares[rookFrom];
            next.squares[rookFrom] = EMPTY;
        }

        if(pieceType == PieceType.KING) {
            if(mover == Color.WHITE) {
                next.whiteCanCastleKingSide = false;
                next.whiteCanCastleQueenSide = false;
            } else {
                next.blackCanCastleKingSide = false;
                next.blackCanCastleQueenSide = false;
            }
        }
        next.clearCastlingRightsTouching(from);
        next.clearCastlingRightsTouching(to);

        next.enPassantIndex = -1;
        if(pieceType == PieceType.PAWN && Math.abs(Move.rankOf(to) - Move.rankOf(from)) == 2) {
            int skipped = (from + to) / 2;
            if(next.hasAdjacentEnemyPawn(to, mover.getOppositeColor())) {
                next.enPassantIndex = skipped;
            }
        }

        next.halfMoveClock = (pieceType == PieceType.PAWN || capture) ? 0 : halfMoveClock + 1;
        if(mover == Color.BLACK) {
            next.fullMoveClock = fullMoveClock + 1;
        }
        next.currentPlayer = mover.getOppositeColor();
        return next;
    }

    private void clearCastlingRightsTouching(int index) {
        switch (index) {
            case 0 -> whiteCanCastleQueenSide = false;
            case 7 -> whiteCanCastleKingSide = false;
            case 56 -> blackCanCastleQueenSide = false;
            case 63 -> blackCanCastleKingSide = false;
            default -> { }
        }
    }

    private boolean hasAdjacentEnemyPawn(int index, Color enemy) {
        char enemyPawn = PieceType.PAWN.toFENLetter(enemy);
        int file = Move.fileOf(index);
        int rank = Move.rankOf(index);
        return (file > 0 && squares[Move.indexOf(file - 1, rank)] == enemyPawn)
                || (file < 7 && squares[Move.indexOf(file + 1, rank)] == enemyPawn);
    }

    public Color getCurrentPlayer() {
        return currentPlayer;
    }

    public void setCurrentPlayer(Color currentPlayer) {
        this.currentPlayer = currentPlayer;
    }

    public boolean whiteCanCastleKingSide() {
        return whiteCanCastleKingSide;
    }

    public boolean whiteCanCastleQueenSide() {
        return whiteCanCastleQueenSide;
    }

    public boolean blackCanCastleKingSide() {
        return blackCanCastleKingSide;
    }

    public boolean blackCanCastleQueenSide() {
        return blackCanCastleQueenSide;
    }

    public void setWhiteCanCastleKingSide(boolean value) {
        this.whiteCanCastleKingSide = value;
    }

    public void setWhiteCanCastleQueenSide(boolean value) {
        this.whiteCanCastleQueenSide = value;
    }

    public void setBlackCanCastleKingSide(boolean value) {
        this.blackCanCastleKingSide = value;
    }

    public void setBlackCanCastleQueenSide(boolean value) {
        this.blackCanCastleQueenSide = value;
    }

    public int getEnPassantIndex() {
        return enPassantIndex;
    }

    public void setEnPassantIndex(int enPassantIndex) {
        this.enPassantIndex = enPassantIndex;
    }

    public int getHalfMoveClock() {
        return halfMoveClock;
    }

    public void setHalfMoveClock(int halfMoveClock) {
        this.halfMoveClock = halfMoveClock;
    }

    public int getFullMoveClock() {
        return fullMoveClock;
    }

    public void setFullMoveClock(int fullMoveClock) {
        this.fullMoveClock = fullMoveClock;
    }
}
