package max.repertoire.rules;

import max.repertoire.common.PieceType;

/**
 * A move between two squares, indexed {@code file + 8 * rank} (a1 = 0, h8 = 63).
 * Castling is encoded as the king's two-square move.
 */
public record Move(int startPosition, int endPosition, PieceType promotion) {

    public Move(int startPosition, int endPosition) {
        this(startPosition, endPosition, PieceType.NONE);
    }

    public boolean isPromotion() {
        return promotion != PieceType.NONE;
    }

    public static int fileOf(int index) {
        return index % 8;
    }

    public static int rankOf(int index) {
        return index / 8;
    }

    public static int indexOf(int file, int rank) {
        return file + 8 * rank;
    }

    public static boolean isOnBoard(int file, int rank) {
        return file >= 0 && file < 8 && rank >= 0 && rank < 8;
    }
}
