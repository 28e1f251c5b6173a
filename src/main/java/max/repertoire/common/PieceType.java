package max.repertoire.common;

public enum PieceType {
    PAWN(""), KNIGHT("N"), BISHOP("B"), ROOK("R"), QUEEN("Q"), KING("K"), NONE(null);

    public static final PieceType[] PROMOTIONS = {QUEEN, ROOK, BISHOP, KNIGHT};

    private final String sanLetter;

    PieceType(String sanLetter) {
        this.sanLetter = sanLetter;
    }

    /** Letter used in short algebraic notation, empty for pawns. */
    public String sanLetter() {
        return sanLetter;
    }

    public char toFENLetter(Color color) {
        char letter = switch (this) {
            case KING -> 'k';
            case PAWN -> 'p';
            case KNIGHT -> 'n';
            case QUEEN -> 'q';
            case ROOK -> 'r';
            case BISHOP -> 'b';
            case NONE -> throw new IllegalStateException("No FEN letter for an empty square");
        };
        return color == Color.WHITE ? Character.toUpperCase(letter) : letter;
    }

    public static PieceType fromFENLetter(char letter) {
        return switch (letter) {
            case 'k', 'K' -> KING;
            case 'n', 'N' -> KNIGHT;
            case 'q', 'Q' -> QUEEN;
            case 'r', 'R' -> ROOK;
            case 'b', 'B' -> BISHOP;
            case 'p', 'P' -> PAWN;
            default -> NONE;
        };
    }

    public static PieceType getPieceTypeFromLetter(char letter) {
        return switch (letter) {
            case 'n', 'N' -> KNIGHT;
            case 'q', 'Q' -> QUEEN;
            case 'r', 'R' -> ROOK;
            case 'b', 'B' -> BISHOP;
            case 'k', 'K' -> KING;
            default -> throw new IllegalArgumentException("Unknown piece letter "+letter);
        };
    }
}
