package max.repertoire.rules;

/**
 * Outcome of validating a move against a position.
 * When legal, {@code san} is the normalized notation and {@code resultPosition} the normalized FEN reached.
 */
public record MoveValidation(boolean legal, String san, String resultPosition) {

    public static MoveValidation legal(String san, String resultPosition) {
        return new MoveValidation(true, san, resultPosition);
    }

    public static MoveValidation illegal(String san) {
        return new MoveValidation(false, san, null);
    }
}
