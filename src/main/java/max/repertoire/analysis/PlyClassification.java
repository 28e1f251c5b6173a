package max.repertoire.analysis;

import max.repertoire.common.Color;

import java.util.Optional;

/**
 * How one ply of a game relates to the repertoire.
 * {@code expectedMove} is only set for an {@link MoveStatus#OUT_OF_REPERTOIRE} ply played where the
 * repertoire knew a move.
 */
public record PlyClassification(int plyIndex, String san, Color mover, MoveStatus status, String expectedMove) {

    public Optional<String> expected() {
        return Optional.ofNullable(expectedMove);
    }
}
