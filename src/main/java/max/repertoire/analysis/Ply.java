package max.repertoire.analysis;

import max.repertoire.common.Color;

/** One half-move of a parsed game: the move in short algebraic notation and the side that played it. */
public record Ply(String san, Color mover) {
}
