package max.repertoire.analysis;

import java.util.List;
import java.util.OptionalInt;

/**
 * @param divergencePly index of the first ply that left the repertoire, -1 if the game never did
 * @param ownerMovesInRepertoire number of the owner's plies found in the repertoire
 */
public record GameAnalysis(List<PlyClassification> classifications, int divergencePly, int ownerMovesInRepertoire) {

    public OptionalInt divergence() {
        return divergencePly < 0 ? OptionalInt.empty() : OptionalInt.of(divergencePly);
    }

    public boolean diverged() {
        return divergencePly >= 0;
    }
}
