package max.repertoire.video;

import max.repertoire.common.Color;
import max.repertoire.tree.RepertoireTree;

import java.util.List;

/**
 * A detached fragment built from video samples, with the sample pairs that could not be linked.
 * A cancelled run still carries everything built before the cancellation.
 */
public record ReconciliationResult(RepertoireTree fragment, List<UnlinkedGap> unlinkedGaps, BuildLog buildLog, boolean cancelled) {

    /** The color the fragment looks like a repertoire for: the side moving first out of the root. */
    public Color detectColor() {
        return detectColor(fragment);
    }

    public static Color detectColor(RepertoireTree fragment) {
        if(fragment.root().children().isEmpty()) {
            return Color.WHITE;
        }
        return fragment.root().sideToMove();
    }
}
