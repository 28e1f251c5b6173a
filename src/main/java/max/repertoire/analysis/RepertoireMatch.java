package max.repertoire.analysis;

import max.repertoire.tree.RepertoireTree;

/** A repertoire chosen for a game and how many of the owner's moves it covered. */
public record RepertoireMatch(RepertoireTree repertoire, int score) {
}
