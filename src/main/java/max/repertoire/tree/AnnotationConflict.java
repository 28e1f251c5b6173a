package max.repertoire.tree;

/** A comment left out of a merged node because an earlier source already annotated it. */
public record AnnotationConflict(long mergedNodeId, String move, String keptComment, String discardedComment, String sourceTreeId) {
}
