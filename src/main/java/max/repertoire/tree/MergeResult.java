package max.repertoire.tree;

import java.util.List;

public record MergeResult(RepertoireTree merged, List<AnnotationConflict> annotationConflicts) {
}
