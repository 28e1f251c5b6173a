package max.repertoire.video;

public enum ProgressStatus {
    PENDING,
    RECOGNIZING,
    BUILDING_TREE,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
