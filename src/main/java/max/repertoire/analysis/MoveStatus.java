package max.repertoire.analysis;

public enum MoveStatus {
    IN_REPERTOIRE,
    OUT_OF_REPERTOIRE,
    OPPONENT_NEW
}
