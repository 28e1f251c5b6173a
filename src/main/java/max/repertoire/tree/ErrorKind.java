package max.repertoire.tree;

public enum ErrorKind {
    PARENT_NOT_FOUND,
    NODE_NOT_FOUND,
    INVALID_MOVE,
    MOVE_EXISTS,
    CANNOT_DELETE_ROOT,
    CANNOT_EXTRACT_ROOT,
    MERGE_MINIMUM_TWO,
    COLOR_MISMATCH,
    DUPLICATE_SOURCES,
    ROOT_MISMATCH,
    LIMIT_REACHED,
    INVALID_INPUT_SEQUENCE,
    REPERTOIRE_NOT_FOUND,
    NAME_REQUIRED,
    NAME_TOO_LONG
}
