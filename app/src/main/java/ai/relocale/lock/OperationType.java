package ai.relocale.lock;

/** Bulk operations that mutate locale files. Operations of the same type may nest. */
public enum OperationType {
    TRANSLATION_PROJECT,
    TRANSLATION_FILE,
    CLEANUP_UNUSED,
    CLEANUP_INVALID,
    KEY_MANAGEMENT,
    STYLE_FIX
}
