package io.packscan.diff;

/**
 * Filesystem operation turning the "a" side of a diff into the "b" side.
 */
public enum DiffOperation {
    ADDED("A"),
    DELETED("D"),
    MODIFIED("M"),
    RENAMED("R");

    private final String code;

    DiffOperation(String code) {
        this.code = code;
    }

    /**
     * One letter code, as printed by {@code git diff --name-status}.
     */
    public String code() {
        return code;
    }
}
