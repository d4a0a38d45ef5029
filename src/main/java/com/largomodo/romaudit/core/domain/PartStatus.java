package com.largomodo.romaudit.core.domain;

/**
 * Classification of one expected part after verification.
 */
public enum PartStatus {
    /** Present with the expected name and content. */
    OK,
    /** Content present in the target archive under another name. */
    MISNAMED,
    /** Not in the target archive, but present somewhere else in the collection. */
    FIXABLE,
    /** Not found anywhere known. */
    MISSING,
    /** No-dump part, content can not be verified. */
    UNKNOWN,
    /** Shares its content with another part of the same set, but only one copy exists. */
    DUPLICATE_CONTENT_UNRESOLVED;

    /**
     * Statuses that still allow the set to be repaired by renaming or copying.
     */
    public boolean isRepairable() {
        return this == MISNAMED || this == FIXABLE;
    }
}
