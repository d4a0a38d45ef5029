package com.largomodo.romaudit.core.domain;

/**
 * Overall verdict for one machine.
 */
public enum SetStatus {
    COMPLETE,
    FIXABLE,
    INCOMPLETE,
    /** Catalog data for the machine is inconsistent; nothing was verified. */
    UNVERIFIABLE
}
