package com.largomodo.romaudit.core;

/**
 * Thrown when the catalog data of one machine is inconsistent (cyclic ancestry, dangling merge,
 * duplicate part names).
 * <p>
 * Fatal for the affected machine only: callers attach it to that machine's report and carry on
 * with the others.
 */
public class CatalogIntegrityException extends RuntimeException {

    private final String machine;
    private final IntegrityViolation violation;

    public CatalogIntegrityException(String machine, IntegrityViolation violation, String message) {
        super(message);
        this.machine = machine;
        this.violation = violation;
    }

    public String getMachine() {
        return machine;
    }

    public IntegrityViolation getViolation() {
        return violation;
    }

    /**
     * Kinds of catalog inconsistency detected during resolution.
     */
    public enum IntegrityViolation {
        CYCLIC_ANCESTRY,
        DANGLING_MERGE,
        MERGE_CHECKSUM_MISMATCH,
        DUPLICATE_PART_NAME,
        UNKNOWN_MACHINE
    }
}
