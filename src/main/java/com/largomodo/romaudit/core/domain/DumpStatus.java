package com.largomodo.romaudit.core.domain;

import java.util.Locale;

/**
 * Dump quality declared by the catalog for a part.
 */
public enum DumpStatus {
    GOOD,
    BADDUMP,
    NODUMP,
    VERIFIED;

    /**
     * Parses the catalog {@code status} attribute. Unknown or absent values are treated as GOOD.
     */
    public static DumpStatus fromAttribute(String value) {
        if (value == null || value.isBlank()) {
            return GOOD;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "nodump" -> NODUMP;
            case "baddump" -> BADDUMP;
            case "verified" -> VERIFIED;
            default -> GOOD;
        };
    }
}
