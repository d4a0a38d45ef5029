package com.largomodo.romaudit.core.domain;

/**
 * Verification outcome for one expected part.
 *
 * @param part        the expected part
 * @param status      classification
 * @param currentName entry currently holding the content, for MISNAMED and DUPLICATE_CONTENT_UNRESOLVED
 * @param donor       where the content can be copied from, for FIXABLE
 * @param cause       reason attached to a MISSING part, may be null
 */
public record PartResult(
        ExpectedPart part,
        PartStatus status,
        String currentName,
        ContentLocation donor,
        String cause
) {
    public PartResult {
        if (part == null || status == null) {
            throw new IllegalArgumentException("part and status must not be null");
        }
    }

    public static PartResult ok(ExpectedPart part) {
        return new PartResult(part, PartStatus.OK, null, null, null);
    }

    public static PartResult unknown(ExpectedPart part) {
        return new PartResult(part, PartStatus.UNKNOWN, null, null, null);
    }

    public static PartResult misnamed(ExpectedPart part, String currentName) {
        return new PartResult(part, PartStatus.MISNAMED, currentName, null, null);
    }

    public static PartResult fixable(ExpectedPart part, ContentLocation donor) {
        return new PartResult(part, PartStatus.FIXABLE, null, donor, null);
    }

    public static PartResult missing(ExpectedPart part, String cause) {
        return new PartResult(part, PartStatus.MISSING, null, null, cause);
    }

    public static PartResult duplicate(ExpectedPart part, String copyOf) {
        return new PartResult(part, PartStatus.DUPLICATE_CONTENT_UNRESOLVED, copyOf, null, null);
    }

    public String name() {
        return part.name();
    }
}
