package com.largomodo.romaudit.core.domain;

/**
 * One entry of an effective content set: what must exist, and in which archive.
 *
 * @param name     logical name the content must carry inside {@code archive}
 * @param type     rom or disk
 * @param checksum expected content, null for no-dump parts
 * @param size     declared size, or null
 * @param required false for no-dump and optional parts
 * @param origin   machine whose declaration produced this entry
 * @param archive  archive (machine name) where the bytes are expected to physically reside
 * @param merge    merge tag of the originating declaration, or null
 */
public record ExpectedPart(
        String name,
        PartType type,
        Checksum checksum,
        Long size,
        boolean required,
        String origin,
        String archive,
        String merge
) {
    public ExpectedPart {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (origin == null || archive == null) {
            throw new IllegalArgumentException("origin and archive must not be null");
        }
        if (type == null) {
            type = PartType.ROM;
        }
    }

    public boolean isNoDump() {
        return checksum == null;
    }

    public String entryName() {
        return type.entryName(name);
    }

    /**
     * True when the given content satisfies this part: matching checksum and, when declared, size.
     */
    public boolean acceptsContent(Checksum actual, long actualSize) {
        if (checksum == null || !checksum.matches(actual)) {
            return false;
        }
        return size == null || size == actualSize;
    }
}
