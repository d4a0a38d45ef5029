package com.largomodo.romaudit.core.domain;

/**
 * A rom or disk declared by exactly one machine.
 *
 * @param machine  owning machine name
 * @param name     logical name, unique within the machine
 * @param type     rom or disk
 * @param size     declared size in bytes, or null when not declared
 * @param checksum content checksum, null for no-dump parts
 * @param status   declared dump status
 * @param merge    name of the ancestor part supplying the bytes, or null
 * @param optional true when the machine works without this part
 * @param order    declaration order inside the machine
 */
public record ContentPart(
        String machine,
        String name,
        PartType type,
        Long size,
        Checksum checksum,
        DumpStatus status,
        String merge,
        boolean optional,
        int order
) {
    public ContentPart {
        if (machine == null || machine.isBlank()) {
            throw new IllegalArgumentException("machine must not be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (type == null) {
            type = PartType.ROM;
        }
        if (status == null) {
            status = DumpStatus.GOOD;
        }
        if (size != null && size < 0) {
            throw new IllegalArgumentException("size must not be negative, got: " + size);
        }
        if (merge != null && merge.isBlank()) {
            merge = null;
        }
        if (status == DumpStatus.NODUMP) {
            checksum = null;
        }
    }

    public static ContentPart rom(String machine, String name, long size, Checksum checksum, int order) {
        return new ContentPart(machine, name, PartType.ROM, size, checksum, DumpStatus.GOOD, null, false, order);
    }

    public boolean isNoDump() {
        return checksum == null;
    }

    public boolean isMerged() {
        return merge != null;
    }

    /**
     * Archive entry name under which this part is stored.
     */
    public String entryName() {
        return type.entryName(name);
    }

    public ContentPart withMerge(String mergeName) {
        return new ContentPart(machine, name, type, size, checksum, status, mergeName, optional, order);
    }
}
