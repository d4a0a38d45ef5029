package com.largomodo.romaudit.core.domain;

/**
 * Kind of content part declared by a machine.
 */
public enum PartType {
    ROM,
    DISK;

    /**
     * Name of the archive entry holding a part of this type.
     * Disks are stored as CHD images next to the roms.
     */
    public String entryName(String partName) {
        return this == DISK ? partName + ".chd" : partName;
    }
}
