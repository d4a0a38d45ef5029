package com.largomodo.romaudit.core.domain;

/**
 * Aggregate counters over a catalog.
 *
 * @param machines          total machines
 * @param distinctChecksums distinct content identities among dumped parts
 * @param noDumpParts       parts without known content
 * @param deviceMachines    machines flagged as devices
 * @param parts             total declared roms and disks
 * @param samples           total declared samples
 * @param deviceRefs        total device references
 * @param biosMachines      machines flagged as bios
 * @param clones            machines with a cloneof parent
 */
public record CatalogStats(
        int machines,
        int distinctChecksums,
        int noDumpParts,
        int deviceMachines,
        int parts,
        int samples,
        int deviceRefs,
        int biosMachines,
        int clones
) {
}
