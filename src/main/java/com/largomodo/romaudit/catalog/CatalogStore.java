package com.largomodo.romaudit.catalog;

import com.largomodo.romaudit.core.domain.ContentPart;
import com.largomodo.romaudit.core.domain.Machine;
import com.largomodo.romaudit.core.domain.Sample;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to parsed catalog entities.
 * <p>
 * Implementations must be safe for concurrent readers; nothing in the verification core ever
 * mutates a store. Loading new catalog data means building a new store.
 */
public interface CatalogStore {

    Optional<Machine> getMachine(String name);

    /**
     * All machines in name order.
     */
    List<Machine> listMachines();

    /**
     * Roms and disks of a machine in declaration order; empty for unknown machines.
     */
    List<ContentPart> getPartsOf(String machine);

    List<Sample> getSamplesOf(String machine);

    /**
     * Rom-inheritance parent ({@code romof}), or empty.
     */
    default Optional<String> resolveRomParent(String machine) {
        return getMachine(machine).map(Machine::romOf);
    }

    /**
     * Clone parent ({@code cloneof}), or empty.
     */
    default Optional<String> resolveCloneParent(String machine) {
        return getMachine(machine).map(Machine::cloneOf);
    }

    default Optional<String> resolveSampleParent(String machine) {
        return getMachine(machine).map(Machine::sampleOf);
    }

    /**
     * Machines whose {@code cloneof} points at the given machine, in name order.
     */
    List<Machine> getClonesOf(String machine);

    default int size() {
        return listMachines().size();
    }

    default DatHeader getHeader() {
        return DatHeader.EMPTY;
    }
}
