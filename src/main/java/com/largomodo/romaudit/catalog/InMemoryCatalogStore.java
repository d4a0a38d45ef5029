package com.largomodo.romaudit.catalog;

import com.largomodo.romaudit.core.domain.ContentPart;
import com.largomodo.romaudit.core.domain.Machine;
import com.largomodo.romaudit.core.domain.Sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable catalog snapshot held in memory.
 * <p>
 * Built once through {@link Builder}; after {@link Builder#build()} every collection is
 * unmodifiable, so the store can be shared between verification threads without locking.
 */
public final class InMemoryCatalogStore implements CatalogStore {

    private final DatHeader header;
    private final Map<String, Machine> machines;
    private final List<Machine> machineList;
    private final Map<String, List<ContentPart>> parts;
    private final Map<String, List<Sample>> samples;
    private final Map<String, List<Machine>> clones;

    private InMemoryCatalogStore(Builder builder) {
        this.header = builder.header;
        this.machines = Collections.unmodifiableMap(new TreeMap<>(builder.machines));
        this.machineList = List.copyOf(this.machines.values());

        Map<String, List<ContentPart>> partCopy = new LinkedHashMap<>();
        builder.parts.forEach((machine, list) -> partCopy.put(machine, List.copyOf(list)));
        this.parts = Collections.unmodifiableMap(partCopy);

        Map<String, List<Sample>> sampleCopy = new LinkedHashMap<>();
        builder.samples.forEach((machine, list) -> sampleCopy.put(machine, List.copyOf(list)));
        this.samples = Collections.unmodifiableMap(sampleCopy);

        Map<String, List<Machine>> cloneIndex = new LinkedHashMap<>();
        for (Machine machine : machineList) {
            if (machine.cloneOf() != null) {
                cloneIndex.computeIfAbsent(machine.cloneOf(), k -> new ArrayList<>()).add(machine);
            }
        }
        Map<String, List<Machine>> cloneCopy = new LinkedHashMap<>();
        cloneIndex.forEach((parent, list) -> {
            list.sort(Comparator.comparing(Machine::name));
            cloneCopy.put(parent, List.copyOf(list));
        });
        this.clones = Collections.unmodifiableMap(cloneCopy);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<Machine> getMachine(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(machines.get(name));
    }

    @Override
    public List<Machine> listMachines() {
        return machineList;
    }

    @Override
    public List<ContentPart> getPartsOf(String machine) {
        return parts.getOrDefault(machine, List.of());
    }

    @Override
    public List<Sample> getSamplesOf(String machine) {
        return samples.getOrDefault(machine, List.of());
    }

    @Override
    public List<Machine> getClonesOf(String machine) {
        return clones.getOrDefault(machine, List.of());
    }

    @Override
    public int size() {
        return machineList.size();
    }

    @Override
    public DatHeader getHeader() {
        return header;
    }

    /**
     * Collects machines and their parts. Not thread-safe; hand the built store to other threads.
     */
    public static final class Builder {

        private final Map<String, Machine> machines = new LinkedHashMap<>();
        private final Map<String, List<ContentPart>> parts = new LinkedHashMap<>();
        private final Map<String, List<Sample>> samples = new LinkedHashMap<>();
        private DatHeader header = DatHeader.EMPTY;

        private Builder() {
        }

        public Builder header(DatHeader header) {
            this.header = header == null ? DatHeader.EMPTY : header;
            return this;
        }

        /**
         * Adds a machine. A later machine with the same name replaces the earlier one.
         */
        public Builder machine(Machine machine) {
            machines.put(machine.name(), machine);
            parts.computeIfAbsent(machine.name(), k -> new ArrayList<>());
            samples.computeIfAbsent(machine.name(), k -> new ArrayList<>());
            return this;
        }

        /**
         * Adds a part to its machine. Duplicate names are kept; resolution reports them.
         */
        public Builder part(ContentPart part) {
            parts.computeIfAbsent(part.machine(), k -> new ArrayList<>()).add(part);
            return this;
        }

        public Builder sample(Sample sample) {
            samples.computeIfAbsent(sample.machine(), k -> new ArrayList<>()).add(sample);
            return this;
        }

        public InMemoryCatalogStore build() {
            return new InMemoryCatalogStore(this);
        }
    }
}
