package com.largomodo.romaudit.core.domain;

import java.util.List;

/**
 * A named set of content parts as declared by the catalog.
 * <p>
 * Relations to other machines are id-based forward references ({@code cloneOf}, {@code romOf},
 * {@code sampleOf}); they are resolved through the catalog store, never embedded.
 *
 * @param name         unique machine name, also the archive base name
 * @param cloneOf      parent for cloning, or null
 * @param romOf        parent for rom inheritance, or null
 * @param sampleOf     parent for sample inheritance, or null
 * @param device       true for device machines (packaged separately)
 * @param bios         true for bios machines
 * @param runnable     false for machines that can not be run on their own
 * @param description  descriptive text, may be null
 * @param year         release year, may be null
 * @param manufacturer manufacturer, may be null
 * @param deviceRefs   names of referenced device machines, in declaration order
 */
public record Machine(
        String name,
        String cloneOf,
        String romOf,
        String sampleOf,
        boolean device,
        boolean bios,
        boolean runnable,
        String description,
        String year,
        String manufacturer,
        List<String> deviceRefs
) {
    public Machine {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Machine name must not be null or blank");
        }
        cloneOf = blankToNull(cloneOf);
        romOf = blankToNull(romOf);
        sampleOf = blankToNull(sampleOf);
        deviceRefs = deviceRefs == null ? List.of() : List.copyOf(deviceRefs);
    }

    /**
     * Plain runnable machine without relations or metadata.
     */
    public static Machine of(String name) {
        return new Machine(name, null, null, null, false, false, true, null, null, null, List.of());
    }

    public boolean isClone() {
        return cloneOf != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
