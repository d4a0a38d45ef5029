package com.largomodo.romaudit.core.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Where content of one machine is used across the catalog, grouped by archive.
 *
 * @param machine  machine whose content was searched
 * @param usages   archive name to the names the content carries there, sorted by archive
 * @param unknown  searched names whose content is not known anywhere else (or is a no-dump)
 */
public record RomUsage(String machine, Map<String, List<String>> usages, List<String> unknown) {
    public RomUsage {
        usages = Collections.unmodifiableMap(new TreeMap<>(usages));
        unknown = List.copyOf(unknown);
    }
}
