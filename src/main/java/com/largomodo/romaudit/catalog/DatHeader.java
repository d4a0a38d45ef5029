package com.largomodo.romaudit.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive header of a DAT file.
 *
 * @param name        catalog name
 * @param description catalog description
 * @param version     catalog version
 * @param extra       any other header fields, in document order
 */
public record DatHeader(String name, String description, String version, Map<String, String> extra) {

    public static final DatHeader EMPTY = new DatHeader(null, null, null, Map.of());

    public DatHeader {
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (name != null && !name.isEmpty()) {
            sb.append("Name: ").append(name).append('\n');
        }
        if (description != null && !description.isEmpty()) {
            sb.append("Description: ").append(description).append('\n');
        }
        if (version != null && !version.isEmpty()) {
            sb.append("Version: ").append(version).append('\n');
        }
        extra.forEach((k, v) -> sb.append(k).append(": ").append(v).append('\n'));
        return sb.toString();
    }
}
