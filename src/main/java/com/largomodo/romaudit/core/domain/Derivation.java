package com.largomodo.romaudit.core.domain;

import java.util.List;

/**
 * A machine whose full content can be produced from an ancestor's full content plus its own
 * clone-specific parts.
 *
 * @param machine     derived machine
 * @param ancestor    machine supplying the shared content
 * @param sharedParts names in {@code machine} whose content the ancestor already holds
 * @param newParts    clone-specific names that must come from elsewhere
 */
public record Derivation(String machine, String ancestor, List<String> sharedParts, List<String> newParts) {
    public Derivation {
        sharedParts = List.copyOf(sharedParts);
        newParts = List.copyOf(newParts);
    }
}
