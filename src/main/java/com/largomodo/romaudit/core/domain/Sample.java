package com.largomodo.romaudit.core.domain;

/**
 * A sample declared by a machine. Samples have no checksum and are verified by presence.
 */
public record Sample(String machine, String name) {
    public Sample {
        if (machine == null || machine.isBlank()) {
            throw new IllegalArgumentException("machine must not be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }
}
