package com.largomodo.romaudit.core.domain;

/**
 * A sample required by a machine and the sample archive that must hold it.
 */
public record ExpectedSample(String name, String origin, String archive) {
}
