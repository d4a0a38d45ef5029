package com.largomodo.romaudit.core.domain;

/**
 * Presence check of one expected sample.
 */
public record SampleResult(ExpectedSample sample, boolean present) {
}
