package com.largomodo.romaudit.hash;

import com.largomodo.romaudit.core.domain.Checksum;

/**
 * Checksum and byte length of a hashed stream.
 */
public record HashedContent(Checksum checksum, long size) {
    public HashedContent {
        if (checksum == null) {
            throw new IllegalArgumentException("checksum must not be null");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative, got: " + size);
        }
    }
}
