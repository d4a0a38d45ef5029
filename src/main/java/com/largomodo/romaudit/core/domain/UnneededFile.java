package com.largomodo.romaudit.core.domain;

import java.util.List;

/**
 * A supplied entry that no expected part claimed.
 *
 * @param entry     entry name inside the verified archive
 * @param checksum  hashed content
 * @param size      content length
 * @param wantedBy  other machines declaring this content; non-empty means the file is misplaced
 */
public record UnneededFile(String entry, Checksum checksum, long size, List<ContentRef> wantedBy) {
    public UnneededFile {
        wantedBy = List.copyOf(wantedBy);
    }

    public boolean isMisplaced() {
        return !wantedBy.isEmpty();
    }
}
