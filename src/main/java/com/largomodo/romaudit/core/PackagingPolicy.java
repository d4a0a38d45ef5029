package com.largomodo.romaudit.core;

import java.util.Locale;

/**
 * Physical packaging policy of a romset collection.
 * Decides in which archive inherited content is expected, never what content is required.
 */
public enum PackagingPolicy {
    SPLIT("split"),           // inherited content only in the ancestor archive
    MERGED("merged"),         // clone family shares the clone-root archive
    NON_MERGED("non-merged"); // every archive is self-contained

    private final String cliName;

    PackagingPolicy(String cliName) {
        this.cliName = cliName;
    }

    public static PackagingPolicy fromCliArgument(String arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Mode argument cannot be null. Supported: split, merged, non-merged");
        }
        String normalized = arg.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (PackagingPolicy policy : values()) {
            if (policy.cliName.equals(normalized)) {
                return policy;
            }
        }
        // "nonmerged" and "full" are common spellings in other romset managers
        if (normalized.equals("nonmerged") || normalized.equals("full")) {
            return NON_MERGED;
        }
        throw new IllegalArgumentException("Invalid mode: " + arg + ". Supported: split, merged, non-merged");
    }

    public String getCliName() {
        return cliName;
    }

    @Override
    public String toString() {
        return cliName;
    }
}
