package com.largomodo.romaudit.core.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Content identity of a part: CRC32 and SHA1 as lower-case hex.
 * <p>
 * Catalog rows may carry only one of the two (disks are SHA1-only, some DATs are CRC-only), so
 * identity is decided by {@link #matches(Checksum)} rather than {@code equals}: every component
 * present on both sides must agree, and at least one component must be shared.
 *
 * @param crc32 8-digit hex CRC32, or null when the catalog does not declare it
 * @param sha1  40-digit hex SHA1, or null when the catalog does not declare it
 */
public record Checksum(String crc32, String sha1) implements Comparable<Checksum> {

    private static final Pattern CRC_PATTERN = Pattern.compile("[0-9a-f]{8}");
    private static final Pattern SHA1_PATTERN = Pattern.compile("[0-9a-f]{40}");

    public Checksum {
        crc32 = normalize(crc32);
        sha1 = normalize(sha1);
        if (crc32 == null && sha1 == null) {
            throw new IllegalArgumentException("Checksum needs at least one of crc32 or sha1");
        }
        if (crc32 != null && !CRC_PATTERN.matcher(crc32).matches()) {
            throw new IllegalArgumentException("Invalid crc32: " + crc32);
        }
        if (sha1 != null && !SHA1_PATTERN.matcher(sha1).matches()) {
            throw new IllegalArgumentException("Invalid sha1: " + sha1);
        }
    }

    public static Checksum of(String crc32, String sha1) {
        return new Checksum(crc32, sha1);
    }

    public static Checksum ofCrc(String crc32) {
        return new Checksum(crc32, null);
    }

    public static Checksum ofSha1(String sha1) {
        return new Checksum(null, sha1);
    }

    /**
     * Content equality tolerant to missing components.
     */
    public boolean matches(Checksum other) {
        if (other == null) {
            return false;
        }
        boolean shared = false;
        if (sha1 != null && other.sha1 != null) {
            if (!sha1.equals(other.sha1)) {
                return false;
            }
            shared = true;
        }
        if (crc32 != null && other.crc32 != null) {
            if (!crc32.equals(other.crc32)) {
                return false;
            }
            shared = true;
        }
        return shared;
    }

    /**
     * Grouping key used by aggregate queries: SHA1 when known, CRC32 otherwise.
     */
    public String identity() {
        return sha1 != null ? "sha1:" + sha1 : "crc:" + crc32;
    }

    @Override
    public int compareTo(Checksum o) {
        return identity().compareTo(o.identity());
    }

    @Override
    public String toString() {
        if (crc32 != null && sha1 != null) {
            return "crc:" + crc32 + " sha1:" + sha1;
        }
        return identity();
    }

    private static String normalize(String hex) {
        if (hex == null) {
            return null;
        }
        String trimmed = hex.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        // Some DATs drop leading zeros on CRCs
        if (lower.length() < 8 && lower.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            lower = "0".repeat(8 - lower.length()) + lower;
        }
        return lower;
    }
}
