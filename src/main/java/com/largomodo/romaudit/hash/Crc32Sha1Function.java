package com.largomodo.romaudit.hash;

import com.largomodo.romaudit.core.domain.Checksum;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.zip.CRC32;

/**
 * CRC32 + SHA1 in a single streaming pass. Arbitrarily large entries (CHD images) are never held
 * in memory.
 */
public final class Crc32Sha1Function implements ChecksumFunction {

    private static final String ALGORITHM = "SHA-1";
    private static final int BUFFER_SIZE = 8192;

    @Override
    public HashedContent hash(InputStream in) throws IOException {
        MessageDigest digest = newDigest();
        CRC32 crc = new CRC32();
        byte[] buffer = new byte[BUFFER_SIZE];
        long size = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
            crc.update(buffer, 0, read);
            size += read;
        }
        Checksum checksum = Checksum.of(
                String.format("%08x", crc.getValue()),
                HexFormat.of().formatHex(digest.digest()));
        return new HashedContent(checksum, size);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JVM ships SHA-1
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}
