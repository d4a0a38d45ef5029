package com.largomodo.romaudit.hash;

import java.io.IOException;
import java.io.InputStream;

/**
 * Computes the content identity of a byte stream.
 * <p>
 * Implementations must be pure: the same bytes always produce the same result. The stream is
 * consumed but not closed.
 */
@FunctionalInterface
public interface ChecksumFunction {

    HashedContent hash(InputStream in) throws IOException;
}
