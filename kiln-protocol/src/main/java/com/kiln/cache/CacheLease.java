package com.kiln.cache;

import java.nio.file.Path;

/**
 * Exclusive hold on one cache key. {@link #release()} is idempotent.
 */
public interface CacheLease extends AutoCloseable {

    /** Key this lease guards. */
    String key();

    /** Location of the cached content for the key. The file may not exist yet. */
    Path path();

    /** Releases the lease. Calling it again has no effect. */
    void release();

    @Override
    default void close() {
        release();
    }
}
