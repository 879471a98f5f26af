package com.kiln.cache;

/**
 * Keyed storage for downloaded or built-once dependencies (ISO images, archives...). A key is
 * guarded by an exclusive lease so concurrent builds referencing the same key download it once.
 */
public interface Cache {

    /**
     * Acquires the exclusive lease for {@code key}, blocking until no one else holds it.
     * The caller must release the lease on every path, including failure.
     *
     * @param key cache key (e.g. {@code iso:ubuntu-20.04})
     * @return held lease
     */
    CacheLease acquire(String key);
}
