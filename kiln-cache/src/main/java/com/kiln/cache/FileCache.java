package com.kiln.cache;

import com.kiln.component.error.BuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cache of files in one directory. A key maps to {@code <dir>/<sha256(key)><ext>}, where
 * {@code <ext>} is the key's file extension, if any.
 * <p>
 * Access to a key is exclusive: {@link #acquire(String)} blocks until no other lease on the same
 * key is held. Leases are not bound to the acquiring thread.
 */
public final class FileCache implements Cache {

    private static final Logger log = LoggerFactory.getLogger(FileCache.class);

    private final Path directory;
    private final Map<String, KeyLock> locks = new ConcurrentHashMap<>();

    public FileCache(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Blocks until the key is free and returns its lease.
     *
     * @throws BuildException when the cache directory cannot be created or the wait is interrupted
     */
    @Override
    public CacheLease acquire(String key) {
        Objects.requireNonNull(key, "key");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new BuildException("Cannot create cache directory " + directory + ": " + e.getMessage(), e);
        }
        KeyLock lock = locks.compute(key, (k, existing) -> {
            KeyLock l = existing != null ? existing : new KeyLock();
            l.users++;
            return l;
        });
        try {
            lock.semaphore.acquire();
        } catch (InterruptedException e) {
            leave(key);
            Thread.currentThread().interrupt();
            throw new BuildException("Interrupted waiting for cache key " + key, e);
        }
        log.debug("Acquired cache lease for {}", key);
        return new Lease(key, pathFor(key), lock);
    }

    /** Number of keys currently leased or waited on. */
    int lockCount() {
        return locks.size();
    }

    // Drops the key's lock once no lease holds it and no caller waits for it.
    private void leave(String key) {
        locks.computeIfPresent(key, (k, l) -> --l.users == 0 ? null : l);
    }

    /** Location for {@code key}, whether or not a file exists there. */
    public Path pathFor(String key) {
        return directory.resolve(hash(key) + extension(key));
    }

    static String extension(String key) {
        int slash = Math.max(key.lastIndexOf('/'), key.lastIndexOf('\\'));
        int dot = key.lastIndexOf('.');
        if (dot <= slash + 1 || dot == key.length() - 1) {
            return "";
        }
        return key.substring(dot);
    }

    private static String hash(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class KeyLock {
        final Semaphore semaphore = new Semaphore(1, true);
        // guarded by the map's compute
        int users;
    }

    private final class Lease implements CacheLease {
        private final String key;
        private final Path path;
        private final KeyLock lock;
        private final AtomicBoolean released = new AtomicBoolean();

        Lease(String key, Path path, KeyLock lock) {
            this.key = key;
            this.path = path;
            this.lock = lock;
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public Path path() {
            return path;
        }

        @Override
        public void release() {
            if (released.compareAndSet(false, true)) {
                lock.semaphore.release();
                leave(key);
                log.debug("Released cache lease for {}", key);
            }
        }
    }
}
