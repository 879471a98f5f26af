package com.kiln.cache;

import com.kiln.component.error.BuildException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(30)
class FileCacheTest {

    @TempDir
    Path dir;

    @Test
    void pathKeepsExtensionAndHashesKey() {
        FileCache cache = new FileCache(dir.resolve("cache"));

        Path iso = cache.pathFor("iso:ubuntu-20.04.iso");
        assertEquals(dir.resolve("cache"), iso.getParent());
        assertTrue(iso.getFileName().toString().endsWith(".iso"));
        assertEquals(64 + 4, iso.getFileName().toString().length());
        assertEquals(64, cache.pathFor("plain-key").getFileName().toString().length());
        assertNotEquals(cache.pathFor("a.iso"), cache.pathFor("b.iso"));
    }

    @Test
    void extensionIgnoresDotsInDirectories() {
        assertEquals("", FileCache.extension("dir.d/file"));
        assertEquals(".gz", FileCache.extension("dir.d/file.tar.gz"));
        assertEquals("", FileCache.extension(".hidden"));
        assertEquals("", FileCache.extension("trailing."));
    }

    @Test
    void createsDirectoryOnDemand() {
        Path target = dir.resolve("a/b");
        FileCache cache = new FileCache(target);
        assertFalse(Files.exists(target));

        try (CacheLease lease = cache.acquire("k")) {
            assertTrue(Files.isDirectory(target));
            assertEquals(target, lease.path().getParent());
        }
    }

    @Test
    void concurrentLeasesOnOneKeyNeverOverlap() throws Exception {
        FileCache cache = new FileCache(dir);
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger maxHolders = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    for (int j = 0; j < 20; j++) {
                        try (CacheLease lease = cache.acquire("shared.iso")) {
                            int now = holders.incrementAndGet();
                            maxHolders.accumulateAndGet(now, Math::max);
                            Thread.yield();
                            holders.decrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(20, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, maxHolders.get());
    }

    @Test
    void secondAcquireWaitsUntilReleaseFromAnotherThread() throws Exception {
        FileCache cache = new FileCache(dir);
        CacheLease first = cache.acquire("k");
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<CacheLease> second = CompletableFuture.supplyAsync(() -> {
            started.countDown();
            return cache.acquire("k");
        });
        started.await();

        assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));
        Thread releaser = new Thread(first::release);
        releaser.start();
        releaser.join();

        second.get(5, TimeUnit.SECONDS).release();
    }

    @Test
    void releaseIsIdempotent() throws Exception {
        FileCache cache = new FileCache(dir);
        CacheLease lease = cache.acquire("k");
        lease.release();
        lease.release();

        CacheLease again = cache.acquire("k");
        CompletableFuture<CacheLease> blocked = CompletableFuture.supplyAsync(() -> cache.acquire("k"));
        assertThrows(TimeoutException.class, () -> blocked.get(200, TimeUnit.MILLISECONDS));
        again.release();
        blocked.get(5, TimeUnit.SECONDS).release();
    }

    @Test
    void differentKeysDoNotBlockEachOther() {
        FileCache cache = new FileCache(dir);
        try (CacheLease a = cache.acquire("a"); CacheLease b = cache.acquire("b")) {
            assertNotEquals(a.path(), b.path());
        }
    }

    @Test
    void keyLocksAreDroppedOnceNoLeaseOrWaiterRemains() throws Exception {
        FileCache cache = new FileCache(dir);
        CacheLease first = cache.acquire("k");
        CompletableFuture<CacheLease> second = CompletableFuture.supplyAsync(() -> cache.acquire("k"));
        assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));

        first.release();
        assertEquals(1, cache.lockCount());
        CacheLease held = second.get(5, TimeUnit.SECONDS);
        assertEquals(1, cache.lockCount());
        held.release();
        held.release();
        assertEquals(0, cache.lockCount());

        for (int i = 0; i < 100; i++) {
            cache.acquire("key-" + i).release();
        }
        assertEquals(0, cache.lockCount());
    }

    @Test
    void interruptedWaiterLeavesNoLockBehind() throws Exception {
        FileCache cache = new FileCache(dir);
        CacheLease held = cache.acquire("k");
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                cache.acquire("k").release();
            } catch (RuntimeException e) {
                failure.set(e);
            }
        });
        waiter.start();
        while (waiter.getState() != Thread.State.WAITING) {
            Thread.sleep(10);
        }
        waiter.interrupt();
        waiter.join();

        assertTrue(failure.get() instanceof BuildException);
        held.release();
        assertEquals(0, cache.lockCount());
    }
}
