package me.internalizable.shopops.ratelimit.store;

import me.internalizable.shopops.ratelimit.Rate;
import me.internalizable.shopops.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWindowCounterStoreTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    private static final Rate PER_MINUTE = Rate.perMinute(100);

    private MutableClock clock;
    private InMemoryWindowCounterStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = InMemoryWindowCounterStore.builder()
                .name("test")
                .maxSize(1_000)
                .clock(clock)
                .build();
    }

    // ========== WINDOW SEMANTICS ==========

    @Test
    void countsUpWithinOneWindow() {
        for (int i = 1; i <= 5; i++) {
            clock.advance(Duration.ofSeconds(1));
            WindowCounter counter = store.incrementAndGet("user:1", PER_MINUTE);
            assertEquals(i, counter.count());
            // expiry is fixed by the first observation
            assertEquals(START.plusSeconds(61), counter.expiresAt());
        }
    }

    @Test
    void startsNewWindowAtExpiry() {
        for (int i = 0; i < 7; i++) {
            store.incrementAndGet("user:1", PER_MINUTE);
        }

        clock.advance(Duration.ofSeconds(60));
        WindowCounter counter = store.incrementAndGet("user:1", PER_MINUTE);

        assertEquals(1, counter.count());
        assertEquals(START.plusSeconds(120), counter.expiresAt());
    }

    @Test
    void keepsWindowJustBeforeExpiry() {
        store.incrementAndGet("user:1", PER_MINUTE);

        clock.advance(Duration.ofMillis(59_999));
        WindowCounter counter = store.incrementAndGet("user:1", PER_MINUTE);

        assertEquals(2, counter.count());
        assertEquals(START.plusSeconds(60), counter.expiresAt());
    }

    @Test
    void startsNewWindowLongAfterExpiry() {
        store.incrementAndGet("user:1", PER_MINUTE);

        clock.advance(Duration.ofHours(5).plusSeconds(7));
        WindowCounter counter = store.incrementAndGet("user:1", PER_MINUTE);

        assertEquals(1, counter.count());
        assertEquals(clock.instant().plusSeconds(60), counter.expiresAt());
    }

    @Test
    void keysAreIndependent() {
        store.incrementAndGet("user:1", PER_MINUTE);
        store.incrementAndGet("user:1", PER_MINUTE);

        assertEquals(1, store.incrementAndGet("user:1:export", Rate.perHour(10)).count());
        assertEquals(1, store.incrementAndGet("user:2", PER_MINUTE).count());
        assertEquals(3, store.incrementAndGet("user:1", PER_MINUTE).count());
    }

    @Test
    void windowLengthComesFromRatePeriod() {
        WindowCounter counter = store.incrementAndGet("device:abc:restore", Rate.perHour(1));
        assertEquals(START.plus(Duration.ofHours(1)), counter.expiresAt());
    }

    // ========== PEEK / RESET / EVICTION ==========

    @Test
    void peekDoesNotCount() {
        assertTrue(store.peek("user:1").isEmpty());

        store.incrementAndGet("user:1", PER_MINUTE);
        assertEquals(1, store.peek("user:1").orElseThrow().count());
        assertEquals(1, store.peek("user:1").orElseThrow().count());
        assertEquals(2, store.incrementAndGet("user:1", PER_MINUTE).count());
    }

    @Test
    void peekHidesExpiredCounters() {
        store.incrementAndGet("user:1", PER_MINUTE);
        clock.advance(Duration.ofSeconds(60));

        assertTrue(store.peek("user:1").isEmpty());
    }

    @Test
    void resetDropsCounter() {
        store.incrementAndGet("user:1", PER_MINUTE);
        store.incrementAndGet("user:1", PER_MINUTE);

        store.reset("user:1");

        assertTrue(store.peek("user:1").isEmpty());
        assertEquals(1, store.incrementAndGet("user:1", PER_MINUTE).count());
    }

    @Test
    void expiredCountersAreSwept() {
        for (int i = 0; i < 50; i++) {
            store.incrementAndGet("ip:10.0.0." + i, PER_MINUTE);
        }
        store.getCounters().cleanUp();
        assertEquals(50L, store.getStats().get("size"));

        clock.advance(Duration.ofMinutes(10));
        store.getCounters().cleanUp();

        assertEquals(0L, store.getStats().get("size"));
    }

    @Test
    void statsDescribeStore() {
        var stats = store.getStats();
        assertEquals("test", stats.get("name"));
        assertEquals("local", stats.get("type"));
        assertEquals(1_000L, stats.get("max_size"));
    }

    @Test
    void rejectsBlankKey() {
        assertThrows(IllegalArgumentException.class, () -> store.incrementAndGet("", PER_MINUTE));
        assertThrows(IllegalArgumentException.class, () -> store.incrementAndGet("  ", PER_MINUTE));
        assertThrows(IllegalArgumentException.class, () -> store.incrementAndGet(null, PER_MINUTE));
        assertThrows(IllegalArgumentException.class, () -> store.incrementAndGet("user:1", null));
    }

    // ========== CONCURRENCY ==========

    @Test
    void concurrentIncrementsAreExactlyOnce() throws InterruptedException {
        int numThreads = 32;
        int callsPerThread = 250;
        int total = numThreads * callsPerThread;

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        Queue<Long> observed = new ConcurrentLinkedQueue<>();

        for (int t = 0; t < numThreads; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        observed.add(store.incrementAndGet("user:hot", Rate.perMinute(10)).count());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "All threads should complete");
        executor.shutdown();

        List<Long> sorted = new ArrayList<>(observed);
        sorted.sort(null);
        List<Long> expected = LongStream.rangeClosed(1, total).boxed().collect(Collectors.toList());
        assertEquals(expected, sorted, "Counts must be a permutation of 1..N");
    }

    @Test
    void concurrentKeysDoNotInterfere() throws InterruptedException {
        int numKeys = 16;
        int callsPerKey = 100;

        ExecutorService executor = Executors.newFixedThreadPool(numKeys);
        CountDownLatch doneLatch = new CountDownLatch(numKeys);

        for (int k = 0; k < numKeys; k++) {
            String key = "user:" + k;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < callsPerKey; i++) {
                        store.incrementAndGet(key, PER_MINUTE);
                    }
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "All threads should complete");
        executor.shutdown();

        for (int k = 0; k < numKeys; k++) {
            assertEquals(callsPerKey, store.peek("user:" + k).orElseThrow().count());
        }
    }
}
