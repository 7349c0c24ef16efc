package com.dagrun.core.resources;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ResourcePoolTest {

    private ResourcePool pool;

    @BeforeEach
    void setUp() {
        pool = new ResourcePool(Map.of("gpu", 4, "io", 1));
    }

    @Nested
    @DisplayName("acquire and release")
    class AcquireTests {

        @Test
        @DisplayName("acquire moves units from available to used")
        void acquireAccounts() throws InterruptedException {
            try (Allocation allocation = pool.acquire(Map.of("gpu", 3))) {
                assertEquals(Map.of("gpu", 3), allocation.held());
                assertEquals(Map.of("gpu", 1, "io", 1), pool.available());
                assertEquals(Map.of("gpu", 3), pool.used());
                assertEquals(Map.of("gpu", 4, "io", 1), pool.total());
            }
            assertEquals(Map.of("gpu", 4, "io", 1), pool.available());
            assertEquals(Map.of(), pool.used());
        }

        @Test
        @DisplayName("partial release returns units early")
        void partialRelease() throws InterruptedException {
            try (Allocation allocation = pool.acquire(Map.of("gpu", 2, "io", 1))) {
                allocation.release(Map.of("gpu", 1));

                assertEquals(Map.of("gpu", 1, "io", 1), allocation.held());
                assertEquals(Map.of("gpu", 3), pool.available());
            }
            assertEquals(Map.of(), pool.used());
        }

        @Test
        @DisplayName("releasing more than held fails and changes nothing")
        void overRelease() throws InterruptedException {
            try (Allocation allocation = pool.acquire(Map.of("gpu", 1))) {
                assertThrows(ResourceException.class, () -> allocation.release(Map.of("gpu", 2)));
                assertEquals(Map.of("gpu", 1), allocation.held());
            }
        }

        @Test
        @DisplayName("allocation can grow with further requests")
        void requestMore() throws InterruptedException {
            try (Allocation allocation = pool.acquire(Map.of("gpu", 1))) {
                allocation.request(Map.of("gpu", 2, "io", 1));
                assertEquals(Map.of("gpu", 3, "io", 1), allocation.held());
            }
            assertEquals(Map.of(), pool.used());
        }
    }

    @Nested
    @DisplayName("limits")
    class LimitTests {

        @Test
        @DisplayName("request larger than total capacity fails immediately")
        void exceedsTotal() {
            assertThrows(ResourceException.class, () -> pool.acquire(Map.of("gpu", 5)));
            assertThrows(ResourceException.class, () -> pool.acquire(Map.of("tpu", 1)));
        }

        @Test
        @DisplayName("negative amounts are rejected")
        void negativeRejected() {
            assertThrows(ResourceException.class, () -> pool.acquire(Map.of("gpu", -1)));
            assertThrows(ResourceException.class, () -> new ResourcePool(Map.of("gpu", -2)));
        }

        @Test
        @DisplayName("addResources grows capacity")
        void addResources() throws InterruptedException {
            pool.addResources(Map.of("tpu", 2));
            try (Allocation allocation = pool.acquire(Map.of("tpu", 2))) {
                assertEquals(Map.of("tpu", 2), allocation.held());
            }
        }
    }

    @Nested
    @DisplayName("blocking")
    class BlockingTests {

        @Test
        @DisplayName("acquire waits until enough units are released")
        void waitsForRelease() throws Exception {
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Allocation first = pool.acquire(Map.of("io", 1));
                Future<Allocation> second = executor.submit(() -> pool.acquire(Map.of("io", 1)));

                assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));

                first.close();
                try (Allocation allocation = second.get(5, TimeUnit.SECONDS)) {
                    assertEquals(Map.of("io", 1), allocation.held());
                }
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("waiting acquire is interruptible")
        void interruptible() throws Exception {
            pool.acquire(Map.of("io", 1));
            var thrown = new CompletableFuture<Throwable>();
            Thread waiter = new Thread(() -> {
                try {
                    pool.acquire(Map.of("io", 1));
                    thrown.complete(null);
                } catch (Throwable t) {
                    thrown.complete(t);
                }
            });
            waiter.start();
            Thread.sleep(100);
            waiter.interrupt();

            assertInstanceOf(InterruptedException.class, thrown.get(5, TimeUnit.SECONDS));
        }
    }
}
