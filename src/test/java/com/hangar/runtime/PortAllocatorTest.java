package com.hangar.runtime;

import com.hangar.core.error.ContainerOperationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PortAllocatorTest {

    @Test
    @DisplayName("Reserves ports upward from the base port")
    void reservesSequentially() {
        var allocator = new PortAllocator(8090, 65535);
        assertEquals(8090, allocator.reserve());
        assertEquals(8091, allocator.reserve());
        assertTrue(allocator.isReserved(8090));
    }

    @Test
    @DisplayName("Ports marked in use are skipped")
    void skipsSeededPorts() {
        var allocator = new PortAllocator(8090, 65535);
        allocator.markInUse(Arrays.asList(8090, 8092, null, 0));
        assertEquals(8091, allocator.reserve());
        assertEquals(8093, allocator.reserve());
        assertEquals(4, allocator.reservedCount());
    }

    @Test
    @DisplayName("Exhausted range fails with a container operation error")
    void exhausted() {
        var allocator = new PortAllocator(9000, 9001);
        allocator.reserve();
        allocator.reserve();
        var ex = assertThrows(ContainerOperationException.class, allocator::reserve);
        assertTrue(ex.getMessage().contains("9000-9001"));
    }

    @Test
    @DisplayName("Invalid ranges are rejected")
    void invalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new PortAllocator(9000, 8000));
        assertThrows(IllegalArgumentException.class, () -> new PortAllocator(0, 8000));
        assertThrows(IllegalArgumentException.class, () -> new PortAllocator(8000, 70000));
    }

    @Test
    @DisplayName("Concurrent reservations never hand out the same port twice")
    void concurrentReservationsAreUnique() throws Exception {
        var allocator = new PortAllocator(10000, 10999);
        Set<Integer> ports = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        var start = new CountDownLatch(1);
        try {
            for (int i = 0; i < 200; i++) {
                pool.submit(() -> {
                    start.await();
                    ports.add(allocator.reserve());
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(200, ports.size());
        assertEquals(200, allocator.reservedCount());
        assertFalse(List.copyOf(ports).contains(11000));
    }
}
