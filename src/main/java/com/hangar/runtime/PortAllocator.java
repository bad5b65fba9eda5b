package com.hangar.runtime;

import com.hangar.core.error.ContainerOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory host-port reservation set.
 *
 * <p>Grows monotonically: ports are never handed back, so a port issued once
 * in this process is never issued again. Safe for concurrent callers within
 * one process; two processes sharing a Docker daemon will double-allocate.
 */
public class PortAllocator {

    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    private final int basePort;
    private final int maxPort;
    private final Set<Integer> used = new TreeSet<>();
    private final ReentrantLock lock = new ReentrantLock();

    public PortAllocator(int basePort, int maxPort) {
        if (basePort < 1 || maxPort > 65535 || basePort > maxPort) {
            throw new IllegalArgumentException("Invalid port range " + basePort + "-" + maxPort);
        }
        this.basePort = basePort;
        this.maxPort = maxPort;
    }

    /**
     * @return the lowest port {@code >= basePort} not yet reserved, now reserved
     */
    public int reserve() {
        lock.lock();
        try {
            for (int port = basePort; port <= maxPort; port++) {
                if (used.add(port)) {
                    log.debug("Reserved host port {}", port);
                    return port;
                }
            }
            throw new ContainerOperationException(null,
                    "No free host port left in range " + basePort + "-" + maxPort);
        } finally {
            lock.unlock();
        }
    }

    public void markInUse(Collection<Integer> ports) {
        lock.lock();
        try {
            for (Integer port : ports) {
                if (port != null && port > 0) {
                    used.add(port);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isReserved(int port) {
        lock.lock();
        try {
            return used.contains(port);
        } finally {
            lock.unlock();
        }
    }

    public int reservedCount() {
        lock.lock();
        try {
            return used.size();
        } finally {
            lock.unlock();
        }
    }

    public int getBasePort() {
        return basePort;
    }
}
