/* (C)2026 */
package com.ammann.imputation.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One re-entrant lock per station. Holding a station's lock never blocks other stations.
 */
public final class StationLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String stationId, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(stationId, id -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
