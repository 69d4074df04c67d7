package com.example.chatorchestrator.session;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single logical owner per session: work submitted for the same session id runs one at a
 * time, in arrival order; different sessions never wait on each other.
 */
@Component
public class SessionSerializer {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> released = ConcurrentHashMap.newKeySet();

    public <T> T execute(String sessionId, Supplier<T> work) {
        ReentrantLock lock = acquire(sessionId);
        try {
            return work.get();
        } finally {
            if (lock.getHoldCount() == 1 && released.remove(sessionId)) {
                locks.remove(sessionId, lock);
            }
            lock.unlock();
        }
    }

    public void run(String sessionId, Runnable work) {
        execute(sessionId, () -> {
            work.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String sessionId) {
        ReentrantLock lock = locks.get(sessionId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    // a lock released while this thread waited on it is stale; retry on the current one
    private ReentrantLock acquire(String sessionId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock(true));
            lock.lock();
            if (locks.get(sessionId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    /**
     * Drops the lock of an evicted session once the current owner leaves {@link #execute}.
     * Threads already waiting on it move over to a fresh lock.
     */
    public void release(String sessionId) {
        released.add(sessionId);
    }
}
