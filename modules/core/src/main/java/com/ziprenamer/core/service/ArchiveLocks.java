package com.ziprenamer.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per archive id, created on first use and evicted when its last holder
 * or waiter leaves.
 */
@ApplicationScoped
public class ArchiveLocks {

    private static final Logger log = Logger.getLogger(ArchiveLocks.class);

    @FunctionalInterface
    public interface LockedWork<T> {
        T run() throws IOException;
    }

    private static final class Holder {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    private final ConcurrentHashMap<String, Holder> holders = new ConcurrentHashMap<>();

    public <T> T withLock(String archiveId, LockedWork<T> work) throws IOException {
        Holder holder = holders.compute(archiveId, (id, h) -> {
            Holder current = h != null ? h : new Holder();
            current.users++;
            return current;
        });
        if (holder.lock.isLocked()) {
            log.debugf("Waiting for archive %s", archiveId);
        }
        holder.lock.lock();
        try {
            return work.run();
        } finally {
            holder.lock.unlock();
            holders.computeIfPresent(archiveId, (id, h) -> --h.users == 0 ? null : h);
        }
    }

    /** Number of archive ids currently holding or awaiting a lock. */
    public int activeCount() {
        return holders.size();
    }
}
