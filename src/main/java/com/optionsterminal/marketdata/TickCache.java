package com.optionsterminal.marketdata;

import com.optionsterminal.domain.model.OptionChainRow;
import com.optionsterminal.domain.model.TickKey;
import com.optionsterminal.domain.model.TickRecord;
import com.optionsterminal.domain.model.TickUpdate;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last-value store for every instrument the session has seen, shared by the push-feed
 * callback thread, REST handlers and the relay loops.
 *
 * <p>Every accepted update merges into the existing record (absent fields leave prior
 * values untouched) and increments the version by exactly one. The map and the version
 * change under the same write lock, so a snapshot's records always reflect its version.
 */
public class TickCache {

    private static final Logger log = LoggerFactory.getLogger(TickCache.class);

    private final Map<TickKey, TickRecord> records = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    /** Written under the write lock; volatile so {@link #version()} can skip the lock. */
    private volatile long version;

    public TickCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Merges {@code update} into the record for {@code key}, creating it if absent.
     *
     * @return the version after this update
     */
    public long update(TickKey key, TickUpdate update) {
        double now = clock.millis() / 1000.0;
        lock.writeLock().lock();
        try {
            TickRecord existing = records.getOrDefault(key, TickRecord.empty());
            records.put(key, existing.merge(update, now));
            return ++version;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Wire-key variant used at the boundary.
     *
     * @throws com.optionsterminal.exception.MalformedKeyException if the key does not parse;
     *     the cache and its version are left unchanged
     */
    public long update(String wireKey, TickUpdate update) {
        return update(TickKey.parse(wireKey), update);
    }

    /** Point-in-time copy of all records together with the version they correspond to. */
    public TickCacheSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new TickCacheSnapshot(Map.copyOf(records), version);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long version() {
        return version;
    }

    public Optional<TickRecord> get(TickKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Empties the cache and resets the version to zero. Only done at a session boundary;
     * observers detect the reset through the session id, not the version.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            int dropped = records.size();
            records.clear();
            version = 0;
            log.debug("Tick cache cleared, {} records dropped", dropped);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<OptionChainRow> delta() {
        return snapshot().optionChainRows();
    }

    public Map<String, Double> spotPrices() {
        return snapshot().spotPrices();
    }

    /** Cached spot level for {@code symbol}, if one with a positive price is present. */
    public Optional<Double> spotPrice(String symbol) {
        return get(TickKey.spot(symbol)).map(TickRecord::getLtp).filter(ltp -> ltp > 0);
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
