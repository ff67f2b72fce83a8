package com.gamecal.backend.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * In-process TTL cache that runs at most one producer per key at a time. Callers arriving
 * while a production is under way wait for that same result. Failures are handed to every
 * waiter and never stored, so the next call after a failure produces again.
 */
@Slf4j
@Component
public class CoalescingTtlCache {

    private record Entry(Object value, Instant expiresAt) {}

    private final ConcurrentMap<String, Entry> store = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<Object>> inflight = new ConcurrentHashMap<>();
    private final Clock clock;

    public CoalescingTtlCache(Clock clock) {
        this.clock = clock;
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrSet(String key, Duration ttl, Supplier<T> producer) {
        Entry live = liveEntry(key);
        if (live != null) return (T) live.value();

        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> existing = inflight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("cache {} joining in-flight production", key);
            return (T) await(existing);
        }

        try {
            // another caller may have stored a value between the first check and registration
            live = liveEntry(key);
            if (live != null) {
                mine.complete(live.value());
                return (T) live.value();
            }
            log.debug("cache {} miss, producing", key);
            T value = producer.get();
            store.put(key, new Entry(value, clock.instant().plus(ttl)));
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inflight.remove(key, mine);
        }
    }

    /** Live value for {@code key} without producing one. */
    @SuppressWarnings("unchecked")
    public <T> T peek(String key) {
        Entry live = liveEntry(key);
        return live == null ? null : (T) live.value();
    }

    public void invalidate(String key) {
        store.remove(key);
    }

    public int size() {
        return store.size();
    }

    private Entry liveEntry(String key) {
        Entry e = store.get(key);
        if (e == null) return null;
        if (clock.instant().isBefore(e.expiresAt())) return e;
        store.remove(key, e);
        return null;
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }
}
