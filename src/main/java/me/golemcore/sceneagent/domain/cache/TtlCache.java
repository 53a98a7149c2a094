package me.golemcore.sceneagent.domain.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.sceneagent.domain.model.CacheStats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-to-live key/value cache with string keys.
 *
 * <p>
 * Expiry is checked lazily on read: an entry is valid while
 * {@code now - storedAt < ttl}, and an expired entry is dropped the first time
 * it is looked up. There is no background sweep.
 *
 * @param <V>
 *            cached value type
 */
public class TtlCache<V> {

    private final Map<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final Clock clock;

    public TtlCache(Clock clock) {
        this.clock = clock;
    }

    public Optional<V> get(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (!entry.isValidAt(clock.instant())) {
            entries.remove(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.value());
    }

    public void put(String key, V value, Duration ttl) {
        entries.put(key, new CacheEntry<>(value, clock.instant(), ttl));
    }

    /**
     * Removes every key starting with {@code prefix}, or everything when the
     * prefix is null or blank.
     *
     * @return number of removed entries
     */
    public int invalidate(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            int size = entries.size();
            entries.clear();
            return size;
        }
        int removed = 0;
        for (String key : entries.keySet()) {
            if (key.startsWith(prefix) && entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    public CacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        long total = h + m;
        return new CacheStats(h, m, entries.size(), total == 0 ? 0.0 : (double) h / total);
    }

    private record CacheEntry<V>(V value, Instant storedAt, Duration ttl) {

        boolean isValidAt(Instant now) {
            return Duration.between(storedAt, now).compareTo(ttl) < 0;
        }
    }
}
