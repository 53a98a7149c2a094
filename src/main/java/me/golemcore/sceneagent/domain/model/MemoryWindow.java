package me.golemcore.sceneagent.domain.model;

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

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity, insertion-ordered buffer of (key, value) entries. Inserting
 * past capacity evicts the oldest entry, so {@code size() <= capacity()} always
 * holds. All operations lock the window itself.
 *
 * @param <T>
 *            value type
 */
public class MemoryWindow<T> {

    private final int capacity;
    private final Deque<Entry<T>> entries = new ArrayDeque<>();

    public MemoryWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Memory window capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void save(String key, T value, Instant storedAt) {
        entries.addLast(new Entry<>(key, value, storedAt));
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * Entries oldest first.
     */
    public synchronized List<Entry<T>> entries() {
        return new ArrayList<>(entries);
    }

    public synchronized Optional<Entry<T>> latest() {
        return Optional.ofNullable(entries.peekLast());
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int capacity() {
        return capacity;
    }

    public record Entry<T>(String key, T value, Instant storedAt) {
    }
}
