package me.golemcore.relay.domain.service;

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

import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * Bounded set of message IDs that were already accepted for routing.
 *
 * <p>
 * Insertion-ordered. When a new ID would exceed {@code maxSize}, the oldest
 * half is evicted and the newest {@code maxSize / 2} are kept. This is a cheap
 * approximation of LRU: an ID is never refreshed by a lookup.
 *
 * <p>
 * {@link #markIfAbsent(String)} is atomic, so two concurrent deliveries of the
 * same ID cannot both win.
 */
public class ProcessedMessageCache {

    public static final int DEFAULT_MAX_SIZE = 1000;

    private final int maxSize;
    private final LinkedHashSet<String> ids = new LinkedHashSet<>();

    public ProcessedMessageCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public ProcessedMessageCache(int maxSize) {
        if (maxSize < 2) {
            throw new IllegalArgumentException("maxSize must be at least 2");
        }
        this.maxSize = maxSize;
    }

    public synchronized boolean contains(String messageId) {
        return ids.contains(messageId);
    }

    /**
     * Record the ID.
     *
     * @return true if the ID was new, false if it was already recorded
     */
    public synchronized boolean markIfAbsent(String messageId) {
        if (ids.contains(messageId)) {
            return false;
        }
        if (ids.size() >= maxSize) {
            evictOldestHalf();
        }
        ids.add(messageId);
        return true;
    }

    public synchronized int size() {
        return ids.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    public synchronized void clear() {
        ids.clear();
    }

    private void evictOldestHalf() {
        int toKeep = maxSize / 2;
        int toRemove = ids.size() - toKeep;
        Iterator<String> iterator = ids.iterator();
        while (toRemove > 0 && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
            toRemove--;
        }
    }
}
