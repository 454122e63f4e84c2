/*
 * AddressCache.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of lookupcache, a caching DNS lookup library.
 *
 * lookupcache is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * lookupcache is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with lookupcache.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.lookupcache;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * TTL-aware store of resolved addresses.
 *
 * <p>Expiry is checked lazily on every read; there is no background
 * sweep. An entry whose addresses have any expiry time in the past is
 * treated as absent and dropped.
 *
 * <p>Not thread-safe. Instances are confined to the {@link LookupLoop}
 * thread of their owning {@link AddressTable}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class AddressCache {

    private final Map<HostKey, CacheEntry> cache;

    AddressCache() {
        this.cache = new HashMap<>();
    }

    /**
     * Returns true if an unexpired entry exists for the key.
     *
     * @param key the key
     * @return whether a usable entry is cached
     */
    boolean has(HostKey key) {
        return has(key, System.currentTimeMillis());
    }

    boolean has(HostKey key, long now) {
        return get(key, now) != null;
    }

    /**
     * Returns the unexpired entry for the key.
     *
     * @param key the key
     * @return the entry, or null if absent or expired
     */
    CacheEntry get(HostKey key) {
        return get(key, System.currentTimeMillis());
    }

    CacheEntry get(HostKey key, long now) {
        CacheEntry entry = cache.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(now)) {
            cache.remove(key);
            return null;
        }
        return entry;
    }

    /**
     * Stores addresses for a key, replacing any previous entry.
     *
     * @param key the key
     * @param addresses the stamped addresses, copied into the entry
     * @return the new entry
     */
    CacheEntry put(HostKey key, List<ResolvedAddress> addresses) {
        CacheEntry entry = new CacheEntry(addresses);
        cache.put(key, entry);
        return entry;
    }

    /**
     * Returns the number of stored entries, including any that have
     * expired but not yet been read.
     *
     * @return the entry count
     */
    int size() {
        return cache.size();
    }

    void clear() {
        cache.clear();
    }

}
