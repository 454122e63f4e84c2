/*
 * CacheEntry.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The addresses resolved for one {@link HostKey}, with a round-robin
 * cursor.
 *
 * <p>An entry is usable only while none of its addresses has expired;
 * it is never partially pruned.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class CacheEntry {

    private final List<ResolvedAddress> addresses;
    private int cursor;

    CacheEntry(List<ResolvedAddress> addresses) {
        this.addresses = Collections.unmodifiableList(new ArrayList<>(addresses));
    }

    /**
     * Returns all addresses in upstream order.
     *
     * @return an unmodifiable list
     */
    List<ResolvedAddress> getAddresses() {
        return addresses;
    }

    /**
     * Returns the next address in rotation.
     *
     * @return the next address, or null if the entry is empty
     */
    ResolvedAddress next() {
        if (addresses.isEmpty()) {
            return null;
        }
        ResolvedAddress address = addresses.get(cursor);
        cursor = (cursor + 1) % addresses.size();
        return address;
    }

    boolean isEmpty() {
        return addresses.isEmpty();
    }

    int size() {
        return addresses.size();
    }

    /**
     * Indicates whether any address in this entry has expired.
     *
     * @param now the current time in milliseconds
     * @return true if the entry must no longer be used
     */
    boolean isExpired(long now) {
        for (ResolvedAddress address : addresses) {
            if (address.isExpired(now)) {
                return true;
            }
        }
        return false;
    }

}
