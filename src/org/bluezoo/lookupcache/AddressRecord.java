/*
 * AddressRecord.java
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

/**
 * A single address returned by a {@link FamilyResolver}, together with
 * the TTL of the DNS record it came from.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class AddressRecord {

    private final String address;
    private final int ttl;

    /**
     * Creates a new address record.
     *
     * @param address the textual IP address
     * @param ttl the record TTL in seconds
     * @throws IllegalArgumentException if address is null or ttl is negative
     */
    public AddressRecord(String address, int ttl) {
        if (address == null) {
            throw new IllegalArgumentException("address must not be null");
        }
        if (ttl < 0) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        this.address = address;
        this.ttl = ttl;
    }

    /**
     * Returns the textual IP address.
     *
     * @return the address
     */
    public String getAddress() {
        return address;
    }

    /**
     * Returns the record TTL.
     *
     * @return the TTL in seconds
     */
    public int getTTL() {
        return ttl;
    }

    @Override
    public String toString() {
        return address + " (ttl=" + ttl + ")";
    }

}
