/*
 * ResolvedAddress.java
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
 * An {@link AddressRecord} stamped with its family and absolute expiry
 * time.
 *
 * <p>Instances are immutable. The expiry time is fixed when the upstream
 * answer is received: {@code expiresAt = receivedAt + ttl * 1000}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ResolvedAddress {

    private final String address;
    private final int ttl;
    private final AddressFamily family;
    private final long expiresAt;

    ResolvedAddress(String address, int ttl, AddressFamily family, long expiresAt) {
        this.address = address;
        this.ttl = ttl;
        this.family = family;
        this.expiresAt = expiresAt;
    }

    /**
     * Stamps a raw resolver record.
     *
     * @param record the record returned by the resolver
     * @param family the family of the query that produced it
     * @param now the time the answer was received, in milliseconds
     * @return the stamped address
     */
    static ResolvedAddress extend(AddressRecord record, AddressFamily family, long now) {
        return new ResolvedAddress(record.getAddress(), record.getTTL(), family,
                now + record.getTTL() * 1000L);
    }

    public String getAddress() {
        return address;
    }

    public int getTTL() {
        return ttl;
    }

    public AddressFamily getFamily() {
        return family;
    }

    /**
     * Returns the absolute expiry time.
     *
     * @return the expiry time in milliseconds since the epoch
     */
    public long getExpiresAt() {
        return expiresAt;
    }

    /**
     * Indicates whether this address has expired at the given time.
     *
     * @param now the current time in milliseconds
     * @return true if the expiry time has passed
     */
    boolean isExpired(long now) {
        return expiresAt < now;
    }

    /**
     * Returns the public view of this address.
     *
     * @return the address and family number
     */
    LookupAddress toLookupAddress() {
        return new LookupAddress(address, family.getNumber());
    }

    @Override
    public String toString() {
        return address + "/" + family.getNumber() + " (ttl=" + ttl + ")";
    }

}
