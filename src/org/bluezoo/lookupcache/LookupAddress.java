/*
 * LookupAddress.java
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
 * An address delivered by {@link DNSLookup} in all-addresses mode.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see LookupCallback#onAddresses(java.util.List)
 */
public final class LookupAddress {

    private final String address;
    private final int family;

    /**
     * Creates a new lookup address.
     *
     * @param address the textual IP address
     * @param family the IP version, 4 or 6
     */
    public LookupAddress(String address, int family) {
        this.address = address;
        this.family = family;
    }

    public String getAddress() {
        return address;
    }

    public int getFamily() {
        return family;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LookupAddress)) {
            return false;
        }
        LookupAddress other = (LookupAddress) o;
        return family == other.family && address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return 31 * address.hashCode() + family;
    }

    @Override
    public String toString() {
        return "{address=" + address + ", family=" + family + "}";
    }

}
