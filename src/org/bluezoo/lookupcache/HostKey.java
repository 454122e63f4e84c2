/*
 * HostKey.java
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
 * Cache and coalescing key combining a hostname and an address family.
 *
 * <p>Two keys are equal when both the hostname string and the family are
 * equal, so the IPv4 and IPv6 answers for one host are cached and
 * coalesced independently.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class HostKey {

    final String hostname;
    final AddressFamily family;

    private HostKey(String hostname, AddressFamily family) {
        this.hostname = hostname;
        this.family = family;
    }

    static HostKey of(String hostname, AddressFamily family) {
        return new HostKey(hostname, family);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HostKey)) {
            return false;
        }
        HostKey other = (HostKey) o;
        return family == other.family && hostname.equals(other.hostname);
    }

    @Override
    public int hashCode() {
        return 31 * hostname.hashCode() + family.hashCode();
    }

    @Override
    public String toString() {
        return hostname + "_" + family.getNumber();
    }

}
