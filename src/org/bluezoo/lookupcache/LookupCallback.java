/*
 * LookupCallback.java
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

import java.util.List;

/**
 * Callback interface for {@link DNSLookup} results.
 *
 * <p>For each accepted lookup exactly one of these methods is called,
 * once, on the {@link LookupLoop} thread: {@link #onAddress} when the
 * lookup asked for a single address, {@link #onAddresses} when it asked
 * for all of them, or {@link #onError}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see DNSLookup
 */
public interface LookupCallback {

    /**
     * Called with the single address of a lookup without {@code all}.
     *
     * <p>For an empty hostname the address is null and the family is 6
     * if family 6 was requested, otherwise 4.
     *
     * @param address the textual IP address
     * @param family the IP version, 4 or 6
     */
    void onAddress(String address, int family);

    /**
     * Called with the addresses of a lookup with {@code all}. When both
     * families were resolved the IPv4 addresses come first.
     *
     * @param addresses the addresses, empty only for an empty hostname
     */
    void onAddresses(List<LookupAddress> addresses);

    /**
     * Called when the lookup fails.
     *
     * @param error a {@link HostNotFoundException} if the host has no
     *        addresses, otherwise the resolver's error unchanged
     */
    void onError(ResolverException error);

}
