/*
 * TableCallback.java
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
 * Receives the result of {@link AddressTable#resolve}.
 *
 * <p>Exactly one method is called, once, on the {@link LookupLoop}
 * thread.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
interface TableCallback {

    /**
     * Called in all-addresses mode.
     *
     * @param addresses every address of the entry, possibly empty
     */
    void onAddresses(List<ResolvedAddress> addresses);

    /**
     * Called in single-address mode.
     *
     * @param address the next address in rotation, or null if the
     *        resolver returned no records
     */
    void onAddress(ResolvedAddress address);

    /**
     * Called with the resolver's error, unchanged.
     *
     * @param error the upstream error
     */
    void onError(ResolverException error);

}
