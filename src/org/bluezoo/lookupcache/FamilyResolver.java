/*
 * FamilyResolver.java
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
 * Asynchronous DNS query for one address family.
 *
 * <p>Implementations issue an A query (IPv4) or an AAAA query (IPv6) and
 * report each answer with the TTL of its record. TTL metadata is
 * mandatory: {@link DNSLookup} caches answers for exactly that long.
 *
 * <p>The callback may be invoked on any thread, including synchronously
 * from within {@link #resolve}. It must be invoked exactly once.
 * Protocol-level retries and timeouts are the implementation's concern.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see org.bluezoo.lookupcache.resolver.HostsFileResolver
 */
public interface FamilyResolver {

    /**
     * Resolves a hostname.
     *
     * @param hostname the hostname to query
     * @param callback the callback to receive the records or the error
     */
    void resolve(String hostname, ResolverCallback callback);

}
