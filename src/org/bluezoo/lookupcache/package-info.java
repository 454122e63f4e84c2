/*
 * package-info.java
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

/**
 * Caching, non-blocking hostname lookup.
 *
 * <p>This package replaces a blocking, thread-pool backed hostname lookup
 * with one that:
 * <ul>
 * <li>Resolves only through A and AAAA queries, via pluggable
 *     {@link org.bluezoo.lookupcache.FamilyResolver}s</li>
 * <li>Caches answers for the TTL of their records</li>
 * <li>Shares one upstream query between concurrent lookups of the same
 *     hostname and family</li>
 * <li>Rotates through the cached addresses on repeated single-address
 *     lookups</li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * DNSLookup lookup = new DNSLookup(ipv4Resolver, ipv6Resolver);
 * lookup.lookup("example.com", 4, callback);
 * </pre>
 *
 * <p>Without a family both families are queried in parallel. Results and
 * errors are delivered to a {@link org.bluezoo.lookupcache.LookupCallback}
 * on the lookup's {@link org.bluezoo.lookupcache.LookupLoop}. A hostname
 * with no addresses is reported as a
 * {@link org.bluezoo.lookupcache.HostNotFoundException} with code
 * {@code ENOTFOUND}; other resolver errors are passed through unchanged.
 *
 * <h2>Threading</h2>
 *
 * <p>Lookups may be issued from any thread. The cache, the in-flight
 * registry and all callbacks are confined to the loop thread.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see org.bluezoo.lookupcache.DNSLookup
 */
package org.bluezoo.lookupcache;
