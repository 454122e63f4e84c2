/*
 * DNSLookup.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Non-blocking hostname lookup backed by DNS queries and a TTL cache.
 *
 * <p>DNSLookup is a drop-in replacement for a blocking
 * {@code getaddrinfo()}-style lookup. Addresses are obtained only through
 * per-family {@link FamilyResolver}s (A and AAAA queries) and cached for
 * the TTL of their records. Concurrent lookups of the same hostname and
 * family share a single upstream query. Repeated single-address lookups
 * rotate through the cached addresses.
 *
 * <p>Each instance owns its caches; nothing is shared between instances.
 * All callbacks run on the instance's {@link LookupLoop}.
 *
 * <p>Example usage:
 * <pre><code>
 * DNSLookup lookup = new DNSLookup(ipv4Resolver, ipv6Resolver);
 *
 * lookup.lookup("example.com", new LookupOptions(null, true), new LookupCallback() {
 *     &#64;Override
 *     public void onAddress(String address, int family) {
 *     }
 *
 *     &#64;Override
 *     public void onAddresses(List&lt;LookupAddress&gt; addresses) {
 *         // IPv4 addresses first, then IPv6
 *     }
 *
 *     &#64;Override
 *     public void onError(ResolverException error) {
 *         // HostNotFoundException, or the resolver's own error
 *     }
 * });
 * </code></pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see FamilyResolver
 * @see LookupCallback
 */
public class DNSLookup {

    private static final Logger LOGGER = Logger.getLogger(DNSLookup.class.getName());
    static final ResourceBundle L10N =
            ResourceBundle.getBundle("org.bluezoo.lookupcache.L10N");

    private final LookupLoop loop;
    private final boolean ownsLoop;
    private final AddressTable ipv4Table;
    private final AddressTable ipv6Table;

    /**
     * Creates a lookup running on its own, newly started loop.
     * Call {@link #close()} to stop the loop.
     *
     * @param ipv4Resolver the resolver for A queries
     * @param ipv6Resolver the resolver for AAAA queries
     */
    public DNSLookup(FamilyResolver ipv4Resolver, FamilyResolver ipv6Resolver) {
        this(ipv4Resolver, ipv6Resolver, new LookupLoop(), true);
        loop.start();
    }

    /**
     * Creates a lookup running on the given loop. The caller owns the loop
     * and is responsible for starting or driving it.
     *
     * @param ipv4Resolver the resolver for A queries
     * @param ipv6Resolver the resolver for AAAA queries
     * @param loop the loop on which lookups and callbacks run
     */
    public DNSLookup(FamilyResolver ipv4Resolver, FamilyResolver ipv6Resolver, LookupLoop loop) {
        this(ipv4Resolver, ipv6Resolver, loop, false);
    }

    private DNSLookup(FamilyResolver ipv4Resolver, FamilyResolver ipv6Resolver,
                      LookupLoop loop, boolean ownsLoop) {
        if (ipv4Resolver == null || ipv6Resolver == null || loop == null) {
            throw new NullPointerException();
        }
        this.loop = loop;
        this.ownsLoop = ownsLoop;
        this.ipv4Table = new AddressTable(AddressFamily.IPV4, ipv4Resolver, loop);
        this.ipv6Table = new AddressTable(AddressFamily.IPV6, ipv6Resolver, loop);
    }

    /**
     * Returns the loop on which this lookup runs.
     *
     * @return the loop
     */
    public LookupLoop getLoop() {
        return loop;
    }

    /**
     * Stops the loop if this lookup created it. Lookups still in flight
     * receive no callback.
     */
    public void close() {
        if (ownsLoop) {
            loop.shutdown();
        }
    }

    AddressTable getTable(AddressFamily family) {
        return family == AddressFamily.IPV4 ? ipv4Table : ipv6Table;
    }

    /**
     * Looks up a single address of either family.
     *
     * @param hostname the hostname, or null/empty for no lookup
     * @param callback the callback
     * @throws IllegalArgumentException if callback is null
     */
    public void lookup(String hostname, LookupCallback callback) {
        lookup(hostname, new LookupOptions(), callback);
    }

    /**
     * Looks up a single address of the given family.
     *
     * @param hostname the hostname, or null/empty for no lookup
     * @param family the IP version, 4 or 6
     * @param callback the callback
     * @throws IllegalArgumentException if family is not 4 or 6 or callback
     *         is null
     */
    public void lookup(String hostname, int family, LookupCallback callback) {
        lookup(hostname, new LookupOptions(family), callback);
    }

    /**
     * Looks up the addresses of a hostname.
     *
     * <p>With a family of 4 or 6 only that family is queried. Without a
     * family both are queried in parallel: in all-addresses mode the IPv4
     * addresses are followed by the IPv6 addresses, otherwise an IPv4
     * address is preferred. A family with no records does not fail a
     * dual-family lookup; any other resolver error does.
     *
     * <p>Arguments are validated on the calling thread and invalid
     * arguments are thrown, never delivered to the callback. The result is
     * always delivered later, on the loop.
     *
     * @param hostname the hostname, or null/empty for no lookup
     * @param options the options
     * @param callback the callback
     * @throws IllegalArgumentException if options or callback is null or
     *         the family is neither 4, 6 nor null
     */
    public void lookup(final String hostname, LookupOptions options, final LookupCallback callback) {
        if (options == null) {
            throw new IllegalArgumentException(L10N.getString("err.options_type"));
        }
        if (callback == null) {
            throw new IllegalArgumentException(L10N.getString("err.callback_required"));
        }
        final Integer familyNumber = options.getFamily();
        final AddressFamily family;
        if (familyNumber == null) {
            family = null;
        } else {
            family = AddressFamily.forNumber(familyNumber);
            if (family == null) {
                throw new IllegalArgumentException(L10N.getString("err.invalid_family"));
            }
        }
        final boolean all = options.isAll();

        if (hostname == null || hostname.isEmpty()) {
            loop.invokeLater(new Runnable() {
                @Override
                public void run() {
                    if (all) {
                        callback.onAddresses(Collections.<LookupAddress>emptyList());
                    } else {
                        callback.onAddress(null, family == AddressFamily.IPV6 ? 6 : 4);
                    }
                }
            });
            return;
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.lookup"),
                    hostname, String.valueOf(familyNumber), all));
        }
        loop.invokeLater(new Runnable() {
            @Override
            public void run() {
                if (family == null) {
                    DualLookupCollector collector = new DualLookupCollector(hostname, all, callback);
                    lookupFamily(hostname, ipv4Table, all, collector.v4Callback);
                    lookupFamily(hostname, ipv6Table, all, collector.v6Callback);
                } else {
                    lookupFamily(hostname, getTable(family), all, callback);
                }
            }
        });
    }

    private void lookupFamily(final String hostname, final AddressTable table, boolean all,
                              final LookupCallback callback) {
        final String syscall = table.getFamily().getSyscall();
        table.resolve(hostname, all, new TableCallback() {
            @Override
            public void onAddresses(List<ResolvedAddress> addresses) {
                if (addresses.isEmpty()) {
                    callback.onError(new HostNotFoundException(hostname, syscall));
                    return;
                }
                List<LookupAddress> result = new ArrayList<>(addresses.size());
                for (ResolvedAddress address : addresses) {
                    result.add(address.toLookupAddress());
                }
                callback.onAddresses(result);
            }

            @Override
            public void onAddress(ResolvedAddress address) {
                if (address == null) {
                    callback.onError(new HostNotFoundException(hostname, syscall));
                    return;
                }
                callback.onAddress(address.getAddress(), address.getFamily().getNumber());
            }

            @Override
            public void onError(ResolverException error) {
                if (ResolverException.ENODATA.equals(error.getCode())) {
                    callback.onError(new HostNotFoundException(hostname, error.getSyscall()));
                } else {
                    callback.onError(error);
                }
            }
        });
    }

}
