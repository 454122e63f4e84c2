/*
 * AddressTable.java
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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves hostnames for one address family.
 *
 * <p>A request is served from the {@link AddressCache} when an unexpired
 * entry exists, otherwise it joins the in-flight {@link ResolveTask} for
 * the same hostname, otherwise a new task is created, registered and
 * launched. At most one upstream query per hostname is therefore
 * outstanding for this family at any time.
 *
 * <p>Cached answers are delivered on a later loop turn, so callers see the
 * same asynchronous contract whether the answer came from the cache or
 * the network. In single-address mode each answer is the next address of
 * the entry's round-robin rotation.
 *
 * <p>All methods must be called on the {@link LookupLoop} thread.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class AddressTable {

    private static final Logger LOGGER = Logger.getLogger(AddressTable.class.getName());

    private final AddressFamily family;
    private final FamilyResolver resolver;
    private final LookupLoop loop;
    private final AddressCache cache;
    private final ResolveTaskRegistry tasks;

    AddressTable(AddressFamily family, FamilyResolver resolver, LookupLoop loop) {
        this.family = family;
        this.resolver = resolver;
        this.loop = loop;
        this.cache = new AddressCache();
        this.tasks = new ResolveTaskRegistry();
    }

    AddressFamily getFamily() {
        return family;
    }

    AddressCache getCache() {
        return cache;
    }

    ResolveTaskRegistry getTasks() {
        return tasks;
    }

    /**
     * Resolves a hostname in this table's family.
     *
     * @param hostname the hostname
     * @param all true to receive every address, false for one address
     * @param callback the callback
     */
    void resolve(String hostname, final boolean all, final TableCallback callback) {
        HostKey key = HostKey.of(hostname, family);

        final CacheEntry cached = cache.get(key);
        if (cached != null) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(DNSLookup.L10N.getString("debug.cache_hit"),
                        hostname, family.getNumber()));
            }
            final ResolvedAddress next = all ? null : cached.next();
            loop.invokeLater(new Runnable() {
                @Override
                public void run() {
                    if (all) {
                        callback.onAddresses(cached.getAddresses());
                    } else {
                        callback.onAddress(next);
                    }
                }
            });
            return;
        }

        ResolveTask.Callback waiter = new ResolveTask.Callback() {
            @Override
            public void onResolved(CacheEntry entry) {
                if (all) {
                    callback.onAddresses(entry.getAddresses());
                } else {
                    callback.onAddress(entry.next());
                }
            }

            @Override
            public void onError(ResolverException error) {
                callback.onError(error);
            }
        };

        ResolveTask task = tasks.get(key);
        if (task != null) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(DNSLookup.L10N.getString("debug.task_attached"),
                        hostname, family.getNumber()));
            }
            task.addCallback(waiter);
            return;
        }

        task = new ResolveTask(key, resolver, loop, cache, tasks);
        tasks.add(key, task);
        task.addCallback(waiter);
        task.launch();
    }

}
