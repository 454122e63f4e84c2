/*
 * ResolveTask.java
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
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One upstream resolution for one {@link HostKey}, shared by every caller
 * that asks for the key while it is running.
 *
 * <p>A task is RUNNING from creation until the resolver answers, then
 * COMPLETED. On completion it removes itself from the registry, stores a
 * successful answer in the cache and then invokes each attached callback
 * exactly once, in attachment order. Because the task is deregistered
 * before any callback runs, a lookup issued from inside a callback never
 * attaches to a completed task.
 *
 * <p>The resolver may answer on any thread, or synchronously from within
 * {@link FamilyResolver#resolve}; the answer is always handed to the
 * {@link LookupLoop} before any state is touched.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ResolveTask {

    private static final Logger LOGGER = Logger.getLogger(ResolveTask.class.getName());

    enum State {
        RUNNING,
        COMPLETED
    }

    /**
     * Receives the outcome of a task.
     */
    interface Callback {

        /**
         * Called with the entry produced by a successful resolution. The
         * entry is a snapshot taken at completion and is not re-checked
         * for expiry.
         *
         * @param entry the resolved addresses, possibly empty
         */
        void onResolved(CacheEntry entry);

        /**
         * Called with the resolver's error, unchanged.
         *
         * @param error the upstream error
         */
        void onError(ResolverException error);

    }

    private final HostKey key;
    private final FamilyResolver resolver;
    private final LookupLoop loop;
    private final AddressCache cache;
    private final ResolveTaskRegistry registry;

    private List<Callback> callbacks;
    private State state;

    ResolveTask(HostKey key, FamilyResolver resolver, LookupLoop loop,
                AddressCache cache, ResolveTaskRegistry registry) {
        this.key = key;
        this.resolver = resolver;
        this.loop = loop;
        this.cache = cache;
        this.registry = registry;
        this.callbacks = new ArrayList<>();
        this.state = State.RUNNING;
    }

    State getState() {
        return state;
    }

    HostKey getKey() {
        return key;
    }

    int getCallbackCount() {
        return callbacks.size();
    }

    /**
     * Attaches a callback to receive this task's outcome.
     *
     * @param callback the callback
     * @throws IllegalStateException if the task has completed
     */
    void addCallback(Callback callback) {
        if (state == State.COMPLETED) {
            throw new IllegalStateException(DNSLookup.L10N.getString("err.task_completed"));
        }
        callbacks.add(callback);
    }

    /**
     * Issues the upstream query. Called once, after registration.
     */
    void launch() {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(DNSLookup.L10N.getString("debug.task_launched"),
                    key.hostname, key.family.getNumber()));
        }
        try {
            resolver.resolve(key.hostname, new ResolverCallback() {
                @Override
                public void onResolved(List<AddressRecord> records) {
                    final List<ResolvedAddress> addresses;
                    try {
                        addresses = stamp(records, System.currentTimeMillis());
                    } catch (RuntimeException e) {
                        String message = MessageFormat.format(
                                DNSLookup.L10N.getString("warn.invalid_answer"), key.hostname);
                        LOGGER.log(Level.WARNING, message, e);
                        fail(new ResolverException(ResolverException.EUNKNOWN,
                                key.hostname, key.family.getSyscall(), e));
                        return;
                    }
                    loop.invokeLater(new Runnable() {
                        @Override
                        public void run() {
                            complete(addresses, null);
                        }
                    });
                }

                @Override
                public void onError(ResolverException error) {
                    fail(error);
                }
            });
        } catch (RuntimeException e) {
            String message = MessageFormat.format(DNSLookup.L10N.getString("warn.resolver_threw"),
                    key.hostname);
            LOGGER.log(Level.WARNING, message, e);
            fail(new ResolverException(ResolverException.EUNKNOWN,
                    key.hostname, key.family.getSyscall(), e));
        }
    }

    /**
     * Stamps a resolver answer with its expiry, on the thread that
     * delivered it. The resolver's list is not retained.
     */
    private List<ResolvedAddress> stamp(List<AddressRecord> records, long now) {
        List<ResolvedAddress> addresses = new ArrayList<>();
        if (records != null) {
            for (AddressRecord record : records) {
                addresses.add(ResolvedAddress.extend(record, key.family, now));
            }
        }
        return addresses;
    }

    private void fail(final ResolverException error) {
        loop.invokeLater(new Runnable() {
            @Override
            public void run() {
                complete(null, error);
            }
        });
    }

    private void complete(List<ResolvedAddress> addresses, ResolverException error) {
        if (state == State.COMPLETED) {
            LOGGER.warning(MessageFormat.format(DNSLookup.L10N.getString("warn.duplicate_completion"),
                    key.hostname, key.family.getNumber()));
            return;
        }
        state = State.COMPLETED;
        registry.remove(key);
        List<Callback> waiting = callbacks;
        callbacks = new ArrayList<>();

        if (error != null) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(DNSLookup.L10N.getString("debug.task_failed"),
                        key.hostname, key.family.getNumber(), error.getCode()));
            }
            for (Callback callback : waiting) {
                try {
                    callback.onError(error);
                } catch (RuntimeException e) {
                    logCallbackFailure(e);
                }
            }
            return;
        }

        CacheEntry entry;
        if (addresses.isEmpty()) {
            // An empty entry has no expiry time, so it is never stored
            entry = new CacheEntry(addresses);
        } else {
            entry = cache.put(key, addresses);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(DNSLookup.L10N.getString("debug.task_resolved"),
                    key.hostname, key.family.getNumber(), entry.size()));
        }
        for (Callback callback : waiting) {
            try {
                callback.onResolved(entry);
            } catch (RuntimeException e) {
                logCallbackFailure(e);
            }
        }
    }

    private void logCallbackFailure(RuntimeException e) {
        String message = MessageFormat.format(DNSLookup.L10N.getString("warn.callback_failed"),
                key.hostname);
        LOGGER.log(Level.WARNING, message, e);
    }

}
