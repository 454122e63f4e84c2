/*
 * ResolveTaskRegistry.java
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
import java.util.HashMap;
import java.util.Map;

/**
 * Registry of in-flight resolutions, at most one per {@link HostKey}.
 *
 * <p>Tasks remove themselves when they complete; callers only add and
 * look up.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class ResolveTaskRegistry {

    private final Map<HostKey, ResolveTask> tasks;

    ResolveTaskRegistry() {
        this.tasks = new HashMap<>();
    }

    boolean has(HostKey key) {
        return tasks.containsKey(key);
    }

    ResolveTask get(HostKey key) {
        return tasks.get(key);
    }

    /**
     * Registers a task.
     *
     * @param key the key the task resolves
     * @param task the task
     * @throws IllegalStateException if a task is already registered for key
     */
    void add(HostKey key, ResolveTask task) {
        if (tasks.containsKey(key)) {
            String message = MessageFormat.format(
                    DNSLookup.L10N.getString("err.task_in_flight"), key);
            throw new IllegalStateException(message);
        }
        tasks.put(key, task);
    }

    void remove(HostKey key) {
        tasks.remove(key);
    }

    int size() {
        return tasks.size();
    }

}
