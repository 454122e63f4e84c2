/*
 * AddressTableTest.java
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

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link AddressTable}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AddressTableTest {

    private static final String HOST = "example.com";

    private ScriptedResolver resolver;
    private LookupLoop loop;
    private AddressTable table;

    @Before
    public void setUp() {
        resolver = new ScriptedResolver();
        loop = new LookupLoop();
        table = new AddressTable(AddressFamily.IPV4, resolver, loop);
    }

    /**
     * Records what the table delivered.
     */
    private static class RecordingCallback implements TableCallback {
        final List<List<ResolvedAddress>> lists = new ArrayList<>();
        final List<ResolvedAddress> singles = new ArrayList<>();
        final List<ResolverException> errors = new ArrayList<>();

        int count() {
            return lists.size() + singles.size() + errors.size();
        }

        @Override
        public void onAddresses(List<ResolvedAddress> addresses) {
            lists.add(addresses);
        }

        @Override
        public void onAddress(ResolvedAddress address) {
            singles.add(address);
        }

        @Override
        public void onError(ResolverException error) {
            errors.add(error);
        }
    }

    @Test
    public void testConcurrentRequestsShareOneQuery() {
        RecordingCallback[] callbacks = new RecordingCallback[5];
        for (int i = 0; i < callbacks.length; i++) {
            callbacks[i] = new RecordingCallback();
            table.resolve(HOST, true, callbacks[i]);
        }
        assertEquals(1, resolver.queryCount(HOST));
        assertEquals(1, table.getTasks().size());
        assertEquals(5, table.getTasks().get(HostKey.of(HOST, AddressFamily.IPV4)).getCallbackCount());

        resolver.complete(HOST, new AddressRecord("1.2.3.4", 60));
        loop.runPendingTasks();

        for (RecordingCallback callback : callbacks) {
            assertEquals(1, callback.count());
            assertEquals("1.2.3.4", callback.lists.get(0).get(0).getAddress());
        }
        assertEquals(0, table.getTasks().size());
    }

    @Test
    public void testCachedAnswerWithoutQuery() {
        table.resolve(HOST, true, new RecordingCallback());
        resolver.complete(HOST, new AddressRecord("1.2.3.4", 60));
        loop.runPendingTasks();

        RecordingCallback callback = new RecordingCallback();
        table.resolve(HOST, true, callback);
        table.resolve(HOST, true, callback);
        assertEquals("Cached answers are delivered later", 0, callback.count());
        loop.runPendingTasks();

        assertEquals(2, callback.lists.size());
        assertEquals(1, resolver.queryCount(HOST));
    }

    @Test
    public void testRoundRobinAcrossRequests() {
        RecordingCallback callback = new RecordingCallback();
        table.resolve(HOST, false, callback);
        resolver.complete(HOST, new AddressRecord("1.2.3.4", 60), new AddressRecord("5.6.7.8", 60));
        loop.runPendingTasks();

        table.resolve(HOST, false, callback);
        table.resolve(HOST, false, callback);
        loop.runPendingTasks();

        assertEquals(3, callback.singles.size());
        assertEquals("1.2.3.4", callback.singles.get(0).getAddress());
        assertEquals("5.6.7.8", callback.singles.get(1).getAddress());
        assertEquals("1.2.3.4", callback.singles.get(2).getAddress());
    }

    @Test
    public void testCoalescedSingleRequestsRotate() {
        RecordingCallback callback = new RecordingCallback();
        table.resolve(HOST, false, callback);
        table.resolve(HOST, false, callback);
        resolver.complete(HOST, new AddressRecord("1.2.3.4", 60), new AddressRecord("5.6.7.8", 60));
        loop.runPendingTasks();

        assertEquals("1.2.3.4", callback.singles.get(0).getAddress());
        assertEquals("5.6.7.8", callback.singles.get(1).getAddress());
    }

    @Test
    public void testExpiredEntryTriggersNewQuery() throws InterruptedException {
        table.resolve(HOST, true, new RecordingCallback());
        resolver.complete(HOST, new AddressRecord("1.2.3.4", 0));
        loop.runPendingTasks();

        Thread.sleep(10);

        RecordingCallback callback = new RecordingCallback();
        table.resolve(HOST, true, callback);
        assertEquals(2, resolver.queryCount(HOST));
        resolver.complete(HOST, new AddressRecord("5.6.7.8", 60));
        loop.runPendingTasks();

        assertEquals("5.6.7.8", callback.lists.get(0).get(0).getAddress());
    }

    @Test
    public void testErrorPassedThroughAndNotCached() {
        RecordingCallback callback = new RecordingCallback();
        table.resolve(HOST, false, callback);
        ResolverException error = new ResolverException(ResolverException.ENODATA, HOST, "queryA");
        resolver.fail(HOST, error);
        loop.runPendingTasks();

        assertSame(error, callback.errors.get(0));

        table.resolve(HOST, false, callback);
        assertEquals("Errors are not cached", 2, resolver.queryCount(HOST));
    }

    @Test
    public void testRequestFromCallbackStartsNewQuery() {
        final RecordingCallback retry = new RecordingCallback();
        table.resolve(HOST, false, new TableCallback() {
            @Override
            public void onAddresses(List<ResolvedAddress> addresses) {
                fail("Not in all mode");
            }

            @Override
            public void onAddress(ResolvedAddress address) {
                fail("Should not resolve");
            }

            @Override
            public void onError(ResolverException error) {
                table.resolve(HOST, false, retry);
            }
        });
        resolver.fail(HOST, new ResolverException(ResolverException.ETIMEOUT, HOST, "queryA"));
        loop.runPendingTasks();

        assertEquals(2, resolver.queryCount(HOST));
        assertEquals(1, resolver.pendingCount());
        resolver.complete(HOST, new AddressRecord("1.2.3.4", 60));
        loop.runPendingTasks();

        assertEquals(1, retry.count());
        assertEquals("1.2.3.4", retry.singles.get(0).getAddress());
    }

    @Test
    public void testEmptyAnswerDeliveredAsNoAddress() {
        RecordingCallback callback = new RecordingCallback();
        table.resolve(HOST, false, callback);
        table.resolve(HOST, true, callback);
        resolver.complete(HOST);
        loop.runPendingTasks();

        assertNull(callback.singles.get(0));
        assertTrue(callback.lists.get(0).isEmpty());
        assertFalse(table.getCache().has(HostKey.of(HOST, AddressFamily.IPV4)));
    }

    @Test
    public void testDistinctHostnamesResolvedIndependently() {
        table.resolve("a.example.com", true, new RecordingCallback());
        table.resolve("b.example.com", true, new RecordingCallback());

        assertEquals(1, resolver.queryCount("a.example.com"));
        assertEquals(1, resolver.queryCount("b.example.com"));
        assertEquals(2, table.getTasks().size());
    }

}
