/*
 * DNSLookupTest.java
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
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link DNSLookup}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DNSLookupTest {

    private static final String HOST = "example.com";

    private ScriptedResolver ipv4;
    private ScriptedResolver ipv6;
    private LookupLoop loop;
    private DNSLookup lookup;

    @Before
    public void setUp() {
        ipv4 = new ScriptedResolver();
        ipv6 = new ScriptedResolver();
        loop = new LookupLoop();
        lookup = new DNSLookup(ipv4, ipv6, loop);
    }

    /**
     * Records every callback invocation.
     */
    private static class RecordingCallback implements LookupCallback {
        final List<String> addresses = new ArrayList<>();
        final List<Integer> families = new ArrayList<>();
        final List<List<LookupAddress>> lists = new ArrayList<>();
        final List<ResolverException> errors = new ArrayList<>();

        int count() {
            return addresses.size() + lists.size() + errors.size();
        }

        @Override
        public void onAddress(String address, int family) {
            addresses.add(address);
            families.add(family);
        }

        @Override
        public void onAddresses(List<LookupAddress> list) {
            lists.add(list);
        }

        @Override
        public void onError(ResolverException error) {
            errors.add(error);
        }
    }

    private static ResolverException notFound(String syscall) {
        return new ResolverException(ResolverException.ENOTFOUND, HOST, syscall);
    }

    // -- Argument validation --

    @Test
    public void testNullOptionsRejected() {
        try {
            lookup.lookup(HOST, (LookupOptions) null, new RecordingCallback());
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("options must be an object or an ip version number", e.getMessage());
        }
        assertEquals(0, loop.getPendingTaskCount());
    }

    @Test
    public void testInvalidFamilyRejected() {
        for (int family : new int[] { 0, 5, 7, -4 }) {
            try {
                lookup.lookup(HOST, family, new RecordingCallback());
                fail("Expected IllegalArgumentException for family " + family);
            } catch (IllegalArgumentException e) {
                assertEquals("invalid family number, must be one of the {4, 6} or undefined",
                        e.getMessage());
            }
        }
        assertEquals(0, loop.getPendingTaskCount());
        assertTrue(ipv4.queries.isEmpty());
    }

    @Test
    public void testInvalidFamilyInOptionsRejected() {
        try {
            lookup.lookup(HOST, new LookupOptions(5, true), new RecordingCallback());
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullCallbackRejected() {
        lookup.lookup(HOST, 4, null);
    }

    @Test
    public void testInvalidFamilyRejectedForEmptyHostname() {
        try {
            lookup.lookup("", 5, new RecordingCallback());
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    // -- Empty hostname --

    @Test
    public void testEmptyHostnameSingle() {
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(null, callback);
        lookup.lookup("", new LookupOptions(null, false), callback);
        lookup.lookup("", 4, callback);
        lookup.lookup(null, 6, callback);
        assertEquals("Delivered on a later loop turn", 0, callback.count());
        loop.runPendingTasks();

        assertEquals(Arrays.asList(null, null, null, null), callback.addresses);
        assertEquals(Arrays.asList(4, 4, 4, 6), callback.families);
        assertTrue(callback.errors.isEmpty());
        assertTrue(ipv4.queries.isEmpty());
        assertTrue(ipv6.queries.isEmpty());
    }

    @Test
    public void testEmptyHostnameAll() {
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup("", new LookupOptions(null, true), callback);
        lookup.lookup(null, new LookupOptions(6, true), callback);
        loop.runPendingTasks();

        assertEquals(2, callback.lists.size());
        assertTrue(callback.lists.get(0).isEmpty());
        assertTrue(callback.lists.get(1).isEmpty());
        assertTrue(callback.addresses.isEmpty());
    }

    // -- Single family --

    @Test
    public void testSingleFamilyLookup() {
        ipv4.answerWith(HOST, new AddressRecord("1.2.3.4", 60));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, 4, callback);
        loop.runPendingTasks();

        assertEquals(Arrays.asList("1.2.3.4"), callback.addresses);
        assertEquals(Arrays.asList(4), callback.families);
        assertTrue(ipv6.queries.isEmpty());
    }

    @Test
    public void testSingleFamilyAll() {
        ipv6.answerWith(HOST, new AddressRecord("::1", 60), new AddressRecord("::2", 60));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, new LookupOptions(6, true), callback);
        loop.runPendingTasks();

        assertEquals(Arrays.asList(new LookupAddress("::1", 6), new LookupAddress("::2", 6)),
                callback.lists.get(0));
    }

    @Test
    public void testCoalescing() {
        RecordingCallback callback = new RecordingCallback();
        for (int i = 0; i < 10; i++) {
            lookup.lookup(HOST, new LookupOptions(4, true), callback);
        }
        loop.runPendingTasks();
        assertEquals(1, ipv4.queryCount(HOST));

        ipv4.complete(HOST, new AddressRecord("1.2.3.4", 60));
        loop.runPendingTasks();

        assertEquals(10, callback.lists.size());
        for (List<LookupAddress> list : callback.lists) {
            assertEquals(Arrays.asList(new LookupAddress("1.2.3.4", 4)), list);
        }
        assertEquals(1, ipv4.queryCount(HOST));
    }

    @Test
    public void testIdempotentWhileCached() {
        ipv4.answerWith(HOST, new AddressRecord("1.2.3.4", 60));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, 4, callback);
        loop.runPendingTasks();
        lookup.lookup(HOST, 4, callback);
        loop.runPendingTasks();
        lookup.lookup(HOST, new LookupOptions(4, true), callback);
        loop.runPendingTasks();

        assertEquals(1, ipv4.queryCount(HOST));
        assertEquals(3, callback.count());
    }

    @Test
    public void testRoundRobin() {
        ipv4.answerWith(HOST, new AddressRecord("1.2.3.4", 60), new AddressRecord("5.6.7.8", 60));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, new LookupOptions(4, true), callback);
        loop.runPendingTasks();

        lookup.lookup(HOST, 4, callback);
        loop.runPendingTasks();
        lookup.lookup(HOST, 4, callback);
        loop.runPendingTasks();
        lookup.lookup(HOST, 4, callback);
        loop.runPendingTasks();

        assertEquals(Arrays.asList("1.2.3.4", "5.6.7.8", "1.2.3.4"), callback.addresses);
    }

    @Test
    public void testFamiliesCachedIndependently() {
        ipv4.answerWith(HOST, new AddressRecord("1.2.3.4", 60));
        ipv6.answerWith(HOST, new AddressRecord("::1", 60));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, 4, callback);
        lookup.lookup(HOST, 6, callback);
        loop.runPendingTasks();

        assertEquals(1, ipv4.queryCount(HOST));
        assertEquals(1, ipv6.queryCount(HOST));
        assertEquals(Arrays.asList(4, 6), callback.families);
    }

    @Test
    public void testTTLExpiry() throws InterruptedException {
        ipv4.answerWith(HOST, new AddressRecord("1.2.3.4", 1));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, 4, callback);
        loop.runPendingTasks();
        lookup.lookup(HOST, 4, callback);
        loop.runPendingTasks();
        assertEquals("Still cached within the TTL", 1, ipv4.queryCount(HOST));

        Thread.sleep(1100);
        lookup.lookup(HOST, 4, callback);
        loop.runPendingTasks();

        assertEquals("Queried again after the TTL", 2, ipv4.queryCount(HOST));
        assertEquals(3, callback.addresses.size());
    }

    @Test
    public void testNoDataMappedToNotFound() {
        ipv4.failWith(HOST, new ResolverException(ResolverException.ENODATA, HOST, "queryA"));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, 4, callback);
        loop.runPendingTasks();

        ResolverException error = callback.errors.get(0);
        assertTrue(error instanceof HostNotFoundException);
        assertEquals("ENOTFOUND", error.getCode());
        assertEquals("ENOTFOUND", error.getErrno());
        assertEquals(HOST, error.getHostname());
        assertEquals("queryA", error.getSyscall());
        assertEquals("queryA ENOTFOUND example.com", error.getMessage());
    }

    @Test
    public void testEmptyAnswerMappedToNotFound() {
        ipv6.answerWith(HOST);
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, new LookupOptions(6, true), callback);
        lookup.lookup(HOST, 6, callback);
        loop.runPendingTasks();

        assertEquals(2, callback.errors.size());
        for (ResolverException error : callback.errors) {
            assertTrue(error instanceof HostNotFoundException);
            assertEquals("queryAaaa", error.getSyscall());
        }
    }

    @Test
    public void testUpstreamErrorPassedThroughToAllWaiters() {
        RecordingCallback first = new RecordingCallback();
        RecordingCallback second = new RecordingCallback();
        lookup.lookup(HOST, 6, first);
        lookup.lookup(HOST, 6, second);
        loop.runPendingTasks();

        ResolverException error = new ResolverException(ResolverException.ETIMEOUT, HOST, "queryAaaa");
        ipv6.fail(HOST, error);
        loop.runPendingTasks();

        assertSame(error, first.errors.get(0));
        assertSame(error, second.errors.get(0));
        assertEquals(1, ipv6.queryCount(HOST));
    }

    // -- Both families --

    @Test
    public void testDualFamilyFanOut() {
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, new LookupOptions(null, true), callback);
        loop.runPendingTasks();

        assertEquals("Both queries issued before either answers", 1, ipv4.pendingCount());
        assertEquals(1, ipv6.pendingCount());

        ipv6.complete(HOST, new AddressRecord("::1", 60));
        loop.runPendingTasks();
        assertEquals("Waits for both branches", 0, callback.count());

        ipv4.complete(HOST, new AddressRecord("1.2.3.4", 60));
        loop.runPendingTasks();
        assertEquals(1, callback.count());
    }

    @Test
    public void testDualFamilyMergeAll() {
        ipv4.answerWith(HOST, new AddressRecord("1.2.3.4", 60));
        ipv6.answerWith(HOST, new AddressRecord("::1", 60));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, new LookupOptions(null, true), callback);
        loop.runPendingTasks();

        assertEquals(Arrays.asList(new LookupAddress("1.2.3.4", 4), new LookupAddress("::1", 6)),
                callback.lists.get(0));
    }

    @Test
    public void testDualFamilyPrefersIPv4() {
        ipv4.answerWith(HOST, new AddressRecord("1.2.3.4", 60));
        ipv6.answerWith(HOST, new AddressRecord("::1", 60));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, callback);
        loop.runPendingTasks();

        assertEquals(Arrays.asList("1.2.3.4"), callback.addresses);
        assertEquals(Arrays.asList(4), callback.families);
    }

    @Test
    public void testDualFamilyFallsBackToIPv6() {
        ipv4.failWith(HOST, notFound("queryA"));
        ipv6.answerWith(HOST, new AddressRecord("::1", 60));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, new LookupOptions(), callback);
        loop.runPendingTasks();

        assertEquals(Arrays.asList("::1"), callback.addresses);
        assertEquals(Arrays.asList(6), callback.families);
    }

    @Test
    public void testDualFamilyNoDataCountsAsEmpty() {
        ipv4.answerWith(HOST, new AddressRecord("1.2.3.4", 60));
        ipv6.failWith(HOST, new ResolverException(ResolverException.ENODATA, HOST, "queryAaaa"));
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, new LookupOptions(null, true), callback);
        loop.runPendingTasks();

        assertEquals(Arrays.asList(new LookupAddress("1.2.3.4", 4)), callback.lists.get(0));
    }

    @Test
    public void testDualFamilyTotalFailure() {
        ipv4.failWith(HOST, notFound("queryA"));
        ipv6.failWith(HOST, notFound("queryAaaa"));
        RecordingCallback single = new RecordingCallback();
        RecordingCallback all = new RecordingCallback();
        lookup.lookup(HOST, new LookupOptions(), single);
        lookup.lookup(HOST, new LookupOptions(null, true), all);
        loop.runPendingTasks();

        for (RecordingCallback callback : Arrays.asList(single, all)) {
            assertEquals(1, callback.count());
            ResolverException error = callback.errors.get(0);
            assertTrue(error instanceof HostNotFoundException);
            assertEquals("ENOTFOUND", error.getCode());
            assertEquals(HOST, error.getHostname());
            assertNull(error.getSyscall());
            assertEquals("ENOTFOUND example.com", error.getMessage());
        }
    }

    @Test
    public void testDualFamilyOtherErrorPropagatesOnce() {
        RecordingCallback callback = new RecordingCallback();
        lookup.lookup(HOST, new LookupOptions(null, true), callback);
        loop.runPendingTasks();

        ResolverException error = new ResolverException(ResolverException.ESERVFAIL, HOST, "queryAaaa");
        ipv6.fail(HOST, error);
        loop.runPendingTasks();
        assertEquals(1, callback.count());
        assertSame(error, callback.errors.get(0));

        ipv4.complete(HOST, new AddressRecord("1.2.3.4", 60));
        loop.runPendingTasks();
        assertEquals("Late branch is discarded", 1, callback.count());

        RecordingCallback later = new RecordingCallback();
        lookup.lookup(HOST, 4, later);
        loop.runPendingTasks();
        assertEquals("Late branch still populates the cache", 1, ipv4.queryCount(HOST));
        assertEquals(Arrays.asList("1.2.3.4"), later.addresses);
    }

    @Test
    public void testOptionsSnapshotAtCallTime() {
        ipv4.answerWith(HOST, new AddressRecord("1.2.3.4", 60));
        RecordingCallback callback = new RecordingCallback();
        LookupOptions options = new LookupOptions(4, false);
        lookup.lookup(HOST, options, callback);
        options.setAll(true);
        options.setFamily(6);
        loop.runPendingTasks();

        assertEquals(Arrays.asList("1.2.3.4"), callback.addresses);
        assertTrue(ipv6.queries.isEmpty());
    }

    // -- Threaded --

    @Test
    public void testOwnLoopDeliversOnLoopThread() throws InterruptedException {
        final ScriptedResolver v4 = new ScriptedResolver();
        final ScriptedResolver v6 = new ScriptedResolver();
        final DNSLookup threaded = new DNSLookup(v4, v6);
        try {
            assertTrue(threaded.getLoop().isRunning());
            final CountDownLatch latch = new CountDownLatch(1);
            final AtomicReference<String> result = new AtomicReference<>();
            final AtomicBoolean onLoop = new AtomicBoolean();
            threaded.lookup(HOST, 4, new LookupCallback() {
                @Override
                public void onAddress(String address, int family) {
                    result.set(address);
                    onLoop.set(threaded.getLoop().inLoop());
                    latch.countDown();
                }

                @Override
                public void onAddresses(List<LookupAddress> addresses) {
                    fail("Not in all mode");
                }

                @Override
                public void onError(ResolverException error) {
                    fail("Should not get error: " + error);
                }
            });

            long deadline = System.currentTimeMillis() + 5000;
            while (v4.pendingCount() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            Thread answerer = new Thread(new Runnable() {
                @Override
                public void run() {
                    v4.complete(HOST, new AddressRecord("1.2.3.4", 60));
                }
            });
            answerer.start();

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals("1.2.3.4", result.get());
            assertTrue("Callbacks run on the loop thread", onLoop.get());
        } finally {
            threaded.close();
        }
    }

}
