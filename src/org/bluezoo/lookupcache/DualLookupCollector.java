/*
 * DualLookupCollector.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Combines the parallel IPv4 and IPv6 branches of a lookup without a
 * family.
 *
 * <p>A branch that ends in {@link ResolverException#ENOTFOUND} counts as
 * an empty result. Any other branch error is delivered at once and the
 * other branch's outcome is then ignored. Confined to the
 * {@link LookupLoop} thread.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class DualLookupCollector {

    final LookupCallback v4Callback;
    final LookupCallback v6Callback;

    private final String hostname;
    private final boolean all;
    private final LookupCallback callback;
    private List<LookupAddress> v4Addresses;
    private List<LookupAddress> v6Addresses;
    private boolean done;

    DualLookupCollector(String hostname, boolean all, LookupCallback callback) {
        this.hostname = hostname;
        this.all = all;
        this.callback = callback;
        this.v4Callback = new Branch(true);
        this.v6Callback = new Branch(false);
    }

    private void branchDone(boolean v4, List<LookupAddress> addresses) {
        if (done) {
            return;
        }
        if (v4) {
            v4Addresses = addresses;
        } else {
            v6Addresses = addresses;
        }
        checkComplete();
    }

    private void branchFailed(ResolverException error) {
        if (done) {
            return;
        }
        done = true;
        callback.onError(error);
    }

    private void checkComplete() {
        if (v4Addresses == null || v6Addresses == null) {
            return;
        }
        done = true;
        if (all) {
            List<LookupAddress> combined = new ArrayList<>(v4Addresses.size() + v6Addresses.size());
            combined.addAll(v4Addresses);
            combined.addAll(v6Addresses);
            if (combined.isEmpty()) {
                callback.onError(new HostNotFoundException(hostname, null));
            } else {
                callback.onAddresses(combined);
            }
            return;
        }
        List<LookupAddress> preferred = !v4Addresses.isEmpty() ? v4Addresses : v6Addresses;
        if (preferred.isEmpty()) {
            callback.onError(new HostNotFoundException(hostname, null));
        } else {
            LookupAddress address = preferred.get(0);
            callback.onAddress(address.getAddress(), address.getFamily());
        }
    }

    private class Branch implements LookupCallback {

        private final boolean v4;

        Branch(boolean v4) {
            this.v4 = v4;
        }

        @Override
        public void onAddress(String address, int family) {
            branchDone(v4, Collections.singletonList(new LookupAddress(address, family)));
        }

        @Override
        public void onAddresses(List<LookupAddress> addresses) {
            branchDone(v4, addresses);
        }

        @Override
        public void onError(ResolverException error) {
            if (ResolverException.ENOTFOUND.equals(error.getCode())) {
                branchDone(v4, Collections.<LookupAddress>emptyList());
            } else {
                branchFailed(error);
            }
        }

    }

}
