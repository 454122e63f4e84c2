/*
 * ResolverCallback.java
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
 * Callback interface for {@link FamilyResolver} results.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface ResolverCallback {

    /**
     * Called when the query succeeds.
     *
     * @param records the addresses and their TTLs
     */
    void onResolved(List<AddressRecord> records);

    /**
     * Called when the query fails.
     *
     * @param error the failure, with a resolver error code such as
     *        {@link ResolverException#ENODATA}
     */
    void onError(ResolverException error);

}
