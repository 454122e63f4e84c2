/*
 * HostNotFoundException.java
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
 * Reported by {@link DNSLookup} when a hostname has no addresses.
 *
 * <p>The code and errno are always {@link #ENOTFOUND}. The syscall is set
 * when the failure is attributable to one family's query.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HostNotFoundException extends ResolverException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new not-found exception.
     *
     * @param hostname the hostname
     * @param syscall the query name, or null
     */
    public HostNotFoundException(String hostname, String syscall) {
        super(ENOTFOUND, hostname, syscall);
    }

}
