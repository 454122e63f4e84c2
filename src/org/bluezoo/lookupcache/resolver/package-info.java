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
 * Offline {@link org.bluezoo.lookupcache.FamilyResolver} implementations.
 *
 * <p>The lookup engine itself obtains addresses only through A and AAAA
 * queries, issued by resolvers the application supplies: the DNS wire
 * protocol and its transports are not part of this library. The
 * resolvers here answer without querying DNS at all, for tests, for
 * offline use and for hosts that are only named locally. The TTLs they
 * report are configured, not received from an authoritative server.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.lookupcache.resolver;
