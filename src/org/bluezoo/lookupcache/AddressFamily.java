/*
 * AddressFamily.java
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
 * IP address family selector.
 *
 * <p>Each family corresponds to one DNS record type: A records for
 * {@link #IPV4} and AAAA records for {@link #IPV6}. The syscall label is
 * the name of the query reported in resolver errors.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum AddressFamily {

    /** IPv4, resolved with A queries. */
    IPV4(4, "queryA"),

    /** IPv6, resolved with AAAA queries. */
    IPV6(6, "queryAaaa");

    private final int number;
    private final String syscall;

    AddressFamily(int number, String syscall) {
        this.number = number;
        this.syscall = syscall;
    }

    /**
     * Returns the IP version number (4 or 6).
     *
     * @return the version number
     */
    public int getNumber() {
        return number;
    }

    /**
     * Returns the name of the query used for this family.
     *
     * @return the syscall label, e.g. "queryA"
     */
    public String getSyscall() {
        return syscall;
    }

    /**
     * Returns the family for an IP version number.
     *
     * @param number the version number
     * @return the family, or null if the number is neither 4 nor 6
     */
    public static AddressFamily forNumber(int number) {
        switch (number) {
            case 4:
                return IPV4;
            case 6:
                return IPV6;
            default:
                return null;
        }
    }

}
