/*
 * ResolverException.java
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
 * A resolver failure.
 *
 * <p>Carries the error code of the failed query, the hostname queried and,
 * where known, the name of the query ({@code queryA} or
 * {@code queryAaaa}). Resolver errors are delivered to every caller
 * waiting on the same resolution as the same instance.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ResolverException extends Exception {

    private static final long serialVersionUID = 1L;

    /** The server answered but has no records of the requested type. */
    public static final String ENODATA = "ENODATA";

    /** The domain name does not exist. */
    public static final String ENOTFOUND = "ENOTFOUND";

    /** The query timed out. */
    public static final String ETIMEOUT = "ETIMEOUT";

    /** The server failed to process the query. */
    public static final String ESERVFAIL = "ESERVFAIL";

    /** The server refused the query. */
    public static final String EREFUSED = "EREFUSED";

    /** The server could not be contacted. */
    public static final String ECONNREFUSED = "ECONNREFUSED";

    /** The query was cancelled. */
    public static final String ECANCELLED = "ECANCELLED";

    /** The resolver failed without reporting a code. */
    public static final String EUNKNOWN = "EUNKNOWN";

    private final String code;
    private final String hostname;
    private final String syscall;

    /**
     * Creates a new resolver exception.
     *
     * @param code the error code
     * @param hostname the hostname queried
     * @param syscall the query name, or null
     */
    public ResolverException(String code, String hostname, String syscall) {
        super(formatMessage(code, hostname, syscall));
        this.code = code;
        this.hostname = hostname;
        this.syscall = syscall;
    }

    /**
     * Creates a new resolver exception with a cause.
     *
     * @param code the error code
     * @param hostname the hostname queried
     * @param syscall the query name, or null
     * @param cause the underlying cause
     */
    public ResolverException(String code, String hostname, String syscall, Throwable cause) {
        super(formatMessage(code, hostname, syscall), cause);
        this.code = code;
        this.hostname = hostname;
        this.syscall = syscall;
    }

    /**
     * Returns the error code.
     *
     * @return the code, e.g. "ENOTFOUND"
     */
    public String getCode() {
        return code;
    }

    /**
     * Returns the error number. Resolver errors use their code as errno.
     *
     * @return the same value as {@link #getCode()}
     */
    public String getErrno() {
        return code;
    }

    public String getHostname() {
        return hostname;
    }

    /**
     * Returns the name of the failed query.
     *
     * @return the syscall label, or null if unknown
     */
    public String getSyscall() {
        return syscall;
    }

    private static String formatMessage(String code, String hostname, String syscall) {
        String message = code + " " + hostname;
        if (syscall != null) {
            message = syscall + " " + message;
        }
        return message;
    }

}
