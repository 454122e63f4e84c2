/*
 * HostsFileResolver.java
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

package org.bluezoo.lookupcache.resolver;

import java.io.BufferedReader;
import java.io.IOException;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.lookupcache.AddressFamily;
import org.bluezoo.lookupcache.AddressRecord;
import org.bluezoo.lookupcache.FamilyResolver;
import org.bluezoo.lookupcache.ResolverCallback;
import org.bluezoo.lookupcache.ResolverException;

/**
 * {@link FamilyResolver} that answers from a hosts-format file instead of
 * DNS. Intended for tests and offline use; production lookups use a
 * resolver that issues real A or AAAA queries.
 *
 * <p>Each line holds an address followed by one or more hostnames; text
 * after {@code #} is ignored, as are lines whose address cannot be parsed.
 * Hostnames match case-insensitively. Only addresses of this resolver's
 * family are returned, each with the configured TTL, so that a caching
 * {@link org.bluezoo.lookupcache.DNSLookup} consults the file again once
 * the TTL has elapsed.
 *
 * <p>The file is parsed lazily and parsed again whenever its modification
 * time changes. An unknown hostname fails with
 * {@link ResolverException#ENOTFOUND}; a hostname listed only with
 * addresses of the other family fails with {@link ResolverException#ENODATA}.
 * The callback is invoked synchronously.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class HostsFileResolver implements FamilyResolver {

    private static final Logger LOGGER = Logger.getLogger(HostsFileResolver.class.getName());
    static final ResourceBundle L10N =
            ResourceBundle.getBundle("org.bluezoo.lookupcache.resolver.L10N");

    /** Default TTL, in seconds, of the records returned. */
    public static final int DEFAULT_TTL = 300;

    private final AddressFamily family;
    private Path path;
    private int ttl;

    private Map<String, List<InetAddress>> entries;
    private FileTime entriesModified;

    /**
     * Creates a resolver for the system hosts file.
     *
     * @param family the family of the addresses to return
     */
    public HostsFileResolver(AddressFamily family) {
        this(family, locateHostsFile());
    }

    /**
     * Creates a resolver for the given hosts file.
     *
     * @param family the family of the addresses to return
     * @param path the hosts file
     */
    public HostsFileResolver(AddressFamily family, Path path) {
        if (family == null) {
            throw new NullPointerException("family");
        }
        this.family = family;
        this.path = path;
        this.ttl = DEFAULT_TTL;
    }

    public AddressFamily getFamily() {
        return family;
    }

    public synchronized Path getPath() {
        return path;
    }

    /**
     * Sets the hosts file to read. The file is parsed on the next lookup.
     *
     * @param path the hosts file
     */
    public synchronized void setPath(Path path) {
        this.path = path;
        this.entries = null;
        this.entriesModified = null;
    }

    public synchronized int getTTL() {
        return ttl;
    }

    /**
     * Sets the TTL reported for every record.
     *
     * @param ttl the TTL in seconds
     * @throws IllegalArgumentException if ttl is negative
     */
    public synchronized void setTTL(int ttl) {
        if (ttl < 0) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        this.ttl = ttl;
    }

    @Override
    public void resolve(String hostname, ResolverCallback callback) {
        List<InetAddress> addresses;
        int recordTTL;
        synchronized (this) {
            addresses = getEntries().get(hostname.toLowerCase());
            recordTTL = ttl;
        }
        if (addresses == null) {
            callback.onError(new ResolverException(ResolverException.ENOTFOUND,
                    hostname, family.getSyscall()));
            return;
        }
        List<AddressRecord> records = new ArrayList<>();
        for (InetAddress address : addresses) {
            if (matchesFamily(address)) {
                records.add(new AddressRecord(address.getHostAddress(), recordTTL));
            }
        }
        if (records.isEmpty()) {
            callback.onError(new ResolverException(ResolverException.ENODATA,
                    hostname, family.getSyscall()));
            return;
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.resolved"),
                    hostname, records.size(), path));
        }
        callback.onResolved(records);
    }

    private boolean matchesFamily(InetAddress address) {
        if (family == AddressFamily.IPV4) {
            return address instanceof Inet4Address;
        }
        return address instanceof Inet6Address;
    }

    private Map<String, List<InetAddress>> getEntries() {
        FileTime modified = lastModified();
        if (entries != null && Objects.equals(modified, entriesModified)) {
            return entries;
        }
        entries = parse();
        entriesModified = modified;
        return entries;
    }

    private FileTime lastModified() {
        if (path == null) {
            return null;
        }
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return null;
        }
    }

    private Map<String, List<InetAddress>> parse() {
        if (path == null || !Files.exists(path)) {
            return Collections.emptyMap();
        }
        Map<String, List<InetAddress>> map = new HashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            String line;
            while ((line = reader.readLine()) != null) {
                int comment = line.indexOf('#');
                if (comment >= 0) {
                    line = line.substring(0, comment);
                }
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                String[] parts = line.split("\\s+");
                if (parts.length < 2) {
                    continue;
                }
                InetAddress address = parseAddress(parts[0]);
                if (address == null) {
                    continue;
                }
                for (int i = 1; i < parts.length; i++) {
                    String name = parts[i].toLowerCase();
                    List<InetAddress> list = map.get(name);
                    if (list == null) {
                        list = new ArrayList<>();
                        map.put(name, list);
                    }
                    list.add(address);
                }
            }
        } catch (IOException e) {
            String message = MessageFormat.format(L10N.getString("warn.read_failed"), path);
            LOGGER.log(Level.WARNING, message, e);
            return Collections.emptyMap();
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.parsed"), map.size(), path));
        }
        return map;
    }

    static InetAddress parseAddress(String addr) {
        try {
            if (addr.indexOf(':') >= 0) {
                // Only literals reach getByName, so no lookup is performed
                return InetAddress.getByName(addr);
            }
            byte[] bytes = parseIPv4(addr);
            if (bytes == null) {
                return null;
            }
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static byte[] parseIPv4(String addr) {
        String[] parts = addr.split("\\.");
        if (parts.length != 4) {
            return null;
        }
        byte[] bytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            try {
                int val = Integer.parseInt(parts[i]);
                if (val < 0 || val > 255) {
                    return null;
                }
                bytes[i] = (byte) val;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return bytes;
    }

    static Path locateHostsFile() {
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("win")) {
            String systemRoot = System.getenv("SystemRoot");
            if (systemRoot == null) {
                systemRoot = "C:\\Windows";
            }
            return Paths.get(systemRoot, "System32", "drivers", "etc", "hosts");
        }
        return Paths.get("/etc/hosts");
    }

}
