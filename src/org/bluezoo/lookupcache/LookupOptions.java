/*
 * LookupOptions.java
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
 * Options for {@link DNSLookup#lookup(String, LookupOptions, LookupCallback)}.
 *
 * <p>The family is 4, 6 or null; null resolves both families. When
 * {@code all} is set every address is delivered, otherwise one.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LookupOptions {

    private Integer family;
    private boolean all;

    /**
     * Creates options for a single address of either family.
     */
    public LookupOptions() {
    }

    /**
     * Creates options for a single address of the given family.
     *
     * @param family the IP version
     */
    public LookupOptions(int family) {
        this.family = family;
    }

    /**
     * Creates options.
     *
     * @param family the IP version, or null for both
     * @param all whether to deliver every address
     */
    public LookupOptions(Integer family, boolean all) {
        this.family = family;
        this.all = all;
    }

    public Integer getFamily() {
        return family;
    }

    public void setFamily(Integer family) {
        this.family = family;
    }

    public boolean isAll() {
        return all;
    }

    public void setAll(boolean all) {
        this.all = all;
    }

    @Override
    public String toString() {
        return "{family=" + family + ", all=" + all + "}";
    }

}
