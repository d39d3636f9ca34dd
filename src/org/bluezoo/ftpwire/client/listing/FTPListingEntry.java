/*
 * FTPListingEntry.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of ftpwire, the gumdrop FTP client protocol library.
 * For more information please visit https://www.nongnu.org/gumdrop/
 *
 * ftpwire is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ftpwire is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with ftpwire.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.ftpwire.client.listing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a directory listing received from an FTP server.
 *
 * <p>Entries are produced by an {@link FTPListingParser} and are immutable.
 * Attributes the listing did not provide are null, or -1 for the numeric
 * ones.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FTPListingEntry {

    /**
     * The kind of file system object an entry describes.
     */
    public enum Type {
        FILE,
        DIRECTORY,
        UNKNOWN
    }

    private final String name;
    private final Type type;
    private final long size;
    private final String permissions;
    private final int links;
    private final String owner;
    private final String group;
    private final String modified;
    private final Map<String,String> facts;

    /**
     * Creates a listing entry.
     *
     * @param name the file or directory name
     * @param type the entry type
     * @param size the size in bytes, or -1 if not available
     * @param permissions Unix-style permissions string (e.g., "rwxr-xr-x"),
     * or null if not available
     * @param links the hard link count, or -1 if not available
     * @param owner the owner, or null if not available
     * @param group the group, or null if not available
     * @param modified the modification time as sent by the server, or null
     * @param facts the MLSD facts with lower-cased names, or null for none
     */
    public FTPListingEntry(String name, Type type, long size, String permissions,
                           int links, String owner, String group, String modified,
                           Map<String,String> facts) {
        this.name = name;
        this.type = type;
        this.size = size;
        this.permissions = permissions;
        this.links = links;
        this.owner = owner;
        this.group = group;
        this.modified = modified;
        if (facts == null || facts.isEmpty()) {
            this.facts = Collections.emptyMap();
        } else {
            this.facts = Collections.unmodifiableMap(new LinkedHashMap<String,String>(facts));
        }
    }

    /**
     * Creates an entry that carries only a name, for listing lines whose
     * format was not understood.
     *
     * @param name the name, usually the whole listing line
     * @return an entry of type {@link Type#UNKNOWN}
     */
    public static FTPListingEntry unknown(String name) {
        return new FTPListingEntry(name, Type.UNKNOWN, -1L, null, -1, null, null, null, null);
    }

    /**
     * @return the file or directory name
     */
    public String getName() {
        return name;
    }

    /**
     * @return the entry type
     */
    public Type getType() {
        return type;
    }

    public boolean isDirectory() {
        return type == Type.DIRECTORY;
    }

    public boolean isFile() {
        return type == Type.FILE;
    }

    /**
     * @return the size in bytes, or -1 if not available
     */
    public long getSize() {
        return size;
    }

    /**
     * @return Unix-style permissions string (e.g., "rw-r--r--"), or null
     */
    public String getPermissions() {
        return permissions;
    }

    /**
     * @return the hard link count, or -1 if not available
     */
    public int getLinks() {
        return links;
    }

    /**
     * @return the owner name, or null if not available
     */
    public String getOwner() {
        return owner;
    }

    /**
     * @return the group name, or null if not available
     */
    public String getGroup() {
        return group;
    }

    /**
     * Returns the modification time exactly as the server sent it,
     * e.g. "Jan 15 10:30" for a LIST entry or "20250115103000" for MLSD.
     *
     * @return the modification time, or null if not available
     */
    public String getModified() {
        return modified;
    }

    /**
     * Returns the MLSD facts of this entry. Fact names are lower case.
     *
     * @return unmodifiable map of facts, empty for LIST entries
     */
    public Map<String,String> getFacts() {
        return facts;
    }

    /**
     * @param name the fact name, case-insensitive
     * @return the fact value, or null if the server did not send it
     */
    public String getFact(String name) {
        return facts.get(name.toLowerCase());
    }

    @Override
    public String toString() {
        return String.format("FTPListingEntry{name='%s', type=%s, size=%d, modified=%s}",
                             name, type, size, modified);
    }

}
