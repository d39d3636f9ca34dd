/*
 * UnixListingParser.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses LIST output in the Unix <code>ls -l</code> format, e.g.
 * <pre>
 * -rw-r--r-- 1 user group     1234 Jan 15 10:30 filename.txt
 * drwxr-xr-x 2 user group     4096 Jan  1  2024 my dir
 * </pre>
 *
 * <p>The format of LIST output is not standardised. A line that does not
 * match is not dropped: it becomes an entry of type
 * {@link FTPListingEntry.Type#UNKNOWN} named after the trimmed line.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UnixListingParser implements FTPListingParser {

    private static final Logger LOGGER = Logger.getLogger(UnixListingParser.class.getName());

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.ftpwire.client.listing.L10N");

    // owner, group and month name may be non-ASCII
    private static final Pattern UNIX_LINE = Pattern.compile(
            "^([d-])([rwxst-]{9})\\s+(\\d+)\\s+(\\w+)\\s+(\\w+)\\s+(\\d+)\\s+(\\w+\\s+\\d+\\s+[\\w:]+)\\s+(.+)$",
            Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public List<FTPListingEntry> parse(List<String> lines) {
        List<FTPListingEntry> result = new ArrayList<FTPListingEntry>();
        for (String line : lines) {
            if (line == null || line.trim().isEmpty()) {
                continue;
            }
            FTPListingEntry entry = parseEntry(line);
            if (entry == null) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String message = L10N.getString("list.degraded");
                    LOGGER.fine(MessageFormat.format(message, line));
                }
                entry = FTPListingEntry.unknown(line.trim());
            }
            result.add(entry);
        }
        return result;
    }

    /**
     * Parses one listing line.
     *
     * @param line the line, with or without a trailing CR
     * @return the entry, or null if the line is not in the Unix format
     */
    FTPListingEntry parseEntry(String line) {
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        Matcher m = UNIX_LINE.matcher(line);
        if (!m.matches()) {
            return null;
        }
        int links;
        long size;
        try {
            links = Integer.parseInt(m.group(3));
            size = Long.parseLong(m.group(6));
        } catch (NumberFormatException e) {
            // counts too large for their type
            return null;
        }
        FTPListingEntry.Type type = "d".equals(m.group(1)) ?
                FTPListingEntry.Type.DIRECTORY : FTPListingEntry.Type.FILE;
        return new FTPListingEntry(m.group(8),
                                   type,
                                   size,
                                   m.group(2),
                                   links,
                                   m.group(4),
                                   m.group(5),
                                   m.group(7),
                                   null);
    }

}
