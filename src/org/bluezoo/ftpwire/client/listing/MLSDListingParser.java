/*
 * MLSDListingParser.java
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.bluezoo.ftpwire.util.UnixPermissions;

/**
 * Parses MLSD listings (RFC 3659 section 7).
 *
 * <p>Each line is a list of facts followed by a space and the entry name:
 * <pre>
 * type=file;size=1024;modify=20250115103000; report 2025.txt
 * </pre>
 * The line is split at its first space, so the name may itself contain
 * spaces. Fact names are stored in lower case. Lines that cannot be split
 * into facts and name are logged and skipped.
 *
 * <p>The <code>type</code>, <code>size</code>, <code>modify</code>,
 * <code>unix.mode</code>, <code>unix.owner</code> and <code>unix.group</code>
 * facts are also exposed through the corresponding {@link FTPListingEntry}
 * properties.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MLSDListingParser implements FTPListingParser {

    private static final Logger LOGGER = Logger.getLogger(MLSDListingParser.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.ftpwire.client.listing.L10N");

    @Override
    public List<FTPListingEntry> parse(List<String> lines) {
        List<FTPListingEntry> result = new ArrayList<FTPListingEntry>();
        for (String line : lines) {
            if (line == null || line.trim().isEmpty()) {
                continue;
            }
            try {
                result.add(parseEntry(line.trim()));
            } catch (IllegalArgumentException e) {
                String message = L10N.getString("mlsd.skipped");
                LOGGER.warning(MessageFormat.format(message, line, e.getMessage()));
            }
        }
        return result;
    }

    /**
     * Parses one trimmed, non-blank MLSD line.
     *
     * @param line the line
     * @return the entry
     * @throws IllegalArgumentException if the line has no name or a fact
     * has no value
     */
    FTPListingEntry parseEntry(String line) {
        int sp = line.indexOf(' ');
        if (sp < 0) {
            throw new IllegalArgumentException(L10N.getString("mlsd.no_name"));
        }
        String factsText = line.substring(0, sp);
        String name = line.substring(sp + 1);

        Map<String,String> facts = new LinkedHashMap<String,String>();
        for (String fact : factsText.split(";")) {
            if (fact.isEmpty()) {
                continue;
            }
            int eq = fact.indexOf('=');
            if (eq < 0) {
                String message = L10N.getString("mlsd.bad_fact");
                throw new IllegalArgumentException(MessageFormat.format(message, fact));
            }
            facts.put(fact.substring(0, eq).toLowerCase(), fact.substring(eq + 1));
        }

        String mode = facts.get("unix.mode");
        String permissions = (mode == null) ? null : UnixPermissions.fromOctalString(mode);
        return new FTPListingEntry(name,
                                   toType(facts.get("type")),
                                   toSize(facts.get("size")),
                                   permissions,
                                   -1,
                                   facts.get("unix.owner"),
                                   facts.get("unix.group"),
                                   facts.get("modify"),
                                   facts);
    }

    private static FTPListingEntry.Type toType(String type) {
        if (type == null) {
            return FTPListingEntry.Type.UNKNOWN;
        }
        switch (type.toLowerCase()) {
            case "file":
                return FTPListingEntry.Type.FILE;
            case "dir":
            case "cdir":
            case "pdir":
                return FTPListingEntry.Type.DIRECTORY;
            default:
                return FTPListingEntry.Type.UNKNOWN;
        }
    }

    private static long toSize(String size) {
        if (size == null || size.isEmpty() || size.length() > 18) {
            return -1L;
        }
        for (int i = 0; i < size.length(); i++) {
            char c = size.charAt(i);
            if (c < '0' || c > '9') {
                return -1L;
            }
        }
        return Long.parseLong(size);
    }

}
