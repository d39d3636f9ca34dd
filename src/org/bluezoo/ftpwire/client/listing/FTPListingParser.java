/*
 * FTPListingParser.java
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

import java.util.List;

/**
 * Converts the lines of a directory listing into entries.
 *
 * <p>Implementations never throw for malformed lines. Blank lines never
 * produce an entry. Implementations are stateless and may be shared
 * between threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see MLSDListingParser
 * @see UnixListingParser
 */
public interface FTPListingParser {

    /**
     * Parses the lines received over the data connection.
     *
     * @param lines listing lines without line terminators
     * @return the entries, in the order of the lines they came from
     */
    List<FTPListingEntry> parse(List<String> lines);

}
