/*
 * FTPProtocol.java
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

package org.bluezoo.ftpwire.client;

import java.util.List;

import org.bluezoo.ftpwire.client.listing.FTPListingEntry;

/**
 * The interpretation of FTP server text used by a client.
 *
 * <p>All operations are functions of their arguments and may be called
 * concurrently.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see DefaultFTPProtocol
 */
public interface FTPProtocol {

    /**
     * Parses a reply line. Never throws; see {@link FTPReply#parse(String)}.
     *
     * @param line the reply line
     * @return the reply
     */
    FTPReply parseReply(String line);

    /**
     * Extracts the data address from a PASV reply.
     *
     * @param line the reply line
     * @return the address
     * @throws FTPAddressFormatException if the line has no host-port tuple
     */
    FTPDataAddress parsePassiveAddress(String line) throws FTPAddressFormatException;

    /**
     * Formats the argument of a PORT command.
     *
     * @param host dotted-quad IPv4 address
     * @param port port number
     * @return the argument, e.g. "10,0,0,1,4,1"
     */
    String buildActiveCommandArgument(String host, int port);

    /**
     * Parses an MLSD listing. Malformed lines are skipped.
     *
     * @param lines the listing lines
     * @return the entries
     */
    List<FTPListingEntry> parseStructuredListing(List<String> lines);

    /**
     * Parses a LIST listing. Lines not in the Unix format become entries of
     * unknown type.
     *
     * @param lines the listing lines
     * @return the entries
     */
    List<FTPListingEntry> parseTextListing(List<String> lines);

    /**
     * Indicates whether a file should be transferred in binary mode.
     *
     * @param filename the file name
     * @return true for binary files
     */
    boolean isBinary(String filename);

}
