/*
 * DefaultFTPProtocol.java
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
import org.bluezoo.ftpwire.client.listing.FTPListingParser;
import org.bluezoo.ftpwire.client.listing.MLSDListingParser;
import org.bluezoo.ftpwire.client.listing.UnixListingParser;
import org.bluezoo.ftpwire.util.BinaryFileClassifier;

/**
 * Standard {@link FTPProtocol} implementation.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DefaultFTPProtocol implements FTPProtocol {

    private final FTPListingParser structuredParser;
    private final FTPListingParser textParser;
    private final BinaryFileClassifier classifier;

    public DefaultFTPProtocol() {
        this(new BinaryFileClassifier());
    }

    /**
     * @param classifier the classifier used by {@link #isBinary(String)}
     */
    public DefaultFTPProtocol(BinaryFileClassifier classifier) {
        this(new MLSDListingParser(), new UnixListingParser(), classifier);
    }

    /**
     * @param structuredParser parser for MLSD listings
     * @param textParser parser for LIST listings
     * @param classifier the classifier used by {@link #isBinary(String)}
     */
    public DefaultFTPProtocol(FTPListingParser structuredParser,
                              FTPListingParser textParser,
                              BinaryFileClassifier classifier) {
        this.structuredParser = structuredParser;
        this.textParser = textParser;
        this.classifier = classifier;
    }

    @Override
    public FTPReply parseReply(String line) {
        return FTPReply.parse(line);
    }

    @Override
    public FTPDataAddress parsePassiveAddress(String line) throws FTPAddressFormatException {
        return FTPDataAddress.parsePassive(line);
    }

    @Override
    public String buildActiveCommandArgument(String host, int port) {
        return FTPDataAddress.formatPortArgument(host, port);
    }

    @Override
    public List<FTPListingEntry> parseStructuredListing(List<String> lines) {
        return structuredParser.parse(lines);
    }

    @Override
    public List<FTPListingEntry> parseTextListing(List<String> lines) {
        return textParser.parse(lines);
    }

    @Override
    public boolean isBinary(String filename) {
        return classifier.isBinary(filename);
    }

}
