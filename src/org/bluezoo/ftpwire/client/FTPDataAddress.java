/*
 * FTPDataAddress.java
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

import java.net.InetSocketAddress;
import java.text.MessageFormat;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The IPv4 host and port of an FTP data connection.
 *
 * <p>PASV replies and PORT arguments encode the address as six decimal
 * numbers <code>h1,h2,h3,h4,p1,p2</code>, where the host is
 * <code>h1.h2.h3.h4</code> and the port is <code>p1 * 256 + p2</code>.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FTPDataAddress {

    private static final Pattern HOST_PORT = Pattern.compile(
            "(\\d+),(\\d+),(\\d+),(\\d+),(\\d+),(\\d+)");

    private final String host;
    private final int port;

    /**
     * @param host dotted-quad IPv4 address
     * @param port port number, 0 to 65535
     */
    public FTPDataAddress(String host, int port) {
        this.host = host;
        this.port = port;
    }

    /**
     * Extracts the data address from a PASV reply.
     *
     * <p>Servers surround the tuple with arbitrary text, e.g.
     * "227 Entering Passive Mode (192,168,1,10,4,1).", so the six numbers
     * are searched for anywhere in the line.
     *
     * <p>Every number must fit in one octet. A tuple such as
     * "(192,168,1,300,4,1)" is rejected rather than producing a host that
     * cannot be connected to, or a port outside 0..65535.
     *
     * @param line the reply line
     * @return the data address
     * @throws FTPAddressFormatException if the line does not contain six
     * comma-separated numbers between 0 and 255
     */
    public static FTPDataAddress parsePassive(String line) throws FTPAddressFormatException {
        Matcher m = (line == null) ? null : HOST_PORT.matcher(line);
        if (m == null || !m.find()) {
            String message = FTPReply.L10N.getString("address.malformed");
            throw new FTPAddressFormatException(MessageFormat.format(message, line));
        }
        int[] fields = new int[6];
        try {
            for (int i = 0; i < 6; i++) {
                int f = Integer.parseInt(m.group(i + 1));
                if (f > 255) {
                    String message = FTPReply.L10N.getString("address.malformed");
                    throw new FTPAddressFormatException(MessageFormat.format(message, line));
                }
                fields[i] = f;
            }
        } catch (NumberFormatException e) {
            String message = FTPReply.L10N.getString("address.malformed");
            throw new FTPAddressFormatException(MessageFormat.format(message, line), e);
        }
        StringBuilder hostBuf = new StringBuilder();
        for (int i = 0; i < 4; i++) {
            if (i > 0) {
                hostBuf.append('.');
            }
            hostBuf.append(fields[i]);
        }
        int port = (fields[4] << 8) + fields[5];
        return new FTPDataAddress(hostBuf.toString(), port);
    }

    /**
     * Formats the argument of a PORT command.
     *
     * @param host dotted-quad IPv4 address
     * @param port port number, 0 to 65535
     * @return the argument, e.g. "192,168,1,10,4,1"
     */
    public static String formatPortArgument(String host, int port) {
        StringBuilder buf = new StringBuilder();
        for (String octet : host.split("\\.")) {
            buf.append(octet).append(',');
        }
        buf.append(port / 256).append(',').append(port % 256);
        return buf.toString();
    }

    /**
     * @return the dotted-quad host address
     */
    public String getHost() {
        return host;
    }

    /**
     * @return the port number
     */
    public int getPort() {
        return port;
    }

    /**
     * @return this address as the argument of a PORT command
     */
    public String toPortArgument() {
        return formatPortArgument(host, port);
    }

    /**
     * @return this address as a socket address for the transport
     */
    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof FTPDataAddress)) {
            return false;
        }
        FTPDataAddress address = (FTPDataAddress) other;
        return port == address.port && host.equals(address.host);
    }

    @Override
    public int hashCode() {
        return host.hashCode() * 31 + port;
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }

}
