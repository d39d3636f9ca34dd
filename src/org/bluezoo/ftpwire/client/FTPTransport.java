/*
 * FTPTransport.java
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

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;

/**
 * The connection an {@link FTPClient} talks through.
 *
 * <p>The transport owns the control and data sockets, including connecting,
 * TLS and timeouts. The client only exchanges lines with it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface FTPTransport {

    /**
     * Sends a command line on the control connection.
     *
     * @param command the command without line terminator, e.g. "PASV"
     * @throws IOException if the line cannot be written
     */
    void sendCommand(String command) throws IOException;

    /**
     * Reads the next reply line from the control connection.
     *
     * @return the reply line without line terminator
     * @throws IOException if no line can be read
     */
    String readReply() throws IOException;

    /**
     * Returns the local end of the control connection. Its address is
     * announced to the server in active mode.
     *
     * @return the local socket address
     */
    InetSocketAddress getLocalAddress();

    /**
     * Prepares a listening socket for an active mode data connection.
     *
     * @return the local port the server should connect to
     * @throws IOException if no socket can be bound
     */
    int listenForData() throws IOException;

    /**
     * Opens the data connection, reads it to the end as text and closes it.
     *
     * @param address in passive mode the server address to connect to; in
     * active mode the local address the server will connect to
     * @param mode the connection mode that was negotiated
     * @return the lines received, without line terminators
     * @throws IOException if the data connection fails
     */
    List<String> readDataLines(FTPDataAddress address, ConnectionMode mode) throws IOException;

}
