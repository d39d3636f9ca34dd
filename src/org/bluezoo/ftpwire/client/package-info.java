/*
 * package-info.java
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

/**
 * FTP client protocol interpretation.
 *
 * <p>This package turns the text an FTP server sends into structured values
 * and turns client intent into command arguments. Sockets, TLS and file
 * transfer loops are left to an {@link org.bluezoo.ftpwire.client.FTPTransport}
 * supplied by the application.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.ftpwire.client.FTPReply} - a parsed reply line</li>
 *   <li>{@link org.bluezoo.ftpwire.client.FTPDataAddress} - the PASV/PORT
 *       host-port encoding</li>
 *   <li>{@link org.bluezoo.ftpwire.client.FTPProtocol} - the parsing
 *       operations as one interface</li>
 *   <li>{@link org.bluezoo.ftpwire.client.FTPCommandInvoker} - logs each
 *       command and each command failure</li>
 *   <li>{@link org.bluezoo.ftpwire.client.FTPClient} - issues commands
 *       through a transport and checks the replies</li>
 * </ul>
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * FTPClient client = new FTPClient(transport);
 * client.setConnectionMode(ConnectionMode.PASSIVE);
 * client.setTransferMode(client.transferModeFor("report.pdf"));
 * for (FTPListingEntry entry : client.mlsd("/pub")) {
 *     System.out.println(entry.getName() + " " + entry.getSize());
 * }
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see org.bluezoo.ftpwire.client.listing
 */
package org.bluezoo.ftpwire.client;
