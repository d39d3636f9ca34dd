/*
 * ConnectionMode.java
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

/**
 * How the data connection is established.
 *
 * <ul>
 *   <li>{@link #ACTIVE} - the client listens and tells the server where to
 *       connect (PORT)</li>
 *   <li>{@link #PASSIVE} - the server listens and tells the client where to
 *       connect (PASV)</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see FTPClient#setConnectionMode(ConnectionMode)
 */
public enum ConnectionMode {

    ACTIVE("PORT"),

    PASSIVE("PASV");

    private final String command;

    ConnectionMode(String command) {
        this.command = command;
    }

    /**
     * Returns the command that negotiates this mode.
     *
     * @return "PORT" or "PASV"
     */
    public String getCommand() {
        return command;
    }

    /**
     * Returns the ConnectionMode negotiated by the given command.
     *
     * @param command PORT or PASV, case-insensitive
     * @return the connection mode
     * @throws IllegalArgumentException if the command is not recognised
     */
    public static ConnectionMode fromCommand(String command) {
        for (ConnectionMode mode : values()) {
            if (mode.command.equalsIgnoreCase(command)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid connection mode: " + command);
    }

}
