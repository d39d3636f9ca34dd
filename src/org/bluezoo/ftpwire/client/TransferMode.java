/*
 * TransferMode.java
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
 * FTP representation type, as selected by the TYPE command (RFC 959 3.1.1).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see FTPClient#setTransferMode(TransferMode)
 */
public enum TransferMode {

    /**
     * ASCII text: line endings are converted to the network form.
     * <p>Command: TYPE A</p>
     */
    ASCII('A'),

    /**
     * Image (binary): bytes are transferred unchanged.
     * <p>Command: TYPE I</p>
     */
    BINARY('I');

    private final char code;

    TransferMode(char code) {
        this.code = code;
    }

    /**
     * Returns the type code sent as the argument of the TYPE command.
     *
     * @return 'A' or 'I'
     */
    public char getCode() {
        return code;
    }

    /**
     * Returns the TransferMode for the given TYPE code.
     *
     * @param code the type code, case-insensitive
     * @return the transfer mode
     * @throws IllegalArgumentException if the code is not recognised
     */
    public static TransferMode fromCode(char code) {
        char c = Character.toUpperCase(code);
        for (TransferMode mode : values()) {
            if (mode.code == c) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid transfer mode: " + code);
    }

}
