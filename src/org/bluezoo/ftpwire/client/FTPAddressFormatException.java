/*
 * FTPAddressFormatException.java
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
 * Thrown when a reply does not contain the six-number
 * <code>h1,h2,h3,h4,p1,p2</code> host-port tuple.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see FTPDataAddress#parsePassive(String)
 */
public class FTPAddressFormatException extends FTPException {

    /**
     * @param message error description
     */
    public FTPAddressFormatException(String message) {
        super(message);
    }

    /**
     * @param message error description
     * @param cause underlying cause
     */
    public FTPAddressFormatException(String message, Throwable cause) {
        super(message, cause);
    }

}
