/*
 * FTPException.java
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

/**
 * Exception thrown for FTP protocol failures: a reply the client did not
 * expect, or reply text it could not interpret.
 *
 * <p>This is an {@link IOException} so that protocol failures and transport
 * failures propagate through the same <code>throws</code> clauses.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FTPException extends IOException {

    private final FTPReply reply;

    /**
     * Creates an FTP exception with message only.
     *
     * @param message error description
     */
    public FTPException(String message) {
        super(message);
        this.reply = null;
    }

    /**
     * Creates an FTP exception with message and cause.
     *
     * @param message error description
     * @param cause underlying cause
     */
    public FTPException(String message, Throwable cause) {
        super(message, cause);
        this.reply = null;
    }

    /**
     * Creates an FTP exception with the server reply that caused it.
     *
     * @param message error description
     * @param reply server reply that caused the error
     */
    public FTPException(String message, FTPReply reply) {
        super(message + ": " + reply);
        this.reply = reply;
    }

    /**
     * Gets the server reply associated with this exception.
     *
     * @return server reply, or null if not available
     */
    public FTPReply getReply() {
        return reply;
    }

    /**
     * Gets the code of the server reply associated with this exception.
     *
     * @return reply code, or {@link FTPReply#UNPARSABLE} if there is none
     */
    public int getReplyCode() {
        return (reply == null) ? FTPReply.UNPARSABLE : reply.getCode();
    }

}
