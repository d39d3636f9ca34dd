/*
 * FTPReply.java
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

import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Logger;

/**
 * Represents a single-line FTP server reply.
 *
 * <p>An FTP reply consists of a 3-digit code followed by a text message,
 * e.g. "230 Login successful.". The first digit of the code gives the
 * category of the reply:
 * <ul>
 * <li>1xx - Positive preliminary</li>
 * <li>2xx - Positive completion</li>
 * <li>3xx - Positive intermediate</li>
 * <li>4xx - Transient negative completion</li>
 * <li>5xx - Permanent negative completion</li>
 * </ul>
 *
 * <p>Lines that do not begin with three digits are not rejected: they are
 * returned with the code {@link #UNPARSABLE} and the raw line as message.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FTPReply {

    private static final Logger LOGGER = Logger.getLogger(FTPReply.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.ftpwire.client.L10N");

    /**
     * Code of a reply whose first three characters are not a number.
     */
    public static final int UNPARSABLE = -1;

    public static final int POSITIVE_PRELIMINARY = 1;
    public static final int POSITIVE_COMPLETION = 2;
    public static final int POSITIVE_INTERMEDIATE = 3;
    public static final int TRANSIENT_NEGATIVE = 4;
    public static final int PERMANENT_NEGATIVE = 5;

    public static final int DATA_CONNECTION_ALREADY_OPEN = 125;
    public static final int FILE_STATUS_OK = 150;
    public static final int COMMAND_OK = 200;
    public static final int FILE_STATUS = 213;
    public static final int SERVICE_READY = 220;
    public static final int SERVICE_CLOSING = 221;
    public static final int TRANSFER_COMPLETE = 226;
    public static final int PASSIVE_MODE = 227;
    public static final int LOGGED_IN = 230;
    public static final int FILE_ACTION_OK = 250;
    public static final int PATH_CREATED = 257;
    public static final int NEED_PASSWORD = 331;
    public static final int FILE_ACTION_PENDING = 350;
    public static final int NOT_LOGGED_IN = 530;

    private final int code;
    private final String message;

    /**
     * Creates a reply.
     *
     * @param code 3-digit reply code, or {@link #UNPARSABLE}
     * @param message reply text, never null
     */
    public FTPReply(int code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Parses a reply line.
     *
     * <p>The first three characters are the code and the rest of the line,
     * trimmed, is the message. This method never throws: a line without a
     * numeric code is logged and returned verbatim with the code
     * {@link #UNPARSABLE}.
     *
     * @param line the reply line, with or without its line terminator
     * @return the parsed reply
     */
    public static FTPReply parse(String line) {
        if (line == null) {
            LOGGER.severe(MessageFormat.format(L10N.getString("reply.unparsable"), "null"));
            return new FTPReply(UNPARSABLE, "");
        }
        int code = UNPARSABLE;
        if (line.length() >= 3) {
            code = parseCode(line);
        }
        if (code == UNPARSABLE) {
            LOGGER.severe(MessageFormat.format(L10N.getString("reply.unparsable"), line));
            return new FTPReply(UNPARSABLE, line);
        }
        return new FTPReply(code, line.substring(3).trim());
    }

    private static int parseCode(String line) {
        int code = 0;
        for (int i = 0; i < 3; i++) {
            char c = line.charAt(i);
            if (c < '0' || c > '9') {
                return UNPARSABLE;
            }
            code = code * 10 + (c - '0');
        }
        return code;
    }

    /**
     * Gets the 3-digit reply code.
     *
     * @return reply code (e.g., 220, 227, 550), or {@link #UNPARSABLE}
     */
    public int getCode() {
        return code;
    }

    /**
     * Gets the reply text following the code, trimmed.
     * For an unparsable reply this is the whole raw line.
     *
     * @return reply message, possibly empty
     */
    public String getMessage() {
        return message;
    }

    /**
     * @return true if the line carried a numeric reply code
     */
    public boolean isParsable() {
        return code != UNPARSABLE;
    }

    /**
     * Returns the first digit of the reply code.
     *
     * @return 1 to 5 for well-formed codes, or {@link #UNPARSABLE}
     */
    public int getCategory() {
        return (code == UNPARSABLE) ? UNPARSABLE : code / 100;
    }

    public boolean isPositivePreliminary() {
        return getCategory() == POSITIVE_PRELIMINARY;
    }

    public boolean isPositiveCompletion() {
        return getCategory() == POSITIVE_COMPLETION;
    }

    public boolean isPositiveIntermediate() {
        return getCategory() == POSITIVE_INTERMEDIATE;
    }

    /**
     * Checks if the reply indicates a transient failure (4xx codes).
     * The command may succeed if it is repeated.
     *
     * @return true for transient negative replies
     */
    public boolean isTransientNegative() {
        return getCategory() == TRANSIENT_NEGATIVE;
    }

    /**
     * Checks if the reply indicates a permanent failure (5xx codes).
     *
     * @return true for permanent negative replies
     */
    public boolean isPermanentNegative() {
        return getCategory() == PERMANENT_NEGATIVE;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof FTPReply)) {
            return false;
        }
        FTPReply reply = (FTPReply) other;
        return code == reply.code && message.equals(reply.message);
    }

    @Override
    public int hashCode() {
        return code * 31 + message.hashCode();
    }

    @Override
    public String toString() {
        if (code == UNPARSABLE) {
            return message;
        }
        return message.isEmpty() ? Integer.toString(code) : code + " " + message;
    }

}
