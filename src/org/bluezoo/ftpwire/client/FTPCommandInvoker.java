/*
 * FTPCommandInvoker.java
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
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs protocol operations with command logging.
 *
 * <p>Before the operation runs, the upper-cased command name and its
 * arguments are logged at {@link Level#FINE}. If the operation throws, the
 * failure is logged at {@link Level#SEVERE} together with the command name
 * and the same exception is rethrown. The result of a successful operation
 * is returned as is.
 *
 * <pre>{@code
 * FTPDataAddress address = invoker.invoke("pasv", new Object[0], () -> {
 *     FTPReply reply = sendCommand("PASV");
 *     return FTPDataAddress.parsePassive(reply.getMessage());
 * });
 * }</pre>
 *
 * <p>The operation runs synchronously on the calling thread. An invoker
 * has no state and may be shared.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FTPCommandInvoker {

    private final Logger logger;

    /**
     * Creates an invoker logging to this class's logger.
     */
    public FTPCommandInvoker() {
        this(Logger.getLogger(FTPCommandInvoker.class.getName()));
    }

    /**
     * Creates an invoker logging to the given logger.
     *
     * @param logger the logger
     */
    public FTPCommandInvoker(Logger logger) {
        this.logger = logger;
    }

    /**
     * Runs an operation with logging.
     *
     * @param name the command name, e.g. "list"
     * @param args the command arguments, for the log only
     * @param command the operation
     * @return the result of the operation
     * @throws E if the operation throws
     */
    public <T, E extends Exception> T invoke(String name, Object[] args, FTPCommand<T, E> command)
            throws E {
        String commandName = name.toUpperCase();
        if (logger.isLoggable(Level.FINE)) {
            String message = FTPReply.L10N.getString("command.invoke");
            logger.fine(MessageFormat.format(message, commandName, Arrays.toString(args)));
        }
        try {
            T result = command.execute();
            if (logger.isLoggable(Level.FINEST)) {
                String message = FTPReply.L10N.getString("command.completed");
                logger.finest(MessageFormat.format(message, commandName));
            }
            return result;
        } catch (RuntimeException e) {
            logFailure(commandName, e);
            throw e;
        } catch (Exception e) {
            logFailure(commandName, e);
            throw e;
        }
    }

    private void logFailure(String commandName, Exception e) {
        String message = FTPReply.L10N.getString("command.failed");
        logger.log(Level.SEVERE, MessageFormat.format(message, commandName, e.getMessage()), e);
    }

}
