/*
 * FTPCommand.java
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
 * A protocol operation run by an {@link FTPCommandInvoker}.
 *
 * @param <T> the result type
 * @param <E> the checked exception the operation may throw
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
@FunctionalInterface
public interface FTPCommand<T, E extends Exception> {

    /**
     * Runs the operation.
     *
     * @return the result
     * @throws E if the operation fails
     */
    T execute() throws E;

}
