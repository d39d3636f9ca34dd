/*
 * ModeTest.java
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

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for {@link TransferMode} and {@link ConnectionMode}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ModeTest {

    @Test
    public void testTransferModeCodes() {
        assertEquals('A', TransferMode.ASCII.getCode());
        assertEquals('I', TransferMode.BINARY.getCode());
        assertEquals(TransferMode.ASCII, TransferMode.fromCode('A'));
        assertEquals(TransferMode.BINARY, TransferMode.fromCode('i'));
        assertEquals("BINARY", TransferMode.BINARY.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTransferModeUnknownCode() {
        TransferMode.fromCode('E');
    }

    @Test
    public void testConnectionModeCommands() {
        assertEquals("PORT", ConnectionMode.ACTIVE.getCommand());
        assertEquals("PASV", ConnectionMode.PASSIVE.getCommand());
        assertEquals(ConnectionMode.ACTIVE, ConnectionMode.fromCommand("port"));
        assertEquals(ConnectionMode.PASSIVE, ConnectionMode.fromCommand("PASV"));
        assertEquals(2, ConnectionMode.values().length);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConnectionModeUnknownCommand() {
        ConnectionMode.fromCommand("EPSV");
    }

}
