/*
 * FTPCommandInvokerTest.java
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

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Unit tests for {@link FTPCommandInvoker}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FTPCommandInvokerTest {

    private Logger logger;
    private Handler handler;
    private List<LogRecord> records;
    private FTPCommandInvoker invoker;

    @Before
    public void setUp() {
        records = new ArrayList<>();
        handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }
            @Override
            public void flush() {
            }
            @Override
            public void close() {
            }
        };
        handler.setLevel(Level.ALL);
        logger = Logger.getLogger("org.bluezoo.ftpwire.client.FTPCommandInvokerTest");
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.FINE);
        logger.addHandler(handler);
        invoker = new FTPCommandInvoker(logger);
    }

    @After
    public void tearDown() {
        logger.removeHandler(handler);
    }

    @Test
    public void testResultReturnedUnchanged() throws Exception {
        Object result = new Object();
        Object returned = invoker.invoke("noop", new Object[0], () -> result);
        assertSame(result, returned);
    }

    @Test
    public void testEntryLoggedAtFine() throws Exception {
        invoker.invoke("cwd", new Object[] { "/pub" }, () -> null);
        assertEquals(1, records.size());
        LogRecord record = records.get(0);
        assertEquals(Level.FINE, record.getLevel());
        assertTrue(record.getMessage().contains("CWD"));
        assertTrue(record.getMessage().contains("/pub"));
    }

    @Test
    public void testCheckedFailureLoggedAndRethrown() {
        IOException failure = new IOException("connection reset");
        try {
            invoker.invoke("list", new Object[] { "/" }, () -> {
                throw failure;
            });
            fail("Exception should propagate");
        } catch (IOException e) {
            assertSame(failure, e);
        }
        LogRecord severe = records.get(records.size() - 1);
        assertEquals(Level.SEVERE, severe.getLevel());
        assertTrue(severe.getMessage().contains("LIST"));
        assertTrue(severe.getMessage().contains("connection reset"));
        assertSame(failure, severe.getThrown());
    }

    @Test
    public void testUncheckedFailureLoggedAndRethrown() {
        IllegalStateException failure = new IllegalStateException("not connected");
        try {
            invoker.invoke("pasv", new Object[0], () -> {
                throw failure;
            });
            fail("Exception should propagate");
        } catch (IllegalStateException e) {
            assertSame(failure, e);
        }
        assertEquals(Level.SEVERE, records.get(records.size() - 1).getLevel());
    }

    @Test
    public void testFTPExceptionKeepsReply() {
        FTPReply reply = FTPReply.parse("550 No such file");
        try {
            invoker.invoke("dele", new Object[] { "missing.txt" }, () -> {
                throw new FTPException("DELE failed", reply);
            });
            fail("Exception should propagate");
        } catch (FTPException e) {
            assertSame(reply, e.getReply());
            assertEquals(550, e.getReplyCode());
        }
    }

    @Test
    public void testNoEntryLogWhenFineDisabled() throws Exception {
        logger.setLevel(Level.INFO);
        invoker.invoke("noop", new Object[0], () -> null);
        assertTrue(records.isEmpty());
    }

}
