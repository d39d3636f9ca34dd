/*
 * FTPReplyTest.java
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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Unit tests for {@link FTPReply}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FTPReplyTest {

    private Logger logger;
    private Handler handler;
    private List<LogRecord> records;

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
        logger = Logger.getLogger(FTPReply.class.getName());
        logger.addHandler(handler);
    }

    @After
    public void tearDown() {
        logger.removeHandler(handler);
    }

    @Test
    public void testParseLoginSuccessful() {
        FTPReply r = FTPReply.parse("230 Login successful.");
        assertEquals(230, r.getCode());
        assertEquals("Login successful.", r.getMessage());
        assertTrue(r.isParsable());
        assertTrue(records.isEmpty());
    }

    @Test
    public void testParseCodeOnly() {
        FTPReply r = FTPReply.parse("226 ");
        assertEquals(226, r.getCode());
        assertEquals("", r.getMessage());

        r = FTPReply.parse("226");
        assertEquals(226, r.getCode());
        assertEquals("", r.getMessage());
    }

    @Test
    public void testMessageIsTrimmed() {
        FTPReply r = FTPReply.parse("220   Welcome to the server  \r\n");
        assertEquals(220, r.getCode());
        assertEquals("Welcome to the server", r.getMessage());
    }

    @Test
    public void testContinuationSeparatorIsPartOfMessage() {
        FTPReply r = FTPReply.parse("220-Welcome");
        assertEquals(220, r.getCode());
        assertEquals("-Welcome", r.getMessage());
    }

    @Test
    public void testUnparsableLineIsReturnedVerbatim() {
        FTPReply r = FTPReply.parse("xyz bad");
        assertEquals(FTPReply.UNPARSABLE, r.getCode());
        assertEquals("xyz bad", r.getMessage());
        assertFalse(r.isParsable());
        assertEquals(FTPReply.UNPARSABLE, r.getCategory());
        assertEquals(1, records.size());
        assertEquals(Level.SEVERE, records.get(0).getLevel());
    }

    @Test
    public void testShortAndPartialCodes() {
        FTPReply r = FTPReply.parse("22");
        assertEquals(FTPReply.UNPARSABLE, r.getCode());
        assertEquals("22", r.getMessage());

        r = FTPReply.parse("2a0 Odd");
        assertEquals(FTPReply.UNPARSABLE, r.getCode());
        assertEquals("2a0 Odd", r.getMessage());

        r = FTPReply.parse("  230 Indented");
        assertEquals(FTPReply.UNPARSABLE, r.getCode());
        assertEquals("  230 Indented", r.getMessage());
    }

    @Test
    public void testNullAndEmpty() {
        FTPReply r = FTPReply.parse("");
        assertEquals(FTPReply.UNPARSABLE, r.getCode());
        assertEquals("", r.getMessage());

        r = FTPReply.parse(null);
        assertEquals(FTPReply.UNPARSABLE, r.getCode());
        assertEquals("", r.getMessage());
    }

    @Test
    public void testCategories() {
        assertTrue(FTPReply.parse("150 Opening data connection").isPositivePreliminary());
        assertTrue(FTPReply.parse("226 Transfer complete").isPositiveCompletion());
        assertTrue(FTPReply.parse("331 Password required").isPositiveIntermediate());
        assertTrue(FTPReply.parse("421 Service not available").isTransientNegative());
        assertTrue(FTPReply.parse("550 No such file").isPermanentNegative());

        FTPReply r = FTPReply.parse("227 Entering Passive Mode");
        assertEquals(FTPReply.POSITIVE_COMPLETION, r.getCategory());
        assertFalse(r.isPositivePreliminary());
        assertFalse(r.isPermanentNegative());
    }

    @Test
    public void testToString() {
        assertEquals("230 Login successful.", FTPReply.parse("230 Login successful.").toString());
        assertEquals("226", FTPReply.parse("226").toString());
        assertEquals("xyz bad", FTPReply.parse("xyz bad").toString());
    }

    @Test
    public void testEquality() {
        assertEquals(new FTPReply(200, "OK"), FTPReply.parse("200 OK"));
        assertEquals(new FTPReply(200, "OK").hashCode(), FTPReply.parse("200 OK").hashCode());
        assertNotEquals(new FTPReply(200, "OK"), FTPReply.parse("250 OK"));
    }

}
