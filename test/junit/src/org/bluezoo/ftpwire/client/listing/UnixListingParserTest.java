/*
 * UnixListingParserTest.java
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

package org.bluezoo.ftpwire.client.listing;

import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Unit tests for {@link UnixListingParser}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UnixListingParserTest {

    private final UnixListingParser parser = new UnixListingParser();

    @Test
    public void testDirectory() {
        List<FTPListingEntry> entries = parser.parse(Collections.singletonList(
                "drwxr-xr-x 2 user group 4096 Jan 1 12:00 mydir"));
        assertEquals(1, entries.size());
        FTPListingEntry e = entries.get(0);
        assertEquals(FTPListingEntry.Type.DIRECTORY, e.getType());
        assertEquals("rwxr-xr-x", e.getPermissions());
        assertEquals(2, e.getLinks());
        assertEquals("user", e.getOwner());
        assertEquals("group", e.getGroup());
        assertEquals(4096L, e.getSize());
        assertEquals("Jan 1 12:00", e.getModified());
        assertEquals("mydir", e.getName());
        assertTrue(e.getFacts().isEmpty());
    }

    @Test
    public void testFileWithYearAndPadding() {
        List<FTPListingEntry> entries = parser.parse(Collections.singletonList(
                "-rw-r--r--   1 ftp      ftp       1234567 Dec 31  2024 archive.tar.gz"));
        FTPListingEntry e = entries.get(0);
        assertTrue(e.isFile());
        assertEquals("rw-r--r--", e.getPermissions());
        assertEquals(1, e.getLinks());
        assertEquals(1234567L, e.getSize());
        assertEquals("Dec 31  2024", e.getModified());
        assertEquals("archive.tar.gz", e.getName());
    }

    @Test
    public void testNameWithSpaces() {
        List<FTPListingEntry> entries = parser.parse(Collections.singletonList(
                "-rw-r--r-- 1 user group 10 Jan 15 10:30 my holiday  photos.jpg"));
        assertEquals("my holiday  photos.jpg", entries.get(0).getName());
    }

    @Test
    public void testStickyAndSetuidBits() {
        List<FTPListingEntry> entries = parser.parse(Arrays.asList(
                "drwxrwxrwt 5 root root 4096 Mar 3 09:15 tmp",
                "-rwsr-xr-x 1 root root 54256 Mar 3 09:15 passwd"));
        assertEquals(2, entries.size());
        assertTrue(entries.get(0).isDirectory());
        assertEquals("rwxrwxrwt", entries.get(0).getPermissions());
        assertTrue(entries.get(1).isFile());
    }

    @Test
    public void testNonAsciiOwnerAndGroup() {
        List<FTPListingEntry> entries = parser.parse(Collections.singletonList(
                "-rw-r--r-- 1 jos\u00e9 g\u00e9nie 10 Jan 1 12:00 a.txt"));
        FTPListingEntry e = entries.get(0);
        assertEquals(FTPListingEntry.Type.FILE, e.getType());
        assertEquals("jos\u00e9", e.getOwner());
        assertEquals("g\u00e9nie", e.getGroup());
        assertEquals(10L, e.getSize());
        assertEquals("a.txt", e.getName());
    }

    @Test
    public void testLocalizedMonth() {
        List<FTPListingEntry> entries = parser.parse(Collections.singletonList(
                "drwxr-xr-x 2 user group 4096 1\u6708 1 12:00 mydir"));
        FTPListingEntry e = entries.get(0);
        assertEquals(FTPListingEntry.Type.DIRECTORY, e.getType());
        assertEquals("1\u6708 1 12:00", e.getModified());
        assertEquals("mydir", e.getName());
    }

    @Test
    public void testTrailingCarriageReturn() {
        List<FTPListingEntry> entries = parser.parse(Collections.singletonList(
                "-rw-r--r-- 1 user group 42 Mar 3 2024 data.csv\r"));
        FTPListingEntry e = entries.get(0);
        assertEquals(FTPListingEntry.Type.FILE, e.getType());
        assertEquals("data.csv", e.getName());
        assertEquals(42L, e.getSize());
    }

    @Test
    public void testUnrecognisedLineDegraded() {
        List<FTPListingEntry> entries = parser.parse(Collections.singletonList(
                "not a valid listing line"));
        assertEquals(1, entries.size());
        FTPListingEntry e = entries.get(0);
        assertEquals("not a valid listing line", e.getName());
        assertEquals(FTPListingEntry.Type.UNKNOWN, e.getType());
        assertEquals(-1L, e.getSize());
        assertEquals(-1, e.getLinks());
        assertNull(e.getPermissions());
        assertNull(e.getOwner());
    }

    @Test
    public void testDegradedLineLoggedAtFine() {
        final List<LogRecord> records = new ArrayList<LogRecord>();
        Handler handler = new Handler() {
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
        Logger logger = Logger.getLogger(UnixListingParser.class.getName());
        Level level = logger.getLevel();
        logger.setLevel(Level.FINE);
        logger.addHandler(handler);
        try {
            parser.parse(Collections.singletonList("total 24"));
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(level);
        }
        assertEquals(1, records.size());
        assertEquals(Level.FINE, records.get(0).getLevel());
        assertEquals("Cannot parse as Unix listing: total 24", records.get(0).getMessage());
    }

    @Test
    public void testDegradedNameIsTrimmed() {
        List<FTPListingEntry> entries = parser.parse(Arrays.asList(
                "  total 24  ",
                "01-15-25  10:30AM       <DIR>          pub"));
        assertEquals(2, entries.size());
        assertEquals("total 24", entries.get(0).getName());
        assertEquals("01-15-25  10:30AM       <DIR>          pub", entries.get(1).getName());
        assertEquals(FTPListingEntry.Type.UNKNOWN, entries.get(1).getType());
    }

    @Test
    public void testSymbolicLinkTypeNotRecognised() {
        // only d and - type characters are in the grammar
        List<FTPListingEntry> entries = parser.parse(Collections.singletonList(
                "lrwxrwxrwx 1 root root 7 Jan 1 12:00 bin -> usr/bin"));
        assertEquals(FTPListingEntry.Type.UNKNOWN, entries.get(0).getType());
    }

    @Test
    public void testBlankLinesIgnored() {
        List<FTPListingEntry> entries = parser.parse(Arrays.asList(
                "",
                "-rw-r--r-- 1 u g 1 Jan 1 12:00 a",
                "   ",
                "",
                "garbage",
                "\t"));
        assertEquals(2, entries.size());
        assertEquals("a", entries.get(0).getName());
        assertEquals("garbage", entries.get(1).getName());
    }

    @Test
    public void testOrderPreserved() {
        List<FTPListingEntry> entries = parser.parse(Arrays.asList(
                "-rw-r--r-- 1 u g 1 Jan 1 12:00 c",
                "odd line",
                "drwxr-xr-x 1 u g 1 Jan 1 12:00 a",
                "-rw-r--r-- 1 u g 1 Jan 1 12:00 b"));
        assertEquals(4, entries.size());
        assertEquals("c", entries.get(0).getName());
        assertEquals("odd line", entries.get(1).getName());
        assertEquals("a", entries.get(2).getName());
        assertEquals("b", entries.get(3).getName());
    }

}
