/*
 * UnixPermissions.java
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

package org.bluezoo.ftpwire.util;

/**
 * Conversions between Unix permission strings such as "rwxr-xr-x" and
 * numeric modes such as 0755.
 *
 * <p>Only the read, write and execute bits of owner, group and other are
 * represented; setuid, setgid and sticky bits are ignored.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class UnixPermissions {

    private UnixPermissions() {
    }

    /**
     * Converts a 9-character permission string to a mode.
     *
     * @param permissions e.g. "rw-r--r--"
     * @return the mode, e.g. 0644, or -1 if the string is not 9 characters
     */
    public static int toMode(String permissions) {
        if (permissions == null || permissions.length() != 9) {
            return -1;
        }
        int mode = 0;
        for (int i = 0; i < 9; i += 3) {
            int bits = 0;
            if (permissions.charAt(i) == 'r') {
                bits |= 4;
            }
            if (permissions.charAt(i + 1) == 'w') {
                bits |= 2;
            }
            // s and t imply execute
            char x = permissions.charAt(i + 2);
            if (x == 'x' || x == 's' || x == 't') {
                bits |= 1;
            }
            mode = (mode << 3) | bits;
        }
        return mode;
    }

    /**
     * Converts a mode to a 9-character permission string.
     *
     * @param mode the mode, e.g. 0755; bits above 0777 are ignored
     * @return e.g. "rwxr-xr-x"
     */
    public static String toString(int mode) {
        StringBuilder buf = new StringBuilder(9);
        for (int shift = 6; shift >= 0; shift -= 3) {
            int bits = (mode >> shift) & 7;
            buf.append((bits & 4) != 0 ? 'r' : '-');
            buf.append((bits & 2) != 0 ? 'w' : '-');
            buf.append((bits & 1) != 0 ? 'x' : '-');
        }
        return buf.toString();
    }

    /**
     * Converts an octal mode string, as sent in the MLSD
     * <code>UNIX.mode</code> fact, to a permission string.
     *
     * @param octal e.g. "0755" or "644"
     * @return the permission string, or null if the value is not octal
     */
    public static String fromOctalString(String octal) {
        if (octal == null || octal.isEmpty() || octal.length() > 6) {
            return null;
        }
        int mode = 0;
        for (int i = 0; i < octal.length(); i++) {
            char c = octal.charAt(i);
            if (c < '0' || c > '7') {
                return null;
            }
            mode = (mode << 3) | (c - '0');
        }
        return toString(mode);
    }

}
