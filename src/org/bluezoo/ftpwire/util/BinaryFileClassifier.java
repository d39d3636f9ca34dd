/*
 * BinaryFileClassifier.java
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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides whether a file should be transferred in binary (image) mode,
 * based on its file name extension.
 *
 * <p>Files with a known text extension are text; every other file,
 * including files without an extension, is binary. The set of text
 * extensions can be replaced with the <code>text-extensions</code>
 * property, a comma or whitespace separated list:
 * <pre>{@code
 * <property name="text-extensions">.txt, .csv, .xml</property>
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BinaryFileClassifier {

    /**
     * Extensions treated as text by default.
     */
    public static final Set<String> DEFAULT_TEXT_EXTENSIONS = Collections.unmodifiableSet(
            new LinkedHashSet<String>(Arrays.asList(
                ".txt", ".md", ".html", ".htm", ".css", ".js", ".json",
                ".xml", ".csv", ".log", ".ini", ".conf", ".cfg",
                ".py", ".java", ".c", ".cpp", ".h", ".sh", ".bat",
                ".yaml", ".yml", ".toml")));

    private volatile Set<String> textExtensions = DEFAULT_TEXT_EXTENSIONS;

    /**
     * Sets the extensions treated as text.
     * A leading dot is added where missing; case is ignored.
     *
     * @param extensions comma or whitespace separated list, e.g. ".txt, csv"
     */
    public void setTextExtensions(String extensions) {
        Set<String> acc = new LinkedHashSet<String>();
        if (extensions != null) {
            for (String ext : extensions.split("[,\\s]+")) {
                if (ext.isEmpty()) {
                    continue;
                }
                ext = ext.toLowerCase();
                acc.add(ext.startsWith(".") ? ext : "." + ext);
            }
        }
        textExtensions = Collections.unmodifiableSet(acc);
    }

    /**
     * @return the extensions treated as text, lower case with leading dot
     */
    public Set<String> getTextExtensions() {
        return textExtensions;
    }

    /**
     * Indicates whether the named file should be transferred in binary mode.
     *
     * @param filename a file name or path; may be null
     * @return false if the extension is a text extension, true otherwise
     */
    public boolean isBinary(String filename) {
        String ext = getExtension(filename);
        return ext.isEmpty() || !textExtensions.contains(ext);
    }

    /**
     * Returns the extension of the last path segment, including its dot.
     * A leading dot, as in ".profile", does not start an extension.
     */
    static String getExtension(String filename) {
        if (filename == null) {
            return "";
        }
        int start = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1;
        String base = filename.substring(start);
        int dot = base.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return base.substring(dot).toLowerCase();
    }

}
