/*
 * PDFString.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Vellum, a PDF object model and incremental update
 * library.
 *
 * Vellum is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Vellum is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Vellum.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.vellum;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A PDF string object.
 * <p>
 * PDF strings are sequences of bytes. They may be written in literal form
 * {@code (...)} or hexadecimal form {@code <...>}; the form is remembered
 * so that a string is written back the way it was read, but it does not
 * take part in equality.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFString extends PDFObject {

    private final byte[] bytes;
    private final boolean hex;

    /**
     * Creates a literal string from the given bytes.
     *
     * @param bytes the string bytes
     */
    public PDFString(byte[] bytes) {
        this(bytes, false);
    }

    /**
     * Creates a string from the given bytes.
     *
     * @param bytes the string bytes
     * @param hex whether the string is written in hexadecimal form
     */
    public PDFString(byte[] bytes, boolean hex) {
        this.bytes = bytes.clone();
        this.hex = hex;
    }

    /**
     * Creates a literal string from text encoded as ISO-8859-1.
     *
     * @param text the text
     */
    public PDFString(String text) {
        this(text.getBytes(StandardCharsets.ISO_8859_1), false);
    }

    /**
     * Returns a copy of the bytes of this string.
     *
     * @return the bytes
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * Returns the bytes of this string decoded as ISO-8859-1, or as UTF-16BE
     * when they begin with a byte order mark.
     *
     * @return the text
     */
    public String getText() {
        if (bytes.length >= 2 && (bytes[0] & 0xff) == 0xfe && (bytes[1] & 0xff) == 0xff) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
        }
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    public boolean isHex() {
        return hex;
    }

    int length() {
        return bytes.length;
    }

    byte byteAt(int index) {
        return bytes[index];
    }

    @Override
    public Kind getKind() {
        return Kind.STRING;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof PDFString) {
            return Arrays.equals(bytes, ((PDFString) obj).bytes);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

}
