/*
 * PDFBoolean.java
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

/**
 * A PDF boolean object.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFBoolean extends PDFObject {

    public static final PDFBoolean TRUE = new PDFBoolean(true);
    public static final PDFBoolean FALSE = new PDFBoolean(false);

    private final boolean value;

    private PDFBoolean(boolean value) {
        this.value = value;
    }

    /**
     * Returns the boolean object for the given value.
     *
     * @param value the value
     * @return {@link #TRUE} or {@link #FALSE}
     */
    public static PDFBoolean valueOf(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean booleanValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.BOOLEAN;
    }

    @Override
    public String toString() {
        return value ? "true" : "false";
    }

}
