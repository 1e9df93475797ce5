/*
 * Name.java
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
 * A name, such as {@code /Type}.
 * <p>
 * The value held is the decoded form, without the solidus and with any
 * {@code #xx} escapes already replaced. Names compare case-sensitively and
 * may hold any byte but NUL.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Name extends PDFObject {

    // Names used by the structural layer
    public static final Name TYPE = new Name("Type");
    public static final Name SUBTYPE = new Name("Subtype");
    public static final Name LENGTH = new Name("Length");
    public static final Name FILTER = new Name("Filter");
    public static final Name DECODE_PARMS = new Name("DecodeParms");
    public static final Name SIZE = new Name("Size");
    public static final Name PREV = new Name("Prev");
    public static final Name ROOT = new Name("Root");
    public static final Name INFO = new Name("Info");
    public static final Name ENCRYPT = new Name("Encrypt");
    public static final Name ID = new Name("ID");
    public static final Name INDEX = new Name("Index");
    public static final Name W = new Name("W");
    public static final Name XREF = new Name("XRef");
    public static final Name XREF_STM = new Name("XRefStm");
    public static final Name OBJ_STM = new Name("ObjStm");
    public static final Name N = new Name("N");
    public static final Name FIRST = new Name("First");
    public static final Name CATALOG = new Name("Catalog");
    public static final Name PAGES = new Name("Pages");
    public static final Name PAGE = new Name("Page");
    public static final Name KIDS = new Name("Kids");
    public static final Name COUNT = new Name("Count");
    public static final Name PARENT = new Name("Parent");
    public static final Name RESOURCES = new Name("Resources");
    public static final Name MEDIA_BOX = new Name("MediaBox");
    public static final Name CROP_BOX = new Name("CropBox");
    public static final Name ROTATE = new Name("Rotate");
    public static final Name CONTENTS = new Name("Contents");
    public static final Name LINEARIZED = new Name("Linearized");

    private final String value;

    /**
     * @param value the decoded name, without the leading solidus
     * @throws IllegalArgumentException if the value contains NUL
     */
    public Name(String value) {
        if (value.indexOf('\0') != -1) {
            throw new IllegalArgumentException("NUL in name");
        }
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.NAME;
    }

    @Override
    public boolean equals(Object obj) {
        return (obj instanceof Name) && value.equals(((Name) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

}
