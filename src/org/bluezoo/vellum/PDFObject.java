/*
 * PDFObject.java
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

/**
 * Base type of every value in the PDF object model.
 * <p>
 * The set of object types is closed: the package-private constructor
 * means only the classes in this package can extend it. Consumers
 * inspect {@link #getKind()} and switch over it rather than relying on
 * virtual dispatch:
 * <pre>
 * switch (obj.getKind()) {
 *     case DICTIONARY:
 *         PDFDictionary dict = (PDFDictionary) obj;
 *         ...
 * }
 * </pre>
 * <p>
 * All object types are immutable once constructed, with the exception of
 * {@link PDFArray} and {@link PDFDictionary} instances that callers build
 * themselves before serializing them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class PDFObject {

    /**
     * The variants of the PDF object model.
     */
    public enum Kind {
        NULL,
        BOOLEAN,
        NUMBER,
        STRING,
        NAME,
        ARRAY,
        DICTIONARY,
        REFERENCE,
        STREAM
    }

    PDFObject() {
    }

    /**
     * Returns the variant of this object.
     *
     * @return the kind
     */
    public abstract Kind getKind();

    /**
     * Returns the PDF syntax for this object.
     */
    @Override
    public String toString() {
        return new String(ObjectWriter.toBytes(this), StandardCharsets.ISO_8859_1);
    }

}
