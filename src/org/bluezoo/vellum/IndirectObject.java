/*
 * IndirectObject.java
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
 * An indirect object as it appears in a file: its identifier, its value,
 * and the offset of its {@code n g obj} header.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class IndirectObject {

    private final ObjectId id;
    private final PDFObject object;
    private final int offset;

    IndirectObject(ObjectId id, PDFObject object, int offset) {
        this.id = id;
        this.object = object;
        this.offset = offset;
    }

    public ObjectId getId() {
        return id;
    }

    public PDFObject getObject() {
        return object;
    }

    public int getOffset() {
        return offset;
    }

}
