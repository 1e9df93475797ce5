/*
 * PDFArray.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A PDF array: an ordered sequence of objects.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFArray extends PDFObject implements Iterable<PDFObject> {

    private final List<PDFObject> elements;

    /**
     * Creates an empty array.
     */
    public PDFArray() {
        elements = new ArrayList<>();
    }

    /**
     * Creates an array holding the given elements.
     *
     * @param elements the elements
     */
    public PDFArray(PDFObject... elements) {
        this.elements = new ArrayList<>(Arrays.asList(elements));
    }

    /**
     * Creates an array holding the given elements.
     *
     * @param elements the elements
     */
    public PDFArray(List<? extends PDFObject> elements) {
        this.elements = new ArrayList<>(elements);
    }

    /**
     * Creates an array of integers.
     *
     * @param values the integer values
     * @return the array
     */
    public static PDFArray ofIntegers(long... values) {
        PDFArray array = new PDFArray();
        for (long value : values) {
            array.add(PDFNumber.of(value));
        }
        return array;
    }

    public void add(PDFObject element) {
        if (element == null) {
            throw new NullPointerException("element");
        }
        elements.add(element);
    }

    public PDFObject get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Returns the integer value at the given index.
     *
     * @param index the index
     * @return the value
     * @throws PDFParseException if the element is not an integer
     */
    public long getInteger(int index) {
        PDFObject element = elements.get(index);
        if (element instanceof PDFNumber && ((PDFNumber) element).isInteger()) {
            return ((PDFNumber) element).longValue();
        }
        throw PDFParseException.invalidObject("Expected integer at array index " + index
                + " but found " + element.getKind(), -1);
    }

    /**
     * Returns an unmodifiable view of the elements.
     *
     * @return the elements
     */
    public List<PDFObject> getElements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Iterator<PDFObject> iterator() {
        return getElements().iterator();
    }

    @Override
    public Kind getKind() {
        return Kind.ARRAY;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof PDFArray) {
            return elements.equals(((PDFArray) obj).elements);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

}
