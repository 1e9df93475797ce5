/*
 * ObjectId.java
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
 * An indirect reference, written {@code n g R} in a file.
 * <p>
 * The pair of object number and generation names the same logical object
 * in every cross-reference section of a file. A reference is only a key:
 * it is looked up through {@link PDFDocument#getObject(ObjectId)} and does
 * not hold the object it names.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectId extends PDFObject implements Comparable<ObjectId> {

    private final int number;
    private final int generation;

    /**
     * @param number the object number
     * @param generation the generation number
     * @throws IllegalArgumentException if either value is negative
     */
    public ObjectId(int number, int generation) {
        if (number < 0 || generation < 0) {
            throw new IllegalArgumentException("Invalid object reference: "
                    + number + " " + generation);
        }
        this.number = number;
        this.generation = generation;
    }

    public int getObjectNumber() {
        return number;
    }

    public int getGenerationNumber() {
        return generation;
    }

    @Override
    public Kind getKind() {
        return Kind.REFERENCE;
    }

    @Override
    public int compareTo(ObjectId other) {
        int c = Integer.compare(number, other.number);
        return (c != 0) ? c : Integer.compare(generation, other.generation);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ObjectId)) {
            return false;
        }
        ObjectId other = (ObjectId) obj;
        return number == other.number && generation == other.generation;
    }

    @Override
    public int hashCode() {
        return (number << 4) ^ generation;
    }

    @Override
    public String toString() {
        return number + " " + generation + " R";
    }

}
