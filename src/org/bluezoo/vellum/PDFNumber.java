/*
 * PDFNumber.java
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
 * A PDF numeric object, either an integer or a real.
 * <p>
 * Integers are held as {@code long} values; reals as {@code double}.
 * Two numbers are equal only if they are of the same sort and have the
 * same value, so that the integer {@code 1} and the real {@code 1.0}
 * remain distinct after serialization and re-parsing.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFNumber extends PDFObject {

    private final long longValue;
    private final double doubleValue;
    private final boolean real;

    private PDFNumber(long longValue, double doubleValue, boolean real) {
        this.longValue = longValue;
        this.doubleValue = doubleValue;
        this.real = real;
    }

    /**
     * Returns an integer number.
     *
     * @param value the value
     * @return the number
     */
    public static PDFNumber of(long value) {
        return new PDFNumber(value, (double) value, false);
    }

    /**
     * Returns a real number. Negative zero is stored as zero, since the
     * file syntax cannot tell them apart.
     *
     * @param value the value
     * @return the number
     */
    public static PDFNumber of(double value) {
        if (value == 0.0) {
            value = 0.0;
        }
        return new PDFNumber((long) value, value, true);
    }

    /**
     * Indicates whether this number is an integer.
     *
     * @return true for integers, false for reals
     */
    public boolean isInteger() {
        return !real;
    }

    public int intValue() {
        return (int) longValue;
    }

    public long longValue() {
        return longValue;
    }

    public double doubleValue() {
        return doubleValue;
    }

    @Override
    public Kind getKind() {
        return Kind.NUMBER;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof PDFNumber) {
            PDFNumber other = (PDFNumber) obj;
            if (real != other.real) {
                return false;
            }
            return real ? Double.compare(doubleValue, other.doubleValue) == 0
                    : longValue == other.longValue;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return real ? Double.hashCode(doubleValue) : Long.hashCode(longValue);
    }

}
