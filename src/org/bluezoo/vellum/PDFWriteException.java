/*
 * PDFWriteException.java
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
 * Exception thrown when an object or file cannot be serialized.
 * <p>
 * Writers build their complete output in memory before returning it, so
 * when this exception is thrown no partial output has been produced.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFWriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new write exception.
     *
     * @param message the error message
     */
    public PDFWriteException(String message) {
        super(message);
    }

    /**
     * Creates a new write exception with an underlying cause.
     *
     * @param message the error message
     * @param cause the cause
     */
    public PDFWriteException(String message, Throwable cause) {
        super(message, cause);
    }

}
