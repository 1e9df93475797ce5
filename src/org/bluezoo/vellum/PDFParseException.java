/*
 * PDFParseException.java
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
 * Exception thrown when a PDF document is malformed or cannot be parsed.
 * <p>
 * This exception indicates a problem with the PDF content itself, such as
 * syntax errors, broken cross-reference data, or unsupported features.
 * Each exception carries a {@link Kind} classifying the failure and, where
 * known, the byte offset at which it was detected.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * The classification of a parse failure.
     */
    public enum Kind {
        /** A token could not be formed from the input bytes. */
        MALFORMED_TOKEN,
        /** A token of one kind was found where another was required. */
        UNEXPECTED_TOKEN,
        /** The input ended in the middle of a structure. */
        UNEXPECTED_END_OF_FILE,
        /** A syntactically valid but semantically malformed object. */
        INVALID_OBJECT,
        /** Unusable cross-reference data. */
        INVALID_XREF,
        /** Damaged stream payload or file layout. */
        CORRUPTED_FILE,
        /** A construct this library does not implement. */
        UNSUPPORTED_FEATURE
    }

    private final Kind kind;
    private final long offset;

    /**
     * Creates a new exception with the specified kind and message.
     *
     * @param kind the failure kind
     * @param message the error message
     */
    public PDFParseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
        this.offset = -1;
    }

    /**
     * Creates a new exception with the specified kind, message and byte
     * offset.
     *
     * @param kind the failure kind
     * @param message the error message
     * @param offset the byte offset in the PDF where the error occurred
     */
    public PDFParseException(Kind kind, String message, long offset) {
        super(offset >= 0 ? message + " at offset " + offset : message);
        this.kind = kind;
        this.offset = offset;
    }

    /**
     * Creates a new exception with the specified kind, message, offset,
     * and cause.
     *
     * @param kind the failure kind
     * @param message the error message
     * @param offset the byte offset in the PDF where the error occurred
     * @param cause the underlying cause
     */
    public PDFParseException(Kind kind, String message, long offset, Throwable cause) {
        super(offset >= 0 ? message + " at offset " + offset : message, cause);
        this.kind = kind;
        this.offset = offset;
    }

    /**
     * Returns the kind of failure.
     *
     * @return the kind
     */
    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the byte offset in the PDF where the error occurred.
     *
     * @return the offset, or -1 if not available
     */
    public long getOffset() {
        return offset;
    }

    static PDFParseException unexpectedToken(String expected, String actual, long offset) {
        return new PDFParseException(Kind.UNEXPECTED_TOKEN,
                "Expected " + expected + " but found " + actual, offset);
    }

    static PDFParseException unexpectedEndOfFile(String context, long offset) {
        return new PDFParseException(Kind.UNEXPECTED_END_OF_FILE,
                "Unexpected end of file in " + context, offset);
    }

    static PDFParseException invalidObject(String message, long offset) {
        return new PDFParseException(Kind.INVALID_OBJECT, message, offset);
    }

    static PDFParseException invalidXref(String message, long offset) {
        return new PDFParseException(Kind.INVALID_XREF, message, offset);
    }

    static PDFParseException corruptedFile(String message, long offset) {
        return new PDFParseException(Kind.CORRUPTED_FILE, message, offset);
    }

    static PDFParseException unsupportedFeature(String message) {
        return new PDFParseException(Kind.UNSUPPORTED_FEATURE, message);
    }

}
