/*
 * ObjectStream.java
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

import java.nio.ByteBuffer;

/**
 * In-memory representation of a decoded PDF object stream (PDF 1.5+).
 * <p>
 * An object stream contains multiple indirect objects stored sequentially.
 * The stream has an index table (N pairs of object number and byte offset)
 * followed by the object data. Offsets in the table are relative to the
 * first object (the /First value in the stream dictionary).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectStream {

    private final ObjectId streamId;
    private final ByteBuffer decoded;
    private final int first;
    private final int[] objectNumbers;
    private final int[] relativeOffsets;

    private ObjectStream(ObjectId streamId, ByteBuffer decoded, int first,
            int[] objectNumbers, int[] relativeOffsets) {
        this.streamId = streamId;
        this.decoded = decoded;
        this.first = first;
        this.objectNumbers = objectNumbers;
        this.relativeOffsets = relativeOffsets;
    }

    /**
     * Reads the index table of an object stream.
     *
     * @param streamId the object ID of the stream
     * @param stream the stream, which must be of /Type /ObjStm
     * @param decoded the decoded payload
     * @return the object stream
     * @throws PDFParseException of kind INVALID_OBJECT if the stream is not
     *         a well-formed object stream
     */
    static ObjectStream load(ObjectId streamId, PDFStream stream, byte[] decoded) {
        PDFDictionary dict = stream.getDictionary();
        if (!dict.isType(Name.OBJ_STM)) {
            throw PDFParseException.invalidObject("Object " + streamId + " is not an object stream", -1);
        }
        long n = dict.getInteger(Name.N, -1);
        long first = dict.getInteger(Name.FIRST, -1);
        // every index pair takes at least two bytes
        if (n < 0 || n > decoded.length / 2 || first < 0 || first > decoded.length) {
            throw PDFParseException.invalidObject("Object stream " + streamId
                    + " has invalid /N or /First", -1);
        }
        Lexer lexer = new Lexer(decoded);
        int[] objectNumbers = new int[(int) n];
        int[] relativeOffsets = new int[(int) n];
        for (int i = 0; i < n; i++) {
            Token num = lexer.nextToken();
            Token offset = lexer.nextToken();
            if (!num.isUnsignedInteger() || !offset.isUnsignedInteger()
                    || num.getNumber().longValue() > Integer.MAX_VALUE
                    || offset.getNumber().longValue() > Integer.MAX_VALUE
                    || lexer.getPosition() > first) {
                throw PDFParseException.invalidObject("Malformed index in object stream " + streamId,
                        num.getOffset());
            }
            objectNumbers[i] = num.getNumber().intValue();
            relativeOffsets[i] = offset.getNumber().intValue();
        }
        return new ObjectStream(streamId, ByteBuffer.wrap(decoded).asReadOnlyBuffer(),
                (int) first, objectNumbers, relativeOffsets);
    }

    /**
     * Returns the object ID of this object stream.
     *
     * @return the stream ID
     */
    public ObjectId getStreamId() {
        return streamId;
    }

    /**
     * Returns the number of objects in this stream.
     *
     * @return N
     */
    public int getObjectCount() {
        return relativeOffsets.length;
    }

    /**
     * Returns the object number stored at the given index.
     *
     * @param index the 0-based index of the object in the stream
     * @return the object number
     */
    public int getObjectNumber(int index) {
        return objectNumbers[index];
    }

    /**
     * Returns the byte offset in the decoded stream where the object at the
     * given index starts. This is {@code first + relativeOffsets[index]}.
     *
     * @param index the 0-based index of the object in the stream
     * @return the start offset in decoded
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public long getObjectStartOffset(int index) {
        if (index < 0 || index >= relativeOffsets.length) {
            throw new IndexOutOfBoundsException("Object index " + index + " not in [0, "
                    + relativeOffsets.length + ")");
        }
        return (long) first + relativeOffsets[index];
    }

    /**
     * Parses the packed object at the given index.
     *
     * @param index the 0-based index
     * @param objectNumber the object number expected at that index
     * @return the object
     * @throws PDFParseException of kind INVALID_OBJECT if the index is out
     *         of range or holds a different object
     */
    public PDFObject getObject(int index, int objectNumber) {
        if (index < 0 || index >= relativeOffsets.length) {
            throw PDFParseException.invalidObject("Object stream " + streamId + " has no index "
                    + index, -1);
        }
        if (objectNumbers[index] != objectNumber) {
            throw PDFParseException.invalidObject("Object stream " + streamId + " holds object "
                    + objectNumbers[index] + " at index " + index + ", not " + objectNumber, -1);
        }
        long start = getObjectStartOffset(index);
        if (start >= decoded.limit()) {
            throw PDFParseException.invalidObject("Object offset beyond end of object stream "
                    + streamId, start);
        }
        Lexer lexer = new Lexer(decoded);
        lexer.setPosition((int) start);
        return new ObjectParser(lexer).parseObject();
    }

}
