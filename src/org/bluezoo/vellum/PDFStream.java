/*
 * PDFStream.java
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

import java.util.Arrays;

/**
 * A PDF stream: a dictionary together with a raw, possibly encoded, byte
 * payload.
 * <p>
 * The decoded form of the payload is computed on first request through
 * the {@link FilterPipeline} and cached on the stream.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFStream extends PDFObject {

    private final PDFDictionary dictionary;
    private final byte[] rawData;
    private final int dataOffset;
    private final boolean lengthProvisional;
    private byte[] decodedData;

    /**
     * Creates a stream from a dictionary and its raw payload.
     *
     * @param dictionary the stream dictionary
     * @param rawData the encoded payload
     */
    public PDFStream(PDFDictionary dictionary, byte[] rawData) {
        this(dictionary, rawData, -1, false);
    }

    PDFStream(PDFDictionary dictionary, byte[] rawData, int dataOffset, boolean lengthProvisional) {
        if (dictionary == null || rawData == null) {
            throw new NullPointerException("Stream dictionary and data cannot be null");
        }
        this.dictionary = dictionary;
        this.rawData = rawData;
        this.dataOffset = dataOffset;
        this.lengthProvisional = lengthProvisional;
    }

    /**
     * Creates a stream by encoding the given data with the named filters.
     * The filters are recorded in the dictionary's /Filter entry.
     *
     * @param dictionary the base dictionary, copied
     * @param data the decoded data
     * @param filters the filters to apply, outermost last
     * @return the stream
     */
    public static PDFStream encode(PDFDictionary dictionary, byte[] data, Name... filters) {
        PDFDictionary dict = new PDFDictionary(dictionary);
        byte[] raw = data;
        for (int i = filters.length - 1; i >= 0; i--) {
            raw = FilterEncoder.encode(filters[i], raw);
        }
        if (filters.length == 1) {
            dict.put(Name.FILTER, filters[0]);
        } else if (filters.length > 1) {
            dict.put(Name.FILTER, new PDFArray(filters));
        }
        dict.put(Name.LENGTH, PDFNumber.of(raw.length));
        PDFStream stream = new PDFStream(dict, raw);
        stream.decodedData = data.clone();
        return stream;
    }

    public PDFDictionary getDictionary() {
        return dictionary;
    }

    /**
     * Returns a copy of the raw (encoded) payload.
     *
     * @return the raw bytes
     */
    public byte[] getRawData() {
        return rawData.clone();
    }

    int getRawLength() {
        return rawData.length;
    }

    byte[] rawData() {
        return rawData;
    }

    /**
     * Returns the offset of the payload in the file it was parsed from.
     *
     * @return the offset, or -1 for streams not read from a file
     */
    public int getDataOffset() {
        return dataOffset;
    }

    /**
     * Indicates whether the payload length was taken from a scan for the
     * endstream keyword rather than from a resolved /Length.
     *
     * @return true if the length has not been validated
     */
    public boolean isLengthProvisional() {
        return lengthProvisional;
    }

    /**
     * Returns the decoded payload, decoding it if necessary. Streams whose
     * /Filter or /DecodeParms are indirect must be decoded through
     * {@link PDFDocument#decodeStream}.
     *
     * @return a copy of the decoded bytes
     * @throws PDFParseException if the payload cannot be decoded
     */
    public byte[] getDecodedData() {
        return decode(dictionary.get(Name.FILTER), dictionary.get(Name.DECODE_PARMS)).clone();
    }

    byte[] decode(PDFObject filter, PDFObject decodeParms) {
        if (decodedData == null) {
            decodedData = FilterPipeline.decode(rawData, filter, decodeParms);
        }
        return decodedData;
    }

    @Override
    public Kind getKind() {
        return Kind.STREAM;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof PDFStream) {
            PDFStream other = (PDFStream) obj;
            return dictionary.equals(other.dictionary) && Arrays.equals(rawData, other.rawData);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * dictionary.hashCode() + Arrays.hashCode(rawData);
    }

}
