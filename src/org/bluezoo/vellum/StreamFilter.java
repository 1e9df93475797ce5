/*
 * StreamFilter.java
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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

/**
 * One decoding stage of a {@link FilterPipeline}.
 * <p>
 * A stage is a channel: encoded bytes are written to it, possibly in
 * several chunks, and it forwards decoded bytes to the channel after it.
 * Closing a stage flushes whatever it still holds and closes the rest of
 * the chain. Bad input is reported as an {@link IOException}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class StreamFilter implements WritableByteChannel {

    private WritableByteChannel next;
    private PDFDictionary params;
    private boolean open = true;

    /**
     * Returns a new decoder for a filter name.
     *
     * @param filterName the full or abbreviated filter name
     * @return the decoder, or null if the filter is not one that decodes
     */
    public static StreamFilter create(String filterName) {
        if ("FlateDecode".equals(filterName) || "Fl".equals(filterName)) {
            return new FlateDecodeFilter();
        }
        if ("LZWDecode".equals(filterName) || "LZW".equals(filterName)) {
            return new LZWDecodeFilter();
        }
        if ("ASCIIHexDecode".equals(filterName) || "AHx".equals(filterName)) {
            return new ASCIIHexDecodeFilter();
        }
        if ("ASCII85Decode".equals(filterName) || "A85".equals(filterName)) {
            return new ASCII85DecodeFilter();
        }
        if ("RunLengthDecode".equals(filterName) || "RL".equals(filterName)) {
            return new RunLengthDecodeFilter();
        }
        return null;
    }

    /**
     * Image codecs and Crypt: their output is left as it stands.
     */
    static boolean isPassThrough(String filterName) {
        switch (filterName) {
            case "DCTDecode":
            case "DCT":
            case "JPXDecode":
            case "CCITTFaxDecode":
            case "CCF":
            case "JBIG2Decode":
            case "Crypt":
                return true;
            default:
                return false;
        }
    }

    public void setNext(WritableByteChannel next) {
        this.next = next;
    }

    /**
     * @param params the /DecodeParms entry for this filter, or null
     */
    public void setParams(PDFDictionary params) {
        this.params = params;
    }

    protected int intParam(String key, int defaultValue) {
        return (params == null) ? defaultValue
                : (int) params.getInteger(new Name(key), defaultValue);
    }

    protected int writeToNext(ByteBuffer data) throws IOException {
        return (next == null || !data.hasRemaining()) ? 0 : next.write(data);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() throws IOException {
        open = false;
        if (next != null) {
            next.close();
        }
    }

}
