/*
 * LZWDecodeFilter.java
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

/**
 * LZWDecode.
 * <p>
 * Codes are read most significant bit first, starting 9 bits wide and
 * growing to at most 12. Code 256 clears the table and code 257 ends the
 * data. With /EarlyChange 1, the default, the width grows when the next
 * free code plus one no longer fits; with /EarlyChange 0 when the next
 * free code itself no longer fits.
 * <p>
 * Table entries are stored as a prefix code plus a final byte, and
 * strings are expanded by walking the prefix chain backwards.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LZWDecodeFilter extends StreamFilter {

    static final int CLEAR_TABLE = 256;
    static final int EOD = 257;
    static final int INITIAL_CODE_LENGTH = 9;
    static final int MAX_CODE_LENGTH = 12;
    static final int MAX_TABLE_SIZE = 4096;

    private final int[] prefix = new int[MAX_TABLE_SIZE];
    private final byte[] suffix = new byte[MAX_TABLE_SIZE];
    private final int[] length = new int[MAX_TABLE_SIZE];
    private final byte[] scratch = new byte[MAX_TABLE_SIZE];

    private int width = INITIAL_CODE_LENGTH;
    private int free = EOD + 1;
    private int previous = -1;
    private int early = 1;

    private int bits;
    private int bitCount;
    private boolean finished;

    public LZWDecodeFilter() {
        for (int i = 0; i < 256; i++) {
            prefix[i] = -1;
            suffix[i] = (byte) i;
            length[i] = 1;
        }
    }

    @Override
    public void setParams(PDFDictionary params) {
        super.setParams(params);
        early = (intParam("EarlyChange", 1) == 0) ? 0 : 1;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        int consumed = src.remaining();
        ByteBuffer out = ByteBuffer.allocate(Math.max(consumed * 4, 256));
        while (!finished) {
            while (bitCount < width && src.hasRemaining()) {
                bits = (bits << 8) | (src.get() & 0xff);
                bitCount += 8;
            }
            if (bitCount < width) {
                break;
            }
            bitCount -= width;
            int code = (bits >>> bitCount) & ((1 << width) - 1);
            if (code == EOD) {
                finished = true;
            } else if (code == CLEAR_TABLE) {
                width = INITIAL_CODE_LENGTH;
                free = EOD + 1;
                previous = -1;
            } else {
                out = decode(code, out);
            }
        }
        src.position(src.limit());
        out.flip();
        writeToNext(out);
        return consumed;
    }

    private ByteBuffer decode(int code, ByteBuffer out) throws IOException {
        int first;
        if (code < free && code != CLEAR_TABLE && code != EOD) {
            first = expand(code);
            out = put(out, scratch, MAX_TABLE_SIZE - length[code], length[code]);
        } else if (code == free && previous >= 0) {
            // the string for the previous code followed by its own first byte
            first = expand(previous);
            out = put(out, scratch, MAX_TABLE_SIZE - length[previous], length[previous]);
            out = put(out, new byte[] { (byte) first }, 0, 1);
        } else {
            throw new IOException("LZWDecode: invalid code " + code);
        }
        if (previous >= 0 && free < MAX_TABLE_SIZE) {
            prefix[free] = previous;
            suffix[free] = (byte) first;
            length[free] = length[previous] + 1;
            free++;
            if (width < MAX_CODE_LENGTH && free + early >= (1 << width)) {
                width++;
            }
        }
        previous = code;
        return out;
    }

    /**
     * Writes the string for a code right-aligned into the scratch buffer
     * and returns its first byte.
     */
    private int expand(int code) {
        int pos = MAX_TABLE_SIZE;
        for (int c = code; c >= 0; c = prefix[c]) {
            scratch[--pos] = suffix[c];
        }
        return scratch[pos] & 0xff;
    }

    private static ByteBuffer put(ByteBuffer out, byte[] bytes, int offset, int count) {
        if (out.remaining() < count) {
            ByteBuffer grown = ByteBuffer.allocate((out.capacity() + count) * 2);
            out.flip();
            grown.put(out);
            out = grown;
        }
        out.put(bytes, offset, count);
        return out;
    }

}
