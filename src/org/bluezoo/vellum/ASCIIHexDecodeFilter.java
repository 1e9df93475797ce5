/*
 * ASCIIHexDecodeFilter.java
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
 * ASCIIHexDecode: pairs of hexadecimal digits, with whitespace ignored,
 * up to a closing {@code >}. An odd final digit is the high nibble of a
 * last byte whose low nibble is 0.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ASCIIHexDecodeFilter extends StreamFilter {

    // digits read so far, a high nibble is pending when odd
    private int digits;
    private int high;
    private boolean finished;

    @Override
    public int write(ByteBuffer src) throws IOException {
        int consumed = src.remaining();
        ByteBuffer out = ByteBuffer.allocate(consumed / 2 + 1);
        while (src.hasRemaining() && !finished) {
            int c = src.get() & 0xff;
            if (c == '>') {
                finish(out);
            } else if (!Lexer.isWhitespace(c)) {
                int value = Lexer.hexValue(c);
                if (value < 0) {
                    throw new IOException("ASCIIHexDecode: invalid character 0x" + Integer.toHexString(c));
                }
                if ((digits++ & 1) == 0) {
                    high = value;
                } else {
                    out.put((byte) ((high << 4) | value));
                }
            }
        }
        src.position(src.limit());
        out.flip();
        writeToNext(out);
        return consumed;
    }

    private void finish(ByteBuffer out) {
        if ((digits & 1) == 1) {
            out.put((byte) (high << 4));
            digits++;
        }
        finished = true;
    }

    @Override
    public void close() throws IOException {
        if (!finished) {
            ByteBuffer out = ByteBuffer.allocate(1);
            finish(out);
            out.flip();
            writeToNext(out);
        }
        super.close();
    }

}
