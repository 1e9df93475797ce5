/*
 * ASCII85DecodeFilter.java
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
 * ASCII85Decode.
 * <p>
 * Every five characters from {@code !} to {@code u} are the base-85
 * digits of four bytes, and {@code z} between groups stands for four zero
 * bytes. Whitespace is ignored. The data ends with {@code ~>}; a final
 * group of n characters yields n - 1 bytes. A leading {@code <~} is
 * skipped.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ASCII85DecodeFilter extends StreamFilter {

    private long group;
    private int count;
    // the last character seen was '~', or a leading '<'
    private boolean tilde;
    private boolean leadingAngle;
    private boolean data;
    private boolean finished;

    @Override
    public int write(ByteBuffer src) throws IOException {
        int consumed = src.remaining();
        ByteBuffer out = ByteBuffer.allocate(consumed * 4 + 4);
        while (src.hasRemaining() && !finished) {
            int c = src.get() & 0xff;
            if (tilde) {
                if (c != '>') {
                    throw new IOException("ASCII85Decode: expected '>' after '~'");
                }
                finish(out);
            } else if (leadingAngle) {
                if (c != '~') {
                    throw new IOException("ASCII85Decode: unexpected '<'");
                }
                leadingAngle = false;
            } else if (c == '~') {
                tilde = true;
            } else if (c == '<' && !data) {
                leadingAngle = true;
            } else if (!Lexer.isWhitespace(c)) {
                data = true;
                digit(c, out);
            }
        }
        src.position(src.limit());
        out.flip();
        writeToNext(out);
        return consumed;
    }

    private void digit(int c, ByteBuffer out) throws IOException {
        if (c == 'z') {
            if (count != 0) {
                throw new IOException("ASCII85Decode: 'z' within a group");
            }
            out.putInt(0);
            return;
        }
        if (c < '!' || c > 'u') {
            throw new IOException("ASCII85Decode: invalid character 0x" + Integer.toHexString(c));
        }
        group = group * 85 + (c - '!');
        if (++count == 5) {
            emit(out, 4);
        }
    }

    /**
     * Writes the leading bytes of the current group.
     */
    private void emit(ByteBuffer out, int bytes) throws IOException {
        if (group > 0xffffffffL) {
            throw new IOException("ASCII85Decode: group value exceeds 2^32 - 1");
        }
        for (int shift = 24; shift > 24 - bytes * 8; shift -= 8) {
            out.put((byte) (group >>> shift));
        }
        group = 0;
        count = 0;
    }

    private void finish(ByteBuffer out) throws IOException {
        if (count == 1) {
            throw new IOException("ASCII85Decode: single character in final group");
        }
        if (count > 1) {
            int bytes = count - 1;
            // pad with the highest digit
            while (count < 5) {
                group = group * 85 + 84;
                count++;
            }
            emit(out, bytes);
        }
        finished = true;
    }

    @Override
    public void close() throws IOException {
        if (!finished) {
            ByteBuffer out = ByteBuffer.allocate(4);
            finish(out);
            out.flip();
            writeToNext(out);
        }
        super.close();
    }

}
