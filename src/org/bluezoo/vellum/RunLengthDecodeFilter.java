/*
 * RunLengthDecodeFilter.java
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
 * RunLengthDecode.
 * <p>
 * The data is a sequence of runs, each introduced by a length byte
 * {@code n}. For {@code n} below 128 the following {@code n + 1} bytes are
 * literal; for {@code n} above 128 the following byte is repeated
 * {@code 257 - n} times. A length byte of 128 ends the data. A run that is
 * cut short by the end of the stream is an error.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RunLengthDecodeFilter extends StreamFilter {

    static final int EOD = 128;

    // literal bytes still to copy, or -count of a pending repeat
    private int pending;
    private boolean finished;

    @Override
    public int write(ByteBuffer src) throws IOException {
        int consumed = src.remaining();
        ByteBuffer out = ByteBuffer.allocate(consumed * 2 + 128);
        while (src.hasRemaining() && !finished) {
            if (pending > 0) {
                int n = Math.min(pending, src.remaining());
                out = ensure(out, n);
                for (int i = 0; i < n; i++) {
                    out.put(src.get());
                }
                pending -= n;
            } else if (pending < 0) {
                byte value = src.get();
                out = ensure(out, -pending);
                for (int i = pending; i < 0; i++) {
                    out.put(value);
                }
                pending = 0;
            } else {
                int length = src.get() & 0xff;
                if (length == EOD) {
                    finished = true;
                } else if (length < EOD) {
                    pending = length + 1;
                } else {
                    pending = length - 257;
                }
            }
        }
        // anything after the end marker is ignored
        src.position(src.limit());
        out.flip();
        writeToNext(out);
        return consumed;
    }

    private static ByteBuffer ensure(ByteBuffer buf, int needed) {
        if (buf.remaining() >= needed) {
            return buf;
        }
        ByteBuffer grown = ByteBuffer.allocate((buf.capacity() + needed) * 2);
        buf.flip();
        grown.put(buf);
        return grown;
    }

    @Override
    public void close() throws IOException {
        if (pending != 0) {
            throw new IOException("RunLengthDecode: data ends inside a run");
        }
        super.close();
    }

}
