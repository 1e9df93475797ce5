/*
 * ByteBufferCollector.java
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
import java.nio.channels.WritableByteChannel;

/**
 * The end of a filter chain: everything written is appended to a growable
 * array, read back with {@link #toByteArray()} once the chain is closed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ByteBufferCollector implements WritableByteChannel {

    private byte[] data;
    private int count;
    private boolean open = true;

    public ByteBufferCollector(int capacity) {
        data = new byte[Math.max(capacity, 64)];
    }

    @Override
    public int write(ByteBuffer src) {
        int n = src.remaining();
        if (count + n > data.length) {
            byte[] grown = new byte[Math.max(data.length * 2, count + n)];
            System.arraycopy(data, 0, grown, 0, count);
            data = grown;
        }
        src.get(data, count, n);
        count += n;
        return n;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    public int size() {
        return count;
    }

    /**
     * Returns a copy of the bytes collected so far.
     *
     * @return the collected data
     */
    public byte[] toByteArray() {
        byte[] result = new byte[count];
        System.arraycopy(data, 0, result, 0, count);
        return result;
    }

}
