/*
 * FlateDecodeFilter.java
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
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * FlateDecode, using {@link Inflater} on the zlib format.
 * <p>
 * An empty payload decodes to nothing, but a non-empty one must contain a
 * complete zlib stream by the time the filter is closed. Bytes following
 * the end of the zlib stream are ignored. Predictors are applied by a
 * separate {@link PredictorFilter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FlateDecodeFilter extends StreamFilter {

    private final Inflater inflater = new Inflater();
    private final byte[] chunk = new byte[8192];
    private byte[] input = new byte[0];
    private boolean seenData;

    @Override
    public int write(ByteBuffer src) throws IOException {
        int n = src.remaining();
        if (n > 0) {
            seenData = true;
        }
        if (inflater.finished()) {
            src.position(src.limit());
            return n;
        }
        if (input.length < n) {
            input = new byte[n];
        }
        src.get(input, 0, n);
        inflater.setInput(input, 0, n);
        drain();
        return n;
    }

    private void drain() throws IOException {
        try {
            while (!inflater.finished() && !inflater.needsInput()) {
                int count = inflater.inflate(chunk);
                if (count == 0 && inflater.needsDictionary()) {
                    throw new IOException("FlateDecode: preset dictionary not supported");
                }
                writeToNext(ByteBuffer.wrap(chunk, 0, count));
            }
        } catch (DataFormatException e) {
            throw new IOException("FlateDecode: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        boolean complete;
        try {
            drain();
            complete = inflater.finished();
        } finally {
            inflater.end();
        }
        if (seenData && !complete) {
            throw new IOException("FlateDecode: truncated data");
        }
        super.close();
    }

}
