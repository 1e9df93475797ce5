/*
 * PredictorFilter.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Stream filter reversing a TIFF or PNG predictor applied before
 * FlateDecode or LZWDecode compression.
 * <p>
 * The parameters /Predictor, /Colors, /BitsPerComponent and /Columns come
 * from the same DecodeParms dictionary as the compression filter. Rows may
 * span input chunks, so incomplete rows are held until more data arrives.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PredictorFilter extends StreamFilter {

    private int predictor = 1;
    private int bytesPerPixel;
    private int rowBytes;
    private byte[] prevRow;
    private ByteBuffer accumulator = ByteBuffer.allocate(4096);

    @Override
    public void setParams(PDFDictionary params) {
        super.setParams(params);
        predictor = intParam("Predictor", 1);
        int colors = intParam("Colors", 1);
        int bitsPerComponent = intParam("BitsPerComponent", 8);
        int columns = intParam("Columns", 1);
        bytesPerPixel = Math.max(1, (colors * bitsPerComponent + 7) / 8);
        rowBytes = (columns * colors * bitsPerComponent + 7) / 8;
        prevRow = new byte[rowBytes];
    }

    /**
     * Indicates whether the given parameters call for a predictor.
     *
     * @param params the decode parameters, may be null
     * @return true if /Predictor is greater than 1
     */
    static boolean isRequired(PDFDictionary params) {
        return params != null && params.getInteger(new Name("Predictor"), 1) > 1;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        int len = src.remaining();
        if (accumulator.remaining() < len) {
            ByteBuffer grown = ByteBuffer.allocate(Math.max(accumulator.capacity() * 2,
                    accumulator.position() + len));
            accumulator.flip();
            grown.put(accumulator);
            accumulator = grown;
        }
        accumulator.put(src);
        accumulator.flip();
        ByteArrayOutputStream result = new ByteArrayOutputStream();
        int fullRowBytes = predictor >= 10 ? rowBytes + 1 : rowBytes;
        while (accumulator.remaining() >= fullRowBytes && fullRowBytes > 0) {
            decodeRow(accumulator, fullRowBytes, result);
        }
        accumulator.compact();
        if (result.size() > 0) {
            writeToNext(ByteBuffer.wrap(result.toByteArray()));
        }
        return len;
    }

    @Override
    public void close() throws IOException {
        accumulator.flip();
        if (accumulator.hasRemaining()) {
            // a short final row
            ByteArrayOutputStream result = new ByteArrayOutputStream();
            decodeRow(accumulator, accumulator.remaining(), result);
            writeToNext(ByteBuffer.wrap(result.toByteArray()));
        }
        accumulator.clear();
        super.close();
    }

    private void decodeRow(ByteBuffer in, int length, ByteArrayOutputStream out) throws IOException {
        if (predictor == 2) {
            byte[] row = new byte[length];
            in.get(row);
            for (int i = bytesPerPixel; i < length; i++) {
                row[i] = (byte) (row[i] + row[i - bytesPerPixel]);
            }
            out.write(row);
            return;
        }
        if (predictor < 10 || predictor > 15) {
            throw new IOException("Unsupported predictor " + predictor);
        }
        int filterByte = in.get() & 0xFF;
        byte[] row = new byte[length - 1];
        in.get(row);
        int n = row.length;
        switch (filterByte) {
            case 0: // None
                break;
            case 1: // Sub
                for (int i = bytesPerPixel; i < n; i++) {
                    row[i] = (byte) (row[i] + row[i - bytesPerPixel]);
                }
                break;
            case 2: // Up
                for (int i = 0; i < n; i++) {
                    row[i] = (byte) (row[i] + prevRow[i]);
                }
                break;
            case 3: // Average
                for (int i = 0; i < n; i++) {
                    int left = (i >= bytesPerPixel) ? (row[i - bytesPerPixel] & 0xFF) : 0;
                    int up = prevRow[i] & 0xFF;
                    row[i] = (byte) (row[i] + (left + up) / 2);
                }
                break;
            case 4: // Paeth
                for (int i = 0; i < n; i++) {
                    int a = (i >= bytesPerPixel) ? (row[i - bytesPerPixel] & 0xFF) : 0;
                    int b = prevRow[i] & 0xFF;
                    int c = (i >= bytesPerPixel) ? (prevRow[i - bytesPerPixel] & 0xFF) : 0;
                    row[i] = (byte) (row[i] + paethPredictor(a, b, c));
                }
                break;
            default:
                throw new IOException("Invalid PNG predictor row type " + filterByte);
        }
        out.write(row);
        System.arraycopy(row, 0, prevRow, 0, n);
    }

    private static int paethPredictor(int a, int b, int c) {
        int p = a + b - c;
        int pa = Math.abs(p - a);
        int pb = Math.abs(p - b);
        int pc = Math.abs(p - c);
        if (pa <= pb && pa <= pc) {
            return a;
        }
        if (pb <= pc) {
            return b;
        }
        return c;
    }

}
