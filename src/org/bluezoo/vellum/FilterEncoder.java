/*
 * FilterEncoder.java
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
import java.util.HashMap;
import java.util.Map;
import java.util.zip.Deflater;

/**
 * Encoders for the standard stream filters, the inverse of the decoding
 * filters used by the {@link FilterPipeline}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FilterEncoder {

    private FilterEncoder() {
    }

    /**
     * Encodes data with the named filter.
     *
     * @param filter the filter name or its abbreviation
     * @param data the data to encode
     * @return the encoded data
     * @throws PDFParseException of kind UNSUPPORTED_FEATURE for a filter
     *         that has no encoder
     */
    public static byte[] encode(Name filter, byte[] data) {
        switch (filter.getValue()) {
            case "FlateDecode":
            case "Fl":
                return flate(data);
            case "ASCIIHexDecode":
            case "AHx":
                return asciiHex(data);
            case "ASCII85Decode":
            case "A85":
                return ascii85(data);
            case "RunLengthDecode":
            case "RL":
                return runLength(data);
            case "LZWDecode":
            case "LZW":
                return lzw(data, true);
            default:
                throw PDFParseException.unsupportedFeature("No encoder for filter " + filter);
        }
    }

    /**
     * Compresses data in zlib format.
     *
     * @param data the data
     * @return the compressed data
     */
    public static byte[] flate(byte[] data) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(data);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2 + 16);
            byte[] buf = new byte[8192];
            while (!deflater.finished()) {
                int count = deflater.deflate(buf);
                out.write(buf, 0, count);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    /**
     * Encodes data as upper-case hex digit pairs terminated by '>'.
     *
     * @param data the data
     * @return the encoded data
     */
    public static byte[] asciiHex(byte[] data) {
        byte[] out = new byte[data.length * 2 + 1];
        int j = 0;
        for (byte b : data) {
            out[j++] = (byte) ObjectWriter.HEX_DIGITS[(b >> 4) & 0xf];
            out[j++] = (byte) ObjectWriter.HEX_DIGITS[b & 0xf];
        }
        out[j] = '>';
        return out;
    }

    /**
     * Encodes data in base 85, terminated by '~>'.
     *
     * @param data the data
     * @return the encoded data
     */
    public static byte[] ascii85(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 5 / 4 + 8);
        int i = 0;
        while (i + 4 <= data.length) {
            long value = ((data[i] & 0xffL) << 24) | ((data[i + 1] & 0xffL) << 16)
                    | ((data[i + 2] & 0xffL) << 8) | (data[i + 3] & 0xffL);
            if (value == 0) {
                out.write('z');
            } else {
                writeBase85(out, value, 5);
            }
            i += 4;
        }
        int rest = data.length - i;
        if (rest > 0) {
            long value = 0;
            for (int k = 0; k < 4; k++) {
                value <<= 8;
                if (k < rest) {
                    value |= data[i + k] & 0xffL;
                }
            }
            writeBase85(out, value, rest + 1);
        }
        out.write('~');
        out.write('>');
        return out.toByteArray();
    }

    private static void writeBase85(ByteArrayOutputStream out, long value, int count) {
        char[] digits = new char[5];
        for (int k = 4; k >= 0; k--) {
            digits[k] = (char) ('!' + (value % 85));
            value /= 85;
        }
        for (int k = 0; k < count; k++) {
            out.write(digits[k]);
        }
    }

    /**
     * Run-length encodes data. Runs of two or more equal bytes become
     * repeat records; everything else is copied in literal records.
     *
     * @param data the data
     * @return the encoded data, terminated by the EOD byte 128
     */
    public static byte[] runLength(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length + data.length / 128 + 2);
        int i = 0;
        while (i < data.length) {
            int run = 1;
            while (i + run < data.length && run < 128 && data[i + run] == data[i]) {
                run++;
            }
            if (run >= 2) {
                out.write(257 - run);
                out.write(data[i]);
                i += run;
                continue;
            }
            int start = i;
            int length = 0;
            while (i < data.length && length < 128) {
                if (i + 1 < data.length && data[i + 1] == data[i]) {
                    break;
                }
                i++;
                length++;
            }
            out.write(length - 1);
            out.write(data, start, length);
        }
        out.write(RunLengthDecodeFilter.EOD);
        return out.toByteArray();
    }

    /**
     * LZW-compresses data, starting with a clear-table code and ending
     * with the end-of-data code. The table is cleared before it grows
     * beyond what 12-bit codes can address.
     *
     * @param data the data
     * @param earlyChange whether code widths grow one code early, as
     *        /EarlyChange 1 (the default) requires
     * @return the compressed data
     */
    public static byte[] lzw(byte[] data, boolean earlyChange) {
        BitWriter out = new BitWriter();
        int early = earlyChange ? 1 : 0;
        Map<String, Integer> dictionary = new HashMap<>();
        int nextCode = 258;
        int emitted = 0;
        out.write(LZWDecodeFilter.CLEAR_TABLE, LZWDecodeFilter.INITIAL_CODE_LENGTH);
        StringBuilder w = new StringBuilder();
        for (byte b : data) {
            char k = (char) (b & 0xff);
            w.append(k);
            if (w.length() == 1 || dictionary.containsKey(w.toString())) {
                continue;
            }
            String prefix = w.substring(0, w.length() - 1);
            out.write(code(dictionary, prefix), lzwWidth(emitted, early));
            emitted++;
            dictionary.put(w.toString(), nextCode++);
            w.setLength(0);
            w.append(k);
            if (nextCode >= LZWDecodeFilter.MAX_TABLE_SIZE - 3) {
                out.write(LZWDecodeFilter.CLEAR_TABLE, lzwWidth(emitted, early));
                dictionary.clear();
                nextCode = 258;
                emitted = 0;
            }
        }
        if (w.length() > 0) {
            out.write(code(dictionary, w.toString()), lzwWidth(emitted, early));
            emitted++;
        }
        out.write(LZWDecodeFilter.EOD, lzwWidth(emitted, early));
        return out.toByteArray();
    }

    private static int code(Map<String, Integer> dictionary, String s) {
        if (s.length() == 1) {
            return s.charAt(0);
        }
        return dictionary.get(s);
    }

    /**
     * Returns the width of the next code, as the decoder will compute it
     * after having read the given number of codes since the last clear.
     * The decoder adds a table entry for every code but the first.
     */
    private static int lzwWidth(int codesRead, int early) {
        int decoderNext = 258 + Math.max(0, codesRead - 1);
        int width = LZWDecodeFilter.INITIAL_CODE_LENGTH;
        while (width < LZWDecodeFilter.MAX_CODE_LENGTH && decoderNext + early >= (1 << width)) {
            width++;
        }
        return width;
    }

    /**
     * Packs codes most significant bit first.
     */
    private static class BitWriter {

        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private long buffer;
        private int bits;

        void write(int code, int width) {
            buffer = (buffer << width) | code;
            bits += width;
            while (bits >= 8) {
                out.write((int) (buffer >> (bits - 8)) & 0xff);
                bits -= 8;
            }
        }

        byte[] toByteArray() {
            if (bits > 0) {
                out.write((int) (buffer << (8 - bits)) & 0xff);
                bits = 0;
            }
            return out.toByteArray();
        }

    }

}
