/*
 * ObjectWriter.java
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
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Serializes PDF objects to their byte representation.
 * <p>
 * Output is written so that parsing it with the {@link ObjectParser}
 * yields an equal object:
 * <ul>
 *   <li>reals are written in plain decimal notation, without exponent and
 *       without trailing zeros, but always with a decimal point;</li>
 *   <li>literal strings escape parentheses, backslashes and non-printable
 *       bytes, the latter as three-digit octal escapes;</li>
 *   <li>hex strings use upper-case digits;</li>
 *   <li>names use {@code #xx} escapes for delimiters, whitespace, '#' and
 *       bytes outside the printable ASCII range;</li>
 *   <li>a stream's /Length is rewritten to the length of its raw payload.</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectWriter {

    static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private ObjectWriter() {
    }

    /**
     * Serializes an object.
     *
     * @param obj the object
     * @return the bytes
     * @throws PDFWriteException if the object cannot be expressed in PDF
     *         syntax
     */
    public static byte[] toBytes(PDFObject obj) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(obj, out);
        return out.toByteArray();
    }

    /**
     * Serializes an indirect object, {@code n g obj ... endobj}.
     *
     * @param id the object identifier
     * @param obj the value
     * @param out the destination
     */
    public static void writeIndirect(ObjectId id, PDFObject obj, ByteArrayOutputStream out) {
        writeAscii(out, id.getObjectNumber() + " " + id.getGenerationNumber() + " obj\n");
        write(obj, out);
        writeAscii(out, "\nendobj\n");
    }

    /**
     * Serializes an object to a byte stream.
     *
     * @param obj the object
     * @param out the destination
     */
    public static void write(PDFObject obj, ByteArrayOutputStream out) {
        switch (obj.getKind()) {
            case NULL:
                writeAscii(out, "null");
                break;
            case BOOLEAN:
                writeAscii(out, ((PDFBoolean) obj).booleanValue() ? "true" : "false");
                break;
            case NUMBER:
                writeAscii(out, formatNumber((PDFNumber) obj));
                break;
            case STRING:
                writeString((PDFString) obj, out);
                break;
            case NAME:
                writeName((Name) obj, out);
                break;
            case ARRAY:
                writeArray((PDFArray) obj, out);
                break;
            case DICTIONARY:
                writeDictionary((PDFDictionary) obj, out);
                break;
            case REFERENCE:
                ObjectId id = (ObjectId) obj;
                writeAscii(out, id.getObjectNumber() + " " + id.getGenerationNumber() + " R");
                break;
            case STREAM:
                writeStream((PDFStream) obj, out);
                break;
            default:
                throw new PDFWriteException("Unknown object kind " + obj.getKind());
        }
    }

    /**
     * Formats a number. Integers are written as-is; reals in plain
     * notation with trailing zeros removed.
     */
    static String formatNumber(PDFNumber number) {
        if (number.isInteger()) {
            return Long.toString(number.longValue());
        }
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new PDFWriteException("Cannot write non-finite number " + value);
        }
        String s = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        if (s.indexOf('.') < 0) {
            s = s + ".0";
        }
        if (s.startsWith("-0") && value == 0.0) {
            s = s.substring(1);
        }
        return s;
    }

    private static void writeString(PDFString string, ByteArrayOutputStream out) {
        int len = string.length();
        if (string.isHex()) {
            out.write('<');
            for (int i = 0; i < len; i++) {
                int b = string.byteAt(i) & 0xff;
                out.write(HEX_DIGITS[b >> 4]);
                out.write(HEX_DIGITS[b & 0xf]);
            }
            out.write('>');
            return;
        }
        out.write('(');
        for (int i = 0; i < len; i++) {
            int b = string.byteAt(i) & 0xff;
            switch (b) {
                case '\n': writeAscii(out, "\\n"); break;
                case '\r': writeAscii(out, "\\r"); break;
                case '\t': writeAscii(out, "\\t"); break;
                case '\b': writeAscii(out, "\\b"); break;
                case '\f': writeAscii(out, "\\f"); break;
                case '(': writeAscii(out, "\\("); break;
                case ')': writeAscii(out, "\\)"); break;
                case '\\': writeAscii(out, "\\\\"); break;
                default:
                    if (b < 0x20 || b > 0x7e) {
                        out.write('\\');
                        out.write('0' + ((b >> 6) & 7));
                        out.write('0' + ((b >> 3) & 7));
                        out.write('0' + (b & 7));
                    } else {
                        out.write(b);
                    }
            }
        }
        out.write(')');
    }

    private static void writeName(Name name, ByteArrayOutputStream out) {
        out.write('/');
        String value = name.getValue();
        byte[] bytes;
        if (isLatin1(value)) {
            bytes = value.getBytes(StandardCharsets.ISO_8859_1);
        } else {
            bytes = value.getBytes(StandardCharsets.UTF_8);
        }
        for (byte v : bytes) {
            int b = v & 0xff;
            if (b < 0x21 || b > 0x7e || b == '#' || Lexer.isDelimiter(b)) {
                out.write('#');
                out.write(HEX_DIGITS[b >> 4]);
                out.write(HEX_DIGITS[b & 0xf]);
            } else {
                out.write(b);
            }
        }
    }

    private static boolean isLatin1(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) > 0xff) {
                return false;
            }
        }
        return true;
    }

    private static void writeArray(PDFArray array, ByteArrayOutputStream out) {
        out.write('[');
        boolean first = true;
        for (PDFObject element : array) {
            if (!first) {
                out.write(' ');
            }
            write(element, out);
            first = false;
        }
        out.write(']');
    }

    private static void writeDictionary(PDFDictionary dict, ByteArrayOutputStream out) {
        writeAscii(out, "<<");
        for (Map.Entry<Name, PDFObject> entry : dict.entrySet()) {
            writeName(entry.getKey(), out);
            out.write(' ');
            write(entry.getValue(), out);
        }
        writeAscii(out, ">>");
    }

    private static void writeStream(PDFStream stream, ByteArrayOutputStream out) {
        byte[] raw = stream.rawData();
        PDFDictionary dict = new PDFDictionary(stream.getDictionary());
        dict.put(Name.LENGTH, PDFNumber.of(raw.length));
        writeDictionary(dict, out);
        writeAscii(out, "\nstream\n");
        out.write(raw, 0, raw.length);
        writeAscii(out, "\nendstream");
    }

    static void writeAscii(ByteArrayOutputStream out, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.US_ASCII);
        out.write(bytes, 0, bytes.length);
    }

}
