/*
 * Lexer.java
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
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Tokenizer for PDF object syntax.
 * <p>
 * The lexer reads from a byte buffer using absolute offsets and keeps an
 * explicit cursor, which callers may save and restore with
 * {@link #getPosition()} and {@link #setPosition(int)}. Several lexers may
 * operate over the same buffer independently, so that a nested object can
 * be resolved while an outer one is still being parsed.
 * <p>
 * Comments are skipped as whitespace. Structural comments such as the
 * {@code %PDF-} header and the {@code %%EOF} marker are handled by the
 * callers that care about them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Lexer {

    private final ByteBuffer data;
    private final int limit;
    private int pos;

    /**
     * Creates a lexer over the given buffer. Offsets are absolute indices
     * into the buffer, from 0 to its limit.
     *
     * @param data the buffer
     */
    public Lexer(ByteBuffer data) {
        this.data = data;
        this.limit = data.limit();
    }

    /**
     * Creates a lexer over the given bytes.
     *
     * @param data the bytes
     */
    public Lexer(byte[] data) {
        this(ByteBuffer.wrap(data));
    }

    public int getPosition() {
        return pos;
    }

    public void setPosition(int pos) {
        if (pos < 0 || pos > limit) {
            throw new IllegalArgumentException("Position out of range: " + pos);
        }
        this.pos = pos;
    }

    /**
     * Returns the number of bytes in the underlying buffer.
     *
     * @return the length
     */
    public int length() {
        return limit;
    }

    ByteBuffer getBuffer() {
        return data;
    }

    /**
     * Returns the next token without consuming it.
     *
     * @return the next token
     */
    public Token peek() {
        int save = pos;
        try {
            return nextToken();
        } finally {
            pos = save;
        }
    }

    /**
     * Reads and returns the next token.
     *
     * @return the next token, of type EOF at the end of the input
     * @throws PDFLexException if the bytes at the cursor do not form a token
     */
    public Token nextToken() {
        skipWhitespace();
        int start = pos;
        if (pos >= limit) {
            return new Token(Token.Type.EOF, start, start, null, null, null);
        }
        int b = byteAt(pos);
        switch (b) {
            case '[':
                pos++;
                return new Token(Token.Type.ARRAY_START, start, pos, null, null, null);
            case ']':
                pos++;
                return new Token(Token.Type.ARRAY_END, start, pos, null, null, null);
            case '<':
                if (pos + 1 < limit && byteAt(pos + 1) == '<') {
                    pos += 2;
                    return new Token(Token.Type.DICT_START, start, pos, null, null, null);
                }
                return readHexString();
            case '>':
                if (pos + 1 < limit && byteAt(pos + 1) == '>') {
                    pos += 2;
                    return new Token(Token.Type.DICT_END, start, pos, null, null, null);
                }
                throw new PDFLexException("Invalid delimiter '>'", start);
            case '(':
                return readLiteralString();
            case '/':
                return readName();
            case ')':
            case '{':
            case '}':
                throw new PDFLexException("Invalid delimiter '" + (char) b + "'", start);
            default:
                return readRegular();
        }
    }

    /**
     * Skips whitespace and comments.
     */
    public void skipWhitespace() {
        while (pos < limit) {
            int b = byteAt(pos);
            if (isWhitespace(b)) {
                pos++;
            } else if (b == '%') {
                while (pos < limit) {
                    b = byteAt(pos);
                    if (b == '\n' || b == '\r') {
                        break;
                    }
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    /**
     * Reads a name token. The leading solidus has not been consumed.
     */
    private Token readName() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < limit) {
            int b = byteAt(pos);
            if (isWhitespace(b) || isDelimiter(b)) {
                break;
            }
            pos++;
            if (b == '#' && pos + 1 < limit
                    && hexValue(byteAt(pos)) >= 0 && hexValue(byteAt(pos + 1)) >= 0) {
                int value = (hexValue(byteAt(pos)) << 4) | hexValue(byteAt(pos + 1));
                if (value == 0) {
                    throw new PDFLexException("Null character in name", start);
                }
                sb.append((char) value);
                pos += 2;
            } else {
                // a '#' without two hex digits is taken literally, as PDF 1.1 allowed
                sb.append((char) b);
            }
        }
        return new Token(Token.Type.NAME, start, pos, sb.toString(), null, null);
    }

    /**
     * Reads a literal string, with nested parentheses and escapes.
     */
    private Token readLiteralString() {
        int start = pos;
        pos++;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int depth = 1;
        while (true) {
            if (pos >= limit) {
                throw new PDFLexException("Unterminated string", start);
            }
            int b = byteAt(pos++);
            if (b == '(') {
                depth++;
                out.write(b);
            } else if (b == ')') {
                depth--;
                if (depth == 0) {
                    break;
                }
                out.write(b);
            } else if (b == '\\') {
                if (pos >= limit) {
                    throw new PDFLexException("Unterminated string", start);
                }
                int escaped = byteAt(pos++);
                switch (escaped) {
                    case 'n': out.write('\n'); break;
                    case 'r': out.write('\r'); break;
                    case 't': out.write('\t'); break;
                    case 'b': out.write('\b'); break;
                    case 'f': out.write('\f'); break;
                    case '(': out.write('('); break;
                    case ')': out.write(')'); break;
                    case '\\': out.write('\\'); break;
                    case '\r':
                        if (pos < limit && byteAt(pos) == '\n') {
                            pos++;
                        }
                        break;
                    case '\n':
                        break;
                    default:
                        if (escaped >= '0' && escaped <= '7') {
                            int octal = escaped - '0';
                            for (int i = 0; i < 2 && pos < limit; i++) {
                                int next = byteAt(pos);
                                if (next >= '0' && next <= '7') {
                                    pos++;
                                    octal = (octal << 3) | (next - '0');
                                } else {
                                    break;
                                }
                            }
                            out.write(octal & 0xff);
                        } else {
                            // unknown escape: the backslash is ignored
                            out.write(escaped);
                        }
                }
            } else if (b == '\r') {
                // an unescaped end-of-line is read as a single LF
                if (pos < limit && byteAt(pos) == '\n') {
                    pos++;
                }
                out.write('\n');
            } else {
                out.write(b);
            }
        }
        return new Token(Token.Type.STRING, start, pos, null, out.toByteArray(), null);
    }

    /**
     * Reads a hexadecimal string. Whitespace is ignored and an odd final
     * digit is padded with 0.
     */
    private Token readHexString() {
        int start = pos;
        pos++;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int high = -1;
        while (true) {
            if (pos >= limit) {
                throw new PDFLexException("Unterminated hex string", start);
            }
            int b = byteAt(pos++);
            if (b == '>') {
                break;
            }
            if (isWhitespace(b)) {
                continue;
            }
            int value = hexValue(b);
            if (value < 0) {
                throw new PDFLexException("Invalid hex character '" + (char) b + "'", pos - 1);
            }
            if (high < 0) {
                high = value;
            } else {
                out.write((high << 4) | value);
                high = -1;
            }
        }
        if (high >= 0) {
            out.write(high << 4);
        }
        return new Token(Token.Type.HEX_STRING, start, pos, null, out.toByteArray(), null);
    }

    /**
     * Reads a run of regular characters as a number or keyword.
     */
    private Token readRegular() {
        int start = pos;
        while (pos < limit) {
            int b = byteAt(pos);
            if (isWhitespace(b) || isDelimiter(b)) {
                break;
            }
            pos++;
        }
        String text = new String(bytes(start, pos), StandardCharsets.ISO_8859_1);
        int c = text.charAt(0);
        if ((c >= '0' && c <= '9') || c == '+' || c == '-' || c == '.') {
            PDFNumber number = parseNumber(text, start);
            return new Token(Token.Type.NUMBER, start, pos, null, null, number);
        }
        return new Token(Token.Type.KEYWORD, start, pos, text, null, null);
    }

    /**
     * Parses the relaxed PDF number syntax: an optional sign, digits, and at
     * most one decimal point, with no exponent.
     */
    static PDFNumber parseNumber(String text, int offset) {
        int i = 0;
        int len = text.length();
        if (text.charAt(0) == '+' || text.charAt(0) == '-') {
            i++;
        }
        boolean point = false;
        boolean digits = false;
        for (; i < len; i++) {
            char c = text.charAt(i);
            if (c == '.') {
                if (point) {
                    throw new PDFLexException("Malformed number '" + text + "'", offset);
                }
                point = true;
            } else if (c >= '0' && c <= '9') {
                digits = true;
            } else {
                throw new PDFLexException("Malformed number '" + text + "'", offset);
            }
        }
        if (!digits) {
            throw new PDFLexException("Malformed number '" + text + "'", offset);
        }
        if (!point) {
            try {
                return PDFNumber.of(Long.parseLong(text.charAt(0) == '+' ? text.substring(1) : text));
            } catch (NumberFormatException e) {
                // too large for a long: keep the magnitude as a real
                return PDFNumber.of(Double.parseDouble(text));
            }
        }
        return PDFNumber.of(Double.parseDouble(text));
    }

    /**
     * Consumes a single end-of-line marker (CRLF, LF or CR) at the cursor,
     * if there is one.
     *
     * @return true if an end-of-line was consumed
     */
    boolean skipEOL() {
        if (pos < limit && byteAt(pos) == '\r') {
            pos++;
            if (pos < limit && byteAt(pos) == '\n') {
                pos++;
            }
            return true;
        }
        if (pos < limit && byteAt(pos) == '\n') {
            pos++;
            return true;
        }
        return false;
    }

    /**
     * Returns a copy of the bytes between two offsets.
     *
     * @param start the start offset, inclusive
     * @param end the end offset, exclusive
     * @return the bytes
     */
    byte[] bytes(int start, int end) {
        byte[] result = new byte[end - start];
        for (int i = start; i < end; i++) {
            result[i - start] = data.get(i);
        }
        return result;
    }

    int byteAt(int index) {
        return data.get(index) & 0xff;
    }

    /**
     * Returns the offset of the first occurrence of a byte sequence at or
     * after the given offset.
     *
     * @param sequence the bytes to find
     * @param from the offset to search from
     * @return the offset, or -1 if not found
     */
    int indexOf(byte[] sequence, int from) {
        return indexOf(data, sequence, from, limit);
    }

    static int indexOf(ByteBuffer buf, byte[] sequence, int from, int limit) {
        for (int i = Math.max(0, from); i <= limit - sequence.length; i++) {
            if (matches(buf, i, sequence)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the offset of the last occurrence of a byte sequence that
     * lies entirely before the given end offset.
     */
    static int lastIndexOf(ByteBuffer buf, byte[] sequence, int end) {
        for (int i = end - sequence.length; i >= 0; i--) {
            if (matches(buf, i, sequence)) {
                return i;
            }
        }
        return -1;
    }

    static boolean matches(ByteBuffer buf, int pos, byte[] sequence) {
        if (pos < 0 || pos + sequence.length > buf.limit()) {
            return false;
        }
        for (int i = 0; i < sequence.length; i++) {
            if (buf.get(pos + i) != sequence[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks if a byte is PDF whitespace.
     */
    static boolean isWhitespace(int b) {
        return b == 0 || b == 9 || b == 10 || b == 12 || b == 13 || b == 32;
    }

    /**
     * Checks if a byte is a PDF delimiter.
     */
    static boolean isDelimiter(int b) {
        return b == '(' || b == ')' || b == '<' || b == '>' ||
               b == '[' || b == ']' || b == '{' || b == '}' ||
               b == '/' || b == '%';
    }

    /**
     * Returns the value of a hex digit, or -1.
     */
    static int hexValue(int c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        return -1;
    }

}
