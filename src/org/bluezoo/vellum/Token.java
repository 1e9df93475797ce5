/*
 * Token.java
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

/**
 * A lexical token produced by the {@link Lexer}.
 * <p>
 * Each token records the byte offset at which it began. Depending on its
 * type it carries a keyword or name text, string bytes, or a number.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Token {

    /**
     * Token types.
     */
    public enum Type {
        KEYWORD,
        NUMBER,
        STRING,
        HEX_STRING,
        NAME,
        ARRAY_START,
        ARRAY_END,
        DICT_START,
        DICT_END,
        EOF
    }

    private final Type type;
    private final int offset;
    private final int end;
    private final String text;
    private final byte[] bytes;
    private final PDFNumber number;

    Token(Type type, int offset, int end, String text, byte[] bytes, PDFNumber number) {
        this.type = type;
        this.offset = offset;
        this.end = end;
        this.text = text;
        this.bytes = bytes;
        this.number = number;
    }

    public Type getType() {
        return type;
    }

    /**
     * Returns the offset of the first byte of this token.
     *
     * @return the offset
     */
    public int getOffset() {
        return offset;
    }

    /**
     * Returns the offset immediately after the last byte of this token.
     *
     * @return the end offset
     */
    public int getEnd() {
        return end;
    }

    /**
     * Returns the keyword text, or the decoded name for name tokens.
     *
     * @return the text, or null for other token types
     */
    public String getText() {
        return text;
    }

    /**
     * Returns the decoded bytes of a string token.
     *
     * @return the bytes, or null for other token types
     */
    public byte[] getBytes() {
        return bytes;
    }

    public PDFNumber getNumber() {
        return number;
    }

    /**
     * Indicates whether this is the given keyword.
     *
     * @param keyword the keyword text
     * @return true if this token is that keyword
     */
    public boolean isKeyword(String keyword) {
        return type == Type.KEYWORD && keyword.equals(text);
    }

    /**
     * Indicates whether this is a non-negative integer token.
     *
     * @return true for non-negative integers
     */
    public boolean isUnsignedInteger() {
        return type == Type.NUMBER && number.isInteger() && number.longValue() >= 0
                && number.longValue() <= Integer.MAX_VALUE;
    }

    /**
     * Returns a short description of this token for error messages.
     */
    @Override
    public String toString() {
        switch (type) {
            case KEYWORD:
                return "keyword '" + text + "'";
            case NAME:
                return "name /" + text;
            case NUMBER:
                return "number " + number;
            case STRING:
            case HEX_STRING:
                return "string";
            case ARRAY_START:
                return "'['";
            case ARRAY_END:
                return "']'";
            case DICT_START:
                return "'<<'";
            case DICT_END:
                return "'>>'";
            default:
                return "end of file";
        }
    }

}
