/*
 * ObjectParser.java
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

import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds PDF objects from the tokens of a {@link Lexer}.
 * <p>
 * The parser consumes exactly one value per call to {@link #parseObject()},
 * leaving the lexer positioned after it. References are returned as
 * {@link ObjectId} values and are never resolved here.
 * <p>
 * When a stream's /Length is an indirect reference, the parser asks its
 * {@link LengthResolver} for the value. If the length cannot be resolved
 * yet, the payload is delimited by scanning for the {@code endstream}
 * keyword and the stream is marked as having a provisional length, to be
 * validated by the document once the reference can be resolved.
 * <p>
 * With length recovery enabled, used when repairing a file, a direct
 * /Length that does not end at {@code endstream} is replaced by the
 * position of the keyword.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ObjectParser {

    private static final Logger LOGGER = Logger.getLogger(ObjectParser.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.vellum.L10N");

    private static final byte[] ENDSTREAM = "endstream".getBytes(StandardCharsets.US_ASCII);

    /**
     * Resolves an indirect stream length.
     */
    public interface LengthResolver {

        /**
         * Returns the integer value of the given object.
         *
         * @param ref the reference held in the stream's /Length
         * @return the length, or -1 if it cannot be resolved yet
         */
        int resolveLength(ObjectId ref);

    }

    private final Lexer lexer;
    private LengthResolver lengthResolver;
    private boolean recoverLength;
    private int depth;

    /**
     * Creates a parser reading from the given lexer.
     *
     * @param lexer the lexer
     */
    public ObjectParser(Lexer lexer) {
        this.lexer = lexer;
    }

    public void setLengthResolver(LengthResolver lengthResolver) {
        this.lengthResolver = lengthResolver;
    }

    /**
     * Sets whether a wrong direct stream /Length is corrected from the
     * position of {@code endstream} instead of failing.
     *
     * @param recoverLength true to recover stream lengths
     */
    public void setRecoverLength(boolean recoverLength) {
        this.recoverLength = recoverLength;
    }

    public Lexer getLexer() {
        return lexer;
    }

    /**
     * Parses an indirect object, {@code n g obj value endobj}, starting at
     * the lexer's position.
     *
     * @return the indirect object
     * @throws PDFParseException if the input is not an indirect object
     */
    public IndirectObject parseIndirectObject() {
        Token numToken = lexer.nextToken();
        int offset = numToken.getOffset();
        if (numToken.getType() == Token.Type.EOF) {
            throw PDFParseException.unexpectedEndOfFile("object header", offset);
        }
        if (!numToken.isUnsignedInteger()) {
            throw PDFParseException.unexpectedToken("object number", numToken.toString(), offset);
        }
        Token genToken = lexer.nextToken();
        if (!genToken.isUnsignedInteger()) {
            throw PDFParseException.unexpectedToken("generation number", genToken.toString(),
                    genToken.getOffset());
        }
        Token objToken = lexer.nextToken();
        if (!objToken.isKeyword("obj")) {
            throw PDFParseException.unexpectedToken("'obj'", objToken.toString(), objToken.getOffset());
        }
        ObjectId id = new ObjectId(numToken.getNumber().intValue(), genToken.getNumber().intValue());
        PDFObject value = parseObject();
        Token end = lexer.nextToken();
        if (end.getType() == Token.Type.EOF) {
            throw PDFParseException.unexpectedEndOfFile("object " + id, end.getOffset());
        }
        if (!end.isKeyword("endobj")) {
            throw PDFParseException.unexpectedToken("'endobj'", end.toString(), end.getOffset());
        }
        return new IndirectObject(id, value, offset);
    }

    /**
     * Parses one value.
     *
     * @return the object
     * @throws PDFParseException if the tokens do not form a value
     */
    public PDFObject parseObject() {
        Token token = lexer.nextToken();
        switch (token.getType()) {
            case DICT_START:
                return parseDictionaryOrStream(token);
            case ARRAY_START:
                return parseArray(token);
            case NAME:
                return new Name(token.getText());
            case STRING:
                return new PDFString(token.getBytes(), false);
            case HEX_STRING:
                return new PDFString(token.getBytes(), true);
            case NUMBER:
                return parseNumberOrReference(token);
            case KEYWORD:
                if (token.isKeyword("true")) {
                    return PDFBoolean.TRUE;
                } else if (token.isKeyword("false")) {
                    return PDFBoolean.FALSE;
                } else if (token.isKeyword("null")) {
                    return PDFNull.INSTANCE;
                }
                throw PDFParseException.unexpectedToken("value", token.toString(), token.getOffset());
            case EOF:
                throw PDFParseException.unexpectedEndOfFile("value", token.getOffset());
            default:
                throw PDFParseException.unexpectedToken("value", token.toString(), token.getOffset());
        }
    }

    /**
     * Disambiguates a number from {@code n g R} with two tokens of
     * lookahead.
     */
    private PDFObject parseNumberOrReference(Token first) {
        if (!first.isUnsignedInteger()) {
            return first.getNumber();
        }
        int save = lexer.getPosition();
        Token second = lexer.nextToken();
        if (second.isUnsignedInteger()) {
            Token third = lexer.nextToken();
            if (third.isKeyword("R")) {
                return new ObjectId(first.getNumber().intValue(), second.getNumber().intValue());
            }
            if (third.isKeyword("obj") && depth == 0) {
                throw PDFParseException.unexpectedToken("value", "indirect object header",
                        first.getOffset());
            }
        }
        lexer.setPosition(save);
        return first.getNumber();
    }

    private PDFArray parseArray(Token start) {
        PDFArray array = new PDFArray();
        depth++;
        try {
            while (true) {
                Token token = lexer.peek();
                if (token.getType() == Token.Type.ARRAY_END) {
                    lexer.nextToken();
                    return array;
                }
                if (token.getType() == Token.Type.EOF) {
                    throw PDFParseException.unexpectedEndOfFile("array", start.getOffset());
                }
                array.add(parseObject());
            }
        } finally {
            depth--;
        }
    }

    private PDFObject parseDictionaryOrStream(Token start) {
        PDFDictionary dict = new PDFDictionary();
        depth++;
        try {
            while (true) {
                Token key = lexer.nextToken();
                if (key.getType() == Token.Type.DICT_END) {
                    break;
                }
                if (key.getType() == Token.Type.EOF) {
                    throw PDFParseException.unexpectedEndOfFile("dictionary", start.getOffset());
                }
                if (key.getType() != Token.Type.NAME) {
                    throw PDFParseException.unexpectedToken("name", key.toString(), key.getOffset());
                }
                if (lexer.peek().getType() == Token.Type.DICT_END) {
                    throw PDFParseException.unexpectedToken("value", "'>>'", lexer.getPosition());
                }
                dict.put(new Name(key.getText()), parseObject());
            }
        } finally {
            depth--;
        }
        if (depth == 0) {
            int save = lexer.getPosition();
            Token next = lexer.peek();
            if (next.isKeyword("stream")) {
                lexer.setPosition(next.getEnd());
                return parseStreamData(dict, start.getOffset());
            }
            lexer.setPosition(save);
        }
        return dict;
    }

    /**
     * Reads the payload of a stream. The lexer is positioned immediately
     * after the {@code stream} keyword.
     */
    private PDFStream parseStreamData(PDFDictionary dict, int dictOffset) {
        lexer.skipEOL();
        int dataStart = lexer.getPosition();
        PDFObject lengthValue = dict.get(Name.LENGTH);
        int length = -1;
        if (lengthValue instanceof PDFNumber && ((PDFNumber) lengthValue).isInteger()) {
            long value = ((PDFNumber) lengthValue).longValue();
            if (value < 0 || value > Integer.MAX_VALUE) {
                throw PDFParseException.invalidObject("Invalid stream length " + value, dictOffset);
            }
            length = (int) value;
        } else if (lengthValue instanceof ObjectId) {
            if (lengthResolver != null) {
                length = lengthResolver.resolveLength((ObjectId) lengthValue);
            }
        } else {
            throw PDFParseException.invalidObject("Stream dictionary lacks a resolvable /Length",
                    dictOffset);
        }
        if (length < 0) {
            // Length not yet resolvable
            int dataEnd = scanToEndstream(dataStart);
            return new PDFStream(dict, lexer.bytes(dataStart, dataEnd), dataStart, true);
        }
        try {
            if ((long) dataStart + length > lexer.length()) {
                throw PDFParseException.unexpectedEndOfFile("stream data", dataStart);
            }
            lexer.setPosition(dataStart + length);
            Token end = lexer.nextToken();
            if (!end.isKeyword("endstream")) {
                throw PDFParseException.unexpectedToken("'endstream'", end.toString(), end.getOffset());
            }
        } catch (PDFParseException e) {
            if (!recoverLength) {
                throw e;
            }
            int dataEnd = scanToEndstream(dataStart);
            LOGGER.warning(MessageFormat.format(L10N.getString("warn.stream_length_recovered"),
                    dictOffset, length, dataEnd - dataStart));
            PDFDictionary corrected = new PDFDictionary(dict);
            corrected.put(Name.LENGTH, PDFNumber.of(dataEnd - dataStart));
            return new PDFStream(corrected, lexer.bytes(dataStart, dataEnd), dataStart, false);
        }
        return new PDFStream(dict, lexer.bytes(dataStart, dataStart + length), dataStart, false);
    }

    /**
     * Finds the {@code endstream} keyword after the payload, leaving the
     * lexer after it. Returns the end of the payload, which excludes the
     * end-of-line marker before the keyword.
     */
    private int scanToEndstream(int dataStart) {
        int endstream = lexer.indexOf(ENDSTREAM, dataStart);
        if (endstream < 0) {
            throw PDFParseException.unexpectedEndOfFile("stream data", dataStart);
        }
        int dataEnd = endstream;
        if (dataEnd > dataStart && lexer.byteAt(dataEnd - 1) == '\n') {
            dataEnd--;
            if (dataEnd > dataStart && lexer.byteAt(dataEnd - 1) == '\r') {
                dataEnd--;
            }
        } else if (dataEnd > dataStart && lexer.byteAt(dataEnd - 1) == '\r') {
            dataEnd--;
        }
        lexer.setPosition(endstream + ENDSTREAM.length);
        return dataEnd;
    }

}
