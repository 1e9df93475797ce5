/*
 * XrefResolver.java
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
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Locates, parses and chains the cross-reference sections of a file.
 * <p>
 * Resolution starts at the offset given after the last {@code startxref}
 * keyword in the buffer. Each section is either a classic {@code xref}
 * table followed by a {@code trailer} dictionary, or an indirect object
 * holding a {@code /Type /XRef} stream. Sections are followed through
 * their trailers' /Prev entries; a chain that revisits an offset is
 * rejected. Hybrid files, whose classic tables name a supplementary
 * cross-reference stream with /XRefStm, have that stream merged into the
 * table that names it.
 * <p>
 * The sections are then folded oldest first into a single
 * {@link CrossReferenceTable}, so that the newest entry for every object
 * number wins.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class XrefResolver {

    private static final Logger LOGGER = Logger.getLogger(XrefResolver.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.vellum.L10N");

    private static final byte[] STARTXREF = "startxref".getBytes(StandardCharsets.US_ASCII);

    private final ByteBuffer data;
    private final Lexer lexer;

    /**
     * Creates a resolver over the given file contents.
     *
     * @param data the file contents, indexed from 0
     */
    public XrefResolver(ByteBuffer data) {
        this.data = data;
        this.lexer = new Lexer(data);
    }

    /**
     * Parses the chain of cross-reference sections and returns the merged
     * table.
     *
     * @return the merged table
     * @throws PDFParseException of kind INVALID_XREF if the cross-reference
     *         data is unusable
     */
    public CrossReferenceTable resolve() {
        long offset = findStartxref(data, data.limit());
        if (offset < 0) {
            throw PDFParseException.invalidXref("startxref not found", -1);
        }
        List<CrossReferenceSection> sections = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        while (offset >= 0) {
            if (!visited.add(offset)) {
                throw PDFParseException.invalidXref("Cross-reference /Prev chain revisits offset "
                        + offset, offset);
            }
            CrossReferenceSection section = parseSection(offset);
            PDFDictionary trailer = section.getTrailer();
            long xrefStm = trailer.getInteger(Name.XREF_STM, -1);
            if (section.getFormat() == CrossReferenceSection.Format.TABLE && xrefStm >= 0) {
                if (!visited.add(xrefStm)) {
                    throw PDFParseException.invalidXref("/XRefStm revisits offset " + xrefStm, xrefStm);
                }
                section.mergeSupplementary(parseStream(checkOffset(xrefStm)));
            }
            sections.add(section);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.section_loaded"),
                        section.getFormat(), offset, section.getEntries().size()));
            }
            offset = section.getPrev();
        }
        return CrossReferenceTable.fold(sections);
    }

    /**
     * Finds the value following the last {@code startxref} keyword that
     * ends before the given offset.
     *
     * @param data the file contents
     * @param end the offset to search back from
     * @return the offset of the newest cross-reference section, or -1 if
     *         no well-formed {@code startxref} was found
     */
    public static long findStartxref(ByteBuffer data, int end) {
        int pos = Lexer.lastIndexOf(data, STARTXREF, end);
        while (pos >= 0) {
            if (pos == 0 || !isRegular(data.get(pos - 1) & 0xff)) {
                Lexer lexer = new Lexer(data);
                lexer.setPosition(pos + STARTXREF.length);
                Token token = lexer.nextToken();
                if (token.getType() == Token.Type.NUMBER && token.getNumber().isInteger()
                        && token.getNumber().longValue() >= 0) {
                    return token.getNumber().longValue();
                }
            }
            pos = Lexer.lastIndexOf(data, STARTXREF, pos + STARTXREF.length - 1);
        }
        return -1;
    }

    private static boolean isRegular(int b) {
        return !Lexer.isWhitespace(b) && !Lexer.isDelimiter(b);
    }

    private int checkOffset(long offset) {
        if (offset < 0 || offset >= data.limit()) {
            throw PDFParseException.invalidXref("Cross-reference offset out of range: " + offset, offset);
        }
        return (int) offset;
    }

    /**
     * Parses the section at the given offset, dispatching on its first
     * token.
     */
    CrossReferenceSection parseSection(long offset) {
        int pos = checkOffset(offset);
        lexer.setPosition(pos);
        Token first = lexer.peek();
        if (first.isKeyword("xref")) {
            return parseTable(pos);
        } else if (first.isUnsignedInteger()) {
            return parseStream(pos);
        }
        throw PDFParseException.invalidXref("Expected 'xref' or a cross-reference stream but found "
                + first, offset);
    }

    /**
     * Parses a classic table and its trailer.
     */
    private CrossReferenceSection parseTable(int offset) {
        CrossReferenceSection section = new CrossReferenceSection(offset, CrossReferenceSection.Format.TABLE);
        lexer.setPosition(offset);
        lexer.nextToken(); // xref
        while (true) {
            Token token = lexer.nextToken();
            if (token.isKeyword("trailer")) {
                break;
            }
            if (!token.isUnsignedInteger()) {
                throw PDFParseException.invalidXref("Malformed subsection header: " + token,
                        token.getOffset());
            }
            int firstObject = token.getNumber().intValue();
            Token countToken = lexer.nextToken();
            if (!countToken.isUnsignedInteger()) {
                throw PDFParseException.invalidXref("Malformed subsection header: " + countToken,
                        countToken.getOffset());
            }
            int count = countToken.getNumber().intValue();
            for (int i = 0; i < count; i++) {
                Token offsetToken = lexer.nextToken();
                Token genToken = lexer.nextToken();
                Token typeToken = lexer.nextToken();
                if (!offsetToken.isUnsignedInteger() || !genToken.isUnsignedInteger()
                        || typeToken.getType() != Token.Type.KEYWORD) {
                    throw PDFParseException.invalidXref("Malformed entry for object "
                            + (firstObject + i), offsetToken.getOffset());
                }
                long value = offsetToken.getNumber().longValue();
                int generation = genToken.getNumber().intValue();
                CrossReferenceEntry entry;
                if ("n".equals(typeToken.getText())) {
                    entry = CrossReferenceEntry.inUse(value, generation);
                } else if ("f".equals(typeToken.getText())) {
                    entry = CrossReferenceEntry.free((int) value, generation);
                } else {
                    throw PDFParseException.invalidXref("Invalid entry type '" + typeToken.getText()
                            + "'", typeToken.getOffset());
                }
                section.put(firstObject + i, entry);
            }
        }
        PDFObject trailer;
        try {
            trailer = new ObjectParser(lexer).parseObject();
        } catch (PDFParseException e) {
            throw new PDFParseException(PDFParseException.Kind.INVALID_XREF,
                    "Malformed trailer: " + e.getMessage(), lexer.getPosition(), e);
        }
        if (!(trailer instanceof PDFDictionary)) {
            throw PDFParseException.invalidXref("Trailer is not a dictionary", lexer.getPosition());
        }
        section.setTrailer((PDFDictionary) trailer);
        return section;
    }

    /**
     * Parses a cross-reference stream.
     */
    private CrossReferenceSection parseStream(int offset) {
        lexer.setPosition(offset);
        IndirectObject indirect = new ObjectParser(lexer).parseIndirectObject();
        if (!(indirect.getObject() instanceof PDFStream)) {
            throw PDFParseException.invalidXref("Object " + indirect.getId()
                    + " is not a cross-reference stream", offset);
        }
        PDFStream stream = (PDFStream) indirect.getObject();
        PDFDictionary dict = stream.getDictionary();
        if (!dict.isType(Name.XREF)) {
            throw PDFParseException.invalidXref("Stream " + indirect.getId() + " is not /Type /XRef", offset);
        }
        if (stream.isLengthProvisional()) {
            LOGGER.warning(MessageFormat.format(L10N.getString("warn.xref_stream_length"),
                    indirect.getId(), offset));
        }
        int[] widths = readWidths(dict, offset);
        int[] index = readIndex(dict, offset);
        byte[] records = stream.getDecodedData();

        int entrySize = widths[0] + widths[1] + widths[2];
        long total = 0;
        for (int i = 1; i < index.length; i += 2) {
            if ((long) index[i - 1] + index[i] > (long) Integer.MAX_VALUE + 1) {
                throw PDFParseException.invalidXref("Cross-reference stream subsection "
                        + index[i - 1] + " " + index[i] + " exceeds the object number range", offset);
            }
            total += index[i];
        }
        if (total * entrySize != records.length) {
            throw PDFParseException.invalidXref("Cross-reference stream holds " + records.length
                    + " bytes, expected " + total + " records of " + entrySize + " bytes", offset);
        }

        CrossReferenceSection section = new CrossReferenceSection(offset, CrossReferenceSection.Format.STREAM);
        section.setTrailer(dict);
        int pos = 0;
        for (int i = 0; i < index.length; i += 2) {
            int firstObject = index[i];
            int count = index[i + 1];
            for (int j = 0; j < count; j++) {
                // The type defaults to 1 when its field is absent
                long type = widths[0] == 0 ? 1 : readField(records, pos, widths[0]);
                pos += widths[0];
                long field2 = readField(records, pos, widths[1]);
                pos += widths[1];
                long field3 = readField(records, pos, widths[2]);
                pos += widths[2];
                int objectNumber = firstObject + j;
                CrossReferenceEntry.State state = CrossReferenceEntry.State.forRecordType(type);
                if (state == null) {
                    // Unknown types are references to the null object
                    if (LOGGER.isLoggable(Level.WARNING)) {
                        LOGGER.warning(MessageFormat.format(L10N.getString("warn.xref_record_type"),
                                type, objectNumber));
                    }
                    continue;
                }
                switch (state) {
                    case FREE:
                        section.put(objectNumber, CrossReferenceEntry.free((int) field2, (int) field3));
                        break;
                    case IN_USE:
                        section.put(objectNumber, CrossReferenceEntry.inUse(field2, (int) field3));
                        break;
                    default:
                        section.put(objectNumber, CrossReferenceEntry.compressed((int) field2, (int) field3));
                }
            }
        }
        return section;
    }

    private static int[] readWidths(PDFDictionary dict, long offset) {
        PDFObject w = dict.get(Name.W);
        if (!(w instanceof PDFArray) || ((PDFArray) w).size() != 3) {
            throw PDFParseException.invalidXref("Cross-reference stream /W must be an array of 3 integers",
                    offset);
        }
        PDFArray array = (PDFArray) w;
        int[] widths = new int[3];
        for (int i = 0; i < 3; i++) {
            PDFObject element = array.get(i);
            if (!(element instanceof PDFNumber) || !((PDFNumber) element).isInteger()
                    || ((PDFNumber) element).longValue() < 0 || ((PDFNumber) element).longValue() > 8) {
                throw PDFParseException.invalidXref("Invalid /W field width " + element, offset);
            }
            widths[i] = ((PDFNumber) element).intValue();
        }
        return widths;
    }

    private static int[] readIndex(PDFDictionary dict, long offset) {
        PDFObject index = dict.get(Name.INDEX);
        if (index == null) {
            long size = dict.getInteger(Name.SIZE, -1);
            if (size < 0 || size > Integer.MAX_VALUE) {
                throw PDFParseException.invalidXref("Cross-reference stream lacks a valid /Size", offset);
            }
            return new int[] { 0, (int) size };
        }
        if (!(index instanceof PDFArray) || ((PDFArray) index).size() % 2 != 0) {
            throw PDFParseException.invalidXref("Cross-reference stream /Index must hold pairs", offset);
        }
        PDFArray array = (PDFArray) index;
        int[] result = new int[array.size()];
        for (int i = 0; i < result.length; i++) {
            PDFObject element = array.get(i);
            if (!(element instanceof PDFNumber) || !((PDFNumber) element).isInteger()
                    || ((PDFNumber) element).longValue() < 0
                    || ((PDFNumber) element).longValue() > Integer.MAX_VALUE) {
                throw PDFParseException.invalidXref("Invalid /Index value " + element, offset);
            }
            result[i] = ((PDFNumber) element).intValue();
        }
        return result;
    }

    /**
     * Reads a big-endian unsigned field.
     */
    private static long readField(byte[] records, int pos, int width) {
        long value = 0;
        for (int i = 0; i < width; i++) {
            value = (value << 8) | (records[pos + i] & 0xff);
        }
        return value;
    }

}
