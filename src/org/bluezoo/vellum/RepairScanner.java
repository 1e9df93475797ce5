/*
 * RepairScanner.java
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
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rebuilds a cross-reference table by scanning a file for indirect object
 * headers.
 * <p>
 * Every {@code n g obj} header that introduces a parseable object is
 * recorded at its offset; when an object number occurs more than once the
 * occurrence nearest the end of the file wins, as it would in an
 * incremental update. The packed contents of object streams found by the
 * scan are indexed as compressed entries for object numbers not otherwise
 * found.
 * <p>
 * The trailer is taken from the last {@code trailer} dictionary or
 * cross-reference stream dictionary in the file. Failing those, one is
 * synthesized with /Root pointing to the last /Type /Catalog object.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class RepairScanner {

    private static final Logger LOGGER = Logger.getLogger(RepairScanner.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.vellum.L10N");

    private static final byte[] OBJ = "obj".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] TRAILER = "trailer".getBytes(StandardCharsets.US_ASCII);

    private final ByteBuffer data;
    private final int limit;

    private final CrossReferenceSection section =
            new CrossReferenceSection(-1, CrossReferenceSection.Format.REPAIRED);
    private final List<IndirectObject> objectStreams = new ArrayList<>();
    private PDFDictionary xrefStreamDictionary;
    private ObjectId catalog;

    RepairScanner(ByteBuffer data) {
        this.data = data;
        this.limit = data.limit();
    }

    /**
     * Scans the file and returns the rebuilt table.
     *
     * @return a table with a single section of format REPAIRED
     * @throws PDFParseException of kind CORRUPTED_FILE if no objects were
     *         found
     */
    CrossReferenceTable scan() {
        int pos = 0;
        while (pos < limit) {
            int objPos = Lexer.indexOf(data, OBJ, pos, limit);
            if (objPos < 0) {
                break;
            }
            pos = objPos + OBJ.length;
            int end = objPos + OBJ.length;
            if (end < limit && !isBoundary(data.get(end) & 0xff)) {
                continue;
            }
            int start = headerStart(objPos);
            if (start < 0) {
                continue;
            }
            Lexer lexer = new Lexer(data);
            lexer.setPosition(start);
            try {
                ObjectParser parser = new ObjectParser(lexer);
                parser.setRecoverLength(true);
                IndirectObject indirect = parser.parseIndirectObject();
                record(indirect);
                pos = lexer.getPosition();
            } catch (PDFParseException e) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(MessageFormat.format(L10N.getString("log.repair_skipped"),
                            start, e.getMessage()));
                }
            }
        }
        if (section.getEntries().isEmpty()) {
            throw PDFParseException.corruptedFile("No objects found while repairing file", -1);
        }
        indexObjectStreams();
        if (section.get(0) == null) {
            section.put(0, CrossReferenceEntry.free(0, 65535));
        }
        section.setTrailer(buildTrailer());
        LOGGER.info(MessageFormat.format(L10N.getString("info.repaired"),
                section.getEntries().size()));
        return CrossReferenceTable.fold(Collections.singletonList(section));
    }

    private void record(IndirectObject indirect) {
        ObjectId id = indirect.getId();
        section.put(id.getObjectNumber(),
                CrossReferenceEntry.inUse(indirect.getOffset(), id.getGenerationNumber()));
        PDFObject obj = indirect.getObject();
        PDFDictionary dict = null;
        if (obj instanceof PDFDictionary) {
            dict = (PDFDictionary) obj;
        } else if (obj instanceof PDFStream) {
            dict = ((PDFStream) obj).getDictionary();
            if (dict.isType(Name.OBJ_STM)) {
                objectStreams.add(indirect);
            } else if (dict.isType(Name.XREF)) {
                xrefStreamDictionary = dict;
            }
        }
        if (dict != null && dict.isType(Name.CATALOG)) {
            catalog = id;
        }
    }

    /**
     * Returns the offset of the object number in a header ending with the
     * {@code obj} keyword at the given offset, or -1 if the keyword is not
     * preceded by two unsigned integers.
     */
    private int headerStart(int objPos) {
        int i = objPos - 1;
        if (i < 0 || !Lexer.isWhitespace(data.get(i) & 0xff)) {
            return -1;
        }
        i = skipWhitespaceBackward(i);
        int genEnd = i + 1;
        i = skipDigitsBackward(i);
        if (i + 1 == genEnd || i < 0 || !Lexer.isWhitespace(data.get(i) & 0xff)) {
            return -1;
        }
        i = skipWhitespaceBackward(i);
        int numEnd = i + 1;
        i = skipDigitsBackward(i);
        if (i + 1 == numEnd) {
            return -1;
        }
        if (i >= 0 && !isBoundary(data.get(i) & 0xff)) {
            return -1;
        }
        return i + 1;
    }

    private int skipWhitespaceBackward(int i) {
        while (i >= 0 && Lexer.isWhitespace(data.get(i) & 0xff)) {
            i--;
        }
        return i;
    }

    private int skipDigitsBackward(int i) {
        while (i >= 0) {
            int c = data.get(i) & 0xff;
            if (c < '0' || c > '9') {
                break;
            }
            i--;
        }
        return i;
    }

    private static boolean isBoundary(int b) {
        return Lexer.isWhitespace(b) || Lexer.isDelimiter(b);
    }

    private void indexObjectStreams() {
        for (IndirectObject indirect : objectStreams) {
            PDFStream stream = (PDFStream) indirect.getObject();
            ObjectStream objectStream;
            try {
                objectStream = ObjectStream.load(indirect.getId(), stream, stream.getDecodedData());
            } catch (PDFParseException e) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(MessageFormat.format(L10N.getString("log.repair_skipped"),
                            indirect.getOffset(), e.getMessage()));
                }
                continue;
            }
            int container = indirect.getId().getObjectNumber();
            for (int i = 0; i < objectStream.getObjectCount(); i++) {
                int num = objectStream.getObjectNumber(i);
                if (section.get(num) == null) {
                    section.put(num, CrossReferenceEntry.compressed(container, i));
                    if (catalog == null) {
                        findCatalog(objectStream, i, num);
                    }
                }
            }
        }
    }

    private void findCatalog(ObjectStream objectStream, int index, int num) {
        try {
            PDFObject obj = objectStream.getObject(index, num);
            if (obj instanceof PDFDictionary && ((PDFDictionary) obj).isType(Name.CATALOG)) {
                catalog = new ObjectId(num, 0);
            }
        } catch (PDFParseException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.repair_skipped"),
                        objectStream.getObjectStartOffset(index), e.getMessage()));
            }
        }
    }

    /**
     * Returns the trailer for the rebuilt table. Only the document-level
     * entries of a found trailer are kept.
     */
    private PDFDictionary buildTrailer() {
        PDFDictionary found = findTrailer();
        if (found == null) {
            found = xrefStreamDictionary;
        }
        PDFDictionary trailer = new PDFDictionary();
        if (found != null) {
            Name[] keys = { Name.ROOT, Name.INFO, Name.ENCRYPT, Name.ID };
            for (Name key : keys) {
                PDFObject value = found.get(key);
                if (value != null) {
                    trailer.put(key, value);
                }
            }
        }
        PDFObject root = trailer.get(Name.ROOT);
        boolean rootFound = root instanceof ObjectId
                && section.get(((ObjectId) root).getObjectNumber()) != null;
        if (!rootFound && catalog != null) {
            trailer.put(Name.ROOT, catalog);
        }
        trailer.put(Name.SIZE, PDFNumber.of(section.getEntries().lastKey() + 1));
        return trailer;
    }

    private PDFDictionary findTrailer() {
        int pos = Lexer.lastIndexOf(data, TRAILER, limit);
        while (pos >= 0) {
            Lexer lexer = new Lexer(data);
            lexer.setPosition(pos + TRAILER.length);
            try {
                PDFObject obj = new ObjectParser(lexer).parseObject();
                if (obj instanceof PDFDictionary) {
                    return (PDFDictionary) obj;
                }
            } catch (PDFParseException e) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(MessageFormat.format(L10N.getString("log.repair_skipped"),
                            pos, e.getMessage()));
                }
            }
            pos = Lexer.lastIndexOf(data, TRAILER, pos + TRAILER.length - 1);
        }
        return null;
    }

}
