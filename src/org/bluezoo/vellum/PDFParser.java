/*
 * PDFParser.java
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
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads PDF files into {@link PDFDocument}s.
 * <p>
 * Loading reads the header and the cross-reference data only. The body
 * objects are parsed lazily as the document is navigated.
 * <p>
 * Example usage:
 * <pre>
 * PDFParser parser = new PDFParser();
 * parser.setRepairEnabled(true);
 * PDFDocument doc = parser.parse(Paths.get("document.pdf"));
 * for (PDFPage page : doc.getPages()) {
 *     byte[] content = doc.getPageContents(page.getIndex());
 * }
 * </pre>
 * <p>
 * A parser holds only its settings and may be reused for any number of
 * files.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFParser {

    private static final Logger LOGGER = Logger.getLogger(PDFParser.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.vellum.L10N");

    static final byte[] HEADER = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    /**
     * The header must begin within this many bytes of the start of the file.
     */
    static final int HEADER_SEARCH = 1024;

    /**
     * The default number of bytes by which a stream's resolved /Length may
     * differ from the scanned length of its payload.
     */
    public static final int DEFAULT_STREAM_LENGTH_TOLERANCE = 2;

    private boolean repairEnabled;
    private int streamLengthTolerance = DEFAULT_STREAM_LENGTH_TOLERANCE;

    /**
     * Indicates whether files with unusable cross-reference data are
     * rebuilt by scanning for objects.
     *
     * @return true if repair is enabled
     */
    public boolean isRepairEnabled() {
        return repairEnabled;
    }

    /**
     * Sets whether files with a missing header or unusable cross-reference
     * data are rebuilt by scanning for objects. Repair is off by default.
     *
     * @param repairEnabled true to enable repair
     */
    public void setRepairEnabled(boolean repairEnabled) {
        this.repairEnabled = repairEnabled;
    }

    public int getStreamLengthTolerance() {
        return streamLengthTolerance;
    }

    /**
     * Sets how far a resolved indirect /Length may differ from the scanned
     * payload length before the file is considered corrupt.
     *
     * @param streamLengthTolerance the tolerance in bytes
     * @throws IllegalArgumentException if the tolerance is negative
     */
    public void setStreamLengthTolerance(int streamLengthTolerance) {
        if (streamLengthTolerance < 0) {
            throw new IllegalArgumentException("Negative tolerance: " + streamLengthTolerance);
        }
        this.streamLengthTolerance = streamLengthTolerance;
    }

    /**
     * Loads a document from bytes. The array is not copied and must not be
     * modified while the document is in use.
     *
     * @param data the file contents
     * @return the document
     * @throws PDFParseException if the file cannot be loaded
     */
    public PDFDocument parse(byte[] data) {
        return parse(ByteBuffer.wrap(data));
    }

    /**
     * Loads a document from a buffer. The contents between 0 and the
     * buffer's limit are taken to be the file.
     *
     * @param data the file contents
     * @return the document
     * @throws PDFParseException if the file cannot be loaded
     */
    public PDFDocument parse(ByteBuffer data) {
        ByteBuffer buf = data.duplicate();
        buf.position(0);
        buf = buf.asReadOnlyBuffer();

        String version = readVersion(buf);
        if (version == null && !repairEnabled) {
            throw PDFParseException.corruptedFile("No %PDF- header in the first "
                    + HEADER_SEARCH + " bytes", 0);
        }
        CrossReferenceTable xref;
        boolean repaired = false;
        try {
            xref = new XrefResolver(buf).resolve();
        } catch (PDFParseException e) {
            if (!repairEnabled) {
                throw e;
            }
            LOGGER.log(Level.WARNING, MessageFormat.format(L10N.getString("warn.repair"),
                    e.getMessage()), e);
            xref = new RepairScanner(buf).scan();
            repaired = true;
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("log.document_loaded"),
                    version, xref.size(), xref.getSections().size()));
        }
        return new PDFDocument(buf, version, xref, streamLengthTolerance, repaired);
    }

    /**
     * Loads a document from a channel. The whole channel is read into
     * memory from position 0.
     *
     * @param channel the channel to read from
     * @return the document
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if the file cannot be loaded
     */
    public PDFDocument parse(SeekableByteChannel channel) throws IOException {
        long size = channel.size();
        if (size > Integer.MAX_VALUE) {
            throw new IOException("File too large: " + size + " bytes");
        }
        ByteBuffer buf = ByteBuffer.allocate((int) size);
        channel.position(0);
        while (buf.hasRemaining()) {
            if (channel.read(buf) < 0) {
                break;
            }
        }
        buf.flip();
        return parse(buf);
    }

    /**
     * Loads a document from a file.
     *
     * @param path the file
     * @return the document
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if the file cannot be loaded
     */
    public PDFDocument parse(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return parse(channel);
        }
    }

    /**
     * Reads the version following the {@code %PDF-} header.
     *
     * @return the version, or null if there is no header
     */
    static String readVersion(ByteBuffer data) {
        int pos = Lexer.indexOf(data, HEADER, 0, Math.min(data.limit(), HEADER_SEARCH));
        if (pos < 0) {
            return null;
        }
        StringBuilder version = new StringBuilder();
        for (int i = pos + HEADER.length; i < data.limit(); i++) {
            int c = data.get(i) & 0xff;
            if ((c >= '0' && c <= '9') || c == '.') {
                version.append((char) c);
            } else {
                break;
            }
        }
        return version.toString();
    }

}
