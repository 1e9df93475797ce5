/*
 * PDFWriter.java
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
import java.nio.channels.WritableByteChannel;
import java.text.MessageFormat;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a complete PDF file from a set of numbered objects.
 * <p>
 * The file consists of the header and a binary comment line, the objects
 * in ascending object number order, and a single cross-reference section:
 * either a classic table, in which unused object numbers form the free
 * list, or a FlateDecode-compressed cross-reference stream.
 * <p>
 * All objects are written at generation 0.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFWriter {

    private static final Logger LOGGER = Logger.getLogger(PDFWriter.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.vellum.L10N");

    private static final Name FLATE_DECODE = new Name("FlateDecode");

    /**
     * The format of the cross-reference section.
     */
    public enum XrefFormat {
        TABLE,
        STREAM
    }

    private final SortedMap<Integer, PDFObject> objects = new TreeMap<>();
    private final PDFDictionary trailer = new PDFDictionary();
    private XrefFormat xrefFormat = XrefFormat.TABLE;
    private String version = "1.7";
    private int nextObjectNumber = 1;

    public XrefFormat getXrefFormat() {
        return xrefFormat;
    }

    public void setXrefFormat(XrefFormat xrefFormat) {
        this.xrefFormat = xrefFormat;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Sets the version written in the header. Cross-reference streams
     * require version 1.5 or later.
     *
     * @param version the version, such as "1.7"
     */
    public void setVersion(String version) {
        this.version = version;
    }

    /**
     * Adds an object under the next unused object number.
     *
     * @param obj the object
     * @return its identifier
     */
    public ObjectId add(PDFObject obj) {
        ObjectId id = new ObjectId(nextObjectNumber, 0);
        put(nextObjectNumber, obj);
        return id;
    }

    /**
     * Sets the object with the given number, replacing any previous one.
     *
     * @param objectNumber the object number, at least 1
     * @param obj the object
     */
    public void put(int objectNumber, PDFObject obj) {
        if (objectNumber <= 0) {
            throw new IllegalArgumentException("Invalid object number: " + objectNumber);
        }
        if (obj instanceof ObjectId) {
            throw new IllegalArgumentException("An indirect object cannot be a reference");
        }
        objects.put(objectNumber, obj);
        if (objectNumber >= nextObjectNumber) {
            nextObjectNumber = objectNumber + 1;
        }
    }

    public void setRoot(ObjectId root) {
        trailer.put(Name.ROOT, root);
    }

    public void setInfo(ObjectId info) {
        trailer.put(Name.INFO, info);
    }

    /**
     * Sets an additional trailer entry, such as /ID.
     *
     * @param key the key
     * @param value the value
     */
    public void setTrailerEntry(Name key, PDFObject value) {
        trailer.put(key, value);
    }

    /**
     * Writes the file.
     *
     * @return the file contents
     * @throws PDFWriteException if no /Root has been set or an object
     *         cannot be serialized
     */
    public byte[] write() {
        if (trailer.get(Name.ROOT) == null) {
            throw new PDFWriteException("No document catalog set");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ObjectWriter.writeAscii(out, "%PDF-" + version + "\n");
        out.write('%');
        out.write(0xe2);
        out.write(0xe3);
        out.write(0xcf);
        out.write(0xd3);
        out.write('\n');

        SortedMap<Integer, Integer> offsets = new TreeMap<>();
        for (Map.Entry<Integer, PDFObject> entry : objects.entrySet()) {
            offsets.put(entry.getKey(), out.size());
            ObjectWriter.writeIndirect(new ObjectId(entry.getKey(), 0), entry.getValue(), out);
        }
        int size = objects.isEmpty() ? 1 : objects.lastKey() + 1;
        int xrefOffset = out.size();
        if (xrefFormat == XrefFormat.STREAM) {
            writeXrefStream(offsets, size, xrefOffset, out);
        } else {
            writeXrefTable(offsets, size, out);
        }
        ObjectWriter.writeAscii(out, "startxref\n" + xrefOffset + "\n%%EOF\n");
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("log.file_written"),
                    objects.size(), xrefFormat, out.size()));
        }
        return out.toByteArray();
    }

    /**
     * Writes the file to a channel.
     *
     * @param channel the channel to write to
     * @throws IOException if an I/O error occurs
     */
    public void writeTo(WritableByteChannel channel) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(write());
        while (buf.hasRemaining()) {
            channel.write(buf);
        }
    }

    private void writeXrefTable(SortedMap<Integer, Integer> offsets, int size, ByteArrayOutputStream out) {
        ObjectWriter.writeAscii(out, "xref\n0 " + size + "\n");
        for (int num = 0; num < size; num++) {
            Integer offset = offsets.get(num);
            if (offset != null) {
                ObjectWriter.writeAscii(out, String.format("%010d 00000 n \n", offset));
            } else {
                int generation = (num == 0) ? 65535 : 0;
                ObjectWriter.writeAscii(out, String.format("%010d %05d f \n",
                        nextFree(offsets, num, size), generation));
            }
        }
        PDFDictionary dict = new PDFDictionary(trailer);
        dict.put(Name.SIZE, PDFNumber.of(size));
        ObjectWriter.writeAscii(out, "trailer\n");
        ObjectWriter.write(dict, out);
        ObjectWriter.writeAscii(out, "\n");
    }

    private void writeXrefStream(SortedMap<Integer, Integer> offsets, int size, int xrefOffset,
            ByteArrayOutputStream out) {
        int xrefNumber = size;
        size++;
        int offsetWidth = 1;
        while (offsetWidth < 4 && (xrefOffset >>> (offsetWidth * 8)) != 0) {
            offsetWidth++;
        }
        int entrySize = 1 + offsetWidth + 2;
        byte[] records = new byte[size * entrySize];
        for (int num = 0; num < size; num++) {
            int pos = num * entrySize;
            if (num == xrefNumber) {
                records[pos] = 1;
                putField(records, pos + 1, offsetWidth, xrefOffset);
            } else if (offsets.containsKey(num)) {
                records[pos] = 1;
                putField(records, pos + 1, offsetWidth, offsets.get(num));
            } else {
                records[pos] = 0;
                putField(records, pos + 1, offsetWidth, nextFree(offsets, num, xrefNumber));
                putField(records, pos + 1 + offsetWidth, 2, (num == 0) ? 65535 : 0);
            }
        }
        PDFDictionary dict = new PDFDictionary(trailer);
        dict.put(Name.TYPE, Name.XREF);
        dict.put(Name.SIZE, PDFNumber.of(size));
        dict.put(Name.W, PDFArray.ofIntegers(1, offsetWidth, 2));
        PDFStream stream = PDFStream.encode(dict, records, FLATE_DECODE);
        ObjectWriter.writeIndirect(new ObjectId(xrefNumber, 0), stream, out);
    }

    /**
     * Returns the next unused object number after num, or 0 at the end of
     * the free list.
     */
    private static int nextFree(SortedMap<Integer, Integer> offsets, int num, int limit) {
        for (int next = num + 1; next < limit; next++) {
            if (!offsets.containsKey(next)) {
                return next;
            }
        }
        return 0;
    }

    private static void putField(byte[] records, int pos, int width, long value) {
        for (int i = width - 1; i >= 0; i--) {
            records[pos + i] = (byte) (value & 0xff);
            value >>>= 8;
        }
    }

}
