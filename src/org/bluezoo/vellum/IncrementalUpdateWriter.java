/*
 * IncrementalUpdateWriter.java
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
 * Appends changed and new objects to an existing file as an incremental
 * update.
 * <p>
 * The original bytes are never rewritten: the output begins with an exact
 * copy of them, followed by the serialized objects, a classic
 * cross-reference section describing only those objects, and a trailer
 * whose /Prev points at the previous section. Byte ranges covered by
 * existing signatures therefore stay valid across any number of updates.
 * <p>
 * Every feature that modifies a document (filling form fields, flattening,
 * signing, encrypting) expresses its changes through this class.
 * <pre>
 * IncrementalUpdateWriter writer = new IncrementalUpdateWriter(doc);
 * ObjectId annot = writer.allocateObjectNumber();
 * writer.put(annot.getObjectNumber(), annotation);
 * writer.put(pageId.getObjectNumber(), updatedPage);
 * byte[] updated = writer.write();
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class IncrementalUpdateWriter {

    private static final Logger LOGGER = Logger.getLogger(IncrementalUpdateWriter.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.vellum.L10N");

    private final PDFDocument document;
    private final SortedMap<Integer, byte[]> changes = new TreeMap<>();
    private int nextObjectNumber;
    private boolean carryEncryption = true;

    /**
     * Creates a writer for changes to the given document.
     *
     * @param document the document to update
     */
    public IncrementalUpdateWriter(PDFDocument document) {
        this.document = document;
        this.nextObjectNumber = document.getNextObjectId();
    }

    /**
     * Indicates whether /Encrypt and /ID are copied into the new trailer.
     *
     * @return true if they are carried forward
     */
    public boolean isCarryEncryption() {
        return carryEncryption;
    }

    /**
     * Sets whether /Encrypt and /ID are copied from the prior trailer into
     * the new one. This is on by default, so that an update to an
     * encrypted file remains readable with the same security handler.
     *
     * @param carryEncryption false to omit them
     */
    public void setCarryEncryption(boolean carryEncryption) {
        this.carryEncryption = carryEncryption;
    }

    /**
     * Reserves a number for a new object.
     *
     * @return the identifier of the new object, with generation 0
     */
    public ObjectId allocateObjectNumber() {
        return new ObjectId(nextObjectNumber++, 0);
    }

    /**
     * Adds a new object or a full replacement of an existing one. The
     * object is serialized immediately.
     *
     * @param objectNumber the object number
     * @param obj the object
     * @throws PDFWriteException if the object cannot be serialized, or if
     *         it would replace an object with a non-zero generation
     */
    public void put(int objectNumber, PDFObject obj) {
        putSerialized(objectNumber, ObjectWriter.toBytes(obj));
    }

    /**
     * Adds an object already serialized by the caller. The bytes must be
     * the object's value only, without the {@code obj} header.
     *
     * @param objectNumber the object number
     * @param serialized the serialized value
     * @throws PDFWriteException if it would replace an object with a
     *         non-zero generation
     */
    public void putSerialized(int objectNumber, byte[] serialized) {
        if (objectNumber <= 0) {
            throw new IllegalArgumentException("Invalid object number: " + objectNumber);
        }
        CrossReferenceEntry existing = document.getCrossReferenceTable().get(objectNumber);
        if (existing != null && existing.isInUse() && existing.getGeneration() != 0) {
            throw new PDFWriteException("Object " + objectNumber + " has generation "
                    + existing.getGeneration() + " and cannot be replaced at generation 0");
        }
        changes.put(objectNumber, serialized.clone());
        if (objectNumber >= nextObjectNumber) {
            nextObjectNumber = objectNumber + 1;
        }
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /**
     * Produces the updated file.
     *
     * @return the original bytes followed by the update, or a copy of the
     *         original bytes if there are no changes
     * @throws PDFWriteException if the update cannot be written
     */
    public byte[] write() {
        int size = (int) Math.max(document.getTrailer().getInteger(Name.SIZE, 0), nextObjectNumber);
        return append(document.getData(), changes, document.getTrailer(), size, carryEncryption);
    }

    /**
     * Writes the updated file to a channel.
     *
     * @param channel the channel to write to
     * @throws IOException if an I/O error occurs
     * @throws PDFWriteException if the update cannot be written
     */
    public void writeTo(WritableByteChannel channel) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(write());
        while (buf.hasRemaining()) {
            channel.write(buf);
        }
    }

    /**
     * Appends an incremental update to a file.
     *
     * @param original the original file, from 0 to its limit
     * @param changes the serialized values of the new and replaced objects,
     *        by object number
     * @param priorTrailer the trailer of the newest existing section
     * @param size the minimum /Size for the new trailer
     * @param carryEncryption whether to copy /Encrypt and /ID forward
     * @return the updated file
     * @throws PDFWriteException if the original has no {@code startxref}
     */
    public static byte[] append(ByteBuffer original, SortedMap<Integer, byte[]> changes,
            PDFDictionary priorTrailer, int size, boolean carryEncryption) {
        int length = original.limit();
        byte[] prefix = new byte[length];
        for (int i = 0; i < length; i++) {
            prefix[i] = original.get(i);
        }
        if (changes.isEmpty()) {
            return prefix;
        }
        long prev = XrefResolver.findStartxref(original, length);
        if (prev < 0) {
            throw new PDFWriteException("Cannot append to a file without startxref");
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(length + 1024);
        out.write(prefix, 0, length);
        if (length == 0 || (prefix[length - 1] != '\n' && prefix[length - 1] != '\r')) {
            out.write('\n');
        }
        SortedMap<Integer, Integer> offsets = new TreeMap<>();
        for (Map.Entry<Integer, byte[]> change : changes.entrySet()) {
            offsets.put(change.getKey(), out.size());
            ObjectWriter.writeAscii(out, change.getKey() + " 0 obj\n");
            byte[] value = change.getValue();
            out.write(value, 0, value.length);
            ObjectWriter.writeAscii(out, "\nendobj\n");
        }

        int xrefOffset = out.size();
        ObjectWriter.writeAscii(out, "xref\n");
        writeSubsections(offsets, out);

        PDFDictionary trailer = new PDFDictionary();
        trailer.put(Name.SIZE, PDFNumber.of(Math.max(size, changes.lastKey() + 1)));
        copy(priorTrailer, trailer, Name.ROOT);
        copy(priorTrailer, trailer, Name.INFO);
        if (carryEncryption) {
            copy(priorTrailer, trailer, Name.ENCRYPT);
            copy(priorTrailer, trailer, Name.ID);
        }
        trailer.put(Name.PREV, PDFNumber.of(prev));
        ObjectWriter.writeAscii(out, "trailer\n");
        ObjectWriter.write(trailer, out);
        ObjectWriter.writeAscii(out, "\nstartxref\n" + xrefOffset + "\n%%EOF\n");

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("log.update_appended"),
                    changes.size(), xrefOffset, prev));
        }
        return out.toByteArray();
    }

    /**
     * Writes the entries as minimal runs of consecutive object numbers.
     */
    private static void writeSubsections(SortedMap<Integer, Integer> offsets, ByteArrayOutputStream out) {
        Integer[] numbers = offsets.keySet().toArray(new Integer[offsets.size()]);
        int start = 0;
        while (start < numbers.length) {
            int end = start + 1;
            while (end < numbers.length && numbers[end] == numbers[end - 1] + 1) {
                end++;
            }
            ObjectWriter.writeAscii(out, numbers[start] + " " + (end - start) + "\n");
            for (int i = start; i < end; i++) {
                ObjectWriter.writeAscii(out, String.format("%010d 00000 n \n", offsets.get(numbers[i])));
            }
            start = end;
        }
    }

    private static void copy(PDFDictionary from, PDFDictionary to, Name key) {
        PDFObject value = from.get(key);
        if (value != null) {
            to.put(key, value);
        }
    }

}
