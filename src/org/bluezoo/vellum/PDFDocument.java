/*
 * PDFDocument.java
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
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A loaded PDF file: the immutable original bytes, the merged
 * cross-reference table, and a cache of the objects parsed so far.
 * <p>
 * Objects are parsed lazily on first access through
 * {@link #getObject(int, int)} and cached by identifier; they are never
 * modified in place. Producing a modified file never edits the buffer
 * held here: see {@link IncrementalUpdateWriter}.
 * <p>
 * Resolving one object may require resolving others, such as the
 * container of a compressed object or an indirect stream length. A
 * reference back to an object that is still being resolved is a cycle
 * and fails with {@link PDFParseException.Kind#INVALID_OBJECT}.
 * <p>
 * Instances are not safe for use by concurrent threads. Distinct
 * documents are independent of each other.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFDocument {

    private static final Logger LOGGER = Logger.getLogger(PDFDocument.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.vellum.L10N");

    private final ByteBuffer data;
    private final String version;
    private final CrossReferenceTable xref;
    private final int lengthTolerance;
    private final boolean repaired;

    private final Map<ObjectId, PDFObject> cache = new HashMap<>();
    private final Map<Integer, ObjectStream> objectStreams = new HashMap<>();
    private final Set<ObjectId> inProgress = new HashSet<>();
    private final Set<ObjectId> warnedLengths = new HashSet<>();
    private final ObjectParser.LengthResolver lengthResolver = new StreamLengthResolver();
    private List<PDFPage> pages;

    PDFDocument(ByteBuffer data, String version, CrossReferenceTable xref,
            int lengthTolerance, boolean repaired) {
        this.data = data;
        this.version = version;
        this.xref = xref;
        this.lengthTolerance = lengthTolerance;
        this.repaired = repaired;
    }

    /**
     * Returns the version from the {@code %PDF-} header.
     *
     * @return the version, such as "1.7", or null if the header was
     *         missing and the file was loaded in repair mode
     */
    public String getVersion() {
        return version;
    }

    public CrossReferenceTable getCrossReferenceTable() {
        return xref;
    }

    /**
     * Indicates whether the cross-reference table was rebuilt by scanning
     * the file.
     *
     * @return true if the file was loaded in repair mode and its own
     *         cross-reference data was unusable
     */
    public boolean isRepaired() {
        return repaired;
    }

    /**
     * Returns a read-only view of the original file contents.
     *
     * @return the file contents, positioned at 0
     */
    public ByteBuffer getData() {
        return data.duplicate();
    }

    /**
     * Returns the length of the original file in bytes.
     *
     * @return the length
     */
    public int length() {
        return data.limit();
    }

    // ========================================================================
    // Object resolution
    // ========================================================================

    /**
     * Returns the object with the given identifier.
     *
     * @param id the identifier
     * @return the object, or {@link PDFNull#INSTANCE} if it is free or not
     *         described by the cross-reference table
     * @throws PDFParseException if the object cannot be parsed
     */
    public PDFObject getObject(ObjectId id) {
        PDFObject cached = cache.get(id);
        if (cached != null) {
            if (cached instanceof PDFStream && ((PDFStream) cached).isLengthProvisional()) {
                cached = validateLength(id, (PDFStream) cached);
                cache.put(id, cached);
            }
            return cached;
        }
        int num = id.getObjectNumber();
        CrossReferenceEntry entry = xref.get(num);
        if (entry == null || entry.isFree()) {
            return PDFNull.INSTANCE;
        }
        if (entry.getGeneration() != id.getGenerationNumber()) {
            return PDFNull.INSTANCE;
        }
        if (!inProgress.add(id)) {
            throw PDFParseException.invalidObject("Reference cycle resolving " + id, -1);
        }
        try {
            PDFObject obj;
            if (entry.isInUse()) {
                obj = loadObject(id, entry.getOffset());
            } else {
                obj = loadCompressedObject(id, entry);
            }
            cache.put(id, obj);
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer(MessageFormat.format(L10N.getString("log.object_loaded"), id, entry));
            }
            return obj;
        } finally {
            inProgress.remove(id);
        }
    }

    /**
     * Returns the object with the given number and generation.
     *
     * @param num the object number
     * @param gen the generation number
     * @return the object, or {@link PDFNull#INSTANCE}
     */
    public PDFObject getObject(int num, int gen) {
        return getObject(new ObjectId(num, gen));
    }

    private PDFObject loadObject(ObjectId id, long offset) {
        if (offset < 0 || offset >= data.limit()) {
            throw PDFParseException.invalidObject("Offset " + offset + " of object " + id
                    + " is outside the file", offset);
        }
        Lexer lexer = new Lexer(data);
        lexer.setPosition((int) offset);
        ObjectParser parser = new ObjectParser(lexer);
        parser.setLengthResolver(lengthResolver);
        parser.setRecoverLength(repaired);
        IndirectObject indirect = parser.parseIndirectObject();
        if (!indirect.getId().equals(id)) {
            throw PDFParseException.invalidObject("Expected object " + id + " but found "
                    + indirect.getId(), offset);
        }
        PDFObject obj = indirect.getObject();
        if (obj instanceof PDFStream && ((PDFStream) obj).isLengthProvisional()) {
            obj = validateLength(id, (PDFStream) obj);
        }
        return obj;
    }

    private PDFObject loadCompressedObject(ObjectId id, CrossReferenceEntry entry) {
        int container = entry.getObjectStreamNumber();
        ObjectStream objectStream = objectStreams.get(container);
        if (objectStream == null) {
            ObjectId containerId = new ObjectId(container, 0);
            PDFObject obj = getObject(containerId);
            if (!(obj instanceof PDFStream)) {
                throw PDFParseException.invalidObject("Container " + containerId + " of object " + id
                        + " is not a stream", -1);
            }
            PDFStream stream = (PDFStream) obj;
            objectStream = ObjectStream.load(containerId, stream, decodeStreamInternal(stream));
            objectStreams.put(container, objectStream);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.object_stream_loaded"),
                        containerId, objectStream.getObjectCount()));
            }
        }
        return objectStream.getObject(entry.getIndexInStream(), id.getObjectNumber());
    }

    /**
     * Checks a stream whose payload was delimited by scanning for
     * {@code endstream} against its /Length. While the length object cannot
     * yet be resolved, because resolving it depends on an object still in
     * progress, the stream is returned unchanged and checked again on a
     * later access.
     */
    private PDFStream validateLength(ObjectId id, PDFStream stream) {
        ObjectId lengthRef = (ObjectId) stream.getDictionary().get(Name.LENGTH);
        if (!isResolvable(lengthRef)) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.length_deferred"), id, lengthRef));
            }
            return stream;
        }
        PDFObject value = getObject(lengthRef);
        if (value instanceof PDFNull) {
            if (warnedLengths.add(id)) {
                LOGGER.warning(MessageFormat.format(L10N.getString("warn.provisional_length"),
                        id, lengthRef));
            }
            return stream;
        }
        if (!(value instanceof PDFNumber) || !((PDFNumber) value).isInteger()) {
            throw PDFParseException.invalidObject("Length " + lengthRef + " of stream " + id
                    + " is not an integer", stream.getDataOffset());
        }
        long length = ((PDFNumber) value).longValue();
        int scanned = stream.getRawLength();
        if (Math.abs(length - scanned) > lengthTolerance) {
            throw PDFParseException.corruptedFile("Stream " + id + " has /Length " + length
                    + " but " + scanned + " bytes precede endstream", stream.getDataOffset());
        }
        if (length == scanned) {
            return new PDFStream(stream.getDictionary(), stream.rawData(), stream.getDataOffset(), false);
        }
        int start = stream.getDataOffset();
        if (length < 0 || start + length > data.limit()) {
            throw PDFParseException.corruptedFile("Stream " + id + " extends beyond end of file", start);
        }
        byte[] raw = new byte[(int) length];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = data.get(start + i);
        }
        return new PDFStream(stream.getDictionary(), raw, start, false);
    }

    /**
     * Indicates whether an object can be resolved without reentering an
     * object that is still being resolved.
     */
    private boolean isResolvable(ObjectId ref) {
        if (inProgress.contains(ref)) {
            return false;
        }
        CrossReferenceEntry entry = xref.get(ref.getObjectNumber());
        if (entry != null && entry.isCompressed()) {
            return !inProgress.contains(new ObjectId(entry.getObjectStreamNumber(), 0));
        }
        return true;
    }

    /**
     * Supplies indirect stream lengths to the object parser.
     */
    private class StreamLengthResolver implements ObjectParser.LengthResolver {

        @Override
        public int resolveLength(ObjectId ref) {
            if (!isResolvable(ref)) {
                return -1;
            }
            PDFObject value = getObject(ref);
            if (value instanceof PDFNumber && ((PDFNumber) value).isInteger()
                    && ((PDFNumber) value).longValue() >= 0) {
                return ((PDFNumber) value).intValue();
            }
            return -1;
        }

    }

    /**
     * Dereferences one level: if the object is a reference, returns the
     * object it denotes, otherwise returns the object itself.
     *
     * @param obj the object, may be null
     * @return the resolved object, or null if obj was null
     */
    public PDFObject resolve(PDFObject obj) {
        if (obj instanceof ObjectId) {
            return getObject((ObjectId) obj);
        }
        return obj;
    }

    /**
     * Returns a copy of the object in which every reference, at any depth,
     * has been replaced by the object it denotes.
     *
     * @param obj the object
     * @return the resolved copy
     * @throws PDFParseException of kind INVALID_OBJECT if the object graph
     *         contains a cycle through references
     */
    public PDFObject resolveAll(PDFObject obj) {
        return resolveAll(obj, new HashSet<ObjectId>());
    }

    private PDFObject resolveAll(PDFObject obj, Set<ObjectId> path) {
        switch (obj.getKind()) {
            case REFERENCE:
                ObjectId id = (ObjectId) obj;
                if (!path.add(id)) {
                    throw PDFParseException.invalidObject("Reference cycle through " + id, -1);
                }
                try {
                    return resolveAll(getObject(id), path);
                } finally {
                    path.remove(id);
                }
            case ARRAY:
                PDFArray array = new PDFArray();
                for (PDFObject element : (PDFArray) obj) {
                    array.add(resolveAll(element, path));
                }
                return array;
            case DICTIONARY:
                return resolveDictionary((PDFDictionary) obj, path);
            case STREAM:
                PDFStream stream = (PDFStream) obj;
                return new PDFStream(resolveDictionary(stream.getDictionary(), path), stream.rawData());
            default:
                return obj;
        }
    }

    private PDFDictionary resolveDictionary(PDFDictionary dict, Set<ObjectId> path) {
        PDFDictionary result = new PDFDictionary();
        for (Map.Entry<Name, PDFObject> entry : dict.entrySet()) {
            result.put(entry.getKey(), resolveAll(entry.getValue(), path));
        }
        return result;
    }

    /**
     * Decodes a stream's payload through its filters, resolving an
     * indirect /Filter or /DecodeParms first. The result is cached on the
     * stream.
     *
     * @param stream the stream
     * @return the decoded bytes
     * @throws PDFParseException if the payload cannot be decoded
     */
    public byte[] decodeStream(PDFStream stream) {
        return decodeStreamInternal(stream).clone();
    }

    private byte[] decodeStreamInternal(PDFStream stream) {
        PDFDictionary dict = stream.getDictionary();
        PDFObject filter = resolve(dict.get(Name.FILTER));
        PDFObject parms = resolve(dict.get(Name.DECODE_PARMS));
        if (filter instanceof PDFArray) {
            filter = resolveElements((PDFArray) filter);
        }
        if (parms instanceof PDFArray) {
            parms = resolveElements((PDFArray) parms);
        }
        return stream.decode(filter, parms);
    }

    private PDFArray resolveElements(PDFArray array) {
        PDFArray result = new PDFArray();
        for (PDFObject element : array) {
            result.add(resolve(element));
        }
        return result;
    }

    // ========================================================================
    // Trailer and catalog
    // ========================================================================

    /**
     * Returns the trailer of the newest cross-reference section.
     *
     * @return the trailer dictionary
     */
    public PDFDictionary getTrailer() {
        return xref.getTrailer();
    }

    /**
     * Returns the reference to the document catalog held in the trailer.
     *
     * @return the /Root reference, or null if the trailer has none
     */
    public ObjectId getRootReference() {
        PDFObject root = getTrailer().get(Name.ROOT);
        return (root instanceof ObjectId) ? (ObjectId) root : null;
    }

    /**
     * Returns the document catalog.
     *
     * @return the catalog dictionary
     * @throws PDFParseException of kind INVALID_OBJECT if /Root does not
     *         resolve to a dictionary
     */
    public PDFDictionary getCatalog() {
        PDFObject catalog = resolve(getTrailer().get(Name.ROOT));
        if (!(catalog instanceof PDFDictionary)) {
            throw PDFParseException.invalidObject("Trailer /Root does not resolve to a dictionary", -1);
        }
        return (PDFDictionary) catalog;
    }

    /**
     * Returns the document information dictionary.
     *
     * @return the /Info dictionary, or null if absent
     */
    public PDFDictionary getInfo() {
        PDFObject info = resolve(getTrailer().get(Name.INFO));
        return (info instanceof PDFDictionary) ? (PDFDictionary) info : null;
    }

    public boolean isEncrypted() {
        return getTrailer().get(Name.ENCRYPT) != null;
    }

    /**
     * Returns the encryption dictionary. Decryption itself is left to
     * collaborators that implement the security handlers.
     *
     * @return the /Encrypt dictionary, or null if the file is not encrypted
     */
    public PDFDictionary getEncryptDictionary() {
        PDFObject encrypt = resolve(getTrailer().get(Name.ENCRYPT));
        return (encrypt instanceof PDFDictionary) ? (PDFDictionary) encrypt : null;
    }

    /**
     * Indicates whether the first object in the file is a linearization
     * parameter dictionary.
     *
     * @return true if the file is linearized
     */
    public boolean isLinearized() {
        Lexer lexer = new Lexer(data);
        int header = Lexer.indexOf(data, PDFParser.HEADER, 0, Math.min(data.limit(), PDFParser.HEADER_SEARCH));
        if (header < 0) {
            return false;
        }
        lexer.setPosition(header);
        try {
            IndirectObject first = new ObjectParser(lexer).parseIndirectObject();
            PDFObject obj = first.getObject();
            return obj instanceof PDFDictionary && ((PDFDictionary) obj).containsKey(Name.LINEARIZED);
        } catch (PDFParseException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, "No linearization dictionary", e);
            }
            return false;
        }
    }

    /**
     * Returns one past the highest object number in the merged table, the
     * first number available for a new object.
     *
     * @return the next object number
     */
    public int getNextObjectId() {
        return xref.getMaxObjectNumber() + 1;
    }

    /**
     * Returns the number of entries in the merged cross-reference table,
     * including free entries.
     *
     * @return the entry count
     */
    public int getObjectCount() {
        return xref.size();
    }

    // ========================================================================
    // Page tree
    // ========================================================================

    /**
     * Returns the pages of the document in order.
     *
     * @return the pages
     * @throws PDFParseException of kind INVALID_OBJECT if the page tree is
     *         malformed or cyclic
     */
    public List<PDFPage> getPages() {
        if (pages == null) {
            List<PDFPage> result = new ArrayList<>();
            PDFObject root = getCatalog().get(Name.PAGES);
            if (root == null) {
                throw PDFParseException.invalidObject("Catalog has no /Pages", -1);
            }
            collectPages(root, null, null, null, 0, new HashSet<ObjectId>(), result);
            pages = Collections.unmodifiableList(result);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.pages_loaded"), result.size()));
            }
        }
        return pages;
    }

    private void collectPages(PDFObject nodeRef, PDFObject resources, PDFObject mediaBox,
            PDFObject cropBox, int rotate, Set<ObjectId> path, List<PDFPage> out) {
        ObjectId id = (nodeRef instanceof ObjectId) ? (ObjectId) nodeRef : null;
        if (id != null && !path.add(id)) {
            throw PDFParseException.invalidObject("Page tree cycle through " + id, -1);
        }
        try {
            PDFObject node = resolve(nodeRef);
            if (!(node instanceof PDFDictionary)) {
                throw PDFParseException.invalidObject("Page tree node " + nodeRef
                        + " is not a dictionary", -1);
            }
            PDFDictionary dict = (PDFDictionary) node;
            if (dict.containsKey(Name.RESOURCES)) {
                resources = dict.get(Name.RESOURCES);
            }
            if (dict.containsKey(Name.MEDIA_BOX)) {
                mediaBox = dict.get(Name.MEDIA_BOX);
            }
            if (dict.containsKey(Name.CROP_BOX)) {
                cropBox = dict.get(Name.CROP_BOX);
            }
            PDFObject rotateValue = resolve(dict.get(Name.ROTATE));
            if (rotateValue instanceof PDFNumber) {
                rotate = ((PDFNumber) rotateValue).intValue();
            }
            boolean isPages = dict.isType(Name.PAGES)
                    || (!dict.isType(Name.PAGE) && dict.containsKey(Name.KIDS));
            if (isPages) {
                PDFObject kids = resolve(dict.get(Name.KIDS));
                if (!(kids instanceof PDFArray)) {
                    throw PDFParseException.invalidObject("Pages node " + nodeRef + " has no /Kids array", -1);
                }
                for (PDFObject kid : (PDFArray) kids) {
                    collectPages(kid, resources, mediaBox, cropBox, rotate, path, out);
                }
            } else {
                out.add(new PDFPage(out.size(), id, dict, resources, mediaBox, cropBox, rotate));
            }
        } finally {
            if (id != null) {
                path.remove(id);
            }
        }
    }

    /**
     * Returns the page at the given index.
     *
     * @param index the 0-based page index
     * @return the page
     * @throws IndexOutOfBoundsException if there is no such page
     */
    public PDFPage getPage(int index) {
        return getPages().get(index);
    }

    public int getPageCount() {
        return getPages().size();
    }

    /**
     * Returns the decoded content of a page: its content stream, or the
     * concatenation of its content streams separated by newlines.
     *
     * @param index the 0-based page index
     * @return the content bytes, empty if the page has no /Contents
     */
    public byte[] getPageContents(int index) {
        PDFObject contents = resolve(getPage(index).getDictionary().get(Name.CONTENTS));
        if (contents == null || contents instanceof PDFNull) {
            return new byte[0];
        }
        if (contents instanceof PDFStream) {
            return decodeStream((PDFStream) contents);
        }
        if (!(contents instanceof PDFArray)) {
            throw PDFParseException.invalidObject("Invalid /Contents on page " + index, -1);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        boolean first = true;
        for (PDFObject element : (PDFArray) contents) {
            PDFObject stream = resolve(element);
            if (!(stream instanceof PDFStream)) {
                throw PDFParseException.invalidObject("Invalid /Contents element on page " + index, -1);
            }
            if (!first) {
                out.write('\n');
            }
            byte[] bytes = decodeStreamInternal((PDFStream) stream);
            out.write(bytes, 0, bytes.length);
            first = false;
        }
        return out.toByteArray();
    }

    @Override
    public String toString() {
        return "PDFDocument[version=" + version + ", " + xref + "]";
    }

}
