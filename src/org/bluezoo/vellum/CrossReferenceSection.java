/*
 * CrossReferenceSection.java
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

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One cross-reference section of a file: a classic table or a
 * cross-reference stream, written by one save, together with its trailer.
 * <p>
 * A classic table in a hybrid file may carry a supplementary
 * cross-reference stream (named by /XRefStm in its trailer) whose entries
 * have been merged into this section.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CrossReferenceSection {

    /**
     * Section formats.
     */
    public enum Format {
        /** A classic {@code xref} table. */
        TABLE,
        /** A cross-reference stream. */
        STREAM,
        /** A table rebuilt by scanning the file in repair mode. */
        REPAIRED
    }

    private final int offset;
    private final Format format;
    private final SortedMap<Integer, CrossReferenceEntry> entries = new TreeMap<>();
    private PDFDictionary trailer;

    CrossReferenceSection(int offset, Format format) {
        this.offset = offset;
        this.format = format;
    }

    /**
     * Returns the byte offset of this section in the file.
     *
     * @return the offset, or -1 for a repaired table
     */
    public int getOffset() {
        return offset;
    }

    public Format getFormat() {
        return format;
    }

    /**
     * Returns the trailer dictionary. For a cross-reference stream this is
     * the stream dictionary.
     *
     * @return the trailer
     */
    public PDFDictionary getTrailer() {
        return trailer;
    }

    void setTrailer(PDFDictionary trailer) {
        this.trailer = trailer;
    }

    /**
     * Returns the entries of this section, keyed by object number.
     *
     * @return an unmodifiable view of the entries
     */
    public SortedMap<Integer, CrossReferenceEntry> getEntries() {
        return Collections.unmodifiableSortedMap(entries);
    }

    void put(int objectNumber, CrossReferenceEntry entry) {
        entries.put(objectNumber, entry);
    }

    CrossReferenceEntry get(int objectNumber) {
        return entries.get(objectNumber);
    }

    /**
     * Merges the entries of a supplementary cross-reference stream. Its
     * entries fill object numbers this table does not describe or
     * describes as free.
     */
    void mergeSupplementary(CrossReferenceSection stream) {
        for (Map.Entry<Integer, CrossReferenceEntry> e : stream.entries.entrySet()) {
            CrossReferenceEntry existing = entries.get(e.getKey());
            if (existing == null || existing.isFree()) {
                entries.put(e.getKey(), e.getValue());
            }
        }
    }

    /**
     * Returns the /Prev offset of the trailer.
     *
     * @return the offset of the next-older section, or -1
     */
    public long getPrev() {
        return trailer == null ? -1 : trailer.getInteger(Name.PREV, -1);
    }

    @Override
    public String toString() {
        return "CrossReferenceSection[" + format + " at " + offset + ", entries=" + entries.size() + "]";
    }

}
