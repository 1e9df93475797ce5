/*
 * CrossReferenceTable.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The merged cross-reference view of a file.
 * <p>
 * The table maps object numbers to their locations within the PDF file.
 * It is built from the chain of cross-reference sections, oldest first,
 * so that a newer section's entry for an object number permanently
 * overrides any entry for that number in older sections.
 * <p>
 * The table also keeps the sections themselves, newest first, for access
 * to the trailer chain.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CrossReferenceTable {

    private final SortedMap<Integer, CrossReferenceEntry> entries;
    private final List<CrossReferenceSection> sections;

    /**
     * Creates an empty cross-reference table.
     */
    public CrossReferenceTable() {
        this.entries = new TreeMap<>();
        this.sections = new ArrayList<>();
    }

    /**
     * Creates the merged table for a chain of sections.
     *
     * @param sectionsNewestFirst the sections, newest first
     * @return the merged table
     */
    static CrossReferenceTable fold(List<CrossReferenceSection> sectionsNewestFirst) {
        CrossReferenceTable table = new CrossReferenceTable();
        for (int i = sectionsNewestFirst.size() - 1; i >= 0; i--) {
            CrossReferenceSection section = sectionsNewestFirst.get(i);
            for (Map.Entry<Integer, CrossReferenceEntry> e : section.getEntries().entrySet()) {
                table.put(e.getKey(), e.getValue());
            }
        }
        table.sections.addAll(sectionsNewestFirst);
        return table;
    }

    /**
     * Adds or updates an entry in the table.
     *
     * @param objectNumber the object number
     * @param entry the cross-reference entry
     */
    public void put(int objectNumber, CrossReferenceEntry entry) {
        entries.put(objectNumber, entry);
    }

    /**
     * Returns the entry for the specified object number.
     *
     * @param objectNumber the object number
     * @return the entry, or null if not found
     */
    public CrossReferenceEntry get(int objectNumber) {
        return entries.get(objectNumber);
    }

    public boolean contains(int objectNumber) {
        return entries.containsKey(objectNumber);
    }

    /**
     * Returns the number of entries in the table.
     *
     * @return the entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns the highest object number in the table.
     *
     * @return the maximum object number, or 0 if empty
     */
    public int getMaxObjectNumber() {
        return entries.isEmpty() ? 0 : entries.lastKey();
    }

    /**
     * Returns the merged entries, keyed by object number.
     *
     * @return an unmodifiable view of the entries
     */
    public SortedMap<Integer, CrossReferenceEntry> getEntries() {
        return Collections.unmodifiableSortedMap(entries);
    }

    /**
     * Returns the sections the table was built from, newest first.
     *
     * @return the sections
     */
    public List<CrossReferenceSection> getSections() {
        return Collections.unmodifiableList(sections);
    }

    /**
     * Returns the trailer of the newest section.
     *
     * @return the trailer, or null if there are no sections
     */
    public PDFDictionary getTrailer() {
        return sections.isEmpty() ? null : sections.get(0).getTrailer();
    }

    @Override
    public String toString() {
        return "CrossReferenceTable[entries=" + entries.size() +
               ", maxObject=" + getMaxObjectNumber() + ", sections=" + sections.size() + "]";
    }

}
