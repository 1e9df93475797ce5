/*
 * CrossReferenceEntry.java
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
 * Where an object number is found in a file.
 * <p>
 * An entry is in one of three states, mirroring the record types of a
 * cross-reference stream: free, in use at a byte offset, or compressed
 * at an index inside an object stream. Entries are immutable values.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CrossReferenceEntry {

    /**
     * The state of an entry, with its cross-reference stream record type.
     */
    public enum State {

        FREE(0),
        IN_USE(1),
        COMPRESSED(2);

        private final int recordType;

        State(int recordType) {
            this.recordType = recordType;
        }

        /**
         * Returns the type field used for this state in cross-reference
         * stream records.
         *
         * @return the record type
         */
        public int getRecordType() {
            return recordType;
        }

        /**
         * Returns the state for a cross-reference stream record type.
         *
         * @param recordType the type field of a record
         * @return the state, or null if the type is not defined
         */
        public static State forRecordType(long recordType) {
            for (State state : values()) {
                if (state.recordType == recordType) {
                    return state;
                }
            }
            return null;
        }

    }

    private final State state;
    // offset, next free object, or containing stream
    private final long location;
    // generation, or index within the containing stream
    private final int number;

    private CrossReferenceEntry(State state, long location, int number) {
        this.state = state;
        this.location = location;
        this.number = number;
    }

    /**
     * Returns an entry for a free object number.
     *
     * @param nextFreeObject the next number in the free list, 0 at its end
     * @param generation the generation to use if the number is reused
     * @return the entry
     */
    public static CrossReferenceEntry free(int nextFreeObject, int generation) {
        return new CrossReferenceEntry(State.FREE, nextFreeObject, generation);
    }

    /**
     * Returns an entry for an object stored at a byte offset.
     *
     * @param offset the offset of the {@code obj} header
     * @param generation the generation number
     * @return the entry
     */
    public static CrossReferenceEntry inUse(long offset, int generation) {
        return new CrossReferenceEntry(State.IN_USE, offset, generation);
    }

    /**
     * Returns an entry for an object packed in an object stream.
     *
     * @param objectStreamNumber the number of the containing stream
     * @param indexInStream the position of the object in the stream's index
     * @return the entry
     */
    public static CrossReferenceEntry compressed(int objectStreamNumber, int indexInStream) {
        return new CrossReferenceEntry(State.COMPRESSED, objectStreamNumber, indexInStream);
    }

    public State getState() {
        return state;
    }

    public boolean isFree() {
        return state == State.FREE;
    }

    public boolean isInUse() {
        return state == State.IN_USE;
    }

    public boolean isCompressed() {
        return state == State.COMPRESSED;
    }

    /**
     * Returns the byte offset of an in-use object.
     *
     * @return the offset
     * @throws IllegalStateException for free and compressed entries
     */
    public long getOffset() {
        check(State.IN_USE);
        return location;
    }

    /**
     * Returns the generation number. Objects in object streams are always
     * at generation 0.
     *
     * @return the generation
     */
    public int getGeneration() {
        return (state == State.COMPRESSED) ? 0 : number;
    }

    /**
     * Returns the number of the object stream holding a compressed object.
     *
     * @return the object stream number
     * @throws IllegalStateException unless the entry is compressed
     */
    public int getObjectStreamNumber() {
        check(State.COMPRESSED);
        return (int) location;
    }

    /**
     * Returns the position of a compressed object in its stream's index.
     *
     * @return the index
     * @throws IllegalStateException unless the entry is compressed
     */
    public int getIndexInStream() {
        check(State.COMPRESSED);
        return number;
    }

    /**
     * Returns the link to the next free object number.
     *
     * @return the next free object number
     * @throws IllegalStateException unless the entry is free
     */
    public int getNextFreeObject() {
        check(State.FREE);
        return (int) location;
    }

    private void check(State expected) {
        if (state != expected) {
            throw new IllegalStateException("Entry is " + state + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof CrossReferenceEntry)) {
            return false;
        }
        CrossReferenceEntry other = (CrossReferenceEntry) obj;
        return state == other.state && location == other.location && number == other.number;
    }

    @Override
    public int hashCode() {
        return state.hashCode() ^ (int) (location * 31) ^ (number << 16);
    }

    @Override
    public String toString() {
        switch (state) {
            case FREE:
                return "f " + location + " " + number;
            case IN_USE:
                return "n @" + location + " gen " + number;
            default:
                return "in " + location + "[" + number + "]";
        }
    }

}
