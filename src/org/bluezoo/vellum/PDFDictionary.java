/*
 * PDFDictionary.java
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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A PDF dictionary: an insertion-ordered mapping from names to objects.
 * <p>
 * Keys are unique; putting an existing key replaces its value in place.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFDictionary extends PDFObject {

    private final Map<Name, PDFObject> entries;

    /**
     * Creates an empty dictionary.
     */
    public PDFDictionary() {
        entries = new LinkedHashMap<>();
    }

    /**
     * Creates a shallow copy of another dictionary.
     *
     * @param other the dictionary to copy
     */
    public PDFDictionary(PDFDictionary other) {
        entries = new LinkedHashMap<>(other.entries);
    }

    public PDFObject get(Name key) {
        return entries.get(key);
    }

    public PDFObject get(String key) {
        return entries.get(new Name(key));
    }

    public boolean containsKey(Name key) {
        return entries.containsKey(key);
    }

    /**
     * Associates a value with a key.
     *
     * @param key the key
     * @param value the value
     * @return this dictionary
     */
    public PDFDictionary put(Name key, PDFObject value) {
        if (key == null || value == null) {
            throw new NullPointerException("Dictionary keys and values cannot be null");
        }
        entries.put(key, value);
        return this;
    }

    public PDFDictionary put(String key, PDFObject value) {
        return put(new Name(key), value);
    }

    public PDFDictionary put(String key, long value) {
        return put(new Name(key), PDFNumber.of(value));
    }

    public PDFObject remove(Name key) {
        return entries.remove(key);
    }

    public int size() {
        return entries.size();
    }

    public Set<Name> keySet() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Set<Map.Entry<Name, PDFObject>> entrySet() {
        return Collections.unmodifiableMap(entries).entrySet();
    }

    /**
     * Returns the value of the given key if it is a name.
     *
     * @param key the key
     * @return the name, or null if absent or not a name
     */
    public Name getName(Name key) {
        PDFObject value = entries.get(key);
        return (value instanceof Name) ? (Name) value : null;
    }

    /**
     * Returns the value of the given key if it is an integer.
     *
     * @param key the key
     * @param defaultValue the value to return if absent or not an integer
     * @return the integer value
     */
    public long getInteger(Name key, long defaultValue) {
        PDFObject value = entries.get(key);
        if (value instanceof PDFNumber && ((PDFNumber) value).isInteger()) {
            return ((PDFNumber) value).longValue();
        }
        return defaultValue;
    }

    /**
     * Indicates whether the /Type entry of this dictionary is the given name.
     *
     * @param type the expected type
     * @return true if the type matches
     */
    public boolean isType(Name type) {
        return type.equals(entries.get(Name.TYPE));
    }

    @Override
    public Kind getKind() {
        return Kind.DICTIONARY;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof PDFDictionary) {
            return entries.equals(((PDFDictionary) obj).entries);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

}
