/*
 * PDFPage.java
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
 * A leaf of the page tree, with the attributes it inherits from its
 * ancestors resolved.
 * <p>
 * /Resources, /MediaBox, /CropBox and /Rotate are taken from the page
 * dictionary when present there, and otherwise from the nearest ancestor
 * /Pages node that defines them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFPage {

    private final int index;
    private final ObjectId id;
    private final PDFDictionary dictionary;
    private final PDFObject resources;
    private final PDFObject mediaBox;
    private final PDFObject cropBox;
    private final int rotate;

    PDFPage(int index, ObjectId id, PDFDictionary dictionary, PDFObject resources,
            PDFObject mediaBox, PDFObject cropBox, int rotate) {
        this.index = index;
        this.id = id;
        this.dictionary = dictionary;
        this.resources = resources;
        this.mediaBox = mediaBox;
        this.cropBox = cropBox;
        this.rotate = rotate;
    }

    /**
     * Returns the 0-based position of this page in the document.
     *
     * @return the page index
     */
    public int getIndex() {
        return index;
    }

    /**
     * Returns the identifier of the page object.
     *
     * @return the identifier, or null for a page given directly in /Kids
     */
    public ObjectId getId() {
        return id;
    }

    public PDFDictionary getDictionary() {
        return dictionary;
    }

    /**
     * Returns the page's resource dictionary, possibly inherited.
     *
     * @return the resources, a dictionary or a reference to one, or null
     */
    public PDFObject getResources() {
        return resources;
    }

    public PDFObject getMediaBox() {
        return mediaBox;
    }

    /**
     * Returns the crop box, which defaults to the media box.
     *
     * @return the crop box
     */
    public PDFObject getCropBox() {
        return cropBox != null ? cropBox : mediaBox;
    }

    /**
     * Returns the rotation in degrees, a multiple of 90.
     *
     * @return the rotation
     */
    public int getRotate() {
        return rotate;
    }

    @Override
    public String toString() {
        return "PDFPage[" + index + (id != null ? ", " + id : "") + "]";
    }

}
