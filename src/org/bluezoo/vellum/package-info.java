/*
 * package-info.java
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

/**
 * Vellum PDF object model, parser and incremental update writer.
 * <p>
 * Vellum reads the structure of a PDF file, resolves its objects lazily
 * through the merged cross-reference data of every incremental update,
 * and appends changes to a file without rewriting any of its existing
 * bytes, so that earlier digital signatures remain valid.
 * <p>
 * The main entry points are:
 * <ul>
 *   <li>{@link org.bluezoo.vellum.PDFParser} - loads a file into a document</li>
 *   <li>{@link org.bluezoo.vellum.PDFDocument} - resolves objects, pages and streams</li>
 *   <li>{@link org.bluezoo.vellum.IncrementalUpdateWriter} - appends changes to a file</li>
 *   <li>{@link org.bluezoo.vellum.PDFWriter} - writes a complete new file</li>
 * </ul>
 * <p>
 * The object model is the closed set of subclasses of
 * {@link org.bluezoo.vellum.PDFObject}, distinguished by
 * {@link org.bluezoo.vellum.PDFObject#getKind()}. References between
 * objects are {@link org.bluezoo.vellum.ObjectId}s and are only followed
 * when a document resolves them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.vellum;
