/*
 * PDFDump.java
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
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;

/**
 * Prints the structure of a PDF file: its version, cross-reference
 * sections, trailer and pages.
 * <pre>
 * java org.bluezoo.vellum.PDFDump [-repair] document.pdf
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFDump {

    private final PrintStream out;

    PDFDump(PrintStream out) {
        this.out = out;
    }

    void dump(PDFDocument doc) {
        out.println("Version: " + doc.getVersion());
        if (doc.isRepaired()) {
            out.println("Cross-reference table rebuilt by scanning");
        }
        out.println("Objects: " + doc.getObjectCount());
        List<CrossReferenceSection> sections = doc.getCrossReferenceTable().getSections();
        for (CrossReferenceSection section : sections) {
            out.println("Section: " + section.getFormat() + " at " + section.getOffset()
                    + ", " + section.getEntries().size() + " entries");
        }
        out.println("Trailer: " + doc.getTrailer());
        out.println("Encrypted: " + doc.isEncrypted());
        out.println("Linearized: " + doc.isLinearized());
        PDFDictionary info = doc.getInfo();
        if (info != null) {
            out.println("Info: " + doc.resolveAll(info));
        }
        List<PDFPage> pages = doc.getPages();
        out.println("Pages: " + pages.size());
        for (PDFPage page : pages) {
            out.println("  " + page + " MediaBox " + doc.resolve(page.getMediaBox())
                    + " Rotate " + page.getRotate()
                    + " content " + doc.getPageContents(page.getIndex()).length + " bytes");
        }
    }

    /**
     * Dumps a PDF file to standard output.
     *
     * @param args command line arguments: an optional -repair flag and the
     *        path of the file
     */
    public static void main(String[] args) {
        boolean repair = false;
        String path = null;
        for (String arg : args) {
            if ("-repair".equals(arg)) {
                repair = true;
            } else {
                path = arg;
            }
        }
        if (path == null) {
            System.err.println("Usage: java org.bluezoo.vellum.PDFDump [-repair] <pdf-file>");
            System.exit(1);
        }

        PDFParser parser = new PDFParser();
        parser.setRepairEnabled(repair);
        try {
            PDFDocument doc = parser.parse(Paths.get(path));
            new PDFDump(System.out).dump(doc);
        } catch (IOException e) {
            System.err.println("Error reading PDF: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        } catch (PDFParseException e) {
            System.err.println("Error parsing PDF: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

}
