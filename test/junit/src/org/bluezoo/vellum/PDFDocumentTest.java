/*
 * PDFDocumentTest.java
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

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * JUnit 4 tests for {@link PDFDocument}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFDocumentTest {

    private static PDFDocument load(byte[] pdf) {
        return new PDFParser().parse(pdf);
    }

    private static void assertFails(PDFParseException.Kind kind, Runnable action) {
        try {
            action.run();
            fail("Expected " + kind);
        } catch (PDFParseException e) {
            assertEquals(kind, e.getKind());
        }
    }

    @Test
    public void testOnePage() {
        PDFDocument doc = load(TestPDFs.onePage());
        assertEquals("1.7", doc.getVersion());
        assertEquals(1, doc.getPageCount());
        PDFPage page = doc.getPage(0);
        assertNull(page.getId());
        assertEquals(PDFArray.ofIntegers(0, 0, 612, 792), page.getMediaBox());
        assertFalse(doc.isRepaired());
        assertFalse(doc.isLinearized());
    }

    @Test
    public void testPageTreeInheritance() {
        PDFDocument doc = load(TestPDFs.twoPages());
        List<PDFPage> pages = doc.getPages();
        assertEquals(2, pages.size());

        PDFPage first = pages.get(0);
        assertEquals(new ObjectId(3, 0), first.getId());
        assertEquals(0, first.getIndex());
        assertEquals(PDFArray.ofIntegers(0, 0, 612, 792), first.getMediaBox());
        assertEquals(first.getMediaBox(), first.getCropBox());
        assertTrue(first.getResources() instanceof PDFDictionary);
        assertEquals(0, first.getRotate());

        PDFPage second = pages.get(1);
        assertEquals(PDFArray.ofIntegers(0, 0, 300, 300), second.getMediaBox());
        assertEquals(90, second.getRotate());
        assertSame(first.getResources(), second.getResources());
    }

    @Test
    public void testPageContents() {
        PDFDocument doc = load(TestPDFs.twoPages());
        assertEquals("BT /F1 12 Tf (Hello) Tj ET", TestPDFs.string(doc.getPageContents(0)));
        assertEquals(0, doc.getPageContents(1).length);
    }

    @Test
    public void testContentArrayIsJoined() {
        PDFWriter writer = new PDFWriter();
        ObjectId q = writer.add(PDFStream.encode(new PDFDictionary(), TestPDFs.bytes("q"),
                new Name("FlateDecode")));
        ObjectId bigQ = writer.add(new PDFStream(new PDFDictionary(), TestPDFs.bytes("Q")));
        PDFDictionary page = new PDFDictionary().put(Name.TYPE, Name.PAGE)
                .put(Name.CONTENTS, new PDFArray(q, bigQ));
        PDFDictionary pages = new PDFDictionary().put(Name.TYPE, Name.PAGES)
                .put(Name.KIDS, new PDFArray(writer.add(page))).put(Name.COUNT, PDFNumber.of(1));
        ObjectId pagesId = writer.add(pages);
        writer.setRoot(writer.add(new PDFDictionary().put(Name.TYPE, Name.CATALOG).put(Name.PAGES, pagesId)));

        PDFDocument doc = load(writer.write());
        assertEquals("q\nQ", TestPDFs.string(doc.getPageContents(0)));
    }

    @Test
    public void testTrailerAndInfo() {
        PDFDocument doc = load(TestPDFs.twoPages());
        assertEquals("1.4", doc.getVersion());
        assertEquals(new ObjectId(1, 0), doc.getRootReference());
        assertTrue(doc.getCatalog().isType(Name.CATALOG));
        assertEquals(new PDFString("Test"), doc.getInfo().get("Title"));
        assertFalse(doc.isEncrypted());
        assertNull(doc.getEncryptDictionary());
        assertEquals(7, doc.getNextObjectId());
        assertEquals(7, doc.getObjectCount());
    }

    @Test
    public void testEncryptDictionary() {
        byte[] pdf = new TestPDFs()
                .header("1.4")
                .object(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .object(2, "<< /Type /Pages /Kids [] /Count 0 >>")
                .object(3, "<< /Filter /Standard /V 2 /R 3 >>")
                .xrefTable("/Root 1 0 R /Encrypt 3 0 R /ID [<01> <02>]")
                .toByteArray();
        PDFDocument doc = load(pdf);
        assertTrue(doc.isEncrypted());
        assertEquals(new Name("Standard"), doc.getEncryptDictionary().get(Name.FILTER));
        assertEquals(0, doc.getPageCount());
    }

    @Test
    public void testLinearized() {
        byte[] pdf = new TestPDFs()
                .header("1.6")
                .object(1, "<< /Linearized 1 /L 1000 /N 1 >>")
                .object(2, "<< /Type /Catalog /Pages << /Type /Pages /Kids [] /Count 0 >> >>")
                .xrefTable("/Root 2 0 R")
                .toByteArray();
        assertTrue(load(pdf).isLinearized());
    }

    @Test
    public void testAbsentObjectsAreNull() {
        PDFDocument doc = load(TestPDFs.twoPages());
        assertSame(PDFNull.INSTANCE, doc.getObject(0, 0));
        assertSame(PDFNull.INSTANCE, doc.getObject(99, 0));
        // generation mismatch
        assertSame(PDFNull.INSTANCE, doc.getObject(1, 1));
        assertSame(PDFNull.INSTANCE, doc.resolve(new ObjectId(42, 0)));
        assertNull(doc.resolve(null));
    }

    @Test
    public void testObjectsAreCached() {
        PDFDocument doc = load(TestPDFs.twoPages());
        assertSame(doc.getObject(2, 0), doc.getObject(new ObjectId(2, 0)));
    }

    @Test
    public void testObjectHeaderMismatch() {
        TestPDFs b = new TestPDFs()
                .header("1.4")
                .object(1, "<< /Type /Catalog /Pages 2 0 R >>");
        int xref = b.size();
        // the entry for object 2 points at object 1
        b.raw("xref\n0 3\n0000000000 65535 f \n")
                .raw(String.format("%010d 00000 n \n", b.offset(1)))
                .raw(String.format("%010d 00000 n \n", b.offset(1)))
                .raw("trailer\n<< /Size 3 /Root 1 0 R >>\n")
                .startxref(xref);
        final PDFDocument doc = load(b.toByteArray());
        assertFails(PDFParseException.Kind.INVALID_OBJECT, new Runnable() {
            @Override
            public void run() {
                doc.getObject(2, 0);
            }
        });
    }

    /**
     * Objects 20, 21, 22 and 10 live in object stream 50, and object 23
     * claims index 1 of the same stream.
     */
    private static byte[] compressedFile() {
        String header = "20 0 21 4 22 8 10 12\n";
        String body = "(a) (b) (c) << /Type /Page /Parent 2 0 R >>";
        TestPDFs b = new TestPDFs()
                .header("1.5")
                .object(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .object(2, "<< /Type /Pages /Kids [10 0 R] /Count 1 /MediaBox [0 0 200 200] >>")
                .stream(50, " /Type /ObjStm /N 4 /First " + header.length() + " /Filter /FlateDecode",
                        FilterEncoder.flate(TestPDFs.bytes(header + body)));
        int xref = b.size();
        long[][] records = {
            { 0, 0, 255 },
            { 1, b.offset(1), 0 },
            { 1, b.offset(2), 0 },
            { 2, 50, 3 },
            { 2, 50, 0 },
            { 2, 50, 1 },
            { 2, 50, 2 },
            { 2, 50, 1 },
            { 1, b.offset(50), 0 },
            { 1, xref, 0 }
        };
        return b.xrefStream(60, "/Size 61 /Index [0 3 10 1 20 4 50 1 60 1] /Root 1 0 R",
                new int[] { 1, 2, 1 }, records)
                .startxref(xref)
                .toByteArray();
    }

    @Test
    public void testCompressedObjects() {
        PDFDocument doc = load(compressedFile());
        assertEquals(new PDFString("a"), doc.getObject(20, 0));
        assertEquals(new PDFString("c"), doc.getObject(22, 0));
        assertEquals(new PDFString("b"), doc.getObject(21, 0));
        // compressed objects have generation 0
        assertSame(PDFNull.INSTANCE, doc.getObject(21, 1));
        assertEquals(1, doc.getPageCount());
        PDFPage page = doc.getPage(0);
        assertEquals(new ObjectId(10, 0), page.getId());
        assertEquals(PDFArray.ofIntegers(0, 0, 200, 200), page.getMediaBox());
        assertEquals(61, doc.getNextObjectId());
    }

    @Test
    public void testCompressedObjectNumberMismatch() {
        final PDFDocument doc = load(compressedFile());
        assertFails(PDFParseException.Kind.INVALID_OBJECT, new Runnable() {
            @Override
            public void run() {
                doc.getObject(23, 0);
            }
        });
    }

    @Test
    public void testContainerInsideItself() {
        TestPDFs b = new TestPDFs()
                .header("1.5")
                .object(1, "<< /Type /Catalog /Pages << /Type /Pages /Kids [] /Count 0 >> >>");
        int xref = b.size();
        long[][] records = {
            { 0, 0, 255 },
            { 1, b.offset(1), 0 },
            { 2, 5, 0 },
            { 1, xref, 0 }
        };
        b.xrefStream(9, "/Size 10 /Index [0 2 5 1 9 1] /Root 1 0 R", new int[] { 1, 2, 1 }, records)
                .startxref(xref);
        final PDFDocument doc = load(b.toByteArray());
        assertFails(PDFParseException.Kind.INVALID_OBJECT, new Runnable() {
            @Override
            public void run() {
                doc.getObject(5, 0);
            }
        });
    }

    @Test
    public void testResolveAllThroughParent() {
        final PDFDocument doc = load(TestPDFs.twoPages());
        // each page's /Parent leads back to the page tree root
        assertFails(PDFParseException.Kind.INVALID_OBJECT, new Runnable() {
            @Override
            public void run() {
                doc.resolveAll(new ObjectId(2, 0));
            }
        });
        PDFDictionary info = (PDFDictionary) doc.resolveAll(new ObjectId(6, 0));
        assertEquals(new PDFString("Vellum"), info.get("Producer"));
    }

    @Test
    public void testResolveAllCycle() {
        byte[] pdf = new TestPDFs()
                .header("1.4")
                .object(1, "<< /Type /Catalog /Pages << /Type /Pages /Kids [] /Count 0 >> >>")
                .object(7, "<< /Next 8 0 R >>")
                .object(8, "<< /Next 7 0 R >>")
                .xrefTable("/Root 1 0 R")
                .toByteArray();
        final PDFDocument doc = load(pdf);
        assertFails(PDFParseException.Kind.INVALID_OBJECT, new Runnable() {
            @Override
            public void run() {
                doc.resolveAll(new ObjectId(7, 0));
            }
        });
        // one level of resolution is fine
        PDFDictionary seven = (PDFDictionary) doc.resolve(new ObjectId(7, 0));
        assertEquals(new ObjectId(8, 0), seven.get("Next"));
    }

    @Test
    public void testResolveAllSharedReferences() {
        byte[] pdf = new TestPDFs()
                .header("1.4")
                .object(1, "<< /Type /Catalog /Pages << /Type /Pages /Kids [] /Count 0 >> >>")
                .object(3, "[4 0 R 4 0 R << /X 4 0 R >>]")
                .object(4, "(shared)")
                .xrefTable("/Root 1 0 R")
                .toByteArray();
        PDFArray resolved = (PDFArray) load(pdf).resolveAll(new ObjectId(3, 0));
        PDFString shared = new PDFString("shared");
        assertEquals(shared, resolved.get(0));
        assertEquals(shared, resolved.get(1));
        assertEquals(shared, ((PDFDictionary) resolved.get(2)).get("X"));
    }

    @Test
    public void testPageTreeCycle() {
        byte[] pdf = new TestPDFs()
                .header("1.4")
                .object(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .object(2, "<< /Type /Pages /Kids [3 0 R] /Count 1 >>")
                .object(3, "<< /Type /Pages /Kids [2 0 R] /Count 1 >>")
                .xrefTable("/Root 1 0 R")
                .toByteArray();
        final PDFDocument doc = load(pdf);
        assertFails(PDFParseException.Kind.INVALID_OBJECT, new Runnable() {
            @Override
            public void run() {
                doc.getPages();
            }
        });
    }

    @Test
    public void testIndirectFilter() {
        byte[] data = TestPDFs.bytes("indirectly filtered");
        byte[] pdf = new TestPDFs()
                .header("1.4")
                .object(1, "<< /Type /Catalog /Pages << /Type /Pages /Kids [] /Count 0 >> >>")
                .stream(2, " /Filter 3 0 R", FilterEncoder.flate(data))
                .object(3, "/FlateDecode")
                .stream(4, " /Filter [3 0 R]", FilterEncoder.flate(data))
                .xrefTable("/Root 1 0 R")
                .toByteArray();
        PDFDocument doc = load(pdf);
        assertArrayEquals(data, doc.decodeStream((PDFStream) doc.getObject(2, 0)));
        assertArrayEquals(data, doc.decodeStream((PDFStream) doc.getObject(4, 0)));
    }

    @Test
    public void testIndirectLength() {
        byte[] pdf = new TestPDFs()
                .header("1.4")
                .object(1, "<< /Type /Catalog /Pages << /Type /Pages /Kids [] /Count 0 >> >>")
                .raw("2 0 obj\n<< /Length 3 0 R >>\nstream\nhello\nendstream\nendobj\n")
                .object(3, "5")
                .raw("4 0 obj\n<< /Length 9 0 R >>\nstream\nworld\nendstream\nendobj\n")
                .toByteArray();
        // objects 2 and 4 were written raw, so locate them by scanning
        String s = TestPDFs.string(pdf);
        TestPDFs b = new TestPDFs().raw(pdf);
        int xref = b.size();
        b.raw("xref\n0 5\n0000000000 65535 f \n")
                .raw(String.format("%010d 00000 n \n", s.indexOf("1 0 obj")))
                .raw(String.format("%010d 00000 n \n", s.indexOf("2 0 obj")))
                .raw(String.format("%010d 00000 n \n", s.indexOf("3 0 obj")))
                .raw(String.format("%010d 00000 n \n", s.indexOf("4 0 obj")))
                .raw("trailer\n<< /Size 5 /Root 1 0 R >>\n")
                .startxref(xref);
        PDFDocument doc = load(b.toByteArray());
        PDFStream resolved = (PDFStream) doc.getObject(2, 0);
        assertFalse(resolved.isLengthProvisional());
        assertEquals("hello", TestPDFs.string(resolved.getRawData()));
        // the length object is missing: the payload stays delimited by endstream
        PDFStream provisional = (PDFStream) doc.getObject(4, 0);
        assertTrue(provisional.isLengthProvisional());
        assertEquals("world", TestPDFs.string(doc.decodeStream(provisional)));
        assertTrue(((PDFStream) doc.getObject(4, 0)).isLengthProvisional());
    }

    /**
     * Object stream 5 takes its /Length from object 6, which it contains.
     * The length can only be checked once object 6 has been loaded.
     */
    private static byte[] selfMeasuringObjectStream(String lengthText) {
        TestPDFs b = new TestPDFs()
                .header("1.5")
                .object(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .object(2, "<< /Type /Pages /Kids [] /Count 0 >>");
        int stm = b.size();
        b.raw("5 0 obj\n<< /Type /ObjStm /N 1 /First 4 /Length 6 0 R >>\nstream\n6 0 " + lengthText
                + "\nendstream\nendobj\n");
        int xref = b.size();
        long[][] records = {
            { 0, 0, 255 },
            { 1, b.offset(1), 0 },
            { 1, b.offset(2), 0 },
            { 1, stm, 0 },
            { 2, 5, 0 },
            { 1, xref, 0 }
        };
        return b.xrefStream(9, "/Size 10 /Index [0 3 5 2 9 1] /Root 1 0 R", new int[] { 1, 2, 1 }, records)
                .startxref(xref)
                .toByteArray();
    }

    @Test
    public void testDeferredLengthValidation() {
        PDFDocument doc = load(selfMeasuringObjectStream("0008"));
        PDFStream first = (PDFStream) doc.getObject(5, 0);
        assertTrue(first.isLengthProvisional());
        assertEquals(PDFNumber.of(8), doc.getObject(6, 0));
        PDFStream validated = (PDFStream) doc.getObject(5, 0);
        assertFalse(validated.isLengthProvisional());
        assertEquals("6 0 0008", TestPDFs.string(validated.getRawData()));
    }

    @Test
    public void testDeferredLengthWithinTolerance() {
        PDFDocument doc = load(selfMeasuringObjectStream("0009"));
        doc.getObject(5, 0);
        assertEquals(PDFNumber.of(9), doc.getObject(6, 0));
        PDFStream validated = (PDFStream) doc.getObject(5, 0);
        assertFalse(validated.isLengthProvisional());
        // resliced from the file, taking in the end-of-line marker
        assertEquals("6 0 0009\n", TestPDFs.string(validated.getRawData()));
    }

    @Test
    public void testDeferredLengthBeyondTolerance() {
        final PDFDocument doc = load(selfMeasuringObjectStream("0030"));
        doc.getObject(5, 0);
        assertEquals(PDFNumber.of(30), doc.getObject(6, 0));
        assertFails(PDFParseException.Kind.CORRUPTED_FILE, new Runnable() {
            @Override
            public void run() {
                doc.getObject(5, 0);
            }
        });
    }

    @Test
    public void testZeroToleranceRejectsAnyDifference() {
        PDFParser parser = new PDFParser();
        parser.setStreamLengthTolerance(0);
        final PDFDocument doc = parser.parse(selfMeasuringObjectStream("0009"));
        doc.getObject(6, 0);
        assertFails(PDFParseException.Kind.CORRUPTED_FILE, new Runnable() {
            @Override
            public void run() {
                doc.getObject(5, 0);
            }
        });
    }

}
