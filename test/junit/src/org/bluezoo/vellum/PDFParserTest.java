/*
 * PDFParserTest.java
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

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

/**
 * JUnit 4 tests for {@link PDFParser}, including repair of files whose
 * cross-reference data is unusable.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFParserTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static PDFDocument repair(byte[] pdf) {
        PDFParser parser = new PDFParser();
        parser.setRepairEnabled(true);
        return parser.parse(pdf);
    }

    private static void assertFails(PDFParseException.Kind kind, byte[] pdf) {
        try {
            new PDFParser().parse(pdf);
            fail("Expected " + kind);
        } catch (PDFParseException e) {
            assertEquals(kind, e.getKind());
        }
    }

    /**
     * The two-page file with its startxref pointing beyond the end.
     */
    private static byte[] brokenStartxref() {
        String pdf = TestPDFs.string(TestPDFs.twoPages());
        int startxref = pdf.lastIndexOf("startxref\n");
        return TestPDFs.bytes(pdf.substring(0, startxref) + "startxref\n999999\n%%EOF\n");
    }

    @Test
    public void testDefaults() {
        PDFParser parser = new PDFParser();
        assertFalse(parser.isRepairEnabled());
        assertEquals(PDFParser.DEFAULT_STREAM_LENGTH_TOLERANCE, parser.getStreamLengthTolerance());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeTolerance() {
        new PDFParser().setStreamLengthTolerance(-1);
    }

    @Test
    public void testReadVersion() {
        assertEquals("1.4", PDFParser.readVersion(ByteBuffer.wrap(TestPDFs.twoPages())));
        assertEquals("2.0", PDFParser.readVersion(ByteBuffer.wrap(TestPDFs.bytes("junk\n%PDF-2.0\r\n"))));
        assertNull(PDFParser.readVersion(ByteBuffer.wrap(TestPDFs.bytes("%!PS-Adobe-3.0\n"))));
    }

    @Test
    public void testMissingHeader() {
        String pdf = TestPDFs.string(TestPDFs.onePage());
        // same length, so the offsets stay valid
        byte[] headerless = TestPDFs.bytes("%XYZ-" + pdf.substring(5));
        assertFails(PDFParseException.Kind.CORRUPTED_FILE, headerless);

        PDFDocument doc = repair(headerless);
        assertNull(doc.getVersion());
        assertFalse(doc.isRepaired());
        assertEquals(1, doc.getPageCount());
    }

    @Test
    public void testBrokenStartxref() {
        byte[] pdf = brokenStartxref();
        assertFails(PDFParseException.Kind.INVALID_XREF, pdf);

        PDFDocument doc = repair(pdf);
        assertTrue(doc.isRepaired());
        assertEquals(CrossReferenceSection.Format.REPAIRED,
                doc.getCrossReferenceTable().getSections().get(0).getFormat());
        assertEquals(2, doc.getPageCount());
        assertEquals("BT /F1 12 Tf (Hello) Tj ET", TestPDFs.string(doc.getPageContents(0)));
        assertEquals(new PDFString("Test"), doc.getInfo().get("Title"));
        assertEquals(7, doc.getTrailer().getInteger(Name.SIZE, -1));
        assertTrue(doc.getCrossReferenceTable().get(0).isFree());
    }

    @Test
    public void testRepairedFileCanBeUpdated() {
        PDFDocument doc = repair(brokenStartxref());
        IncrementalUpdateWriter writer = new IncrementalUpdateWriter(doc);
        writer.put(6, new PDFDictionary().put("Title", new PDFString("Fixed")));
        byte[] updated = writer.write();
        // /Prev still names the broken offset
        assertFails(PDFParseException.Kind.INVALID_XREF, updated);
        PDFDocument reloaded = repair(updated);
        assertTrue(reloaded.isRepaired());
        assertEquals(new PDFString("Fixed"), reloaded.getInfo().get("Title"));
    }

    @Test
    public void testRepairWithoutCrossReferenceData() {
        byte[] pdf = TestPDFs.bytes("%PDF-1.3\n"
                + "1 0 obj <</Type/Catalog/Pages 2 0 R>> endobj\n"
                + "2 0 obj <</Type/Pages/Kids[]/Count 0>> endobj\n"
                + "3 0 obj (old) endobj\n"
                + "garbage 12 obj\n"
                + "3 0 obj (new) endobj\n");
        assertFails(PDFParseException.Kind.INVALID_XREF, pdf);
        PDFDocument doc = repair(pdf);
        assertEquals(new PDFString("new"), doc.getObject(3, 0));
        assertEquals(new ObjectId(1, 0), doc.getRootReference());
        assertEquals(0, doc.getPageCount());
        assertEquals(4, doc.getTrailer().getInteger(Name.SIZE, -1));
    }

    @Test
    public void testRepairRecoversWrongStreamLength() {
        byte[] pdf = TestPDFs.bytes("%PDF-1.4\n"
                + "1 0 obj <</Type/Catalog/Pages 2 0 R>> endobj\n"
                + "2 0 obj <</Type/Pages/Kids[]/Count 0>> endobj\n"
                + "3 0 obj <</Length 99>>\nstream\nhello\nendstream\nendobj\n"
                + "4 0 obj <</Length 2>>\nstream\nworld\nendstream\nendobj\n"
                + "5 0 obj (after) endobj\n");
        PDFDocument doc = repair(pdf);
        PDFStream tooLong = (PDFStream) doc.getObject(3, 0);
        assertEquals("hello", TestPDFs.string(doc.decodeStream(tooLong)));
        assertEquals(5, tooLong.getDictionary().getInteger(Name.LENGTH, -1));
        assertFalse(tooLong.isLengthProvisional());
        PDFStream tooShort = (PDFStream) doc.getObject(4, 0);
        assertEquals("world", TestPDFs.string(doc.decodeStream(tooShort)));
        assertEquals(new PDFString("after"), doc.getObject(5, 0));
        assertEquals(6, doc.getTrailer().getInteger(Name.SIZE, -1));
    }

    @Test
    public void testRepairFindsObjectStreams() {
        String catalog = "<< /Type /Catalog /Pages 2 0 R >>";
        String pages = "<< /Type /Pages /Kids [] /Count 0 >>";
        String index = "1 0 2 " + (catalog.length() + 1) + "\n";
        byte[] pdf = new TestPDFs()
                .header("1.5")
                .stream(5, " /Type /ObjStm /N 2 /First " + index.length() + " /Filter /FlateDecode",
                        FilterEncoder.flate(TestPDFs.bytes(index + catalog + " " + pages)))
                .toByteArray();
        PDFDocument doc = repair(pdf);
        CrossReferenceEntry entry = doc.getCrossReferenceTable().get(1);
        assertTrue(entry.isCompressed());
        assertEquals(5, entry.getObjectStreamNumber());
        assertEquals(new ObjectId(1, 0), doc.getRootReference());
        assertTrue(doc.getCatalog().isType(Name.CATALOG));
        assertEquals(0, doc.getPageCount());
    }

    @Test
    public void testNothingToRepair() {
        byte[] pdf = TestPDFs.bytes("%PDF-1.4\nnot a single object here\n");
        try {
            repair(pdf);
            fail("Expected a corrupted file");
        } catch (PDFParseException e) {
            assertEquals(PDFParseException.Kind.CORRUPTED_FILE, e.getKind());
        }
    }

    @Test
    public void testParsePathAndChannel() throws IOException {
        File file = folder.newFile("two-pages.pdf");
        FileOutputStream out = new FileOutputStream(file);
        try {
            out.write(TestPDFs.twoPages());
        } finally {
            out.close();
        }
        PDFDocument doc = new PDFParser().parse(file.toPath());
        assertEquals(2, doc.getPageCount());
        assertEquals(TestPDFs.twoPages().length, doc.length());

        FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.READ);
        try {
            channel.position(10);
            assertEquals("1.4", new PDFParser().parse(channel).getVersion());
        } finally {
            channel.close();
        }
    }

    @Test
    public void testBufferPositionIgnored() {
        ByteBuffer buf = ByteBuffer.wrap(TestPDFs.twoPages());
        buf.position(100);
        PDFDocument doc = new PDFParser().parse(buf);
        assertEquals(2, doc.getPageCount());
        assertEquals(100, buf.position());
        assertTrue(doc.getData().isReadOnly());
    }

}
