/*
 * ObjectWriterTest.java
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

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * JUnit 4 tests for {@link ObjectWriter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ObjectWriterTest {

    private static String write(PDFObject obj) {
        return TestPDFs.string(ObjectWriter.toBytes(obj));
    }

    @Test
    public void testScalars() {
        assertEquals("null", write(PDFNull.INSTANCE));
        assertEquals("true", write(PDFBoolean.TRUE));
        assertEquals("false", write(PDFBoolean.FALSE));
        assertEquals("42", write(PDFNumber.of(42)));
        assertEquals("-7", write(PDFNumber.of(-7)));
        assertEquals("12 0 R", write(new ObjectId(12, 0)));
    }

    @Test
    public void testReals() {
        assertEquals("0.5", write(PDFNumber.of(0.5)));
        assertEquals("-1.25", write(PDFNumber.of(-1.25)));
        assertEquals("3.0", write(PDFNumber.of(3.0)));
        assertEquals("0.0", write(PDFNumber.of(-0.0)));
        // never exponent notation
        assertEquals("0.00001", write(PDFNumber.of(1e-5)));
        assertEquals("12000000000.0", write(PDFNumber.of(1.2e10)));
    }

    @Test
    public void testNonFiniteNumbers() {
        double[] values = { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY };
        for (double value : values) {
            try {
                write(PDFNumber.of(value));
                fail("Expected " + value + " to be rejected");
            } catch (PDFWriteException e) {
                assertTrue(e.getMessage().contains("non-finite"));
            }
        }
    }

    @Test
    public void testNames() {
        assertEquals("/Type", write(Name.TYPE));
        assertEquals("/A#20B", write(new Name("A B")));
        assertEquals("/a#2Fb#23c", write(new Name("a/b#c")));
        assertEquals("/#28x#29", write(new Name("(x)")));
    }

    @Test
    public void testStrings() {
        assertEquals("(plain)", write(new PDFString("plain")));
        assertEquals("(\\(a\\) \\\\ b)", write(new PDFString("(a) \\ b")));
        assertEquals("(line\\nbreak\\r\\t)", write(new PDFString("line\nbreak\r\t")));
        assertEquals("(\\351\\000)", write(new PDFString(new byte[] { (byte) 0xe9, 0 })));
        assertEquals("<00FF1A>", write(new PDFString(new byte[] { 0, (byte) 0xff, 0x1a }, true)));
    }

    @Test
    public void testContainers() {
        assertEquals("[]", write(new PDFArray()));
        assertEquals("[1 2 3 R]", write(new PDFArray(PDFNumber.of(1), new ObjectId(2, 3))));
        PDFDictionary dict = new PDFDictionary()
                .put(Name.TYPE, Name.PAGE)
                .put(Name.ROTATE, PDFNumber.of(90));
        assertEquals("<</Type /Page/Rotate 90>>", write(dict));
        assertEquals("<<>>", write(new PDFDictionary()));
    }

    @Test
    public void testStreamLengthIsRewritten() {
        PDFDictionary dict = new PDFDictionary().put(Name.LENGTH, PDFNumber.of(999));
        PDFStream stream = new PDFStream(dict, TestPDFs.bytes("abc"));
        assertEquals("<</Length 3>>\nstream\nabc\nendstream", write(stream));
        // the stream's own dictionary is not modified
        assertEquals(PDFNumber.of(999), stream.getDictionary().get(Name.LENGTH));
    }

    @Test
    public void testIndirect() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ObjectWriter.writeIndirect(new ObjectId(4, 0), new PDFString("x"), out);
        assertEquals("4 0 obj\n(x)\nendobj\n", TestPDFs.string(out.toByteArray()));
    }

}
