/*
 * ObjectParserTest.java
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

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * JUnit 4 tests for {@link ObjectParser}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ObjectParserTest {

    private static ObjectParser parser(String s) {
        return new ObjectParser(new Lexer(TestPDFs.bytes(s)));
    }

    private static PDFObject parse(String s) {
        return parser(s).parseObject();
    }

    private static void assertFails(PDFParseException.Kind kind, String s) {
        try {
            ObjectParser parser = parser(s);
            if (s.contains(" obj")) {
                parser.parseIndirectObject();
            } else {
                parser.parseObject();
            }
            fail("Expected " + kind + " for " + s);
        } catch (PDFParseException e) {
            assertEquals(kind, e.getKind());
        }
    }

    @Test
    public void testScalars() {
        assertSame(PDFBoolean.TRUE, parse("true"));
        assertSame(PDFBoolean.FALSE, parse("false"));
        assertSame(PDFNull.INSTANCE, parse("null"));
        assertEquals(PDFNumber.of(42), parse("42"));
        assertEquals(PDFNumber.of(-1.5), parse("-1.5"));
        assertEquals(new Name("Type"), parse("/Type"));
        assertEquals(new PDFString("abc"), parse("(abc)"));
        assertTrue(((PDFString) parse("<616263>")).isHex());
    }

    @Test
    public void testDictionary() {
        PDFObject obj = parse("<< /Type /Page /Kids [1 0 R 2 0 R] /Count 2 >>");
        assertEquals(PDFObject.Kind.DICTIONARY, obj.getKind());
        PDFDictionary dict = (PDFDictionary) obj;
        assertTrue(dict.isType(Name.PAGE));
        assertEquals(2, dict.getInteger(Name.COUNT, -1));
        PDFArray kids = (PDFArray) dict.get(Name.KIDS);
        assertEquals(2, kids.size());
        assertEquals(new ObjectId(1, 0), kids.get(0));
        assertEquals(new ObjectId(2, 0), kids.get(1));
    }

    @Test
    public void testReferenceLookahead() {
        assertEquals(new ObjectId(1, 2), parse("1 2 R"));
        PDFArray numbers = (PDFArray) parse("[1 2 3]");
        assertEquals(3, numbers.size());
        assertEquals(PDFNumber.of(3), numbers.get(2));
        PDFArray pair = (PDFArray) parse("[1 2]");
        assertEquals(2, pair.size());
        PDFArray mixed = (PDFArray) parse("[0 1 5 0 R 7]");
        assertEquals(4, mixed.size());
        assertEquals(new ObjectId(5, 0), mixed.get(2));
        assertEquals(PDFNumber.of(7), mixed.get(3));
    }

    @Test
    public void testNumberFollowedByIndirectHeader() {
        try {
            parse("5 0 obj 42 endobj");
            fail("Expected an error for an indirect object header in value position");
        } catch (PDFParseException e) {
            assertEquals(PDFParseException.Kind.UNEXPECTED_TOKEN, e.getKind());
            assertEquals(0, e.getOffset());
        }
        // inside an array the header is just two numbers and a keyword
        try {
            parse("[5 0 obj]");
            fail("Expected an error for a keyword in an array");
        } catch (PDFParseException e) {
            assertEquals(PDFParseException.Kind.UNEXPECTED_TOKEN, e.getKind());
        }
    }

    @Test
    public void testIndirectObject() {
        IndirectObject indirect = parser("  7 0 obj\n<< /A 1 >>\nendobj").parseIndirectObject();
        assertEquals(new ObjectId(7, 0), indirect.getId());
        assertEquals(2, indirect.getOffset());
        assertEquals(PDFNumber.of(1), ((PDFDictionary) indirect.getObject()).get("A"));
    }

    @Test
    public void testMalformedIndirectObjects() {
        assertFails(PDFParseException.Kind.UNEXPECTED_TOKEN, "1 0 obj 42 endstream");
        assertFails(PDFParseException.Kind.UNEXPECTED_END_OF_FILE, "1 0 obj 42");
        assertFails(PDFParseException.Kind.UNEXPECTED_TOKEN, "1 x obj 42 endobj");
    }

    @Test
    public void testMalformedContainers() {
        assertFails(PDFParseException.Kind.UNEXPECTED_TOKEN, "<< 1 2 >>");
        assertFails(PDFParseException.Kind.UNEXPECTED_END_OF_FILE, "<< /A 1");
        assertFails(PDFParseException.Kind.UNEXPECTED_END_OF_FILE, "[1 2");
        assertFails(PDFParseException.Kind.UNEXPECTED_TOKEN, "<< /A >>");
        assertFails(PDFParseException.Kind.UNEXPECTED_TOKEN, "]");
        assertFails(PDFParseException.Kind.UNEXPECTED_TOKEN, "endobj");
        assertFails(PDFParseException.Kind.UNEXPECTED_END_OF_FILE, "");
        assertFails(PDFParseException.Kind.MALFORMED_TOKEN, "[1 )]");
    }

    @Test
    public void testStreamWithDirectLength() {
        String s = "1 0 obj\n<< /Length 5 >>\nstream\nhello\nendstream\nendobj\n";
        IndirectObject indirect = parser(s).parseIndirectObject();
        PDFStream stream = (PDFStream) indirect.getObject();
        assertEquals("hello", TestPDFs.string(stream.getRawData()));
        assertEquals(s.indexOf("hello"), stream.getDataOffset());
        assertFalse(stream.isLengthProvisional());
    }

    @Test
    public void testStreamWithCRLF() {
        String s = "1 0 obj\n<< /Length 2 >>stream\r\nab\r\nendstream\nendobj";
        PDFStream stream = (PDFStream) parser(s).parseIndirectObject().getObject();
        assertEquals("ab", TestPDFs.string(stream.getRawData()));
    }

    @Test
    public void testStreamWithWrongLength() {
        assertFails(PDFParseException.Kind.UNEXPECTED_TOKEN,
                "1 0 obj\n<< /Length 3 >>\nstream\nhello\nendstream\nendobj");
        assertFails(PDFParseException.Kind.UNEXPECTED_END_OF_FILE,
                "1 0 obj\n<< /Length 500 >>\nstream\nhello\nendstream\nendobj");
        assertFails(PDFParseException.Kind.INVALID_OBJECT,
                "1 0 obj\n<< /Length -1 >>\nstream\nhello\nendstream\nendobj");
        assertFails(PDFParseException.Kind.INVALID_OBJECT,
                "1 0 obj\n<< >>\nstream\nhello\nendstream\nendobj");
        assertFails(PDFParseException.Kind.INVALID_OBJECT,
                "1 0 obj\n<< /Length 4294967296 >>\nstream\nhello\nendstream\nendobj");
    }

    @Test
    public void testRecoverWrongLength() {
        String[] lengths = { "3", "500" };
        for (String length : lengths) {
            ObjectParser parser = parser("1 0 obj\n<< /Length " + length
                    + " /Filter /ASCIIHexDecode >>\nstream\nhello\r\nendstream\nendobj");
            parser.setRecoverLength(true);
            PDFStream stream = (PDFStream) parser.parseIndirectObject().getObject();
            assertEquals("hello", TestPDFs.string(stream.getRawData()));
            assertEquals(5, stream.getDictionary().getInteger(Name.LENGTH, -1));
            assertEquals(new Name("ASCIIHexDecode"), stream.getDictionary().get(Name.FILTER));
            assertFalse(stream.isLengthProvisional());
        }
        // a negative length is not recovered
        ObjectParser parser = parser("1 0 obj\n<< /Length -1 >>\nstream\nhello\nendstream\nendobj");
        parser.setRecoverLength(true);
        try {
            parser.parseIndirectObject();
            fail("Expected invalid object");
        } catch (PDFParseException e) {
            assertEquals(PDFParseException.Kind.INVALID_OBJECT, e.getKind());
        }
    }

    @Test
    public void testStreamWithUnresolvedLength() {
        String s = "1 0 obj\n<< /Length 2 0 R >>\nstream\nhello\r\nendstream\nendobj";
        IndirectObject indirect = parser(s).parseIndirectObject();
        PDFStream stream = (PDFStream) indirect.getObject();
        assertEquals("hello", TestPDFs.string(stream.getRawData()));
        assertTrue(stream.isLengthProvisional());
    }

    @Test
    public void testStreamWithResolvedLength() {
        String s = "1 0 obj\n<< /Length 2 0 R >>\nstream\nhello\nendstream\nendobj";
        ObjectParser parser = parser(s);
        parser.setLengthResolver(new ObjectParser.LengthResolver() {
            @Override
            public int resolveLength(ObjectId ref) {
                assertEquals(new ObjectId(2, 0), ref);
                return 4;
            }
        });
        try {
            parser.parseIndirectObject();
            fail("Length 4 leaves 'o' before endstream");
        } catch (PDFParseException e) {
            assertEquals(PDFParseException.Kind.UNEXPECTED_TOKEN, e.getKind());
        }
        parser = parser(s);
        parser.setLengthResolver(new ObjectParser.LengthResolver() {
            @Override
            public int resolveLength(ObjectId ref) {
                return 5;
            }
        });
        PDFStream stream = (PDFStream) parser.parseIndirectObject().getObject();
        assertFalse(stream.isLengthProvisional());
        assertEquals("hello", TestPDFs.string(stream.getRawData()));
    }

    @Test
    public void testNoStreamInsideContainers() {
        // only a top-level dictionary can introduce a stream
        ObjectParser parser = parser("[<< /Length 0 >>] stream");
        PDFArray array = (PDFArray) parser.parseObject();
        assertEquals(PDFObject.Kind.DICTIONARY, array.get(0).getKind());
        assertTrue(parser.getLexer().nextToken().isKeyword("stream"));
    }

    @Test
    public void testWriteThenParse() {
        PDFDictionary dict = new PDFDictionary()
                .put(Name.TYPE, new Name("Annot"))
                .put("Rect", PDFArray.ofIntegers(0, 0, 100, 50))
                .put("T", new PDFString(TestPDFs.bytes("(paren) \\ back\né")))
                .put("Name With Space", new Name("a/b#c"))
                .put("Ref", new ObjectId(12, 0))
                .put("Scale", PDFNumber.of(0.25))
                .put("Flag", PDFBoolean.TRUE)
                .put("Nothing", PDFNull.INSTANCE)
                .put("Id", new PDFString(new byte[] { 0, (byte) 0xff, 0x10 }, true));
        PDFObject parsed = parse(TestPDFs.string(ObjectWriter.toBytes(dict)));
        assertEquals(dict, parsed);

        PDFObject zeros = parse("[-0.0 -.0 0.0]");
        assertEquals(PDFNumber.of(0.0), ((PDFArray) zeros).get(0));
        assertEquals(zeros, parse(TestPDFs.string(ObjectWriter.toBytes(zeros))));
    }

}
