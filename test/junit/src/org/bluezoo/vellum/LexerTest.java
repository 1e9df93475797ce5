/*
 * LexerTest.java
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
 * JUnit 4 tests for {@link Lexer}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LexerTest {

    private static Lexer lexer(String s) {
        return new Lexer(TestPDFs.bytes(s));
    }

    private static Token single(String s) {
        return lexer(s).nextToken();
    }

    @Test
    public void testNames() {
        assertEquals("Type", single("/Type").getText());
        assertEquals("A B", single("/A#20B").getText());
        assertEquals("A", single("/#41").getText());
        assertEquals("", single("/ ").getText());
    }

    @Test
    public void testNameLiteralHash() {
        // not followed by two hex digits
        assertEquals("a#zz", single("/a#zz").getText());
    }

    @Test(expected = PDFLexException.class)
    public void testNameNullCharacter() {
        single("/x#00");
    }

    @Test
    public void testNameTerminatedByDelimiter() {
        Lexer lexer = lexer("/Name/Other[");
        assertEquals("Name", lexer.nextToken().getText());
        assertEquals("Other", lexer.nextToken().getText());
        assertEquals(Token.Type.ARRAY_START, lexer.nextToken().getType());
    }

    @Test
    public void testLiteralStrings() {
        assertEquals("a(b)c", TestPDFs.string(single("(a\\(b\\)c)").getBytes()));
        assertEquals("a(b)c", TestPDFs.string(single("(a(b)c)").getBytes()));
        assertEquals("A01", TestPDFs.string(single("(\\101\\0601)").getBytes()));
        assertEquals("linecontinued", TestPDFs.string(single("(line\\\ncontinued)").getBytes()));
        assertEquals("a\nb", TestPDFs.string(single("(a\r\nb)").getBytes()));
        assertEquals("a\nb", TestPDFs.string(single("(a\rb)").getBytes()));
        assertEquals("\t\\", TestPDFs.string(single("(\\t\\\\)").getBytes()));
        assertEquals(Token.Type.STRING, single("()").getType());
        assertEquals(0, single("()").getBytes().length);
    }

    @Test
    public void testUnknownEscapeIgnoresBackslash() {
        assertEquals("q", TestPDFs.string(single("(\\q)").getBytes()));
    }

    @Test
    public void testUnterminatedString() {
        try {
            single("(abc");
            fail("Expected lex error");
        } catch (PDFLexException e) {
            assertEquals(PDFParseException.Kind.MALFORMED_TOKEN, e.getKind());
            assertEquals(0, e.getOffset());
        }
    }

    @Test
    public void testHexStrings() {
        Token token = single("<48 65 6C6c6F>");
        assertEquals(Token.Type.HEX_STRING, token.getType());
        assertEquals("Hello", TestPDFs.string(token.getBytes()));
        assertArrayEquals(new byte[] { 0x40 }, single("<4>").getBytes());
        assertEquals(0, single("<>").getBytes().length);
    }

    @Test(expected = PDFLexException.class)
    public void testInvalidHexString() {
        single("<4G>");
    }

    @Test
    public void testNumbers() {
        assertEquals(PDFNumber.of(123), single("123").getNumber());
        assertEquals(PDFNumber.of(-17), single("-17").getNumber());
        assertEquals(PDFNumber.of(5), single("+5").getNumber());
        assertEquals(PDFNumber.of(0.5), single(".5").getNumber());
        assertEquals(PDFNumber.of(-0.002), single("-.002").getNumber());
        PDFNumber real = single("4.").getNumber();
        assertFalse(real.isInteger());
        assertEquals(4.0, real.doubleValue(), 0.0);
    }

    @Test
    public void testNumberOverflowBecomesReal() {
        PDFNumber number = single("99999999999999999999").getNumber();
        assertFalse(number.isInteger());
        assertEquals(1e20, number.doubleValue(), 1e6);
    }

    @Test
    public void testMalformedNumbers() {
        String[] bad = { "1.2.3", "-", "--5", "12a" };
        for (String text : bad) {
            try {
                single(text);
                fail("Expected lex error for " + text);
            } catch (PDFLexException e) {
                assertEquals(PDFParseException.Kind.MALFORMED_TOKEN, e.getKind());
            }
        }
    }

    @Test
    public void testDelimiters() {
        Lexer lexer = lexer("[ ] << >>");
        assertEquals(Token.Type.ARRAY_START, lexer.nextToken().getType());
        assertEquals(Token.Type.ARRAY_END, lexer.nextToken().getType());
        assertEquals(Token.Type.DICT_START, lexer.nextToken().getType());
        assertEquals(Token.Type.DICT_END, lexer.nextToken().getType());
        assertEquals(Token.Type.EOF, lexer.nextToken().getType());
    }

    @Test
    public void testInvalidDelimiters() {
        String[] bad = { ")", "{", "}", "> " };
        for (String text : bad) {
            try {
                single(text);
                fail("Expected lex error for " + text);
            } catch (PDFLexException e) {
                assertEquals(0, e.getOffset());
            }
        }
    }

    @Test
    public void testCommentsAreWhitespace() {
        Lexer lexer = lexer("% a comment\n42 % another\r true");
        assertEquals(PDFNumber.of(42), lexer.nextToken().getNumber());
        assertTrue(lexer.nextToken().isKeyword("true"));
        assertEquals(Token.Type.EOF, lexer.nextToken().getType());
    }

    @Test
    public void testKeywords() {
        Lexer lexer = lexer("1 0 R endobj");
        assertTrue(lexer.nextToken().isUnsignedInteger());
        assertTrue(lexer.nextToken().isUnsignedInteger());
        assertTrue(lexer.nextToken().isKeyword("R"));
        Token endobj = lexer.nextToken();
        assertEquals(Token.Type.KEYWORD, endobj.getType());
        assertEquals("endobj", endobj.getText());
    }

    @Test
    public void testOffsets() {
        Lexer lexer = lexer("  /A  (b)");
        Token name = lexer.nextToken();
        assertEquals(2, name.getOffset());
        assertEquals(4, name.getEnd());
        Token string = lexer.nextToken();
        assertEquals(6, string.getOffset());
        assertEquals(9, string.getEnd());
    }

    @Test
    public void testPeekDoesNotConsume() {
        Lexer lexer = lexer("/A /B");
        assertEquals("A", lexer.peek().getText());
        assertEquals(0, lexer.getPosition());
        assertEquals("A", lexer.nextToken().getText());
        lexer.setPosition(0);
        assertEquals("A", lexer.nextToken().getText());
    }

    @Test
    public void testUnsignedInteger() {
        assertTrue(single("0").isUnsignedInteger());
        assertFalse(single("-1").isUnsignedInteger());
        assertFalse(single("1.0").isUnsignedInteger());
        assertFalse(single("/1").isUnsignedInteger());
    }

}
