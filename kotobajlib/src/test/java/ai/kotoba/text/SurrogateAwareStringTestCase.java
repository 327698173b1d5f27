// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SurrogateAwareStringTestCase {

    private static final String yoshi = "𠮷";

    @Test
    public void testLogicalCharacters() {
        SurrogateAwareString s = new SurrogateAwareString(yoshi + "野屋");
        assertEquals(4, s.length());
        assertEquals(3, s.logicalLength());
        assertEquals(yoshi, s.characterAt(0));
        assertEquals("野", s.characterAt(1));
        assertEquals("屋", s.characterAt(2));
        assertEquals("", s.characterAt(3));
    }

    @Test
    public void testSlicing() {
        SurrogateAwareString s = new SurrogateAwareString("あ" + yoshi + "い");
        assertEquals(yoshi + "い", s.slice(1));
        assertEquals("い", s.slice(2));
        assertEquals("", s.slice(3));
        assertEquals("あ" + yoshi, s.slice(0, 2));
        assertEquals(yoshi, s.slice(1, 2));
        assertEquals("", s.slice(2, 2));
        assertEquals(s.toString(), s.slice(0, 10));
    }

    @Test
    public void testDanglingHighSurrogate() {
        SurrogateAwareString s = new SurrogateAwareString("a\uD842");
        assertEquals(2, s.logicalLength());
        assertEquals("\uD842", s.characterAt(1));
        assertEquals(2, SurrogateAwareString.logicalLength("a\uD842"));
    }

    @Test
    public void testStaticHelpers() {
        assertTrue(SurrogateAwareString.isSurrogatePair(yoshi));
        assertFalse(SurrogateAwareString.isSurrogatePair("野"));
        assertFalse(SurrogateAwareString.isSurrogatePair(""));
        assertEquals(0, SurrogateAwareString.logicalLength(""));
        assertEquals(3, SurrogateAwareString.logicalLength(yoshi + "野屋"));
    }

    @Test
    public void testEquality() {
        assertEquals(new SurrogateAwareString("すもも"), new SurrogateAwareString("すもも"));
        assertEquals(new SurrogateAwareString("すもも").hashCode(), new SurrogateAwareString("すもも").hashCode());
    }

}
