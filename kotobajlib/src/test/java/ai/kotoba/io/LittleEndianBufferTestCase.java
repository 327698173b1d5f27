// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.io;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LittleEndianBufferTestCase {

    @Test
    public void testReadsLittleEndian() {
        LittleEndianBuffer buffer = LittleEndianBuffer.wrap(new byte[] { 0x01, 0x02, 0x03, 0x04, (byte)0xff, (byte)0xff });
        assertEquals(6, buffer.size());
        assertEquals(0x01, buffer.getByte(0));
        assertEquals(0xff, buffer.getByte(4));
        assertEquals(0x0201, buffer.getShort(0));
        assertEquals(-1, buffer.getShort(4));
        assertEquals(0x04030201, buffer.getInt(0));
        assertEquals(0xffff0403, buffer.getInt(2));
    }

    @Test
    public void testDefaultOnOverrun() {
        LittleEndianBuffer buffer = LittleEndianBuffer.wrap(new byte[] { 0x01, 0x02, 0x03 });
        assertEquals(0, buffer.getInt(0));
        assertEquals(0, buffer.getShort(2));
        assertEquals(0, buffer.getByte(3));
        assertEquals(0, buffer.getByte(-1));
        assertEquals("", buffer.getString(3));
        assertEquals(OptionalInt.empty(), buffer.findInt(0));
        assertEquals(OptionalInt.of(0x0302), buffer.findShort(1));

        assertEquals(0, LittleEndianBuffer.empty().getInt(0));
        assertEquals("", LittleEndianBuffer.empty().getString(0));
    }

    @Test
    public void testStrings() {
        LittleEndianBuffer buffer = new GrowableByteBuffer(4).putString("すもも").putString("").putString("もも").toReadable();
        assertEquals("すもも", buffer.getString(0));
        assertEquals("", buffer.getString(9));
        assertEquals("", buffer.getString(10));
        assertEquals("もも", buffer.getString(11));
        assertEquals("も", buffer.getString(14));

        LittleEndianBuffer unterminated = LittleEndianBuffer.wrap(new byte[] { 'a', 'b' });
        assertEquals("ab", unterminated.getString(0));
    }

    @Test
    public void testCursor() {
        LittleEndianBuffer buffer = new GrowableByteBuffer().putInt(2).putByte(7).putString("の").toReadable();
        LittleEndianBuffer.Cursor cursor = buffer.cursor();
        assertTrue(cursor.hasRemaining(4));
        assertEquals(2, cursor.getInt());
        assertEquals(7, cursor.getByte());
        assertEquals("の", cursor.getString());
        assertEquals(buffer.size(), cursor.position());
        assertFalse(cursor.hasRemaining(1));
        assertEquals(0, cursor.getInt());
        assertEquals("", cursor.getString());
    }

    @Test
    public void testArrayViews() {
        int[] ints = { 0, -1, 65536, Integer.MIN_VALUE };
        assertArrayEquals(ints, LittleEndianBuffer.wrap(GrowableByteBuffer.toBytes(ints)).toIntArray());
        short[] shorts = { 0, -1, 1000, Short.MAX_VALUE };
        assertArrayEquals(shorts, LittleEndianBuffer.wrap(GrowableByteBuffer.toBytes(shorts)).toShortArray());
        assertEquals(1, LittleEndianBuffer.wrap(new byte[] { 1, 0, 0, 0, 9 }).toIntArray().length);
    }

}
