// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.io;

import ai.kotoba.text.Utf8;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A read-only view of a little-endian binary buffer addressed by absolute byte offsets.
 *
 * <p>Reads are bounds checked. The find* methods return empty for reads which would overrun the buffer,
 * while the get* methods return a default value (0, or the empty string) on overrun. The latter is what
 * dictionary readers use, so that a buffer written by a newer or older writer can still be read.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class LittleEndianBuffer {

    private static final LittleEndianBuffer empty = new LittleEndianBuffer(new byte[0]);

    private final byte[] data;

    private LittleEndianBuffer(byte[] data) {
        this.data = data;
    }

    /** Creates a buffer reading the given bytes. The array is not copied and must not be modified later. */
    public static LittleEndianBuffer wrap(byte[] data) {
        return new LittleEndianBuffer(Objects.requireNonNull(data, "data cannot be null"));
    }

    public static LittleEndianBuffer empty() { return empty; }

    /** Returns the size of this in bytes */
    public int size() { return data.length; }

    private boolean inBounds(int index, int width) {
        return index >= 0 && index <= data.length - width;
    }

    /** Returns the unsigned byte at the given index, or empty if out of bounds */
    public OptionalInt findByte(int index) {
        if ( ! inBounds(index, 1)) return OptionalInt.empty();
        return OptionalInt.of(data[index] & 0xff);
    }

    /** Returns the signed 16 bit value at the given index, or empty if it would overrun */
    public OptionalInt findShort(int index) {
        if ( ! inBounds(index, 2)) return OptionalInt.empty();
        return OptionalInt.of((short)((data[index] & 0xff) | (data[index + 1] << 8)));
    }

    /** Returns the 32 bit value at the given index, or empty if it would overrun */
    public OptionalInt findInt(int index) {
        if ( ! inBounds(index, 4)) return OptionalInt.empty();
        return OptionalInt.of((data[index] & 0xff)
                              | (data[index + 1] & 0xff) << 8
                              | (data[index + 2] & 0xff) << 16
                              | (data[index + 3] & 0xff) << 24);
    }

    /** Returns the unsigned byte at the given index. Default on overrun: 0 */
    public int getByte(int index) { return findByte(index).orElse(0); }

    /** Returns the signed short at the given index. Default on overrun: 0 */
    public short getShort(int index) { return (short)findShort(index).orElse(0); }

    /** Returns the int at the given index. Default on overrun: 0 */
    public int getInt(int index) { return findInt(index).orElse(0); }

    /**
     * Returns the NUL-terminated UTF-8 string starting at the given index.
     * Default on overrun: the empty string. A string running to the end of the buffer without a terminator
     * is returned as is.
     */
    public String getString(int index) {
        if ( ! inBounds(index, 1)) return "";
        int end = stringEnd(index);
        return Utf8.toString(data, index, end - index);
    }

    /** Returns the index of the NUL terminator of the string starting at index, or the buffer size if none */
    private int stringEnd(int index) {
        int end = index;
        while (end < data.length && data[end] != 0)
            end++;
        return end;
    }

    /** Reads this as an array of little-endian 16 bit values. A trailing odd byte is ignored. */
    public short[] toShortArray() {
        short[] values = new short[data.length / 2];
        ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asShortBuffer().get(values);
        return values;
    }

    /** Reads this as an array of little-endian 32 bit values. Trailing bytes not filling an int are ignored. */
    public int[] toIntArray() {
        int[] values = new int[data.length / 4];
        ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asIntBuffer().get(values);
        return values;
    }

    /** Returns a copy of the bytes of this */
    public byte[] toByteArray() { return Arrays.copyOf(data, data.length); }

    /** Returns a cursor reading this sequentially from the start */
    public Cursor cursor() { return new Cursor(); }

    @Override
    public String toString() { return "little-endian buffer of " + data.length + " bytes"; }

    /** Sequential reader over the buffer, with the same default-on-overrun semantics as the buffer getters. */
    public final class Cursor {

        private int position = 0;

        private Cursor() {}

        public int position() { return position; }

        /** Returns whether at least the given number of bytes remain */
        public boolean hasRemaining(int bytes) { return inBounds(position, bytes); }

        public int getByte() {
            int value = LittleEndianBuffer.this.getByte(position);
            position += 1;
            return value;
        }

        public int getInt() {
            int value = LittleEndianBuffer.this.getInt(position);
            position += 4;
            return value;
        }

        /** Reads a NUL-terminated string and positions this after the terminator */
        public String getString() {
            if ( ! inBounds(position, 1)) return "";
            int end = stringEnd(position);
            String value = Utf8.toString(data, position, end - position);
            position = end + 1;
            return value;
        }

    }

}
