// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.io;

import ai.kotoba.text.Utf8;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * GrowableByteBuffer encapsulates a little-endian ByteBuffer and grows it as needed.
 * When growing, a new buffer is allocated, the old contents are copied into it,
 * and the position is kept. The growth factor decides the new size; the default is 2.0,
 * meaning that the buffer doubles its size when growing.
 *
 * This is the write side of the binary dictionary formats, see {@link LittleEndianBuffer} for reading.
 */
public class GrowableByteBuffer {

    public static final int DEFAULT_BASE_SIZE = 64 * 1024;
    public static final float DEFAULT_GROW_FACTOR = 2.0f;

    private ByteBuffer buffer;
    private final float growFactor;

    public GrowableByteBuffer() {
        this(DEFAULT_BASE_SIZE, DEFAULT_GROW_FACTOR);
    }

    public GrowableByteBuffer(int baseSize) {
        this(baseSize, DEFAULT_GROW_FACTOR);
    }

    public GrowableByteBuffer(int baseSize, float growFactor) {
        if (growFactor <= 1.00f)
            throw new IllegalArgumentException("Growth factor must be greater than 1.00f, otherwise buffer will never grow!");
        this.growFactor = growFactor;
        buffer = ByteBuffer.allocate(baseSize).order(ByteOrder.LITTLE_ENDIAN);
    }

    /** Returns the number of bytes written so far, which is also the offset of the next byte written */
    public int position() { return buffer.position(); }

    public int capacity() { return buffer.capacity(); }

    private void grow(int newSize) {
        ByteBuffer newBuffer = ByteBuffer.allocate(newSize).order(ByteOrder.LITTLE_ENDIAN);
        int position = buffer.position();
        buffer.flip();
        newBuffer.put(buffer);
        newBuffer.position(position);
        buffer = newBuffer;
    }

    private void accommodate(int putSize) {
        int position = buffer.position();
        int size = buffer.capacity();
        if (size - position >= putSize) return;

        while (size - position < putSize)
            size = (int) ((((float) size) * growFactor) + 100.0);
        grow(size);
    }

    /** Writes one byte. Values outside -128..255 are rejected. */
    public GrowableByteBuffer putByte(int value) {
        if (value < Byte.MIN_VALUE || value > 0xff)
            throw new IllegalArgumentException(value + " is out of byte range");
        accommodate(1);
        buffer.put((byte) value);
        return this;
    }

    /** Writes a 16 bit value. Values outside -32768..65535 are rejected. */
    public GrowableByteBuffer putShort(int value) {
        if (value < Short.MIN_VALUE || value > 0xffff)
            throw new IllegalArgumentException(value + " is out of short range");
        accommodate(2);
        buffer.putShort((short) value);
        return this;
    }

    public GrowableByteBuffer putInt(int value) {
        accommodate(4);
        buffer.putInt(value);
        return this;
    }

    /**
     * Writes a string as UTF-8 followed by a NUL terminator.
     *
     * @throws IllegalArgumentException if the string contains a NUL or a malformed surrogate pair
     */
    public GrowableByteBuffer putString(String value) {
        if (value.indexOf('\0') >= 0)
            throw new IllegalArgumentException("Cannot write a string containing NUL: '" + value + "'");
        byte[] bytes = Utf8.toBytesStrict(value);
        if (bytes == null)
            throw new IllegalArgumentException("Cannot encode '" + value + "' as UTF-8");
        accommodate(bytes.length + 1);
        buffer.put(bytes);
        buffer.put((byte) 0);
        return this;
    }

    /** Returns a copy of the bytes written so far, i.e the buffer shrunk to its position */
    public byte[] toByteArray() {
        return Arrays.copyOf(buffer.array(), buffer.position());
    }

    /** Returns a reader of the bytes written so far */
    public LittleEndianBuffer toReadable() {
        return LittleEndianBuffer.wrap(toByteArray());
    }

    /** Returns the little-endian encoding of the given values */
    public static byte[] toBytes(int[] values) {
        ByteBuffer bytes = ByteBuffer.allocate(values.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        bytes.asIntBuffer().put(values);
        return bytes.array();
    }

    /** Returns the little-endian encoding of the given values */
    public static byte[] toBytes(short[] values) {
        ByteBuffer bytes = ByteBuffer.allocate(values.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        bytes.asShortBuffer().put(values);
        return bytes.array();
    }

    @Override
    public String toString() {
        return "GrowableByteBuffer(position " + buffer.position() + ", capacity " + buffer.capacity() + ")";
    }

}
