// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.trie;

import ai.kotoba.io.GrowableByteBuffer;
import ai.kotoba.io.LittleEndianBuffer;

/**
 * Conversion of double arrays to and from their serialized form: one buffer of little-endian i32 BASE values
 * and one of CHECK values.
 */
public final class DoubleArrays {

    private DoubleArrays() {}

    public static DoubleArray load(byte[] base, byte[] check) {
        return load(LittleEndianBuffer.wrap(base), LittleEndianBuffer.wrap(check));
    }

    public static DoubleArray load(LittleEndianBuffer base, LittleEndianBuffer check) {
        return new DoubleArray(base.toIntArray(), check.toIntArray());
    }

    public static byte[] baseBytes(DoubleArray doubleArray) {
        return GrowableByteBuffer.toBytes(doubleArray.baseArray());
    }

    public static byte[] checkBytes(DoubleArray doubleArray) {
        return GrowableByteBuffer.toBytes(doubleArray.checkArray());
    }

}
