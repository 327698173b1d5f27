// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.text;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Utility class with functions for handling UTF-8.
 *
 * Unlike String.getBytes, the strict encoder here never substitutes malformed input:
 * a string with an unpaired surrogate has no encoding.
 */
public final class Utf8 {

    private Utf8() {}

    /**
     * Encodes a string as UTF-8, failing on unpaired surrogates.
     *
     * @return the encoded bytes, or null if the string contains a malformed surrogate pair
     */
    public static byte[] toBytesStrict(CharSequence string) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                                                       .onMalformedInput(CodingErrorAction.REPORT)
                                                       .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(string));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    /** Decodes the given range of UTF-8 bytes. */
    public static String toString(byte[] data, int offset, int length) {
        return new String(data, offset, length, StandardCharsets.UTF_8);
    }

    /** Decodes UTF-8 bytes. */
    public static String toString(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }

}
