// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.text;

import java.util.Arrays;
import java.util.Objects;

/**
 * A string viewed as a sequence of logical characters, where a UTF-16 surrogate pair
 * counts as one character. Indexes into this are logical positions, not char offsets.
 *
 * A high surrogate always starts a logical character of two chars, whether or not it is followed by
 * a low surrogate, so a dangling high surrogate at the end of the string is a one char logical character.
 */
public final class SurrogateAwareString implements CharSequence {

    private final String string;

    /** The char offset in string of each logical character */
    private final int[] offsets;

    public SurrogateAwareString(String string) {
        this.string = Objects.requireNonNull(string, "string cannot be null");
        int[] offsets = new int[string.length()];
        int count = 0;
        for (int i = 0; i < string.length(); i++) {
            offsets[count++] = i;
            if (isSurrogatePair(string.charAt(i)))
                i++;
        }
        this.offsets = Arrays.copyOf(offsets, count);
    }

    /** Returns the number of logical characters in this */
    public int logicalLength() { return offsets.length; }

    /** Returns the logical character at the given position as a string of one or two chars, or "" if out of range */
    public String characterAt(int index) {
        if (index < 0 || index >= offsets.length) return "";
        int end = index + 1 < offsets.length ? offsets[index + 1] : string.length();
        return string.substring(offsets[index], end);
    }

    /** Returns the text from the given logical position to the end, or "" if out of range */
    public String slice(int index) {
        if (index < 0 || index >= offsets.length) return "";
        return string.substring(offsets[index]);
    }

    /** Returns the text between the given logical positions, end exclusive */
    public String slice(int start, int end) {
        if (start >= end || start >= offsets.length) return "";
        int endOffset = end < offsets.length ? offsets[end] : string.length();
        return string.substring(offsets[start], endOffset);
    }

    /** Returns whether the given char starts a surrogate pair */
    public static boolean isSurrogatePair(char ch) {
        return Character.isHighSurrogate(ch);
    }

    /** Returns whether the given one or two char string is a surrogate pair character */
    public static boolean isSurrogatePair(String character) {
        return ! character.isEmpty() && isSurrogatePair(character.charAt(0));
    }

    /** Returns the number of logical characters in the given string */
    public static int logicalLength(String string) {
        int count = 0;
        for (int i = 0; i < string.length(); i++, count++) {
            if (isSurrogatePair(string.charAt(i)))
                i++;
        }
        return count;
    }

    @Override
    public int length() { return string.length(); }

    @Override
    public char charAt(int index) { return string.charAt(index); }

    @Override
    public CharSequence subSequence(int start, int end) { return string.subSequence(start, end); }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof SurrogateAwareString)) return false;
        return string.equals(((SurrogateAwareString) o).string);
    }

    @Override
    public int hashCode() { return string.hashCode(); }

    @Override
    public String toString() { return string; }

}
