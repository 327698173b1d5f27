// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

import java.util.Objects;

/**
 * A named category of characters, such as KANJI or HIRAGANA, which decides how unknown words
 * starting with such a character are formed.
 */
public final class CharacterClass {

    private final int classId;
    private final String name;
    private final boolean alwaysInvoke;
    private final boolean grouping;
    private final int maxLength;

    /**
     * Creates a character class.
     *
     * @param classId the id of this class, its index in the char.def definition order
     * @param name the class name
     * @param alwaysInvoke whether unknown words are added at a position even when known words are found there
     * @param grouping whether an unknown word extends over the following characters of the same class
     * @param maxLength the max length of unknown words of this class. This is stored but not applied
     */
    public CharacterClass(int classId, String name, boolean alwaysInvoke, boolean grouping, int maxLength) {
        if (classId < 0 || classId > 255)
            throw new IllegalArgumentException("Class id must be in 0..255, but was " + classId);
        this.classId = classId;
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.alwaysInvoke = alwaysInvoke;
        this.grouping = grouping;
        this.maxLength = maxLength;
    }

    public int classId() { return classId; }

    public String name() { return name; }

    public boolean isAlwaysInvoke() { return alwaysInvoke; }

    public boolean isGrouping() { return grouping; }

    public int maxLength() { return maxLength; }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof CharacterClass)) return false;
        CharacterClass other = (CharacterClass) o;
        return classId == other.classId && name.equals(other.name) && alwaysInvoke == other.alwaysInvoke &&
               grouping == other.grouping && maxLength == other.maxLength;
    }

    @Override
    public int hashCode() { return Objects.hash(classId, name, alwaysInvoke, grouping, maxLength); }

    @Override
    public String toString() {
        return "character class " + classId + " " + name + " (invoke " + (alwaysInvoke ? 1 : 0) +
               ", group " + (grouping ? 1 : 0) + ", length " + maxLength + ")";
    }

}
