// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

import ai.kotoba.io.GrowableByteBuffer;
import ai.kotoba.io.LittleEndianBuffer;
import ai.kotoba.text.SurrogateAwareString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The character classes of all UCS-2 code units, from a char.def file.
 * Each code unit has one primary class, and a set of compatible classes stored as a bitset
 * where bit n set means class id n applies.
 *
 * <p>Characters outside the basic multilingual plane (surrogate pairs) cannot be mapped and
 * always have the DEFAULT class, which every character definition must have.</p>
 *
 * <p>Instances are immutable.</p>
 */
public final class CharacterDefinition {

    /** The name of the class of characters which are not otherwise mapped */
    public static final String DEFAULT_CATEGORY = "DEFAULT";

    /** The number of UCS-2 code units */
    public static final int CODE_UNITS = 65536;

    private final byte[] categories;
    private final int[] compatibleCategories;
    private final InvokeDefinitionMap invokeDefinitionMap;
    private final CharacterClass defaultClass;

    /**
     * Creates a character definition.
     *
     * @param categories the primary class id of each code unit, as unsigned bytes
     * @param compatibleCategories the compatible class id bitset of each code unit
     * @param invokeDefinitionMap the character classes
     * @throws IllegalArgumentException if the arrays do not cover all code units or there is no DEFAULT class
     */
    public CharacterDefinition(byte[] categories, int[] compatibleCategories, InvokeDefinitionMap invokeDefinitionMap) {
        if (categories.length != CODE_UNITS)
            throw new IllegalArgumentException("Expected " + CODE_UNITS + " character categories, got " + categories.length);
        if (compatibleCategories.length != CODE_UNITS)
            throw new IllegalArgumentException("Expected " + CODE_UNITS + " compatible categories, got " +
                                               compatibleCategories.length);
        this.categories = categories;
        this.compatibleCategories = compatibleCategories;
        this.invokeDefinitionMap = Objects.requireNonNull(invokeDefinitionMap, "invokeDefinitionMap cannot be null");
        this.defaultClass = invokeDefinitionMap.getCharacterClass(invokeDefinitionMap.lookup(DEFAULT_CATEGORY))
                .orElseThrow(() -> new IllegalArgumentException("The character definition has no " + DEFAULT_CATEGORY +
                                                                " class"));
    }

    /**
     * Returns the primary class of the first logical character of the given string.
     * Surrogate pairs, the empty string and code units mapped to an undefined class id give the DEFAULT class.
     */
    public CharacterClass lookup(String character) {
        if (character.isEmpty() || SurrogateAwareString.isSurrogatePair(character)) return defaultClass;
        return lookup(character.charAt(0));
    }

    /** Returns the primary class of the given code unit */
    public CharacterClass lookup(char ch) {
        int classId = categories[ch] & 0xff;
        return invokeDefinitionMap.getCharacterClass(classId).orElse(defaultClass);
    }

    /** Returns the compatible classes of the first code unit of the given string, in class id order */
    public List<CharacterClass> lookupCompatibleCategory(String character) {
        if (character.isEmpty()) return List.of();
        int bitset = compatibleCategories[character.charAt(0)];
        List<CharacterClass> classes = new ArrayList<>();
        for (int bit = 0; bit < 32; bit++) {
            if ((bitset >>> bit & 1) == 1)
                invokeDefinitionMap.getCharacterClass(bit).ifPresent(classes::add);
        }
        return classes;
    }

    public InvokeDefinitionMap invokeDefinitionMap() { return invokeDefinitionMap; }

    public CharacterClass defaultClass() { return defaultClass; }

    /** Returns the unk_char buffer: one unsigned byte class id per code unit */
    public byte[] categoryBytes() { return Arrays.copyOf(categories, categories.length); }

    /** Returns the unk_compat buffer: one little-endian u32 bitset per code unit */
    public byte[] compatibleCategoryBytes() { return GrowableByteBuffer.toBytes(compatibleCategories); }

    /** Returns the unk_invoke buffer */
    public byte[] invokeDefinitionBytes() { return invokeDefinitionMap.toBytes(); }

    /**
     * Reads a character definition from its three buffers.
     *
     * @throws IllegalArgumentException if the buffers are not a valid character definition
     */
    public static CharacterDefinition load(LittleEndianBuffer categories,
                                           LittleEndianBuffer compatibleCategories,
                                           LittleEndianBuffer invokeDefinitions) {
        return new CharacterDefinition(categories.toByteArray(),
                                       compatibleCategories.toIntArray(),
                                       InvokeDefinitionMap.load(invokeDefinitions));
    }

    @Override
    public String toString() { return "character definition of " + invokeDefinitionMap.size() + " classes"; }

}
