// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

import ai.kotoba.io.GrowableByteBuffer;
import ai.kotoba.io.LittleEndianBuffer;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The character classes of a char.def file, indexed by class id.
 *
 * <p>Serialized as one entry per class in class id order: u8 always invoke, u8 grouping, i32 max length,
 * NUL-terminated UTF-8 class name.</p>
 */
public final class InvokeDefinitionMap {

    /** Returned by {@link #lookup} for unknown class names */
    public static final int NOT_FOUND = -1;

    private final List<CharacterClass> classes;
    private final Map<String, Integer> idsByName;

    /**
     * Creates an invoke definition map from classes whose ids are their list index.
     *
     * @throws IllegalArgumentException if a class id is not its index, or a name is used twice
     */
    public InvokeDefinitionMap(List<CharacterClass> classes) {
        Map<String, Integer> idsByName = new HashMap<>();
        for (int i = 0; i < classes.size(); i++) {
            CharacterClass characterClass = classes.get(i);
            if (characterClass.classId() != i)
                throw new IllegalArgumentException("Expected class id " + i + " but got " + characterClass);
            if (idsByName.put(characterClass.name(), i) != null)
                throw new IllegalArgumentException("Character class '" + characterClass.name() + "' is defined twice");
        }
        this.classes = ImmutableList.copyOf(classes);
        this.idsByName = ImmutableMap.copyOf(idsByName);
    }

    /** Returns the class with the given id, or empty if none */
    public Optional<CharacterClass> getCharacterClass(int classId) {
        if (classId < 0 || classId >= classes.size()) return Optional.empty();
        return Optional.of(classes.get(classId));
    }

    /** Returns the id of the class with the given name, or NOT_FOUND */
    public int lookup(String className) {
        return idsByName.getOrDefault(className, NOT_FOUND);
    }

    /** Returns all classes in class id order */
    public List<CharacterClass> classes() { return classes; }

    public int size() { return classes.size(); }

    public byte[] toBytes() {
        GrowableByteBuffer buffer = new GrowableByteBuffer(1024);
        for (CharacterClass characterClass : classes) {
            buffer.putByte(characterClass.isAlwaysInvoke() ? 1 : 0);
            buffer.putByte(characterClass.isGrouping() ? 1 : 0);
            buffer.putInt(characterClass.maxLength());
            buffer.putString(characterClass.name());
        }
        return buffer.toByteArray();
    }

    /** Reads a map written by {@link #toBytes}. A trailing partial entry is ignored. */
    public static InvokeDefinitionMap load(LittleEndianBuffer buffer) {
        List<CharacterClass> classes = new ArrayList<>();
        LittleEndianBuffer.Cursor cursor = buffer.cursor();
        while (cursor.hasRemaining(2)) {
            boolean alwaysInvoke = cursor.getByte() == 1;
            boolean grouping = cursor.getByte() == 1;
            int maxLength = cursor.getInt();
            String name = cursor.getString();
            classes.add(new CharacterClass(classes.size(), name, alwaysInvoke, grouping, maxLength));
        }
        return new InvokeDefinitionMap(classes);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof InvokeDefinitionMap)) return false;
        return classes.equals(((InvokeDefinitionMap) o).classes);
    }

    @Override
    public int hashCode() { return classes.hashCode(); }

    @Override
    public String toString() { return "invoke definitions " + classes; }

}
