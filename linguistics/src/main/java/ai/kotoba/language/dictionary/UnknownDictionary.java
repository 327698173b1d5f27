// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

import ai.kotoba.io.LittleEndianBuffer;

import java.util.List;
import java.util.Objects;

/**
 * The generic entries used for words which are not in the dictionary, keyed by character class id.
 * The surface form of an unknown entry is the name of its class.
 */
public final class UnknownDictionary implements RecordDictionary {

    private final RecordStore store;
    private final CharacterDefinition characterDefinition;

    public UnknownDictionary(RecordStore store, CharacterDefinition characterDefinition) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.characterDefinition = Objects.requireNonNull(characterDefinition, "characterDefinition cannot be null");
    }

    /** Returns the class of the first logical character of the given string */
    public CharacterClass lookup(String character) { return characterDefinition.lookup(character); }

    public CharacterDefinition characterDefinition() { return characterDefinition; }

    @Override
    public int leftId(int recordId) { return store.leftId(recordId); }

    @Override
    public int rightId(int recordId) { return store.rightId(recordId); }

    @Override
    public int wordCost(int recordId) { return store.wordCost(recordId); }

    @Override
    public String getFeatures(int recordId) { return store.getFeatures(recordId); }

    /** Returns the unknown word entries of the given character class */
    @Override
    public List<Integer> targets(int classId) { return store.targets(classId); }

    @Override
    public byte[] recordBytes() { return store.recordBytes(); }

    @Override
    public byte[] featureBytes() { return store.featureBytes(); }

    @Override
    public byte[] targetMapBytes() { return store.targetMapBytes(); }

    /** Reads an unknown dictionary from its unk, unk_pos, unk_map, unk_char, unk_compat and unk_invoke buffers */
    public static UnknownDictionary load(LittleEndianBuffer records, LittleEndianBuffer features,
                                         LittleEndianBuffer targetMap, LittleEndianBuffer categories,
                                         LittleEndianBuffer compatibleCategories, LittleEndianBuffer invokeDefinitions) {
        return new UnknownDictionary(RecordStore.load(records, features, targetMap),
                                     CharacterDefinition.load(categories, compatibleCategories, invokeDefinitions));
    }

    @Override
    public String toString() { return "unknown dictionary of " + store.size() + " entries"; }

}
