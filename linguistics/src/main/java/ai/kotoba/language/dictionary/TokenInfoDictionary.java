// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

import ai.kotoba.io.LittleEndianBuffer;

import java.util.List;
import java.util.Objects;

/**
 * The known words of the dictionary, keyed by the trie id of their surface form.
 * Homographs share a trie id, so a key may have several records.
 */
public final class TokenInfoDictionary implements RecordDictionary {

    private final RecordStore store;

    public TokenInfoDictionary(RecordStore store) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
    }

    @Override
    public int leftId(int recordId) { return store.leftId(recordId); }

    @Override
    public int rightId(int recordId) { return store.rightId(recordId); }

    @Override
    public int wordCost(int recordId) { return store.wordCost(recordId); }

    @Override
    public String getFeatures(int recordId) { return store.getFeatures(recordId); }

    /** Returns the records of the surface form with the given trie id */
    @Override
    public List<Integer> targets(int trieId) { return store.targets(trieId); }

    public int size() { return store.size(); }

    @Override
    public byte[] recordBytes() { return store.recordBytes(); }

    @Override
    public byte[] featureBytes() { return store.featureBytes(); }

    @Override
    public byte[] targetMapBytes() { return store.targetMapBytes(); }

    /** Reads a token info dictionary from its tid, tid_pos and tid_map buffers */
    public static TokenInfoDictionary load(LittleEndianBuffer records, LittleEndianBuffer features,
                                           LittleEndianBuffer targetMap) {
        return new TokenInfoDictionary(RecordStore.load(records, features, targetMap));
    }

    @Override
    public String toString() { return "token info dictionary of " + size() + " words"; }

}
