// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

import ai.kotoba.trie.DoubleArray;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * The complete set of dictionaries used for tokenization: the trie of known surface forms, the
 * known word records, the connection costs and the unknown word entries.
 *
 * <p>Immutable once created, and may be shared by any number of tokenizers.</p>
 */
public final class Dictionaries {

    private static final Logger log = Logger.getLogger(Dictionaries.class.getName());

    private final DoubleArray trie;
    private final TokenInfoDictionary tokenInfoDictionary;
    private final ConnectionCosts connectionCosts;
    private final UnknownDictionary unknownDictionary;

    /**
     * Creates a set of dictionaries.
     *
     * @throws NullPointerException if any argument is null
     * @throws IllegalArgumentException if the character definition has no DEFAULT class
     */
    public Dictionaries(DoubleArray trie, TokenInfoDictionary tokenInfoDictionary,
                        ConnectionCosts connectionCosts, UnknownDictionary unknownDictionary) {
        this.trie = Objects.requireNonNull(trie, "trie cannot be null");
        this.tokenInfoDictionary = Objects.requireNonNull(tokenInfoDictionary, "tokenInfoDictionary cannot be null");
        this.connectionCosts = Objects.requireNonNull(connectionCosts, "connectionCosts cannot be null");
        this.unknownDictionary = Objects.requireNonNull(unknownDictionary, "unknownDictionary cannot be null");
        validateUnknownEntries(unknownDictionary);
    }

    private static void validateUnknownEntries(UnknownDictionary unknownDictionary) {
        InvokeDefinitionMap classes = unknownDictionary.characterDefinition().invokeDefinitionMap();
        if (classes.lookup(CharacterDefinition.DEFAULT_CATEGORY) == InvokeDefinitionMap.NOT_FOUND)
            throw new IllegalArgumentException("The character definition has no " +
                                               CharacterDefinition.DEFAULT_CATEGORY + " class");
        for (CharacterClass characterClass : classes.classes()) {
            if (unknownDictionary.targets(characterClass.classId()).isEmpty())
                log.warning("No unknown word entries for " + characterClass +
                            ": Text starting with such characters may not be tokenized");
        }
    }

    public DoubleArray trie() { return trie; }

    public TokenInfoDictionary tokenInfoDictionary() { return tokenInfoDictionary; }

    public ConnectionCosts connectionCosts() { return connectionCosts; }

    public UnknownDictionary unknownDictionary() { return unknownDictionary; }

    @Override
    public String toString() {
        return "dictionaries: " + tokenInfoDictionary + ", " + connectionCosts + ", " + unknownDictionary;
    }

}
