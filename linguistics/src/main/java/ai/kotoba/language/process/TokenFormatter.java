// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.process;

import ai.kotoba.language.viterbi.NodeType;

/**
 * Maps the comma-separated features of a dictionary entry to the fields of a token.
 * Each dictionary format (IPADIC, UniDic, ...) orders its features differently.
 */
public interface TokenFormatter {

    /**
     * Returns the token of a dictionary word.
     *
     * @param wordId the record id of the word
     * @param position the 1-based logical position of the word in the text
     * @param type the kind of word
     * @param features the features of the record, starting with the surface form, which may be empty
     */
    Token formatEntry(int wordId, int position, NodeType type, String[] features);

    /**
     * Returns the token of a word which is not in the dictionary. The first feature of an unknown
     * word entry is the name of its character class, so the surface form is given separately.
     */
    Token formatUnknownEntry(int wordId, int position, NodeType type, String[] features, String surfaceForm);

}
