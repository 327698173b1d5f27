// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.viterbi;

/**
 * The kind of a lattice node.
 */
public enum NodeType {

    /** A word found in the token info dictionary */
    KNOWN,

    /** A word made up from the unknown word entries of a character class */
    UNKNOWN,

    /** Beginning of sentence */
    BOS,

    /** End of sentence */
    EOS

}
