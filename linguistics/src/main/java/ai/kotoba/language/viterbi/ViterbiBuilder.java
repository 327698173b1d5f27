// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.viterbi;

import ai.kotoba.language.dictionary.CharacterClass;
import ai.kotoba.language.dictionary.Dictionaries;
import ai.kotoba.language.dictionary.TokenInfoDictionary;
import ai.kotoba.language.dictionary.UnknownDictionary;
import ai.kotoba.text.SurrogateAwareString;
import ai.kotoba.trie.DoubleArray;
import ai.kotoba.trie.Match;

import java.util.List;
import java.util.Objects;

/**
 * Builds the lattice of all candidate words of a sentence: every dictionary word starting at each
 * character, and words made from the unknown word entries of the character's class where there are
 * no dictionary words or the class is always invoked.
 *
 * <p>Positions and lengths are in logical characters, so a surrogate pair counts as one.</p>
 */
public final class ViterbiBuilder {

    private final DoubleArray trie;
    private final TokenInfoDictionary tokenInfoDictionary;
    private final UnknownDictionary unknownDictionary;

    public ViterbiBuilder(Dictionaries dictionaries) {
        Objects.requireNonNull(dictionaries, "dictionaries cannot be null");
        this.trie = dictionaries.trie();
        this.tokenInfoDictionary = dictionaries.tokenInfoDictionary();
        this.unknownDictionary = dictionaries.unknownDictionary();
    }

    /** Returns the complete lattice of the given sentence */
    public ViterbiLattice build(String sentence) {
        Objects.requireNonNull(sentence, "sentence cannot be null");
        ViterbiLattice lattice = new ViterbiLattice();
        SurrogateAwareString text = new SurrogateAwareString(sentence);
        for (int pos = 0; pos < text.logicalLength(); pos++) {
            String tail = text.slice(pos);
            boolean hasKnownWords = addKnownWords(tail, pos + 1, lattice);
            addUnknownWords(text, pos, hasKnownWords, lattice);
        }
        lattice.appendEos();
        return lattice;
    }

    private boolean addKnownWords(String tail, int startPos, ViterbiLattice lattice) {
        List<Match> matches = trie.commonPrefixSearch(tail);
        for (Match match : matches) {
            int length = SurrogateAwareString.logicalLength(match.key());
            for (int tokenInfoId : tokenInfoDictionary.targets(match.value())) {
                lattice.append(tokenInfoId,
                               tokenInfoDictionary.wordCost(tokenInfoId),
                               startPos,
                               length,
                               NodeType.KNOWN,
                               tokenInfoDictionary.leftId(tokenInfoId),
                               tokenInfoDictionary.rightId(tokenInfoId),
                               match.key());
            }
        }
        return ! matches.isEmpty();
    }

    private void addUnknownWords(SurrogateAwareString text, int pos, boolean hasKnownWords, ViterbiLattice lattice) {
        CharacterClass head = unknownDictionary.lookup(text.characterAt(pos));
        if (hasKnownWords && ! head.isAlwaysInvoke()) return;

        int end = pos + 1;
        if (head.isGrouping()) {
            while (end < text.logicalLength() && head.name().equals(unknownDictionary.lookup(text.characterAt(end)).name()))
                end++;
        }
        String key = text.slice(pos, end);
        int length = end - pos;
        for (int unknownId : unknownDictionary.targets(head.classId())) {
            lattice.append(unknownId,
                           unknownDictionary.wordCost(unknownId),
                           pos + 1,
                           length,
                           NodeType.UNKNOWN,
                           unknownDictionary.leftId(unknownId),
                           unknownDictionary.rightId(unknownId),
                           key);
        }
    }

}
