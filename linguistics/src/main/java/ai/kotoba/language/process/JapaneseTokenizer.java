// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.process;

import ai.kotoba.language.dictionary.Dictionaries;
import ai.kotoba.language.dictionary.RecordDictionary;
import ai.kotoba.language.viterbi.ViterbiBuilder;
import ai.kotoba.language.viterbi.ViterbiLattice;
import ai.kotoba.language.viterbi.ViterbiNode;
import ai.kotoba.language.viterbi.ViterbiSearcher;
import ai.kotoba.text.SurrogateAwareString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tokenizes Japanese text by finding the cheapest segmentation of each sentence
 * through the lattice of its dictionary and unknown words.
 *
 * <p>Word positions are 1-based logical character positions in the whole text.
 * This is thread safe: each call builds its own lattice over the shared immutable dictionaries.</p>
 */
public class JapaneseTokenizer implements Tokenizer {

    private final Dictionaries dictionaries;
    private final ViterbiBuilder viterbiBuilder;
    private final ViterbiSearcher viterbiSearcher;
    private final TokenFormatter formatter;

    public JapaneseTokenizer(Dictionaries dictionaries) {
        this(dictionaries, new IpadicFormatter());
    }

    public JapaneseTokenizer(Dictionaries dictionaries, TokenFormatter formatter) {
        this.dictionaries = Objects.requireNonNull(dictionaries, "dictionaries cannot be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter cannot be null");
        this.viterbiBuilder = new ViterbiBuilder(dictionaries);
        this.viterbiSearcher = new ViterbiSearcher(dictionaries.connectionCosts());
    }

    @Override
    public List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        List<Token> tokens = new ArrayList<>();
        int offset = 0;
        for (String sentence : SentenceSplitter.split(text)) {
            tokenizeForSentence(sentence, offset, tokens);
            offset += SurrogateAwareString.logicalLength(sentence);
        }
        return tokens;
    }

    /** Returns the tokens of a single sentence, with positions relative to the sentence */
    public List<Token> tokenizeForSentence(String sentence) {
        return tokenizeForSentence(sentence, 0, new ArrayList<>());
    }

    /**
     * Adds the tokens of the given sentence to the given list.
     *
     * @param offset the logical length of the text preceding the sentence, which is added to word positions
     * @return the given token list
     */
    public List<Token> tokenizeForSentence(String sentence, int offset, List<Token> tokens) {
        for (ViterbiNode node : viterbiSearcher.search(getLattice(sentence)))
            tokens.add(format(node, offset));
        return tokens;
    }

    /** Returns the complete lattice of all candidate words of the given sentence, before search */
    public ViterbiLattice getLattice(String sentence) {
        return viterbiBuilder.build(sentence);
    }

    private Token format(ViterbiNode node, int offset) {
        int position = node.startPos() + offset;
        switch (node.type()) {
            case KNOWN:
                return formatter.formatEntry(node.name(), position, node.type(),
                                             features(dictionaries.tokenInfoDictionary(), node.name()));
            case UNKNOWN:
                return formatter.formatUnknownEntry(node.name(), position, node.type(),
                                                    features(dictionaries.unknownDictionary(), node.name()),
                                                    node.surfaceForm());
            default:
                return formatter.formatEntry(node.name(), position, node.type(), new String[0]);
        }
    }

    private static String[] features(RecordDictionary dictionary, int recordId) {
        String features = dictionary.getFeatures(recordId);
        if (features.isEmpty()) return new String[0];
        return features.split(",", -1);
    }

    public Dictionaries dictionaries() { return dictionaries; }

}
