// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.process;

import ai.kotoba.language.viterbi.NodeType;

/**
 * Formats IPADIC entries, whose features are
 * surface form, part of speech, three part of speech details, conjugated type, conjugated form,
 * basic form, reading and pronunciation.
 */
public class IpadicFormatter implements TokenFormatter {

    private static final int SURFACE_FORM = 0;
    private static final int POS = 1;
    private static final int POS_DETAIL_1 = 2;
    private static final int POS_DETAIL_2 = 3;
    private static final int POS_DETAIL_3 = 4;
    private static final int CONJUGATED_TYPE = 5;
    private static final int CONJUGATED_FORM = 6;
    private static final int BASIC_FORM = 7;
    private static final int READING = 8;
    private static final int PRONUNCIATION = 9;

    @Override
    public Token formatEntry(int wordId, int position, NodeType type, String[] features) {
        return posBuilder(wordId, position, type, features).surfaceForm(feature(features, SURFACE_FORM))
                                                           .reading(feature(features, READING))
                                                           .pronunciation(feature(features, PRONUNCIATION))
                                                           .build();
    }

    /** Unknown words have no reading or pronunciation */
    @Override
    public Token formatUnknownEntry(int wordId, int position, NodeType type, String[] features, String surfaceForm) {
        return posBuilder(wordId, position, type, features).surfaceForm(surfaceForm).build();
    }

    private static Token.Builder posBuilder(int wordId, int position, NodeType type, String[] features) {
        return new Token.Builder().wordId(wordId)
                                  .wordType(type)
                                  .wordPosition(position)
                                  .pos(feature(features, POS))
                                  .posDetail1(feature(features, POS_DETAIL_1))
                                  .posDetail2(feature(features, POS_DETAIL_2))
                                  .posDetail3(feature(features, POS_DETAIL_3))
                                  .conjugatedType(feature(features, CONJUGATED_TYPE))
                                  .conjugatedForm(feature(features, CONJUGATED_FORM))
                                  .basicForm(feature(features, BASIC_FORM));
    }

    private static String feature(String[] features, int index) {
        return index < features.length ? features[index] : null;
    }

}
