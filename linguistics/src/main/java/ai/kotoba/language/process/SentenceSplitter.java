// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.process;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Splits text into sentences after each Japanese comma (、) and full stop (。).
 * The punctuation stays at the end of its sentence, and the last sentence may have none.
 */
public final class SentenceSplitter {

    private static final CharMatcher punctuation = CharMatcher.anyOf("、。");

    private SentenceSplitter() {}

    /** Returns the sentences of the given text, which concatenate to the text. Empty text has no sentences. */
    public static List<String> split(String text) {
        ImmutableList.Builder<String> sentences = ImmutableList.builder();
        int start = 0;
        while (start < text.length()) {
            int index = punctuation.indexIn(text, start);
            int end = index < 0 ? text.length() : index + 1;
            sentences.add(text.substring(start, end));
            start = end;
        }
        return sentences.build();
    }

}
