// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.process;

import java.util.List;

/**
 * A morphological analyzer which segments text into annotated tokens.
 *
 * <p>Implementations must be thread safe.</p>
 */
public interface Tokenizer {

    /**
     * Returns the tokens of the given text, in text order.
     *
     * @param text the text to tokenize, which may be empty
     * @return the tokens, which is empty if the text is empty
     */
    List<Token> tokenize(String text);

}
