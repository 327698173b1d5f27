// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.process;

import ai.kotoba.language.dictionary.Dictionaries;
import ai.kotoba.language.dictionary.loader.DictionaryLoader;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Creates tokenizers by loading their dictionary as given by {@link TokenizerParameters}.
 * Loading reads the whole dictionary, so callers should build once and share the tokenizer.
 */
public class TokenizerBuilder {

    private static final Logger log = Logger.getLogger(TokenizerBuilder.class.getName());

    private final TokenizerParameters parameters;

    public TokenizerBuilder() {
        this(TokenizerParameters.defaults());
    }

    public TokenizerBuilder(TokenizerParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
    }

    /**
     * Loads the dictionary and returns a tokenizer using it.
     *
     * @throws java.io.UncheckedIOException if the dictionary cannot be read
     * @throws IllegalArgumentException if the dictionary is invalid
     */
    public JapaneseTokenizer build() {
        log.fine(() -> "Building tokenizer from " + parameters);
        Dictionaries dictionaries = loader().load();
        return new JapaneseTokenizer(dictionaries, parameters.formatter());
    }

    private DictionaryLoader loader() {
        if (parameters.dictionaryDirectory().isPresent())
            return DictionaryLoader.fromDirectory(parameters.dictionaryDirectory().get());
        return DictionaryLoader.fromClasspath(parameters.classpathPrefix());
    }

}
