// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.process;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * The parameters of a tokenizer: where to load its dictionary from, and how to format its tokens.
 * The dictionary is loaded from a directory if one is set, and otherwise from the class path.
 */
public class TokenizerParameters {

    /** The class path prefix of the dictionary files unless another is set */
    public static final String DEFAULT_CLASSPATH_PREFIX = "dict/";

    private final Path dictionaryDirectory;
    private final String classpathPrefix;
    private final TokenFormatter formatter;

    private TokenizerParameters(Path dictionaryDirectory, String classpathPrefix, TokenFormatter formatter) {
        this.dictionaryDirectory = dictionaryDirectory;
        this.classpathPrefix = Objects.requireNonNull(classpathPrefix, "classpathPrefix cannot be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter cannot be null");
    }

    /** Returns the directory holding the dictionary files, or empty to load them from the class path */
    public Optional<Path> dictionaryDirectory() { return Optional.ofNullable(dictionaryDirectory); }

    public String classpathPrefix() { return classpathPrefix; }

    public TokenFormatter formatter() { return formatter; }

    @Override
    public String toString() {
        return "tokenizer parameters: dictionary " +
               (dictionaryDirectory != null ? "directory " + dictionaryDirectory : "class path '" + classpathPrefix + "'") +
               ", formatter " + formatter.getClass().getSimpleName();
    }

    public static TokenizerParameters defaults() { return new Builder().build(); }

    public static class Builder {

        private Path dictionaryDirectory = null;
        private String classpathPrefix = DEFAULT_CLASSPATH_PREFIX;
        private TokenFormatter formatter = new IpadicFormatter();

        public Builder setDictionaryDirectory(Path dictionaryDirectory) {
            this.dictionaryDirectory = dictionaryDirectory;
            return this;
        }

        public Builder setDictionaryDirectory(String dictionaryDirectory) {
            return setDictionaryDirectory(dictionaryDirectory == null ? null : Path.of(dictionaryDirectory));
        }

        public Builder setClasspathPrefix(String classpathPrefix) {
            this.classpathPrefix = classpathPrefix;
            return this;
        }

        public Builder setFormatter(TokenFormatter formatter) {
            this.formatter = formatter;
            return this;
        }

        public TokenizerParameters build() {
            return new TokenizerParameters(dictionaryDirectory, classpathPrefix, formatter);
        }

    }

}
