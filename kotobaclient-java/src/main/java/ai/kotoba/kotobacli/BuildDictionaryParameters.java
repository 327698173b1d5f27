// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.kotobacli;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * The parameters of the build-dictionary command.
 */
public class BuildDictionaryParameters {

    private final String inputDirectory;
    private final String outputDirectory;
    private final Charset encoding;

    private BuildDictionaryParameters(Builder builder) {
        this.inputDirectory = builder.inputDirectory;
        this.outputDirectory = builder.outputDirectory;
        this.encoding = builder.encoding;
    }

    /** Returns the directory of the seed files: *.csv, matrix.def, char.def and unk.def */
    public String inputDirectory() { return inputDirectory; }

    /** Returns the directory to write the binary dictionary to */
    public String outputDirectory() { return outputDirectory; }

    /** Returns the encoding of the seed files */
    public Charset encoding() { return encoding; }

    public static Builder builder() { return new Builder(); }

    public static class Builder {

        private String inputDirectory;
        private String outputDirectory;
        private Charset encoding = StandardCharsets.UTF_8;

        public Builder inputDirectory(String inputDirectory) {
            this.inputDirectory = inputDirectory;
            return this;
        }

        public Builder outputDirectory(String outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        /**
         * Sets the encoding of the seed files by name, e.g. UTF-8 or EUC-JP. Null keeps UTF-8.
         *
         * @throws IllegalArgumentException if the encoding is not supported
         */
        public Builder encoding(String encoding) {
            if (encoding != null)
                this.encoding = Charset.forName(encoding);
            return this;
        }

        public BuildDictionaryParameters build() {
            return new BuildDictionaryParameters(this);
        }

    }

}
