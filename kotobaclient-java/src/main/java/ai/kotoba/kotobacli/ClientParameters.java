// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.kotobacli;

/**
 * The parameters of the tokenize command.
 */
public class ClientParameters {

    // Show help page if true
    public final boolean help;

    // Directory of the binary dictionary
    public final String dictionaryDirectory;

    // Text to tokenize, or null to tokenize each line of standard input
    public final String text;

    // Output format: json or text
    public final String format;

    public ClientParameters(boolean help, String dictionaryDirectory, String text, String format) {
        this.help = help;
        this.dictionaryDirectory = dictionaryDirectory;
        this.text = text;
        this.format = format;
    }

    public static class Builder {

        private boolean help;
        private String dictionaryDirectory;
        private String text;
        private String format;

        public Builder setHelp(boolean help) {
            this.help = help;
            return this;
        }

        public Builder setDictionaryDirectory(String dictionaryDirectory) {
            this.dictionaryDirectory = dictionaryDirectory;
            return this;
        }

        public Builder setText(String text) {
            this.text = text;
            return this;
        }

        public Builder setFormat(String format) {
            this.format = format;
            return this;
        }

        public ClientParameters build() {
            return new ClientParameters(help, dictionaryDirectory, text, format);
        }

    }

}
