// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.kotobacli;

import ai.kotoba.language.dictionary.Dictionaries;
import ai.kotoba.language.dictionary.builder.DictionaryBuilder;
import ai.kotoba.language.dictionary.builder.DictionaryWriter;
import ai.kotoba.yolean.Exceptions;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Builds a binary dictionary from a directory of MeCab seed files and writes it to an output directory.
 */
public class BuildDictionaryCommand {

    private static final Logger log = Logger.getLogger(BuildDictionaryCommand.class.getName());

    private final BuildDictionaryParameters params;
    private final PrintStream err;

    public BuildDictionaryCommand(BuildDictionaryParameters params) {
        this(params, System.err);
    }

    public BuildDictionaryCommand(BuildDictionaryParameters params, PrintStream err) {
        this.params = params;
        this.err = err;
    }

    /** Runs this and returns the exit status */
    public int run() {
        try {
            Path input = Path.of(params.inputDirectory());
            Path output = Path.of(params.outputDirectory());
            log.info("Building dictionary from " + input + " (" + params.encoding() + ")");
            Dictionaries dictionaries = new DictionaryBuilder().addSeedDirectory(input, params.encoding()).build();
            DictionaryWriter.write(dictionaries, output);
            return 0;
        }
        catch (RuntimeException e) {
            err.println("Error: " + Exceptions.toMessageString(e));
            return 1;
        }
    }

}
