// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary.builder;

import ai.kotoba.io.IOUtils;
import ai.kotoba.language.dictionary.CharacterDefinition;
import ai.kotoba.language.dictionary.ConnectionCosts;
import ai.kotoba.language.dictionary.Dictionaries;
import ai.kotoba.language.dictionary.InvokeDefinitionMap;
import ai.kotoba.language.dictionary.RecordStore;
import ai.kotoba.language.dictionary.TokenInfoDictionary;
import ai.kotoba.language.dictionary.UnknownDictionary;
import ai.kotoba.trie.DoubleArray;
import ai.kotoba.trie.DoubleArrayBuilder;
import ai.kotoba.yolean.Exceptions;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds dictionaries from MeCab/IPADIC style seed files:
 * <ul>
 *     <li>Token info lines from *.csv files: surface,left_id,right_id,word_cost,features...</li>
 *     <li>matrix.def: connection costs, see {@link ConnectionCostsBuilder}</li>
 *     <li>char.def: character classes, see {@link CharacterDefinitionBuilder}</li>
 *     <li>unk.def: unknown word entries in the csv format, with a character class name as surface form</li>
 * </ul>
 *
 * <p>A builder may be used for one build only.</p>
 */
public class DictionaryBuilder {

    private static final Logger log = Logger.getLogger(DictionaryBuilder.class.getName());

    public static final String MATRIX_DEF = "matrix.def";
    public static final String CHAR_DEF = "char.def";
    public static final String UNK_DEF = "unk.def";

    private final List<Entry> tokenInfoEntries = new ArrayList<>();
    private final List<Entry> unknownEntries = new ArrayList<>();
    private final ConnectionCostsBuilder connectionCosts = new ConnectionCostsBuilder();
    private final CharacterDefinitionBuilder characterDefinition = new CharacterDefinitionBuilder();
    private boolean built = false;

    /**
     * Adds a known word line. Lines with fewer than four fields are ignored,
     * and lines with ids or costs which are not numbers are logged and skipped.
     */
    public DictionaryBuilder addTokenInfoDictionary(String line) {
        Entry.parse(line).ifPresent(tokenInfoEntries::add);
        return this;
    }

    /** Adds a line of matrix.def */
    public DictionaryBuilder putCostMatrixLine(String line) {
        connectionCosts.putLine(line);
        return this;
    }

    /** Adds all lines of a matrix.def text */
    public DictionaryBuilder costMatrix(String text) {
        text.lines().forEach(this::putCostMatrixLine);
        return this;
    }

    /** Adds a line of char.def */
    public DictionaryBuilder putCharDefLine(String line) {
        characterDefinition.putLine(line);
        return this;
    }

    /** Adds all lines of a char.def text */
    public DictionaryBuilder charDef(String text) {
        text.lines().forEach(this::putCharDefLine);
        return this;
    }

    /** Adds a line of unk.def, subject to the same rules as known word lines */
    public DictionaryBuilder putUnkDefLine(String line) {
        Entry.parse(line).ifPresent(unknownEntries::add);
        return this;
    }

    /** Adds all lines of an unk.def text */
    public DictionaryBuilder unkDef(String text) {
        text.lines().forEach(this::putUnkDefLine);
        return this;
    }

    /**
     * Adds the seed files of a directory: all *.csv files in name order, and matrix.def, char.def and unk.def.
     *
     * @param encoding the encoding of the files, typically UTF-8 or EUC-JP
     * @throws java.io.UncheckedIOException if the directory or a required file cannot be read
     */
    public DictionaryBuilder addSeedDirectory(Path directory, Charset encoding) {
        List<Path> csvFiles = Exceptions.uncheck(() -> {
            try (Stream<Path> files = Files.list(directory)) {
                return files.filter(file -> file.getFileName().toString().endsWith(".csv"))
                            .sorted()
                            .collect(Collectors.toList());
            }
        }, "Could not list seed directory %s", directory);
        for (Path csvFile : csvFiles)
            readLines(csvFile, encoding).forEach(this::addTokenInfoDictionary);
        readLines(directory.resolve(MATRIX_DEF), encoding).forEach(this::putCostMatrixLine);
        readLines(directory.resolve(CHAR_DEF), encoding).forEach(this::putCharDefLine);
        readLines(directory.resolve(UNK_DEF), encoding).forEach(this::putUnkDefLine);
        log.info("Read " + tokenInfoEntries.size() + " words from " + csvFiles.size() + " csv files in " + directory);
        return this;
    }

    private static List<String> readLines(Path file, Charset encoding) {
        return Exceptions.uncheck(() -> IOUtils.readLines(file, encoding), "Could not read %s", file);
    }

    /**
     * Builds the dictionaries.
     *
     * @throws IllegalArgumentException if the matrix has no dimensions or char.def has no DEFAULT class
     */
    public Dictionaries build() {
        if (built)
            throw new IllegalStateException("This builder has already been used");
        built = true;

        DoubleArrayBuilder trieBuilder = new DoubleArrayBuilder();
        for (int i = 0; i < tokenInfoEntries.size(); i++)
            trieBuilder.add(tokenInfoEntries.get(i).surface, i);
        DoubleArray trie = trieBuilder.build();

        TokenInfoDictionary tokenInfoDictionary = buildTokenInfoDictionary(trie);
        ConnectionCosts costs = connectionCosts.build();
        UnknownDictionary unknownDictionary = buildUnknownDictionary();
        log.fine(() -> "Built " + tokenInfoDictionary + " and " + unknownDictionary);
        return new Dictionaries(trie, tokenInfoDictionary, costs, unknownDictionary);
    }

    private TokenInfoDictionary buildTokenInfoDictionary(DoubleArray trie) {
        RecordStore.Builder store = new RecordStore.Builder();
        for (Entry entry : tokenInfoEntries) {
            int trieId = trie.lookup(entry.surface);
            if (trieId == DoubleArray.NOT_FOUND) {
                log.warning("Skipping '" + entry.line + "': Its surface form cannot be stored");
                continue;
            }
            int recordId = store.put(entry.leftId, entry.rightId, entry.wordCost, entry.surface, entry.features);
            store.addMapping(trieId, recordId);
        }
        return new TokenInfoDictionary(store.build());
    }

    private UnknownDictionary buildUnknownDictionary() {
        CharacterDefinition characters = characterDefinition.build();
        InvokeDefinitionMap classes = characters.invokeDefinitionMap();
        RecordStore.Builder store = new RecordStore.Builder();
        for (Entry entry : unknownEntries) {
            int classId = classes.lookup(entry.surface);
            if (classId == InvokeDefinitionMap.NOT_FOUND) {
                log.warning("Skipping unk.def line '" + entry.line + "': " + entry.surface +
                            " is not a class in char.def");
                continue;
            }
            int recordId = store.put(entry.leftId, entry.rightId, entry.wordCost, entry.surface, entry.features);
            store.addMapping(classId, recordId);
        }
        return new UnknownDictionary(store.build(), characters);
    }

    /** A parsed csv line */
    private static class Entry {

        final String line;
        final String surface;
        final int leftId;
        final int rightId;
        final int wordCost;
        final String features;

        private Entry(String line, String surface, int leftId, int rightId, int wordCost, String features) {
            this.line = line;
            this.surface = surface;
            this.leftId = leftId;
            this.rightId = rightId;
            this.wordCost = wordCost;
            this.features = features;
        }

        static Optional<Entry> parse(String line) {
            String[] fields = line.split(",", -1);
            if (fields.length < 4) return Optional.empty();
            try {
                int leftId = Integer.parseInt(fields[1].trim());
                int rightId = Integer.parseInt(fields[2].trim());
                int wordCost = Integer.parseInt(fields[3].trim());
                if (outOfShortRange(leftId) || outOfShortRange(rightId) || outOfShortRange(wordCost)) {
                    log.warning("Skipping '" + line + "': Ids and cost must fit in 16 bits");
                    return Optional.empty();
                }
                String features = String.join(",", Arrays.asList(fields).subList(4, fields.length));
                return Optional.of(new Entry(line, fields[0], leftId, rightId, wordCost, features));
            }
            catch (NumberFormatException e) {
                log.warning("Skipping '" + line + "': " + Exceptions.toMessageString(e));
                return Optional.empty();
            }
        }

        private static boolean outOfShortRange(int value) {
            return value < Short.MIN_VALUE || value > Short.MAX_VALUE;
        }

    }

}
