// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary.builder;

import ai.kotoba.io.IOUtils;
import ai.kotoba.language.dictionary.CharacterDefinition;
import ai.kotoba.language.dictionary.Dictionaries;
import ai.kotoba.language.dictionary.DictionaryFile;
import ai.kotoba.trie.DoubleArrays;
import ai.kotoba.yolean.Exceptions;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Writes dictionaries to a directory as the gzip compressed buffers listed in {@link DictionaryFile}.
 */
public class DictionaryWriter {

    private static final Logger log = Logger.getLogger(DictionaryWriter.class.getName());

    /** Returns the serialized buffers of the given dictionaries */
    public static Map<DictionaryFile, byte[]> toBuffers(Dictionaries dictionaries) {
        CharacterDefinition characters = dictionaries.unknownDictionary().characterDefinition();
        Map<DictionaryFile, byte[]> buffers = new EnumMap<>(DictionaryFile.class);
        buffers.put(DictionaryFile.BASE, DoubleArrays.baseBytes(dictionaries.trie()));
        buffers.put(DictionaryFile.CHECK, DoubleArrays.checkBytes(dictionaries.trie()));
        buffers.put(DictionaryFile.TOKEN_INFO, dictionaries.tokenInfoDictionary().recordBytes());
        buffers.put(DictionaryFile.TOKEN_INFO_FEATURES, dictionaries.tokenInfoDictionary().featureBytes());
        buffers.put(DictionaryFile.TOKEN_INFO_TARGET_MAP, dictionaries.tokenInfoDictionary().targetMapBytes());
        buffers.put(DictionaryFile.CONNECTION_COSTS, dictionaries.connectionCosts().toBytes());
        buffers.put(DictionaryFile.UNKNOWN, dictionaries.unknownDictionary().recordBytes());
        buffers.put(DictionaryFile.UNKNOWN_FEATURES, dictionaries.unknownDictionary().featureBytes());
        buffers.put(DictionaryFile.UNKNOWN_TARGET_MAP, dictionaries.unknownDictionary().targetMapBytes());
        buffers.put(DictionaryFile.CHARACTER_CATEGORIES, characters.categoryBytes());
        buffers.put(DictionaryFile.COMPATIBLE_CHARACTER_CATEGORIES, characters.compatibleCategoryBytes());
        buffers.put(DictionaryFile.INVOKE_DEFINITIONS, characters.invokeDefinitionBytes());
        return buffers;
    }

    /**
     * Writes the given dictionaries to a directory, which is created if missing.
     *
     * @throws java.io.UncheckedIOException if a file cannot be written
     */
    public static void write(Dictionaries dictionaries, Path directory) {
        for (Map.Entry<DictionaryFile, byte[]> buffer : toBuffers(dictionaries).entrySet()) {
            Path file = directory.resolve(buffer.getKey().fileName());
            Exceptions.uncheck(() -> IOUtils.writeFile(file, buffer.getValue()), "Could not write %s", file);
        }
        log.info("Wrote " + dictionaries + " to " + directory);
    }

}
