// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary.loader;

import ai.kotoba.io.IOUtils;
import ai.kotoba.io.LittleEndianBuffer;
import ai.kotoba.language.dictionary.ConnectionCosts;
import ai.kotoba.language.dictionary.Dictionaries;
import ai.kotoba.language.dictionary.DictionaryFile;
import ai.kotoba.language.dictionary.TokenInfoDictionary;
import ai.kotoba.language.dictionary.UnknownDictionary;
import ai.kotoba.trie.DoubleArray;
import ai.kotoba.trie.DoubleArrays;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Loads the binary dictionary buffers listed in {@link DictionaryFile} from a directory or from the class path.
 * Each file is read gzip compressed if present, and otherwise uncompressed from the name without ".gz".
 *
 * @see ai.kotoba.language.dictionary.builder.DictionaryWriter
 */
public class DictionaryLoader {

    private static final Logger log = Logger.getLogger(DictionaryLoader.class.getName());

    private final Source source;

    private DictionaryLoader(Source source) {
        this.source = source;
    }

    /** Returns a loader of the dictionary files in the given directory */
    public static DictionaryLoader fromDirectory(Path directory) {
        return new DictionaryLoader(new DirectorySource(directory));
    }

    /** Returns a loader of the dictionary resources under the given class path prefix, e.g. "dict/" */
    public static DictionaryLoader fromClasspath(String prefix) {
        return fromClasspath(prefix, DictionaryLoader.class.getClassLoader());
    }

    public static DictionaryLoader fromClasspath(String prefix, ClassLoader classLoader) {
        return new DictionaryLoader(new ClasspathSource(prefix, classLoader));
    }

    /**
     * Loads all the dictionaries.
     *
     * @throws UncheckedIOException if a file is missing or cannot be read
     * @throws IllegalArgumentException if the files do not form a valid dictionary
     */
    public Dictionaries load() {
        long startTime = System.currentTimeMillis();
        DoubleArray trie = DoubleArrays.load(read(DictionaryFile.BASE), read(DictionaryFile.CHECK));
        TokenInfoDictionary tokenInfoDictionary = TokenInfoDictionary.load(read(DictionaryFile.TOKEN_INFO),
                                                                           read(DictionaryFile.TOKEN_INFO_FEATURES),
                                                                           read(DictionaryFile.TOKEN_INFO_TARGET_MAP));
        ConnectionCosts connectionCosts = ConnectionCosts.load(read(DictionaryFile.CONNECTION_COSTS));
        UnknownDictionary unknownDictionary = UnknownDictionary.load(read(DictionaryFile.UNKNOWN),
                                                                     read(DictionaryFile.UNKNOWN_FEATURES),
                                                                     read(DictionaryFile.UNKNOWN_TARGET_MAP),
                                                                     read(DictionaryFile.CHARACTER_CATEGORIES),
                                                                     read(DictionaryFile.COMPATIBLE_CHARACTER_CATEGORIES),
                                                                     read(DictionaryFile.INVOKE_DEFINITIONS));
        Dictionaries dictionaries = new Dictionaries(trie, tokenInfoDictionary, connectionCosts, unknownDictionary);
        log.info("Loaded " + dictionaries + " from " + source + " in " +
                 (System.currentTimeMillis() - startTime) + " ms");
        return dictionaries;
    }

    private LittleEndianBuffer read(DictionaryFile file) {
        try {
            InputStream compressed = source.open(file.fileName());
            if (compressed != null)
                return LittleEndianBuffer.wrap(IOUtils.readBytes(compressed, true));
            InputStream uncompressed = source.open(file.uncompressedFileName());
            if (uncompressed != null)
                return LittleEndianBuffer.wrap(IOUtils.readBytes(uncompressed, false));
            throw new FileNotFoundException("Neither " + file.fileName() + " nor " + file.uncompressedFileName() +
                                            " found in " + source);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not load " + file.fileName() + " from " + source, e);
        }
    }

    @Override
    public String toString() { return "dictionary loader from " + source; }

    /** A place dictionary files can be read from */
    private interface Source {

        /** Returns a stream of the given file, or null if it does not exist */
        InputStream open(String name) throws IOException;

    }

    private static class DirectorySource implements Source {

        private final Path directory;

        DirectorySource(Path directory) {
            this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        }

        @Override
        public InputStream open(String name) throws IOException {
            Path file = directory.resolve(name);
            if ( ! Files.isRegularFile(file)) return null;
            return Files.newInputStream(file);
        }

        @Override
        public String toString() { return "directory " + directory; }

    }

    private static class ClasspathSource implements Source {

        private final String prefix;
        private final ClassLoader classLoader;

        ClasspathSource(String prefix, ClassLoader classLoader) {
            this.prefix = prefix.isEmpty() || prefix.endsWith("/") ? prefix : prefix + "/";
            this.classLoader = Objects.requireNonNull(classLoader, "classLoader cannot be null");
        }

        @Override
        public InputStream open(String name) {
            return classLoader.getResourceAsStream(prefix + name);
        }

        @Override
        public String toString() { return "class path '" + prefix + "'"; }

    }

}
