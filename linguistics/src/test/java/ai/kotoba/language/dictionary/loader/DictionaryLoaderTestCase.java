// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary.loader;

import ai.kotoba.language.MinimumDictionaries;
import ai.kotoba.language.dictionary.Dictionaries;
import ai.kotoba.language.dictionary.DictionaryFile;
import ai.kotoba.language.dictionary.builder.DictionaryWriter;
import ai.kotoba.language.process.JapaneseTokenizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DictionaryLoaderTestCase {

    private static final List<String> texts = List.of("すもももももももものうち", "となりのトトロ", "𠮷野屋", "あ、あ。あ、あ。", "");

    @TempDir
    Path tempDir;

    @Test
    public void testWriteAndLoadFromDirectory() {
        Dictionaries built = MinimumDictionaries.get();
        DictionaryWriter.write(built, tempDir);
        for (DictionaryFile file : DictionaryFile.values())
            assertTrue(Files.isRegularFile(tempDir.resolve(file.fileName())), file.fileName() + " is written");

        Dictionaries loaded = DictionaryLoader.fromDirectory(tempDir).load();
        assertSameBuffers(built, loaded);
        assertSameTokens(built, loaded);
    }

    @Test
    public void testLoadUncompressedFiles() throws IOException {
        Dictionaries built = MinimumDictionaries.get();
        for (Map.Entry<DictionaryFile, byte[]> buffer : DictionaryWriter.toBuffers(built).entrySet())
            Files.write(tempDir.resolve(buffer.getKey().uncompressedFileName()), buffer.getValue());

        Dictionaries loaded = DictionaryLoader.fromDirectory(tempDir).load();
        assertSameTokens(built, loaded);
    }

    @Test
    public void testLoadFromClasspath() throws IOException {
        Dictionaries built = MinimumDictionaries.get();
        DictionaryWriter.write(built, tempDir.resolve("dict"));
        try (URLClassLoader classLoader = new URLClassLoader(new URL[] { tempDir.toUri().toURL() }, null)) {
            Dictionaries loaded = DictionaryLoader.fromClasspath("dict", classLoader).load();
            assertSameTokens(built, loaded);
        }
    }

    @Test
    public void testMissingFile() throws IOException {
        DictionaryWriter.write(MinimumDictionaries.get(), tempDir);
        Files.delete(tempDir.resolve(DictionaryFile.CONNECTION_COSTS.fileName()));

        UncheckedIOException e = assertThrows(UncheckedIOException.class,
                                              () -> DictionaryLoader.fromDirectory(tempDir).load());
        assertEquals("Could not load cc.dat.gz from directory " + tempDir, e.getMessage());
        assertEquals("Neither cc.dat.gz nor cc.dat found in directory " + tempDir, e.getCause().getMessage());
    }

    @Test
    public void testMissingClasspathResources() {
        UncheckedIOException e = assertThrows(UncheckedIOException.class,
                                              () -> DictionaryLoader.fromClasspath("no/such/dict/").load());
        assertEquals("Could not load base.dat.gz from class path 'no/such/dict/'", e.getMessage());
    }

    private static void assertSameBuffers(Dictionaries expected, Dictionaries actual) {
        Map<DictionaryFile, byte[]> expectedBuffers = DictionaryWriter.toBuffers(expected);
        Map<DictionaryFile, byte[]> actualBuffers = DictionaryWriter.toBuffers(actual);
        for (DictionaryFile file : DictionaryFile.values())
            assertArrayEquals(expectedBuffers.get(file), actualBuffers.get(file), file.fileName());
    }

    private static void assertSameTokens(Dictionaries expected, Dictionaries actual) {
        JapaneseTokenizer expectedTokenizer = new JapaneseTokenizer(expected);
        JapaneseTokenizer actualTokenizer = new JapaneseTokenizer(actual);
        for (String text : texts)
            assertEquals(expectedTokenizer.tokenize(text), actualTokenizer.tokenize(text), "Tokens of '" + text + "'");
    }

}
