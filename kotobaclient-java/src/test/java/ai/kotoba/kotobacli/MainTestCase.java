// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.kotobacli;

import ai.kotoba.language.dictionary.DictionaryFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTestCase {

    @TempDir
    Path tempDir;

    @Test
    public void testHelpAndUnknownCommands() {
        assertEquals(0, Main.run(new String[0]));
        assertEquals(0, Main.run(new String[] { "--help" }));
        assertEquals(0, Main.run(new String[] { "tokenize", "-h" }));
        assertEquals(1, Main.run(new String[] { "analyze" }));
    }

    @Test
    public void testParseErrorsFail() {
        assertEquals(1, Main.run(new String[] { "tokenize", "--text", "もも" }));
        assertEquals(1, Main.run(new String[] { "build-dictionary", "--input", "seed" }));
    }

    @Test
    public void testBuildDictionary() {
        Path output = tempDir.resolve("dict");
        assertEquals(0, Main.run(new String[] { "build-dictionary",
                                                "--input", "src/test/files/minimum-dic",
                                                "--output", output.toString() }));
        assertTrue(Files.exists(output.resolve(DictionaryFile.values()[0].fileName())));
        assertEquals(1, Main.run(new String[] { "build-dictionary",
                                                "--input", tempDir.resolve("missing").toString(),
                                                "--output", tempDir.resolve("other").toString() }));
        assertFalse(Files.exists(tempDir.resolve("other")));
    }

}
