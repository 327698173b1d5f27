// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.kotobacli;

import ai.kotoba.language.dictionary.builder.DictionaryBuilder;
import ai.kotoba.language.dictionary.builder.DictionaryWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenizeCommandTestCase {

    @TempDir
    Path tempDir;

    private Path dictionaryDir;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errors = new ByteArrayOutputStream();

    @BeforeEach
    public void writeDictionary() {
        dictionaryDir = tempDir.resolve("dict");
        DictionaryWriter.write(new DictionaryBuilder().addSeedDirectory(Path.of("src/test/files/minimum-dic"),
                                                                        StandardCharsets.UTF_8).build(),
                               dictionaryDir);
    }

    private ClientParameters createParameters(String text, String format) {
        return new ClientParameters.Builder()
                .setDictionaryDirectory(dictionaryDir.toString())
                .setText(text)
                .setFormat(format)
                .build();
    }

    private int run(ClientParameters params, String stdin) {
        return new TokenizeCommand(params,
                                   new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                                   new PrintStream(output, true, StandardCharsets.UTF_8),
                                   new PrintStream(errors, true, StandardCharsets.UTF_8)).run();
    }

    private String output() { return output.toString(StandardCharsets.UTF_8); }

    @Test
    public void testTextFormat() {
        assertEquals(0, run(createParameters("となりのトトロ", "text"), ""));
        assertEquals("となり\t名詞,一般,*,*,*,*,となり,トナリ,トナリ\n" +
                     "の\t助詞,連体化,*,*,*,*,の,ノ,ノ\n" +
                     "トトロ\t名詞,一般,*,*,*,*,*,*,*\n" +
                     "EOS\n",
                     output());
    }

    @Test
    public void testJsonFormat() throws IOException {
        assertEquals(0, run(createParameters("となりのトトロ", "json"), ""));
        JsonNode tokens = new ObjectMapper().readTree(output());
        assertTrue(tokens.isArray());
        assertEquals(3, tokens.size());

        JsonNode first = tokens.get(0);
        assertEquals("となり", first.get("surface_form").asText());
        assertEquals("KNOWN", first.get("word_type").asText());
        assertEquals(1, first.get("word_position").asInt());
        assertEquals("名詞", first.get("pos").asText());
        assertEquals("トナリ", first.get("reading").asText());

        JsonNode last = tokens.get(2);
        assertEquals("トトロ", last.get("surface_form").asText());
        assertEquals("UNKNOWN", last.get("word_type").asText());
        assertEquals(5, last.get("word_position").asInt());
        assertTrue(last.get("reading").isNull());
    }

    @Test
    public void testEachInputLineIsTokenized() {
        assertEquals(0, run(createParameters(null, "text"), "もも\nうち\n"));
        assertEquals("もも\t名詞,一般,*,*,*,*,もも,モモ,モモ\n" +
                     "EOS\n" +
                     "うち\t名詞,非自立,副詞可能,*,*,*,うち,ウチ,ウチ\n" +
                     "EOS\n",
                     output());
    }

    @Test
    public void testJsonLinePerInputLine() {
        assertEquals(0, run(createParameters(null, "json"), "もも\n\nうち\n"));
        String[] lines = output().split("\n");
        assertEquals(3, lines.length);
        assertEquals("[]", lines[1]);
    }

    @Test
    public void testMissingDictionaryFails() {
        ClientParameters params = new ClientParameters.Builder()
                .setDictionaryDirectory(tempDir.resolve("no-such-dict").toString())
                .setText("もも")
                .setFormat("text")
                .build();
        assertEquals(1, run(params, ""));
        String message = errors.toString(StandardCharsets.UTF_8);
        assertTrue(message.startsWith("Error: Could not load base.dat.gz from directory"), message);
        assertEquals("", output());
    }

}
