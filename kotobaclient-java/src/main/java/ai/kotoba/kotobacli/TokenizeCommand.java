// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.kotobacli;

import ai.kotoba.language.process.JapaneseTokenizer;
import ai.kotoba.language.process.Token;
import ai.kotoba.language.process.TokenizerBuilder;
import ai.kotoba.language.process.TokenizerParameters;
import ai.kotoba.yolean.Exceptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;

/**
 * Tokenizes the text given on the command line, or each line of an input stream, and prints the tokens.
 *
 * <p>The json format prints one array of token objects per input line. The text format prints one
 * token per line as the surface form, a tab and the comma separated features, with * for absent
 * features, and EOS after each input line.</p>
 */
public class TokenizeCommand {

    private static final Logger log = Logger.getLogger(TokenizeCommand.class.getName());

    private static final ObjectMapper mapper = new ObjectMapper();

    private final ClientParameters params;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public TokenizeCommand(ClientParameters params) {
        this(params, System.in, System.out, System.err);
    }

    public TokenizeCommand(ClientParameters params, InputStream in, PrintStream out, PrintStream err) {
        this.params = params;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    /** Runs this and returns the exit status */
    public int run() {
        try {
            JapaneseTokenizer tokenizer = new TokenizerBuilder(new TokenizerParameters.Builder()
                                                                       .setDictionaryDirectory(params.dictionaryDirectory)
                                                                       .build()).build();
            if (params.text != null) {
                print(tokenizer.tokenize(params.text));
            }
            else {
                BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
                String line;
                while ((line = reader.readLine()) != null)
                    print(tokenizer.tokenize(line));
            }
            out.flush();
            return 0;
        }
        catch (IOException | RuntimeException e) {
            log.fine(() -> "Tokenizing failed: " + e);
            err.println("Error: " + Exceptions.toMessageString(e));
            return 1;
        }
    }

    private void print(List<Token> tokens) {
        if (CommandLineOptions.JSON_FORMAT.equals(params.format))
            out.println(toJson(tokens));
        else
            out.print(toText(tokens));
    }

    static String toJson(List<Token> tokens) {
        ArrayNode array = mapper.createArrayNode();
        for (Token token : tokens) {
            ObjectNode node = array.addObject();
            node.put("word_id", token.wordId());
            node.put("word_type", token.wordType().name());
            node.put("word_position", token.wordPosition());
            node.put("surface_form", token.surfaceForm());
            node.put("pos", token.pos());
            node.put("pos_detail_1", token.posDetail1());
            node.put("pos_detail_2", token.posDetail2());
            node.put("pos_detail_3", token.posDetail3());
            node.put("conjugated_type", token.conjugatedType());
            node.put("conjugated_form", token.conjugatedForm());
            node.put("basic_form", token.basicForm());
            node.put("reading", token.reading());
            node.put("pronunciation", token.pronunciation());
        }
        try {
            return mapper.writeValueAsString(array);
        }
        catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String toText(List<Token> tokens) {
        StringBuilder b = new StringBuilder();
        for (Token token : tokens) {
            b.append(token.surfaceForm()).append('\t');
            b.append(String.join(",",
                                 orAsterisk(token.pos()),
                                 orAsterisk(token.posDetail1()),
                                 orAsterisk(token.posDetail2()),
                                 orAsterisk(token.posDetail3()),
                                 orAsterisk(token.conjugatedType()),
                                 orAsterisk(token.conjugatedForm()),
                                 orAsterisk(token.basicForm()),
                                 orAsterisk(token.reading()),
                                 orAsterisk(token.pronunciation())));
            b.append('\n');
        }
        b.append("EOS\n");
        return b.toString();
    }

    private static String orAsterisk(String feature) {
        return feature == null || feature.isEmpty() ? "*" : feature;
    }

}
