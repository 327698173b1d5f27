// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.process;

import ai.kotoba.language.viterbi.NodeType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class IpadicFormatterTestCase {

    private final IpadicFormatter formatter = new IpadicFormatter();

    @Test
    public void testFormatEntry() {
        String[] features = "走る,動詞,自立,*,*,五段・ラ行,基本形,走る,ハシル,ハシル".split(",");
        Token token = formatter.formatEntry(30, 4, NodeType.KNOWN, features);
        Token expected = new Token.Builder().wordId(30)
                                            .wordType(NodeType.KNOWN)
                                            .wordPosition(4)
                                            .surfaceForm("走る")
                                            .pos("動詞")
                                            .posDetail1("自立")
                                            .posDetail2("*")
                                            .posDetail3("*")
                                            .conjugatedType("五段・ラ行")
                                            .conjugatedForm("基本形")
                                            .basicForm("走る")
                                            .reading("ハシル")
                                            .pronunciation("ハシル")
                                            .build();
        assertEquals(expected, token);
    }

    @Test
    public void testMissingFeaturesAreNull() {
        Token token = formatter.formatEntry(10, 1, NodeType.KNOWN, new String[] { "ほげ", "名詞" });
        assertEquals("ほげ", token.surfaceForm());
        assertEquals("名詞", token.pos());
        assertNull(token.posDetail1());
        assertNull(token.pronunciation());

        Token empty = formatter.formatEntry(-1, 5, NodeType.EOS, new String[0]);
        assertNull(empty.surfaceForm());
        assertEquals(NodeType.EOS, empty.wordType());
        assertEquals(5, empty.wordPosition());
    }

    @Test
    public void testFormatUnknownEntry() {
        String[] features = "KATAKANA,名詞,一般,*,*,*,*,*".split(",");
        Token token = formatter.formatUnknownEntry(20, 5, NodeType.UNKNOWN, features, "トトロ");
        assertEquals("トトロ", token.surfaceForm());
        assertEquals("名詞", token.pos());
        assertEquals("一般", token.posDetail1());
        assertEquals("*", token.basicForm());
        assertNull(token.reading());
        assertNull(token.pronunciation());
    }

}
