// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary.builder;

import ai.kotoba.language.dictionary.CharacterClass;
import ai.kotoba.language.dictionary.CharacterDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CharacterDefinitionBuilderTestCase {

    @Test
    public void testBuild() {
        CharacterDefinition definition = new CharacterDefinitionBuilder()
                .putLine("# comment only")
                .putLine("DEFAULT 0 1 0  # the fallback")
                .putLine("ALPHA 1 1 0")
                .putLine("NUMERIC 1 0 3")
                .putLine("0x0041..0x005A ALPHA")
                .putLine("0x0030..0x0039 NUMERIC ALPHA")
                .putLine("0x0035 ALPHA")
                .build();
        assertEquals(List.of(new CharacterClass(0, "DEFAULT", false, true, 0),
                             new CharacterClass(1, "ALPHA", true, true, 0),
                             new CharacterClass(2, "NUMERIC", true, false, 3)),
                     definition.invokeDefinitionMap().classes());
        assertEquals("ALPHA", definition.lookup("Q").name());
        assertEquals("NUMERIC", definition.lookup("4").name());
        assertEquals("ALPHA", definition.lookup("5").name());
        assertEquals("DEFAULT", definition.lookup("q").name());
        assertEquals(List.of(definition.invokeDefinitionMap().getCharacterClass(1).get()),
                     definition.lookupCompatibleCategory("4"));
        assertEquals(List.of(definition.invokeDefinitionMap().getCharacterClass(1).get()),
                     definition.lookupCompatibleCategory("5"));
    }

    @Test
    public void testUnmappedCodeUnitsGetDefaultWhenDefaultIsNotFirst() {
        CharacterDefinition definition = new CharacterDefinitionBuilder()
                .putLine("SPACE 0 1 0")
                .putLine("DEFAULT 0 1 0")
                .putLine("0x0020 SPACE")
                .build();
        assertEquals("SPACE", definition.lookup(" ").name());
        assertEquals("DEFAULT", definition.lookup("x").name());
        assertEquals("DEFAULT", definition.lookup("\u0000").name());
    }

    @Test
    public void testInvalidLinesAreSkipped() {
        CharacterDefinition definition = new CharacterDefinitionBuilder()
                .putLine("DEFAULT 0 1 0")
                .putLine("BAD_INVOKE 2 1 0")
                .putLine("BAD_GROUP 0 7 0")
                .putLine("HUGE 0 0 99999999999")
                .putLine("DEFAULT 1 1 1")
                .putLine("0x0041 UNDEFINED")
                .putLine("0x0042 DEFAULT UNDEFINED")
                .putLine("0x005A..0x0041 DEFAULT")
                .putLine("nonsense")
                .build();
        assertEquals(List.of(new CharacterClass(0, "DEFAULT", false, true, 0)), definition.invokeDefinitionMap().classes());
        assertEquals("DEFAULT", definition.lookup("A").name());
        assertEquals(List.of(), definition.lookupCompatibleCategory("B"));
    }

    @Test
    public void testDefaultClassIsRequired() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                                                  () -> new CharacterDefinitionBuilder().putLine("KANJI 0 0 2").build());
        assertEquals("char.def has no DEFAULT class", e.getMessage());
    }

}
