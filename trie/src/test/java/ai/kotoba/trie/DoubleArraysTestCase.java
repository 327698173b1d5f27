// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.trie;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class DoubleArraysTestCase {

    @Test
    public void testSerializationRoundTrip() {
        DoubleArray trie = new DoubleArrayBuilder().add("となり", 0).add("の", 1).add("うち", 2).add("と", 3).build();
        byte[] base = DoubleArrays.baseBytes(trie);
        byte[] check = DoubleArrays.checkBytes(trie);
        assertEquals(trie.size() * 4, base.length);
        assertEquals(trie.size() * 4, check.length);

        DoubleArray loaded = DoubleArrays.load(base, check);
        assertArrayEquals(trie.baseArray(), loaded.baseArray());
        assertArrayEquals(trie.checkArray(), loaded.checkArray());
        assertEquals(0, loaded.lookup("となり"));
        assertEquals(List.of(new Match("と", 3), new Match("となり", 0)), loaded.commonPrefixSearch("となりのトトロ"));
    }

    @Test
    public void testTruncatedArraysReadAsMissingNodes() {
        DoubleArray trie = new DoubleArrayBuilder().add("a", 0).add("あいうえお", 1).build();
        byte[] base = DoubleArrays.baseBytes(trie);
        byte[] check = DoubleArrays.checkBytes(trie);
        int a = trie.traverse(0, 'a');
        int terminalOfA = trie.traverse(a, 0);
        int keep = (Math.max(a, terminalOfA) + 1) * 4;
        DoubleArray truncated = DoubleArrays.load(Arrays.copyOf(base, Math.min(base.length, keep)),
                                                  Arrays.copyOf(check, Math.min(check.length, keep)));
        assertEquals(0, truncated.lookup("a"));
    }

}
