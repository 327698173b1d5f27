// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.trie;

import ai.kotoba.text.Utf8;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A double-array trie mapping strings to non-negative integers.
 *
 * <p>The trie is two parallel arrays, BASE and CHECK, indexed by node. Node 0 is the root.
 * The child of a node via a byte is BASE[node] + byte, which is valid if CHECK[child] == node.
 * Keys are UTF-8 encoded and terminated by a transition on byte 0. A terminal node stores its value
 * as BASE = -value - 1.</p>
 *
 * <p>Reads past the end of the arrays return BASE(i) = -i + 1 and CHECK(i) = -i - 1,
 * the values of an unused slot, so an array which is shorter than the data it was written from
 * reads as a trie without those nodes rather than failing.</p>
 *
 * <p>Instances are immutable and may be shared between threads. Create with {@link DoubleArrayBuilder}
 * or load with {@link DoubleArrays#load}.</p>
 */
public final class DoubleArray {

    /** Returned when a key or transition is not present */
    public static final int NOT_FOUND = -1;

    private static final int root = 0;
    private static final int terminator = 0;

    private final int[] base;
    private final int[] check;

    /** Creates a double array from BASE and CHECK arrays. The arrays are owned by this afterwards. */
    DoubleArray(int[] base, int[] check) {
        this.base = base;
        this.check = check;
    }

    /** Returns BASE of the given node, or the unused slot sentinel if past the end */
    public int base(int node) {
        return node < base.length ? base[node] : -node + 1;
    }

    /** Returns CHECK of the given node, or the unused slot sentinel if past the end */
    public int check(int node) {
        return node < check.length ? check[node] : -node - 1;
    }

    /**
     * Follows the transition from parent on the given unsigned byte.
     *
     * @return the child node, or NOT_FOUND if there is no such transition
     */
    public int traverse(int parent, int code) {
        if (parent < 0) return NOT_FOUND;
        int parentBase = base(parent);
        if (parentBase <= 0) return NOT_FOUND; // a terminal or unused node
        int child = parentBase + code;
        if (check(child) != parent) return NOT_FOUND;
        return child;
    }

    /** Returns the value stored for the given key, or NOT_FOUND if it is not a key of this */
    public int lookup(String key) {
        byte[] bytes = Utf8.toBytesStrict(key);
        if (bytes == null) return NOT_FOUND;

        int node = root;
        for (byte b : bytes) {
            node = traverse(node, b & 0xff);
            if (node == NOT_FOUND) return NOT_FOUND;
        }
        int terminal = traverse(node, terminator);
        if (terminal == NOT_FOUND) return NOT_FOUND;
        return -base(terminal) - 1;
    }

    public boolean contains(String key) {
        return lookup(key) != NOT_FOUND;
    }

    /**
     * Returns all keys of this which are non-empty prefixes of the given string, with their values,
     * in order of increasing length. Returns an empty list if the string cannot be UTF-8 encoded.
     */
    public List<Match> commonPrefixSearch(String string) {
        byte[] bytes = Utf8.toBytesStrict(string);
        if (bytes == null) return List.of();

        List<Match> matches = new ArrayList<>();
        int node = root;
        for (int length = 1; length <= bytes.length; length++) {
            node = traverse(node, bytes[length - 1] & 0xff);
            if (node == NOT_FOUND) break;

            int terminal = traverse(node, terminator);
            if (terminal != NOT_FOUND)
                matches.add(new Match(Utf8.toString(bytes, 0, length), -base(terminal) - 1));
        }
        return matches;
    }

    /** Returns the number of slots in the BASE and CHECK arrays */
    public int size() { return Math.max(base.length, check.length); }

    /** Returns a copy of the BASE array */
    public int[] baseArray() { return Arrays.copyOf(base, base.length); }

    /** Returns a copy of the CHECK array */
    public int[] checkArray() { return Arrays.copyOf(check, check.length); }

    @Override
    public String toString() { return "double array of " + size() + " slots"; }

}
