// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.trie;

import ai.kotoba.text.Utf8;
import com.google.common.primitives.UnsignedBytes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds an immutable {@link DoubleArray} from (key, value) pairs.
 *
 * <p>Keys are encoded as UTF-8 followed by a NUL terminator and placed in unsigned byte order.
 * A terminal node stores its value as -(value + 1) in BASE. Keys which cannot be stored (empty keys, keys
 * containing NUL and keys with malformed surrogate pairs) are skipped with a warning. When the same key is
 * added more than once the first value is kept.</p>
 *
 * <p>A builder may be used for one build only.</p>
 */
public class DoubleArrayBuilder {

    private static final Logger log = Logger.getLogger(DoubleArrayBuilder.class.getName());

    private static final Comparator<Entry> byKeyBytes =
            Comparator.comparing(Entry::bytes, UnsignedBytes.lexicographicalComparator());

    private final List<Entry> entries = new ArrayList<>();
    private boolean built = false;

    /**
     * Adds a key to the double array to build.
     *
     * @param key the key
     * @param value the value to store for the key, which must be non-negative
     * @return this for chaining
     * @throws IllegalArgumentException if the value is negative
     */
    public DoubleArrayBuilder add(String key, int value) {
        if (value < 0)
            throw new IllegalArgumentException("Value of '" + key + "' must be non-negative, but was " + value);
        if (key.isEmpty() || key.indexOf('\0') >= 0) {
            log.warning("Skipping key '" + key + "': Keys must be non-empty and cannot contain NUL");
            return this;
        }
        byte[] encoded = Utf8.toBytesStrict(key);
        if (encoded == null) {
            log.warning("Skipping key '" + key + "': It contains a malformed surrogate pair");
            return this;
        }
        byte[] terminated = Arrays.copyOf(encoded, encoded.length + 1);
        entries.add(new Entry(terminated, value));
        return this;
    }

    /** Returns the number of keys added so far, including duplicates */
    public int size() { return entries.size(); }

    /** Builds the double array. */
    public DoubleArray build() {
        if (built)
            throw new IllegalStateException("This builder has already been used");
        built = true;

        List<Entry> sorted = deduplicated(entries);
        FreeList nodes = new FreeList(sorted.size() * 4);
        if ( ! sorted.isEmpty())
            place(0, sorted, 0, sorted.size(), 0, nodes);
        DoubleArray doubleArray = new DoubleArray(nodes.baseArray(), nodes.checkArray());
        if (log.isLoggable(Level.FINE))
            log.fine("Built double array of " + sorted.size() + " keys in " + doubleArray.size() + " slots");
        return doubleArray;
    }

    /** Returns the entries sorted by key bytes, keeping only the first added of equal keys */
    private static List<Entry> deduplicated(List<Entry> entries) {
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(byKeyBytes); // stable, so the first added of equal keys comes first
        List<Entry> unique = new ArrayList<>(sorted.size());
        for (Entry entry : sorted) {
            if ( ! unique.isEmpty() && Arrays.equals(unique.get(unique.size() - 1).bytes(), entry.bytes())) continue;
            unique.add(entry);
        }
        return unique;
    }

    /**
     * Places the children of parent, which are the distinct bytes at the given depth of the entries
     * in [from, to), and recurses into each of them.
     */
    private void place(int parent, List<Entry> sorted, int from, int to, int depth, FreeList nodes) {
        List<Integer> groupStarts = new ArrayList<>();
        List<Integer> codeList = new ArrayList<>();
        for (int i = from; i < to; i++) {
            int code = sorted.get(i).code(depth);
            if (codeList.isEmpty() || codeList.get(codeList.size() - 1) != code) {
                codeList.add(code);
                groupStarts.add(i);
            }
        }
        groupStarts.add(to);
        int[] codes = codeList.stream().mapToInt(Integer::intValue).toArray();

        int base = nodes.findAllocatableBase(codes);
        nodes.setBase(parent, base);
        for (int code : codes)
            nodes.allocate(base + code, parent);

        for (int group = 0; group < codes.length; group++) {
            int child = base + codes[group];
            int groupFrom = groupStarts.get(group);
            int groupTo = groupStarts.get(group + 1);
            if (codes[group] == 0)
                nodes.setBase(child, -sorted.get(groupFrom).value() - 1);
            else
                place(child, sorted, groupFrom, groupTo, depth + 1, nodes);
        }
    }

    private record Entry(byte[] bytes, int value) {

        /** Returns the unsigned byte at the given depth */
        int code(int depth) { return bytes[depth] & 0xff; }

    }

}
