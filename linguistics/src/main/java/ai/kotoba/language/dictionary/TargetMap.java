// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

import ai.kotoba.io.GrowableByteBuffer;
import ai.kotoba.io.LittleEndianBuffer;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Ordering;

import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A map from a source id (a trie id, or a character class id) to the ordered list of record ids of the
 * dictionary entries for it. Every source present maps to a non-empty list.
 *
 * <p>Serialized as i32 count, followed by count entries of
 * i32 key, i32 value count, value count i32 values.</p>
 */
public final class TargetMap {

    private static final Logger log = Logger.getLogger(TargetMap.class.getName());

    private static final TargetMap empty = new Builder().build();

    private final ImmutableListMultimap<Integer, Integer> targets;

    private TargetMap(ImmutableListMultimap<Integer, Integer> targets) {
        this.targets = targets;
    }

    /** Returns the targets of the given source in the order they were added, or an empty list if none */
    public List<Integer> get(int source) { return targets.get(source); }

    public boolean contains(int source) { return targets.containsKey(source); }

    /** Returns the sources of this in increasing order */
    public Set<Integer> sources() { return targets.keySet(); }

    public byte[] toBytes() {
        GrowableByteBuffer buffer = new GrowableByteBuffer(4 + targets.keySet().size() * 12 + targets.size() * 4);
        buffer.putInt(targets.keySet().size());
        for (Integer source : targets.keySet()) {
            List<Integer> values = targets.get(source);
            buffer.putInt(source);
            buffer.putInt(values.size());
            for (int value : values)
                buffer.putInt(value);
        }
        return buffer.toByteArray();
    }

    /**
     * Reads a target map written by {@link #toBytes}. Reading stops at the end of the buffer,
     * so a truncated buffer gives the entries which are complete.
     */
    public static TargetMap load(LittleEndianBuffer bytes) {
        Builder builder = new Builder();
        LittleEndianBuffer.Cursor cursor = bytes.cursor();
        int count = cursor.getInt();
        int read = 0;
        while (cursor.hasRemaining(8)) {
            int source = cursor.getInt();
            int valueCount = cursor.getInt();
            for (int i = 0; i < valueCount && cursor.hasRemaining(4); i++)
                builder.add(source, cursor.getInt());
            read++;
        }
        if (read != count && log.isLoggable(Level.FINE))
            log.fine("Target map header says " + count + " entries, but " + read + " were read");
        return builder.build();
    }

    public static TargetMap empty() { return empty; }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof TargetMap)) return false;
        return targets.equals(((TargetMap) o).targets);
    }

    @Override
    public int hashCode() { return targets.hashCode(); }

    @Override
    public String toString() { return "target map of " + targets.keySet().size() + " sources"; }

    public static class Builder {

        private final ImmutableListMultimap.Builder<Integer, Integer> targets =
                ImmutableListMultimap.<Integer, Integer>builder().orderKeysBy(Ordering.natural());

        /** Appends a target to the list of the given source */
        public Builder add(int source, int target) {
            targets.put(source, target);
            return this;
        }

        public TargetMap build() { return new TargetMap(targets.build()); }

    }

}
