// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

import ai.kotoba.io.GrowableByteBuffer;
import ai.kotoba.io.LittleEndianBuffer;

import java.util.List;
import java.util.Objects;

/**
 * The storage of a {@link RecordDictionary}: a record buffer of 10 byte little-endian records
 * [i16 left id][i16 right id][i16 word cost][i32 feature offset], a buffer of NUL-terminated UTF-8 feature
 * strings, and a target map.
 *
 * <p>Immutable. Create with a {@link Builder} or {@link #load}.</p>
 */
public final class RecordStore implements RecordDictionary {

    /** The size of a record in bytes */
    public static final int RECORD_SIZE = 10;

    private static final int rightIdOffset = 2;
    private static final int wordCostOffset = 4;
    private static final int featureOffsetOffset = 6;

    private final LittleEndianBuffer records;
    private final LittleEndianBuffer features;
    private final TargetMap targetMap;

    public RecordStore(LittleEndianBuffer records, LittleEndianBuffer features, TargetMap targetMap) {
        this.records = Objects.requireNonNull(records, "records cannot be null");
        this.features = Objects.requireNonNull(features, "features cannot be null");
        this.targetMap = Objects.requireNonNull(targetMap, "targetMap cannot be null");
    }

    @Override
    public int leftId(int recordId) { return records.getShort(recordId); }

    @Override
    public int rightId(int recordId) { return records.getShort(recordId + rightIdOffset); }

    @Override
    public int wordCost(int recordId) { return records.getShort(recordId + wordCostOffset); }

    @Override
    public String getFeatures(int recordId) {
        return features.getString(records.getInt(recordId + featureOffsetOffset));
    }

    @Override
    public List<Integer> targets(int key) { return targetMap.get(key); }

    public TargetMap targetMap() { return targetMap; }

    /** Returns the number of records in this */
    public int size() { return records.size() / RECORD_SIZE; }

    @Override
    public byte[] recordBytes() { return records.toByteArray(); }

    @Override
    public byte[] featureBytes() { return features.toByteArray(); }

    @Override
    public byte[] targetMapBytes() { return targetMap.toBytes(); }

    public static RecordStore load(LittleEndianBuffer records, LittleEndianBuffer features, LittleEndianBuffer targetMap) {
        return new RecordStore(records, features, TargetMap.load(targetMap));
    }

    @Override
    public String toString() { return "record store of " + size() + " records"; }

    public static class Builder {

        private final GrowableByteBuffer records = new GrowableByteBuffer(64 * 1024);
        private final GrowableByteBuffer features = new GrowableByteBuffer(64 * 1024);
        private final TargetMap.Builder targetMap = new TargetMap.Builder();

        /**
         * Appends a record.
         *
         * @param surface the surface form, stored as the first feature
         * @param feature the remaining comma-separated features
         * @return the id of the new record
         * @throws IllegalArgumentException if a number does not fit in 16 bits or the features cannot be stored
         */
        public int put(int leftId, int rightId, int wordCost, String surface, String feature) {
            requireShort("left id", leftId);
            requireShort("right id", rightId);
            requireShort("word cost", wordCost);
            int recordId = records.position();
            int featureOffset = features.position();
            features.putString(surface + "," + feature);
            records.putShort(leftId);
            records.putShort(rightId);
            records.putShort(wordCost);
            records.putInt(featureOffset);
            return recordId;
        }

        private static void requireShort(String name, int value) {
            if (value < Short.MIN_VALUE || value > Short.MAX_VALUE)
                throw new IllegalArgumentException("The " + name + " must be in " + Short.MIN_VALUE + ".." +
                                                   Short.MAX_VALUE + ", but was " + value);
        }

        /** Adds a record to the targets of the given key */
        public Builder addMapping(int key, int recordId) {
            targetMap.add(key, recordId);
            return this;
        }

        public RecordStore build() {
            return new RecordStore(records.toReadable(), features.toReadable(), targetMap.build());
        }

    }

}
