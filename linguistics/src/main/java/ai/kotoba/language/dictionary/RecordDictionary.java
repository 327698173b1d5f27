// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

import java.util.List;

/**
 * A dictionary of fixed size word records addressed by record id, which is the byte offset of the record.
 * Each record holds a left context id, a right context id, a word cost and the offset of its comma-separated
 * feature string. Records are found through a target map from the key of the dictionary to record ids.
 *
 * <p>Reads are bounds checked: an id outside the dictionary reads as 0, and its features as the empty string.</p>
 *
 * @see RecordStore
 */
public interface RecordDictionary {

    /** Returns the left context id of the given record */
    int leftId(int recordId);

    /** Returns the right context id of the given record */
    int rightId(int recordId);

    int wordCost(int recordId);

    /** Returns the comma-separated features of the given record, starting with its surface form */
    String getFeatures(int recordId);

    /** Returns the ids of the records of the given key, in dictionary order, or an empty list if none */
    List<Integer> targets(int key);

    /** Returns the serialized records */
    byte[] recordBytes();

    /** Returns the serialized feature strings */
    byte[] featureBytes();

    /** Returns the serialized target map */
    byte[] targetMapBytes();

}
