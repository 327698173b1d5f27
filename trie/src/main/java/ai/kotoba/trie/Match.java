// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.trie;

/**
 * A key of a double array which is a prefix of some query string, with the value stored for it.
 *
 * @param key the matched key
 * @param value the value stored for the key
 */
public record Match(String key, int value) {

    @Override
    public String toString() { return key + ":" + value; }

}
