// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary.builder;

import ai.kotoba.language.dictionary.ConnectionCosts;

/**
 * Builds connection costs from the lines of a matrix.def file: a first line "forward_dimension backward_dimension"
 * followed by lines "forward_id backward_id cost". Connections not listed cost 0.
 */
public class ConnectionCostsBuilder {

    private int forwardDimension = -1;
    private int backwardDimension = -1;
    private short[] costs;

    /**
     * Adds a line of matrix.def. Blank lines, and cost lines which do not have three fields, are ignored.
     *
     * @throws IllegalArgumentException if the line is not valid
     */
    public ConnectionCostsBuilder putLine(String line) {
        String[] fields = line.trim().split("\\s+");
        if (fields.length == 1 && fields[0].isEmpty()) return this;

        if (costs == null) {
            putDimensions(fields, line);
            return this;
        }
        if (fields.length != 3) return this;

        int forwardId = parse(fields[0], line);
        int backwardId = parse(fields[1], line);
        int cost = parse(fields[2], line);
        if (forwardId < 0 || forwardId >= forwardDimension || backwardId < 0 || backwardId >= backwardDimension)
            throw new IllegalArgumentException("Parse error of matrix.def: Ids of '" + line + "' are outside the " +
                                               forwardDimension + "x" + backwardDimension + " matrix");
        if (cost < Short.MIN_VALUE || cost > Short.MAX_VALUE)
            throw new IllegalArgumentException("Parse error of matrix.def: Cost of '" + line + "' does not fit in 16 bits");
        costs[forwardId * backwardDimension + backwardId] = (short)cost;
        return this;
    }

    private void putDimensions(String[] fields, String line) {
        if (fields.length < 2)
            throw new IllegalArgumentException("Parse error of matrix.def: Expected dimensions, got '" + line + "'");
        forwardDimension = parse(fields[0], line);
        backwardDimension = parse(fields[1], line);
        if (forwardDimension < 0 || backwardDimension < 0 ||
            forwardDimension > Short.MAX_VALUE || backwardDimension > Short.MAX_VALUE)
            throw new IllegalArgumentException("Parse error of matrix.def: Invalid dimensions '" + line + "'");
        costs = new short[forwardDimension * backwardDimension];
    }

    private static int parse(String field, String line) {
        try {
            return Integer.parseInt(field);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parse error of matrix.def: '" + field + "' in '" + line +
                                               "' is not a number", e);
        }
    }

    /**
     * Returns the connection costs added.
     *
     * @throws IllegalArgumentException if no dimensions were given
     */
    public ConnectionCosts build() {
        if (costs == null)
            throw new IllegalArgumentException("Parse error of matrix.def: No dimensions line");
        return new ConnectionCosts(forwardDimension, backwardDimension, costs.clone());
    }

}
