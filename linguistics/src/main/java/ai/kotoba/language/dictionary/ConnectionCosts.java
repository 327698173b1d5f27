// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary;

import ai.kotoba.io.GrowableByteBuffer;
import ai.kotoba.io.LittleEndianBuffer;

/**
 * The cost of connecting a word to the next, by the right context id of the first (forward id) and the
 * left context id of the second (backward id).
 *
 * <p>Serialized as i16 forward dimension, i16 backward dimension, then forward × backward i16 costs,
 * row-major by forward id.</p>
 */
public final class ConnectionCosts {

    private final int forwardDimension;
    private final int backwardDimension;

    /** The dimensions followed by the costs */
    private final short[] buffer;

    /**
     * Creates connection costs from a matrix of costs.
     *
     * @param costs forwardDimension * backwardDimension costs, row-major by forward id
     */
    public ConnectionCosts(int forwardDimension, int backwardDimension, short[] costs) {
        validateDimension("forward", forwardDimension);
        validateDimension("backward", backwardDimension);
        if (costs.length != forwardDimension * backwardDimension)
            throw new IllegalArgumentException("Expected " + forwardDimension * backwardDimension + " costs for a " +
                                               forwardDimension + "x" + backwardDimension + " matrix, got " + costs.length);
        this.forwardDimension = forwardDimension;
        this.backwardDimension = backwardDimension;
        this.buffer = new short[costs.length + 2];
        this.buffer[0] = (short)forwardDimension;
        this.buffer[1] = (short)backwardDimension;
        System.arraycopy(costs, 0, buffer, 2, costs.length);
    }

    private static void validateDimension(String name, int dimension) {
        if (dimension < 0 || dimension > Short.MAX_VALUE)
            throw new IllegalArgumentException("The " + name + " dimension must be in 0.." + Short.MAX_VALUE +
                                               ", but was " + dimension);
    }

    /**
     * Returns the cost of connecting a word with the given right id to a following word with the given left id.
     *
     * @throws IllegalArgumentException if an id is outside the matrix, which means the dictionary is corrupt
     */
    public int get(int forwardId, int backwardId) {
        if (forwardId < 0 || forwardId >= forwardDimension || backwardId < 0 || backwardId >= backwardDimension)
            throw new IllegalArgumentException("Connection (" + forwardId + ", " + backwardId + ") is outside the " +
                                               forwardDimension + "x" + backwardDimension + " cost matrix");
        return buffer[forwardId * backwardDimension + backwardId + 2];
    }

    public int forwardDimension() { return forwardDimension; }

    public int backwardDimension() { return backwardDimension; }

    public byte[] toBytes() { return GrowableByteBuffer.toBytes(buffer); }

    /**
     * Reads connection costs written by {@link #toBytes}.
     *
     * @throws IllegalArgumentException if the buffer is shorter than its dimensions say
     */
    public static ConnectionCosts load(LittleEndianBuffer bytes) {
        short[] values = bytes.toShortArray();
        if (values.length < 2)
            throw new IllegalArgumentException("Connection costs must start with two dimensions, but has " +
                                               bytes.size() + " bytes");
        int forwardDimension = values[0];
        int backwardDimension = values[1];
        if (forwardDimension < 0 || backwardDimension < 0 || values.length < forwardDimension * backwardDimension + 2)
            throw new IllegalArgumentException("Connection costs of dimensions " + forwardDimension + "x" +
                                               backwardDimension + " cannot be read from " + bytes.size() + " bytes");
        short[] costs = new short[forwardDimension * backwardDimension];
        System.arraycopy(values, 2, costs, 0, costs.length);
        return new ConnectionCosts(forwardDimension, backwardDimension, costs);
    }

    @Override
    public String toString() { return "connection costs " + forwardDimension + "x" + backwardDimension; }

}
