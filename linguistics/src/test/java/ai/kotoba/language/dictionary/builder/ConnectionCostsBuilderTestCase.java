// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary.builder;

import ai.kotoba.language.dictionary.ConnectionCosts;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConnectionCostsBuilderTestCase {

    @Test
    public void testBuild() {
        ConnectionCosts costs = new ConnectionCostsBuilder().putLine("2 3")
                                                            .putLine("0 0 -434")
                                                            .putLine("")
                                                            .putLine("  1   2  1000  ")
                                                            .putLine("1 1")
                                                            .build();
        assertEquals(2, costs.forwardDimension());
        assertEquals(3, costs.backwardDimension());
        assertEquals(-434, costs.get(0, 0));
        assertEquals(1000, costs.get(1, 2));
        assertEquals(0, costs.get(0, 1));
    }

    @Test
    public void testIdsOutsideMatrixAreRejected() {
        ConnectionCostsBuilder builder = new ConnectionCostsBuilder().putLine("2 2");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> builder.putLine("2 0 1"));
        assertEquals("Parse error of matrix.def: Ids of '2 0 1' are outside the 2x2 matrix", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> builder.putLine("0 -1 1"));
    }

    @Test
    public void testInvalidNumbersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ConnectionCostsBuilder().putLine("two 2"));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionCostsBuilder().putLine("2"));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionCostsBuilder().putLine("40000 1"));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionCostsBuilder().putLine("1 1").putLine("0 0 x"));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionCostsBuilder().putLine("1 1").putLine("0 0 40000"));
    }

    @Test
    public void testDimensionsAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> new ConnectionCostsBuilder().putLine("   ").build());
    }

}
