// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.viterbi;

import ai.kotoba.language.MinimumDictionaries;
import ai.kotoba.language.dictionary.ConnectionCosts;
import ai.kotoba.language.dictionary.Dictionaries;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ViterbiSearcherTestCase {

    @Test
    public void testBestPath() {
        Dictionaries dictionaries = MinimumDictionaries.get();
        ViterbiLattice lattice = new ViterbiBuilder(dictionaries).build("すもももももももものうち");
        List<ViterbiNode> path = new ViterbiSearcher(dictionaries.connectionCosts()).search(lattice);
        assertEquals(List.of("すもも", "も", "もも", "も", "もも", "の", "うち"),
                     path.stream().map(ViterbiNode::surfaceForm).collect(Collectors.toList()));
        assertEquals(List.of(1, 4, 5, 7, 8, 10, 11),
                     path.stream().map(ViterbiNode::startPos).collect(Collectors.toList()));
        assertEquals(700, lattice.eos().shortestCost());
    }

    @Test
    public void testBestPathIsOptimalOnDictionaryLattices() {
        Dictionaries dictionaries = MinimumDictionaries.get();
        ViterbiBuilder builder = new ViterbiBuilder(dictionaries);
        ViterbiSearcher searcher = new ViterbiSearcher(dictionaries.connectionCosts());
        for (String sentence : List.of("すもももももももものうち", "となりのトトロ", "もものうちのもも", "𠮷野屋のうち")) {
            ViterbiLattice lattice = builder.build(sentence);
            List<ViterbiNode> path = searcher.search(lattice);
            long bruteForceCost = cheapestPathCost(lattice, dictionaries.connectionCosts());
            assertEquals(bruteForceCost, lattice.eos().shortestCost(), sentence);
            assertEquals(bruteForceCost, pathCost(path, dictionaries.connectionCosts()), sentence);
        }
    }

    @Test
    public void testBestPathIsOptimalOnRandomLattices() {
        Random random = new Random(42);
        for (int round = 0; round < 200; round++) {
            int ids = 1 + random.nextInt(4);
            short[] matrix = new short[ids * ids];
            for (int i = 0; i < matrix.length; i++)
                matrix[i] = (short)(random.nextInt(2000) - 500);
            ConnectionCosts costs = new ConnectionCosts(ids, ids, matrix);

            ViterbiLattice lattice = new ViterbiLattice();
            int length = 1 + random.nextInt(7);
            for (int start = 1; start <= length; start++) {
                int candidates = 1 + random.nextInt(3);
                for (int i = 0; i < candidates; i++) {
                    int wordLength = 1 + random.nextInt(length - start + 1);
                    lattice.append(i, random.nextInt(3000) - 1000, start, wordLength, NodeType.KNOWN,
                                   random.nextInt(ids), random.nextInt(ids), "w" + start + "." + i);
                }
            }
            lattice.appendEos();

            List<ViterbiNode> path = new ViterbiSearcher(costs).search(lattice);
            long bruteForceCost = cheapestPathCost(lattice, costs);
            assertEquals(bruteForceCost, lattice.eos().shortestCost(), "Round " + round);
            assertEquals(bruteForceCost, pathCost(path, costs), "Round " + round);
            assertContiguous(path, lattice.eosPosition());
        }
    }

    @Test
    public void testFirstAddedPredecessorWinsTies() {
        ViterbiLattice lattice = new ViterbiLattice();
        ViterbiNode first = lattice.append(10, 100, 1, 1, NodeType.KNOWN, 0, 0, "a");
        lattice.append(20, 100, 1, 1, NodeType.UNKNOWN, 0, 0, "a");
        lattice.appendEos();
        List<ViterbiNode> path = new ViterbiSearcher(new ConnectionCosts(1, 1, new short[1])).search(lattice);
        assertEquals(List.of(first), path);
    }

    @Test
    public void testUnreachableEndGivesEmptyPath() {
        ViterbiLattice lattice = new ViterbiLattice();
        ViterbiNode stranded = lattice.append(0, 100, 2, 1, NodeType.KNOWN, 0, 0, "b");
        lattice.appendEos();
        List<ViterbiNode> path = new ViterbiSearcher(new ConnectionCosts(1, 1, new short[1])).search(lattice);
        assertTrue(path.isEmpty());
        assertFalse(stranded.isReachable());
        assertFalse(lattice.eos().isReachable());
        assertEquals(ViterbiNode.NO_PREVIOUS, lattice.eos().prev());
    }

    @Test
    public void testEmptyLatticeGivesEmptyPath() {
        ViterbiLattice lattice = new ViterbiLattice();
        lattice.appendEos();
        assertTrue(new ViterbiSearcher(new ConnectionCosts(1, 1, new short[] { 7 })).search(lattice).isEmpty());
        assertEquals(7, lattice.eos().shortestCost());
    }

    @Test
    public void testCostsDoNotOverflow() {
        ViterbiLattice lattice = new ViterbiLattice();
        int words = 100000;
        for (int start = 1; start <= words; start++)
            lattice.append(0, Short.MAX_VALUE, start, 1, NodeType.KNOWN, 0, 0, "x");
        lattice.appendEos();
        List<ViterbiNode> path = new ViterbiSearcher(new ConnectionCosts(1, 1, new short[] { Short.MAX_VALUE })).search(lattice);
        assertEquals(words, path.size());
        assertEquals((long)Short.MAX_VALUE * (2L * words + 1), lattice.eos().shortestCost());
    }

    /** Returns the cost of the cheapest path from BOS to EOS by enumerating all paths */
    private static long cheapestPathCost(ViterbiLattice lattice, ConnectionCosts costs) {
        List<List<ViterbiNode>> paths = new ArrayList<>();
        enumerate(lattice, lattice.bos(), new ArrayList<>(), paths);
        long cheapest = ViterbiNode.UNREACHABLE;
        for (List<ViterbiNode> path : paths)
            cheapest = Math.min(cheapest, pathCost(path, costs));
        return cheapest;
    }

    private static void enumerate(ViterbiLattice lattice, ViterbiNode from, List<ViterbiNode> path,
                                  List<List<ViterbiNode>> paths) {
        int nextStart = from.type() == NodeType.BOS ? 1 : from.endPos() + 1;
        if (nextStart == lattice.eosPosition()) {
            paths.add(new ArrayList<>(path));
            return;
        }
        for (ViterbiNode node : lattice.nodes()) {
            if (node.startPos() != nextStart) continue;
            if (node.type() != NodeType.KNOWN && node.type() != NodeType.UNKNOWN) continue;

            path.add(node);
            enumerate(lattice, node, path, paths);
            path.remove(path.size() - 1);
        }
    }

    /** Returns the cost of a path of word nodes, including the connections from BOS and to EOS */
    private static long pathCost(List<ViterbiNode> path, ConnectionCosts costs) {
        long cost = 0;
        int rightId = 0;
        for (ViterbiNode node : path) {
            cost += costs.get(rightId, node.leftId()) + node.cost();
            rightId = node.rightId();
        }
        return cost + costs.get(rightId, 0);
    }

    private static void assertContiguous(List<ViterbiNode> path, int eosPosition) {
        int expectedStart = 1;
        for (ViterbiNode node : path) {
            assertEquals(expectedStart, node.startPos());
            expectedStart = node.endPos() + 1;
        }
        assertEquals(eosPosition, expectedStart);
    }

}
