// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.viterbi;

import ai.kotoba.language.dictionary.ConnectionCosts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds the cheapest path from BOS to EOS through a lattice, where the cost of a path is the sum of
 * its word costs and the connection costs between adjacent words.
 *
 * <p>Costs are summed as longs, so long sentences cannot overflow. Among paths of equal cost, the one
 * whose predecessors were added to the lattice first wins.</p>
 */
public final class ViterbiSearcher {

    private static final Logger log = Logger.getLogger(ViterbiSearcher.class.getName());

    private final ConnectionCosts connectionCosts;

    public ViterbiSearcher(ConnectionCosts connectionCosts) {
        this.connectionCosts = Objects.requireNonNull(connectionCosts, "connectionCosts cannot be null");
    }

    /**
     * Returns the word nodes of the best path through the given lattice from left to right, excluding BOS and EOS.
     * Returns an empty list if EOS cannot be reached.
     */
    public List<ViterbiNode> search(ViterbiLattice lattice) {
        forward(lattice);
        return backward(lattice);
    }

    /** Computes the best predecessor and shortest cost of every node */
    void forward(ViterbiLattice lattice) {
        for (int position = 1; position <= lattice.eosPosition(); position++) {
            for (int index : lattice.nodesEndingAt(position)) {
                ViterbiNode node = lattice.node(index);
                int best = ViterbiNode.NO_PREVIOUS;
                long bestCost = ViterbiNode.UNREACHABLE;
                for (int prevIndex : lattice.nodesEndingAt(node.startPos() - 1)) {
                    ViterbiNode prev = lattice.node(prevIndex);
                    if ( ! prev.isReachable()) continue;

                    long cost = prev.shortestCost() + connectionCosts.get(prev.rightId(), node.leftId()) + node.cost();
                    if (cost < bestCost) {
                        best = prevIndex;
                        bestCost = cost;
                    }
                }
                node.setPath(best, bestCost);
            }
        }
    }

    /** Returns the best path ending in EOS, without BOS and EOS */
    List<ViterbiNode> backward(ViterbiLattice lattice) {
        ViterbiNode eos = lattice.eos();
        if ( ! eos.isReachable()) {
            if (log.isLoggable(Level.FINE))
                log.fine("No path reaches the end of " + lattice + ": Returning no words");
            return List.of();
        }

        List<ViterbiNode> path = new ArrayList<>();
        for (int index = eos.prev(); index != ViterbiNode.NO_PREVIOUS; ) {
            ViterbiNode node = lattice.node(index);
            if (node.type() == NodeType.BOS) break;
            path.add(node);
            index = node.prev();
        }
        Collections.reverse(path);
        return path;
    }

}
