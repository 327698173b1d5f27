// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.viterbi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All candidate words of a sentence, indexed by the position where they end.
 * Position 0 holds BOS only, and the position after the last character of the
 * longest candidate holds EOS only.
 *
 * <p>A lattice is built by one thread and discarded after its best path is extracted.</p>
 */
public final class ViterbiLattice {

    private final List<ViterbiNode> nodes = new ArrayList<>();
    private final List<List<Integer>> nodesEndAt = new ArrayList<>();
    private final ViterbiNode bos;
    private ViterbiNode eos = null;

    public ViterbiLattice() {
        bos = add(ViterbiNode.NO_NAME, 0, 0, 0, NodeType.BOS, 0, 0, "");
        bos.setPath(ViterbiNode.NO_PREVIOUS, 0);
    }

    /**
     * Adds a word node.
     *
     * @param startPos the 1-based logical position of the first character of the word
     * @param length the length of the word in logical characters, at least 1
     * @return the new node
     * @throws IllegalStateException if EOS is already added
     */
    public ViterbiNode append(int name, int cost, int startPos, int length, NodeType type,
                              int leftId, int rightId, String surfaceForm) {
        if (eos != null) throw new IllegalStateException("Cannot add nodes after EOS");
        if (startPos < 1) throw new IllegalArgumentException("Start position must be at least 1, was " + startPos);
        if (length < 1) throw new IllegalArgumentException("Length must be at least 1, was " + length);
        if (type == NodeType.BOS || type == NodeType.EOS)
            throw new IllegalArgumentException("BOS and EOS nodes are added by the lattice");
        return add(name, cost, startPos, length, type, leftId, rightId, surfaceForm);
    }

    /**
     * Adds the EOS node after the last position where any node ends, which completes this lattice.
     *
     * @throws IllegalStateException if EOS is already added
     */
    public ViterbiNode appendEos() {
        if (eos != null) throw new IllegalStateException("EOS is already added");
        int position = nodesEndAt.size();
        eos = add(ViterbiNode.NO_NAME, 0, position, 0, NodeType.EOS, 0, 0, "");
        return eos;
    }

    private ViterbiNode add(int name, int cost, int startPos, int length, NodeType type,
                            int leftId, int rightId, String surfaceForm) {
        ViterbiNode node = new ViterbiNode(nodes.size(), name, cost, startPos, length, type, leftId, rightId, surfaceForm);
        while (nodesEndAt.size() <= node.endPos())
            nodesEndAt.add(new ArrayList<>());
        nodesEndAt.get(node.endPos()).add(node.index());
        nodes.add(node);
        return node;
    }

    /** Returns the node at the given index */
    public ViterbiNode node(int index) { return nodes.get(index); }

    /** Returns all nodes in the order they were added */
    public List<ViterbiNode> nodes() { return Collections.unmodifiableList(nodes); }

    /** Returns the indexes of the nodes ending at the given position, which is empty if there are none */
    public List<Integer> nodesEndingAt(int position) {
        if (position < 0 || position >= nodesEndAt.size()) return List.of();
        return Collections.unmodifiableList(nodesEndAt.get(position));
    }

    public ViterbiNode bos() { return bos; }

    /** Returns the EOS node */
    public ViterbiNode eos() {
        if (eos == null) throw new IllegalStateException("EOS is not added");
        return eos;
    }

    public boolean isComplete() { return eos != null; }

    /** Returns the position of EOS, which is also the last position of this */
    public int eosPosition() { return eos().startPos(); }

    public int size() { return nodes.size(); }

    @Override
    public String toString() {
        return "lattice of " + nodes.size() + " nodes over " + Math.max(0, nodesEndAt.size() - 1) + " positions";
    }

}
