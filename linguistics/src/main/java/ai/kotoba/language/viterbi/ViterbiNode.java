// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.viterbi;

import java.util.Objects;

/**
 * A candidate word in a lattice. Nodes are owned by a {@link ViterbiLattice} and refer to
 * their best predecessor by its index in the lattice.
 *
 * <p>The word data of a node is fixed when it is created, while the search state
 * (best predecessor and shortest cost) is written by {@link ViterbiSearcher}.</p>
 */
public final class ViterbiNode {

    /** The value of {@link #prev()} for a node without a predecessor */
    public static final int NO_PREVIOUS = -1;

    /** The value of {@link #name()} for BOS and EOS nodes */
    public static final int NO_NAME = -1;

    /** The shortest cost of a node which cannot be reached from BOS */
    public static final long UNREACHABLE = Long.MAX_VALUE;

    private final int index;
    private final int name;
    private final int cost;
    private final int startPos;
    private final int length;
    private final NodeType type;
    private final int leftId;
    private final int rightId;
    private final String surfaceForm;

    private int prev = NO_PREVIOUS;
    private long shortestCost = UNREACHABLE;

    ViterbiNode(int index, int name, int cost, int startPos, int length, NodeType type,
                int leftId, int rightId, String surfaceForm) {
        this.index = index;
        this.name = name;
        this.cost = cost;
        this.startPos = startPos;
        this.length = length;
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.leftId = leftId;
        this.rightId = rightId;
        this.surfaceForm = Objects.requireNonNull(surfaceForm, "surfaceForm cannot be null");
    }

    /** Returns the index of this in its lattice */
    public int index() { return index; }

    /** Returns the record id of this word in the dictionary given by its type, or {@link #NO_NAME} */
    public int name() { return name; }

    /** Returns the word cost of this */
    public int cost() { return cost; }

    /** Returns the 1-based logical character position where this word starts */
    public int startPos() { return startPos; }

    /** Returns the length of this word in logical characters */
    public int length() { return length; }

    /** Returns the 1-based logical character position of the last character of this word, or the start of BOS and EOS */
    public int endPos() { return length == 0 ? startPos : startPos + length - 1; }

    public NodeType type() { return type; }

    public int leftId() { return leftId; }

    public int rightId() { return rightId; }

    public String surfaceForm() { return surfaceForm; }

    /** Returns the lattice index of the best predecessor of this, or {@link #NO_PREVIOUS} */
    public int prev() { return prev; }

    /** Returns the cost of the best path from BOS to and including this, or {@link #UNREACHABLE} */
    public long shortestCost() { return shortestCost; }

    public boolean isReachable() { return shortestCost != UNREACHABLE; }

    void setPath(int prev, long shortestCost) {
        this.prev = prev;
        this.shortestCost = shortestCost;
    }

    @Override
    public String toString() {
        return type + " node '" + surfaceForm + "' at " + startPos + " (" + name + ", cost " + cost +
               ", left " + leftId + ", right " + rightId + ")";
    }

}
