// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.trie;

import java.util.Arrays;

/**
 * The node arrays of a double array under construction, with the unused slots kept as a doubly linked list
 * encoded in the arrays themselves: a free slot i has BASE[i] = -previousFree and CHECK[i] = -nextFree.
 * Used slots have CHECK &gt;= 0. Slot 0 is the root and is never free.
 *
 * <p>Slots past the end of the arrays are free and linked to their neighbours, the same values
 * {@link DoubleArray} returns for reads past its end. The list is kept in ascending slot order.</p>
 *
 * <p>Not thread safe. An instance is owned by one build.</p>
 */
class FreeList {

    private static final int minimumCapacity = 1024;

    private int[] base;
    private int[] check;

    /** The lowest free slot */
    private int firstFree = 1;

    FreeList(int expectedNodes) {
        int capacity = Math.max(minimumCapacity, expectedNodes);
        base = new int[capacity];
        check = new int[capacity];
        initializeFree(1, capacity);
        base[0] = 1;
        check[0] = 0;
        base[1] = 0;
    }

    private void initializeFree(int from, int to) {
        for (int i = from; i < to; i++) {
            base[i] = -i + 1;
            check[i] = -i - 1;
        }
    }

    int capacity() { return base.length; }

    boolean isFree(int node) {
        return node >= check.length || check[node] < 0;
    }

    private int nextFree(int node) {
        return node >= check.length ? node + 1 : -check[node];
    }

    void setBase(int node, int value) {
        ensureCapacity(node + 1);
        base[node] = value;
    }

    /**
     * Returns the smallest base offset, at least 1, such that every slot base + code is free.
     *
     * @param codes the distinct byte codes of the children to place, in ascending order
     */
    int findAllocatableBase(int[] codes) {
        for (int slot = firstFree; ; slot = nextFree(slot)) {
            int candidate = slot - codes[0];
            if (candidate < 1) continue;
            if (allFree(candidate, codes)) return candidate;
        }
    }

    private boolean allFree(int candidate, int[] codes) {
        for (int i = 1; i < codes.length; i++) {
            if ( ! isFree(candidate + codes[i])) return false;
        }
        return true;
    }

    /** Removes the given free slot from the list and makes it a child of parent */
    void allocate(int node, int parent) {
        if ( ! isFree(node))
            throw new IllegalStateException("Slot " + node + " is already in use");
        ensureCapacity(node + 1);
        int previous = -base[node];
        int next = -check[node];
        ensureCapacity(next + 1);

        if (node == firstFree) {
            firstFree = next;
            base[next] = 0;
        }
        else {
            check[previous] = -next;
            base[next] = -previous;
        }
        check[node] = parent;
    }

    private void ensureCapacity(int size) {
        if (size <= base.length) return;
        int oldCapacity = base.length;
        int newCapacity = Math.max(size, oldCapacity * 2);
        base = Arrays.copyOf(base, newCapacity);
        check = Arrays.copyOf(check, newCapacity);
        initializeFree(oldCapacity, newCapacity);
        base[oldCapacity] = -lastFreeBefore(oldCapacity);
    }

    /** Returns the highest free slot below the given one, or 0 if none */
    private int lastFreeBefore(int node) {
        for (int i = node - 1; i > 0; i--) {
            if (check[i] < 0) return i;
        }
        return 0;
    }

    /** Returns the highest slot in use */
    int highestUsed() {
        for (int i = check.length - 1; i > 0; i--) {
            if (check[i] >= 0) return i;
        }
        return 0;
    }

    /** Returns the BASE array shrunk to the highest slot in use */
    int[] baseArray() { return Arrays.copyOf(base, highestUsed() + 1); }

    /** Returns the CHECK array shrunk to the highest slot in use */
    int[] checkArray() { return Arrays.copyOf(check, highestUsed() + 1); }

}
