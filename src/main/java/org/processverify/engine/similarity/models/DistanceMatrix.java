package org.processverify.engine.similarity.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Square matrix of shortest-path hop counts, indexed by a sorted node list.
 * Unreachable pairs hold {@link #UNREACHABLE}; the diagonal is always 0.
 * A padded matrix has more rows than nodes: the padding rows belong to no node.
 */
public final class DistanceMatrix {
    public static final int UNREACHABLE = Integer.MAX_VALUE;

    private final List<String> nodes;
    private final int[][] cells;

    public DistanceMatrix(List<String> nodes, int[][] cells) {
        if (nodes.size() > cells.length) {
            throw new IllegalArgumentException(
                    "Matrix has " + cells.length + " rows for " + nodes.size() + " nodes");
        }
        for (int[] row : cells) {
            if (row.length != cells.length) {
                throw new IllegalArgumentException("Distance matrix must be square");
            }
        }
        this.nodes = List.copyOf(nodes);
        this.cells = deepCopy(cells);
    }

    public static DistanceMatrix empty() {
        return new DistanceMatrix(List.of(), new int[0][0]);
    }

    public List<String> nodes() {
        return nodes;
    }

    public int size() {
        return cells.length;
    }

    public int get(int row, int column) {
        return cells[row][column];
    }

    public boolean isReachable(int row, int column) {
        return cells[row][column] != UNREACHABLE;
    }

    /**
     * Pads the matrix to {@code dimension} x {@code dimension}. New cells are unreachable,
     * except new diagonal cells which are 0. The node list is not extended.
     */
    public DistanceMatrix padTo(int dimension) {
        if (dimension < size()) {
            throw new IllegalArgumentException("Cannot pad a " + size() + "x" + size() + " matrix down to " + dimension);
        }
        int[][] padded = new int[dimension][dimension];
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                if (i < size() && j < size()) {
                    padded[i][j] = cells[i][j];
                } else {
                    padded[i][j] = i == j ? 0 : UNREACHABLE;
                }
            }
        }
        return new DistanceMatrix(nodes, padded);
    }

    /**
     * Rows as lists, with {@code null} standing for unreachable cells.
     */
    public List<List<Integer>> toRows() {
        List<List<Integer>> rows = new ArrayList<>();
        for (int[] row : cells) {
            List<Integer> values = new ArrayList<>();
            for (int cell : row) {
                values.add(cell == UNREACHABLE ? null : cell);
            }
            rows.add(values);
        }
        return rows;
    }

    private static int[][] deepCopy(int[][] cells) {
        int[][] copy = new int[cells.length][];
        for (int i = 0; i < cells.length; i++) {
            copy[i] = cells[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DistanceMatrix that)) return false;
        return nodes.equals(that.nodes) && Arrays.deepEquals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return 31 * nodes.hashCode() + Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        return "DistanceMatrix{nodes=" + nodes + ", cells=" + toRows() + "}";
    }
}
