package com.kamisolver.puzzle;

import lombok.Value;

/**
 * Unordered pair of region ids. The smaller id is always stored first.
 */
@Value
public class Edge implements Comparable<Edge> {

    int first;
    int second;

    private Edge(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public static Edge of(int a, int b) {
        return a <= b ? new Edge(a, b) : new Edge(b, a);
    }

    public boolean isSelfLoop() {
        return first == second;
    }

    public boolean touches(int id) {
        return first == id || second == id;
    }

    /**
     * Get the endpoint opposite to {@code id}.
     */
    public int other(int id) {
        if (id == first) return second;
        if (id == second) return first;
        throw new IllegalArgumentException("Region " + id + " is not an endpoint of " + this);
    }

    @Override
    public int compareTo(Edge o) {
        int c = Integer.compare(first, o.first);
        return c != 0 ? c : Integer.compare(second, o.second);
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")";
    }
}
