package com.kamisolver.generator;

import com.kamisolver.puzzle.Edge;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Tests for PlanarityTester against graphs of known planarity.
 */
public class PlanarityTesterTest {

    private PlanarityTester tester;

    @Before
    public void setUp() {
        tester = new PlanarityTester();
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private static List<Edge> complete(int n) {
        List<Edge> edges = new ArrayList<>();
        for (int a = 0; a < n; a++) {
            for (int b = a + 1; b < n; b++) {
                edges.add(Edge.of(a, b));
            }
        }
        return edges;
    }

    private static List<Edge> completeBipartite(int left, int right) {
        List<Edge> edges = new ArrayList<>();
        for (int a = 0; a < left; a++) {
            for (int b = 0; b < right; b++) {
                edges.add(Edge.of(a, left + b));
            }
        }
        return edges;
    }

    private static List<Edge> cycle(int n) {
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            edges.add(Edge.of(i, (i + 1) % n));
        }
        return edges;
    }

    private static List<Edge> petersen() {
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            edges.add(Edge.of(i, (i + 1) % 5));
            edges.add(Edge.of(i, i + 5));
            edges.add(Edge.of(5 + i, 5 + (i + 2) % 5));
        }
        return edges;
    }

    private static List<Edge> grid(int rows, int cols) {
        List<Edge> edges = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int id = r * cols + c;
                if (c + 1 < cols) edges.add(Edge.of(id, id + 1));
                if (r + 1 < rows) edges.add(Edge.of(id, id + cols));
            }
        }
        return edges;
    }

    private static List<Edge> wheel(int rim) {
        List<Edge> edges = new ArrayList<>();
        for (int i = 1; i <= rim; i++) {
            edges.add(Edge.of(0, i));
            edges.add(Edge.of(i, i % rim + 1));
        }
        return edges;
    }

    // ========================================================================
    // Non-Planar Graphs
    // ========================================================================

    @Test
    public void testK5IsNotPlanar() {
        assertFalse(tester.isPlanar(5, complete(5)));
    }

    @Test
    public void testK33IsNotPlanar() {
        assertFalse(tester.isPlanar(6, completeBipartite(3, 3)));
    }

    @Test
    public void testPetersenIsNotPlanar() {
        assertFalse(tester.isPlanar(10, petersen()));
    }

    @Test
    public void testSubdividedK5IsNotPlanar() {
        List<Edge> edges = complete(5);
        edges.remove(Edge.of(0, 1));
        edges.remove(Edge.of(2, 3));
        edges.add(Edge.of(0, 5));
        edges.add(Edge.of(5, 1));
        edges.add(Edge.of(2, 6));
        edges.add(Edge.of(6, 3));

        assertFalse(tester.isPlanar(7, edges));
    }

    @Test
    public void testSubdividedK33IsNotPlanar() {
        // Sparse enough to pass the edge count bound
        List<Edge> edges = completeBipartite(3, 3);
        edges.remove(Edge.of(0, 3));
        edges.add(Edge.of(0, 6));
        edges.add(Edge.of(6, 7));
        edges.add(Edge.of(7, 3));

        assertFalse(tester.isPlanar(8, edges));
    }

    @Test
    public void testK33BehindBridgeIsNotPlanar() {
        List<Edge> edges = completeBipartite(3, 3);
        edges.add(Edge.of(5, 6));
        edges.add(Edge.of(6, 7));
        edges.add(Edge.of(7, 8));
        edges.add(Edge.of(8, 6));

        assertFalse(tester.isPlanar(9, edges));
    }

    @Test
    public void testK5WithIsolatedVerticesIsNotPlanar() {
        assertFalse(tester.isPlanar(8, complete(5)));
    }

    // ========================================================================
    // Planar Graphs
    // ========================================================================

    @Test
    public void testSmallGraphsArePlanar() {
        assertTrue(tester.isPlanar(0, Collections.emptyList()));
        assertTrue(tester.isPlanar(1, Collections.emptyList()));
        assertTrue(tester.isPlanar(4, complete(4)));
    }

    @Test
    public void testTreesArePlanar() {
        List<Edge> edges = new ArrayList<>();
        for (int i = 1; i < 12; i++) {
            edges.add(Edge.of((i - 1) / 2, i));
        }

        assertTrue(tester.isPlanar(12, edges));
    }

    @Test
    public void testCyclesArePlanar() {
        assertTrue(tester.isPlanar(5, cycle(5)));
        assertTrue(tester.isPlanar(9, cycle(9)));
    }

    @Test
    public void testWheelsArePlanar() {
        assertTrue(tester.isPlanar(6, wheel(5)));
        assertTrue(tester.isPlanar(9, wheel(8)));
    }

    @Test
    public void testGridsArePlanar() {
        assertTrue(tester.isPlanar(9, grid(3, 3)));
        assertTrue(tester.isPlanar(12, grid(3, 4)));
    }

    @Test
    public void testNearlyCompleteGraphsArePlanar() {
        List<Edge> k5 = complete(5);
        k5.remove(Edge.of(3, 4));
        List<Edge> k33 = completeBipartite(3, 3);
        k33.remove(Edge.of(2, 5));

        assertTrue(tester.isPlanar(5, k5));
        assertTrue(tester.isPlanar(6, k33));
    }

    @Test
    public void testOctahedronIsPlanar() {
        // Maximal planar: exactly 3V - 6 edges
        List<Edge> edges = complete(6);
        edges.remove(Edge.of(0, 1));
        edges.remove(Edge.of(2, 3));
        edges.remove(Edge.of(4, 5));

        assertTrue(tester.isPlanar(6, edges));
    }

    @Test
    public void testBlocksSharingCutVertexArePlanar() {
        List<Edge> edges = complete(4);
        for (Edge edge : complete(4)) {
            edges.add(Edge.of(edge.getFirst() == 0 ? 0 : edge.getFirst() + 3, edge.getSecond() + 3));
        }

        assertTrue(tester.isPlanar(7, edges));
    }

    @Test
    public void testDisjointPlanarComponents() {
        List<Edge> edges = new ArrayList<>(complete(4));
        for (Edge edge : cycle(5)) {
            edges.add(Edge.of(edge.getFirst() + 4, edge.getSecond() + 4));
        }

        assertTrue(tester.isPlanar(9, edges));
    }

    @Test
    public void testEdgeOnlyOverload() {
        List<Edge> shifted = new ArrayList<>();
        for (Edge edge : complete(5)) {
            shifted.add(Edge.of(edge.getFirst() + 10, edge.getSecond() + 10));
        }

        assertFalse(tester.isPlanar(shifted));
        assertTrue(tester.isPlanar(wheel(6)));
    }

    // ========================================================================
    // Invalid Input
    // ========================================================================

    @Test(expected = IllegalArgumentException.class)
    public void testSelfLoopRejected() {
        tester.isPlanar(3, Collections.singletonList(Edge.of(1, 1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOutOfRangeVertexRejected() {
        tester.isPlanar(3, Collections.singletonList(Edge.of(1, 3)));
    }
}
