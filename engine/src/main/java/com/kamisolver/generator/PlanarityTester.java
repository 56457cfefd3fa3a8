package com.kamisolver.generator;

import com.kamisolver.puzzle.Edge;

import javax.inject.Singleton;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Decides whether a simple undirected graph can be drawn in the plane without crossings.
 *
 * <p>The graph is split into biconnected blocks (a graph is planar iff each block is) and
 * each block with five or more vertices is embedded face by face with the
 * Demoucron-Malgrange-Pertuiset algorithm:
 * <ol>
 *   <li>Embed any cycle; it bounds two faces</li>
 *   <li>Compute the fragments of the block relative to the embedded part: chords between
 *       embedded vertices, and components of the remaining vertices with their attachments</li>
 *   <li>A fragment whose attachments do not all lie on one face makes the block non-planar</li>
 *   <li>Otherwise embed a path of a fragment (one with a single admissible face first) into
 *       an admissible face, splitting that face in two, and repeat</li>
 * </ol>
 */
@Singleton
public class PlanarityTester {

    /**
     * Every graph on at most this many vertices is planar.
     */
    private static final int ALWAYS_PLANAR_VERTICES = 4;

    /**
     * Check planarity of a graph on vertices {@code 0..nodeCount-1}.
     *
     * @throws IllegalArgumentException for self loops or vertices outside the range
     */
    public boolean isPlanar(int nodeCount, Collection<Edge> edges) {
        Map<Integer, Set<Integer>> adjacency = new TreeMap<>();
        for (int v = 0; v < nodeCount; v++) {
            adjacency.put(v, new TreeSet<>());
        }
        for (Edge edge : edges) {
            if (edge.isSelfLoop()) {
                throw new IllegalArgumentException("Self loop " + edge + " is not a simple graph edge");
            }
            if (!adjacency.containsKey(edge.getFirst()) || !adjacency.containsKey(edge.getSecond())) {
                throw new IllegalArgumentException("Edge " + edge + " is outside 0.." + (nodeCount - 1));
            }
            adjacency.get(edge.getFirst()).add(edge.getSecond());
            adjacency.get(edge.getSecond()).add(edge.getFirst());
        }
        return isPlanar(adjacency);
    }

    /**
     * Check planarity of a graph whose vertices are the endpoints of its edges.
     */
    public boolean isPlanar(Collection<Edge> edges) {
        Map<Integer, Set<Integer>> adjacency = new TreeMap<>();
        for (Edge edge : edges) {
            if (edge.isSelfLoop()) {
                throw new IllegalArgumentException("Self loop " + edge + " is not a simple graph edge");
            }
            adjacency.computeIfAbsent(edge.getFirst(), k -> new TreeSet<>()).add(edge.getSecond());
            adjacency.computeIfAbsent(edge.getSecond(), k -> new TreeSet<>()).add(edge.getFirst());
        }
        return isPlanar(adjacency);
    }

    private boolean isPlanar(Map<Integer, Set<Integer>> adjacency) {
        int vertices = adjacency.size();
        int edgeCount = 0;
        for (Set<Integer> neighbors : adjacency.values()) {
            edgeCount += neighbors.size();
        }
        edgeCount /= 2;
        if (vertices <= ALWAYS_PLANAR_VERTICES) {
            return true;
        }
        if (edgeCount > 3 * vertices - 6) {
            return false;
        }
        for (List<Edge> block : biconnectedBlocks(adjacency)) {
            if (!isBlockPlanar(block)) {
                return false;
            }
        }
        return true;
    }

    // ========================================================================
    // Biconnected blocks (Tarjan)
    // ========================================================================

    private List<List<Edge>> biconnectedBlocks(Map<Integer, Set<Integer>> adjacency) {
        List<List<Edge>> blocks = new ArrayList<>();
        Map<Integer, Integer> discovery = new HashMap<>();
        Map<Integer, Integer> low = new HashMap<>();
        Deque<Edge> edgeStack = new ArrayDeque<>();
        int[] clock = {0};

        for (int root : adjacency.keySet()) {
            if (!discovery.containsKey(root)) {
                visit(root, -1, adjacency, discovery, low, edgeStack, blocks, clock);
            }
        }
        return blocks;
    }

    private void visit(int u, int parent, Map<Integer, Set<Integer>> adjacency,
                       Map<Integer, Integer> discovery, Map<Integer, Integer> low,
                       Deque<Edge> edgeStack, List<List<Edge>> blocks, int[] clock) {
        discovery.put(u, clock[0]);
        low.put(u, clock[0]);
        clock[0]++;

        for (int v : adjacency.get(u)) {
            if (v == parent) {
                continue;
            }
            if (!discovery.containsKey(v)) {
                Edge treeEdge = Edge.of(u, v);
                edgeStack.push(treeEdge);
                visit(v, u, adjacency, discovery, low, edgeStack, blocks, clock);
                low.put(u, Math.min(low.get(u), low.get(v)));
                if (low.get(v) >= discovery.get(u)) {
                    List<Edge> block = new ArrayList<>();
                    Edge popped;
                    do {
                        popped = edgeStack.pop();
                        block.add(popped);
                    } while (!popped.equals(treeEdge));
                    blocks.add(block);
                }
            } else if (discovery.get(v) < discovery.get(u)) {
                edgeStack.push(Edge.of(u, v));
                low.put(u, Math.min(low.get(u), discovery.get(v)));
            }
        }
    }

    // ========================================================================
    // Demoucron-Malgrange-Pertuiset embedding of one block
    // ========================================================================

    private static final class Fragment {
        final Set<Integer> attachments;
        final Set<Integer> interior;
        final Edge chord;

        Fragment(Set<Integer> attachments, Set<Integer> interior, Edge chord) {
            this.attachments = attachments;
            this.interior = interior;
            this.chord = chord;
        }
    }

    private boolean isBlockPlanar(List<Edge> block) {
        Map<Integer, Set<Integer>> adjacency = new TreeMap<>();
        for (Edge edge : block) {
            adjacency.computeIfAbsent(edge.getFirst(), k -> new TreeSet<>()).add(edge.getSecond());
            adjacency.computeIfAbsent(edge.getSecond(), k -> new TreeSet<>()).add(edge.getFirst());
        }
        int vertices = adjacency.size();
        if (vertices <= ALWAYS_PLANAR_VERTICES) {
            return true;
        }
        if (block.size() > 3 * vertices - 6) {
            return false;
        }

        List<Integer> cycle = findCycle(adjacency);
        Set<Integer> embeddedVertices = new HashSet<>(cycle);
        Set<Edge> embeddedEdges = new HashSet<>();
        for (int i = 0; i < cycle.size(); i++) {
            embeddedEdges.add(Edge.of(cycle.get(i), cycle.get((i + 1) % cycle.size())));
        }
        List<List<Integer>> faces = new ArrayList<>();
        faces.add(new ArrayList<>(cycle));
        faces.add(new ArrayList<>(cycle));

        while (true) {
            List<Fragment> fragments = fragments(block, adjacency, embeddedVertices, embeddedEdges);
            if (fragments.isEmpty()) {
                return true;
            }

            Fragment chosen = null;
            int chosenFace = -1;
            for (Fragment fragment : fragments) {
                List<Integer> admissible = new ArrayList<>();
                for (int f = 0; f < faces.size(); f++) {
                    if (faces.get(f).containsAll(fragment.attachments)) {
                        admissible.add(f);
                    }
                }
                if (admissible.isEmpty()) {
                    return false;
                }
                if (admissible.size() == 1) {
                    chosen = fragment;
                    chosenFace = admissible.get(0);
                    break;
                }
                if (chosen == null) {
                    chosen = fragment;
                    chosenFace = admissible.get(0);
                }
            }

            List<Integer> path = fragmentPath(chosen, adjacency, embeddedVertices);
            splitFace(faces, chosenFace, path);
            embeddedVertices.addAll(path);
            for (int i = 0; i + 1 < path.size(); i++) {
                embeddedEdges.add(Edge.of(path.get(i), path.get(i + 1)));
            }
        }
    }

    /**
     * Any cycle of a block, found through the first back edge of a depth-first walk.
     */
    private List<Integer> findCycle(Map<Integer, Set<Integer>> adjacency) {
        int start = adjacency.keySet().iterator().next();
        Map<Integer, Integer> parent = new HashMap<>();
        parent.put(start, null);
        Deque<Integer> path = new ArrayDeque<>();
        Deque<Iterator<Integer>> iterators = new ArrayDeque<>();
        path.push(start);
        iterators.push(adjacency.get(start).iterator());

        while (!path.isEmpty()) {
            int u = path.peek();
            Iterator<Integer> it = iterators.peek();
            if (!it.hasNext()) {
                path.pop();
                iterators.pop();
                continue;
            }
            int v = it.next();
            if (parent.get(u) != null && v == parent.get(u)) {
                continue;
            }
            if (parent.containsKey(v)) {
                List<Integer> cycle = new ArrayList<>();
                int x = u;
                cycle.add(x);
                while (x != v) {
                    x = parent.get(x);
                    cycle.add(x);
                }
                return cycle;
            }
            parent.put(v, u);
            path.push(v);
            iterators.push(adjacency.get(v).iterator());
        }
        throw new IllegalStateException("Block without a cycle: " + adjacency);
    }

    private List<Fragment> fragments(List<Edge> block, Map<Integer, Set<Integer>> adjacency,
                                     Set<Integer> embeddedVertices, Set<Edge> embeddedEdges) {
        List<Fragment> fragments = new ArrayList<>();
        for (Edge edge : block) {
            if (embeddedVertices.contains(edge.getFirst()) && embeddedVertices.contains(edge.getSecond())
                    && !embeddedEdges.contains(edge)) {
                Set<Integer> attachments = new HashSet<>();
                attachments.add(edge.getFirst());
                attachments.add(edge.getSecond());
                fragments.add(new Fragment(attachments, Set.of(), edge));
            }
        }

        Set<Integer> seen = new HashSet<>();
        for (int v : adjacency.keySet()) {
            if (embeddedVertices.contains(v) || seen.contains(v)) {
                continue;
            }
            Set<Integer> interior = new HashSet<>();
            Set<Integer> attachments = new HashSet<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(v);
            while (!stack.isEmpty()) {
                int x = stack.pop();
                if (!interior.add(x)) {
                    continue;
                }
                for (int y : adjacency.get(x)) {
                    if (embeddedVertices.contains(y)) {
                        attachments.add(y);
                    } else if (!interior.contains(y)) {
                        stack.push(y);
                    }
                }
            }
            seen.addAll(interior);
            fragments.add(new Fragment(attachments, interior, null));
        }
        return fragments;
    }

    /**
     * A path through a fragment between two distinct attachments.
     * Blocks are biconnected, so every fragment has at least two attachments.
     */
    private List<Integer> fragmentPath(Fragment fragment, Map<Integer, Set<Integer>> adjacency,
                                       Set<Integer> embeddedVertices) {
        if (fragment.chord != null) {
            List<Integer> path = new ArrayList<>();
            path.add(fragment.chord.getFirst());
            path.add(fragment.chord.getSecond());
            return path;
        }

        int from = new TreeSet<>(fragment.attachments).first();
        int entry = -1;
        for (int y : adjacency.get(from)) {
            if (fragment.interior.contains(y)) {
                entry = y;
                break;
            }
        }

        Map<Integer, Integer> parent = new HashMap<>();
        parent.put(entry, null);
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(entry);
        while (!queue.isEmpty()) {
            int x = queue.poll();
            for (int y : adjacency.get(x)) {
                if (embeddedVertices.contains(y) && y != from) {
                    List<Integer> inner = new ArrayList<>();
                    Integer step = x;
                    while (step != null) {
                        inner.add(0, step);
                        step = parent.get(step);
                    }
                    List<Integer> path = new ArrayList<>();
                    path.add(from);
                    path.addAll(inner);
                    path.add(y);
                    return path;
                }
            }
            for (int y : adjacency.get(x)) {
                if (fragment.interior.contains(y) && !parent.containsKey(y)) {
                    parent.put(y, x);
                    queue.add(y);
                }
            }
        }
        throw new IllegalStateException("Fragment with a single attachment inside a block");
    }

    /**
     * Replace face {@code index} by the two faces the path cuts it into.
     */
    private void splitFace(List<List<Integer>> faces, int index, List<Integer> path) {
        List<Integer> face = faces.remove(index);
        int from = path.get(0);
        int to = path.get(path.size() - 1);
        int fromPos = face.indexOf(from);
        int toPos = face.indexOf(to);
        List<Integer> inner = path.subList(1, path.size() - 1);

        List<Integer> first = walk(face, fromPos, toPos);
        for (int i = inner.size() - 1; i >= 0; i--) {
            first.add(inner.get(i));
        }
        List<Integer> second = walk(face, toPos, fromPos);
        second.addAll(inner);

        faces.add(first);
        faces.add(second);
    }

    private List<Integer> walk(List<Integer> face, int fromPos, int toPos) {
        List<Integer> out = new ArrayList<>();
        int i = fromPos;
        while (true) {
            out.add(face.get(i));
            if (i == toPos) {
                return out;
            }
            i = (i + 1) % face.size();
        }
    }
}
