package com.kamisolver.signature;

import com.kamisolver.puzzle.RegionGraph;
import com.kamisolver.puzzle.RegionNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Color-preserving isomorphism test between two region graphs.
 *
 * <p>Backtracking search that only pairs regions with equal refinement labels (which
 * already implies equal color and degree) and checks adjacency against every region mapped
 * so far. Regions are visited in breadth-first order from the rarest label class so that
 * most candidates are rejected by adjacency after a few levels.
 */
final class IsomorphismChecker {

    private IsomorphismChecker() {
    }

    static boolean areIsomorphic(RegionGraph left, Map<Integer, Long> leftLabels,
                                 RegionGraph right, Map<Integer, Long> rightLabels) {
        if (left.size() != right.size() || left.getEdgeCount() != right.getEdgeCount()) {
            return false;
        }

        Map<Long, List<Integer>> rightByLabel = new HashMap<>();
        for (int id : right.getLiveIds()) {
            rightByLabel.computeIfAbsent(rightLabels.get(id), k -> new ArrayList<>()).add(id);
        }
        Map<Long, Integer> leftCounts = new HashMap<>();
        for (int id : left.getLiveIds()) {
            leftCounts.merge(leftLabels.get(id), 1, Integer::sum);
        }
        for (Map.Entry<Long, Integer> entry : leftCounts.entrySet()) {
            List<Integer> candidates = rightByLabel.get(entry.getKey());
            if (candidates == null || candidates.size() != entry.getValue()) {
                return false;
            }
        }

        List<Integer> order = searchOrder(left, leftLabels, leftCounts);
        return extend(0, order, left, leftLabels, right, rightByLabel, new HashMap<>(), new HashSet<>());
    }

    private static boolean extend(int depth, List<Integer> order,
                                  RegionGraph left, Map<Integer, Long> leftLabels,
                                  RegionGraph right, Map<Long, List<Integer>> rightByLabel,
                                  Map<Integer, Integer> mapping, Set<Integer> used) {
        if (depth == order.size()) {
            return true;
        }
        int leftId = order.get(depth);
        RegionNode leftNode = left.getNode(leftId);

        for (int rightId : rightByLabel.get(leftLabels.get(leftId))) {
            if (used.contains(rightId)) {
                continue;
            }
            RegionNode rightNode = right.getNode(rightId);
            if (!leftNode.getColor().equals(rightNode.getColor())
                    || leftNode.getDegree() != rightNode.getDegree()
                    || !consistent(leftNode, rightNode, mapping)) {
                continue;
            }
            mapping.put(leftId, rightId);
            used.add(rightId);
            if (extend(depth + 1, order, left, leftLabels, right, rightByLabel, mapping, used)) {
                return true;
            }
            mapping.remove(leftId);
            used.remove(rightId);
        }
        return false;
    }

    private static boolean consistent(RegionNode leftNode, RegionNode rightNode, Map<Integer, Integer> mapping) {
        for (Map.Entry<Integer, Integer> mapped : mapping.entrySet()) {
            boolean leftAdjacent = leftNode.isAdjacentTo(mapped.getKey());
            boolean rightAdjacent = rightNode.isAdjacentTo(mapped.getValue());
            if (leftAdjacent != rightAdjacent) {
                return false;
            }
        }
        return true;
    }

    private static List<Integer> searchOrder(RegionGraph graph, Map<Integer, Long> labels, Map<Long, Integer> counts) {
        List<Integer> byRarity = new ArrayList<>(graph.getLiveIds());
        byRarity.sort(Comparator.<Integer>comparingInt(id -> counts.get(labels.get(id)))
                .thenComparing(Comparator.naturalOrder()));

        List<Integer> order = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (int root : byRarity) {
            if (seen.contains(root)) {
                continue;
            }
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(root);
            seen.add(root);
            while (!queue.isEmpty()) {
                int current = queue.poll();
                order.add(current);
                for (int neighbor : graph.getNode(current).getNeighbors()) {
                    if (seen.add(neighbor)) {
                        queue.add(neighbor);
                    }
                }
            }
        }
        return order;
    }
}
