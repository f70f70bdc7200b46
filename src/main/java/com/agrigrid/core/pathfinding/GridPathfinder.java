package com.agrigrid.core.pathfinding;

import com.agrigrid.core.model.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * A* shortest-path search on a 4-connected grid.
 * <p>
 * Uses the Manhattan distance as heuristic. Nodes with equal f-score are expanded in
 * insertion order, so identical inputs always produce the identical path.
 */
public class GridPathfinder {

    /** Expansion order: up, down, right, left. */
    private static final int[][] MOVES = {{0, 1}, {0, -1}, {1, 0}, {-1, 0}};

    /**
     * Finds a shortest path from {@code start} to {@code goal}.
     *
     * @param obstacles cells that may not be entered; may be null
     * @return the path including both endpoints, {@code [start]} when start equals goal,
     *         or an empty list when no path exists
     */
    public List<Position> findPath(Position start, Position goal, int width, int height, Set<Position> obstacles) {
        Set<Position> blocked = obstacles != null ? obstacles : Collections.emptySet();
        if (!inBounds(start, width, height) || !inBounds(goal, width, height)) {
            return List.of();
        }
        if (blocked.contains(start) || blocked.contains(goal)) {
            return List.of();
        }
        if (start.equals(goal)) {
            return List.of(start);
        }

        PriorityQueue<SearchNode> open = new PriorityQueue<>();
        Map<Position, Integer> bestG = new HashMap<>();
        Set<Position> closed = new HashSet<>();
        long sequence = 0;

        open.add(new SearchNode(start, null, 0, start.manhattanDistance(goal), sequence));
        bestG.put(start, 0);

        while (!open.isEmpty()) {
            SearchNode current = open.poll();
            if (closed.contains(current.position)) continue;
            if (current.position.equals(goal)) {
                return reconstructPath(current);
            }
            closed.add(current.position);

            for (int[] move : MOVES) {
                Position next = current.position.offset(move[0], move[1]);
                if (!inBounds(next, width, height)) continue;
                if (blocked.contains(next) || closed.contains(next)) continue;

                int g = current.g + 1;
                Integer existing = bestG.get(next);
                if (existing != null && existing <= g) continue;

                bestG.put(next, g);
                open.add(new SearchNode(next, current, g, g + next.manhattanDistance(goal), ++sequence));
            }
        }
        return List.of();
    }

    public boolean isPathClear(Position start, Position goal, int width, int height, Set<Position> obstacles) {
        return !findPath(start, goal, width, height, obstacles).isEmpty();
    }

    private static boolean inBounds(Position pos, int width, int height) {
        return pos.x() >= 0 && pos.x() < width && pos.y() >= 0 && pos.y() < height;
    }

    private static List<Position> reconstructPath(SearchNode goalNode) {
        List<Position> path = new ArrayList<>();
        for (SearchNode node = goalNode; node != null; node = node.parent) {
            path.add(node.position);
        }
        Collections.reverse(path);
        return path;
    }

    private static final class SearchNode implements Comparable<SearchNode> {
        final Position position;
        final SearchNode parent;
        final int g;
        final int f;
        final long sequence;

        SearchNode(Position position, SearchNode parent, int g, int f, long sequence) {
            this.position = position;
            this.parent = parent;
            this.g = g;
            this.f = f;
            this.sequence = sequence;
        }

        @Override
        public int compareTo(SearchNode other) {
            int byF = Integer.compare(f, other.f);
            return byF != 0 ? byF : Long.compare(sequence, other.sequence);
        }
    }
}
