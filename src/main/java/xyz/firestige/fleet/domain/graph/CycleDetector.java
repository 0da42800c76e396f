package xyz.firestige.fleet.domain.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 依赖环检测（三色 DFS）
 * <p>
 * 节点与邻接表按名称顺序遍历，同一输入总是报告同一个环；指向未知节点的边被忽略
 */
public final class CycleDetector {

    private enum Color { WHITE, GRAY, BLACK }

    private CycleDetector() {
    }

    /**
     * 查找第一个依赖环
     *
     * @param edges 服务名 -> 依赖的服务名
     * @return 环路径，首尾为同一服务；无环时为空
     */
    public static Optional<List<String>> findCycle(Map<String, ? extends Set<String>> edges) {
        SortedMap<String, ? extends Set<String>> graph = new TreeMap<>(edges);
        Map<String, Color> colors = new HashMap<>();
        graph.keySet().forEach(n -> colors.put(n, Color.WHITE));

        for (String start : graph.keySet()) {
            if (colors.get(start) != Color.WHITE) {
                continue;
            }
            Optional<List<String>> cycle = visit(start, graph, colors, new ArrayDeque<>());
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        return Optional.empty();
    }

    private static Optional<List<String>> visit(String node, SortedMap<String, ? extends Set<String>> graph,
                                                Map<String, Color> colors, Deque<String> stack) {
        colors.put(node, Color.GRAY);
        stack.addLast(node);

        Set<String> deps = graph.containsKey(node) ? graph.get(node) : Set.of();
        for (String dep : new TreeSet<>(deps)) {
            Color color = colors.get(dep);
            if (color == null) {
                continue;
            }
            if (color == Color.GRAY) {
                List<String> path = new ArrayList<>();
                boolean inCycle = false;
                for (String s : stack) {
                    if (s.equals(dep)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        path.add(s);
                    }
                }
                path.add(dep);
                return Optional.of(path);
            }
            if (color == Color.WHITE) {
                Optional<List<String>> cycle = visit(dep, graph, colors, stack);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }

        stack.removeLast();
        colors.put(node, Color.BLACK);
        return Optional.empty();
    }
}
