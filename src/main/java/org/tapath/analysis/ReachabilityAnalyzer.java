package org.tapath.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapath.automata.models.Template;
import org.tapath.automata.models.TimedAutomatonGraph;
import org.tapath.automata.path.Path;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

/**
 * 基于半可实现路径表的可达性查询。
 * 路径表只是必要条件过滤：一个位置被标记为可达，当且仅当表中某条从初始位置到它的路径
 * 在时钟初值全为 0 的条件下通过检查（同时检查相邻关系，并跳过阈值为变量的时钟约束）。
 * @author Ayalyt
 */
public final class ReachabilityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ReachabilityAnalyzer.class);

    private final PathRealizabilityChecker checker;
    private final RealizabilityOptions options;

    public ReachabilityAnalyzer(PathRealizabilityChecker checker) {
        this.checker = Objects.requireNonNull(checker, "PathRealizabilityChecker cannot be null.");
        this.options = RealizabilityOptions.defaults().withValidatePath(true).withValidateState(true);
    }

    public ReachabilityAnalyzer() {
        this(new PathRealizabilityChecker());
    }

    /**
     * 从初始位置出发广度优先遍历，只展开被标记为可达的位置。
     * @return 被标记为可达的位置 ID，按发现顺序。
     */
    public Set<String> findReachableLocations(Template template, SemiRealizablePathTable table) {
        TimedAutomatonGraph graph = template.getGraph();
        String initial = graph.getInitialLocation();
        Set<String> reachable = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new LinkedList<>();
        queue.add(initial);
        visited.add(initial);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!isTagged(template, table, initial, current)) {
                logger.debug("位置 {} 没有可实现的路径，不再展开", current);
                continue;
            }
            reachable.add(current);
            for (String successor : graph.successors(current)) {
                if (visited.add(successor)) {
                    queue.add(successor);
                }
            }
        }
        logger.info("模板 {} 中可达的位置: {}", template.getName(), reachable);
        return reachable;
    }

    /**
     * 从目标集合出发在反向图上逐层广度优先遍历，返回第一个包含可达位置的层中的全部可达位置，
     * 即离目标最近的可达祖先。找不到时返回空集合。
     */
    public Set<String> furthestReachable(Template template, Collection<String> targets, SemiRealizablePathTable table) {
        return furthestReachable(template, targets, findReachableLocations(template, table));
    }

    /**
     * @param reachable 已计算好的可达位置集合。
     */
    public Set<String> furthestReachable(Template template, Collection<String> targets, Set<String> reachable) {
        TimedAutomatonGraph graph = template.getGraph();
        Set<String> visited = new HashSet<>();
        Set<String> layer = new LinkedHashSet<>();
        for (String target : targets) {
            if (!graph.containsLocation(target)) {
                logger.error("目标位置 '{}' 不在模板 {} 中", target, template.getName());
                throw new IllegalArgumentException("不存在位置 '" + target + "'");
            }
            if (visited.add(target)) {
                layer.add(target);
            }
        }

        while (!layer.isEmpty()) {
            Set<String> found = new LinkedHashSet<>();
            for (String location : layer) {
                if (reachable.contains(location)) {
                    found.add(location);
                }
            }
            if (!found.isEmpty()) {
                logger.debug("目标 {} 最近的可达祖先: {}", targets, found);
                return found;
            }
            Set<String> next = new LinkedHashSet<>();
            for (String location : layer) {
                for (String predecessor : graph.predecessors(location)) {
                    if (visited.add(predecessor)) {
                        next.add(predecessor);
                    }
                }
            }
            layer = next;
        }
        logger.debug("目标 {} 没有可达的祖先", targets);
        return Set.of();
    }

    private boolean isTagged(Template template, SemiRealizablePathTable table, String initial, String location) {
        for (Path path : table.paths(initial, location)) {
            RealizabilityResult result = checker.check(template, path, options);
            if (result.isRealizable()) {
                logger.debug("位置 {} 经由路径 {} 可达", location, path);
                return true;
            }
        }
        return false;
    }
}
