package org.tapath.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapath.automata.base.Location;
import org.tapath.automata.base.Transition;
import org.tapath.automata.models.Template;
import org.tapath.automata.models.TimedAutomatonGraph;
import org.tapath.automata.path.Path;
import org.tapath.automata.path.PathSignature;
import org.tapath.core.AnalysisConfig;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 自底向上构造有界长度的半可实现路径表。
 * <ol>
 *     <li>长度 0：DP[i][i][0] = [i]</li>
 *     <li>长度 1：每条迁移构成的路径，在时钟初值自由的条件下可实现则加入</li>
 *     <li>长度 l &gt;= 2：对每个分割点 p，把 DP[i][j][p] 与 DP[j][k][l-p] 中的路径两两拼接，
 *     去重后重新检查</li>
 * </ol>
 * 子路径可能从运行中途开始，变量的取值未知，所以检查时跳过阈值为变量的时钟约束
 * （validateState），路径表只是可达性的必要条件。
 * 长度之间有先后依赖；同一长度内每个单元格 (i, k) 只读更短的长度，因此按单元格划分给线程，
 * 每个单元格只有一个写者。单元格内部按 p、j 的顺序枚举，结果与串行构造完全相同。
 * @author Ayalyt
 */
public final class SemiRealizablePathFinder {

    private static final Logger logger = LoggerFactory.getLogger(SemiRealizablePathFinder.class);

    private final PathRealizabilityChecker checker;
    private final RealizabilityOptions options;

    public SemiRealizablePathFinder(PathRealizabilityChecker checker) {
        this.checker = Objects.requireNonNull(checker, "PathRealizabilityChecker cannot be null.");
        this.options = RealizabilityOptions.semiRealizable().withValidateState(true);
    }

    public SemiRealizablePathFinder() {
        this(new PathRealizabilityChecker());
    }

    /**
     * 串行构造路径表。
     */
    public SemiRealizablePathTable build(Template template, int maxLength) {
        return build(template, maxLength, 1);
    }

    /**
     * 使用配置中的线程数构造路径表。
     */
    public SemiRealizablePathTable build(Template template, int maxLength, AnalysisConfig config) {
        return build(template, maxLength, config.getDpThreads());
    }

    /**
     * @param template  模板。
     * @param maxLength 最大路径长度（迁移条数），非负。
     * @param threads   同一长度内并行处理单元格的线程数，1 表示串行。
     * @return 填充好的路径表。
     */
    public SemiRealizablePathTable build(Template template, int maxLength, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("线程数必须为正数: " + threads);
        }
        TimedAutomatonGraph graph = template.getGraph();
        SemiRealizablePathTable table = new SemiRealizablePathTable(graph.getLocationIds(), maxLength);
        logger.info("开始构造模板 {} 的半可实现路径表: maxLength={}, threads={}", template.getName(), maxLength, threads);

        for (Location location : graph.getLocations()) {
            table.add(location.getId(), location.getId(), 0, Path.of(location));
        }
        if (maxLength >= 1) {
            for (Transition transition : graph.getTransitionsInFileOrder()) {
                Path path = Path.of(List.of(graph.getLocation(transition.getSource()), graph.getLocation(transition.getTarget())),
                        List.of(transition));
                if (accept(template, table, path)) {
                    table.add(transition.getSource(), transition.getTarget(), 1, path);
                }
            }
        }

        if (threads == 1) {
            for (int length = 2; length <= maxLength; length++) {
                for (String i : table.getLocationIds()) {
                    for (String k : table.getLocationIds()) {
                        fillCell(template, table, i, k, length);
                    }
                }
                logger.debug("长度 {} 完成", length);
            }
        } else {
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                for (int length = 2; length <= maxLength; length++) {
                    final int l = length;
                    List<Future<?>> futures = new ArrayList<>();
                    for (String i : table.getLocationIds()) {
                        for (String k : table.getLocationIds()) {
                            futures.add(executor.submit(() -> fillCell(template, table, i, k, l)));
                        }
                    }
                    for (Future<?> future : futures) {
                        await(future);
                    }
                    logger.debug("长度 {} 完成", length);
                }
            } finally {
                executor.shutdownNow();
            }
        }

        logger.info("路径表构造完成: {}，{} 条路径无法判定", table, table.getUndecidedPaths().size());
        return table;
    }

    private void fillCell(Template template, SemiRealizablePathTable table, String i, String k, int length) {
        Set<PathSignature> tried = new HashSet<>();
        for (int p = 1; p < length; p++) {
            for (String j : table.getLocationIds()) {
                for (Path first : table.get(i, j, p)) {
                    for (Path second : table.get(j, k, length - p)) {
                        Path candidate = first.concat(second);
                        if (!tried.add(candidate.getSignature()) || table.contains(i, k, length, candidate)) {
                            continue;
                        }
                        if (accept(template, table, candidate)) {
                            table.add(i, k, length, candidate);
                        }
                    }
                }
            }
        }
    }

    private boolean accept(Template template, SemiRealizablePathTable table, Path path) {
        RealizabilityResult result = checker.check(template, path, options);
        if (result.isUnknown()) {
            logger.warn("路径 {} 的可实现性无法判定 ({})，不加入路径表", path, result.getReason());
            table.recordUndecided(path);
            return false;
        }
        return result.isRealizable();
    }

    private static void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("构造路径表时被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("构造路径表失败", cause);
        }
    }
}
