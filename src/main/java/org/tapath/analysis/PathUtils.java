package org.tapath.analysis;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapath.automata.base.Location;
import org.tapath.automata.base.Transition;
import org.tapath.automata.models.Template;
import org.tapath.automata.models.TimedAutomatonGraph;
import org.tapath.automata.path.Path;

import java.util.ArrayList;
import java.util.List;

/**
 * 构造与拼接路径的工具方法。
 */
public final class PathUtils {

    private static final Logger logger = LoggerFactory.getLogger(PathUtils.class);

    private PathUtils() {
    }

    /**
     * 由交替序列构造路径：偶数位置为位置名（没有名字的结点用 ID），奇数位置为迁移在模板中的序号。
     * 不检查相邻关系，需要时调用 {@link Path#exists()}。
     * @throws IllegalArgumentException 如果序列长度为偶数、元素类型不对，或名字/序号不存在。
     */
    public static Path convertToPath(Template template, Object... alternating) {
        if (alternating.length % 2 == 0) {
            logger.error("PathUtils-convertToPath: 交替序列长度必须为奇数: {}", alternating.length);
            throw new IllegalArgumentException("交替序列长度必须为奇数: " + alternating.length);
        }
        TimedAutomatonGraph graph = template.getGraph();
        List<Location> locations = new ArrayList<>();
        List<Transition> transitions = new ArrayList<>();
        for (int i = 0; i < alternating.length; i++) {
            Object element = alternating[i];
            if (i % 2 == 0) {
                if (!(element instanceof String name)) {
                    throw new IllegalArgumentException("第 " + i + " 个元素应为位置名: " + element);
                }
                locations.add(resolveLocation(graph, name));
            } else {
                if (!(element instanceof Integer index)) {
                    throw new IllegalArgumentException("第 " + i + " 个元素应为迁移序号: " + element);
                }
                transitions.add(graph.getTransition(index));
            }
        }
        return Path.of(locations, transitions);
    }

    /**
     * 解析以空白分隔的紧凑形式，例如 {@code "l0 0 l1 2 l2"}。
     */
    public static Path parseCompactPath(Template template, String compact) {
        if (StringUtils.isBlank(compact)) {
            throw new IllegalArgumentException("路径文本不能为空");
        }
        String[] tokens = StringUtils.split(compact.strip());
        Object[] alternating = new Object[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            if (i % 2 == 0) {
                alternating[i] = tokens[i];
            } else {
                try {
                    alternating[i] = Integer.parseInt(tokens[i]);
                } catch (NumberFormatException e) {
                    logger.error("PathUtils-parseCompactPath: '{}' 不是迁移序号", tokens[i]);
                    throw new IllegalArgumentException("不是迁移序号: " + tokens[i], e);
                }
            }
        }
        return convertToPath(template, alternating);
    }

    /**
     * 对 first 的末位置到 second 的首位置之间的每一条平行迁移 t，生成 first + [t] + second。
     * @return 拼接结果，没有这样的迁移时为空列表。
     */
    public static List<Path> concatenate(Template template, Path first, Path second) {
        List<Path> result = new ArrayList<>();
        for (Transition transition : template.getGraph().transitionsBetween(first.last().getId(), second.first().getId())) {
            result.add(first.join(transition, second));
        }
        logger.debug("拼接 {} 与 {} 得到 {} 条路径", first, second, result.size());
        return result;
    }

    private static Location resolveLocation(TimedAutomatonGraph graph, String name) {
        if (graph.getNamedLocations().containsKey(name)) {
            return graph.getLocationByName(name);
        }
        if (graph.containsLocation(name)) {
            return graph.getLocation(name);
        }
        logger.error("PathUtils-convertToPath: 不存在位置 '{}'", name);
        throw new IllegalArgumentException("不存在位置 '" + name + "'");
    }
}
