package org.tapath.automata.models;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapath.automata.base.Location;
import org.tapath.automata.base.Transition;
import org.tapath.core.Context;
import org.tapath.expressions.Constraint;
import org.tapath.expressions.Update;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 一个定时自动机模板：名称、声明上下文与位置-迁移图。
 * 守卫、不变量与赋值文本在 {@link Builder} 中用模板的 Context 解析。
 */
@Getter
public final class Template {

    private static final Logger logger = LoggerFactory.getLogger(Template.class);

    private final String name;
    private final Context context;
    private final TimedAutomatonGraph graph;

    private Template(String name, Context context, TimedAutomatonGraph graph) {
        this.name = Objects.requireNonNull(name, "Template name cannot be null.");
        this.context = Objects.requireNonNull(context, "Template context cannot be null.");
        this.graph = Objects.requireNonNull(graph, "Template graph cannot be null.");
    }

    public static Builder builder(String name, Context context) {
        return new Builder(name, context);
    }

    @Override
    public String toString() {
        return "Template(name='" + name + "', locations=" + graph.size()
                + ", transitions=" + graph.getTransitionsInFileOrder().size()
                + ", initial=" + graph.getInitialLocation() + ")";
    }

    public static final class Builder {

        private final String name;
        private final Context context;
        private final Map<String, Location> locations = new LinkedHashMap<>();
        private final List<Transition> transitions = new ArrayList<>();
        private String initialLocation;

        private Builder(String name, Context context) {
            this.name = Objects.requireNonNull(name, "Template name cannot be null.");
            this.context = Objects.requireNonNull(context, "Template context cannot be null.");
        }

        /**
         * 添加一个位置。第一个添加的位置在未显式指定时作为初始位置。
         * @param id        位置 ID。
         * @param name      位置名，可以为 null。
         * @param invariant 不变量文本，可以为 null。
         */
        public Builder location(String id, String name, String invariant) {
            return add(Location.of(id, name, Constraint.parseConjunction(invariant, context)));
        }

        public Builder location(String id, String name) {
            return location(id, name, null);
        }

        public Builder branchPoint(String id) {
            return add(Location.branchPoint(id));
        }

        private Builder add(Location location) {
            if (locations.putIfAbsent(location.getId(), location) != null) {
                throw new IllegalArgumentException("重复的位置 ID: " + location.getId());
            }
            if (initialLocation == null) {
                initialLocation = location.getId();
            }
            return this;
        }

        /**
         * 添加一条迁移，序号按添加顺序递增。
         * @param source     源位置 ID。
         * @param target     目标位置 ID。
         * @param guard      守卫文本，可以为 null。
         * @param assignment 赋值文本，可以为 null。
         */
        public Builder transition(String source, String target, String guard, String assignment) {
            transitions.add(new Transition(transitions.size(), source, target,
                    Constraint.parseConjunction(guard, context),
                    Update.parseList(assignment, context)));
            return this;
        }

        public Builder initial(String id) {
            this.initialLocation = id;
            return this;
        }

        public Template build() {
            if (initialLocation == null) {
                throw new IllegalStateException("模板 '" + name + "' 没有任何位置");
            }
            TimedAutomatonGraph graph = new TimedAutomatonGraph(locations, transitions, initialLocation);
            logger.debug("构建模板 {}: {} 个位置, {} 条迁移", name, locations.size(), transitions.size());
            return new Template(name, context, graph);
        }
    }
}
