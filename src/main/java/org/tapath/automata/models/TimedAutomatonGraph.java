package org.tapath.automata.models;

import lombok.Getter;
import org.tapath.automata.base.Location;
import org.tapath.automata.base.Transition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 一个模板的位置-迁移有向多重图。
 * 结点和边都存放在按插入顺序排列的表中，邻接结构只保存迁移的引用；平行迁移由 {@link Transition#getIndex()} 区分。
 * 此类是不可变的，由 {@link Template.Builder} 构造。
 */
public final class TimedAutomatonGraph {

    private final Map<String, Location> locations;
    @Getter
    private final Map<String, Location> namedLocations;
    @Getter
    private final List<Transition> transitionsInFileOrder;
    private final Map<String, List<Transition>> outgoing;
    private final Map<String, List<Transition>> incoming;
    @Getter
    private final String initialLocation;

    TimedAutomatonGraph(Map<String, Location> locations, List<Transition> transitions, String initialLocation) {
        this.locations = Collections.unmodifiableMap(new LinkedHashMap<>(locations));
        this.transitionsInFileOrder = List.copyOf(transitions);
        this.initialLocation = Objects.requireNonNull(initialLocation, "Initial location cannot be null.");
        if (!this.locations.containsKey(initialLocation)) {
            throw new IllegalArgumentException("初始位置 '" + initialLocation + "' 不在模板中");
        }

        Map<String, Location> named = new LinkedHashMap<>();
        Map<String, List<Transition>> out = new LinkedHashMap<>();
        Map<String, List<Transition>> in = new LinkedHashMap<>();
        for (Location location : this.locations.values()) {
            location.getName().ifPresent(name -> named.put(name, location));
            out.put(location.getId(), new ArrayList<>());
            in.put(location.getId(), new ArrayList<>());
        }
        for (Transition transition : this.transitionsInFileOrder) {
            if (!out.containsKey(transition.getSource()) || !in.containsKey(transition.getTarget())) {
                throw new IllegalArgumentException("迁移 " + transition + " 引用了不存在的位置");
            }
            out.get(transition.getSource()).add(transition);
            in.get(transition.getTarget()).add(transition);
        }
        this.namedLocations = Collections.unmodifiableMap(named);
        this.outgoing = freeze(out);
        this.incoming = freeze(in);
    }

    private static Map<String, List<Transition>> freeze(Map<String, List<Transition>> adjacency) {
        Map<String, List<Transition>> frozen = new LinkedHashMap<>();
        adjacency.forEach((id, list) -> frozen.put(id, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * @return 按插入顺序排列的全部结点（包括分支点）。
     */
    public List<Location> getLocations() {
        return List.copyOf(locations.values());
    }

    public List<String> getLocationIds() {
        return List.copyOf(locations.keySet());
    }

    public boolean containsLocation(String id) {
        return locations.containsKey(id);
    }

    /**
     * @param id 位置 ID。
     * @return 对应的位置。
     * @throws IllegalArgumentException 如果不存在该位置。
     */
    public Location getLocation(String id) {
        Location location = locations.get(id);
        if (location == null) {
            throw new IllegalArgumentException("不存在位置 '" + id + "'");
        }
        return location;
    }

    public Location getLocationByName(String name) {
        Location location = namedLocations.get(name);
        if (location == null) {
            throw new IllegalArgumentException("不存在名为 '" + name + "' 的位置");
        }
        return location;
    }

    /**
     * @param index 迁移在模板中的序号（从 0 开始）。
     */
    public Transition getTransition(int index) {
        if (index < 0 || index >= transitionsInFileOrder.size()) {
            throw new IllegalArgumentException("迁移序号越界: " + index);
        }
        return transitionsInFileOrder.get(index);
    }

    public List<Transition> getOutgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<Transition> getIncoming(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    /**
     * @return 从 source 到 target 的全部平行迁移，按声明顺序。
     */
    public List<Transition> transitionsBetween(String source, String target) {
        return getOutgoing(source).stream()
                .filter(t -> t.getTarget().equals(target))
                .collect(Collectors.toList());
    }

    /**
     * @return 直接后继的 ID，去重并保持顺序。
     */
    public Set<String> successors(String id) {
        Set<String> result = new LinkedHashSet<>();
        for (Transition transition : getOutgoing(id)) {
            result.add(transition.getTarget());
        }
        return result;
    }

    /**
     * @return 直接前驱的 ID（即反向图中的后继），去重并保持顺序。
     */
    public Set<String> predecessors(String id) {
        Set<String> result = new LinkedHashSet<>();
        for (Transition transition : getIncoming(id)) {
            result.add(transition.getSource());
        }
        return result;
    }

    public int size() {
        return locations.size();
    }
}
