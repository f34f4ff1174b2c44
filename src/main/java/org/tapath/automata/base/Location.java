package org.tapath.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapath.expressions.Constraint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 代表定时自动机模板中的一个结点：普通位置或分支点。
 * Location 是不可变对象，相等性只由 ID 决定。
 */
public final class Location implements Comparable<Location> {

    private static final Logger logger = LoggerFactory.getLogger(Location.class);

    @Getter
    private final String id;
    private final String name;
    @Getter
    private final List<Constraint> invariant;
    @Getter
    private final boolean branchPoint;

    /**
     * @param id          位置的唯一 ID，例如 "id0"。
     * @param name        位置名，可以为 null。
     * @param invariant   不变量中的简单约束列表。
     * @param branchPoint 是否为分支点。
     */
    private Location(String id, String name, List<Constraint> invariant, boolean branchPoint) {
        this.id = Objects.requireNonNull(id, "Location id cannot be null");
        this.name = name;
        this.invariant = List.copyOf(Objects.requireNonNull(invariant, "Location invariant cannot be null"));
        this.branchPoint = branchPoint;
        logger.debug("创建了一个Location: {} with id {}", name, id);
    }

    public static Location of(String id, String name, List<Constraint> invariant) {
        return new Location(id, name, invariant, false);
    }

    public static Location of(String id, String name) {
        return new Location(id, name, List.of(), false);
    }

    public static Location branchPoint(String id) {
        return new Location(id, null, List.of(), true);
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Location location = (Location) o;
        return id.equals(location.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return name != null ? name : id;
    }

    @Override
    public int compareTo(Location other) {
        return this.id.compareTo(other.id);
    }
}
