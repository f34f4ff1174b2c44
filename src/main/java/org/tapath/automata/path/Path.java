package org.tapath.automata.path;

import lombok.Getter;
import org.tapath.automata.base.Location;
import org.tapath.automata.base.Transition;
import org.tapath.expressions.Constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 位置与迁移交替出现的序列 [l0, t0, l1, t1, ..., ln]。
 * 位置数总比迁移数多一，{@link #length()} 为迁移数（即段数）。
 * 相等性按 (位置 ID 序列, 迁移序号序列) 判定。此类是不可变的。
 */
public final class Path {

    @Getter
    private final List<Location> locations;
    @Getter
    private final List<Transition> transitions;
    @Getter
    private final PathSignature signature;

    private Path(List<Location> locations, List<Transition> transitions) {
        if (locations.size() != transitions.size() + 1) {
            throw new IllegalArgumentException("路径中位置数必须比迁移数多一: "
                    + locations.size() + " 个位置, " + transitions.size() + " 条迁移");
        }
        this.locations = List.copyOf(locations);
        this.transitions = List.copyOf(transitions);
        this.signature = PathSignature.of(this.locations, this.transitions);
    }

    public static Path of(Location location) {
        return new Path(List.of(Objects.requireNonNull(location, "Location cannot be null.")), List.of());
    }

    public static Path of(List<Location> locations, List<Transition> transitions) {
        return new Path(locations, transitions);
    }

    /**
     * @return 段数，即迁移的条数。
     */
    public int length() {
        return transitions.size();
    }

    /**
     * @return 交替序列的元素个数，总是奇数 2n+1。
     */
    public int size() {
        return locations.size() + transitions.size();
    }

    /**
     * 交替视图：偶数下标为位置，奇数下标为迁移。
     */
    public Object elementAt(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("路径下标越界: " + index);
        }
        return index % 2 == 0 ? locations.get(index / 2) : transitions.get(index / 2);
    }

    public Location first() {
        return locations.get(0);
    }

    public Location last() {
        return locations.get(locations.size() - 1);
    }

    /**
     * 检查每条迁移是否确实从前一个位置到后一个位置。不查询模板的图。
     * @return 相邻关系全部匹配时返回 true。
     */
    public boolean exists() {
        for (int i = 0; i < transitions.size(); i++) {
            Transition transition = transitions.get(i);
            if (!locations.get(i).getId().equals(transition.getSource())
                    || !locations.get(i + 1).getId().equals(transition.getTarget())) {
                return false;
            }
        }
        return true;
    }

    /**
     * 拼接 this = i...j 与 other = j...k，得到 i...j...k，交界处的 j 只保留一份。
     * @throws IllegalArgumentException 如果 this 的末位置与 other 的首位置不同。
     */
    public Path concat(Path other) {
        if (!last().equals(other.first())) {
            throw new IllegalArgumentException("无法拼接路径: " + last() + " != " + other.first());
        }
        List<Location> newLocations = new ArrayList<>(locations.subList(0, locations.size() - 1));
        newLocations.addAll(other.locations);
        List<Transition> newTransitions = new ArrayList<>(transitions);
        newTransitions.addAll(other.transitions);
        return new Path(newLocations, newTransitions);
    }

    /**
     * 通过一条迁移连接两条路径：this + [transition] + other。
     */
    public Path join(Transition transition, Path other) {
        List<Location> newLocations = new ArrayList<>(locations);
        newLocations.addAll(other.locations);
        List<Transition> newTransitions = new ArrayList<>(transitions);
        newTransitions.add(Objects.requireNonNull(transition, "Transition cannot be null."));
        newTransitions.addAll(other.transitions);
        return new Path(newLocations, newTransitions);
    }

    /**
     * @return 子路径 [l_from, ..., l_to]（按位置下标，含两端）。
     */
    public Path subPath(int fromLocation, int toLocation) {
        return new Path(locations.subList(fromLocation, toLocation + 1), transitions.subList(fromLocation, toLocation));
    }

    /**
     * @return 路径上所有不变量与守卫中的约束，按出现顺序。
     */
    public List<Constraint> getConstraints() {
        List<Constraint> result = new ArrayList<>();
        for (int i = 0; i < locations.size(); i++) {
            result.addAll(locations.get(i).getInvariant());
            if (i < transitions.size()) {
                result.addAll(transitions.get(i).getGuard());
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return signature.equals(((Path) o).signature);
    }

    @Override
    public int hashCode() {
        return signature.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(locations.get(0).toString());
        for (int i = 0; i < transitions.size(); i++) {
            sb.append(" -#").append(transitions.get(i).getIndex()).append("-> ").append(locations.get(i + 1));
        }
        return sb.toString();
    }
}
