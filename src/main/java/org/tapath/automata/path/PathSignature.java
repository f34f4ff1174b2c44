package org.tapath.automata.path;

import org.tapath.automata.base.Location;
import org.tapath.automata.base.Transition;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 路径的规范键：位置 ID 序列与迁移序号序列。用于路径去重。
 */
public final class PathSignature {

    private final List<String> locationIds;
    private final List<Integer> transitionIndices;
    private final int hashCode;

    private PathSignature(List<String> locationIds, List<Integer> transitionIndices) {
        this.locationIds = List.copyOf(locationIds);
        this.transitionIndices = List.copyOf(transitionIndices);
        this.hashCode = Objects.hash(this.locationIds, this.transitionIndices);
    }

    static PathSignature of(List<Location> locations, List<Transition> transitions) {
        return new PathSignature(
                locations.stream().map(Location::getId).collect(Collectors.toList()),
                transitions.stream().map(Transition::getIndex).collect(Collectors.toList()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PathSignature that = (PathSignature) o;
        return locationIds.equals(that.locationIds) && transitionIndices.equals(that.transitionIndices);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return locationIds + "/" + transitionIndices;
    }
}
