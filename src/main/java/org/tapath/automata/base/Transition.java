package org.tapath.automata.base;

import lombok.Getter;
import org.tapath.expressions.ClockReset;
import org.tapath.expressions.Constraint;
import org.tapath.expressions.Update;
import org.tapath.expressions.VariableUpdate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 模板中的一条迁移。index 是它在模板中的声明顺序，也是同一对位置之间平行迁移的区分键。
 */
@Getter
public final class Transition {

    private final int index;
    private final String source;
    private final String target;
    private final List<Constraint> guard;
    private final List<Update> updates;

    private final int hashCode;

    /**
     * @param index   迁移在模板中的序号。
     * @param source  源位置 ID
     * @param target  目标位置 ID
     * @param guard   守卫中的简单约束
     * @param updates 赋值标签中的更新，按执行顺序
     */
    public Transition(int index, String source, String target, List<Constraint> guard, List<Update> updates) {
        this.index = index;
        this.source = Objects.requireNonNull(source, "Source location cannot be null.");
        this.target = Objects.requireNonNull(target, "Target location cannot be null.");
        this.guard = List.copyOf(Objects.requireNonNull(guard, "Guard cannot be null."));
        this.updates = List.copyOf(Objects.requireNonNull(updates, "Updates cannot be null."));
        this.hashCode = Objects.hash(index, source, target);
    }

    /**
     * @return 被重置的时钟，去重并保持出现顺序。
     */
    public List<String> getResets() {
        List<String> resets = new ArrayList<>();
        for (Update update : updates) {
            if (update instanceof ClockReset reset && !resets.contains(reset.getClock())) {
                resets.add(reset.getClock());
            }
        }
        return resets;
    }

    /**
     * @return 除时钟重置以外的更新。
     */
    public List<VariableUpdate> getOtherUpdates() {
        List<VariableUpdate> others = new ArrayList<>();
        for (Update update : updates) {
            if (update instanceof VariableUpdate variableUpdate) {
                others.add(variableUpdate);
            }
        }
        return others;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return index == that.index &&
                source.equals(that.source) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("%s --[#%d, %s, %s]--> %s",
                source,
                index,
                Constraint.join(guard),
                Update.join(updates),
                target);
    }
}
