package org.tapath.core;

import lombok.Getter;

/**
 * 试图静态读取时钟的值时抛出。时钟只在线性规划中以延迟变量之和的形式出现，没有单一的静态值。
 * @author Ayalyt
 */
@Getter
public class ClockValueException extends IllegalStateException {

    private final String clock;

    public ClockValueException(String clock) {
        super("时钟 '" + clock + "' 没有静态值");
        this.clock = clock;
    }
}
