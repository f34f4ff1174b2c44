package org.tapath.expressions;

/**
 * 时钟约束中阈值所在的一侧。
 */
public enum ThresholdSide {
    LEFT,
    RIGHT
}
