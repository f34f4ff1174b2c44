package org.tapath.symbolic;

/**
 * 线性可行性判定器。实现必须是无状态的，每次调用独立完成，可被多个线程同时调用。
 */
public interface FeasibilityOracle {

    /**
     * @param program 所有变量非负的可行性问题。
     * @return 可行性结果；可行时附带一个见证解。
     */
    FeasibilityResult check(LinearProgram program);
}
