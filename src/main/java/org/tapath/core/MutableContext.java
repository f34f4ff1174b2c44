package org.tapath.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Context 的可变版本，用于沿路径模拟变量的更新。
 * 只能由 {@link Context#toMutable()} 创建，与原 Context 不共享任何集合。
 * @author Ayalyt
 */
public final class MutableContext extends Context {

    private static final Logger logger = LoggerFactory.getLogger(MutableContext.class);

    MutableContext(Set<String> clocks, Map<String, Integer> constants, Map<String, Integer> initialState) {
        super(clocks, constants, initialState);
    }

    /**
     * 设置一个变量的当前值。
     * @param identifier 变量名。
     * @param value      新值。
     * @throws IllegalArgumentException     如果标识符是常量或时钟。
     * @throws UndefinedIdentifierException 如果标识符未声明。
     */
    public void setVal(String identifier, int value) {
        if (!isVariable(identifier)) {
            if (isConstant(identifier) || isClock(identifier)) {
                logger.error("MutableContext-setVal: '{}' 不是可赋值的变量", identifier);
                throw new IllegalArgumentException("'" + identifier + "' 不是可赋值的变量");
            }
            logger.error("MutableContext-setVal: 未定义的标识符 '{}'", identifier);
            throw new UndefinedIdentifierException(identifier);
        }
        logger.debug("更新变量 {}: {} -> {}", identifier, initialState.get(identifier), value);
        initialState.put(identifier, value);
    }
}
