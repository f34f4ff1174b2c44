package org.tapath.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 一个模板的声明上下文：时钟、常量以及变量的初始值。
 * Context 是不可变的；沿路径模拟变量更新时请通过 {@link #toMutable()} 得到独立的副本。
 * 三类标识符两两不相交，构造时检查。
 * @author Ayalyt
 */
public class Context {

    private static final Logger logger = LoggerFactory.getLogger(Context.class);

    private static final Pattern CLOCK_DECL = Pattern.compile("^clock\\s.*");
    private static final Pattern CONST_DECL = Pattern.compile("^const\\s+int\\s.*");
    private static final Pattern INT_DECL = Pattern.compile("^int\\s.*");

    private final SortedSet<String> clocks;
    private final Map<String, Integer> constants;
    protected final Map<String, Integer> initialState;

    /**
     * 构造一个 Context，传入的集合会被拷贝。
     * @param clocks       时钟名集合。
     * @param constants    常量名到值的映射。
     * @param initialState 变量名到初始值的映射。
     * @throws IllegalArgumentException 如果同一个标识符出现在两类声明中。
     */
    public Context(Set<String> clocks, Map<String, Integer> constants, Map<String, Integer> initialState) {
        this.clocks = new TreeSet<>(Objects.requireNonNull(clocks, "Context-构造函数: clocks 不能为 null"));
        this.constants = new LinkedHashMap<>(Objects.requireNonNull(constants, "Context-构造函数: constants 不能为 null"));
        this.initialState = new LinkedHashMap<>(Objects.requireNonNull(initialState, "Context-构造函数: initialState 不能为 null"));
        checkDisjoint();
        logger.debug("创建 Context: clocks={}, constants={}, variables={}", this.clocks, this.constants, this.initialState);
    }

    public static Context empty() {
        return new Context(Collections.emptySet(), Collections.emptyMap(), Collections.emptyMap());
    }

    /**
     * 从声明文本构造 Context。
     * 只识别以 {@code clock}、{@code const int}、{@code int} 开头的行，其余行被忽略。
     * 没有初始化式的整数默认为 0。
     * @param declaration 声明文本，可以为 null。
     * @return 新的 Context。
     * @throws IllegalArgumentException 如果某个被识别的声明行无法解析。
     */
    public static Context parse(String declaration) {
        Set<String> clocks = new TreeSet<>();
        Map<String, Integer> constants = new LinkedHashMap<>();
        Map<String, Integer> variables = new LinkedHashMap<>();
        if (declaration == null) {
            return new Context(clocks, constants, variables);
        }

        for (String rawLine : declaration.split("\n")) {
            String line = rawLine.strip();
            if (CLOCK_DECL.matcher(line).matches()) {
                for (String clock : declarationBody(line, "clock".length()).split(",")) {
                    clocks.add(clock.strip());
                }
            } else if (CONST_DECL.matcher(line).matches()) {
                int offset = line.indexOf("int") + "int".length();
                parseInitializers(line, offset, constants, constants);
            } else if (INT_DECL.matcher(line).matches()) {
                parseInitializers(line, "int".length(), variables, constants);
            }
        }
        logger.debug("解析声明得到 {} 个时钟, {} 个常量, {} 个变量", clocks.size(), constants.size(), variables.size());
        return new Context(clocks, constants, variables);
    }

    private static String declarationBody(String line, int offset) {
        int end = line.indexOf(';');
        if (end < 0) {
            logger.error("Context-parse: 声明行缺少 ';': {}", line);
            throw new IllegalArgumentException("声明行缺少 ';': " + line);
        }
        return line.substring(offset, end);
    }

    private static void parseInitializers(String line, int offset, Map<String, Integer> target, Map<String, Integer> knownConstants) {
        for (String init : declarationBody(line, offset).split(",")) {
            String[] decl = init.split("=");
            String identifier = decl[0].strip();
            if (identifier.contains("[")) {
                logger.warn("Context-parse: 不支持数组声明 '{}'，已忽略", identifier);
                continue;
            }
            int value = 0;
            if (decl.length == 2) {
                String initializer = decl[1].strip();
                if (isLiteral(initializer)) {
                    value = Integer.parseInt(initializer);
                } else if (knownConstants.containsKey(initializer)) {
                    value = knownConstants.get(initializer);
                } else {
                    logger.error("Context-parse: 无法解析初始化式 '{}'", init);
                    throw new IllegalArgumentException("无法解析初始化式: " + init.strip());
                }
            }
            target.put(identifier, value);
        }
    }

    private void checkDisjoint() {
        for (String constant : constants.keySet()) {
            if (clocks.contains(constant) || initialState.containsKey(constant)) {
                logger.error("Context: 标识符 '{}' 被重复声明", constant);
                throw new IllegalArgumentException("标识符 '" + constant + "' 被声明为多种类别");
            }
        }
        for (String variable : initialState.keySet()) {
            if (clocks.contains(variable)) {
                logger.error("Context: 标识符 '{}' 同时是时钟和变量", variable);
                throw new IllegalArgumentException("标识符 '" + variable + "' 被声明为多种类别");
            }
        }
    }

    public boolean isDefined(String identifier) {
        return isClock(identifier) || isConstant(identifier) || isVariable(identifier);
    }

    public boolean isClock(String identifier) {
        return clocks.contains(identifier);
    }

    public boolean isConstant(String identifier) {
        return constants.containsKey(identifier);
    }

    public boolean isVariable(String identifier) {
        return initialState.containsKey(identifier);
    }

    /**
     * @param string 任意字符串。
     * @return 如果它是一个十进制整数字面量则返回 true。
     */
    public static boolean isLiteral(String string) {
        if (string == null) {
            return false;
        }
        try {
            Integer.parseInt(string.strip());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * 获取字面量、常量或变量的值。
     * @param identifier 标识符或整数字面量。
     * @return 对应的整数值。
     * @throws ClockValueException          如果标识符是时钟。
     * @throws UndefinedIdentifierException 如果标识符未声明。
     */
    public int getVal(String identifier) {
        if (isLiteral(identifier)) {
            return Integer.parseInt(identifier.strip());
        }
        if (isConstant(identifier)) {
            return constants.get(identifier);
        }
        if (isVariable(identifier)) {
            return initialState.get(identifier);
        }
        if (isClock(identifier)) {
            logger.error("Context-getVal: 试图读取时钟 '{}' 的值", identifier);
            throw new ClockValueException(identifier);
        }
        logger.error("Context-getVal: 未定义的标识符 '{}'", identifier);
        throw new UndefinedIdentifierException(identifier);
    }

    /**
     * 创建一个可变副本，对它的修改不会影响本对象。
     * @return 新的 MutableContext。
     */
    public MutableContext toMutable() {
        return new MutableContext(clocks, constants, initialState);
    }

    public SortedSet<String> getClocks() {
        return Collections.unmodifiableSortedSet(clocks);
    }

    public Map<String, Integer> getConstants() {
        return Collections.unmodifiableMap(constants);
    }

    public Map<String, Integer> getInitialState() {
        return Collections.unmodifiableMap(initialState);
    }

    @Override
    public String toString() {
        return "Context{clocks=" + clocks + ", constants=" + constants + ", variables=" + initialState + "}";
    }
}
