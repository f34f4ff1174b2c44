package org.tapath.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 分析相关的配置项。
 * 依次读取默认值、类路径上的 {@code tapath.properties}、同名系统属性，后者覆盖前者。
 * <ul>
 *     <li>{@code tapath.solver.timeoutMs}：单次可行性检查的超时（毫秒），超时视为 UNKNOWN</li>
 *     <li>{@code tapath.dp.threads}：构造路径表时同一长度内的并行线程数，1 表示串行</li>
 * </ul>
 */
@Getter
public final class AnalysisConfig {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisConfig.class);

    public static final String RESOURCE = "tapath.properties";
    public static final String SOLVER_TIMEOUT_KEY = "tapath.solver.timeoutMs";
    public static final String DP_THREADS_KEY = "tapath.dp.threads";

    private static final int DEFAULT_TIMEOUT_MS = 10_000;
    private static final int DEFAULT_DP_THREADS = 1;

    private final int solverTimeoutMs;
    private final int dpThreads;

    public AnalysisConfig(int solverTimeoutMs, int dpThreads) {
        if (solverTimeoutMs <= 0) {
            throw new IllegalArgumentException("求解超时必须为正数: " + solverTimeoutMs);
        }
        if (dpThreads <= 0) {
            throw new IllegalArgumentException("线程数必须为正数: " + dpThreads);
        }
        this.solverTimeoutMs = solverTimeoutMs;
        this.dpThreads = dpThreads;
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(DEFAULT_TIMEOUT_MS, DEFAULT_DP_THREADS);
    }

    /**
     * 加载配置。配置文件不存在时使用默认值。
     * @throws IllegalArgumentException 如果某个配置值不是整数。
     */
    public static AnalysisConfig load() {
        Properties properties = new Properties();
        try (InputStream in = AnalysisConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
                logger.debug("从 {} 读取配置", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("无法读取配置文件 " + RESOURCE, e);
        }
        properties.putAll(System.getProperties());
        AnalysisConfig config = new AnalysisConfig(
                readInt(properties, SOLVER_TIMEOUT_KEY, DEFAULT_TIMEOUT_MS),
                readInt(properties, DP_THREADS_KEY, DEFAULT_DP_THREADS));
        logger.info("加载配置: {}", config);
        return config;
    }

    private static int readInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            logger.error("配置项 {} 不是整数: {}", key, value);
            throw new IllegalArgumentException("配置项 " + key + " 不是整数: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "AnalysisConfig{solverTimeoutMs=" + solverTimeoutMs + ", dpThreads=" + dpThreads + "}";
    }
}
