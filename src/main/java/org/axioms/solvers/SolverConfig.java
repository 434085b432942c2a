package org.axioms.solvers;

import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * 求解器配置：单次查询超时、后端名称、验证前是否检查背景理论一致性。
 * {@link #load()} 从 classpath 的 axiom-verifier.properties 读取，再由同名系统属性覆盖。
 */
@Getter
@Builder(toBuilder = true)
public class SolverConfig {

    private static final Logger logger = LoggerFactory.getLogger(SolverConfig.class);

    public static final String RESOURCE = "/axiom-verifier.properties";
    public static final String TIMEOUT_KEY = "axioms.solver.timeout";
    public static final String BACKEND_KEY = "axioms.solver.backend";
    public static final String CHECK_CONSISTENCY_KEY = "axioms.solver.check-consistency";

    public static final int DEFAULT_TIMEOUT_MILLIS = 30_000;
    public static final String DEFAULT_BACKEND = "z3";

    /** 单次 check 的超时（毫秒），0 表示不限 */
    @Builder.Default
    private final int timeoutMillis = DEFAULT_TIMEOUT_MILLIS;

    @Builder.Default
    private final String backendName = DEFAULT_BACKEND;

    /** verify 之前是否先检查已加载的背景理论可满足 */
    @Builder.Default
    private final boolean checkConsistency = false;

    public static SolverConfig defaults() {
        return SolverConfig.builder().build();
    }

    /**
     * 读取 classpath 配置并应用系统属性覆盖。资源不存在时使用默认值。
     * @throws IllegalArgumentException 超时不是非负整数
     */
    public static SolverConfig load() {
        Properties properties = new Properties();
        try (InputStream in = SolverConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.debug("未找到 {}，使用默认配置", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("读取 {} 失败，使用默认配置: {}", RESOURCE, e.getMessage());
        }
        for (String key : new String[]{TIMEOUT_KEY, BACKEND_KEY, CHECK_CONSISTENCY_KEY}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    public static SolverConfig fromProperties(Properties properties) {
        SolverConfigBuilder builder = SolverConfig.builder();
        String timeout = StringUtils.trimToNull(properties.getProperty(TIMEOUT_KEY));
        if (timeout != null) {
            if (!StringUtils.isNumeric(timeout)) {
                logger.error("{} 必须是非负整数，实际为 {}", TIMEOUT_KEY, timeout);
                throw new IllegalArgumentException(TIMEOUT_KEY + " 必须是非负整数: " + timeout);
            }
            builder.timeoutMillis(Integer.parseInt(timeout));
        }
        String backend = StringUtils.trimToNull(properties.getProperty(BACKEND_KEY));
        if (backend != null) {
            builder.backendName(backend);
        }
        String consistency = StringUtils.trimToNull(properties.getProperty(CHECK_CONSISTENCY_KEY));
        if (consistency != null) {
            builder.checkConsistency(Boolean.parseBoolean(consistency));
        }
        SolverConfig config = builder.build();
        logger.debug("求解器配置: {}", config);
        return config;
    }

    @Override
    public String toString() {
        return "SolverConfig{timeoutMillis=" + timeoutMillis + ", backendName=" + backendName
                + ", checkConsistency=" + checkConsistency + "}";
    }
}
