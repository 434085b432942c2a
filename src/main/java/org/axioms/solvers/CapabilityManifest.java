package org.axioms.solvers;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 后端能力清单（classpath 上的 JSON 资源）的绑定对象。
 * 原生运算不在清单中列出，而由构造后端所用的翻译器注册表给出。
 */
@Getter
public class CapabilityManifest {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityManifest.class);
    private static final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    private Metadata solver;
    private Capabilities capabilities;

    @Getter
    public static class Metadata {
        private String name;
        private String version;
        private String type;
        private String description;
    }

    @Getter
    public static class Capabilities {
        private List<String> theories;
        private FeatureFlags features;
        private Performance performance;
    }

    @Getter
    public static class Performance {
        private int maxAxioms = 10000;
        private long timeoutMs = 5000;
    }

    /**
     * 从 classpath 读取清单。
     * @param resource 资源路径，例如 /solvers/z3-capabilities.json
     * @return 解析后的清单
     * @throws SolverException 资源缺失或格式错误
     */
    public static CapabilityManifest load(String resource) {
        try (InputStream in = CapabilityManifest.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.error("找不到能力清单资源 {}", resource);
                throw new SolverException(SolverException.Kind.ENGINE_FAILURE, "找不到能力清单: " + resource);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return parse(reader, resource);
            }
        } catch (IOException e) {
            throw new SolverException(SolverException.Kind.ENGINE_FAILURE, "读取能力清单失败: " + resource, e);
        }
    }

    public static CapabilityManifest parse(Reader reader, String source) {
        CapabilityManifest manifest;
        try {
            manifest = gson.fromJson(reader, CapabilityManifest.class);
        } catch (JsonParseException e) {
            logger.error("能力清单 {} 格式错误: {}", source, e.getMessage());
            throw new SolverException(SolverException.Kind.ENGINE_FAILURE, "能力清单格式错误: " + source, e);
        }
        if (manifest == null || manifest.solver == null || manifest.solver.name == null) {
            throw new SolverException(SolverException.Kind.ENGINE_FAILURE, "能力清单缺少 solver.name: " + source);
        }
        if (manifest.capabilities == null) {
            manifest.capabilities = new Capabilities();
        }
        if (manifest.capabilities.theories == null) {
            manifest.capabilities.theories = List.of();
        }
        if (manifest.capabilities.features == null) {
            manifest.capabilities.features = new FeatureFlags();
        }
        if (manifest.capabilities.performance == null) {
            manifest.capabilities.performance = new Performance();
        }
        logger.debug("读取能力清单 {}: {} {}", source, manifest.solver.name, manifest.solver.version);
        return manifest;
    }
}
