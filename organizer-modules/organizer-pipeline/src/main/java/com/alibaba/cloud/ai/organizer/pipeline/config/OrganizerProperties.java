package com.alibaba.cloud.ai.organizer.pipeline.config;

import com.alibaba.cloud.ai.organizer.pipeline.model.ModelInfo;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 整理器配置 (application.yml 中 organizer.*)
 * 命令行参数会覆盖其中的 source / destination / cache-dir
 *
 * @author RobustH
 */
@Data
@ConfigurationProperties(prefix = "organizer")
public class OrganizerProperties {

    /**
     * 源目录
     */
    private String source;

    /**
     * 整理后的目标根目录
     */
    private String destination;

    /**
     * 缓存目录
     */
    private String cacheDir = ".organizer-cache";

    private Scan scan = new Scan();

    private Models models = new Models();

    private Analysis analysis = new Analysis();

    /**
     * 模型提供方 (ModelInfo.provider) 到 OpenAI 兼容端点的映射
     * openai 未配置时使用 spring.ai.openai 自动配置的客户端
     */
    private Map<String, Provider> providers = new LinkedHashMap<>();

    @Data
    public static class Scan {

        /**
         * 只保留匹配的文件 (glob, 相对源目录); 为空表示全部
         */
        private List<String> includePatterns = new ArrayList<>();

        private List<String> excludePatterns = new ArrayList<>();

        /**
         * 单个文件大小上限 (MB), 0 表示不限
         */
        private long maxFileSizeMb = 0;

        private boolean respectGitignore = true;
    }

    @Data
    public static class Models {

        /**
         * 配置的模型目录
         */
        private List<ModelInfo> catalog = new ArrayList<>();

        /**
         * 第二阶段是否实际调用每个模型验证连通性; 关闭时目录中的模型都视为连通
         */
        private boolean verifyConnectivity = false;
    }

    @Data
    public static class Analysis {

        /**
         * 文本类文件发送给模型的最大字符数
         */
        private int maxContentChars = 2000;

        /**
         * 第四阶段提示词中最多列出的文件数
         */
        private int maxTaxonomyFiles = 200;
    }

    @Data
    public static class Provider {

        /**
         * 例如 http://localhost:11434 (Ollama) 或 https://api.anthropic.com
         */
        private String baseUrl;

        private String apiKey = "not-set";
    }
}
