package com.alibaba.cloud.ai.organizer.cli;

import com.alibaba.cloud.ai.organizer.pipeline.config.OrganizerProperties;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.PipelineStageId;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 命令行解析
 * 选项使用 Spring 的 --name=value 语法; --clear-cache 的值也可以作为下一个参数给出
 *
 * @author RobustH
 */
@Component
@RequiredArgsConstructor
public class PipelineCommandLine {

    public static final String SOURCE = "source";
    public static final String DESTINATION = "destination";
    public static final String CACHE_DIR = "cache-dir";
    public static final String NO_CACHE = "no-cache";
    public static final String NO_CACHE_WRITE = "no-cache-write";
    public static final String CLEAR_CACHE = "clear-cache";
    public static final String CACHE_STATS = "cache-stats";
    public static final String SKIP_STAGE = "skip-stage";
    public static final String DRY_RUN = "dry-run";
    public static final String OVERWRITE = "overwrite";

    private static final String ALL = "all";

    private static final Set<String> FLAGS = Set.of(
            SOURCE, DESTINATION, CACHE_DIR, NO_CACHE, NO_CACHE_WRITE, CLEAR_CACHE, CACHE_STATS, DRY_RUN, OVERWRITE
    );

    // Spring 属性覆盖 (例如 --logging.level.root=debug) 直接放行
    private static final List<String> PROPERTY_PREFIXES = List.of("spring.", "logging.", "organizer.");

    private static final Set<String> SPRING_SWITCHES = Set.of("debug", "trace");

    private final OrganizerProperties properties;

    /**
     * 解析并校验参数
     *
     * @throws PipelineConfigException 参数非法或相互冲突
     */
    public CommandLineOptions parse(ApplicationArguments args) {
        PipelineStageId stopBefore = null;
        for (String name : args.getOptionNames()) {
            if (FLAGS.contains(name) || isPropertyOverride(name)) {
                continue;
            }
            if (name.startsWith(SKIP_STAGE)) {
                PipelineStageId skipped = parseSkip(name);
                if (stopBefore == null || skipped.compareTo(stopBefore) < 0) {
                    stopBefore = skipped;
                }
                continue;
            }
            throw new PipelineConfigException("未知选项: --" + name);
        }

        // --clear-cache
        List<String> leftovers = new ArrayList<>(args.getNonOptionArgs());
        boolean clearRequested = args.containsOption(CLEAR_CACHE);
        boolean clearAll = false;
        Set<PipelineStageId> clearStages = EnumSet.noneOf(PipelineStageId.class);
        if (clearRequested) {
            List<String> values = new ArrayList<>();
            for (String value : args.getOptionValues(CLEAR_CACHE)) {
                if (!value.isBlank()) {
                    values.add(value);
                }
            }
            if (values.isEmpty() && !leftovers.isEmpty()) {
                values.add(leftovers.remove(0));
            }
            if (values.isEmpty()) {
                throw new PipelineConfigException("--clear-cache 需要一个值: stage1..stage5 或 all");
            }
            for (String value : values) {
                for (String token : value.split(",")) {
                    String stage = token.strip();
                    if (ALL.equalsIgnoreCase(stage)) {
                        clearAll = true;
                        continue;
                    }
                    PipelineStageId id = PipelineStageId.fromId(stage);
                    if (id == null) {
                        throw new PipelineConfigException("未知阶段: " + stage + " (可选 stage1..stage5 或 all)");
                    }
                    clearStages.add(id);
                }
            }
        }
        if (!leftovers.isEmpty()) {
            throw new PipelineConfigException("无法识别的参数: " + String.join(" ", leftovers));
        }

        boolean noCache = args.containsOption(NO_CACHE);
        if (noCache && clearRequested) {
            throw new PipelineConfigException("--no-cache 不能与 --clear-cache 同时使用");
        }

        Path cacheDir = path(single(args, CACHE_DIR, properties.getCacheDir()));
        if (cacheDir == null) {
            throw new PipelineConfigException("缓存目录不能为空");
        }
        if (Files.exists(cacheDir) && !Files.isDirectory(cacheDir)) {
            throw new PipelineConfigException("--cache-dir 不是目录: " + cacheDir);
        }

        boolean cacheStats = args.containsOption(CACHE_STATS);
        Path source = path(single(args, SOURCE, properties.getSource()));
        Path destination = path(single(args, DESTINATION, properties.getDestination()));

        boolean runsPipeline = !cacheStats && !(clearRequested && source == null);
        if (runsPipeline) {
            if (source == null) {
                throw new PipelineConfigException("缺少源目录: 使用 --source=<目录> 或配置 organizer.source");
            }
            if (!Files.isDirectory(source)) {
                throw new PipelineConfigException("源目录不存在或不是目录: " + source);
            }
            if (destination != null && Files.exists(destination) && !Files.isDirectory(destination)) {
                throw new PipelineConfigException("--destination 不是目录: " + destination);
            }
        }

        return CommandLineOptions.builder()
                .source(source)
                .destination(destination)
                .cacheDir(cacheDir)
                .noCache(noCache)
                .noCacheWrite(args.containsOption(NO_CACHE_WRITE))
                .clearRequested(clearRequested)
                .clearAll(clearAll)
                .clearStages(clearStages)
                .cacheStats(cacheStats)
                .stopBefore(stopBefore)
                .dryRun(args.containsOption(DRY_RUN))
                .overwrite(args.containsOption(OVERWRITE))
                .build();
    }

    private static PipelineStageId parseSkip(String name) {
        String number = name.substring(SKIP_STAGE.length());
        PipelineStageId stage;
        try {
            stage = PipelineStageId.fromNumber(Integer.parseInt(number));
        } catch (NumberFormatException e) {
            throw new PipelineConfigException("未知选项: --" + name);
        }
        if (stage == null) {
            throw new PipelineConfigException("未知阶段: --" + name);
        }
        if (stage == PipelineStageId.STAGE1) {
            throw new PipelineConfigException("第一阶段不能跳过: 后续阶段都依赖它的结果");
        }
        return stage;
    }

    private static boolean isPropertyOverride(String name) {
        if (SPRING_SWITCHES.contains(name)) {
            return true;
        }
        for (String prefix : PROPERTY_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String single(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        String value = values.get(values.size() - 1);
        if (value.isBlank()) {
            throw new PipelineConfigException("--" + name + " 需要一个值");
        }
        return value;
    }

    private static Path path(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Path.of(value).toAbsolutePath().normalize();
    }
}
