package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.config.OrganizerProperties;
import com.alibaba.cloud.ai.organizer.pipeline.model.ExcludedFile;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileError;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileInfo;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanResult;
import com.alibaba.cloud.ai.organizer.pipeline.utils.FileScanner;
import com.alibaba.cloud.ai.organizer.pipeline.utils.FileTypeClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * 第一阶段: 文件枚举和元数据收集
 *
 * @author RobustH
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanService {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final FileScanner fileScanner;
    private final FileTypeClassifier fileTypeClassifier;
    private final OrganizerProperties properties;

    /**
     * 列出参与扫描的文件 (用于计算源目录指纹)
     */
    public List<Path> enumerate(ScanRequest request) {
        return fileScanner.walk(request.getSource(), request.getSkipDirectories(),
                properties.getScan().isRespectGitignore());
    }

    /**
     * 扫描源目录
     *
     * @param request 扫描请求
     * @return 扫描结果, 文件按路径排序
     */
    public ScanResult scan(ScanRequest request) {
        Path root = request.getSource().toAbsolutePath().normalize();
        log.info("开始扫描: {}", root);

        OrganizerProperties.Scan scan = properties.getScan();
        List<PathMatcher> includes = matchers(scan.getIncludePatterns());
        List<PathMatcher> excludes = matchers(scan.getExcludePatterns());
        long maxBytes = scan.getMaxFileSizeMb() * BYTES_PER_MB;

        List<FileInfo> files = new ArrayList<>();
        List<ExcludedFile> excluded = new ArrayList<>();
        List<FileError> errors = new ArrayList<>();
        TreeSet<String> mimeTypes = new TreeSet<>();

        for (Path file : enumerate(request)) {
            String fileName = file.getFileName().toString();
            Path relative = root.relativize(file.toAbsolutePath().normalize());

            // 1. 隐藏文件
            if (fileName.startsWith(".")) {
                excluded.add(exclusion(file, "隐藏文件", "hidden_file"));
                continue;
            }

            // 2. include / exclude
            String excludedBy = firstMatch(scan.getExcludePatterns(), excludes, relative);
            if (excludedBy != null) {
                excluded.add(exclusion(file, "匹配排除规则 " + excludedBy, "exclude:" + excludedBy));
                continue;
            }
            if (!includes.isEmpty() && firstMatch(scan.getIncludePatterns(), includes, relative) == null) {
                excluded.add(exclusion(file, "不匹配任何包含规则", "include"));
                continue;
            }

            // 3. 元数据
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(file, BasicFileAttributes.class);
            } catch (IOException e) {
                log.warn("读取文件属性失败: {}, 原因: {}", file, e.getMessage());
                errors.add(new FileError(file.toString(), e.getMessage()));
                continue;
            }
            if (maxBytes > 0 && attrs.size() > maxBytes) {
                excluded.add(exclusion(file, "超过大小上限 " + scan.getMaxFileSizeMb() + " MB", "size_limit"));
                continue;
            }

            String mimeType = fileTypeClassifier.detectMimeType(file);
            mimeTypes.add(mimeType);
            files.add(FileInfo.builder()
                    .fileName(fileName)
                    .filePath(file.toAbsolutePath().normalize().toString())
                    .mimeType(mimeType)
                    .category(fileTypeClassifier.classify(fileName, mimeType))
                    .fileSize(attrs.size())
                    .modifiedAt(attrs.lastModifiedTime().toMillis())
                    .build());
        }

        log.info("扫描完成: 文件={}, 排除={}, 错误={}, MIME 类型={}",
                files.size(), excluded.size(), errors.size(), mimeTypes.size());
        return ScanResult.builder()
                .sourceDirectory(root.toString())
                .totalFiles(files.size())
                .files(files)
                .excludedFiles(excluded)
                .errors(errors)
                .uniqueMimeTypes(new ArrayList<>(mimeTypes))
                .build();
    }

    private static List<PathMatcher> matchers(List<String> patterns) {
        List<PathMatcher> matchers = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        return matchers;
    }

    /**
     * 相对路径或文件名匹配任一规则时返回该规则
     */
    private static String firstMatch(List<String> patterns, List<PathMatcher> matchers, Path relative) {
        Path unixStyle = Path.of(relative.toString().replace(File.separatorChar, '/'));
        for (int i = 0; i < matchers.size(); i++) {
            PathMatcher matcher = matchers.get(i);
            if (matcher.matches(unixStyle) || matcher.matches(relative.getFileName())) {
                return patterns.get(i);
            }
        }
        return null;
    }

    private static ExcludedFile exclusion(Path file, String reason, String rule) {
        return ExcludedFile.builder()
                .filePath(file.toAbsolutePath().normalize().toString())
                .fileName(file.getFileName().toString())
                .reason(reason)
                .rule(rule)
                .build();
    }
}
