package com.alibaba.cloud.ai.organizer.pipeline.utils;

import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 文件扫描器
 * 遍历源目录, 应用过滤规则 (默认规则 + .gitignore + 调用方指定的目录), 返回排序后的文件列表
 *
 * @author RobustH
 */
@Slf4j
@Component
public class FileScanner {

    // 默认忽略的目录和文件
    private static final Set<String> DEFAULT_IGNORES = Set.of(
            ".git", ".idea", ".vscode", "node_modules", "__pycache__",
            ".DS_Store", "Thumbs.db", "desktop.ini"
    );

    /**
     * 遍历目录
     *
     * @param rootPath        源目录
     * @param skipDirectories 整个跳过的目录 (缓存目录等)
     * @param respectGitignore 是否应用源目录根部的 .gitignore
     * @return 按路径排序的文件 (绝对路径)
     * @throws UncheckedIOException 源目录无法遍历
     */
    public List<Path> walk(Path rootPath, Collection<Path> skipDirectories, boolean respectGitignore) {
        Path root = rootPath.toAbsolutePath().normalize();
        GitIgnoreParser gitIgnoreParser = respectGitignore ? new GitIgnoreParser(root) : null;
        Set<Path> skipped = new HashSet<>();
        for (Path dir : skipDirectories) {
            skipped.add(dir.toAbsolutePath().normalize());
        }
        List<Path> files = new ArrayList<>();

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
                @NotNull
                @Override
                public FileVisitResult preVisitDirectory(@NotNull Path dir, @NotNull BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String dirName = dir.getFileName().toString();
                    // 1. 默认规则, 隐藏目录
                    if (DEFAULT_IGNORES.contains(dirName) || dirName.startsWith(".") || skipped.contains(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    // 2. .gitignore 规则
                    if (gitIgnoreParser != null && gitIgnoreParser.isIgnored(dir, true)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @NotNull
                @Override
                public FileVisitResult visitFile(@NotNull Path file, @NotNull BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile() || DEFAULT_IGNORES.contains(file.getFileName().toString())) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (gitIgnoreParser != null && gitIgnoreParser.isIgnored(file, false)) {
                        return FileVisitResult.CONTINUE;
                    }
                    // 隐藏文件不在这里过滤, 由扫描服务记录为排除项
                    files.add(file);
                    return FileVisitResult.CONTINUE;
                }

                @NotNull
                @Override
                public FileVisitResult visitFileFailed(@NotNull Path file, @NotNull IOException exc) throws IOException {
                    if (file.equals(root)) {
                        throw exc;
                    }
                    log.warn("无法访问文件: {}, 原因: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("遍历源目录失败: " + root, e);
        }

        files.sort(null);
        log.debug("遍历完成: {} 个文件, 目录={}", files.size(), root);
        return files;
    }
}
