package com.alibaba.cloud.ai.organizer.pipeline.utils;

import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.ignore.IgnoreNode;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * .gitignore 解析器
 * 基于 JGit 实现, 只读取源目录根部的 .gitignore
 *
 * @author RobustH
 */
@Slf4j
public class GitIgnoreParser {

    private final IgnoreNode ignoreNode;
    private final Path rootPath;

    public GitIgnoreParser(Path rootPath) {
        this.rootPath = rootPath;
        this.ignoreNode = new IgnoreNode();
        loadGitIgnore();
    }

    private void loadGitIgnore() {
        Path gitIgnoreFile = rootPath.resolve(".gitignore");
        if (!Files.isRegularFile(gitIgnoreFile)) {
            return;
        }
        try (InputStream in = Files.newInputStream(gitIgnoreFile)) {
            ignoreNode.parse(in);
            log.debug("已加载 .gitignore 规则: {} 条, 文件={}", ignoreNode.getRules().size(), gitIgnoreFile);
        } catch (IOException e) {
            log.warn("加载 .gitignore 失败, 忽略其规则: {}", e.getMessage());
        }
    }

    /**
     * 检查路径是否被忽略
     *
     * @param path        文件或目录 (位于根目录之下)
     * @param isDirectory 是否为目录
     * @return true 表示被忽略
     */
    public boolean isIgnored(Path path, boolean isDirectory) {
        String relativePath = rootPath.relativize(path).toString().replace(File.separatorChar, '/');
        if (relativePath.isEmpty()) {
            return false;
        }
        // null 表示没有匹配的规则
        Boolean result = ignoreNode.checkIgnored(relativePath, isDirectory);
        return Boolean.TRUE.equals(result);
    }
}
