package com.alibaba.cloud.ai.organizer.pipeline.utils;

import com.alibaba.cloud.ai.organizer.pipeline.model.FileCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 文件类型分类器
 * 根据扩展名识别 MIME 类型, 未知扩展名交给 Files.probeContentType
 *
 * @author RobustH
 */
@Slf4j
@Component
public class FileTypeClassifier {

    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private static final Map<String, String> EXTENSION_TO_MIME = Map.ofEntries(
            // 图片
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("heic", "image/heic"),
            Map.entry("svg", "image/svg+xml"),
            // 音视频
            Map.entry("mp4", "video/mp4"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("mkv", "video/x-matroska"),
            Map.entry("avi", "video/x-msvideo"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/wav"),
            Map.entry("flac", "audio/flac"),
            Map.entry("ogg", "audio/ogg"),
            Map.entry("m4a", "audio/mp4"),
            // 文档
            Map.entry("txt", "text/plain"),
            Map.entry("md", "text/markdown"),
            Map.entry("markdown", "text/markdown"),
            Map.entry("csv", "text/csv"),
            Map.entry("html", "text/html"),
            Map.entry("htm", "text/html"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("doc", "application/msword"),
            Map.entry("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
            Map.entry("xls", "application/vnd.ms-excel"),
            Map.entry("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
            Map.entry("ppt", "application/vnd.ms-powerpoint"),
            Map.entry("pptx", "application/vnd.openxmlformats-officedocument.presentationml.presentation"),
            // 配置
            Map.entry("json", "application/json"),
            Map.entry("xml", "application/xml"),
            Map.entry("yaml", "application/yaml"),
            Map.entry("yml", "application/yaml"),
            Map.entry("toml", "application/toml"),
            Map.entry("properties", "text/x-java-properties"),
            // 代码
            Map.entry("java", "text/x-java"),
            Map.entry("py", "text/x-python"),
            Map.entry("js", "text/javascript"),
            Map.entry("ts", "text/x-typescript"),
            Map.entry("go", "text/x-go"),
            Map.entry("rs", "text/x-rust"),
            Map.entry("c", "text/x-c"),
            Map.entry("cpp", "text/x-c++"),
            Map.entry("sh", "application/x-sh"),
            Map.entry("sql", "application/sql"),
            // 压缩包
            Map.entry("zip", "application/zip"),
            Map.entry("gz", "application/gzip"),
            Map.entry("tar", "application/x-tar"),
            Map.entry("7z", "application/x-7z-compressed"),
            Map.entry("rar", "application/vnd.rar")
    );

    private static final Set<String> CODE_EXTENSIONS = Set.of(
            "java", "kt", "scala", "groovy", "py", "rb", "php", "go", "rs",
            "c", "cpp", "cc", "h", "hpp", "cs", "js", "jsx", "ts", "tsx", "sh", "sql"
    );

    private static final Set<String> CONFIG_MIME_TYPES = Set.of(
            "application/json", "application/xml", "application/yaml", "application/toml", "text/x-java-properties"
    );

    private static final Set<String> DOCUMENT_MIME_PREFIXES = Set.of(
            "text/", "application/pdf", "application/msword", "application/vnd.openxmlformats", "application/vnd.ms-"
    );

    private static final Set<String> ARCHIVE_MIME_TYPES = Set.of(
            "application/zip", "application/gzip", "application/x-tar", "application/x-7z-compressed", "application/vnd.rar"
    );

    /**
     * 识别 MIME 类型
     */
    public String detectMimeType(Path file) {
        String mime = EXTENSION_TO_MIME.get(getExtension(file.getFileName().toString()));
        if (mime != null) {
            return mime;
        }
        try {
            String detected = Files.probeContentType(file);
            if (detected != null && !detected.isBlank()) {
                return detected;
            }
        } catch (IOException e) {
            log.debug("探测 MIME 类型失败: {}, 原因: {}", file, e.getMessage());
        }
        return DEFAULT_MIME_TYPE;
    }

    /**
     * 根据 MIME 类型和文件名判断大类
     */
    public FileCategory classify(String fileName, String mimeType) {
        if (CODE_EXTENSIONS.contains(getExtension(fileName))) {
            return FileCategory.CODE;
        }
        if (mimeType.startsWith("image/")) {
            return FileCategory.IMAGE;
        }
        if (mimeType.startsWith("video/")) {
            return FileCategory.VIDEO;
        }
        if (mimeType.startsWith("audio/")) {
            return FileCategory.AUDIO;
        }
        if (CONFIG_MIME_TYPES.contains(mimeType)) {
            return FileCategory.CONFIG;
        }
        if (ARCHIVE_MIME_TYPES.contains(mimeType)) {
            return FileCategory.ARCHIVE;
        }
        for (String prefix : DOCUMENT_MIME_PREFIXES) {
            if (mimeType.startsWith(prefix)) {
                return FileCategory.DOCUMENT;
            }
        }
        return FileCategory.OTHER;
    }

    /**
     * 获取小写扩展名, 没有扩展名时为空串
     */
    public static String getExtension(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return "";
        }
        int lastDotIndex = fileName.lastIndexOf('.');
        if (lastDotIndex <= 0 || lastDotIndex == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
    }
}
