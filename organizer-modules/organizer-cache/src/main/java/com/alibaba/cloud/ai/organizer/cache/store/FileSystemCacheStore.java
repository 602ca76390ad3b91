package com.alibaba.cloud.ai.organizer.cache.store;

import com.alibaba.cloud.ai.organizer.cache.exception.CacheException;
import com.alibaba.cloud.ai.organizer.cache.exception.CacheWriteException;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.Fingerprint;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 基于本地目录的缓存存储
 * 每个键对应一个 JSON 文件; 先写临时文件再重命名, 崩溃不会留下 get 可见的半写条目
 *
 * @author RobustH
 */
@Slf4j
public class FileSystemCacheStore implements CacheStore {

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemCacheStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        Path file = directory.resolve(key.fileName());
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("读取缓存文件失败, 按未命中处理: key={}, file={}, error={}", key, file, e.getMessage());
            return Optional.empty();
        }

        try {
            CacheEntry entry = objectMapper.readValue(bytes, CacheEntry.class);
            String problem = validate(entry, key);
            if (problem != null) {
                log.warn("缓存记录损坏, 按未命中处理: key={}, reason={}", key, problem);
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (IOException e) {
            log.warn("缓存记录损坏, 按未命中处理: key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(CacheKey key, byte[] payload, Fingerprint fingerprint) {
        CacheEntry entry = CacheEntry.builder()
                .formatVersion(CacheEntry.FORMAT_VERSION)
                .key(key)
                .fingerprint(fingerprint)
                .writtenAt(System.currentTimeMillis())
                .payload(payload)
                .build();

        Path target = directory.resolve(key.fileName());
        Path temp = null;
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(entry);
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, key.fileName(), TEMP_SUFFIX);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(temp, target);
            temp = null;
            log.debug("已写入缓存: key={}, bytes={}", key, bytes.length);
        } catch (IOException e) {
            throw new CacheWriteException("写入缓存失败: " + key + " -> " + target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    @Override
    public int delete(CacheKey key) {
        try {
            return Files.deleteIfExists(directory.resolve(key.fileName())) ? 1 : 0;
        } catch (IOException e) {
            throw new CacheException("删除缓存失败: " + key, e);
        }
    }

    @Override
    public int deleteStage(String stageId) {
        return deleteMatching(CacheKey.stagePrefix(stageId));
    }

    @Override
    public int deleteAll() {
        return deleteMatching("");
    }

    @Override
    public CacheStats stats() {
        Map<String, CacheStats.StageStats> stages = new TreeMap<>();
        long totalEntries = 0;
        long totalBytes = 0;

        for (Path file : listCacheFiles("")) {
            String name = file.getFileName().toString();
            int stageEnd = name.indexOf(CacheKey.SEPARATOR);
            if (stageEnd <= 0) {
                continue;
            }
            String stageId = name.substring(0, stageEnd);
            int scopeStart = stageEnd + CacheKey.SEPARATOR.length();
            int scopeEnd = name.indexOf(CacheKey.SEPARATOR, scopeStart);
            CacheScope scope = scopeEnd < 0 ? null : CacheScope.fromFileToken(name.substring(scopeStart, scopeEnd));
            if (scope == null) {
                continue;
            }

            long size;
            try {
                size = Files.size(file);
            } catch (IOException e) {
                log.warn("读取缓存文件大小失败: {}", file, e);
                continue;
            }

            CacheStats.StageStats stageStats = stages.computeIfAbsent(stageId, id -> new CacheStats.StageStats());
            if (scope == CacheScope.ITEM) {
                stageStats.setItemEntries(stageStats.getItemEntries() + 1);
            } else {
                stageStats.setGlobalEntries(stageStats.getGlobalEntries() + 1);
            }
            stageStats.setBytes(stageStats.getBytes() + size);
            totalEntries++;
            totalBytes += size;
        }

        return CacheStats.builder()
                .directory(directory.toString())
                .stages(stages)
                .totalEntries(totalEntries)
                .totalBytes(totalBytes)
                .build();
    }

    @Override
    public Path directory() {
        return directory;
    }

    // ==================== 内部方法 ====================

    private String validate(CacheEntry entry, CacheKey expectedKey) {
        if (entry == null) {
            return "empty record";
        }
        if (entry.getFormatVersion() != CacheEntry.FORMAT_VERSION) {
            return "unsupported format version " + entry.getFormatVersion();
        }
        if (!expectedKey.equals(entry.getKey())) {
            return "key mismatch: " + entry.getKey();
        }
        if (entry.getFingerprint() == null || entry.getPayload() == null) {
            return "missing fingerprint or payload";
        }
        return null;
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("文件系统不支持原子移动, 使用普通替换: {}", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private int deleteMatching(String prefix) {
        int removed = 0;
        for (Path file : listFiles(prefix, true)) {
            try {
                if (Files.deleteIfExists(file) && file.getFileName().toString().endsWith(CacheKey.FILE_SUFFIX)) {
                    removed++;
                }
            } catch (IOException e) {
                throw new CacheException("删除缓存文件失败: " + file, e);
            }
        }
        if (removed > 0) {
            log.info("已清理 {} 个缓存条目: 目录={}, 前缀='{}'", removed, directory, prefix);
        }
        return removed;
    }

    private List<Path> listCacheFiles(String prefix) {
        return listFiles(prefix, false);
    }

    /**
     * 列出匹配前缀的缓存文件; 目录不存在时为空, 目录不可访问时抛出 CacheException
     */
    private List<Path> listFiles(String prefix, boolean includeTemp) {
        List<Path> files = new ArrayList<>();
        if (!Files.exists(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (!name.startsWith(prefix) || !Files.isRegularFile(file)) {
                    continue;
                }
                if (name.endsWith(CacheKey.FILE_SUFFIX) || (includeTemp && name.endsWith(TEMP_SUFFIX))) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            throw new CacheException("缓存目录不可访问: " + directory, e);
        }
        return files;
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("清理临时缓存文件失败: {}", temp, e);
        }
    }
}
