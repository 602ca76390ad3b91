package com.alibaba.cloud.ai.organizer.cache.fingerprint;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * 指纹计算器
 * 根据修改时间、大小和路径计算缓存主体的稳定身份
 *
 * @author RobustH
 */
@Slf4j
public class FingerprintComputer {

    /**
     * 计算单个文件的指纹
     *
     * @param path 文件路径
     * @return 文件指纹
     * @throws IoUnavailableException 文件无法 stat 时
     */
    public Fingerprint fingerprintFile(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            return Fingerprint.builder()
                    .kind(FingerprintKind.FILE)
                    .path(normalize(path))
                    .size(attrs.size())
                    .modifiedAt(attrs.lastModifiedTime().toMillis())
                    .build();
        } catch (IOException e) {
            throw new IoUnavailableException("无法读取文件属性: " + path, e);
        }
    }

    /**
     * 计算目录快照指纹
     * 文件列表先按路径排序, 因此枚举顺序不同的两次扫描得到相同的值
     *
     * @param directory 目录
     * @param files     目录下参与快照的文件
     * @return 目录指纹
     */
    public Fingerprint fingerprintDirectory(Path directory, Collection<Path> files) {
        List<Fingerprint> fileFingerprints = new ArrayList<>(files.size());
        for (Path file : files) {
            fileFingerprints.add(fingerprintFile(file));
        }
        fileFingerprints.sort(Comparator.comparing(Fingerprint::getPath));

        long totalSize = 0;
        long latest = 0;
        StringBuilder canonical = new StringBuilder();
        for (Fingerprint fp : fileFingerprints) {
            totalSize += fp.getSize();
            latest = Math.max(latest, fp.getModifiedAt());
            canonical.append(fp.canonicalLine()).append('\n');
        }

        return Fingerprint.builder()
                .kind(FingerprintKind.DIRECTORY)
                .path(normalize(directory))
                .size(totalSize)
                .modifiedAt(latest)
                .digest(md5(canonical.toString().getBytes(StandardCharsets.UTF_8)))
                .build();
    }

    /**
     * 基于内容哈希的指纹, 用于非文件系统主体
     */
    public Fingerprint fingerprintBytes(byte[] blob) {
        return Fingerprint.builder()
                .kind(FingerprintKind.CONTENT)
                .size(blob.length)
                .digest(md5(blob))
                .build();
    }

    /**
     * 聚合多个指纹 (与顺序无关)
     */
    public Fingerprint fingerprintAggregate(Collection<Fingerprint> parts) {
        List<String> lines = new ArrayList<>(parts.size());
        long totalSize = 0;
        long latest = 0;
        for (Fingerprint part : parts) {
            lines.add(part.canonicalLine());
            totalSize += part.getSize();
            latest = Math.max(latest, part.getModifiedAt());
        }
        lines.sort(Comparator.naturalOrder());

        return Fingerprint.builder()
                .kind(FingerprintKind.AGGREGATE)
                .size(totalSize)
                .modifiedAt(latest)
                .digest(md5(String.join("\n", lines).getBytes(StandardCharsets.UTF_8)))
                .build();
    }

    private static String normalize(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    private static String md5(byte[] bytes) {
        return DigestUtils.md5DigestAsHex(bytes);
    }
}
