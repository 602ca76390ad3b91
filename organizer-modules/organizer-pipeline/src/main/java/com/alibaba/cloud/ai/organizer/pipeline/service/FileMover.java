package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisFailure;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileAssignment;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveOperation;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 第五阶段: 按分类结果移动文件
 * 已分析的文件移到 目标根目录/分类路径/建议文件名; 分析失败的文件移到 _errors/ 并写 errors_log.json.
 * 单个文件移动失败只记录在结果里, 目标根目录无法创建才是致命错误
 *
 * @author RobustH
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileMover {

    public static final String ERRORS_DIRECTORY = "_errors";
    public static final String ERRORS_LOG = "errors_log.json";

    private final ObjectMapper objectMapper;

    public MoveResult move(MoveRequest request) {
        TaxonomyResult taxonomy = request.getTaxonomy();
        Path root = Path.of(request.getDestination()).toAbsolutePath().normalize();
        boolean dryRun = request.isDryRun();
        log.info("开始移动文件: 目标={}, 分配={}, 失败文件={}{}", root, taxonomy.getAssignments().size(),
                taxonomy.getFailures().size(), dryRun ? " [DRY-RUN]" : "");

        if (!dryRun) {
            try {
                Files.createDirectories(root);
            } catch (IOException e) {
                throw new UncheckedIOException("无法创建目标根目录: " + root, e);
            }
        }

        List<MoveOperation> operations = new ArrayList<>();

        // 1. 已分类的文件
        for (FileAssignment assignment : taxonomy.getAssignments()) {
            Path targetDir = root.resolve(assignment.getTargetPath()).normalize();
            operations.add(moveOne(root, Path.of(assignment.getFilePath()), targetDir, assignment.getTargetPath(),
                    assignment.getProposedFilename(), MoveOperation.ORGANIZED, request));
        }

        // 2. 分析失败的文件
        if (!taxonomy.getFailures().isEmpty()) {
            Path errorsDir = root.resolve(ERRORS_DIRECTORY);
            for (AnalysisFailure failure : taxonomy.getFailures()) {
                Path source = Path.of(failure.getFilePath());
                operations.add(moveOne(root, source, errorsDir, ERRORS_DIRECTORY,
                        source.getFileName().toString(), MoveOperation.ERROR, request));
            }
            writeErrorsLog(errorsDir, taxonomy.getFailures(), dryRun);
        }

        int successful = 0;
        int failed = 0;
        int errorMoves = 0;
        for (MoveOperation operation : operations) {
            if (!operation.isSuccess()) {
                failed++;
            } else if (MoveOperation.ERROR.equals(operation.getCategory())) {
                errorMoves++;
            } else {
                successful++;
            }
        }

        log.info("移动完成: 成功={}, 失败={}, 移入 {}={}", successful, failed, ERRORS_DIRECTORY, errorMoves);
        return MoveResult.builder()
                .destination(root.toString())
                .dryRun(dryRun)
                .operations(operations)
                .successfulMoves(successful)
                .failedMoves(failed)
                .errorMoves(errorMoves)
                .build();
    }

    private MoveOperation moveOne(Path root, Path source, Path targetDir, String targetPath, String fileName,
                                  String category, MoveRequest request) {
        Path target = targetDir.resolve(fileName).normalize();
        MoveOperation operation = MoveOperation.builder()
                .sourcePath(source.toString())
                .targetPath(targetPath)
                .targetFilename(fileName)
                .fullTarget(target.toString())
                .category(category)
                .build();

        String error = checkMove(root, source, target, request.isOverwrite());
        if (error != null) {
            log.warn("跳过移动: {}, 原因: {}", source, error);
            operation.setError(error);
            return operation;
        }
        if (request.isDryRun()) {
            log.info("[DRY-RUN] {} -> {}", source, target);
            operation.setSuccess(true);
            return operation;
        }

        try {
            Files.createDirectories(target.getParent());
            if (request.isOverwrite()) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.move(source, target);
            }
            log.debug("已移动: {} -> {}", source, target);
            operation.setSuccess(true);
        } catch (IOException e) {
            log.error("移动文件失败: {} -> {}, 原因: {}", source, target, e.getMessage());
            operation.setError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return operation;
    }

    private static String checkMove(Path root, Path source, Path target, boolean overwrite) {
        if (!target.startsWith(root)) {
            return "目标路径超出目标根目录: " + target;
        }
        if (!Files.exists(source)) {
            return "源文件不存在: " + source;
        }
        if (Files.exists(target) && !overwrite) {
            return "目标已存在: " + target;
        }
        return null;
    }

    private void writeErrorsLog(Path errorsDir, List<AnalysisFailure> failures, boolean dryRun) {
        Path logFile = errorsDir.resolve(ERRORS_LOG);
        if (dryRun) {
            log.info("[DRY-RUN] 将写入错误日志: {}", logFile);
            return;
        }
        ObjectNode document = objectMapper.createObjectNode();
        document.put("timestamp", Instant.now().toString());
        document.put("total", failures.size());
        ArrayNode entries = document.putArray("entries");
        for (AnalysisFailure failure : failures) {
            entries.addObject()
                    .put("filePath", failure.getFilePath())
                    .put("error", failure.getError());
        }
        try {
            Files.createDirectories(errorsDir);
            Files.write(logFile, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document));
            log.info("已写入错误日志: {}", logFile);
        } catch (IOException e) {
            log.error("写入错误日志失败: {}, 原因: {}", logFile, e.getMessage());
        }
    }
}
