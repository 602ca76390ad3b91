package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.config.OrganizerProperties;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileAnalysis;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileInfo;
import com.alibaba.cloud.ai.organizer.pipeline.model.ModelInfo;
import com.alibaba.cloud.ai.organizer.pipeline.utils.AiResponseParser;
import com.alibaba.cloud.ai.organizer.pipeline.utils.FileTypeClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 基于 ChatClient 的文件分析
 * 回复必须包含 proposed_filename、description、tags; 解析失败的文件记为失败, 下次运行重试
 * 请求发往模型所属提供方的端点, 提供方未配置时该文件分析失败
 *
 * @author RobustH
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiFileAnalyzer implements FileAnalyzer {

    private static final int MAX_FILENAME_LENGTH = 80;

    private final ChatClientRegistry chatClients;
    private final ObjectMapper objectMapper;
    private final OrganizerProperties properties;

    @Override
    public FileAnalysis analyze(FileInfo file, DiscoveryResult discovery) {
        ModelInfo model = discovery.resolveModel(file.getMimeType());
        if (model == null) {
            throw new AnalysisException("没有可用于 MIME 类型 " + file.getMimeType() + " 的模型");
        }

        String prompt = buildPrompt(file);
        ChatClient chatClient = chatClients.forProvider(model.getProvider());
        String reply;
        try {
            reply = chatClient.prompt()
                    .options(ChatOptions.builder().model(model.getModelName()).build())
                    .user(prompt)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new AnalysisException("调用模型 " + model.getName() + " 失败: " + e.getMessage(), e);
        }

        JsonNode json;
        try {
            json = AiResponseParser.parseObject(objectMapper, reply);
        } catch (IllegalArgumentException e) {
            throw new AnalysisException(e.getMessage(), e);
        }
        String proposed = json.path("proposed_filename").asText("").strip();
        String description = json.path("description").asText("").strip();
        List<String> tags = AiResponseParser.stringList(json.get("tags"));
        if (proposed.isEmpty() || description.isEmpty()) {
            throw new AnalysisException("模型回复缺少必需字段 proposed_filename / description");
        }

        log.debug("分析完成: {} -> {}", file.getFileName(), proposed);
        return FileAnalysis.builder()
                .filePath(file.getFilePath())
                .fileName(file.getFileName())
                .mimeType(file.getMimeType())
                .assignedModel(model.getName())
                .proposedFilename(sanitizeFilename(proposed, file.getFileName()))
                .description(description)
                .tags(tags)
                .build();
    }

    /**
     * 构建分析提示词
     */
    String buildPrompt(FileInfo file) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are analyzing a file for organization purposes. Please analyze this file and provide:\n\n")
                .append("1. A proposed new filename (descriptive, concise, keep extension)\n")
                .append("2. A description of the file's contents\n")
                .append("3. Relevant tags/keywords for categorization\n\n")
                .append("File Information:\n")
                .append("- Current filename: ").append(file.getFileName()).append('\n')
                .append("- MIME type: ").append(file.getMimeType()).append('\n')
                .append("- Category: ").append(file.getCategory()).append('\n')
                .append("- File size: ").append(file.getFileSize()).append(" bytes\n");

        if (file.getCategory() != null && file.getCategory().isTextual()) {
            String excerpt = readExcerpt(Path.of(file.getFilePath()));
            if (!excerpt.isEmpty()) {
                prompt.append("\nContent excerpt:\n---\n").append(excerpt).append("\n---\n");
            }
        }

        prompt.append("""

                Please respond in JSON format with the following structure:
                {
                  "proposed_filename": "descriptive-name-with-extension",
                  "description": "Description of what's in this file",
                  "tags": ["tag1", "tag2", "tag3"]
                }

                Important:
                - Keep the original file extension
                - Make the filename descriptive but concise (max 50 chars)
                - Description should be 2-3 sentences
                - Provide 3-7 relevant tags
                - Tags should be lowercase, single words or hyphenated phrases
                """);
        return prompt.toString();
    }

    private String readExcerpt(Path path) {
        int limit = properties.getAnalysis().getMaxContentChars();
        if (limit <= 0) {
            return "";
        }
        char[] buffer = new char[limit];
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            int read = reader.read(buffer, 0, limit);
            return read <= 0 ? "" : new String(buffer, 0, read);
        } catch (CharacterCodingException e) {
            log.debug("文件不是 UTF-8 文本, 不附带内容: {}", path);
            return "";
        } catch (IOException e) {
            throw new AnalysisException("读取文件内容失败: " + e.getMessage(), e);
        }
    }

    /**
     * 去掉路径分隔符, 并保证保留原扩展名
     */
    static String sanitizeFilename(String proposed, String originalName) {
        String name = proposed.replace('/', '-').replace('\\', '-').replace("..", ".").strip();
        if (name.length() > MAX_FILENAME_LENGTH) {
            name = name.substring(0, MAX_FILENAME_LENGTH);
        }
        String extension = FileTypeClassifier.getExtension(originalName);
        if (!extension.isEmpty() && !FileTypeClassifier.getExtension(name).equals(extension)) {
            name = name + "." + extension;
        }
        if (name.isEmpty() || name.startsWith(".")) {
            return originalName;
        }
        return name;
    }
}
