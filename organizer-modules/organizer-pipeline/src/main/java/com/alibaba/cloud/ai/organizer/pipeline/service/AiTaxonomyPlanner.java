package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.config.OrganizerProperties;
import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileAnalysis;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileAssignment;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyNode;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyResult;
import com.alibaba.cloud.ai.organizer.pipeline.utils.AiResponseParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 基于 ChatClient 的分类规划
 * 一次调用得到分类树和文件分配; 回复无法解析时全部归入 Unsorted, 未被分配的文件同样归入 Unsorted
 *
 * @author RobustH
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiTaxonomyPlanner implements TaxonomyPlanner {

    public static final String UNSORTED = "Unsorted";

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final OrganizerProperties properties;

    @Override
    public TaxonomyResult plan(AnalysisResult analysis) {
        List<FileAnalysis> files = analysis.getAnalyses();
        if (files.isEmpty()) {
            log.info("没有成功分析的文件, 跳过分类规划");
            return emptyResult(analysis);
        }

        int limit = Math.min(files.size(), Math.max(1, properties.getAnalysis().getMaxTaxonomyFiles()));
        String reply = chatClient.prompt()
                .user(buildPrompt(files.subList(0, limit), files.size()))
                .call()
                .content();
        return assemble(analysis, reply);
    }

    /**
     * 把模型回复组装成分类结果
     */
    TaxonomyResult assemble(AnalysisResult analysis, String reply) {
        List<FileAnalysis> files = analysis.getAnalyses();
        Map<String, TaxonomyNode> nodes = new TreeMap<>();
        Map<Integer, FileAssignment> byIndex = new TreeMap<>();

        try {
            JsonNode json = AiResponseParser.parseObject(objectMapper, reply);
            for (JsonNode item : json.path("taxonomy")) {
                String path = normalizePath(item.path("path").asText(""));
                if (path.isEmpty()) {
                    continue;
                }
                TaxonomyNode node = ensureNode(nodes, path, item.path("description").asText(""));
                for (String child : AiResponseParser.stringList(item.get("subcategories"))) {
                    String childPath = normalizePath(child);
                    if (!childPath.isEmpty() && !node.getSubcategories().contains(childPath)) {
                        node.getSubcategories().add(childPath);
                    }
                }
            }
            for (JsonNode item : json.path("assignments")) {
                int index = item.path("file_index").asInt(-1);
                String target = normalizePath(item.path("target_path").asText(""));
                if (index < 1 || index > files.size() || target.isEmpty() || byIndex.containsKey(index)) {
                    continue;
                }
                FileAnalysis file = files.get(index - 1);
                byIndex.put(index, assignment(file, target, item.path("reasoning").asText("")));
            }
        } catch (IllegalArgumentException e) {
            log.warn("分类回复无法解析, 全部归入 {}: {}", UNSORTED, e.getMessage());
            nodes.clear();
            byIndex.clear();
        }

        List<FileAssignment> assignments = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            FileAssignment assigned = byIndex.get(i + 1);
            if (assigned == null) {
                assigned = assignment(files.get(i), UNSORTED, "未被分配");
            }
            assignments.add(assigned);
            TaxonomyNode target = ensureNode(nodes, assigned.getTargetPath(), "");
            target.setFileCount(target.getFileCount() + 1);
        }
        linkParents(nodes);

        log.info("分类规划完成: 节点={}, 分配={}", nodes.size(), assignments.size());
        return TaxonomyResult.builder()
                .sourceDirectory(analysis.getSourceDirectory())
                .nodes(new ArrayList<>(nodes.values()))
                .assignments(assignments)
                .failures(new ArrayList<>(analysis.getFailures()))
                .build();
    }

    String buildPrompt(List<FileAnalysis> files, int totalFiles) {
        StringBuilder prompt = new StringBuilder("""
                You are an expert at creating taxonomic organizational systems for files.

                Analyze the provided files and create a hierarchical directory structure that organizes them.

                Guidelines:
                1. Create a multi-level hierarchy where it helps
                2. Use clear, descriptive category names
                3. Group related items together
                4. Broader categories contain narrower ones

                """);
        prompt.append("Files to Organize (").append(totalFiles).append(" files):\n\n");
        for (int i = 0; i < files.size(); i++) {
            FileAnalysis file = files.get(i);
            prompt.append(i + 1).append(". File: ").append(file.getProposedFilename()).append('\n')
                    .append("   MIME: ").append(file.getMimeType()).append('\n')
                    .append("   Description: ").append(file.getDescription()).append('\n')
                    .append("   Tags: ").append(String.join(", ", file.getTags())).append("\n\n");
        }
        if (totalFiles > files.size()) {
            prompt.append("... and ").append(totalFiles - files.size()).append(" more files\n\n");
        }
        prompt.append("""
                Respond with a JSON object containing:
                1. "taxonomy": array of {"path", "category", "description", "subcategories"}
                2. "assignments": array of {"file_index" (1-based from the list above), "target_path", "reasoning"}

                Each listed file must be assigned to exactly one category path from "taxonomy".
                """);
        return prompt.toString();
    }

    private TaxonomyResult emptyResult(AnalysisResult analysis) {
        return TaxonomyResult.builder()
                .sourceDirectory(analysis.getSourceDirectory())
                .failures(new ArrayList<>(analysis.getFailures()))
                .build();
    }

    private static FileAssignment assignment(FileAnalysis file, String target, String reasoning) {
        return FileAssignment.builder()
                .filePath(file.getFilePath())
                .targetPath(target)
                .proposedFilename(file.getProposedFilename())
                .reasoning(reasoning)
                .build();
    }

    private static TaxonomyNode ensureNode(Map<String, TaxonomyNode> nodes, String path, String description) {
        TaxonomyNode node = nodes.get(path);
        if (node == null) {
            int slash = path.lastIndexOf('/');
            node = TaxonomyNode.builder()
                    .path(path)
                    .category(slash < 0 ? path : path.substring(slash + 1))
                    .description(description)
                    .build();
            nodes.put(path, node);
        } else if ((node.getDescription() == null || node.getDescription().isEmpty()) && !description.isEmpty()) {
            node.setDescription(description);
        }
        return node;
    }

    /**
     * 补齐缺失的父节点并登记子节点
     */
    private static void linkParents(Map<String, TaxonomyNode> nodes) {
        for (String path : new ArrayList<>(nodes.keySet())) {
            String child = path;
            int slash;
            while ((slash = child.lastIndexOf('/')) > 0) {
                String parent = child.substring(0, slash);
                TaxonomyNode parentNode = ensureNode(nodes, parent, "");
                if (!parentNode.getSubcategories().contains(child)) {
                    parentNode.getSubcategories().add(child);
                }
                child = parent;
            }
        }
        for (TaxonomyNode node : nodes.values()) {
            node.getSubcategories().sort(null);
        }
    }

    /**
     * 去掉首尾斜杠、空段和 ..
     */
    static String normalizePath(String path) {
        StringBuilder normalized = new StringBuilder();
        for (String segment : path.replace('\\', '/').split("/")) {
            String part = segment.strip();
            if (part.isEmpty() || part.equals(".") || part.equals("..")) {
                continue;
            }
            if (normalized.length() > 0) {
                normalized.append('/');
            }
            normalized.append(part);
        }
        return normalized.toString();
    }
}
