package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.config.OrganizerProperties;
import com.alibaba.cloud.ai.organizer.pipeline.model.ExcludedFile;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileCategory;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileInfo;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanResult;
import com.alibaba.cloud.ai.organizer.pipeline.utils.FileScanner;
import com.alibaba.cloud.ai.organizer.pipeline.utils.FileTypeClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScanServiceTest {

    @TempDir
    Path source;

    private OrganizerProperties properties;
    private ScanService scanService;

    @BeforeEach
    void setUp() {
        properties = new OrganizerProperties();
        scanService = new ScanService(new FileScanner(), new FileTypeClassifier(), properties);
    }

    @Test
    void collectsMetadataSortedByPath() throws Exception {
        write("b/photo.png", "png");
        write("a.md", "# title");

        ScanResult result = scanService.scan(new ScanRequest(source));

        assertThat(result.getSourceDirectory()).isEqualTo(source.toAbsolutePath().normalize().toString());
        assertThat(result.getTotalFiles()).isEqualTo(2);
        assertThat(result.getFiles()).extracting(FileInfo::getFileName).containsExactly("a.md", "photo.png");
        FileInfo markdown = result.getFiles().get(0);
        assertThat(markdown.getMimeType()).isEqualTo("text/markdown");
        assertThat(markdown.getCategory()).isEqualTo(FileCategory.DOCUMENT);
        assertThat(markdown.getFileSize()).isEqualTo(7);
        assertThat(markdown.getFilePath()).isEqualTo(source.resolve("a.md").toString());
        assertThat(result.getUniqueMimeTypes()).containsExactly("image/png", "text/markdown");
    }

    @Test
    void recordsExclusionsWithRule() throws Exception {
        properties.getScan().getExcludePatterns().add("*.tmp");
        write(".env", "SECRET=1");
        write("scratch.tmp", "x");
        write("keep.txt", "keep");

        ScanResult result = scanService.scan(new ScanRequest(source));

        assertThat(result.getFiles()).extracting(FileInfo::getFileName).containsExactly("keep.txt");
        assertThat(result.getExcludedFiles()).extracting(ExcludedFile::getRule)
                .containsExactlyInAnyOrder("hidden_file", "exclude:*.tmp");
    }

    @Test
    void includePatternsRestrictFiles() throws Exception {
        properties.getScan().getIncludePatterns().add("**/*.jpg");
        write("pics/cat.jpg", "jpg");
        write("notes.txt", "txt");

        ScanResult result = scanService.scan(new ScanRequest(source));

        assertThat(result.getFiles()).extracting(FileInfo::getFileName).containsExactly("cat.jpg");
        assertThat(result.getExcludedFiles()).extracting(ExcludedFile::getRule).containsExactly("include");
    }

    @Test
    void sizeLimitExcludesLargeFiles() throws Exception {
        properties.getScan().setMaxFileSizeMb(1);
        Files.write(source.resolve("big.bin"), new byte[2 * 1024 * 1024]);
        write("small.txt", "small");

        ScanResult result = scanService.scan(new ScanRequest(source));

        assertThat(result.getFiles()).extracting(FileInfo::getFileName).containsExactly("small.txt");
        assertThat(result.getExcludedFiles()).extracting(ExcludedFile::getRule).containsExactly("size_limit");
    }

    @Test
    void skippedDirectoriesAreNotScanned() throws Exception {
        write("organized/Docs/old.txt", "old");
        write("new.txt", "new");

        ScanResult result = scanService.scan(new ScanRequest(source, List.of(source.resolve("organized"))));

        assertThat(result.getFiles()).extracting(FileInfo::getFileName).containsExactly("new.txt");
    }

    @Test
    void enumerateMatchesScannedCandidates() throws Exception {
        write("a.txt", "a");
        write("b.txt", "b");

        assertThat(scanService.enumerate(new ScanRequest(source)))
                .containsExactly(source.resolve("a.txt"), source.resolve("b.txt"));
    }

    @Test
    void emptyDirectoryGivesEmptyResult() {
        ScanResult result = scanService.scan(new ScanRequest(source));

        assertThat(result.getFiles()).isEmpty();
        assertThat(result.getUniqueMimeTypes()).isEmpty();
    }

    private void write(String relative, String content) throws Exception {
        Path file = source.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
