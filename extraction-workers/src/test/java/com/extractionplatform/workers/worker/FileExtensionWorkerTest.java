package com.extractionplatform.workers.worker;

import com.extractionplatform.common.model.CertaintyClass;
import com.extractionplatform.common.model.Finding;
import com.extractionplatform.common.model.SectionName;
import com.extractionplatform.common.worker.WorkerStatus;
import com.extractionplatform.workers.WorkerHarness;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class FileExtensionWorkerTest {

    private final FileExtensionWorker worker = new FileExtensionWorker();

    @TempDir
    Path corpus;

    private void touch(String relative) throws IOException {
        Path file = corpus.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "// " + relative);
    }

    private List<Finding> languages(WorkerHarness harness) {
        return harness.snapshot().findings().stream()
            .filter(f -> f.key().equals("primary_language"))
            .toList();
    }

    @Test
    @DisplayName("dominant extension becomes an inferred language claim citing three samples")
    void dominantLanguage() throws IOException {
        for (int i = 0; i < 5; i++) touch("src/main/java/App" + i + ".java");

        WorkerHarness harness = new WorkerHarness().run(worker, corpus);
        List<Finding> languages = languages(harness);

        assertEquals(1, languages.size());
        Finding java = languages.get(0);
        assertEquals("Java", java.value());
        assertEquals(3, java.evidenceCount());
        assertEquals(CertaintyClass.INFERRED, java.certaintyClass());
        assertTrue(java.evidence().stream().allMatch(e -> e.sourceKind().equals("file_ext")));
    }

    @Test
    @DisplayName("languages under the minimum share are ignored")
    void minorLanguageIgnored() throws IOException {
        for (int i = 0; i < 12; i++) touch("src/app" + i + ".ts");
        touch("scripts/build.py");

        List<Finding> languages = languages(new WorkerHarness().run(worker, corpus));
        assertEquals(List.of("TypeScript"), languages.stream().map(Finding::value).toList());
    }

    @Test
    @DisplayName("build output and dependency directories are skipped")
    void skipsVendoredDirectories() throws IOException {
        touch("index.go");
        for (int i = 0; i < 20; i++) touch("node_modules/lib/mod" + i + ".js");

        List<Finding> languages = languages(new WorkerHarness().run(worker, corpus));
        assertEquals(List.of("Go"), languages.stream().map(Finding::value).toList());
    }

    @Test
    @DisplayName("standard layout directories are reported as a convention")
    void layoutConvention() throws IOException {
        touch("src/main/java/App.java");

        List<Finding> conventions = new WorkerHarness().run(worker, corpus).snapshot().findingsIn(SectionName.CONVENTIONS);
        assertEquals(1, conventions.size());
        assertEquals("maven-standard", conventions.get(0).value());
        assertEquals("directory_layout", conventions.get(0).evidence().get(0).sourceKind());
    }

    @Test
    @DisplayName("extension parsing is case-insensitive and tolerates dotless names")
    void extension() {
        assertEquals("java", FileExtensionWorker.extension(Path.of("A.JAVA")));
        assertEquals("", FileExtensionWorker.extension(Path.of("Makefile")));
    }

    @Test
    @DisplayName("extension lookup ignores the default locale")
    void extensionUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("ini", FileExtensionWorker.extension(Path.of("SETTINGS.INI")));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("an unreadable corpus ends in an error outcome")
    void missingCorpus() {
        WorkerHarness harness = new WorkerHarness().run(new FileExtensionWorker(), corpus.resolve("gone"));

        assertEquals(WorkerStatus.ERROR, harness.lastOutcome().status());
        assertNotNull(harness.lastOutcome().errorDetail());
        assertEquals(0, harness.snapshot().size());
    }
}
