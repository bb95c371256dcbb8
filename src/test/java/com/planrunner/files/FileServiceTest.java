package com.planrunner.files;

import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.exception.ToolExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FileServiceTest {

    private FileService fileService;
    private PlanRunnerProperties properties;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        properties = mock(PlanRunnerProperties.class);
        when(properties.getWorkspaceRoot()).thenReturn(tempDir.toString());
        fileService = new FileService(properties);
    }

    @Test
    void testList() throws IOException {
        Files.createFile(tempDir.resolve("test.txt"));
        Files.createDirectory(tempDir.resolve("testdir"));

        FileListing listing = fileService.list("");
        assertEquals(2, listing.entries().size());
        assertTrue(listing.entries().get(0).directory());
        assertEquals("test.txt", listing.entries().get(1).name());
    }

    @Test
    void testRead() throws IOException {
        Files.writeString(tempDir.resolve("test.txt"), "Hello World");

        FileContent content = fileService.read("test.txt");
        assertEquals("Hello World", content.content());
        assertEquals("test.txt", content.path());
        assertFalse(content.truncated());
    }

    @Test
    void testReadTruncatesLargeFiles() throws IOException {
        Files.writeString(tempDir.resolve("big.txt"), "x".repeat(FileService.MAX_READ_CHARS + 10));

        FileContent content = fileService.read("big.txt");
        assertTrue(content.truncated());
        assertEquals(FileService.MAX_READ_CHARS, content.content().length());
    }

    @Test
    void testReadNotFound() {
        assertThrows(ToolExecutionException.class, () -> fileService.read("nonexistent.txt"));
    }

    @Test
    void testReadOutsideWorkspace() {
        ToolExecutionException ex = assertThrows(ToolExecutionException.class, () -> fileService.read("../secret.txt"));
        assertTrue(ex.getMessage().contains("outside workspace"));
    }

    @Test
    void testTreeSkipsHiddenAndBuildOutput() throws IOException {
        Files.createDirectories(tempDir.resolve("src/main"));
        Files.createFile(tempDir.resolve("src/main/App.java"));
        Files.createDirectories(tempDir.resolve("target/classes"));
        Files.createDirectories(tempDir.resolve(".git"));
        Files.createFile(tempDir.resolve("pom.xml"));

        List<String> tree = fileService.tree("", 3, 100);

        assertEquals(List.of("├─ src/", "  ├─ main/", "    ├─ App.java", "├─ pom.xml"), tree);
    }

    @Test
    void testTreeStopsAtEntryLimit() throws IOException {
        for (int i = 0; i < 5; i++) {
            Files.createFile(tempDir.resolve("file" + i + ".txt"));
        }

        List<String> tree = fileService.tree("", 1, 3);

        assertEquals(4, tree.size());
        assertEquals("... (truncated)", tree.get(3));
    }
}
