package com.planrunner.files;

import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.exception.ToolExecutionException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Read-only access to the workspace the project tools operate on. Paths never escape the workspace root.
 */
@Service
public class FileService {

    private static final Set<String> IGNORED_NAMES = Set.of("node_modules", "target", "bin", "build");
    static final int MAX_READ_CHARS = 60_000;

    private final Path workspaceRoot;

    public FileService(PlanRunnerProperties properties) {
        String configuredRoot = properties.getWorkspaceRoot();
        String rootValue = StringUtils.hasText(configuredRoot)
                ? configuredRoot
                : System.getProperty("user.dir");
        this.workspaceRoot = Paths.get(rootValue).toAbsolutePath().normalize();
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public FileListing list(String path) {
        Path directory = resolvePath(path);
        if (!Files.exists(directory)) {
            throw new ToolExecutionException("Directory not found: " + displayPath(path));
        }
        if (!Files.isDirectory(directory)) {
            throw new ToolExecutionException("Path is not a directory: " + displayPath(path));
        }
        try (Stream<Path> stream = Files.list(directory)) {
            List<FileEntry> entries = stream
                    .sorted(directoriesFirst())
                    .map(this::toEntry)
                    .toList();
            return new FileListing(toRelative(directory), entries);
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to list directory: " + displayPath(path), ex);
        }
    }

    public FileContent read(String path) {
        if (!StringUtils.hasText(path)) {
            throw new ToolExecutionException("File path is required.");
        }
        Path file = resolvePath(path);
        if (!Files.exists(file)) {
            throw new ToolExecutionException("File not found: " + path);
        }
        if (!Files.isRegularFile(file)) {
            throw new ToolExecutionException("Path is not a file: " + path);
        }
        try {
            String content = Files.readString(file);
            boolean truncated = content.length() > MAX_READ_CHARS;
            return new FileContent(toRelative(file), truncated ? content.substring(0, MAX_READ_CHARS) : content, truncated);
        } catch (MalformedInputException ex) {
            throw new ToolExecutionException("File is not UTF-8 text: " + path, ex);
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to read file: " + path, ex);
        }
    }

    /**
     * Indented directory tree below {@code path}, directories first, hidden and build output skipped.
     */
    public List<String> tree(String path, int maxDepth, int maxEntries) {
        Path start = resolvePath(path);
        if (!Files.isDirectory(start)) {
            throw new ToolExecutionException("Path is not a directory: " + displayPath(path));
        }
        List<String> lines = new ArrayList<>();
        try {
            collectTree(start, 0, maxDepth, maxEntries, lines);
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to walk directory: " + displayPath(path), ex);
        }
        return lines;
    }

    private void collectTree(Path current, int depth, int maxDepth, int maxEntries, List<String> lines) throws IOException {
        if (depth > maxDepth) {
            return;
        }
        List<Path> children;
        try (Stream<Path> stream = Files.list(current)) {
            children = stream.filter(p -> !isIgnored(p)).sorted(directoriesFirst()).toList();
        }
        String indent = "  ".repeat(depth);
        for (Path child : children) {
            if (lines.size() >= maxEntries) {
                lines.add(indent + "... (truncated)");
                return;
            }
            String name = child.getFileName().toString();
            if (Files.isDirectory(child)) {
                lines.add(indent + "├─ " + name + "/");
                collectTree(child, depth + 1, maxDepth, maxEntries, lines);
            } else {
                lines.add(indent + "├─ " + name);
            }
        }
    }

    private Path resolvePath(String path) {
        if (!StringUtils.hasText(path)) {
            return workspaceRoot;
        }
        Path target = workspaceRoot.resolve(path.trim()).normalize();
        if (!target.startsWith(workspaceRoot)) {
            throw new ToolExecutionException("Invalid path outside workspace: " + path);
        }
        return target;
    }

    private Comparator<Path> directoriesFirst() {
        return Comparator.comparing((Path p) -> !Files.isDirectory(p))
                .thenComparing(p -> p.getFileName().toString().toLowerCase());
    }

    private boolean isIgnored(Path path) {
        String name = path.getFileName().toString();
        return name.startsWith(".") || IGNORED_NAMES.contains(name);
    }

    private FileEntry toEntry(Path path) {
        try {
            return new FileEntry(
                    path.getFileName().toString(),
                    toRelative(path),
                    Files.isDirectory(path),
                    Files.isDirectory(path) ? 0L : Files.size(path),
                    Instant.ofEpochMilli(Files.getLastModifiedTime(path).toMillis())
            );
        } catch (IOException ex) {
            return new FileEntry(path.getFileName().toString(), toRelative(path), Files.isDirectory(path), 0L, Instant.EPOCH);
        }
    }

    private String displayPath(String path) {
        return StringUtils.hasText(path) ? path : "/";
    }

    private String toRelative(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (normalized.equals(workspaceRoot)) {
            return "";
        }
        return workspaceRoot.relativize(normalized).toString().replace("\\", "/");
    }
}
