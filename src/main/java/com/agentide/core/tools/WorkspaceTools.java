package com.agentide.core.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * File-system tools available to workers, confined to a single working root.
 * <p>
 * Paths are always interpreted relative to the root; anything resolving outside it is rejected.
 * Every failure is reported as a {@link ToolExecutionException}.
 */
public class WorkspaceTools {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceTools.class);

    static final int MAX_READ_CHARS = 8000;
    static final int MAX_LISTED_FILES = 300;
    static final int MAX_SEARCH_RESULTS = 50;
    static final String DEFAULT_SEARCH_GLOB = "*.py";

    private final Path root;

    public WorkspaceTools(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /**
     * Resolves a relative path against the root, rejecting escapes. The deepest existing part of
     * the path is checked by its real location, so a symlink inside the root cannot point outside it.
     */
    public Path resolveSafe(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new ToolExecutionException("path must not be empty");
        }
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root) || !realPathInsideRoot(resolved)) {
            throw new ToolExecutionException("Access outside project root is not allowed: " + relativePath);
        }
        return resolved;
    }

    private boolean realPathInsideRoot(Path resolved) {
        Path existing = resolved;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null || !Files.exists(root)) {
            return true;
        }
        try {
            return existing.toRealPath().startsWith(root.toRealPath());
        } catch (IOException e) {
            throw new ToolExecutionException("cannot resolve " + root.relativize(resolved) + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the normalized id ({@code /}-separated, relative to the root) for a path argument.
     */
    public String artifactId(String relativePath) {
        return root.relativize(resolveSafe(relativePath)).toString().replace('\\', '/');
    }

    public boolean exists(String relativePath) {
        return Files.isRegularFile(resolveSafe(relativePath));
    }

    /**
     * Reads a text file. Content beyond {@value #MAX_READ_CHARS} characters is truncated with a marker.
     */
    public String readFile(String relativePath) {
        Path path = resolveSafe(relativePath);
        if (!Files.isRegularFile(path)) {
            throw new ToolExecutionException("file does not exist: " + relativePath);
        }
        String content = readString(path);
        if (content.length() > MAX_READ_CHARS) {
            return content.substring(0, MAX_READ_CHARS)
                    + "\n\n...[TRUNCATED, " + (content.length() - MAX_READ_CHARS) + " more chars]...";
        }
        return content;
    }

    /**
     * Reads a text file in full, for capturing artifact contents.
     */
    public String readFully(String relativePath) {
        return readString(resolveSafe(relativePath));
    }

    /**
     * Overwrites (or creates) a file, creating parent directories as needed.
     */
    public String writeFile(String relativePath, String content) {
        Path path = resolveSafe(relativePath);
        try {
            createParents(path);
            Files.writeString(path, content == null ? "" : content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolExecutionException("write_file failed for " + relativePath + ": " + e.getMessage(), e);
        }
        log.debug("Wrote {}", relativePath);
        return "File written: " + relativePath;
    }

    /**
     * Appends to a file, creating it and its parent directories if missing.
     */
    public String appendFile(String relativePath, String content) {
        Path path = resolveSafe(relativePath);
        try {
            createParents(path);
            Files.writeString(path, content == null ? "" : content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new ToolExecutionException("append_file failed for " + relativePath + ": " + e.getMessage(), e);
        }
        return "Appended to file: " + relativePath;
    }

    /**
     * Replaces the {@code occurrence}-th (1-based) occurrence of {@code originalSnippet}.
     */
    public String applyPatch(String relativePath, String originalSnippet, String newSnippet, int occurrence) {
        Path path = resolveSafe(relativePath);
        if (!Files.isRegularFile(path)) {
            throw new ToolExecutionException("file does not exist: " + relativePath);
        }
        if (originalSnippet == null || originalSnippet.isEmpty()) {
            throw new ToolExecutionException("original_snippet must not be empty");
        }
        String content = readString(path);
        int index = -1;
        int from = 0;
        for (int i = 0; i < Math.max(1, occurrence); i++) {
            index = content.indexOf(originalSnippet, from);
            if (index < 0) {
                throw new ToolExecutionException("original_snippet not found (occurrence " + occurrence
                        + ") in file: " + relativePath);
            }
            from = index + originalSnippet.length();
        }
        String patched = content.substring(0, index)
                + (newSnippet == null ? "" : newSnippet)
                + content.substring(index + originalSnippet.length());
        try {
            Files.writeString(path, patched, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolExecutionException("apply_patch failed for " + relativePath + ": " + e.getMessage(), e);
        }
        return "Patch applied to " + relativePath + " (replaced occurrence " + occurrence + ")";
    }

    public String applyPatch(String relativePath, String originalSnippet, String newSnippet) {
        return applyPatch(relativePath, originalSnippet, newSnippet, 1);
    }

    /**
     * Lists files below a directory, at most {@value #MAX_LISTED_FILES}.
     */
    public String listFiles(String relativeDir) {
        Path base = resolveSafe(relativeDir == null || relativeDir.isBlank() ? "." : relativeDir);
        if (!Files.isDirectory(base)) {
            throw new ToolExecutionException("directory does not exist: " + relativeDir);
        }
        List<String> paths;
        try (Stream<Path> walk = Files.walk(base)) {
            paths = walk.filter(Files::isRegularFile)
                    .map(p -> root.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .limit(MAX_LISTED_FILES)
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new ToolExecutionException("list_files failed for " + relativeDir + ": " + e.getMessage(), e);
        }
        if (paths.isEmpty()) {
            return "No files found under: " + relativeDir;
        }
        return String.join("\n", paths);
    }

    /**
     * Searches files whose name matches {@code fileGlob} for lines containing {@code query}.
     */
    public String searchText(String query, String fileGlob) {
        if (query == null || query.isEmpty()) {
            throw new ToolExecutionException("query must not be empty");
        }
        String glob = fileGlob == null || fileGlob.isBlank() ? DEFAULT_SEARCH_GLOB : fileGlob;
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        List<String> matches = new ArrayList<>();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new ToolExecutionException("search_text failed: " + e.getMessage(), e);
        }
        for (Path file : files) {
            List<String> lines;
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException | UncheckedIOException e) {
                log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                continue;
            }
            for (int i = 0; i < lines.size() && matches.size() < MAX_SEARCH_RESULTS; i++) {
                if (lines.get(i).contains(query)) {
                    matches.add(root.relativize(file).toString().replace('\\', '/')
                            + ":" + (i + 1) + ": " + lines.get(i).strip());
                }
            }
            if (matches.size() >= MAX_SEARCH_RESULTS) {
                break;
            }
        }
        if (matches.isEmpty()) {
            return "No matches found for '" + query + "' in files matching '" + glob + "'.";
        }
        return String.join("\n", matches);
    }

    private static String readString(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException | UncheckedIOException e) {
            throw new ToolExecutionException("read failed for " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static void createParents(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
