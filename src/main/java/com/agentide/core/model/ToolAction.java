package com.agentide.core.model;

import java.io.Serializable;

/**
 * A single tool invocation requested by a reasoning worker.
 *
 * @param tool            one of read_file, write_file, append_file, apply_patch, list_files, search_text
 * @param path            target path relative to the working root (directory or glob for list/search)
 * @param content         file content for write_file / append_file
 * @param originalSnippet text to replace for apply_patch
 * @param newSnippet      replacement text for apply_patch
 * @param query           search term for search_text
 */
public record ToolAction(
    String tool,
    String path,
    String content,
    String originalSnippet,
    String newSnippet,
    String query
) implements Serializable {

    public static ToolAction read(String path) {
        return new ToolAction("read_file", path, null, null, null, null);
    }

    public static ToolAction write(String path, String content) {
        return new ToolAction("write_file", path, content, null, null, null);
    }

    public static ToolAction append(String path, String content) {
        return new ToolAction("append_file", path, content, null, null, null);
    }

    public static ToolAction patch(String path, String originalSnippet, String newSnippet) {
        return new ToolAction("apply_patch", path, null, originalSnippet, newSnippet, null);
    }

    public static ToolAction list(String path) {
        return new ToolAction("list_files", path, null, null, null, null);
    }

    public static ToolAction search(String query, String pathGlob) {
        return new ToolAction("search_text", pathGlob, null, null, null, query);
    }
}
